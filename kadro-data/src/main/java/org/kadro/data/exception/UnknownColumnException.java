/**
 * kadro: Fluent grouped transformations over in-memory tables.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of kadro.
 *
 * kadro is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.kadro.data.exception;

import java.util.Collection;

/**
 * A column that was referenced does not exist in the table.
 *
 * @author Bastian Gloeckle
 */
public class UnknownColumnException extends KadroException {
  private static final long serialVersionUID = 1L;

  public UnknownColumnException(String msg, Collection<String> columnNames) {
    super(msg, columnNames);
  }

  public UnknownColumnException(String msg, String... columnNames) {
    super(msg, columnNames);
  }
}
