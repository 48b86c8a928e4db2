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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Base class of all exceptions thrown when a transformation of a table cannot be executed.
 * 
 * <p>
 * Each exception names the columns that caused the failure, if there are any.
 *
 * @author Bastian Gloeckle
 */
public class KadroException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<String> columnNames;

  public KadroException(String msg, Collection<String> columnNames, Throwable cause) {
    super(msg, cause);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  public KadroException(String msg, Collection<String> columnNames) {
    super(msg);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  public KadroException(String msg, String... columnNames) {
    this(msg, Arrays.asList(columnNames));
  }

  /**
   * @return The names of the columns that are the reason for this exception. Might be empty.
   */
  public List<String> getColumnNames() {
    return columnNames;
  }
}
