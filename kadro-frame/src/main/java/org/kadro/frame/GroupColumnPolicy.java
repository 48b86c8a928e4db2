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
package org.kadro.frame;

/**
 * Defines how {@link Frame#select(String...)} and {@link Frame#drop(String...)} treat the columns a frame is grouped
 * by.
 *
 * @author Bastian Gloeckle
 */
public enum GroupColumnPolicy {
  /**
   * Grouping columns are kept: <code>select</code> adds grouping columns that were not selected in front of the
   * selected ones, <code>drop</code> ignores grouping columns.
   */
  RETAIN,

  /**
   * Removing a grouping column fails with an {@link org.kadro.execution.exception.InvalidGroupColumnException}.
   */
  REJECT
}
