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
package org.kadro.execution;

import java.util.Arrays;

import org.kadro.data.Table;

/**
 * The rows of a table that share the same {@link GroupKey}.
 * 
 * <p>
 * The row positions are in ascending order.
 *
 * @author Bastian Gloeckle
 */
public class Partition {
  private final GroupKey key;
  private final int[] rows;
  private final boolean wholeTable;

  /* package */ Partition(GroupKey key, int[] rows, boolean wholeTable) {
    this.key = key;
    this.rows = rows;
    this.wholeTable = wholeTable;
  }

  public GroupKey getKey() {
    return key;
  }

  /**
   * @return Number of rows in this partition.
   */
  public int size() {
    return rows.length;
  }

  /**
   * @return Position of the idx'th row of this partition in the partitioned table.
   */
  public int getRow(int idx) {
    return rows[idx];
  }

  /**
   * @return Copy of the positions of all rows of this partition in the partitioned table.
   */
  public int[] getRows() {
    return rows.clone();
  }

  /**
   * @return The rows of this partition taken from the given table. If the partition covers the whole table, the table
   *         itself is returned.
   */
  public Table selectFrom(Table table) {
    if (wholeTable)
      return table;
    return table.selectRows(rows);
  }

  @Override
  public String toString() {
    return "Partition[key=" + key + ",rows=" + Arrays.toString(rows) + "]";
  }
}
