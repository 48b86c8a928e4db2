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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.data.exception.UnknownColumnException;
import org.kadro.util.ValueOrdering;

/**
 * Sorts the rows of a table by the values of some columns.
 * 
 * <p>
 * The sort is stable. <code>NaN</code> and missing values are sorted last, regardless of the sort direction.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class RowSorter {
  /**
   * @param columnNames
   *          Columns to sort by, most significant first.
   * @param ascending
   *          Sort direction per column.
   * @throws UnknownColumnException
   *           if a column does not exist.
   * @throws IllegalArgumentException
   *           if the number of directions does not match the number of columns.
   */
  public Table sort(Table table, List<String> columnNames, List<Boolean> ascending)
      throws UnknownColumnException, IllegalArgumentException {
    if (columnNames.size() != ascending.size())
      throw new IllegalArgumentException(
          "Expected " + columnNames.size() + " sort directions, but " + ascending.size() + " were provided.");

    List<Column> columns = new ArrayList<>();
    for (String columnName : columnNames)
      columns.add(table.getColumn(columnName));

    if (columns.isEmpty())
      return table;

    List<List<Object>> sortValues = new ArrayList<>(table.getRowCount());
    for (int row = 0; row < table.getRowCount(); row++) {
      List<Object> values = new ArrayList<>(columns.size());
      for (Column column : columns)
        values.add(column.get(row));
      sortValues.add(values);
    }

    Integer[] order = new Integer[table.getRowCount()];
    for (int i = 0; i < order.length; i++)
      order[i] = i;
    // Arrays.sort on objects is stable.
    Arrays.sort(order, (a, b) -> ValueOrdering.compareTuples(sortValues.get(a), sortValues.get(b), ascending));

    int[] rows = new int[order.length];
    for (int i = 0; i < rows.length; i++)
      rows[i] = order[i];
    return table.selectRows(rows);
  }
}
