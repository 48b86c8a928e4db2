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
package org.kadro.data;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Strings;

/**
 * Renders the first rows of a {@link Table} as text grid.
 *
 * @author Bastian Gloeckle
 */
public class TableFormatter {
  public static final int DEFAULT_ROWS = 10;

  /** Rendering of missing values. */
  public static final String MISSING = "NA";

  private TableFormatter() {
  }

  /**
   * @param maxRows
   *          Maximum number of rows to render. If the table has more rows, a note is added to the output.
   * @return The rendered table, lines separated by '\n'.
   */
  public static String format(Table table, int maxRows) {
    int rows = Math.min(maxRows, table.getRowCount());
    List<String> columnNames = table.getColumnNames();

    // first "column" holds the row numbers.
    List<String[]> cells = new ArrayList<>();
    String[] rowNumbers = new String[rows + 1];
    rowNumbers[0] = "";
    for (int row = 0; row < rows; row++)
      rowNumbers[row + 1] = Integer.toString(row);
    cells.add(rowNumbers);

    for (String columnName : columnNames) {
      Column column = table.getColumn(columnName);
      String[] columnCells = new String[rows + 1];
      columnCells[0] = columnName;
      for (int row = 0; row < rows; row++) {
        Object value = column.get(row);
        columnCells[row + 1] = (value == null) ? MISSING : value.toString();
      }
      cells.add(columnCells);
    }

    int[] widths = new int[cells.size()];
    for (int i = 0; i < cells.size(); i++)
      for (String cell : cells.get(i))
        widths[i] = Math.max(widths[i], cell.length());

    StringBuilder sb = new StringBuilder();
    for (int line = 0; line < rows + 1; line++) {
      for (int i = 0; i < cells.size(); i++) {
        if (i > 0)
          sb.append("  ");
        sb.append(Strings.padStart(cells.get(i)[line], widths[i], ' '));
      }
      sb.append('\n');
    }

    if (table.getRowCount() > rows)
      sb.append(" only showing top ").append(rows).append(" of ").append(table.getRowCount()).append(" rows.\n");
    else
      sb.append("[").append(table.getRowCount()).append(" rows x ").append(columnNames.size()).append(" columns]\n");
    return sb.toString();
  }
}
