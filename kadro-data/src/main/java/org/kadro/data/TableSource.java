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

import java.util.List;

/**
 * A source of tabular data from which a {@link Table} can be created, see
 * {@link TableFactory#createTable(TableSource)}.
 * 
 * <p>
 * How the data is read or parsed is up to the implementation.
 *
 * @author Bastian Gloeckle
 */
public interface TableSource {
  /**
   * @return Names of all columns, in column order.
   */
  public List<String> getColumnNames();

  /**
   * @return Type of the values of the given column.
   */
  public ColumnType getColumnType(String columnName);

  /**
   * @return The values of the given column, in row order. Missing values are <code>null</code>.
   */
  public List<?> getValues(String columnName);

  /**
   * @return Number of rows; each column has exactly this number of values.
   */
  public int getRowCount();
}
