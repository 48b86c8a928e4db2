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
package org.kadro.loader;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import org.kadro.data.ColumnType;

/**
 * Contains information about each column for the loader.
 * 
 * <p>
 * This contains both, a specific {@link ColumnType} for each column and custom transformation functions. A
 * transformation function could e.g. be used for a 'date' column: The function parses the date and returns a Long,
 * with the column actually being a LONG column.
 * 
 * <p>
 * Empty input values are always loaded as missing values, the transformation functions do not see them.
 *
 * @author Bastian Gloeckle
 */
public class LoaderColumnInfo {
  private static final Function<String, Object> STRING_FN = s -> s;
  private static final Function<String, Object> LONG_FN = LoaderColumnInfo::parseLong;
  private static final Function<String, Object> DOUBLE_FN = LoaderColumnInfo::parseDouble;
  private static final Function<String, Object> BOOLEAN_FN = LoaderColumnInfo::parseBoolean;

  private Map<String, ColumnType> columnType = new HashMap<>();
  private Map<String, Function<String, Object>> customTransformationFunction = new HashMap<>();
  private ColumnType defaultColumnType;

  /**
   * @param defaultColumnType
   *          The column type that will be assumed for columns that have not been registered explicitly.
   */
  public LoaderColumnInfo(ColumnType defaultColumnType) {
    this.defaultColumnType = defaultColumnType;
  }

  /**
   * Register a specific column type for a column without specifying a custom transformation function.
   */
  public LoaderColumnInfo registerColumnType(String colName, ColumnType columnType) {
    this.columnType.put(colName, columnType);
    return this;
  }

  /**
   * Register a specific column type and a specific transformation function for a column.
   * 
   * @param transformFunc
   *          Transforms a single, non-empty input value. The result must be a value of the given {@link ColumnType}
   *          or <code>null</code>. A function that cannot parse its input should throw an
   *          {@link IllegalArgumentException}.
   */
  public LoaderColumnInfo registerCustomTransformationFunc(String colName, ColumnType columnType,
      Function<String, Object> transformFunc) {
    this.columnType.put(colName, columnType);
    this.customTransformationFunction.put(colName, transformFunc);
    return this;
  }

  /**
   * @return The registered {@link ColumnType} for the given column or <code>null</code> if column not yet known.
   */
  public ColumnType getRegisteredColumnType(String colName) {
    return columnType.get(colName);
  }

  /**
   * @return <code>true</code> if the default column type is used for the given column.
   */
  public boolean isDefaultDataType(String colName) {
    return !columnType.containsKey(colName);
  }

  /**
   * @return The {@link ColumnType} that the loader should assume for the values of this column.
   */
  public ColumnType getFinalColumnType(String column) {
    ColumnType res = columnType.get(column);
    if (res == null)
      return defaultColumnType;
    return res;
  }

  /**
   * @return The function transforming a single input string of the given column into a value of the columns
   *         {@link ColumnType}, either a registered custom function or a default parser.
   */
  public Function<String, Object> getFinalTransformFunc(String column) {
    Function<String, Object> res = customTransformationFunction.get(column);
    if (res != null)
      return res;
    switch (getFinalColumnType(column)) {
    case LONG:
      return LONG_FN;
    case DOUBLE:
      return DOUBLE_FN;
    case BOOLEAN:
      return BOOLEAN_FN;
    default:
      return STRING_FN;
    }
  }

  public static Long parseLong(String s) throws NumberFormatException {
    return Long.parseLong(s.trim());
  }

  public static Double parseDouble(String s) throws NumberFormatException {
    return Double.parseDouble(s.trim());
  }

  public static Boolean parseBoolean(String s) throws IllegalArgumentException {
    String trimmed = s.trim();
    if ("true".equalsIgnoreCase(trimmed))
      return true;
    if ("false".equalsIgnoreCase(trimmed))
      return false;
    throw new IllegalArgumentException("Not a boolean: '" + s + "'");
  }
}
