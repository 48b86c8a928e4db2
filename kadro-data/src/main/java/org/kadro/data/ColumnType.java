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

import org.kadro.data.exception.ColumnTypeException;

/**
 * Type of a column.
 * 
 * <p>
 * All non-missing values of a {@link Column} are of the Java class of the column type. A missing value is represented
 * by <code>null</code> in all types.
 *
 * @author Bastian Gloeckle
 */
public enum ColumnType {
  LONG(Long.class), DOUBLE(Double.class), STRING(String.class), BOOLEAN(Boolean.class);

  private final Class<?> valueClass;

  private ColumnType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  public Class<?> getValueClass() {
    return valueClass;
  }

  public boolean isNumeric() {
    return this == LONG || this == DOUBLE;
  }

  /**
   * @return The {@link ColumnType} a single value would have, <code>null</code> if the value is <code>null</code>.
   * @throws ColumnTypeException
   *           if the class of the value is not supported.
   */
  public static ColumnType forValue(Object value) throws ColumnTypeException {
    if (value == null)
      return null;
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
      return LONG;
    if (value instanceof Double || value instanceof Float)
      return DOUBLE;
    if (value instanceof String)
      return STRING;
    if (value instanceof Boolean)
      return BOOLEAN;
    throw new ColumnTypeException("Values of type " + value.getClass().getName() + " cannot be held in a column.");
  }

  /**
   * Identify the type of a column that should hold the given values.
   * 
   * <p>
   * A mix of integral and floating point values results in {@link #DOUBLE}. If all values are missing, the result is
   * {@link #STRING}.
   * 
   * @throws ColumnTypeException
   *           if the values have different types.
   */
  public static ColumnType infer(List<?> values) throws ColumnTypeException {
    ColumnType res = null;
    for (Object value : values) {
      ColumnType valueType = forValue(value);
      if (valueType == null || valueType == res)
        continue;
      if (res == null)
        res = valueType;
      else if (res.isNumeric() && valueType.isNumeric())
        res = DOUBLE;
      else
        throw new ColumnTypeException("Values of types " + res + " and " + valueType + " cannot be mixed in a column.");
    }
    return (res == null) ? STRING : res;
  }

  /**
   * Widen two column types to a type that can hold the values of both.
   * 
   * @throws ColumnTypeException
   *           if there is no such type.
   */
  public static ColumnType common(ColumnType a, ColumnType b) throws ColumnTypeException {
    if (a == b)
      return a;
    if (a.isNumeric() && b.isNumeric())
      return DOUBLE;
    throw new ColumnTypeException("Column types " + a + " and " + b + " are incompatible.");
  }

  /**
   * Convert a value to the representation used in columns of this type.
   * 
   * @throws ColumnTypeException
   *           if the value cannot be represented in this type.
   */
  /* package */ Object normalize(Object value) throws ColumnTypeException {
    if (value == null)
      return null;
    ColumnType valueType = forValue(value);
    if (this == LONG && valueType == LONG)
      return ((Number) value).longValue();
    if (this == DOUBLE && valueType.isNumeric())
      return ((Number) value).doubleValue();
    if (valueType == this)
      return value;
    throw new ColumnTypeException("Value '" + value + "' of type " + valueType + " cannot be held in a column of type "
        + this + ".");
  }
}
