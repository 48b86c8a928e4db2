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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import org.kadro.data.exception.ColumnTypeException;

/**
 * An immutable sequence of values of a single {@link ColumnType}.
 * 
 * <p>
 * Missing values are represented by <code>null</code>. A {@link Column} does not know its name, it is identified by
 * the name it has in a {@link Table}. As columns are immutable, the same instance is shared between all tables that
 * contain the same data.
 *
 * @author Bastian Gloeckle
 */
public class Column {
  private final ColumnType type;
  private final Object[] values;

  /**
   * Values must already be normalized to the given type, the array must not be changed afterwards.
   */
  /* package */ Column(ColumnType type, Object[] values) {
    this.type = type;
    this.values = values;
  }

  /**
   * Create a new column of a specific type.
   * 
   * <p>
   * Integral values are accepted for {@link ColumnType#DOUBLE} columns, too.
   * 
   * @throws ColumnTypeException
   *           if any value cannot be held in a column of the given type.
   */
  public static Column of(ColumnType type, List<?> values) throws ColumnTypeException {
    Object[] normalized = new Object[values.size()];
    int i = 0;
    for (Object value : values)
      normalized[i++] = type.normalize(value);
    return new Column(type, normalized);
  }

  /**
   * Create a new column whose type is inferred from the values, see {@link ColumnType#infer(List)}.
   * 
   * @throws ColumnTypeException
   *           if the values have incompatible types.
   */
  public static Column fromValues(List<?> values) throws ColumnTypeException {
    return of(ColumnType.infer(values), values);
  }

  public static Column ofLongs(Long... values) {
    return of(ColumnType.LONG, Arrays.asList(values));
  }

  public static Column ofDoubles(Double... values) {
    return of(ColumnType.DOUBLE, Arrays.asList(values));
  }

  public static Column ofStrings(String... values) {
    return of(ColumnType.STRING, Arrays.asList(values));
  }

  public static Column ofBooleans(Boolean... values) {
    return of(ColumnType.BOOLEAN, Arrays.asList(values));
  }

  /**
   * @return A column of the given type and length containing only missing values.
   */
  public static Column missing(ColumnType type, int size) {
    return new Column(type, new Object[size]);
  }

  public ColumnType getType() {
    return type;
  }

  public int size() {
    return values.length;
  }

  /**
   * @return The value at the given row, <code>null</code> if the value is missing.
   */
  public Object get(int row) {
    return values[row];
  }

  /**
   * @return Unmodifiable view on all values.
   */
  public List<Object> getValues() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  /**
   * @throws ColumnTypeException
   *           if this is not a {@link ColumnType#LONG} column.
   */
  public List<Long> asLongs() throws ColumnTypeException {
    return typedValues(ColumnType.LONG, Long.class);
  }

  /**
   * @return The values as doubles. Available for {@link ColumnType#LONG} columns, too.
   * @throws ColumnTypeException
   *           if this is not a numeric column.
   */
  public List<Double> asDoubles() throws ColumnTypeException {
    if (!type.isNumeric())
      throw new ColumnTypeException("Column of type " + type + " cannot be read as doubles.");
    List<Double> res = new ArrayList<>(values.length);
    for (Object value : values)
      res.add((value == null) ? null : ((Number) value).doubleValue());
    return res;
  }

  /**
   * @throws ColumnTypeException
   *           if this is not a {@link ColumnType#STRING} column.
   */
  public List<String> asStrings() throws ColumnTypeException {
    return typedValues(ColumnType.STRING, String.class);
  }

  /**
   * @throws ColumnTypeException
   *           if this is not a {@link ColumnType#BOOLEAN} column.
   */
  public List<Boolean> asBooleans() throws ColumnTypeException {
    return typedValues(ColumnType.BOOLEAN, Boolean.class);
  }

  private <T> List<T> typedValues(ColumnType expectedType, Class<T> valueClass) {
    if (type != expectedType)
      throw new ColumnTypeException("Column of type " + type + " cannot be read as " + expectedType + ".");
    List<T> res = new ArrayList<>(values.length);
    for (Object value : values)
      res.add(valueClass.cast(value));
    return res;
  }

  /**
   * Apply a function on each value. Missing values are passed to the function as <code>null</code>.
   * 
   * @return The results in row order, usable as result of a mutate function.
   */
  public List<Object> map(Function<Object, ?> fn) {
    List<Object> res = new ArrayList<>(values.length);
    for (Object value : values)
      res.add(fn.apply(value));
    return res;
  }

  /**
   * Test each value. Missing values never match, the predicate is not called for them.
   * 
   * @return The results in row order, usable as result of a filter function.
   */
  public List<Boolean> test(Predicate<Object> predicate) {
    List<Boolean> res = new ArrayList<>(values.length);
    for (Object value : values)
      res.add(value != null && predicate.test(value));
    return res;
  }

  /**
   * Gather the values at the given rows into a new column of the same type.
   * 
   * @param rows
   *          Row positions in this column, in the order in which they should be contained in the result. A position
   *          of -1 results in a missing value.
   */
  public Column take(int[] rows) {
    Object[] res = new Object[rows.length];
    for (int i = 0; i < rows.length; i++)
      res[i] = (rows[i] == -1) ? null : values[rows[i]];
    return new Column(type, res);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Column))
      return false;
    Column other = (Column) obj;
    return type == other.type && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return type.hashCode() * 31 + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "Column[type=" + type + ",values=" + Arrays.toString(values) + "]";
  }
}
