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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.kadro.data.exception.ColumnLengthMismatchException;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.kadro.data.exception.UnknownColumnException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

/**
 * A {@link Table} is the basic container of any data.
 * 
 * <p>
 * A table is an ordered collection of uniquely named {@link Column}s which all have the same length, the number of
 * rows of the table. The order of the rows is significant.
 * 
 * <p>
 * Tables are immutable. All methods that "change" a table return a new instance and leave the original untouched.
 * Columns which are not changed by such a method are shared between the old and the new instance.
 *
 * @author Bastian Gloeckle
 */
public class Table {
  private final ImmutableMap<String, Column> columns;
  private final int rowCount;

  private Table(ImmutableMap<String, Column> columns, int rowCount) {
    this.columns = columns;
    this.rowCount = rowCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return Names of the columns, in column order.
   */
  public List<String> getColumnNames() {
    return columns.keySet().asList();
  }

  public int getColumnCount() {
    return columns.size();
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * @throws UnknownColumnException
   *           if there is no such column.
   */
  public Column getColumn(String name) throws UnknownColumnException {
    Column res = columns.get(name);
    if (res == null)
      throw new UnknownColumnException("Column '" + name + "' does not exist. Available: " + columns.keySet(), name);
    return res;
  }

  /**
   * @return Value of a single cell, <code>null</code> if it is missing.
   */
  public Object getValue(String columnName, int row) {
    return getColumn(columnName).get(row);
  }

  /**
   * @return Unmodifiable map from column name to value of the given row, in column order.
   */
  public Map<String, Object> getRow(int row) {
    Map<String, Object> res = new LinkedHashMap<>();
    for (Entry<String, Column> e : columns.entrySet())
      res.put(e.getKey(), e.getValue().get(row));
    return Collections.unmodifiableMap(res);
  }

  /**
   * @return A table containing the given rows of this table, in the given order. Rows may be repeated.
   */
  public Table selectRows(int[] rows) {
    ImmutableMap.Builder<String, Column> res = ImmutableMap.builder();
    for (Entry<String, Column> e : columns.entrySet())
      res.put(e.getKey(), e.getValue().take(rows));
    return new Table(res.build(), rows.length);
  }

  /**
   * @return A table containing the given columns in the given order.
   * @throws UnknownColumnException
   *           if a column does not exist.
   * @throws DuplicateColumnNameException
   *           if a column is named twice.
   */
  public Table selectColumns(List<String> names) throws UnknownColumnException, DuplicateColumnNameException {
    Builder res = new Builder().withRowCount(rowCount);
    for (String name : names)
      res.withColumn(name, getColumn(name));
    return res.build();
  }

  /**
   * @return A table without the given columns.
   * @throws UnknownColumnException
   *           if a column does not exist.
   */
  public Table dropColumns(Collection<String> names) throws UnknownColumnException {
    Set<String> unknown = Sets.difference(new HashSet<>(names), columns.keySet());
    if (!unknown.isEmpty())
      throw new UnknownColumnException("Cannot drop columns that do not exist: " + unknown, unknown);

    Builder res = new Builder().withRowCount(rowCount);
    for (Entry<String, Column> e : columns.entrySet())
      if (!names.contains(e.getKey()))
        res.withColumn(e.getKey(), e.getValue());
    return res.build();
  }

  /**
   * Add a column or replace the column with the same name. A replaced column keeps its position, a new column is
   * appended.
   * 
   * @throws ColumnLengthMismatchException
   *           if the column does not have {@link #getRowCount()} values.
   */
  public Table withColumn(String name, Column column) throws ColumnLengthMismatchException {
    if (column.size() != rowCount)
      throw new ColumnLengthMismatchException(
          "Column '" + name + "' has " + column.size() + " values, but table has " + rowCount + " rows.", name);

    Map<String, Column> res = new LinkedHashMap<>(columns);
    res.put(name, column);
    return new Table(ImmutableMap.copyOf(res), rowCount);
  }

  /**
   * Rename columns, keeping their position.
   * 
   * @param renames
   *          Map from old name to new name.
   * @throws UnknownColumnException
   *           if an old name does not exist.
   * @throws DuplicateColumnNameException
   *           if the renamed table would contain a name twice.
   */
  public Table renameColumns(Map<String, String> renames)
      throws UnknownColumnException, DuplicateColumnNameException {
    Set<String> unknown = Sets.difference(renames.keySet(), columns.keySet());
    if (!unknown.isEmpty())
      throw new UnknownColumnException("Cannot rename columns that do not exist: " + unknown, unknown);

    Builder res = new Builder().withRowCount(rowCount);
    for (Entry<String, Column> e : columns.entrySet())
      res.withColumn(renames.getOrDefault(e.getKey(), e.getKey()), e.getValue());
    return res.build();
  }

  /**
   * Replace all column names.
   * 
   * @throws IllegalArgumentException
   *           if the number of names does not match the number of columns.
   * @throws DuplicateColumnNameException
   *           if a name is contained twice.
   */
  public Table withColumnNames(List<String> names) throws IllegalArgumentException, DuplicateColumnNameException {
    if (names.size() != columns.size())
      throw new IllegalArgumentException(
          "Expected " + columns.size() + " column names, but " + names.size() + " were provided.");

    Builder res = new Builder().withRowCount(rowCount);
    int i = 0;
    for (Column column : columns.values())
      res.withColumn(names.get(i++), column);
    return res.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Table))
      return false;
    Table other = (Table) obj;
    // compare order of columns, too.
    return rowCount == other.rowCount && getColumnNames().equals(other.getColumnNames())
        && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode() * 31 + rowCount;
  }

  @Override
  public String toString() {
    return TableFormatter.format(this, TableFormatter.DEFAULT_ROWS);
  }

  /**
   * Builds {@link Table}s.
   */
  public static class Builder {
    private Map<String, Column> columns = new LinkedHashMap<>();
    private Integer rowCount = null;

    private Builder() {
    }

    /**
     * Sets the number of rows explicitly. This is needed only if the table has no columns.
     */
    public Builder withRowCount(int rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    /**
     * @throws DuplicateColumnNameException
     *           if there is a column with that name already.
     */
    public Builder withColumn(String name, Column column) throws DuplicateColumnNameException {
      if (columns.containsKey(name))
        throw new DuplicateColumnNameException("Column '" + name + "' is contained twice.", name);
      columns.put(name, column);
      return this;
    }

    /**
     * Add a column whose type is inferred from the values, see {@link Column#fromValues(List)}.
     */
    public Builder withColumn(String name, List<?> values) {
      return withColumn(name, Column.fromValues(values));
    }

    public Builder withColumn(String name, ColumnType type, List<?> values) {
      return withColumn(name, Column.of(type, values));
    }

    /**
     * @throws ColumnLengthMismatchException
     *           if the columns have different lengths.
     */
    public Table build() throws ColumnLengthMismatchException {
      int res = (rowCount != null) ? rowCount
          : (columns.isEmpty() ? 0 : columns.values().iterator().next().size());
      for (Entry<String, Column> e : columns.entrySet())
        if (e.getValue().size() != res)
          throw new ColumnLengthMismatchException("Column '" + e.getKey() + "' has " + e.getValue().size()
              + " values, but expected " + res + ".", e.getKey());
      return new Table(ImmutableMap.copyOf(columns), res);
    }
  }
}
