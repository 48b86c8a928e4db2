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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import org.kadro.data.Table;
import org.kadro.data.TableFormatter;
import org.kadro.data.exception.ColumnTypeException;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.kadro.data.exception.UnknownColumnException;
import org.kadro.execution.GroupSpec;
import org.kadro.execution.JoinType;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.kadro.execution.exception.PartitionLengthMismatchException;
import org.kadro.execution.exception.ReducerFailureException;
import org.kadro.execution.exception.SpreadConflictException;
import org.kadro.execution.function.FilterFunction;
import org.kadro.execution.function.MutateFunction;
import org.kadro.execution.function.ReduceFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Table} together with the columns it is currently grouped by.
 *
 * <p>
 * A frame is immutable, each operation returns a new frame and leaves this one (and its table) untouched. The grouping
 * is respected by {@link #mutate(Map)}, {@link #agg(Map)} and {@link #sort(List, List)}. It is carried along by most
 * other operations and removed by {@link #agg(Map)}, {@link #gather(String, String, String...)},
 * {@link #spread(String, String)}, the joins and {@link #ungroup()}.
 *
 * <p>
 * Example:
 *
 * <pre>
 * frameFactory.createFrame(table) //
 *     .filter(t -&gt; t.getColumn("x").test(x -&gt; (Long) x &gt; 15)) //
 *     .groupBy("id") //
 *     .agg("m", t -&gt; mean(t.getColumn("x").asDoubles()));
 * </pre>
 *
 * Instances are created by {@link FrameFactory}.
 *
 * @author Bastian Gloeckle
 */
public class Frame {
  private static final Logger logger = LoggerFactory.getLogger(Frame.class);

  public static final String DEFAULT_KEY_COLUMN = "key";
  public static final String DEFAULT_VALUE_COLUMN = "value";
  public static final int DEFAULT_HEAD_ROWS = 5;

  private final FrameFactory factory;
  private final Table table;
  private final GroupSpec groupSpec;
  private final GroupColumnPolicy groupColumnPolicy;

  /* package */ Frame(FrameFactory factory, Table table, GroupSpec groupSpec, GroupColumnPolicy groupColumnPolicy)
      throws InvalidGroupColumnException {
    groupSpec.validate(table);
    this.factory = factory;
    this.table = table;
    this.groupSpec = groupSpec;
    this.groupColumnPolicy = groupColumnPolicy;
  }

  private Frame derive(Table newTable) {
    return new Frame(factory, newTable, groupSpec, groupColumnPolicy);
  }

  private Frame derive(Table newTable, GroupSpec newGroupSpec) {
    return new Frame(factory, newTable, newGroupSpec, groupColumnPolicy);
  }

  public Table getTable() {
    return table;
  }

  public GroupSpec getGroupSpec() {
    return groupSpec;
  }

  /**
   * @return The names of the columns this frame is grouped by, empty if it is not grouped.
   */
  public List<String> getGroups() {
    return groupSpec.getColumnNames();
  }

  public List<String> getColumnNames() {
    return table.getColumnNames();
  }

  public int getRowCount() {
    return table.getRowCount();
  }

  public GroupColumnPolicy getGroupColumnPolicy() {
    return groupColumnPolicy;
  }

  /**
   * @return A frame equal to this one, but using another {@link GroupColumnPolicy}.
   */
  public Frame withGroupColumnPolicy(GroupColumnPolicy policy) {
    return new Frame(factory, table, groupSpec, policy);
  }

  /**
   * Keep only the given columns, in the given order. Grouping columns are handled according to the
   * {@link GroupColumnPolicy}.
   *
   * @throws UnknownColumnException
   *           if a column does not exist.
   * @throws InvalidGroupColumnException
   *           if a grouping column is not selected and the policy is {@link GroupColumnPolicy#REJECT}.
   */
  public Frame select(String... columnNames) throws UnknownColumnException, InvalidGroupColumnException {
    return select(Arrays.asList(columnNames));
  }

  /**
   * @see #select(String...)
   */
  public Frame select(List<String> columnNames) throws UnknownColumnException, InvalidGroupColumnException {
    for (String columnName : columnNames)
      table.getColumn(columnName);

    List<String> missingGroups = new ArrayList<>();
    for (String group : groupSpec.getColumnNames())
      if (!columnNames.contains(group))
        missingGroups.add(group);

    List<String> res = new ArrayList<>();
    if (!missingGroups.isEmpty()) {
      if (groupColumnPolicy == GroupColumnPolicy.REJECT)
        throw new InvalidGroupColumnException(
            "Cannot remove columns " + missingGroups + " as the frame is grouped by them.", missingGroups);
      logger.debug("Retaining grouping columns {} that were not selected.", missingGroups);
      res.addAll(missingGroups);
    }
    res.addAll(columnNames);
    return derive(table.selectColumns(res));
  }

  /**
   * Remove the given columns. Grouping columns are handled according to the {@link GroupColumnPolicy}.
   *
   * @throws UnknownColumnException
   *           if a column does not exist.
   * @throws InvalidGroupColumnException
   *           if a grouping column should be dropped and the policy is {@link GroupColumnPolicy#REJECT}.
   */
  public Frame drop(String... columnNames) throws UnknownColumnException, InvalidGroupColumnException {
    return drop(Arrays.asList(columnNames));
  }

  /**
   * @see #drop(String...)
   */
  public Frame drop(Collection<String> columnNames) throws UnknownColumnException, InvalidGroupColumnException {
    for (String columnName : columnNames)
      table.getColumn(columnName);

    List<String> droppedGroups = new ArrayList<>();
    List<String> toDrop = new ArrayList<>();
    for (String columnName : columnNames) {
      if (groupSpec.contains(columnName))
        droppedGroups.add(columnName);
      else
        toDrop.add(columnName);
    }

    if (!droppedGroups.isEmpty()) {
      if (groupColumnPolicy == GroupColumnPolicy.REJECT)
        throw new InvalidGroupColumnException(
            "Cannot drop columns " + droppedGroups + " as the frame is grouped by them.", droppedGroups);
      logger.debug("Not dropping grouping columns {}.", droppedGroups);
    }
    return derive(table.dropColumns(toDrop));
  }

  /**
   * Rename columns. Grouping columns that are renamed stay grouping columns.
   *
   * @param renames
   *          Map from old name to new name.
   * @throws UnknownColumnException
   *           if an old name does not exist.
   * @throws DuplicateColumnNameException
   *           if the result would contain a column name twice.
   */
  public Frame rename(Map<String, String> renames) throws UnknownColumnException, DuplicateColumnNameException {
    return derive(table.renameColumns(renames), groupSpec.renamed(renames));
  }

  /**
   * Replace the names of all columns, in column order.
   *
   * @throws IllegalArgumentException
   *           if the number of names does not match the number of columns.
   * @throws DuplicateColumnNameException
   *           if a name is contained twice.
   */
  public Frame setNames(String... names) throws IllegalArgumentException, DuplicateColumnNameException {
    return setNames(Arrays.asList(names));
  }

  /**
   * @see #setNames(String...)
   */
  public Frame setNames(List<String> names) throws IllegalArgumentException, DuplicateColumnNameException {
    Table res = table.withColumnNames(names);
    Map<String, String> renames = new HashMap<>();
    List<String> oldNames = table.getColumnNames();
    for (int i = 0; i < oldNames.size(); i++)
      renames.put(oldNames.get(i), names.get(i));
    return derive(res, groupSpec.renamed(renames));
  }

  /**
   * Sort ascending by the given columns, see {@link #sort(List, List)}.
   */
  public Frame sort(String... columnNames) throws UnknownColumnException {
    return sort(Arrays.asList(columnNames), true);
  }

  /**
   * Sort by the given columns, all in the same direction, see {@link #sort(List, List)}.
   */
  public Frame sort(List<String> columnNames, boolean ascending) throws UnknownColumnException {
    return sort(columnNames, Collections.nCopies(columnNames.size(), ascending));
  }

  /**
   * Sort the rows. If the frame is grouped, the rows are sorted ascending by the grouping columns first, then by the
   * given columns. The sort is stable, <code>NaN</code> and missing values are sorted last.
   *
   * @param ascending
   *          Sort direction for each of the given columns.
   * @throws UnknownColumnException
   *           if a column does not exist.
   * @throws IllegalArgumentException
   *           if the number of directions does not match the number of columns.
   */
  public Frame sort(List<String> columnNames, List<Boolean> ascending)
      throws UnknownColumnException, IllegalArgumentException {
    if (columnNames.size() != ascending.size())
      throw new IllegalArgumentException(
          "Expected " + columnNames.size() + " sort directions, but " + ascending.size() + " were provided.");

    List<String> sortColumns = new ArrayList<>(groupSpec.getColumnNames());
    sortColumns.addAll(columnNames);
    List<Boolean> sortAscending = new ArrayList<>(Collections.nCopies(groupSpec.size(), true));
    sortAscending.addAll(ascending);
    return derive(factory.getRowSorter().sort(table, sortColumns, sortAscending));
  }

  /**
   * Keep only rows for which all filters return <code>true</code>. Each filter receives the whole table as filtered
   * by the previous ones.
   *
   * @throws PartitionLengthMismatchException
   *           if a filter returns the wrong number of values.
   * @throws ReducerFailureException
   *           if a filter throws an exception.
   */
  public Frame filter(FilterFunction... filters) throws PartitionLengthMismatchException, ReducerFailureException {
    return derive(factory.getRowSelector().filter(table, Arrays.asList(filters)));
  }

  /**
   * Add or replace columns. If the frame is grouped, each function is called once per group and receives the rows of
   * that group. The functions are applied in iteration order of the map, each sees the columns created before.
   *
   * @param functions
   *          Map from column name to the function calculating the values of that column.
   * @throws PartitionLengthMismatchException
   *           if a function returns the wrong number of values.
   * @throws ReducerFailureException
   *           if a function throws an exception.
   * @throws ColumnTypeException
   *           if the values of a column have incompatible types.
   */
  public Frame mutate(Map<String, MutateFunction> functions)
      throws PartitionLengthMismatchException, ReducerFailureException, ColumnTypeException {
    return derive(factory.getGroupedMutator().mutate(table, groupSpec, functions));
  }

  /**
   * Add or replace a single column, see {@link #mutate(Map)}.
   */
  public Frame mutate(String columnName, MutateFunction function)
      throws PartitionLengthMismatchException, ReducerFailureException, ColumnTypeException {
    Map<String, MutateFunction> functions = new LinkedHashMap<>();
    functions.put(columnName, function);
    return mutate(functions);
  }

  /**
   * Group by the given columns, replacing any previous grouping.
   *
   * @throws InvalidGroupColumnException
   *           if a column does not exist.
   */
  public Frame groupBy(String... columnNames) throws InvalidGroupColumnException {
    return groupBy(Arrays.asList(columnNames));
  }

  /**
   * @see #groupBy(String...)
   */
  public Frame groupBy(List<String> columnNames) throws InvalidGroupColumnException {
    return derive(table, GroupSpec.of(columnNames));
  }

  public Frame ungroup() {
    return derive(table, GroupSpec.empty());
  }

  /**
   * Reduce each group to a single row, or the whole frame if it is not grouped. The result contains the grouping
   * columns followed by one column per reducer, one row per group sorted by the grouping columns. The result is not
   * grouped.
   *
   * @param reducers
   *          Map from column name to the function calculating the value of that column.
   * @throws DuplicateColumnNameException
   *           if a reducer is named like a grouping column.
   * @throws ReducerFailureException
   *           if a reducer throws an exception.
   * @throws ColumnTypeException
   *           if a reducer returns a value that is no scalar or values of incompatible types.
   */
  public Frame agg(Map<String, ReduceFunction> reducers)
      throws DuplicateColumnNameException, ReducerFailureException, ColumnTypeException {
    return derive(factory.getAggregator().aggregate(table, groupSpec, reducers), GroupSpec.empty());
  }

  /**
   * Aggregate into a single column, see {@link #agg(Map)}.
   */
  public Frame agg(String columnName, ReduceFunction reducer)
      throws DuplicateColumnNameException, ReducerFailureException, ColumnTypeException {
    Map<String, ReduceFunction> reducers = new LinkedHashMap<>();
    reducers.put(columnName, reducer);
    return agg(reducers);
  }

  /**
   * Turn all columns into key/value pairs, with columns named {@value #DEFAULT_KEY_COLUMN} and
   * {@value #DEFAULT_VALUE_COLUMN}.
   */
  public Frame gather() throws ColumnTypeException, DuplicateColumnNameException {
    return gather(DEFAULT_KEY_COLUMN, DEFAULT_VALUE_COLUMN);
  }

  /**
   * Turn the frame from wide to long: each column that is not kept is turned into key/value pairs, the key column
   * holding the name of the original column and the value column holding its values. The result is not grouped.
   *
   * @throws UnknownColumnException
   *           if a column to keep does not exist.
   * @throws ColumnTypeException
   *           if the gathered columns have incompatible types.
   * @throws DuplicateColumnNameException
   *           if the key or value column is named like a kept column.
   */
  public Frame gather(String keyColumnName, String valueColumnName, String... keepColumnNames)
      throws UnknownColumnException, ColumnTypeException, DuplicateColumnNameException {
    return derive(
        factory.getReshaper().gather(table, keyColumnName, valueColumnName, Arrays.asList(keepColumnNames)),
        GroupSpec.empty());
  }

  /**
   * Turn the frame from long to wide, the inverse of {@link #gather(String, String, String...)}: each distinct value of
   * the key column becomes a new column holding the corresponding values of the value column. The result contains one
   * row per distinct combination of the remaining columns and is not grouped.
   *
   * @throws UnknownColumnException
   *           if the key or value column does not exist.
   * @throws SpreadConflictException
   *           if multiple rows provide a value for the same cell.
   */
  public Frame spread(String keyColumnName, String valueColumnName)
      throws UnknownColumnException, SpreadConflictException, DuplicateColumnNameException {
    return derive(factory.getReshaper().spread(table, keyColumnName, valueColumnName), GroupSpec.empty());
  }

  /**
   * Sample rows without replacement, see {@link #sampleN(int, boolean)}.
   */
  public Frame sampleN(int n) throws IllegalArgumentException {
    return sampleN(n, false);
  }

  /**
   * Select n random rows.
   *
   * @param replace
   *          If <code>true</code>, a row can be selected multiple times.
   * @throws IllegalArgumentException
   *           if n is negative or larger than the number of rows when sampling without replacement.
   */
  public Frame sampleN(int n, boolean replace) throws IllegalArgumentException {
    return derive(factory.getRowSelector().sample(table, n, replace));
  }

  public Frame head() {
    return head(DEFAULT_HEAD_ROWS);
  }

  public Frame head(int n) throws IllegalArgumentException {
    return derive(factory.getRowSelector().head(table, n));
  }

  public Frame tail() {
    return tail(DEFAULT_HEAD_ROWS);
  }

  public Frame tail(int n) throws IllegalArgumentException {
    return derive(factory.getRowSelector().tail(table, n));
  }

  /**
   * Select rows by position. Negative positions count from the end.
   *
   * @throws IndexOutOfBoundsException
   *           if a position is outside of the frame.
   */
  public Frame slice(int... positions) throws IndexOutOfBoundsException {
    return derive(factory.getRowSelector().slice(table, positions));
  }

  /**
   * Left join with another frame. All rows of this frame are contained in the result. The result is not grouped.
   *
   * @param by
   *          Columns to join on. If none are given, the frames are joined on all columns they have in common.
   * @see org.kadro.execution.Joiner
   */
  public Frame leftJoin(Frame other, String... by) {
    return join(other, JoinType.LEFT, by);
  }

  /**
   * Inner join with another frame. The result is not grouped.
   *
   * @param by
   *          Columns to join on. If none are given, the frames are joined on all columns they have in common.
   * @see org.kadro.execution.Joiner
   */
  public Frame innerJoin(Frame other, String... by) {
    return join(other, JoinType.INNER, by);
  }

  private Frame join(Frame other, JoinType joinType, String[] by) {
    List<String> keyColumnNames = (by.length == 0) ? null : Arrays.asList(by);
    return derive(factory.getJoiner().join(table, other.table, keyColumnNames, joinType), GroupSpec.empty());
  }

  /**
   * Transform the table with an arbitrary function. The grouping is kept.
   *
   * @throws InvalidGroupColumnException
   *           if the resulting table does not contain all grouping columns.
   */
  public Frame pipe(UnaryOperator<Table> function) throws InvalidGroupColumnException {
    return derive(function.apply(table));
  }

  /**
   * Render the first rows of this frame, including its grouping.
   */
  public String format(int rows) {
    StringBuilder sb = new StringBuilder();
    sb.append("Frame with ").append(table.getRowCount()).append(" rows and ").append(table.getColumnCount())
        .append(" columns.\n");
    if (!groupSpec.isEmpty())
      sb.append("With groups ").append(groupSpec).append("\n");
    sb.append("\n");
    sb.append(TableFormatter.format(table, rows));
    return sb.toString();
  }

  /**
   * Print the first rows of this frame to stdout.
   */
  public void show(int rows) {
    System.out.println(format(rows));
  }

  /**
   * Print the configured number of rows of this frame to stdout.
   */
  public void show() {
    show(factory.getShowRows());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Frame))
      return false;
    Frame other = (Frame) obj;
    return table.equals(other.table) && groupSpec.equals(other.groupSpec);
  }

  @Override
  public int hashCode() {
    return table.hashCode() * 31 + groupSpec.hashCode();
  }

  @Override
  public String toString() {
    return format(factory.getShowRows());
  }
}
