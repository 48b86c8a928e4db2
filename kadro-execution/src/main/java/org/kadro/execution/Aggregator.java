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
import java.util.Map;
import java.util.Map.Entry;

import javax.inject.Inject;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.ColumnType;
import org.kadro.data.Table;
import org.kadro.data.exception.ColumnTypeException;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.kadro.execution.exception.ReducerFailureException;
import org.kadro.execution.function.ReduceFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces each partition of a table to a single row.
 * 
 * <p>
 * The resulting table has one row per partition, ordered by group key. Its columns are the grouping columns (holding
 * the group keys, with the type of the source column) followed by one column per reducer, in iteration order of the
 * provided map. If the table is not grouped, the result has exactly one row.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class Aggregator {
  private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

  @Inject
  private Partitioner partitioner;

  @Inject
  private PartitionWorkExecutor partitionWorkExecutor;

  /**
   * @param reducers
   *          Map from name of the result column to the function calculating its value.
   * @throws InvalidGroupColumnException
   *           if a grouping column does not exist.
   * @throws DuplicateColumnNameException
   *           if a reducer has the name of a grouping column.
   * @throws ReducerFailureException
   *           if a reducer throws an exception.
   * @throws ColumnTypeException
   *           if a reducer returns a value that is no scalar or the values of a reducer have incompatible types.
   */
  public Table aggregate(Table table, GroupSpec groupSpec, Map<String, ReduceFunction> reducers)
      throws InvalidGroupColumnException, DuplicateColumnNameException, ReducerFailureException,
      ColumnTypeException {
    List<String> clashing = new ArrayList<>();
    for (String name : reducers.keySet())
      if (groupSpec.contains(name))
        clashing.add(name);
    if (!clashing.isEmpty())
      throw new DuplicateColumnNameException("Aggregation result columns clash with grouping columns: " + clashing,
          clashing);

    List<Partition> partitions = partitioner.partition(table, groupSpec);
    logger.debug("Aggregating {} partitions into columns {}.", partitions.size(), reducers.keySet());

    List<String> reducerNames = new ArrayList<>(reducers.keySet());
    List<ReduceFunction> reducerFunctions = new ArrayList<>(reducers.values());
    List<Object[]> results = partitionWorkExecutor.computeAll(partitions, partition -> {
      Table partitionTable = partition.selectFrom(table);
      Object[] res = new Object[reducerFunctions.size()];
      for (int i = 0; i < res.length; i++)
        res[i] = reduce(reducerFunctions.get(i), reducerNames.get(i), partitionTable, partition);
      return res;
    });

    Table.Builder res = Table.builder().withRowCount(partitions.size());
    for (int k = 0; k < groupSpec.size(); k++) {
      String keyColumnName = groupSpec.getColumnNames().get(k);
      List<Object> keyValues = new ArrayList<>();
      for (Partition partition : partitions)
        keyValues.add(partition.getKey().get(k));
      res.withColumn(keyColumnName, table.getColumn(keyColumnName).getType(), keyValues);
    }

    for (int i = 0; i < reducerNames.size(); i++) {
      List<Object> values = new ArrayList<>();
      for (Object[] result : results)
        values.add(result[i]);
      res.withColumn(reducerNames.get(i), toColumn(reducerNames.get(i), values));
    }
    return res.build();
  }

  private Object reduce(ReduceFunction reducer, String name, Table table, Partition partition) {
    Object res;
    try {
      res = reducer.apply(table);
    } catch (RuntimeException e) {
      throw new ReducerFailureException("Reducer for column '" + name + "' failed on group " + partition.getKey()
          + ": " + e.getMessage(), Arrays.asList(name), e);
    }
    try {
      ColumnType.forValue(res);
    } catch (ColumnTypeException e) {
      throw new ColumnTypeException(
          "Reducer for column '" + name + "' returned no scalar value on group " + partition.getKey() + ": " + res,
          name);
    }
    return res;
  }

  private Column toColumn(String name, List<Object> values) {
    try {
      return Column.fromValues(values);
    } catch (ColumnTypeException e) {
      throw new ColumnTypeException(
          "Reducer for column '" + name + "' returned values of incompatible types: " + e.getMessage(), name);
    }
  }
}
