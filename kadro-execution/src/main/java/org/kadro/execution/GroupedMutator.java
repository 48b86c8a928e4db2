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
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.inject.Inject;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.data.exception.ColumnTypeException;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.kadro.execution.exception.PartitionLengthMismatchException;
import org.kadro.execution.exception.ReducerFailureException;
import org.kadro.execution.function.MutateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds or replaces columns of a table, calculating their values for each partition of the table separately.
 * 
 * <p>
 * The functions are applied one after the other, in iteration order of the provided map. Each function sees the
 * columns created by the functions before it. The partitions are calculated only once on the input table. The row order
 * of the table is not changed: the values a function returns for a partition are written to the positions the rows of
 * the partition have in the table.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class GroupedMutator {
  private static final Logger logger = LoggerFactory.getLogger(GroupedMutator.class);

  @Inject
  private Partitioner partitioner;

  @Inject
  private PartitionWorkExecutor partitionWorkExecutor;

  /**
   * @param functions
   *          Map from name of the column to create to the function calculating its values.
   * @throws InvalidGroupColumnException
   *           if a grouping column does not exist.
   * @throws PartitionLengthMismatchException
   *           if a function returns the wrong number of values for a partition.
   * @throws ReducerFailureException
   *           if a function throws an exception.
   * @throws ColumnTypeException
   *           if the values returned for a column have incompatible types.
   */
  public Table mutate(Table table, GroupSpec groupSpec, Map<String, MutateFunction> functions)
      throws InvalidGroupColumnException, PartitionLengthMismatchException, ReducerFailureException,
      ColumnTypeException {
    List<Partition> partitions = partitioner.partition(table, groupSpec);
    logger.debug("Mutating columns {} on {} partitions.", functions.keySet(), partitions.size());

    Table res = table;
    for (Entry<String, MutateFunction> e : functions.entrySet()) {
      String columnName = e.getKey();
      MutateFunction function = e.getValue();
      Table current = res;

      List<List<?>> partitionValues =
          partitionWorkExecutor.computeAll(partitions, partition -> apply(function, columnName, current, partition));

      Object[] values = new Object[table.getRowCount()];
      for (int p = 0; p < partitions.size(); p++) {
        Partition partition = partitions.get(p);
        int i = 0;
        for (Object value : partitionValues.get(p))
          values[partition.getRow(i++)] = value;
      }

      Column column;
      try {
        column = Column.fromValues(Arrays.asList(values));
      } catch (ColumnTypeException ex) {
        throw new ColumnTypeException("Values calculated for column '" + columnName + "' have incompatible types: "
            + ex.getMessage(), columnName);
      }
      res = res.withColumn(columnName, column);
    }
    return res;
  }

  private List<?> apply(MutateFunction function, String columnName, Table table, Partition partition) {
    Table partitionTable = partition.selectFrom(table);
    List<?> res;
    try {
      res = function.apply(partitionTable);
    } catch (RuntimeException e) {
      throw new ReducerFailureException("Function calculating column '" + columnName + "' failed on group "
          + partition.getKey() + ": " + e.getMessage(), Arrays.asList(columnName), e);
    }

    int actualLength = (res == null) ? -1 : res.size();
    if (actualLength != partition.size())
      throw new PartitionLengthMismatchException("Function calculating column '" + columnName + "' returned "
          + actualLength + " values for group " + partition.getKey() + ", but group has " + partition.size()
          + " rows.", Arrays.asList(columnName), partition.size(), actualLength);
    return res;
  }
}
