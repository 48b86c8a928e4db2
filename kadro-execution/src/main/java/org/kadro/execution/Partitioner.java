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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

/**
 * Splits the rows of a {@link Table} into {@link Partition}s according to a {@link GroupSpec}.
 * 
 * <p>
 * There is one partition for each distinct combination of values in the grouping columns that occurs in the table.
 * Missing values form their own group in each column, so do <code>NaN</code> doubles. The returned partitions are
 * sorted by their {@link GroupKey}, the rows in each partition are in ascending order. Each row of the table is
 * contained in exactly one partition.
 * 
 * <p>
 * If the {@link GroupSpec} is empty, the whole table is a single partition with an empty key, even if the table has no
 * rows. A grouped table without rows has no partitions.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class Partitioner {
  private static final Logger logger = LoggerFactory.getLogger(Partitioner.class);

  /**
   * @throws InvalidGroupColumnException
   *           if a column of the group spec does not exist in the table.
   */
  public List<Partition> partition(Table table, GroupSpec groupSpec) throws InvalidGroupColumnException {
    groupSpec.validate(table);

    int[] allRows = new int[table.getRowCount()];
    for (int i = 0; i < allRows.length; i++)
      allRows[i] = i;

    if (groupSpec.isEmpty())
      return Collections.singletonList(new Partition(GroupKey.empty(), allRows, true));

    List<Column> columns = new ArrayList<>();
    for (String columnName : groupSpec.getColumnNames())
      columns.add(table.getColumn(columnName));

    List<Partition> res = new ArrayList<>();
    if (allRows.length > 0)
      createGroupers(columns, 0).get().groupRows(allRows, new Object[0], res);

    Collections.sort(res, (a, b) -> a.getKey().compareTo(b.getKey()));
    logger.trace("Grouped {} rows by {} into {} partitions.", allRows.length, groupSpec, res.size());
    return res;
  }

  /**
   * Create a {@link Grouper} for grouping by the given columns, starting at the given index. The supplied
   * {@link Grouper} groups by the column at that index and delegates to groupers of the following columns. After the
   * last column, a leaf {@link Grouper} is supplied.
   */
  private Supplier<Grouper> createGroupers(List<Column> columns, int index) {
    if (index == columns.size())
      return () -> new Grouper();

    Column column = columns.get(index);
    Supplier<Grouper> delegateGroupersFactory = createGroupers(columns, index + 1);
    return () -> new Grouper(column, delegateGroupersFactory);
  }

  /**
   * Groups rows by the values of one column and forwards each group to a delegate {@link Grouper} that groups by the
   * next column. A leaf {@link Grouper} does not group anymore, but records the rows it receives as one
   * {@link Partition}.
   */
  private static class Grouper {
    private Column column;
    private Supplier<Grouper> delegateGroupersFactory;
    private boolean isLeaf;

    public Grouper(Column column, Supplier<Grouper> delegateGroupersFactory) {
      this.column = column;
      this.delegateGroupersFactory = delegateGroupersFactory;
      isLeaf = false;
    }

    public Grouper() {
      isLeaf = true;
    }

    /**
     * @param rows
     *          Rows to group, ascending.
     * @param keyValues
     *          Values of the columns that the rows were grouped by already.
     * @param res
     *          Partitions found are added here.
     */
    public void groupRows(int[] rows, Object[] keyValues, List<Partition> res) {
      if (isLeaf) {
        res.add(new Partition(new GroupKey(keyValues), rows, false));
        return;
      }

      // LinkedHashMap accepts null keys, missing values therefore end up in a group of their own.
      Map<Object, List<Integer>> valueToRows = new LinkedHashMap<>();
      for (int row : rows)
        valueToRows.computeIfAbsent(GroupKey.keyValue(column.get(row)), v -> new ArrayList<>()).add(row);

      for (Map.Entry<Object, List<Integer>> e : valueToRows.entrySet()) {
        Object[] delegateKeyValues = new Object[keyValues.length + 1];
        System.arraycopy(keyValues, 0, delegateKeyValues, 0, keyValues.length);
        delegateKeyValues[keyValues.length] = e.getKey();

        delegateGroupersFactory.get().groupRows(Ints.toArray(e.getValue()), delegateKeyValues, res);
      }
    }
  }
}
