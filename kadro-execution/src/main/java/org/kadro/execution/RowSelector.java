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
import java.util.List;

import javax.inject.Inject;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Table;
import org.kadro.execution.exception.PartitionLengthMismatchException;
import org.kadro.execution.exception.ReducerFailureException;
import org.kadro.execution.function.FilterFunction;
import org.kadro.util.RandomManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

/**
 * Selects rows of a table by position, by random or by predicates.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class RowSelector {
  private static final Logger logger = LoggerFactory.getLogger(RowSelector.class);

  @Inject
  private RandomManager randomManager;

  /**
   * @return The first n rows of the table, or the whole table if it has less rows.
   */
  public Table head(Table table, int n) throws IllegalArgumentException {
    checkNotNegative(n);
    int count = Math.min(n, table.getRowCount());
    return table.selectRows(range(0, count));
  }

  /**
   * @return The last n rows of the table, or the whole table if it has less rows.
   */
  public Table tail(Table table, int n) throws IllegalArgumentException {
    checkNotNegative(n);
    int count = Math.min(n, table.getRowCount());
    return table.selectRows(range(table.getRowCount() - count, count));
  }

  /**
   * Select rows by their position, in the given order. Negative positions count from the end of the table, -1 being
   * the last row.
   * 
   * @throws IndexOutOfBoundsException
   *           if a position is outside of the table.
   */
  public Table slice(Table table, int[] positions) throws IndexOutOfBoundsException {
    int[] rows = new int[positions.length];
    for (int i = 0; i < positions.length; i++) {
      int row = (positions[i] < 0) ? table.getRowCount() + positions[i] : positions[i];
      if (row < 0 || row >= table.getRowCount())
        throw new IndexOutOfBoundsException(
            "Row position " + positions[i] + " is out of range for table with " + table.getRowCount() + " rows.");
      rows[i] = row;
    }
    return table.selectRows(rows);
  }

  /**
   * Select n random rows.
   * 
   * @param replace
   *          if <code>true</code>, a row may be selected multiple times.
   * @throws IllegalArgumentException
   *           if n is negative or there are not enough rows to sample from.
   */
  public Table sample(Table table, int n, boolean replace) throws IllegalArgumentException {
    checkNotNegative(n);
    int rowCount = table.getRowCount();
    int[] rows = new int[n];
    if (replace) {
      if (rowCount == 0 && n > 0)
        throw new IllegalArgumentException("Cannot sample " + n + " rows from an empty table.");
      for (int i = 0; i < n; i++)
        rows[i] = randomManager.nextInt(rowCount);
    } else {
      if (n > rowCount)
        throw new IllegalArgumentException(
            "Cannot sample " + n + " rows without replacement from a table with " + rowCount + " rows.");
      // partial Fisher-Yates shuffle
      int[] pool = range(0, rowCount);
      for (int i = 0; i < n; i++) {
        int j = i + randomManager.nextInt(rowCount - i);
        int tmp = pool[i];
        pool[i] = pool[j];
        pool[j] = tmp;
        rows[i] = pool[i];
      }
    }
    return table.selectRows(rows);
  }

  /**
   * Keep only rows for which all filters return <code>true</code>. The filters are applied one after the other, each
   * one receives the table as filtered by the previous ones.
   * 
   * @throws PartitionLengthMismatchException
   *           if a filter returns the wrong number of values.
   * @throws ReducerFailureException
   *           if a filter throws an exception.
   */
  public Table filter(Table table, List<FilterFunction> filters)
      throws PartitionLengthMismatchException, ReducerFailureException {
    Table res = table;
    for (FilterFunction filter : filters) {
      List<Boolean> mask;
      try {
        mask = filter.apply(res);
      } catch (RuntimeException e) {
        throw new ReducerFailureException("Filter failed: " + e.getMessage(), Collections.emptyList(), e);
      }

      int actualLength = (mask == null) ? -1 : mask.size();
      if (actualLength != res.getRowCount())
        throw new PartitionLengthMismatchException("Filter returned " + actualLength + " values, but table has "
            + res.getRowCount() + " rows.", Collections.emptyList(), res.getRowCount(), actualLength);

      List<Integer> rows = new ArrayList<>();
      for (int row = 0; row < mask.size(); row++)
        if (Boolean.TRUE.equals(mask.get(row)))
          rows.add(row);
      logger.trace("Filter keeps {} of {} rows.", rows.size(), res.getRowCount());
      res = res.selectRows(Ints.toArray(rows));
    }
    return res;
  }

  private void checkNotNegative(int n) {
    if (n < 0)
      throw new IllegalArgumentException("Number of rows must not be negative: " + n);
  }

  private int[] range(int start, int count) {
    int[] res = new int[count];
    for (int i = 0; i < count; i++)
      res[i] = start + i;
    return res;
  }
}
