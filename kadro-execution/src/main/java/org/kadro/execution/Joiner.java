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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.ColumnType;
import org.kadro.data.Table;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.kadro.execution.exception.EmptyJoinKeyException;
import org.kadro.execution.exception.IncompatibleJoinKeyException;
import org.kadro.execution.exception.UnknownJoinColumnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Sets;
import com.google.common.primitives.Ints;

/**
 * Joins two tables on equal values in a set of key columns.
 * 
 * <p>
 * The right table is indexed by its key values, then the rows of the left table are probed in order. Therefore the
 * result contains the rows of the left table in their order, each repeated once for each matching row of the right
 * table (in the order of the right table). Missing key values match each other. Key columns of type LONG and DOUBLE are
 * compared numerically.
 * 
 * <p>
 * The result holds all columns of the left table, followed by the non-key columns of the right table. Non-key columns
 * that exist in both tables are suffixed with {@value #LEFT_SUFFIX} and {@value #RIGHT_SUFFIX}.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class Joiner {
  private static final Logger logger = LoggerFactory.getLogger(Joiner.class);

  public static final String LEFT_SUFFIX = "_x";
  public static final String RIGHT_SUFFIX = "_y";

  /**
   * @param keyColumnNames
   *          Names of the columns to join on, <code>null</code> to join on all columns the two tables have in common.
   * @throws EmptyJoinKeyException
   *           if there are no columns to join on.
   * @throws UnknownJoinColumnException
   *           if a key column is missing in one of the tables.
   * @throws IncompatibleJoinKeyException
   *           if a key column has types in the two tables that cannot be compared.
   * @throws DuplicateColumnNameException
   *           if a suffixed column name exists already.
   */
  public Table join(Table left, Table right, List<String> keyColumnNames, JoinType joinType)
      throws EmptyJoinKeyException, UnknownJoinColumnException, IncompatibleJoinKeyException,
      DuplicateColumnNameException {
    List<String> keys = resolveKeyColumnNames(left, right, keyColumnNames);

    boolean[] widenToDouble = new boolean[keys.size()];
    List<String> incompatible = new ArrayList<>();
    for (int k = 0; k < keys.size(); k++) {
      ColumnType leftType = left.getColumn(keys.get(k)).getType();
      ColumnType rightType = right.getColumn(keys.get(k)).getType();
      if (leftType != rightType) {
        if (leftType.isNumeric() && rightType.isNumeric())
          widenToDouble[k] = true;
        else
          incompatible.add(keys.get(k));
      }
    }
    if (!incompatible.isEmpty())
      throw new IncompatibleJoinKeyException("Cannot join on columns " + incompatible + " as their types differ.",
          incompatible);

    Map<GroupKey, List<Integer>> rightIndex = new HashMap<>();
    for (int row = 0; row < right.getRowCount(); row++)
      rightIndex.computeIfAbsent(keyOf(right, keys, widenToDouble, row), k -> new ArrayList<>()).add(row);

    List<Integer> leftRows = new ArrayList<>();
    List<Integer> rightRows = new ArrayList<>();
    for (int row = 0; row < left.getRowCount(); row++) {
      List<Integer> matches = rightIndex.get(keyOf(left, keys, widenToDouble, row));
      if (matches != null) {
        for (int match : matches) {
          leftRows.add(row);
          rightRows.add(match);
        }
      } else if (joinType == JoinType.LEFT) {
        leftRows.add(row);
        rightRows.add(-1);
      }
    }
    logger.debug("{} join on {} resulted in {} rows.", joinType, keys, leftRows.size());

    int[] leftIdx = Ints.toArray(leftRows);
    int[] rightIdx = Ints.toArray(rightRows);

    Set<String> keySet = new LinkedHashSet<>(keys);
    Set<String> leftNonKey = Sets.difference(new LinkedHashSet<>(left.getColumnNames()), keySet);
    Set<String> rightNonKey = Sets.difference(new LinkedHashSet<>(right.getColumnNames()), keySet);
    Set<String> collisions = Sets.intersection(leftNonKey, rightNonKey);

    Table.Builder res = Table.builder().withRowCount(leftIdx.length);
    for (String columnName : left.getColumnNames()) {
      Column column = left.getColumn(columnName).take(leftIdx);
      res.withColumn(collisions.contains(columnName) ? columnName + LEFT_SUFFIX : columnName, column);
    }
    for (String columnName : rightNonKey) {
      Column column = right.getColumn(columnName).take(rightIdx);
      res.withColumn(collisions.contains(columnName) ? columnName + RIGHT_SUFFIX : columnName, column);
    }
    return res.build();
  }

  private List<String> resolveKeyColumnNames(Table left, Table right, List<String> keyColumnNames) {
    if (keyColumnNames == null) {
      List<String> res = new ArrayList<>();
      for (String columnName : left.getColumnNames())
        if (right.hasColumn(columnName))
          res.add(columnName);
      if (res.isEmpty())
        throw new EmptyJoinKeyException("Tables do not have any column in common: " + left.getColumnNames() + " and "
            + right.getColumnNames());
      return res;
    }

    if (keyColumnNames.isEmpty())
      throw new EmptyJoinKeyException("No columns to join on provided.");

    List<String> res = new ArrayList<>(new LinkedHashSet<>(keyColumnNames));
    List<String> unknown = new ArrayList<>();
    for (String columnName : res)
      if (!left.hasColumn(columnName) || !right.hasColumn(columnName))
        unknown.add(columnName);
    if (!unknown.isEmpty())
      throw new UnknownJoinColumnException("Columns " + unknown + " do not exist in both tables.", unknown);
    return res;
  }

  private GroupKey keyOf(Table table, List<String> keys, boolean[] widenToDouble, int row) {
    Object[] values = new Object[keys.size()];
    for (int k = 0; k < values.length; k++) {
      Object value = table.getValue(keys.get(k), row);
      if (widenToDouble[k] && value != null)
        value = ((Number) value).doubleValue();
      values[k] = value;
    }
    return new GroupKey(values);
  }
}
