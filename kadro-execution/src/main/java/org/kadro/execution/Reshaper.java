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
import java.util.TreeSet;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.Column;
import org.kadro.data.ColumnType;
import org.kadro.data.Table;
import org.kadro.data.TableFormatter;
import org.kadro.data.exception.ColumnTypeException;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.kadro.data.exception.UnknownColumnException;
import org.kadro.execution.exception.SpreadConflictException;
import org.kadro.util.ValueOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts tables between a wide and a long layout.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class Reshaper {
  private static final Logger logger = LoggerFactory.getLogger(Reshaper.class);

  /**
   * Turns a wide table into a long one.
   * 
   * <p>
   * All columns that are not kept are "value columns". For each value column and each row of the input, the result
   * contains one row: the values of the kept columns, the name of the value column in the key column and the cell
   * value in the value column. Rows are ordered by value column (in column order) first, then by input row.
   * 
   * @throws UnknownColumnException
   *           if a column to keep does not exist.
   * @throws ColumnTypeException
   *           if the value columns have types that cannot be held in a single column.
   * @throws DuplicateColumnNameException
   *           if the key or value column name equals a kept column or each other.
   */
  public Table gather(Table table, String keyColumnName, String valueColumnName, List<String> keepColumnNames)
      throws UnknownColumnException, ColumnTypeException, DuplicateColumnNameException {
    for (String keep : keepColumnNames)
      table.getColumn(keep);

    List<String> valueColumnNames = new ArrayList<>();
    for (String columnName : table.getColumnNames())
      if (!keepColumnNames.contains(columnName))
        valueColumnNames.add(columnName);

    ColumnType valueType = null;
    for (String columnName : valueColumnNames) {
      ColumnType type = table.getColumn(columnName).getType();
      try {
        valueType = (valueType == null) ? type : ColumnType.common(valueType, type);
      } catch (ColumnTypeException e) {
        throw new ColumnTypeException("Cannot gather columns of incompatible types: " + valueColumnNames,
            valueColumnNames);
      }
    }
    if (valueType == null)
      valueType = ColumnType.STRING;

    int inputRows = table.getRowCount();
    int[] keepRows = new int[inputRows * valueColumnNames.size()];
    List<String> keys = new ArrayList<>(keepRows.length);
    List<Object> values = new ArrayList<>(keepRows.length);
    int pos = 0;
    for (String columnName : valueColumnNames) {
      Column column = table.getColumn(columnName);
      for (int row = 0; row < inputRows; row++) {
        keepRows[pos++] = row;
        keys.add(columnName);
        values.add(column.get(row));
      }
    }

    Table.Builder res = Table.builder().withRowCount(keepRows.length);
    for (String keep : keepColumnNames)
      res.withColumn(keep, table.getColumn(keep).take(keepRows));
    res.withColumn(keyColumnName, ColumnType.STRING, keys);
    res.withColumn(valueColumnName, valueType, values);

    logger.trace("Gathered {} columns of {} rows.", valueColumnNames.size(), inputRows);
    return res.build();
  }

  /**
   * Turns a long table into a wide one, the inverse of {@link #gather(Table, String, String, List)}.
   * 
   * <p>
   * All columns but the key and value column are "identifier columns". The result contains one row per distinct
   * combination of identifier values, in order of first appearance, and one new column per distinct value of the key
   * column, sorted by that value. Missing keys result in a column named {@value TableFormatter#MISSING}. Cells for
   * which there is no input row are missing.
   * 
   * @throws UnknownColumnException
   *           if the key or value column does not exist.
   * @throws SpreadConflictException
   *           if there are multiple rows with the same identifier values and key.
   * @throws DuplicateColumnNameException
   *           if a new column has the name of an identifier column.
   */
  public Table spread(Table table, String keyColumnName, String valueColumnName)
      throws UnknownColumnException, SpreadConflictException, DuplicateColumnNameException {
    Column keyColumn = table.getColumn(keyColumnName);
    Column valueColumn = table.getColumn(valueColumnName);

    List<String> idColumnNames = new ArrayList<>();
    for (String columnName : table.getColumnNames())
      if (!columnName.equals(keyColumnName) && !columnName.equals(valueColumnName))
        idColumnNames.add(columnName);

    TreeSet<Object> sortedKeys = new TreeSet<>(ValueOrdering.VALUES);
    sortedKeys.addAll(keyColumn.getValues());
    List<Object> newColumnKeys = new ArrayList<>(sortedKeys);

    // first input row of each identifier tuple, by output row.
    Map<GroupKey, Integer> idToOutputRow = new LinkedHashMap<>();
    List<Integer> firstRows = new ArrayList<>();
    for (int row = 0; row < table.getRowCount(); row++) {
      GroupKey id = idOf(table, idColumnNames, row);
      if (!idToOutputRow.containsKey(id)) {
        idToOutputRow.put(id, firstRows.size());
        firstRows.add(row);
      }
    }

    Object[][] cells = new Object[newColumnKeys.size()][firstRows.size()];
    boolean[][] filled = new boolean[newColumnKeys.size()][firstRows.size()];
    for (int row = 0; row < table.getRowCount(); row++) {
      GroupKey id = idOf(table, idColumnNames, row);
      int outputRow = idToOutputRow.get(id);
      int newColumn = Collections.binarySearch(newColumnKeys, keyColumn.get(row), ValueOrdering.VALUES);
      if (filled[newColumn][outputRow])
        throw new SpreadConflictException("Multiple values for key '" + keyColumn.get(row) + "' and identifier "
            + id + " in column '" + valueColumnName + "'.", keyColumnName, valueColumnName);
      filled[newColumn][outputRow] = true;
      cells[newColumn][outputRow] = valueColumn.get(row);
    }

    int[] idRows = new int[firstRows.size()];
    for (int i = 0; i < idRows.length; i++)
      idRows[i] = firstRows.get(i);

    Table.Builder res = Table.builder().withRowCount(idRows.length);
    for (String idColumnName : idColumnNames)
      res.withColumn(idColumnName, table.getColumn(idColumnName).take(idRows));
    for (int c = 0; c < newColumnKeys.size(); c++) {
      Object key = newColumnKeys.get(c);
      List<Object> values = new ArrayList<>(idRows.length);
      Collections.addAll(values, cells[c]);
      res.withColumn((key == null) ? TableFormatter.MISSING : key.toString(), valueColumn.getType(), values);
    }

    logger.trace("Spread {} rows into {} rows and {} new columns.", table.getRowCount(), idRows.length,
        newColumnKeys.size());
    return res.build();
  }

  private GroupKey idOf(Table table, List<String> idColumnNames, int row) {
    Object[] values = new Object[idColumnNames.size()];
    for (int i = 0; i < values.length; i++)
      values[i] = table.getValue(idColumnNames.get(i), row);
    return new GroupKey(values);
  }
}
