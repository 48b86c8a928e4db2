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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.kadro.data.Table;
import org.kadro.execution.exception.InvalidGroupColumnException;

import com.google.common.collect.ImmutableList;

/**
 * The ordered list of column names a table is grouped by. An empty {@link GroupSpec} means "not grouped".
 * 
 * <p>
 * If a column name is provided multiple times, only its first occurrence is used.
 *
 * @author Bastian Gloeckle
 */
public class GroupSpec {
  private static final GroupSpec EMPTY = new GroupSpec(ImmutableList.of());

  private final ImmutableList<String> columnNames;

  private GroupSpec(ImmutableList<String> columnNames) {
    this.columnNames = columnNames;
  }

  public static GroupSpec empty() {
    return EMPTY;
  }

  public static GroupSpec of(String... columnNames) {
    return of(Arrays.asList(columnNames));
  }

  public static GroupSpec of(List<String> columnNames) {
    if (columnNames.isEmpty())
      return EMPTY;
    return new GroupSpec(ImmutableList.copyOf(new LinkedHashSet<>(columnNames)));
  }

  public boolean isEmpty() {
    return columnNames.isEmpty();
  }

  public int size() {
    return columnNames.size();
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public boolean contains(String columnName) {
    return columnNames.contains(columnName);
  }

  /**
   * @throws InvalidGroupColumnException
   *           if any of the columns does not exist in the given table.
   */
  public void validate(Table table) throws InvalidGroupColumnException {
    List<String> missing = new ArrayList<>();
    for (String columnName : columnNames)
      if (!table.hasColumn(columnName))
        missing.add(columnName);
    if (!missing.isEmpty())
      throw new InvalidGroupColumnException(
          "Cannot group by columns that do not exist: " + missing + ". Available: " + table.getColumnNames(), missing);
  }

  /**
   * @param renames
   *          Map from old column name to new column name.
   * @return A {@link GroupSpec} that has the columns renamed.
   */
  public GroupSpec renamed(Map<String, String> renames) {
    List<String> res = new ArrayList<>();
    for (String columnName : columnNames)
      res.add(renames.getOrDefault(columnName, columnName));
    return of(res);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof GroupSpec) && columnNames.equals(((GroupSpec) obj).columnNames);
  }

  @Override
  public int hashCode() {
    return columnNames.hashCode();
  }

  @Override
  public String toString() {
    return columnNames.toString();
  }
}
