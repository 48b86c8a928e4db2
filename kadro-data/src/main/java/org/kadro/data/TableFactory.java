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

import org.kadro.context.AutoInstatiate;
import org.kadro.data.exception.ColumnLengthMismatchException;
import org.kadro.data.exception.ColumnTypeException;
import org.kadro.data.exception.DuplicateColumnNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link Table}s from external {@link TableSource}s.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class TableFactory {
  private static final Logger logger = LoggerFactory.getLogger(TableFactory.class);

  /**
   * Create a new table containing the data of the given source. The data is copied.
   * 
   * @throws ColumnLengthMismatchException
   *           if a column of the source does not have {@link TableSource#getRowCount()} values.
   * @throws ColumnTypeException
   *           if a value is not of the type of its column.
   * @throws DuplicateColumnNameException
   *           if the source contains a column name twice.
   */
  public Table createTable(TableSource source)
      throws ColumnLengthMismatchException, ColumnTypeException, DuplicateColumnNameException {
    Table.Builder builder = Table.builder().withRowCount(source.getRowCount());
    for (String columnName : source.getColumnNames()) {
      Column column = Column.of(source.getColumnType(columnName), source.getValues(columnName));
      if (column.size() != source.getRowCount())
        throw new ColumnLengthMismatchException("Column '" + columnName + "' of source has " + column.size()
            + " values, but source has " + source.getRowCount() + " rows.", columnName);
      builder.withColumn(columnName, column);
    }
    Table res = builder.build();
    logger.debug("Created table with {} rows and columns {}", res.getRowCount(), res.getColumnNames());
    return res;
  }
}
