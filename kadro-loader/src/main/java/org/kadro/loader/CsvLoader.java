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
package org.kadro.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import javax.inject.Inject;

import org.kadro.context.AutoInstatiate;
import org.kadro.data.ColumnType;
import org.kadro.data.Table;
import org.kadro.data.TableFactory;
import org.kadro.data.TableSource;
import org.kadro.data.exception.KadroException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

/**
 * Simple CSV loader.
 * 
 * <p>
 * The first line of the CSV is the header containing the column names. All following lines are rows, each with one
 * value per column. Empty values are loaded as missing values. The types of the columns are defined by a
 * {@link LoaderColumnInfo}.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class CsvLoader {
  private static final Logger logger = LoggerFactory.getLogger(CsvLoader.class);

  @Inject
  private TableFactory tableFactory;

  /**
   * Load a CSV file (UTF-8) into a {@link Table}.
   * 
   * @throws LoadException
   *           If data cannot be loaded.
   */
  public Table load(String filename, LoaderColumnInfo columnInfo) throws LoadException {
    logger.info("Reading data for new table from '{}'.", filename);
    try (Reader reader = Files.newBufferedReader(Paths.get(filename), StandardCharsets.UTF_8)) {
      return load(reader, columnInfo);
    } catch (IOException e) {
      throw new LoadException("Could not load " + filename, e);
    }
  }

  /**
   * Load CSV data (UTF-8) from a stream into a {@link Table}. The stream is not closed.
   * 
   * @throws LoadException
   *           If data cannot be loaded.
   */
  public Table load(InputStream csvStream, LoaderColumnInfo columnInfo) throws LoadException {
    return load(new InputStreamReader(csvStream, StandardCharsets.UTF_8), columnInfo);
  }

  /**
   * Load CSV data from a {@link Reader} into a {@link Table}. The reader is not closed.
   * 
   * @throws LoadException
   *           If data cannot be loaded.
   */
  public Table load(Reader csvReader, LoaderColumnInfo columnInfo) throws LoadException {
    CsvTableSource source = readColumnData(new CSVReaderBuilder(csvReader).build(), columnInfo);
    logger.info("Read {} rows of columns {}, creating table.", source.getRowCount(), source.getColumnNames());
    try {
      return tableFactory.createTable(source);
    } catch (KadroException e) {
      throw new LoadException("Could not create table from CSV: " + e.getMessage(), e);
    }
  }

  private CsvTableSource readColumnData(CSVReader reader, LoaderColumnInfo columnInfo) throws LoadException {
    try {
      String[] header = reader.readNext();
      if (header == null)
        throw new LoadException("Could not identify CSV header.");

      Set<String> seen = new HashSet<>();
      for (String columnName : header)
        if (!seen.add(columnName))
          throw new LoadException("CSV header contains column '" + columnName + "' multiple times.");

      logger.debug("CSV contains {} columns: {}", header.length, Arrays.toString(header));

      List<Function<String, Object>> transformFuncs = new ArrayList<>();
      Map<String, List<Object>> values = new LinkedHashMap<>();
      for (String columnName : header) {
        transformFuncs.add(columnInfo.getFinalTransformFunc(columnName));
        values.put(columnName, new ArrayList<>());
      }
      List<List<Object>> columnValues = new ArrayList<>(values.values());

      int rowCount = 0;
      String[] line;
      while ((line = reader.readNext()) != null) {
        if (line.length == 1 && line[0].isEmpty())
          // ignore empty lines
          continue;
        long lineNumber = reader.getLinesRead();
        if (line.length != header.length)
          throw new LoadException(
              "Line " + lineNumber + " has " + line.length + " values, but header has " + header.length + ".");

        for (int col = 0; col < header.length; col++)
          columnValues.get(col).add(transform(line[col], transformFuncs.get(col), header[col], lineNumber));
        rowCount++;
      }

      Map<String, ColumnType> types = new LinkedHashMap<>();
      for (String columnName : header)
        types.put(columnName, columnInfo.getFinalColumnType(columnName));
      return new CsvTableSource(types, values, rowCount);
    } catch (IOException | CsvValidationException e) {
      throw new LoadException("Could not parse CSV.", e);
    }
  }

  private Object transform(String value, Function<String, Object> transformFunc, String columnName,
      long lineNumber) throws LoadException {
    if (value.isEmpty())
      return null;
    try {
      return transformFunc.apply(value);
    } catch (IllegalArgumentException e) {
      throw new LoadException(
          "Could not parse value '" + value + "' of column '" + columnName + "' in line " + lineNumber + ".", e);
    }
  }

  /**
   * {@link TableSource} on the parsed values of a CSV.
   */
  private static class CsvTableSource implements TableSource {
    private Map<String, ColumnType> types;
    private Map<String, List<Object>> values;
    private int rowCount;

    public CsvTableSource(Map<String, ColumnType> types, Map<String, List<Object>> values, int rowCount) {
      this.types = types;
      this.values = values;
      this.rowCount = rowCount;
    }

    @Override
    public List<String> getColumnNames() {
      return new ArrayList<>(types.keySet());
    }

    @Override
    public ColumnType getColumnType(String columnName) {
      return types.get(columnName);
    }

    @Override
    public List<?> getValues(String columnName) {
      return values.get(columnName);
    }

    @Override
    public int getRowCount() {
      return rowCount;
    }
  }
}
