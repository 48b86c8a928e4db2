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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.kadro.data.ColumnType;
import org.kadro.data.Table;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests the {@link CsvLoader}.
 *
 * @author Bastian Gloeckle
 */
public class CsvLoaderTest {
  private static final String CSV_SIMPLE_CLASSPATH = "/CsvLoaderTestSimple.csv";

  private CsvLoader csvLoader;
  private LoaderColumnInfo colInfo;

  private AnnotationConfigApplicationContext dataContext;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.scan("org.kadro");
    dataContext.refresh();

    csvLoader = dataContext.getBean(CsvLoader.class);
    colInfo = new LoaderColumnInfo(ColumnType.STRING);
  }

  @AfterMethod
  public void shutDown() {
    dataContext.close();
  }

  @Test
  public void smallSimpleCsv() throws LoadException, IOException {
    // GIVEN
    // simple CSV with 4 columns, mapped to String, Long, Double and Boolean.
    colInfo.registerColumnType("colB", ColumnType.LONG) //
        .registerColumnType("colC", ColumnType.DOUBLE) //
        .registerColumnType("colD", ColumnType.BOOLEAN);

    // WHEN
    Table table;
    try (InputStream in = getClass().getResourceAsStream(CSV_SIMPLE_CLASSPATH)) {
      table = csvLoader.load(in, colInfo);
    }

    // THEN
    Assert.assertEquals(table.getRowCount(), 4, "Expected 4 rows");
    Assert.assertEquals(table.getColumnNames(), Arrays.asList("colA", "colB", "colC", "colD"),
        "Expected columns of header");
    Assert.assertEquals(table.getColumn("colA").getValues(), Arrays.asList("a", "b, quoted", null, "d"),
        "Expected correct string values");
    Assert.assertEquals(table.getColumn("colB").getValues(), Arrays.asList(1L, 2L, 3L, null),
        "Expected correct long values");
    Assert.assertEquals(table.getColumn("colC").getValues(), Arrays.asList(1.5, null, 2.25, -1.),
        "Expected correct double values");
    Assert.assertEquals(table.getColumn("colD").getValues(), Arrays.asList(true, false, null, true),
        "Expected correct boolean values");
  }

  @Test
  public void customTransformation() throws LoadException {
    // GIVEN
    colInfo.registerCustomTransformationFunc("colA", ColumnType.LONG, s -> (long) s.length());

    // WHEN
    Table table = csvLoader.load(new StringReader("colA\nabc\nx\n"), colInfo);

    // THEN
    Assert.assertEquals(table.getColumn("colA").asLongs(), Arrays.asList(3L, 1L), "Expected transformed values");
  }

  @Test
  public void loadFromFile() throws LoadException, IOException {
    // GIVEN
    File file = File.createTempFile("kadro-csv", ".csv");
    file.deleteOnExit();
    Files.write(file.toPath(), "x,y\n1,2\n".getBytes(StandardCharsets.UTF_8));

    // WHEN
    Table table = csvLoader.load(file.getAbsolutePath(), colInfo.registerColumnType("y", ColumnType.DOUBLE));

    // THEN
    Assert.assertEquals(table.getValue("x", 0), "1", "Expected default type string");
    Assert.assertEquals(table.getValue("y", 0), 2., "Expected registered type");
  }

  @Test(expectedExceptions = LoadException.class)
  public void unparsableNumber() throws LoadException {
    colInfo.registerColumnType("n", ColumnType.LONG);
    csvLoader.load(new StringReader("n\n1\nabc\n"), colInfo);
  }

  @Test(expectedExceptions = LoadException.class)
  public void wrongNumberOfValues() throws LoadException {
    csvLoader.load(new StringReader("a,b\n1,2\n3\n"), colInfo);
  }

  @Test(expectedExceptions = LoadException.class)
  public void missingHeader() throws LoadException {
    csvLoader.load(new StringReader(""), colInfo);
  }

  @Test(expectedExceptions = LoadException.class)
  public void missingFile() throws LoadException {
    csvLoader.load("/does/not/exist.csv", colInfo);
  }
}
