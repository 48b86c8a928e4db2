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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link Partitioner}.
 *
 * @author Bastian Gloeckle
 */
public class PartitionerTest {
  private AnnotationConfigApplicationContext dataContext;
  private Partitioner partitioner;

  @BeforeMethod
  public void setup() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.scan("org.kadro");
    dataContext.refresh();
    partitioner = dataContext.getBean(Partitioner.class);
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void singleColumnSortedByKey() {
    // GIVEN
    Table table = Table.builder() //
        .withColumn("g", Column.ofStrings("b", "a", "b", "c", "a")) //
        .withColumn("v", Column.ofLongs(1L, 2L, 3L, 4L, 5L)) //
        .build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.of("g"));

    // THEN
    Assert.assertEquals(partitions.size(), 3, "Expected correct number of partitions");
    Assert.assertEquals(partitions.get(0).getKey().getValues(), Arrays.asList("a"), "Expected keys to be sorted");
    Assert.assertEquals(partitions.get(0).getRows(), new int[] { 1, 4 }, "Expected correct rows");
    Assert.assertEquals(partitions.get(1).getKey().getValues(), Arrays.asList("b"), "Expected keys to be sorted");
    Assert.assertEquals(partitions.get(1).getRows(), new int[] { 0, 2 }, "Expected correct rows");
    Assert.assertEquals(partitions.get(2).getKey().getValues(), Arrays.asList("c"), "Expected keys to be sorted");
    Assert.assertEquals(partitions.get(2).getRows(), new int[] { 3 }, "Expected correct rows");
  }

  @Test
  public void multipleColumnsCoverEachRowOnce() {
    // GIVEN
    Table table = Table.builder() //
        .withColumn("a", Column.ofLongs(2L, 1L, 2L, 1L, 2L, 1L)) //
        .withColumn("b", Column.ofStrings("x", "y", "x", "x", "y", "y")) //
        .build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.of("a", "b"));

    // THEN
    Assert.assertEquals(partitions.size(), 4, "Expected one partition per combination");
    Assert.assertEquals(partitions.get(0).getKey().getValues(), Arrays.asList(1L, "x"), "Expected correct key");
    Assert.assertEquals(partitions.get(1).getKey().getValues(), Arrays.asList(1L, "y"), "Expected correct key");
    Assert.assertEquals(partitions.get(1).getRows(), new int[] { 1, 5 }, "Expected correct rows");
    Assert.assertEquals(partitions.get(2).getKey().getValues(), Arrays.asList(2L, "x"), "Expected correct key");
    Assert.assertEquals(partitions.get(3).getKey().getValues(), Arrays.asList(2L, "y"), "Expected correct key");

    Set<Integer> seen = new HashSet<>();
    int total = 0;
    for (Partition partition : partitions)
      for (int row : partition.getRows()) {
        seen.add(row);
        total++;
      }
    Assert.assertEquals(total, 6, "Expected each row exactly once");
    Assert.assertEquals(seen.size(), 6, "Expected each row exactly once");
  }

  @Test
  public void missingAndNaNFormOwnGroups() {
    // GIVEN
    Table table = Table.builder() //
        .withColumn("g", Column.ofDoubles(null, 1., Double.NaN, null, Double.NaN, 1.)) //
        .build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.of("g"));

    // THEN
    Assert.assertEquals(partitions.size(), 3, "Expected groups for value, NaN and missing");
    Assert.assertEquals(partitions.get(0).getKey().get(0), 1., "Expected numbers first");
    Assert.assertEquals(partitions.get(1).getKey().get(0), Double.NaN, "Expected NaN after numbers");
    Assert.assertEquals(partitions.get(1).getRows(), new int[] { 2, 4 }, "Expected NaN rows collapsed");
    Assert.assertNull(partitions.get(2).getKey().get(0), "Expected missing group last");
    Assert.assertEquals(partitions.get(2).getRows(), new int[] { 0, 3 }, "Expected missing rows collapsed");
  }

  @Test
  public void negativeZeroEqualsZero() {
    // GIVEN
    Table table = Table.builder() //
        .withColumn("g", Column.ofDoubles(0., -0., 0.)) //
        .build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.of("g"));

    // THEN
    Assert.assertEquals(partitions.size(), 1, "Expected -0.0 and 0.0 to be grouped together");
    Assert.assertEquals(partitions.get(0).getKey().get(0), 0., "Expected key to be 0.0");
    Assert.assertEquals(partitions.get(0).getRows(), new int[] { 0, 1, 2 }, "Expected all rows in the group");
  }

  @Test
  public void emptyGroupSpecIsWholeTable() {
    // GIVEN
    Table table = Table.builder().withColumn("v", Column.ofLongs()).build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.empty());

    // THEN
    Assert.assertEquals(partitions.size(), 1, "Expected single partition even for empty table");
    Assert.assertEquals(partitions.get(0).getKey().size(), 0, "Expected empty key");
    Assert.assertSame(partitions.get(0).selectFrom(table), table, "Expected whole table not to be copied");
  }

  @Test
  public void groupedEmptyTableHasNoPartitions() {
    // GIVEN
    Table table = Table.builder().withColumn("g", Column.ofStrings()).build();

    // WHEN
    List<Partition> partitions = partitioner.partition(table, GroupSpec.of("g"));

    // THEN
    Assert.assertTrue(partitions.isEmpty(), "Expected no partitions");
  }

  @Test
  public void unknownGroupColumn() {
    // GIVEN
    Table table = Table.builder().withColumn("g", Column.ofStrings("a")).build();

    try {
      // WHEN
      partitioner.partition(table, GroupSpec.of("g", "x", "y"));
      Assert.fail("Expected exception");
    } catch (InvalidGroupColumnException e) {
      // THEN
      Assert.assertEquals(e.getColumnNames(), Arrays.asList("x", "y"), "Expected all unknown columns to be named");
    }
  }
}
