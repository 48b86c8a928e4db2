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
package org.kadro.frame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.data.exception.UnknownColumnException;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.kadro.execution.exception.PartitionLengthMismatchException;
import org.kadro.execution.function.MutateFunction;
import org.kadro.execution.function.ReduceFunction;
import org.mockito.Mockito;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;

/**
 * Tests {@link Frame}.
 *
 * @author Bastian Gloeckle
 */
public class FrameTest {
  private AnnotationConfigApplicationContext dataContext;
  private FrameFactory frameFactory;

  /** {id:[1,1,2], x:[10,20,30]} */
  private Frame a;

  @BeforeMethod
  public void setup() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.scan("org.kadro");
    dataContext.refresh();
    frameFactory = dataContext.getBean(FrameFactory.class);

    a = frameFactory.createFrame(Table.builder() //
        .withColumn("id", Column.ofLongs(1L, 1L, 2L)) //
        .withColumn("x", Column.ofLongs(10L, 20L, 30L)) //
        .build());
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  private static double mean(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).average().getAsDouble();
  }

  @Test
  public void groupedMean() {
    // WHEN
    Frame res = a.groupBy("id").agg("m", t -> mean(t.getColumn("x").asDoubles()));

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("id", "m"), "Expected group and result column");
    Assert.assertEquals(res.getTable().getColumn("id").asLongs(), Arrays.asList(1L, 2L), "Expected sorted groups");
    Assert.assertEquals(res.getTable().getColumn("m").asDoubles(), Arrays.asList(15., 30.), "Expected means");
    Assert.assertTrue(res.getGroups().isEmpty(), "Expected grouping to be removed");
  }

  @Test
  public void leftJoinWithMissingMatch() {
    // GIVEN
    Frame left = frameFactory.createFrame(Table.builder() //
        .withColumn("id", Column.ofLongs(1L, 2L)) //
        .withColumn("v", Column.ofStrings("a", "b")) //
        .build());
    Frame right = frameFactory.createFrame(Table.builder() //
        .withColumn("id", Column.ofLongs(1L, 3L)) //
        .withColumn("w", Column.ofStrings("x", "y")) //
        .build());

    // WHEN
    Frame res = left.leftJoin(right, "id");

    // THEN
    Assert.assertEquals(res.getTable().getRow(0), ImmutableMap.of("id", 1L, "v", "a", "w", "x"), "Expected match");
    Map<String, Object> expected = new HashMap<>();
    expected.put("id", 2L);
    expected.put("v", "b");
    expected.put("w", null);
    Assert.assertEquals(res.getTable().getRow(1), expected, "Expected missing value for row without match");
    Assert.assertEquals(res.getRowCount(), 2, "Expected two rows");
  }

  @Test
  public void filterKeepsOrder() {
    // WHEN
    Frame res = a.filter(t -> t.getColumn("x").test(x -> (Long) x > 15));

    // THEN
    Assert.assertEquals(res.getTable().getColumn("id").asLongs(), Arrays.asList(1L, 2L), "Expected ids");
    Assert.assertEquals(res.getTable().getColumn("x").asLongs(), Arrays.asList(20L, 30L), "Expected values");
  }

  @Test
  public void groupedMutatePreservesRows() {
    // GIVEN
    Frame frame = randomFrame(new Random(1), 200, 7);
    MutateFunction rank = t -> {
      List<Object> res = new ArrayList<>();
      for (int i = 0; i < t.getRowCount(); i++)
        res.add((long) i);
      return res;
    };

    // WHEN
    Frame res = frame.groupBy("g").mutate("rank", rank);

    // THEN
    Assert.assertEquals(res.getRowCount(), frame.getRowCount(), "Expected same number of rows");
    Assert.assertEquals(res.getTable().getColumn("g"), frame.getTable().getColumn("g"), "Expected same row order");
    Assert.assertEquals(res.getTable().getColumn("v"), frame.getTable().getColumn("v"), "Expected same row order");
    Assert.assertEquals(res.getGroups(), Arrays.asList("g"), "Expected grouping to be kept");

    Map<Object, Long> expectedRank = new HashMap<>();
    for (int row = 0; row < res.getRowCount(); row++) {
      Object group = res.getTable().getValue("g", row);
      long expected = expectedRank.merge(group, 1L, Long::sum) - 1;
      Assert.assertEquals(res.getTable().getValue("rank", row), expected, "Expected rank within group at " + row);
    }
  }

  @Test
  public void singleGroupMutateEqualsUngrouped() {
    // GIVEN
    Frame frame = randomFrame(new Random(2), 50, 1);
    MutateFunction doubled = t -> t.getColumn("v").map(v -> (Long) v * 2);

    // WHEN
    Frame grouped = frame.groupBy("g").mutate("d", doubled);
    Frame ungrouped = frame.mutate("d", doubled);

    // THEN
    Assert.assertEquals(grouped.getTable().getColumn("d"), ungrouped.getTable().getColumn("d"),
        "Expected same result for a single group");
  }

  @Test
  public void aggregateHasOneSortedRowPerKey() {
    // GIVEN
    Frame frame = randomFrame(new Random(3), 300, 11);

    // WHEN
    Frame res = frame.groupBy("g").agg("n", t -> t.getRowCount());

    // THEN
    Set<Object> distinct = new HashSet<>(frame.getTable().getColumn("g").getValues());
    Assert.assertEquals(res.getRowCount(), distinct.size(), "Expected one row per distinct key");
    List<Long> keys = res.getTable().getColumn("g").asLongs();
    for (int i = 1; i < keys.size(); i++)
      Assert.assertTrue(keys.get(i - 1) < keys.get(i), "Expected ascending keys");
    long total = res.getTable().getColumn("n").asLongs().stream().mapToLong(Long::longValue).sum();
    Assert.assertEquals(total, 300L, "Expected all rows to be counted");
  }

  @Test
  public void reducerCalledOncePerGroup() {
    // GIVEN
    ReduceFunction reducer = Mockito.mock(ReduceFunction.class);
    Mockito.when(reducer.apply(Mockito.any())).thenReturn(1L);
    Frame frame = frameFactory.createFrame(Table.builder() //
        .withColumn("g", Column.ofStrings("a", "b", "c", "a")) //
        .build());

    // WHEN
    frame.groupBy("g").agg("r", reducer);

    // THEN
    Mockito.verify(reducer, Mockito.times(3)).apply(Mockito.any());
  }

  @Test
  public void joinCardinality() {
    // GIVEN
    Random random = new Random(4);
    Frame left = randomFrame(random, 40, 6);
    Frame right = randomFrame(random, 30, 8).rename(ImmutableMap.of("v", "w"));

    // WHEN
    Frame inner = left.innerJoin(right);
    Frame innerExplicit = left.innerJoin(right, "g");
    Frame leftJoined = left.leftJoin(right);

    // THEN
    Assert.assertEquals(inner, innerExplicit, "Expected auto detected key to equal explicit key");

    Map<Object, Integer> leftCounts = counts(left);
    Map<Object, Integer> rightCounts = counts(right);
    int expectedRows = 0;
    for (Map.Entry<Object, Integer> e : leftCounts.entrySet())
      expectedRows += e.getValue() * rightCounts.getOrDefault(e.getKey(), 0);
    Assert.assertEquals(inner.getRowCount(), expectedRows, "Expected product of matching group sizes");

    Set<Object> leftValues = new HashSet<>(left.getTable().getColumn("v").getValues());
    Set<Object> joinedValues = new HashSet<>(leftJoined.getTable().getColumn("v").getValues());
    Assert.assertEquals(joinedValues, leftValues, "Expected every left row to be contained");
    Assert.assertTrue(leftJoined.getRowCount() >= left.getRowCount(), "Expected every left row to be contained");
  }

  @Test
  public void selectRetainsGroupColumns() {
    // WHEN
    Frame res = a.groupBy("id").select("x");

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("id", "x"), "Expected grouping column to be retained");
    Assert.assertEquals(res.getGroups(), Arrays.asList("id"), "Expected grouping to be kept");
  }

  @Test(expectedExceptions = InvalidGroupColumnException.class)
  public void selectRejectsRemovingGroupColumns() {
    a.withGroupColumnPolicy(GroupColumnPolicy.REJECT).groupBy("id").select("x");
  }

  @Test
  public void dropRetainsGroupColumns() {
    // WHEN
    Frame res = a.groupBy("id").drop("id", "x");

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("id"), "Expected grouping column to be retained");
  }

  @Test(expectedExceptions = InvalidGroupColumnException.class)
  public void dropRejectsRemovingGroupColumns() {
    a.withGroupColumnPolicy(GroupColumnPolicy.REJECT).groupBy("id").drop("id");
  }

  @Test
  public void dropAndSelectWithoutGroups() {
    Assert.assertEquals(a.drop("id").getColumnNames(), Arrays.asList("x"), "Expected column to be dropped");
    Assert.assertEquals(a.select("x", "id").getColumnNames(), Arrays.asList("x", "id"), "Expected selected order");
  }

  @Test(expectedExceptions = UnknownColumnException.class)
  public void selectUnknownColumn() {
    a.select("nope");
  }

  @Test
  public void renameFollowsGroups() {
    // WHEN
    Frame renamed = a.groupBy("id").rename(ImmutableMap.of("id", "key"));
    Frame setNames = a.groupBy("x").setNames("first", "second");

    // THEN
    Assert.assertEquals(renamed.getColumnNames(), Arrays.asList("key", "x"), "Expected renamed column");
    Assert.assertEquals(renamed.getGroups(), Arrays.asList("key"), "Expected renamed group");
    Assert.assertEquals(setNames.getGroups(), Arrays.asList("second"), "Expected group renamed by position");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void setNamesWrongLength() {
    a.setNames("one");
  }

  @Test
  public void sortByGroupsFirst() {
    // GIVEN
    Frame frame = frameFactory.createFrame(Table.builder() //
        .withColumn("g", Column.ofStrings("b", "a", "b", "a")) //
        .withColumn("v", Column.ofLongs(1L, 2L, 3L, 4L)) //
        .build());

    // WHEN
    Frame res = frame.groupBy("g").sort(Arrays.asList("v"), false);

    // THEN
    Assert.assertEquals(res.getTable().getColumn("v").asLongs(), Arrays.asList(4L, 2L, 3L, 1L),
        "Expected ascending groups, descending values");
  }

  @Test
  public void gatherAndSpread() {
    // GIVEN
    Frame wide = frameFactory.createFrame(Table.builder() //
        .withColumn("id", Column.ofLongs(1L, 2L)) //
        .withColumn("x", Column.ofLongs(10L, 20L)) //
        .withColumn("y", Column.ofLongs(5L, 6L)) //
        .build());

    // WHEN
    Frame gathered = wide.groupBy("id").gather("k", "val", "id");
    Frame spread = gathered.spread("k", "val");

    // THEN
    Assert.assertTrue(gathered.getGroups().isEmpty(), "Expected grouping to be removed");
    Assert.assertEquals(gathered.getColumnNames(), Arrays.asList("id", "k", "val"), "Expected long layout");
    Assert.assertEquals(gathered.getRowCount(), 4, "Expected one row per row and gathered column");
    Assert.assertEquals(spread.getTable(), wide.getTable(), "Expected spread to restore the wide layout");
  }

  @Test
  public void rowSelections() {
    // GIVEN
    Frame grouped = a.groupBy("id");

    // THEN
    Assert.assertEquals(grouped.head(2).getTable().getColumn("x").asLongs(), Arrays.asList(10L, 20L), "head");
    Assert.assertEquals(grouped.tail(1).getTable().getColumn("x").asLongs(), Arrays.asList(30L), "tail");
    Assert.assertEquals(grouped.slice(2, 0).getTable().getColumn("x").asLongs(), Arrays.asList(30L, 10L), "slice");
    Assert.assertEquals(grouped.head().getRowCount(), 3, "Expected all rows if frame is smaller");
    Frame sample = grouped.sampleN(2);
    Assert.assertEquals(sample.getRowCount(), 2, "Expected sampled rows");
    Assert.assertEquals(sample.getGroups(), Arrays.asList("id"), "Expected grouping to be kept");
    Assert.assertEquals(grouped.sampleN(10, true).getRowCount(), 10, "Expected sampled rows");
  }

  @Test
  public void pipeRevalidatesGroups() {
    // WHEN
    Frame res = a.groupBy("id").pipe(t -> t.dropColumns(Arrays.asList("x")));

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("id"), "Expected piped table");
    try {
      a.groupBy("id").pipe(t -> t.dropColumns(Arrays.asList("id")));
      Assert.fail("Expected exception");
    } catch (InvalidGroupColumnException e) {
      Assert.assertEquals(e.getColumnNames(), Arrays.asList("id"), "Expected grouping column to be named");
    }
  }

  @Test
  public void failedOperationLeavesFrameUntouched() {
    // GIVEN
    Frame grouped = a.groupBy("id");

    // WHEN
    Assert.assertThrows(PartitionLengthMismatchException.class, () -> grouped.mutate("y", t -> Arrays.asList(1L)));

    // THEN
    Assert.assertEquals(grouped.getColumnNames(), Arrays.asList("id", "x"), "Expected frame to be unchanged");
  }

  @Test
  public void toStringShowsGroupsAndTopRows() {
    // GIVEN
    Frame frame = randomFrame(new Random(5), 10, 2).groupBy("g");

    // WHEN
    String res = frame.toString();

    // THEN
    Assert.assertTrue(res.contains("With groups [g]"), "Expected groups in: " + res);
    Assert.assertTrue(res.contains("only showing top 3 of 10 rows."), "Expected configured number of rows: " + res);
  }

  private Frame randomFrame(Random random, int rows, int groups) {
    List<Long> g = new ArrayList<>();
    List<Long> v = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      g.add((long) random.nextInt(groups));
      v.add((long) i);
    }
    return frameFactory.createFrame(Table.builder().withColumn("g", g).withColumn("v", v).build());
  }

  private Map<Object, Integer> counts(Frame frame) {
    Map<Object, Integer> res = new HashMap<>();
    for (Object value : frame.getTable().getColumn("g").getValues())
      res.merge(value, 1, Integer::sum);
    return res;
  }
}
