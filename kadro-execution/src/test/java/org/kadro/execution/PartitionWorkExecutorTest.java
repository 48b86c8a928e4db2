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
import java.util.HashSet;
import java.util.List;

import org.kadro.data.Column;
import org.kadro.data.Table;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link PartitionWorkExecutor}.
 *
 * @author Bastian Gloeckle
 */
public class PartitionWorkExecutorTest {
  private AnnotationConfigApplicationContext dataContext;
  private PartitionWorkExecutor workExecutor;
  private List<Partition> partitions;

  @BeforeMethod
  public void setup() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.scan("org.kadro");
    dataContext.refresh();
    workExecutor = dataContext.getBean(PartitionWorkExecutor.class);

    List<Long> groups = new ArrayList<>();
    for (long i = 0; i < 20; i++)
      groups.add(i);
    Table table = Table.builder().withColumn("g", groups).build();
    partitions = dataContext.getBean(Partitioner.class).partition(table, GroupSpec.of("g"));
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void resultsInPartitionOrder() {
    // WHEN
    List<String> res = workExecutor.computeAll(partitions, p -> Thread.currentThread().getName());
    List<Long> keys = workExecutor.computeAll(partitions, p -> (Long) p.getKey().get(0));

    // THEN
    for (int i = 0; i < keys.size(); i++)
      Assert.assertEquals((long) keys.get(i), i, "Expected result of partition " + i);
    for (String threadName : res)
      Assert.assertTrue(threadName.startsWith("kadro-partition-"), "Expected work on partition threads");
  }

  @Test
  public void failureIsPropagatedUnwrapped() {
    IllegalStateException failure = new IllegalStateException("fail");
    try {
      // WHEN
      workExecutor.computeAll(partitions, p -> {
        if ((Long) p.getKey().get(0) == 7L)
          throw failure;
        return 1;
      });
      Assert.fail("Expected exception");
    } catch (IllegalStateException e) {
      // THEN
      Assert.assertSame(e, failure, "Expected original exception");
    }
  }

  @Test
  public void nestedWorkRunsOnCallingThread() {
    // WHEN
    List<List<String>> res = workExecutor.computeAll(partitions, p -> workExecutor
        .computeAll(Collections.nCopies(3, p), inner -> Thread.currentThread().getName()));

    // THEN
    for (List<String> inner : res)
      Assert.assertEquals(new HashSet<>(inner).size(), 1, "Expected nested work on a single thread");
  }
}
