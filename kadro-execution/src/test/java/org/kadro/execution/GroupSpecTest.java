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

import org.kadro.data.Column;
import org.kadro.data.Table;
import org.kadro.execution.exception.InvalidGroupColumnException;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;

/**
 * Tests {@link GroupSpec}.
 *
 * @author Bastian Gloeckle
 */
public class GroupSpecTest {
  @Test
  public void duplicatesCollapseToFirstOccurrence() {
    // WHEN
    GroupSpec spec = GroupSpec.of("b", "a", "b");

    // THEN
    Assert.assertEquals(spec.getColumnNames(), Arrays.asList("b", "a"), "Expected duplicates removed");
    Assert.assertEquals(spec, GroupSpec.of("b", "a"), "Expected equal specs");
  }

  @Test
  public void emptyIsNotGrouped() {
    Assert.assertTrue(GroupSpec.of().isEmpty(), "Expected empty spec");
    Assert.assertEquals(GroupSpec.of(), GroupSpec.empty(), "Expected equal specs");
  }

  @Test
  public void renamed() {
    // GIVEN
    GroupSpec spec = GroupSpec.of("a", "b");

    // WHEN
    GroupSpec res = spec.renamed(ImmutableMap.of("b", "c"));

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("a", "c"), "Expected renamed column");
  }

  @Test(expectedExceptions = InvalidGroupColumnException.class)
  public void validateFailsOnMissingColumn() {
    GroupSpec.of("a").validate(Table.builder().withColumn("b", Column.ofLongs(1L)).build());
  }
}
