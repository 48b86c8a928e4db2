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

import java.util.Arrays;
import java.util.List;

import org.kadro.data.exception.ColumnTypeException;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Column} and {@link ColumnType}.
 *
 * @author Bastian Gloeckle
 */
public class ColumnTest {
  @Test
  public void integralValuesNormalizedToLong() {
    // GIVEN
    List<Object> values = Arrays.asList(1, (short) 2, 3L, null);

    // WHEN
    Column column = Column.fromValues(values);

    // THEN
    Assert.assertEquals(column.getType(), ColumnType.LONG, "Expected LONG column");
    Assert.assertEquals(column.asLongs(), Arrays.asList(1L, 2L, 3L, null), "Expected normalized values");
  }

  @Test
  public void mixedNumbersWidenToDouble() {
    // GIVEN
    List<Object> values = Arrays.asList(1L, 2.5, 3f);

    // WHEN
    Column column = Column.fromValues(values);

    // THEN
    Assert.assertEquals(column.getType(), ColumnType.DOUBLE, "Expected DOUBLE column");
    Assert.assertEquals(column.getValues(), Arrays.asList(1., 2.5, 3.), "Expected values converted to double");
  }

  @Test
  public void allMissingIsString() {
    // WHEN
    Column column = Column.fromValues(Arrays.asList(null, null));

    // THEN
    Assert.assertEquals(column.getType(), ColumnType.STRING, "Expected STRING for all-missing column");
    Assert.assertEquals(column.size(), 2, "Expected correct size");
  }

  @Test(expectedExceptions = ColumnTypeException.class)
  public void mixedTypesRejected() {
    // WHEN
    Column.fromValues(Arrays.asList(1L, "a"));

    // THEN: exception
  }

  @Test(expectedExceptions = ColumnTypeException.class)
  public void unsupportedValueRejected() {
    // WHEN
    Column.fromValues(Arrays.asList(new Object()));

    // THEN: exception
  }

  @Test(expectedExceptions = ColumnTypeException.class)
  public void stringsAreNotLongs() {
    // WHEN
    Column.ofStrings("a").asLongs();

    // THEN: exception
  }

  @Test
  public void longsReadableAsDoubles() {
    // WHEN
    List<Double> res = Column.ofLongs(1L, null, 3L).asDoubles();

    // THEN
    Assert.assertEquals(res, Arrays.asList(1., null, 3.), "Expected doubles");
  }

  @Test
  public void takeWithMissingRows() {
    // GIVEN
    Column column = Column.ofStrings("a", "b", "c");

    // WHEN
    Column res = column.take(new int[] { 2, -1, 0, 2 });

    // THEN
    Assert.assertEquals(res, Column.ofStrings("c", null, "a", "c"), "Expected gathered values");
    Assert.assertEquals(column, Column.ofStrings("a", "b", "c"), "Expected source column to be unchanged");
  }

  @Test
  public void testSkipsMissingValues() {
    // GIVEN
    Column column = Column.ofLongs(10L, null, 30L);

    // WHEN
    List<Boolean> res = column.test(v -> (Long) v > 15);

    // THEN
    Assert.assertEquals(res, Arrays.asList(false, false, true), "Expected missing value not to match");
  }

  @Test
  public void mapKeepsOrder() {
    // WHEN
    List<Object> res = Column.ofLongs(1L, 2L).map(v -> "x" + v);

    // THEN
    Assert.assertEquals(res, Arrays.asList("x1", "x2"), "Expected mapped values");
  }
}
