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
import java.util.Collections;
import java.util.List;

import org.kadro.util.ValueOrdering;

/**
 * The values of a single row in a set of key columns.
 * 
 * <p>
 * Keys are equal if all their values are equal. Missing values (<code>null</code>) are equal to each other, so are
 * <code>NaN</code> doubles. <code>-0.0</code> is held as <code>0.0</code>. Keys are ordered lexicographically, see
 * {@link ValueOrdering#TUPLES}.
 *
 * @author Bastian Gloeckle
 */
public class GroupKey implements Comparable<GroupKey> {
  private static final GroupKey EMPTY = new GroupKey(new Object[0]);

  private final List<Object> values;

  /* package */ GroupKey(Object[] values) {
    Object[] keyValues = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      keyValues[i] = keyValue(values[i]);
    this.values = Collections.unmodifiableList(Arrays.asList(keyValues));
  }

  /**
   * @return The value as it is held in a key: <code>-0.0</code> is replaced by <code>0.0</code>, as both are equal
   *         numerically. All other values are returned unchanged.
   */
  /* package */ static Object keyValue(Object value) {
    if (value instanceof Double && ((Double) value).doubleValue() == 0.)
      return 0.;
    return value;
  }

  public static GroupKey empty() {
    return EMPTY;
  }

  public List<Object> getValues() {
    return values;
  }

  public Object get(int idx) {
    return values.get(idx);
  }

  public int size() {
    return values.size();
  }

  @Override
  public int compareTo(GroupKey o) {
    return ValueOrdering.TUPLES.compare(values, o.values);
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof GroupKey) && values.equals(((GroupKey) obj).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
