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
package org.kadro.util;

import java.util.Comparator;
import java.util.List;

import com.google.common.collect.Comparators;
import com.google.common.collect.Ordering;

/**
 * Orderings of cell values as they are held in table columns.
 * 
 * <p>
 * Values are ordered by their natural order, missing values (<code>null</code>) are ordered after all other values.
 * Doubles use {@link Double#compareTo(Double)}, which orders <code>NaN</code> after all other numbers, but still before
 * <code>null</code>.
 *
 * @author Bastian Gloeckle
 */
public class ValueOrdering {
  /**
   * Natural order of single values, <code>null</code> last.
   */
  public static final Ordering<Object> VALUES = new Ordering<Object>() {
    @SuppressWarnings({ "unchecked", "rawtypes" })
    @Override
    public int compare(Object left, Object right) {
      return ((Comparable) left).compareTo(right);
    }
  }.nullsLast();

  /**
   * Lexicographical order of value tuples, each position ordered by {@link #VALUES}.
   */
  public static final Comparator<Iterable<Object>> TUPLES = Comparators.lexicographical(VALUES);

  private ValueOrdering() {
  }

  /**
   * Compare two tuples of equal length, position by position, with a sort direction per position. <code>NaN</code> and
   * <code>null</code> values are ordered last regardless of the direction, <code>NaN</code> before <code>null</code>.
   */
  public static int compareTuples(List<Object> left, List<Object> right, List<Boolean> ascending) {
    for (int i = 0; i < left.size(); i++) {
      Object l = left.get(i);
      Object r = right.get(i);
      int res = VALUES.compare(l, r);
      if (res == 0)
        continue;
      if (isOrderedLast(l) || isOrderedLast(r))
        return res;
      return ascending.get(i) ? res : -res;
    }
    return 0;
  }

  private static boolean isOrderedLast(Object value) {
    return value == null || (value instanceof Double && ((Double) value).isNaN());
  }
}
