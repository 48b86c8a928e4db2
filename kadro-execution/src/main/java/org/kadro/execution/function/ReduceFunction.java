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
package org.kadro.execution.function;

import org.kadro.data.Table;

/**
 * Reduces the rows of one partition of a table (or the full table, if it is not grouped) to a single value.
 * 
 * <p>
 * The returned value has to be a {@link Long}, {@link Double}, {@link String}, {@link Boolean} (or any other type
 * accepted by {@link org.kadro.data.ColumnType#forValue(Object)}) or <code>null</code>.
 *
 * @author Bastian Gloeckle
 */
@FunctionalInterface
public interface ReduceFunction {
  public Object apply(Table partition);
}
