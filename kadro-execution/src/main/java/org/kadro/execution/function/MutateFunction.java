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

import java.util.List;

import org.kadro.data.Table;

/**
 * Calculates the values of a column.
 * 
 * <p>
 * The function receives the rows of one partition of a table (or the full table, if it is not grouped) and has to
 * return exactly one value per row, in the row order of the received table.
 *
 * @author Bastian Gloeckle
 */
@FunctionalInterface
public interface MutateFunction {
  public List<?> apply(Table partition);
}
