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
package org.kadro.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * Number of threads that may compute the partitions of a grouped mutate or aggregate concurrently. A value of 1
   * makes all partition work run on the calling thread.
   */
  public static final String PARTITION_THREADS = "partitionThreads";

  /**
   * Minimum number of partitions an operation needs to have before its work is distributed to the partition threads.
   * Operations with fewer partitions are computed on the calling thread.
   */
  public static final String PARALLEL_PARTITION_THRESHOLD = "parallelPartitionThreshold";

  /**
   * Seed of the random source used when sampling rows. Leave empty for a different sequence on each run.
   */
  public static final String RANDOM_SEED = "randomSeed";

  /**
   * How <code>select</code> and <code>drop</code> treat columns the frame is currently grouped by. One of
   * <code>RETAIN</code> (grouping columns are kept silently) or <code>REJECT</code> (the call fails).
   */
  public static final String GROUP_COLUMN_POLICY = "groupColumnPolicy";

  /**
   * Number of rows rendered when a frame is converted to a String.
   */
  public static final String SHOW_ROWS = "showRows";
}
