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
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

import javax.inject.Inject;

import org.kadro.config.Config;
import org.kadro.config.ConfigKey;
import org.kadro.context.AutoInstatiate;
import org.kadro.data.exception.KadroException;
import org.kadro.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a piece of work on each {@link Partition} of a table.
 * 
 * <p>
 * If there are at least {@link ConfigKey#PARALLEL_PARTITION_THRESHOLD} partitions and more than one partition thread
 * is configured, the partitions are computed concurrently on the partition thread pool of {@link ExecutorManager}.
 * Otherwise, and for work that is started from within a partition thread, they are computed on the calling thread.
 * 
 * <p>
 * In any case the results are returned in the order of the partitions. If the work fails on any partition, the
 * exception of the first failed partition (in partition order) is thrown and no result is returned.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class PartitionWorkExecutor {
  private static final Logger logger = LoggerFactory.getLogger(PartitionWorkExecutor.class);

  private static final ThreadLocal<Boolean> insidePartitionWork = ThreadLocal.withInitial(() -> false);

  @Inject
  private ExecutorManager executorManager;

  @Config(ConfigKey.PARALLEL_PARTITION_THRESHOLD)
  private int parallelPartitionThreshold;

  public <T> List<T> computeAll(List<Partition> partitions, Function<Partition, T> work) {
    if (partitions.size() < parallelPartitionThreshold || executorManager.getPartitionThreads() <= 1
        || insidePartitionWork.get()) {
      List<T> res = new ArrayList<>(partitions.size());
      for (Partition partition : partitions)
        res.add(work.apply(partition));
      return res;
    }

    logger.trace("Computing {} partitions concurrently.", partitions.size());
    ExecutorService executor = executorManager.getPartitionExecutor();
    List<Future<T>> futures = new ArrayList<>(partitions.size());
    for (Partition partition : partitions)
      futures.add(executor.submit(() -> {
        insidePartitionWork.set(true);
        try {
          return work.apply(partition);
        } finally {
          insidePartitionWork.set(false);
        }
      }));

    List<T> res = new ArrayList<>(partitions.size());
    try {
      for (Future<T> future : futures)
        res.add(future.get());
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException)
        throw (RuntimeException) cause;
      if (cause instanceof Error)
        throw (Error) cause;
      throw new KadroException("Computation of partition failed: " + cause.getMessage(),
          Collections.emptyList(), cause);
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new KadroException("Interrupted while waiting for partitions to be computed.", Collections.emptyList(),
          e);
    }
    return res;
  }

  private void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures)
      future.cancel(true);
  }
}
