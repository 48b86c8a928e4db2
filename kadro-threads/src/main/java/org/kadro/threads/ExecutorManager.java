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
package org.kadro.threads;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import javax.annotation.PreDestroy;

import org.kadro.config.Config;
import org.kadro.config.ConfigKey;
import org.kadro.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Manages {@link ExecutorService}s for kadro.
 * 
 * <p>
 * All threads created by this manager are daemon threads, so a program that simply drops its frames does not need to
 * shut anything down. The executors are nevertheless shut down when the context is closed.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ExecutorManager {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorManager.class);

  private static final String PARTITION_THREAD_NAME_FORMAT = "kadro-partition-%d";

  @Config(ConfigKey.PARTITION_THREADS)
  private int partitionThreads;

  private ExecutorService partitionExecutor;

  /**
   * @return Number of threads that is available to compute partitions concurrently.
   */
  public int getPartitionThreads() {
    return partitionThreads;
  }

  /**
   * Returns the shared thread pool partition work can be submitted to. The pool is created on first use and contains
   * {@link ConfigKey#PARTITION_THREADS} threads.
   * 
   * <p>
   * Work that is submitted to the returned executor must not itself wait for other work on the same executor.
   */
  public synchronized ExecutorService getPartitionExecutor() {
    if (partitionExecutor == null) {
      logger.debug("Creating partition thread pool with {} threads.", partitionThreads);
      partitionExecutor = newFixedThreadPool(partitionThreads, PARTITION_THREAD_NAME_FORMAT,
          (t, e) -> logger.error("Uncaught exception in partition thread {}", t.getName(), e));
    }
    return partitionExecutor;
  }

  /**
   * Create a new thread pool with a fixed set of daemon threads, see {@link Executors#newFixedThreadPool(int)}.
   * 
   * @param numberOfThreads
   *          Number of threads the thread pool should have.
   * @param nameFormat
   *          a {@link String#format(String, Object...)}-compatible format String, to which a unique integer (0, 1,
   *          etc.) will be supplied as the single parameter. For example, {@code "rpc-pool-%d"} will generate thread
   *          names like {@code "rpc-pool-0"}, {@code "rpc-pool-1"}, {@code "rpc-pool-2"}, etc.
   * @param uncaughtExceptionHandler
   *          This will be called in case any of the threads of the ExecutorService ends because an exception was
   *          thrown.
   * @return The new thread pool.
   */
  public ExecutorService newFixedThreadPool(int numberOfThreads, String nameFormat,
      UncaughtExceptionHandler uncaughtExceptionHandler) {
    ThreadFactoryBuilder threadFactoryBuilder = new ThreadFactoryBuilder();
    threadFactoryBuilder.setNameFormat(nameFormat);
    threadFactoryBuilder.setDaemon(true);
    threadFactoryBuilder.setUncaughtExceptionHandler(uncaughtExceptionHandler);
    return Executors.newFixedThreadPool(numberOfThreads, threadFactoryBuilder.build());
  }

  @PreDestroy
  public synchronized void cleanup() {
    if (partitionExecutor == null)
      return;

    List<Runnable> notExecuted = partitionExecutor.shutdownNow();
    if (!notExecuted.isEmpty())
      logger.warn("Shut down partition thread pool, {} tasks were not executed.", notExecuted.size());
    try {
      if (!partitionExecutor.awaitTermination(1, TimeUnit.SECONDS))
        logger.warn("Partition thread pool did not terminate in time.");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    partitionExecutor = null;
  }
}
