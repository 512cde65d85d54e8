/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.skymap.offline.util;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static java.lang.Runtime.getRuntime;

public final class ExecutorProvider {
  private static final Executor EXECUTOR = createDefault();

  private ExecutorProvider() {
  }

  /**
   * Returns the shared, daemon {@link Executor} running layer and survey downloads.
   * <p>
   * A download task spends most of its time waiting on network futures, so the pool is created in
   * async mode and its threads are daemons: a pending download never keeps the JVM alive.
   *
   * @return the default shared executor
   */
  public static Executor defaultExecutor() {
    return EXECUTOR;
  }

  private static Executor createDefault() {
    int cores = Math.max(2, getRuntime().availableProcessors());
    var factory = (ForkJoinPool.ForkJoinWorkerThreadFactory) pool -> {
      var workerThread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
      workerThread.setName("Skymap-Offline" + "-" + workerThread.getPoolIndex());
      workerThread.setDaemon(true);
      return workerThread;
    };
    return new ForkJoinPool(cores, factory, null, true);
  }
}
