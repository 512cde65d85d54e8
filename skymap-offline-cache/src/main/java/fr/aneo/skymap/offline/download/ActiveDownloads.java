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
package fr.aneo.skymap.offline.download;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Registry of in-flight tasks, keyed by target id, enforcing at most one task per target.
 * <p>
 * A task is registered until {@link #release(DownloadTask)}, cancelled or not.
 */
public final class ActiveDownloads {
  private final Map<String, DownloadTask> tasks = new ConcurrentHashMap<>();

  /**
   * @return {@code true} if {@code task} was registered, {@code false} if a task for the same target
   * is already running
   */
  public boolean tryRegister(DownloadTask task) {
    requireNonNull(task, "task must not be null");
    return tasks.putIfAbsent(task.targetId(), task) == null;
  }

  /**
   * Removes {@code task} if it is still the registered one for its target.
   */
  public void release(DownloadTask task) {
    tasks.remove(task.targetId(), task);
  }

  public boolean isActive(String targetId) {
    return tasks.containsKey(targetId);
  }

  /**
   * Cancels the task of {@code targetId}. The task stays registered until its owner calls
   * {@link #release(DownloadTask)}, so no new task for the same target starts while it winds down.
   *
   * @return {@code true} if a running task was cancelled by this call
   */
  public boolean cancel(String targetId) {
    var task = tasks.get(targetId);
    return task != null && task.cancel();
  }

  /**
   * @return number of tasks cancelled
   */
  public int cancelAll() {
    var cancelled = 0;
    for (var targetId : List.copyOf(tasks.keySet())) {
      if (cancel(targetId)) cancelled++;
    }
    return cancelled;
  }

  public List<DownloadProgress> snapshot() {
    return tasks.values().stream().map(DownloadTask::snapshot).toList();
  }
}
