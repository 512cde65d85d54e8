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

import fr.aneo.skymap.offline.network.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Mutable state of one running download, owned by the manager that created it.
 * <p>
 * Counters only grow. Terminal transitions are applied once; later ones are ignored, so a task
 * cancelled while its last unit was being stored stays {@code CANCELLED}.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe; listeners receive {@link DownloadProgress} snapshots, never the task.
 * </p>
 */
public final class DownloadTask {
  private static final Logger logger = LoggerFactory.getLogger(DownloadTask.class);

  private final String targetId;
  private final long totalUnits;
  private final long totalBytesEstimate;
  private final CancellationToken token = new CancellationToken();
  private final DownloadProgressListener listener;

  private long completedUnits;
  private long failedUnits;
  private DownloadStatus status = DownloadStatus.PENDING;
  private String failureReason;

  public DownloadTask(String targetId, long totalUnits, long totalBytesEstimate, DownloadProgressListener listener) {
    this.targetId = requireNonNull(targetId, "targetId must not be null");
    this.listener = requireNonNull(listener, "listener must not be null");
    if (totalUnits < 0) throw new IllegalArgumentException("totalUnits must be >= 0, got: " + totalUnits);
    if (totalBytesEstimate < 0) throw new IllegalArgumentException("totalBytesEstimate must be >= 0, got: " + totalBytesEstimate);
    this.totalUnits = totalUnits;
    this.totalBytesEstimate = totalBytesEstimate;
  }

  public String targetId() {
    return targetId;
  }

  public CancellationToken token() {
    return token;
  }

  public synchronized DownloadStatus status() {
    return status;
  }

  public synchronized long completedUnits() {
    return completedUnits;
  }

  public synchronized long failedUnits() {
    return failedUnits;
  }

  public synchronized void start() {
    if (status == DownloadStatus.PENDING) status = DownloadStatus.DOWNLOADING;
  }

  public void recordCompleted() {
    synchronized (this) {
      completedUnits++;
    }
    publish();
  }

  public void recordFailed() {
    synchronized (this) {
      failedUnits++;
    }
    publish();
  }

  public void complete() {
    finish(DownloadStatus.COMPLETED, null);
  }

  public void fail(String reason) {
    finish(DownloadStatus.FAILED, requireNonNull(reason, "reason must not be null"));
  }

  /**
   * Cancels the token and marks the task {@code CANCELLED} unless it already ended.
   *
   * @return {@code true} if this call cancelled the task, {@code false} if it already was
   */
  public boolean cancel() {
    var first = token.cancel();
    finish(DownloadStatus.CANCELLED, null);
    return first;
  }

  public synchronized DownloadProgress snapshot() {
    var completedBytes = totalUnits == 0
      ? totalBytesEstimate
      : Math.round((double) completedUnits / totalUnits * totalBytesEstimate);
    return new DownloadProgress(targetId, status, totalUnits, completedUnits, failedUnits,
      totalBytesEstimate, completedBytes, failureReason);
  }

  private void finish(DownloadStatus terminal, String reason) {
    synchronized (this) {
      if (status.isTerminal()) return;
      status = terminal;
      failureReason = reason;
    }
    publish();
  }

  private void publish() {
    var progress = snapshot();
    try {
      listener.onProgress(progress);
    } catch (RuntimeException e) {
      logger.warn("Progress listener failed for {}", targetId, e);
    }
  }
}
