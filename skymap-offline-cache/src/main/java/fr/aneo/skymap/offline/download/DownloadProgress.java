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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of a {@link DownloadTask}, as delivered to progress listeners.
 *
 * @param targetId               layer id or survey id
 * @param status                 status at snapshot time
 * @param totalUnits             number of files or tiles in the task
 * @param completedUnits         units stored (or already present) so far
 * @param failedUnits            units that could not be fetched or stored
 * @param totalBytesEstimate     estimated size of the whole task
 * @param completedBytesEstimate estimated size of the completed units
 * @param failureReason          why the task failed, {@code null} unless {@code status} is FAILED
 */
public record DownloadProgress(
  String targetId,
  DownloadStatus status,
  long totalUnits,
  long completedUnits,
  long failedUnits,
  long totalBytesEstimate,
  long completedBytesEstimate,
  String failureReason
) {

  public DownloadProgress {
    requireNonNull(targetId, "targetId must not be null");
    requireNonNull(status, "status must not be null");
  }

  /**
   * @return completed units as a percentage of the total, 100 for an empty task
   */
  public double percent() {
    return totalUnits == 0 ? 100.0 : completedUnits * 100.0 / totalUnits;
  }

  public Optional<String> failure() {
    return Optional.ofNullable(failureReason);
  }
}
