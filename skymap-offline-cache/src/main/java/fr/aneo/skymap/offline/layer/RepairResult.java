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
package fr.aneo.skymap.offline.layer;

/**
 * Outcome of {@link LayerDownloadManager#verifyAndRepairLayer}.
 *
 * @param verified whether the layer is complete after the repair
 * @param repaired missing files fetched and stored
 * @param failed   missing files still absent
 */
public record RepairResult(boolean verified, int repaired, int failed) {

  public static final RepairResult ALREADY_COMPLETE = new RepairResult(true, 0, 0);

  public RepairResult {
    if (repaired < 0) throw new IllegalArgumentException("repaired must be >= 0, got: " + repaired);
    if (failed < 0) throw new IllegalArgumentException("failed must be >= 0, got: " + failed);
  }
}
