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
package fr.aneo.skymap.offline.store;

import java.util.OptionalDouble;

/**
 * Host storage usage as reported by a {@link BlobStore}.
 *
 * @param usageBytes bytes currently used by the store
 * @param quotaBytes bytes the store may use in total
 */
public record StorageEstimate(long usageBytes, long quotaBytes) {

  public StorageEstimate {
    if (usageBytes < 0) throw new IllegalArgumentException("usageBytes must be >= 0, got: " + usageBytes);
    if (quotaBytes < 0) throw new IllegalArgumentException("quotaBytes must be >= 0, got: " + quotaBytes);
  }

  /**
   * @return usage as a fraction of the quota, empty when the quota is zero
   */
  public OptionalDouble usageRatio() {
    return quotaBytes == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) usageBytes / quotaBytes);
  }
}
