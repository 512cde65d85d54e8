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

import java.util.Collection;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Cache completeness of one layer, computed from the keys present in its partition.
 *
 * @param layerId             the layer
 * @param cachedFileCount     declared files present in the cache
 * @param totalFileCount      declared files
 * @param missingFiles        declared files absent from the cache, in declaration order
 * @param cachedBytesEstimate share of the layer size estimate corresponding to the cached files
 * @param totalBytesEstimate  size estimate of the whole layer
 */
public record CacheEntryStatus(
  String layerId,
  int cachedFileCount,
  int totalFileCount,
  List<String> missingFiles,
  long cachedBytesEstimate,
  long totalBytesEstimate
) {

  public CacheEntryStatus {
    requireNonNull(layerId, "layerId must not be null");
    missingFiles = List.copyOf(requireNonNull(missingFiles, "missingFiles must not be null"));
    if (cachedFileCount + missingFiles.size() != totalFileCount) {
      throw new IllegalArgumentException("cachedFileCount + missing files must equal totalFileCount for " + layerId);
    }
  }

  /**
   * Computes the status of {@code layer} given the keys of its partition.
   */
  public static CacheEntryStatus of(LayerDescriptor layer, Collection<String> presentKeys) {
    var present = Set.copyOf(presentKeys);
    var missing = layer.files().stream().filter(file -> !present.contains(layer.resolve(file))).toList();
    var total = layer.files().size();
    var cached = total - missing.size();
    var cachedBytes = Math.round((double) cached / total * layer.estimatedSizeBytes());
    return new CacheEntryStatus(layer.id(), cached, total, missing, cachedBytes, layer.estimatedSizeBytes());
  }

  public static CacheEntryStatus empty(LayerDescriptor layer) {
    return of(layer, List.of());
  }

  public boolean isComplete() {
    return missingFiles.isEmpty();
  }

  public boolean cached() {
    return isComplete();
  }
}
