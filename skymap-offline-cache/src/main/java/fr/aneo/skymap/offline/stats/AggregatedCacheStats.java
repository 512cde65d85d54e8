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
package fr.aneo.skymap.offline.stats;

import fr.aneo.skymap.offline.store.StorageEstimate;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static java.util.Objects.requireNonNull;

/**
 * Usage of the whole cache, summed over every subsystem.
 *
 * @param totalBytes   stored bytes
 * @param totalEntries stored entries
 * @param totalHits    lookups served from a cache
 * @param totalMisses  lookups not found
 * @param hitRate      {@code hits / (hits + misses)}, empty when there was no lookup at all
 * @param subsystems   per-subsystem details
 * @param storage      host storage usage and quota, when known
 */
public record AggregatedCacheStats(
  long totalBytes,
  long totalEntries,
  long totalHits,
  long totalMisses,
  OptionalDouble hitRate,
  List<CacheSubsystemStats> subsystems,
  Optional<StorageEstimate> storage
) {

  public AggregatedCacheStats {
    requireNonNull(hitRate, "hitRate must not be null");
    requireNonNull(storage, "storage must not be null");
    subsystems = List.copyOf(requireNonNull(subsystems, "subsystems must not be null"));
  }

  public static AggregatedCacheStats of(List<CacheSubsystemStats> subsystems, Optional<StorageEstimate> storage) {
    long bytes = 0;
    long entries = 0;
    long hits = 0;
    long misses = 0;
    for (var subsystem : subsystems) {
      bytes += subsystem.bytes();
      entries += subsystem.entries();
      hits += subsystem.hits();
      misses += subsystem.misses();
    }
    return new AggregatedCacheStats(bytes, entries, hits, misses, HitRates.of(hits, misses), subsystems, storage);
  }
}
