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

import java.util.List;
import java.util.OptionalDouble;

import static java.util.Objects.requireNonNull;

/**
 * Usage of one cache subsystem.
 *
 * @param name       subsystem name, e.g. {@code layers}
 * @param entries    stored entries
 * @param bytes      stored bytes, 0 when the subsystem cannot tell
 * @param hits       lookups served from the cache
 * @param misses     lookups not found in the cache
 * @param partitions per-partition breakdown, empty for subsystems without partitions
 */
public record CacheSubsystemStats(String name, long entries, long bytes, long hits, long misses, List<PartitionStats> partitions) {

  public CacheSubsystemStats {
    requireNonNull(name, "name must not be null");
    partitions = List.copyOf(requireNonNull(partitions, "partitions must not be null"));
  }

  public OptionalDouble hitRate() {
    return HitRates.of(hits, misses);
  }
}
