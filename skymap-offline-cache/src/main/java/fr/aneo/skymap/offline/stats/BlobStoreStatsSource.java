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

import fr.aneo.skymap.offline.store.BlobStore;

import java.util.List;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Reports the partitions of a {@link BlobStore} selected by a name predicate, together with the hit
 * and miss counters of the subsystem owning them.
 */
public final class BlobStoreStatsSource implements CacheStatsSource {
  private final String name;
  private final BlobStore store;
  private final Predicate<String> partitionFilter;
  private final CacheCounters counters;

  public BlobStoreStatsSource(String name, BlobStore store, Predicate<String> partitionFilter, CacheCounters counters) {
    this.name = requireNonNull(name, "name must not be null");
    this.store = requireNonNull(store, "store must not be null");
    this.partitionFilter = requireNonNull(partitionFilter, "partitionFilter must not be null");
    this.counters = requireNonNull(counters, "counters must not be null");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public CacheSubsystemStats collect() {
    if (!store.isAvailable()) {
      return new CacheSubsystemStats(name, 0, 0, counters.hits(), counters.misses(), List.of());
    }

    var partitions = store.listPartitions().stream()
                          .filter(partitionFilter)
                          .map(partition -> new PartitionStats(partition, store.listKeys(partition).size(), store.sizeOf(partition)))
                          .toList();
    var entries = partitions.stream().mapToLong(PartitionStats::entries).sum();
    var bytes = partitions.stream().mapToLong(PartitionStats::bytes).sum();
    return new CacheSubsystemStats(name, entries, bytes, counters.hits(), counters.misses(), partitions);
  }
}
