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

import fr.aneo.skymap.offline.exception.StorageException;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.StorageEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.aneo.skymap.offline.util.ByteSizes.format;
import static java.util.Objects.requireNonNull;

/**
 * Aggregates the usage of every registered {@link CacheStatsSource}. Read-only.
 */
public final class StorageUsageReporter {
  private static final Logger logger = LoggerFactory.getLogger(StorageUsageReporter.class);

  private final BlobStore store;
  private final List<CacheStatsSource> sources = new CopyOnWriteArrayList<>();

  public StorageUsageReporter(BlobStore store, List<? extends CacheStatsSource> sources) {
    this.store = requireNonNull(store, "store must not be null");
    this.sources.addAll(requireNonNull(sources, "sources must not be null"));
  }

  public void register(CacheStatsSource source) {
    sources.add(requireNonNull(source, "source must not be null"));
  }

  /**
   * Collects every source. A source that fails is logged and left out.
   */
  public AggregatedCacheStats collectCacheStats() {
    var subsystems = new ArrayList<CacheSubsystemStats>();
    for (var source : sources) {
      try {
        subsystems.add(source.collect());
      } catch (RuntimeException e) {
        logger.warn("Cannot collect stats of {}", source.name(), e);
      }
    }
    return AggregatedCacheStats.of(subsystems, storageEstimate());
  }

  /**
   * Renders a multi-line summary. An absent hit rate prints as {@code n/a}.
   */
  public static String formatCacheStats(AggregatedCacheStats stats) {
    requireNonNull(stats, "stats must not be null");

    var text = new StringBuilder();
    text.append("Cache: ").append(format(stats.totalBytes()))
        .append(" in ").append(stats.totalEntries()).append(" entries\n");
    text.append("Hit rate: ").append(formatRate(stats.hitRate()))
        .append(" (").append(stats.totalHits()).append(" hits, ")
        .append(stats.totalMisses()).append(" misses)\n");
    for (var subsystem : stats.subsystems()) {
      text.append("  ").append(subsystem.name()).append(": ")
          .append(format(subsystem.bytes())).append(", ")
          .append(subsystem.entries()).append(" entries, hit rate ")
          .append(formatRate(subsystem.hitRate())).append('\n');
      for (var partition : subsystem.partitions()) {
        text.append("    ").append(partition.name()).append(": ")
            .append(format(partition.bytes())).append(", ")
            .append(partition.entries()).append(" entries\n");
      }
    }
    stats.storage().ifPresent(estimate -> {
      text.append("Storage: ").append(format(estimate.usageBytes()))
          .append(" of ").append(format(estimate.quotaBytes()));
      estimate.usageRatio().ifPresent(ratio -> text.append(" (").append(percent(ratio)).append(')'));
      text.append('\n');
    });
    return text.toString();
  }

  private Optional<StorageEstimate> storageEstimate() {
    try {
      return store.estimate();
    } catch (StorageException e) {
      logger.warn("Cannot estimate storage usage", e);
      return Optional.empty();
    }
  }

  private static String formatRate(OptionalDouble rate) {
    return rate.isPresent() ? percent(rate.getAsDouble()) : "n/a";
  }

  private static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
  }
}
