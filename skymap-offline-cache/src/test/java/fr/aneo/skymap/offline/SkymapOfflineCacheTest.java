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
package fr.aneo.skymap.offline;

import fr.aneo.skymap.offline.download.DownloadProgressListener;
import fr.aneo.skymap.offline.migration.CacheVersionMigrator;
import fr.aneo.skymap.offline.stats.CacheSubsystemStats;
import fr.aneo.skymap.offline.store.InMemoryBlobStore;
import fr.aneo.skymap.offline.store.InMemoryMetadataSlot;
import fr.aneo.skymap.offline.testutils.FakeResourceFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static fr.aneo.skymap.offline.testutils.TestDataFactory.BASE;
import static fr.aneo.skymap.offline.testutils.TestDataFactory.DIRECT;
import static fr.aneo.skymap.offline.testutils.TestDataFactory.registry;
import static fr.aneo.skymap.offline.testutils.TestDataFactory.survey;
import static org.assertj.core.api.Assertions.assertThat;

class SkymapOfflineCacheTest {
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private InMemoryBlobStore store;
  private InMemoryMetadataSlot metadata;
  private FakeResourceFetcher fetcher;
  private AtomicBoolean online;
  private SkymapOfflineCache cache;

  @BeforeEach
  void setUp() {
    store = new InMemoryBlobStore();
    metadata = new InMemoryMetadataSlot();
    fetcher = new FakeResourceFetcher().respondToAll("application/json");
    online = new AtomicBoolean(true);
    cache = SkymapOfflineCache.builder(OfflineCacheConfig.builder().build())
                              .store(store)
                              .metadata(metadata)
                              .fetcher(fetcher)
                              .connectivity(online::get)
                              .executor(DIRECT)
                              .layerRegistry(registry())
                              .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                              .build();
  }

  @Test
  @DisplayName("initializeCacheSystem migrates a legacy install once")
  void initializeCacheSystem_migrates_once() {
    // Given
    store.put("skymap-cache-stars", "k", new byte[1]);

    // When
    var first = cache.initializeCacheSystem();
    var second = cache.initializeCacheSystem();

    // Then
    assertThat(first.fromVersion()).isZero();
    assertThat(first.deletedItems()).isEqualTo(1);
    assertThat(second.fromVersion()).isEqualTo(CacheVersionMigrator.CURRENT_VERSION);
    assertThat(second.deletedItems()).isZero();
    assertThat(cache.isMigrationNeeded()).isFalse();
    assertThat(cache.getCacheVersion()).hasValueSatisfying(v -> assertThat(v.migratedAt()).isEqualTo(NOW));
  }

  @Test
  @DisplayName("a downloaded layer is served offline from the cache")
  void downloaded_layer_is_served_offline() {
    // Given
    cache.initializeCacheSystem();
    cache.downloadLayer("stars", DownloadProgressListener.noop()).toCompletableFuture().join();
    fetcher.clearRequests();
    online.set(false);

    // When
    var resource = cache.getResource(BASE + "stars/b.json").toCompletableFuture().join();

    // Then
    assertThat(cache.isOnline()).isFalse();
    assertThat(resource).isPresent();
    assertThat(fetcher.requests()).isEmpty();
    assertThat(cache.getResource(BASE + "dso/dso.json").toCompletableFuture().join()).isEmpty();
  }

  @Test
  @DisplayName("usage stats cover layers, tiles and the memory tier")
  void usage_stats_cover_every_subsystem() {
    // Given
    cache.downloadAllLayers(DownloadProgressListener.noop()).toCompletableFuture().join();
    cache.downloadHipsSurvey(survey(3), 0, DownloadProgressListener.noop()).toCompletableFuture().join();
    cache.getResource(BASE + "stars/a.json").toCompletableFuture().join();

    // When
    var stats = cache.collectCacheStats();

    // Then
    assertThat(stats.subsystems()).extracting(CacheSubsystemStats::name).containsExactly("layers", "tiles", "memory");
    assertThat(stats.subsystems().get(0).entries()).isEqualTo(4);
    assertThat(stats.subsystems().get(1).entries()).isEqualTo(12);
    assertThat(stats.subsystems().get(2).entries()).isEqualTo(1);
    assertThat(stats.totalHits()).isEqualTo(1);
    assertThat(cache.formatCacheStats(stats)).startsWith("Cache: ").contains("  tiles: ");
  }

  @Test
  @DisplayName("resetAllCaches wipes partitions and the version so the next start migrates again")
  void resetAllCaches_wipes_everything() {
    // Given
    cache.initializeCacheSystem();
    cache.downloadLayer("dso", DownloadProgressListener.noop()).toCompletableFuture().join();

    // When
    var reset = cache.resetAllCaches();

    // Then
    assertThat(reset).isTrue();
    assertThat(store.listPartitions()).isEmpty();
    assertThat(cache.getCacheVersion()).isEmpty();
    assertThat(cache.isMigrationNeeded()).isTrue();
  }

  @Test
  @DisplayName("layer and survey operations are delegated")
  void operations_are_delegated() {
    // When
    var downloaded = cache.downloadLayers(List.of("stars"), DownloadProgressListener.noop()).toCompletableFuture().join();
    var repaired = cache.verifyAndRepairLayer("stars", DownloadProgressListener.noop()).toCompletableFuture().join();

    // Then
    assertThat(downloaded).containsEntry("stars", true);
    assertThat(repaired.verified()).isTrue();
    assertThat(cache.getAllLayerStatus()).hasSize(2);
    assertThat(cache.clearLayer("stars")).isTrue();
    assertThat(cache.getLayerStatus("stars").cachedFileCount()).isZero();
    assertThat(cache.getHipsCacheStatus(survey(3)).cachedTileCount()).isZero();
    assertThat(cache.clearHipsCache("CDS/P/DSS2/color")).isFalse();
    assertThat(cache.estimateHipsCacheSize(0)).isEqualTo(12 * OfflineCacheConfig.DEFAULT_AVERAGE_TILE_SIZE_BYTES);
    assertThat(cache.cancelDownload("stars")).isFalse();
    assertThat(cache.cancelHipsDownload("CDS/P/DSS2/color")).isFalse();
    assertThat(cache.clearAllCache()).isTrue();
  }

  @Test
  @DisplayName("a configured cache directory persists layers and the version across instances")
  void cache_directory_persists_across_instances(@TempDir Path tempDir) {
    // Given
    var config = OfflineCacheConfig.builder().cacheDirectory(tempDir).build();
    try (var first = SkymapOfflineCache.builder(config).fetcher(fetcher).executor(DIRECT).layerRegistry(registry()).build()) {
      first.initializeCacheSystem();
      first.downloadLayer("stars", DownloadProgressListener.noop()).toCompletableFuture().join();
    }

    // When
    try (var second = SkymapOfflineCache.builder(config).fetcher(fetcher).executor(DIRECT).layerRegistry(registry()).build()) {

      // Then
      assertThat(Files.exists(tempDir.resolve("cache-metadata.json"))).isTrue();
      assertThat(second.isMigrationNeeded()).isFalse();
      assertThat(second.getLayerStatus("stars").isComplete()).isTrue();
    }
  }

  @Test
  @DisplayName("a cleared layer is no longer served offline")
  void cleared_layer_is_not_served_offline() {
    // Given
    cache.downloadLayer("stars", DownloadProgressListener.noop()).toCompletableFuture().join();
    assertThat(cache.getResource(BASE + "stars/b.json").toCompletableFuture().join()).isPresent();
    online.set(false);

    // When
    cache.clearLayer("stars");

    // Then
    assertThat(cache.getResource(BASE + "stars/b.json").toCompletableFuture().join()).isEmpty();
  }

  @Test
  @DisplayName("resetAllCaches also forgets payloads held in memory")
  void resetAllCaches_forgets_memory_tier() {
    // Given
    cache.initializeCacheSystem();
    cache.downloadLayer("stars", DownloadProgressListener.noop()).toCompletableFuture().join();
    cache.getResource(BASE + "stars/a.json").toCompletableFuture().join();
    online.set(false);

    // When
    cache.resetAllCaches();

    // Then
    assertThat(cache.getResource(BASE + "stars/a.json").toCompletableFuture().join()).isEmpty();
  }

  @Test
  @DisplayName("clearAllCache forgets payloads held in memory")
  void clearAllCache_forgets_memory_tier() {
    // Given
    cache.downloadLayer("dso", DownloadProgressListener.noop()).toCompletableFuture().join();
    cache.getResource(BASE + "dso/dso.json").toCompletableFuture().join();
    online.set(false);

    // When
    cache.clearAllCache();

    // Then
    assertThat(cache.getResource(BASE + "dso/dso.json").toCompletableFuture().join()).isEmpty();
    assertThat(cache.collectCacheStats().subsystems().get(2).entries()).isZero();
  }
}
