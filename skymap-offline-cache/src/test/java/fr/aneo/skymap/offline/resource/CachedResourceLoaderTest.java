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
package fr.aneo.skymap.offline.resource;

import fr.aneo.skymap.offline.network.ConnectivityMonitor;
import fr.aneo.skymap.offline.stats.CacheCounters;
import fr.aneo.skymap.offline.store.CachePartition;
import fr.aneo.skymap.offline.store.InMemoryBlobStore;
import fr.aneo.skymap.offline.testutils.FakeResourceFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import static fr.aneo.skymap.offline.testutils.TestDataFactory.BASE;
import static fr.aneo.skymap.offline.testutils.TestDataFactory.codec;
import static fr.aneo.skymap.offline.testutils.TestDataFactory.partitionNames;
import static org.assertj.core.api.Assertions.assertThat;

class CachedResourceLoaderTest {
  private static final String STARS_URL = BASE + "stars/a.json";
  private static final String TILE_URL = "https://alasky.test/DSS/DSSColor/Norder3/Dir0/Npix1.jpg";

  private InMemoryBlobStore store;
  private FakeResourceFetcher fetcher;
  private AtomicBoolean online;
  private CacheCounters layerCounters;
  private CacheCounters tileCounters;
  private CachedResourceLoader loader;

  @BeforeEach
  void setUp() {
    store = new InMemoryBlobStore();
    fetcher = new FakeResourceFetcher();
    online = new AtomicBoolean(true);
    layerCounters = new CacheCounters();
    tileCounters = new CacheCounters();
    ConnectivityMonitor connectivity = online::get;
    loader = new CachedResourceLoader(store, partitionNames(), codec(), fetcher, connectivity,
      layerCounters, tileCounters, 1024 * 1024);
  }

  @Test
  @DisplayName("a cached layer file is served from storage without network access")
  void cached_layer_file_is_served_from_storage() {
    // Given
    var data = "{\"a\":1},".repeat(500).getBytes(StandardCharsets.UTF_8);
    new CachePartition(store, "skymap-offline-stars-v1", codec()).put(STARS_URL, data, "application/json");

    // When
    var result = loader.getResource(STARS_URL).toCompletableFuture().join();

    // Then
    assertThat(result).hasValue(data);
    assertThat(fetcher.requests()).isEmpty();
    assertThat(layerCounters.hits()).isEqualTo(1);
  }

  @Test
  @DisplayName("a cached tile counts as a tile hit and is then served from memory")
  void cached_tile_counts_as_tile_hit() {
    // Given
    store.put("skymap-offline-hips-CDS_P_DSS2_color-v1", TILE_URL, new byte[]{1, 2});

    // When
    loader.getResource(TILE_URL).toCompletableFuture().join();
    store.deletePartition("skymap-offline-hips-CDS_P_DSS2_color-v1");
    var second = loader.getResource(TILE_URL).toCompletableFuture().join();

    // Then
    assertThat(second).hasValue(new byte[]{1, 2});
    assertThat(tileCounters.hits()).isEqualTo(1);
    assertThat(loader.memoryCache().stats().hitCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("foreign partitions are never consulted")
  void foreign_partitions_are_ignored() {
    // Given
    store.put("other-app", STARS_URL, new byte[]{9});
    online.set(false);

    // When/Then
    assertThat(loader.getResource(STARS_URL).toCompletableFuture().join()).isEmpty();
  }

  @Test
  @DisplayName("a miss while online fetches the resource and records a miss")
  void miss_while_online_fetches() {
    // Given
    fetcher.respond(STARS_URL, "{}", "application/json");

    // When
    var result = loader.getResource(STARS_URL).toCompletableFuture().join();

    // Then
    assertThat(result).hasValue("{}".getBytes(StandardCharsets.UTF_8));
    assertThat(fetcher.requests()).containsExactly(STARS_URL);
    assertThat(layerCounters.misses()).isEqualTo(1);
    assertThat(tileCounters.misses()).isZero();
  }

  @Test
  @DisplayName("a tile miss is counted on the tile counters")
  void tile_miss_is_counted_on_tiles() {
    // When
    loader.getResource(TILE_URL).toCompletableFuture().join();

    // Then
    assertThat(tileCounters.misses()).isEqualTo(1);
    assertThat(layerCounters.misses()).isZero();
  }

  @Test
  @DisplayName("a miss while offline resolves empty without network access")
  void miss_while_offline_resolves_empty() {
    // Given
    online.set(false);

    // When
    var result = loader.getResource(STARS_URL).toCompletableFuture().join();

    // Then
    assertThat(result).isEmpty();
    assertThat(fetcher.requests()).isEmpty();
  }

  @Test
  @DisplayName("HTTP errors and network failures resolve empty")
  void failures_resolve_empty() {
    // Given
    fetcher.status(STARS_URL, 500).networkError(TILE_URL);

    // Then
    assertThat(loader.getResource(STARS_URL).toCompletableFuture().join()).isEmpty();
    assertThat(loader.getResource(TILE_URL).toCompletableFuture().join()).isEmpty();
  }

  @Test
  @DisplayName("unavailable storage goes straight to the network")
  void unavailable_storage_goes_to_network() {
    // Given
    store.setAvailable(false);
    fetcher.respond(STARS_URL, "{}", "application/json");

    // When
    var result = loader.getResource(STARS_URL).toCompletableFuture().join();

    // Then
    assertThat(result).isPresent();
    assertThat(layerCounters.misses()).isZero();
  }

  @Test
  @DisplayName("changing a returned payload does not alter the remembered copy")
  void returned_payload_is_a_copy() {
    // Given
    store.put("skymap-offline-stars-v1", STARS_URL, new byte[]{'a', 'b'});
    var first = loader.getResource(STARS_URL).toCompletableFuture().join().orElseThrow();

    // When
    first[0] = 'X';
    var second = loader.getResource(STARS_URL).toCompletableFuture().join();

    // Then
    assertThat(second).hasValue(new byte[]{'a', 'b'});
  }

  @Test
  @DisplayName("invalidateAll sends the next lookup back to storage")
  void invalidateAll_drops_memory_tier() {
    // Given
    store.put("skymap-offline-stars-v1", STARS_URL, new byte[]{1});
    loader.getResource(STARS_URL).toCompletableFuture().join();
    store.deletePartition("skymap-offline-stars-v1");
    online.set(false);

    // When
    loader.invalidateAll();

    // Then
    assertThat(loader.memoryCache().size()).isZero();
    assertThat(loader.getResource(STARS_URL).toCompletableFuture().join()).isEmpty();
  }
}
