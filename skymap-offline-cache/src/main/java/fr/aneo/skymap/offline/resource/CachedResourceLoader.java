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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import fr.aneo.skymap.offline.codec.CompressionCodec;
import fr.aneo.skymap.offline.exception.StorageException;
import fr.aneo.skymap.offline.hips.HipsTileAddress;
import fr.aneo.skymap.offline.network.CancellationToken;
import fr.aneo.skymap.offline.network.ConnectivityMonitor;
import fr.aneo.skymap.offline.network.ResourceFetcher;
import fr.aneo.skymap.offline.stats.CacheCounters;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.CachePartition;
import fr.aneo.skymap.offline.store.PartitionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Cache-first lookup of any resource the offline cache may hold.
 * <p>
 * A lookup goes through three tiers:
 * <ol>
 *   <li>a bounded in-memory Guava cache of recently served payloads,</li>
 *   <li>every partition of the blob store carrying the cache prefix, layers and surveys alike,</li>
 *   <li>the network, only when the host is online.</li>
 * </ol>
 * A hit in the blob store is counted on the tile counters when it comes from a survey partition and
 * on the layer counters otherwise; a miss is counted the same way, according to whether the URL
 * addresses a HiPS tile. When storage is unavailable the lookup goes straight to the network.
 * Network failures and offline misses yield an empty result; nothing is thrown.
 */
public final class CachedResourceLoader {
  private static final Logger logger = LoggerFactory.getLogger(CachedResourceLoader.class);

  private final BlobStore store;
  private final PartitionNames partitionNames;
  private final CompressionCodec codec;
  private final ResourceFetcher fetcher;
  private final ConnectivityMonitor connectivity;
  private final CacheCounters layerCounters;
  private final CacheCounters tileCounters;
  private final Cache<String, byte[]> memory;

  /**
   * @param memoryCacheMaxBytes weight bound of the in-memory tier; 0 disables it
   */
  public CachedResourceLoader(BlobStore store,
                              PartitionNames partitionNames,
                              CompressionCodec codec,
                              ResourceFetcher fetcher,
                              ConnectivityMonitor connectivity,
                              CacheCounters layerCounters,
                              CacheCounters tileCounters,
                              long memoryCacheMaxBytes) {
    this.store = requireNonNull(store, "store must not be null");
    this.partitionNames = requireNonNull(partitionNames, "partitionNames must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.fetcher = requireNonNull(fetcher, "fetcher must not be null");
    this.connectivity = requireNonNull(connectivity, "connectivity must not be null");
    this.layerCounters = requireNonNull(layerCounters, "layerCounters must not be null");
    this.tileCounters = requireNonNull(tileCounters, "tileCounters must not be null");
    if (memoryCacheMaxBytes < 0) {
      throw new IllegalArgumentException("memoryCacheMaxBytes must be >= 0, got: " + memoryCacheMaxBytes);
    }
    this.memory = CacheBuilder.newBuilder()
                              .maximumWeight(memoryCacheMaxBytes)
                              .weigher((String url, byte[] data) -> data.length)
                              .recordStats()
                              .build();
  }

  /**
   * The in-memory tier, exposed for usage reporting.
   */
  public Cache<String, byte[]> memoryCache() {
    return memory;
  }

  /**
   * Drops every payload held in memory, so that later lookups go back to the blob store.
   */
  public void invalidateAll() {
    memory.invalidateAll();
  }

  /**
   * Looks {@code url} up in the cache, falling back to the network.
   *
   * @param url the resource URL, as used for the cache key
   * @return a stage completing with the payload, or empty when it is neither cached nor reachable
   */
  public CompletionStage<Optional<byte[]>> getResource(String url) {
    requireNonNull(url, "url must not be null");

    var remembered = memory.getIfPresent(url);
    if (remembered != null) return completedFuture(Optional.of(remembered.clone()));

    if (!store.isAvailable()) {
      logger.debug("Storage unavailable, fetching {} directly", url);
      return fetch(url);
    }

    try {
      var cached = findInPartitions(url);
      if (cached.isPresent()) {
        memory.put(url, cached.get().clone());
        return completedFuture(cached);
      }
    } catch (StorageException e) {
      logger.warn("Cache lookup of {} failed, falling back to network", url, e);
    }

    countersFor(url).recordMiss();
    if (!connectivity.isOnline()) {
      logger.debug("Offline and {} is not cached", url);
      return completedFuture(Optional.empty());
    }
    return fetch(url);
  }

  private Optional<byte[]> findInPartitions(String url) {
    for (var name : store.listPartitions()) {
      if (!partitionNames.isOwned(name)) continue;
      var found = new CachePartition(store, name, codec).get(url);
      if (found.isPresent()) {
        (partitionNames.isSurvey(name) ? tileCounters : layerCounters).recordHit();
        return found;
      }
    }
    return Optional.empty();
  }

  private CompletionStage<Optional<byte[]>> fetch(String url) {
    CompletionStage<Optional<byte[]>> pending;
    try {
      pending = fetcher.fetch(url, new CancellationToken()).thenApply(response -> {
        if (!response.isOk()) {
          logger.debug("Fetching {} returned HTTP {}", url, response.statusCode());
          return Optional.empty();
        }
        memory.put(url, response.body().clone());
        return Optional.of(response.body());
      });
    } catch (RuntimeException e) {
      pending = CompletableFuture.failedFuture(e);
    }
    return pending.exceptionally(failure -> {
      logger.warn("Fetching {} failed: {}", url, unwrap(failure).getMessage());
      return Optional.empty();
    });
  }

  private CacheCounters countersFor(String url) {
    return HipsTileAddress.parseOrder(url).isPresent() ? tileCounters : layerCounters;
  }
}
