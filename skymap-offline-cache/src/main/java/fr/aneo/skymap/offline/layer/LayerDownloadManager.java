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

import fr.aneo.skymap.offline.codec.CompressionCodec;
import fr.aneo.skymap.offline.download.ActiveDownloads;
import fr.aneo.skymap.offline.download.DownloadProgress;
import fr.aneo.skymap.offline.download.DownloadProgressListener;
import fr.aneo.skymap.offline.download.DownloadStatus;
import fr.aneo.skymap.offline.download.DownloadTask;
import fr.aneo.skymap.offline.exception.StorageException;
import fr.aneo.skymap.offline.network.ResourceFetcher;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.CachePartition;
import fr.aneo.skymap.offline.store.PartitionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static fr.aneo.skymap.offline.util.Futures.isCancellation;
import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Comparator.comparingInt;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Downloads, verifies, repairs and clears the cached files of the registered layers.
 * <p>
 * Each layer lives in its own partition, named by {@link PartitionNames#layer(String)}, where every
 * file is stored under its resolved URL. A layer's status is always recomputed from the partition
 * content; nothing about download history is persisted.
 *
 * <h2>Concurrency</h2>
 * <p>
 * A download runs as a single task on the configured executor and fetches the layer files one after
 * the other. At most one task per layer runs at a time: a download or repair requested while another
 * is in flight for the same layer is rejected. Cancelling a task stops it before the next file,
 * aborts the pending fetch, and keeps the files already stored.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe.
 * </p>
 */
public final class LayerDownloadManager {
  private static final Logger logger = LoggerFactory.getLogger(LayerDownloadManager.class);

  private final BlobStore store;
  private final PartitionNames partitionNames;
  private final CompressionCodec codec;
  private final LayerRegistry registry;
  private final ResourceFetcher fetcher;
  private final Executor executor;
  private final ActiveDownloads activeDownloads = new ActiveDownloads();

  public LayerDownloadManager(BlobStore store,
                              PartitionNames partitionNames,
                              CompressionCodec codec,
                              LayerRegistry registry,
                              ResourceFetcher fetcher,
                              Executor executor) {
    this.store = requireNonNull(store, "store must not be null");
    this.partitionNames = requireNonNull(partitionNames, "partitionNames must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.registry = requireNonNull(registry, "registry must not be null");
    this.fetcher = requireNonNull(fetcher, "fetcher must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
  }

  public LayerRegistry registry() {
    return registry;
  }

  /**
   * Downloads every file of a layer into the cache.
   * <p>
   * Files that cannot be fetched (network failure or non-success HTTP status) or stored are logged
   * and skipped; the remaining files are still downloaded.
   *
   * @param layerId  the layer to download
   * @param listener receives a progress snapshot after every file and at the end
   * @return a stage completing with {@code true} if every file is now cached, {@code false} if some
   * file failed, the download was cancelled, the layer was already downloading, or storage is
   * unavailable; it completes exceptionally with {@link IllegalArgumentException} for an unknown layer
   */
  public CompletionStage<Boolean> downloadLayer(String layerId, DownloadProgressListener listener) {
    requireNonNull(layerId, "layerId must not be null");
    requireNonNull(listener, "listener must not be null");

    var layer = registry.find(layerId).orElse(null);
    if (layer == null) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown layer: " + layerId));
    }

    return fetchFiles(layer, layer.files(), layer.estimatedSizeBytes(), listener, "downloadLayer")
      .thenApply(outcome -> outcome.status() == DownloadStatus.COMPLETED);
  }

  /**
   * Downloads several layers one after the other, by ascending priority.
   *
   * @param layerIds layers to download; unknown ids are skipped and reported {@code false}
   * @param listener receives the progress of every layer; {@link DownloadProgress#targetId()} tells
   *                 them apart
   * @return a stage completing with the outcome of every requested id, in download order followed by
   * the unknown ids
   */
  public CompletionStage<Map<String, Boolean>> downloadLayers(Collection<String> layerIds, DownloadProgressListener listener) {
    requireNonNull(layerIds, "layerIds must not be null");
    requireNonNull(listener, "listener must not be null");

    var results = new LinkedHashMap<String, Boolean>();
    var known = new ArrayList<LayerDescriptor>();
    var unknown = new ArrayList<String>();
    for (var layerId : layerIds) {
      registry.find(layerId).ifPresentOrElse(known::add, () -> unknown.add(layerId));
    }
    known.sort(comparingInt(LayerDescriptor::priority));

    if (!unknown.isEmpty()) {
      logger.warn("Skipping unknown layers {}", unknown);
    }

    CompletionStage<Void> chain = completedFuture(null);
    for (var layer : known) {
      chain = chain.thenCompose(ignored -> downloadLayer(layer.id(), listener))
                   .thenAccept(success -> results.put(layer.id(), success));
    }
    return chain.thenApply(ignored -> {
      unknown.forEach(layerId -> results.putIfAbsent(layerId, false));
      return results;
    });
  }

  public CompletionStage<Map<String, Boolean>> downloadAllLayers(DownloadProgressListener listener) {
    return downloadLayers(registry.ids(), listener);
  }

  /**
   * Computes the cache status of a layer from its partition content.
   * <p>
   * When storage is unavailable every file is reported missing.
   *
   * @throws IllegalArgumentException if the layer is unknown
   */
  public CacheEntryStatus getLayerStatus(String layerId) {
    requireNonNull(layerId, "layerId must not be null");
    var layer = registry.get(layerId);
    if (!store.isAvailable()) return CacheEntryStatus.empty(layer);

    try {
      return CacheEntryStatus.of(layer, partition(layer).keys());
    } catch (StorageException e) {
      logger.warn("Cannot list partition of layer {}, reporting it empty", layerId, e);
      return CacheEntryStatus.empty(layer);
    }
  }

  /**
   * @return the status of every registered layer, by ascending priority
   */
  public List<CacheEntryStatus> getAllLayerStatus() {
    return registry.all().stream().map(layer -> getLayerStatus(layer.id())).toList();
  }

  /**
   * Fetches only the files of a layer that are missing from the cache.
   * <p>
   * A complete layer yields {@link RepairResult#ALREADY_COMPLETE} without any network access.
   * Progress is scoped to the missing files. A repair requested while the layer is being downloaded
   * is rejected and reports every missing file as failed.
   *
   * @param layerId  the layer to repair
   * @param listener receives progress of the repair
   * @return a stage completing with the repair outcome; it completes exceptionally with
   * {@link IllegalArgumentException} for an unknown layer
   */
  public CompletionStage<RepairResult> verifyAndRepairLayer(String layerId, DownloadProgressListener listener) {
    requireNonNull(layerId, "layerId must not be null");
    requireNonNull(listener, "listener must not be null");

    var layer = registry.find(layerId).orElse(null);
    if (layer == null) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown layer: " + layerId));
    }

    var status = getLayerStatus(layerId);
    if (status.isComplete()) {
      logger.atDebug()
            .addKeyValue("operation", "verifyAndRepairLayer")
            .addKeyValue("layerId", layerId)
            .log("Layer already complete");
      return completedFuture(RepairResult.ALREADY_COMPLETE);
    }

    var missing = status.missingFiles();
    var repairBytes = Math.round((double) missing.size() / status.totalFileCount() * layer.estimatedSizeBytes());
    logger.atInfo()
          .addKeyValue("operation", "verifyAndRepairLayer")
          .addKeyValue("layerId", layerId)
          .addKeyValue("missingFiles", missing.size())
          .log("Repairing layer");

    return fetchFiles(layer, missing, repairBytes, listener, "verifyAndRepairLayer")
      .thenApply(outcome -> {
        if (outcome.status() == null) return new RepairResult(false, 0, missing.size());
        var failed = missing.size() - outcome.stored();
        return new RepairResult(failed == 0, outcome.stored(), failed);
      });
  }

  /**
   * Deletes the partition of a layer.
   *
   * @return {@code true} if the partition existed and was deleted; {@code false} otherwise,
   * including when storage is unavailable or fails
   */
  public boolean clearLayer(String layerId) {
    requireNonNull(layerId, "layerId must not be null");
    if (!store.isAvailable()) return false;

    try {
      return store.deletePartition(partitionNames.layer(layerId));
    } catch (StorageException e) {
      logger.error("Error clearing cache for {}", layerId, e);
      return false;
    }
  }

  /**
   * Deletes every partition carrying the cache prefix, layers and HiPS surveys alike.
   *
   * @return {@code true} on success, {@code false} when storage is unavailable or fails
   */
  public boolean clearAllCache() {
    if (!store.isAvailable()) return false;

    try {
      var owned = store.listPartitions().stream().filter(partitionNames::isOwned).toList();
      owned.forEach(store::deletePartition);
      logger.atInfo()
            .addKeyValue("operation", "clearAllCache")
            .addKeyValue("partitions", owned.size())
            .log("Cleared all caches");
      return true;
    } catch (StorageException e) {
      logger.error("Error clearing all caches", e);
      return false;
    }
  }

  /**
   * @return {@code true} if a download or repair of this layer was running and is now cancelled
   */
  public boolean cancelDownload(String layerId) {
    requireNonNull(layerId, "layerId must not be null");
    return activeDownloads.cancel(layerId);
  }

  /**
   * @return number of tasks cancelled
   */
  public int cancelAllDownloads() {
    return activeDownloads.cancelAll();
  }

  public boolean isDownloading(String layerId) {
    return activeDownloads.isActive(layerId);
  }

  public List<DownloadProgress> activeDownloads() {
    return activeDownloads.snapshot();
  }

  CachePartition partition(LayerDescriptor layer) {
    return new CachePartition(store, partitionNames.layer(layer.id()), codec);
  }

  /**
   * Runs one download task over {@code files}. The outcome status is {@code null} when the task was
   * rejected because another one runs for the same layer.
   */
  private CompletionStage<Outcome> fetchFiles(LayerDescriptor layer,
                                              List<String> files,
                                              long totalBytesEstimate,
                                              DownloadProgressListener listener,
                                              String operation) {
    var task = new DownloadTask(layer.id(), files.size(), totalBytesEstimate, listener);

    if (!store.isAvailable()) {
      logger.warn("Storage unavailable, cannot {} {}", operation, layer.id());
      task.fail("storage unavailable");
      return completedFuture(new Outcome(DownloadStatus.FAILED, 0, files.size()));
    }

    if (!activeDownloads.tryRegister(task)) {
      logger.warn("Layer {} is already downloading", layer.id());
      return completedFuture(new Outcome(null, 0, 0));
    }

    logger.atInfo()
          .addKeyValue("operation", operation)
          .addKeyValue("layerId", layer.id())
          .addKeyValue("files", files.size())
          .log("Starting layer download");

    try {
      return CompletableFuture.supplyAsync(() -> runTask(task, layer, files), executor);
    } catch (RuntimeException e) {
      activeDownloads.release(task);
      task.fail("executor rejected task: " + e.getMessage());
      return completedFuture(new Outcome(DownloadStatus.FAILED, 0, files.size()));
    }
  }

  private Outcome runTask(DownloadTask task, LayerDescriptor layer, List<String> files) {
    var token = task.token();
    var partition = partition(layer);
    var stored = 0;
    var failed = 0;
    try {
      task.start();
      for (var file : files) {
        if (token.isCancelled()) break;
        var url = layer.resolve(file);
        try {
          var response = token.bind(fetcher.fetch(url, token)).join();
          if (token.isCancelled()) break;
          if (!response.isOk()) {
            logger.warn("Failed to download {}: HTTP {}", url, response.statusCode());
            failed++;
            task.recordFailed();
            continue;
          }
          partition.put(url, response.body(), response.contentType());
          stored++;
          task.recordCompleted();
        } catch (CancellationException | CompletionException e) {
          if (token.isCancelled() || isCancellation(e)) break;
          logger.warn("Failed to download {}: {}", url, unwrap(e).getMessage());
          failed++;
          task.recordFailed();
        } catch (StorageException e) {
          logger.warn("Failed to store {}", url, e);
          failed++;
          task.recordFailed();
        }
      }

      if (token.isCancelled()) {
        task.cancel();
        logger.info("Download of {} cancelled after {} of {} files", layer.id(), stored, files.size());
        return new Outcome(DownloadStatus.CANCELLED, stored, failed);
      }
      if (failed == 0) {
        task.complete();
      } else {
        task.fail(failed + " of " + files.size() + " files failed");
      }

      logger.atInfo()
            .addKeyValue("operation", "downloadLayer")
            .addKeyValue("layerId", layer.id())
            .addKeyValue("stored", stored)
            .addKeyValue("failed", failed)
            .log("Layer download finished");
      return new Outcome(task.status(), stored, failed);
    } catch (RuntimeException e) {
      logger.error("Download of {} aborted", layer.id(), e);
      task.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      return new Outcome(DownloadStatus.FAILED, stored, files.size() - stored);
    } finally {
      activeDownloads.release(task);
    }
  }

  private record Outcome(DownloadStatus status, int stored, int failed) {
  }
}
