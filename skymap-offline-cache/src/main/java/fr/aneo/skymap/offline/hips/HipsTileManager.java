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
package fr.aneo.skymap.offline.hips;

import com.google.common.math.LongMath;
import fr.aneo.skymap.offline.codec.CompressionCodec;
import fr.aneo.skymap.offline.download.ActiveDownloads;
import fr.aneo.skymap.offline.download.DownloadProgress;
import fr.aneo.skymap.offline.download.DownloadProgressListener;
import fr.aneo.skymap.offline.download.DownloadTask;
import fr.aneo.skymap.offline.exception.StorageException;
import fr.aneo.skymap.offline.network.CancellationToken;
import fr.aneo.skymap.offline.network.FetchResponse;
import fr.aneo.skymap.offline.network.ResourceFetcher;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.CachePartition;
import fr.aneo.skymap.offline.store.PartitionNames;
import fr.aneo.skymap.offline.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static fr.aneo.skymap.offline.util.Futures.isCancellation;
import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Downloads HiPS survey tiles order by order into a partition per survey.
 * <p>
 * Each order is split into batches of {@code tileBatchSize} tiles. The tiles of a batch are fetched
 * concurrently and the whole batch settles before the next one starts, which bounds the number of
 * requests in flight. Tiles already cached are skipped without any request, so re-running an
 * interrupted download only fetches what is missing.
 * <p>
 * A failed tile is counted and does not stop its siblings; a cancelled tile ends the whole survey
 * download once the current batch has settled.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe. At most one download runs per survey id.
 * </p>
 */
public final class HipsTileManager {
  private static final Logger logger = LoggerFactory.getLogger(HipsTileManager.class);

  private final BlobStore store;
  private final PartitionNames partitionNames;
  private final CompressionCodec codec;
  private final ResourceFetcher fetcher;
  private final Executor executor;
  private final int tileBatchSize;
  private final long averageTileSizeBytes;
  private final ActiveDownloads activeDownloads = new ActiveDownloads();

  public HipsTileManager(BlobStore store,
                         PartitionNames partitionNames,
                         CompressionCodec codec,
                         ResourceFetcher fetcher,
                         Executor executor,
                         int tileBatchSize,
                         long averageTileSizeBytes) {
    this.store = requireNonNull(store, "store must not be null");
    this.partitionNames = requireNonNull(partitionNames, "partitionNames must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.fetcher = requireNonNull(fetcher, "fetcher must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
    if (tileBatchSize < 1) throw new IllegalArgumentException("tileBatchSize must be >= 1, got: " + tileBatchSize);
    if (averageTileSizeBytes < 0) {
      throw new IllegalArgumentException("averageTileSizeBytes must be >= 0, got: " + averageTileSizeBytes);
    }
    this.tileBatchSize = tileBatchSize;
    this.averageTileSizeBytes = averageTileSizeBytes;
  }

  /**
   * Downloads every tile of orders {@code 0..maxOrder} of a survey.
   *
   * @param survey   the survey
   * @param maxOrder deepest order to download, clamped to the survey's own maximum
   * @param listener receives a progress snapshot after every tile and at the end
   * @return a stage completing with {@code true} if no tile failed and the download was not
   * cancelled; {@code false} otherwise, and when the survey is already downloading or storage is
   * unavailable
   */
  public CompletionStage<Boolean> downloadHipsSurvey(HipsSurvey survey, int maxOrder, DownloadProgressListener listener) {
    requireNonNull(survey, "survey must not be null");
    requireNonNull(listener, "listener must not be null");
    if (maxOrder < 0) {
      return CompletableFuture.failedFuture(new IllegalArgumentException("maxOrder must be >= 0, got: " + maxOrder));
    }

    var effectiveMaxOrder = Math.min(maxOrder, survey.maxOrder());
    var totalTiles = HipsTileAddress.cumulativeTileCount(effectiveMaxOrder);
    var task = new DownloadTask(survey.id(), totalTiles,
      LongMath.saturatedMultiply(totalTiles, averageTileSizeBytes), listener);

    if (!store.isAvailable()) {
      logger.warn("Storage unavailable, cannot download survey {}", survey.id());
      task.fail("storage unavailable");
      return completedFuture(false);
    }

    if (!activeDownloads.tryRegister(task)) {
      logger.warn("Survey {} is already downloading", survey.id());
      return completedFuture(false);
    }

    logger.atInfo()
          .addKeyValue("operation", "downloadHipsSurvey")
          .addKeyValue("surveyId", survey.id())
          .addKeyValue("maxOrder", effectiveMaxOrder)
          .addKeyValue("tiles", totalTiles)
          .log("Starting survey download");

    try {
      return CompletableFuture.supplyAsync(() -> runTask(task, survey, effectiveMaxOrder), executor);
    } catch (RuntimeException e) {
      activeDownloads.release(task);
      task.fail("executor rejected task: " + e.getMessage());
      return completedFuture(false);
    }
  }

  /**
   * Describes the cached tiles of a survey by parsing the order out of every stored key.
   * <p>
   * Reports an empty cache when storage is unavailable.
   */
  public HipsSurveyCacheStatus getHipsCacheStatus(HipsSurvey survey) {
    requireNonNull(survey, "survey must not be null");
    if (!store.isAvailable()) return HipsSurveyCacheStatus.empty(survey.id());

    try {
      var partition = partition(survey.id());
      return HipsSurveyCacheStatus.fromKeys(survey.id(), partition.keys(), averageTileSizeBytes, partition.sizeBytes());
    } catch (StorageException e) {
      logger.warn("Cannot list partition of survey {}, reporting it empty", survey.id(), e);
      return HipsSurveyCacheStatus.empty(survey.id());
    }
  }

  /**
   * @return {@code true} if a download of this survey was running and is now cancelled
   */
  public boolean cancelHipsDownload(String surveyId) {
    requireNonNull(surveyId, "surveyId must not be null");
    return activeDownloads.cancel(surveyId);
  }

  public int cancelAllDownloads() {
    return activeDownloads.cancelAll();
  }

  /**
   * Deletes the partition of a survey.
   *
   * @return {@code true} if the partition existed and was deleted; {@code false} otherwise,
   * including when storage is unavailable or fails
   */
  public boolean clearHipsCache(String surveyId) {
    requireNonNull(surveyId, "surveyId must not be null");
    if (!store.isAvailable()) return false;

    try {
      return store.deletePartition(partitionNames.survey(surveyId));
    } catch (StorageException e) {
      logger.error("Error clearing cache for survey {}", surveyId, e);
      return false;
    }
  }

  public boolean isDownloading(String surveyId) {
    return activeDownloads.isActive(surveyId);
  }

  public List<DownloadProgress> activeDownloads() {
    return activeDownloads.snapshot();
  }

  /**
   * Cache footprint estimate of one order, based on the configured average tile size.
   */
  public long estimateCacheSize(int order) {
    return HipsTileAddress.estimateCacheSize(order, averageTileSizeBytes);
  }

  private CachePartition partition(String surveyId) {
    return new CachePartition(store, partitionNames.survey(surveyId), codec);
  }

  private boolean runTask(DownloadTask task, HipsSurvey survey, int maxOrder) {
    var token = task.token();
    var partition = partition(survey.id());
    var cancelled = false;
    try {
      task.start();
      orders:
      for (int order = 0; order <= maxOrder; order++) {
        var tileCount = HipsTileAddress.tileCount(order);
        for (long start = 0; start < tileCount; start += tileBatchSize) {
          if (token.isCancelled()) {
            cancelled = true;
            break orders;
          }
          var end = Math.min(tileCount, start + tileBatchSize);
          var batch = new ArrayList<CompletionStage<TileOutcome>>();
          for (long pixel = start; pixel < end; pixel++) {
            batch.add(fetchTile(partition, new HipsTileAddress(order, pixel).toUrl(survey), token));
          }

          for (var outcome : Futures.allOf(batch).toCompletableFuture().join()) {
            switch (outcome) {
              case STORED, SKIPPED -> task.recordCompleted();
              case FAILED -> task.recordFailed();
              case CANCELLED -> cancelled = true;
            }
          }
          if (cancelled || token.isCancelled()) {
            cancelled = true;
            break orders;
          }
        }
        logger.atDebug()
              .addKeyValue("operation", "downloadHipsSurvey")
              .addKeyValue("surveyId", survey.id())
              .addKeyValue("order", order)
              .log("Order done");
      }

      var failed = task.failedUnits();
      if (cancelled) {
        task.cancel();
        logger.info("Download of survey {} cancelled after {} tiles", survey.id(), task.completedUnits());
        return false;
      }
      if (failed == 0) {
        task.complete();
      } else {
        task.fail(failed + " of " + task.snapshot().totalUnits() + " tiles failed");
      }

      logger.atInfo()
            .addKeyValue("operation", "downloadHipsSurvey")
            .addKeyValue("surveyId", survey.id())
            .addKeyValue("completed", task.completedUnits())
            .addKeyValue("failed", failed)
            .log("Survey download finished");
      return failed == 0;
    } catch (RuntimeException e) {
      logger.error("Download of survey {} aborted", survey.id(), e);
      task.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      return false;
    } finally {
      activeDownloads.release(task);
    }
  }

  /**
   * Fetches and stores one tile. The returned stage never completes exceptionally.
   */
  private CompletionStage<TileOutcome> fetchTile(CachePartition partition, String url, CancellationToken token) {
    try {
      if (partition.contains(url)) return completedFuture(TileOutcome.SKIPPED);
    } catch (StorageException e) {
      logger.debug("Cannot check cached tile {}, fetching it", url, e);
    }
    if (token.isCancelled()) return completedFuture(TileOutcome.CANCELLED);

    CompletionStage<FetchResponse> pending;
    try {
      pending = fetcher.fetch(url, token);
    } catch (RuntimeException e) {
      pending = CompletableFuture.failedFuture(e);
    }
    return pending.handle((response, failure) -> {
      if (failure != null) {
        if (token.isCancelled() || isCancellation(failure)) return TileOutcome.CANCELLED;
        logger.warn("Failed to download tile {}: {}", url, unwrap(failure).getMessage());
        return TileOutcome.FAILED;
      }
      if (!response.isOk()) {
        logger.warn("Failed to download tile {}: HTTP {}", url, response.statusCode());
        return TileOutcome.FAILED;
      }
      try {
        partition.put(url, response.body(), response.contentType());
        return TileOutcome.STORED;
      } catch (StorageException e) {
        logger.warn("Failed to store tile {}", url, e);
        return TileOutcome.FAILED;
      }
    });
  }

  private enum TileOutcome {
    STORED,
    SKIPPED,
    FAILED,
    CANCELLED
  }
}
