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

import fr.aneo.skymap.offline.codec.CompressionCodec;
import fr.aneo.skymap.offline.codec.GzipCompressionFacility;
import fr.aneo.skymap.offline.download.DownloadProgressListener;
import fr.aneo.skymap.offline.hips.HipsSurvey;
import fr.aneo.skymap.offline.hips.HipsSurveyCacheStatus;
import fr.aneo.skymap.offline.hips.HipsTileManager;
import fr.aneo.skymap.offline.layer.CacheEntryStatus;
import fr.aneo.skymap.offline.layer.LayerDownloadManager;
import fr.aneo.skymap.offline.layer.LayerRegistry;
import fr.aneo.skymap.offline.layer.RepairResult;
import fr.aneo.skymap.offline.migration.CacheSchemaVersion;
import fr.aneo.skymap.offline.migration.CacheVersionMigrator;
import fr.aneo.skymap.offline.migration.LegacyPartitionCleanup;
import fr.aneo.skymap.offline.migration.MigrationResult;
import fr.aneo.skymap.offline.network.ConnectivityMonitor;
import fr.aneo.skymap.offline.network.HttpResourceFetcher;
import fr.aneo.skymap.offline.network.ResourceFetcher;
import fr.aneo.skymap.offline.network.RetryingResourceFetcher;
import fr.aneo.skymap.offline.resource.CachedResourceLoader;
import fr.aneo.skymap.offline.stats.AggregatedCacheStats;
import fr.aneo.skymap.offline.stats.BlobStoreStatsSource;
import fr.aneo.skymap.offline.stats.CacheCounters;
import fr.aneo.skymap.offline.stats.CacheStatsSource;
import fr.aneo.skymap.offline.stats.GuavaCacheStatsSource;
import fr.aneo.skymap.offline.stats.StorageUsageReporter;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.FileSystemBlobStore;
import fr.aneo.skymap.offline.store.InMemoryBlobStore;
import fr.aneo.skymap.offline.store.InMemoryMetadataSlot;
import fr.aneo.skymap.offline.store.JsonFileMetadataSlot;
import fr.aneo.skymap.offline.store.MetadataSlot;
import fr.aneo.skymap.offline.store.PartitionNames;
import fr.aneo.skymap.offline.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of the offline cache.
 * <p>
 * Wires the blob store, the compression codec, the network fetcher and the managers from an
 * {@link OfflineCacheConfig}, and exposes every cache operation.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (var cache = SkymapOfflineCache.create(OfflineCacheConfig.fromEnvironment())) {
 *   cache.initializeCacheSystem();
 *   cache.downloadLayer("stars", progress -> System.out.println(progress.percent()))
 *        .toCompletableFuture()
 *        .join();
 *   System.out.println(cache.getLayerStatus("stars").isComplete());
 * }
 * }</pre>
 *
 * <h2>Startup Ordering</h2>
 * <p>
 * {@link #initializeCacheSystem()} must complete before the first download: it is the only writer
 * of the schema version and may delete legacy partitions.
 * </p>
 *
 * <h2>Resource Management</h2>
 * <p>
 * Closing the cache cancels every running download. Stored data is kept.
 * </p>
 */
public final class SkymapOfflineCache implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SkymapOfflineCache.class);

  static final String METADATA_FILE = "cache-metadata.json";

  private final OfflineCacheConfig config;
  private final BlobStore store;
  private final ConnectivityMonitor connectivity;
  private final LayerDownloadManager layers;
  private final HipsTileManager hips;
  private final CacheVersionMigrator migrator;
  private final StorageUsageReporter reporter;
  private final CachedResourceLoader resources;

  private SkymapOfflineCache(Builder builder) {
    this.config = builder.config;
    this.store = builder.store != null ? builder.store : defaultStore(config);
    var metadata = builder.metadata != null ? builder.metadata : defaultMetadata(config);
    var fetcher = builder.fetcher != null ? builder.fetcher : defaultFetcher(config);
    var executor = builder.executor != null ? builder.executor : ExecutorProvider.defaultExecutor();
    var registry = builder.layerRegistry != null ? builder.layerRegistry : LayerRegistry.loadDefault();
    this.connectivity = builder.connectivity;

    var partitionNames = new PartitionNames(config.cacheNamePrefix(), config.versionSuffix());
    var codec = new CompressionCodec(new GzipCompressionFacility(), config.compressionThresholdBytes());
    var layerCounters = new CacheCounters();
    var tileCounters = new CacheCounters();

    this.layers = new LayerDownloadManager(store, partitionNames, codec, registry, fetcher, executor);
    this.hips = new HipsTileManager(store, partitionNames, codec, fetcher, executor,
      config.tileBatchSize(), config.averageTileSizeBytes());
    this.migrator = new CacheVersionMigrator(store, metadata, partitionNames,
      List.of(new LegacyPartitionCleanup(partitionNames, config.legacyCachePrefixes(), config.legacyMetadataKeys())),
      config.legacyMetadataKeys(), builder.clock);
    this.resources = new CachedResourceLoader(store, partitionNames, codec, fetcher, connectivity,
      layerCounters, tileCounters, config.memoryCacheMaxBytes());
    this.reporter = new StorageUsageReporter(store, List.of(
      new BlobStoreStatsSource("layers", store, name -> partitionNames.isOwned(name) && !partitionNames.isSurvey(name), layerCounters),
      new BlobStoreStatsSource("tiles", store, partitionNames::isSurvey, tileCounters),
      new GuavaCacheStatsSource<byte[]>("memory", resources.memoryCache(), data -> data.length)));
  }

  public static SkymapOfflineCache create(OfflineCacheConfig config) {
    return builder(config).build();
  }

  /**
   * Starts a builder; collaborators left unset are derived from {@code config}.
   */
  public static Builder builder(OfflineCacheConfig config) {
    return new Builder(config);
  }

  public OfflineCacheConfig config() {
    return config;
  }

  public LayerRegistry layerRegistry() {
    return layers.registry();
  }

  /**
   * Runs the pending cache migrations, if any. Call once at startup, before any download.
   *
   * @return the migration outcome; an up-to-date result when nothing had to be done
   */
  public MigrationResult initializeCacheSystem() {
    if (!store.isAvailable()) {
      logger.warn("Cache storage is not available, offline features are disabled");
    }
    if (!migrator.isMigrationNeeded()) {
      var version = migrator.getCacheVersion().map(CacheSchemaVersion::version).orElse(migrator.currentVersion());
      logger.debug("Cache is up to date at version {}", version);
      return MigrationResult.upToDate(version);
    }
    var result = migrator.runMigrations();
    logger.atInfo()
          .addKeyValue("operation", "initializeCacheSystem")
          .addKeyValue("fromVersion", result.fromVersion())
          .addKeyValue("toVersion", result.toVersion())
          .addKeyValue("deleted", result.deletedItems())
          .addKeyValue("success", result.success())
          .log("Cache system initialized");
    return result;
  }

  // Layers

  public CacheEntryStatus getLayerStatus(String layerId) {
    return layers.getLayerStatus(layerId);
  }

  public List<CacheEntryStatus> getAllLayerStatus() {
    return layers.getAllLayerStatus();
  }

  public CompletionStage<Boolean> downloadLayer(String layerId, DownloadProgressListener listener) {
    return layers.downloadLayer(layerId, listener);
  }

  public CompletionStage<Map<String, Boolean>> downloadLayers(Collection<String> layerIds, DownloadProgressListener listener) {
    return layers.downloadLayers(layerIds, listener);
  }

  public CompletionStage<Map<String, Boolean>> downloadAllLayers(DownloadProgressListener listener) {
    return layers.downloadAllLayers(listener);
  }

  public boolean cancelDownload(String layerId) {
    return layers.cancelDownload(layerId);
  }

  /**
   * Cancels every running layer and survey download.
   *
   * @return number of downloads cancelled
   */
  public int cancelAllDownloads() {
    return layers.cancelAllDownloads() + hips.cancelAllDownloads();
  }

  public CompletionStage<RepairResult> verifyAndRepairLayer(String layerId, DownloadProgressListener listener) {
    return layers.verifyAndRepairLayer(layerId, listener);
  }

  public boolean clearLayer(String layerId) {
    resources.invalidateAll();
    return layers.clearLayer(layerId);
  }

  public boolean clearAllCache() {
    resources.invalidateAll();
    return layers.clearAllCache();
  }

  // HiPS surveys

  public HipsSurveyCacheStatus getHipsCacheStatus(HipsSurvey survey) {
    return hips.getHipsCacheStatus(survey);
  }

  public CompletionStage<Boolean> downloadHipsSurvey(HipsSurvey survey, int maxOrder, DownloadProgressListener listener) {
    return hips.downloadHipsSurvey(survey, maxOrder, listener);
  }

  public boolean cancelHipsDownload(String surveyId) {
    return hips.cancelHipsDownload(surveyId);
  }

  public boolean clearHipsCache(String surveyId) {
    resources.invalidateAll();
    return hips.clearHipsCache(surveyId);
  }

  public long estimateHipsCacheSize(int order) {
    return hips.estimateCacheSize(order);
  }

  // Schema version

  public Optional<CacheSchemaVersion> getCacheVersion() {
    return migrator.getCacheVersion();
  }

  public boolean isMigrationNeeded() {
    return migrator.isMigrationNeeded();
  }

  public MigrationResult runMigrations() {
    return migrator.runMigrations();
  }

  /**
   * Cancels running downloads, then deletes every cache partition and the schema version.
   */
  public boolean resetAllCaches() {
    cancelAllDownloads();
    resources.invalidateAll();
    return migrator.resetAllCaches();
  }

  // Usage

  public AggregatedCacheStats collectCacheStats() {
    return reporter.collectCacheStats();
  }

  public String formatCacheStats(AggregatedCacheStats stats) {
    return StorageUsageReporter.formatCacheStats(stats);
  }

  /**
   * Adds an auxiliary cache to the usage report.
   */
  public void registerStatsSource(CacheStatsSource source) {
    reporter.register(source);
  }

  // Lookup

  public CompletionStage<Optional<byte[]>> getResource(String url) {
    return resources.getResource(url);
  }

  public boolean isOnline() {
    return connectivity.isOnline();
  }

  @Override
  public void close() {
    var cancelled = cancelAllDownloads();
    if (cancelled > 0) {
      logger.info("Cancelled {} running download(s) on close", cancelled);
    }
  }

  private static BlobStore defaultStore(OfflineCacheConfig config) {
    return config.cacheDirectory()
                 .<BlobStore>map(FileSystemBlobStore::new)
                 .orElseGet(InMemoryBlobStore::new);
  }

  private static MetadataSlot defaultMetadata(OfflineCacheConfig config) {
    return config.cacheDirectory()
                 .<MetadataSlot>map(directory -> new JsonFileMetadataSlot(directory.resolve(METADATA_FILE)))
                 .orElseGet(InMemoryMetadataSlot::new);
  }

  private static ResourceFetcher defaultFetcher(OfflineCacheConfig config) {
    var http = HttpResourceFetcher.create(config.resourceOrigin().orElse(null), config.requestTimeout());
    return new RetryingResourceFetcher(http, config.retryPolicy());
  }

  public static final class Builder {
    private final OfflineCacheConfig config;
    private BlobStore store;
    private MetadataSlot metadata;
    private ResourceFetcher fetcher;
    private ConnectivityMonitor connectivity = ConnectivityMonitor.alwaysOnline();
    private Executor executor;
    private LayerRegistry layerRegistry;
    private Clock clock = Clock.systemUTC();

    private Builder(OfflineCacheConfig config) {
      this.config = requireNonNull(config, "config must not be null");
    }

    public Builder store(BlobStore store) {
      this.store = requireNonNull(store, "store must not be null");
      return this;
    }

    public Builder metadata(MetadataSlot metadata) {
      this.metadata = requireNonNull(metadata, "metadata must not be null");
      return this;
    }

    /**
     * Replaces the HTTP fetcher; retries are then up to the given fetcher.
     */
    public Builder fetcher(ResourceFetcher fetcher) {
      this.fetcher = requireNonNull(fetcher, "fetcher must not be null");
      return this;
    }

    public Builder connectivity(ConnectivityMonitor connectivity) {
      this.connectivity = requireNonNull(connectivity, "connectivity must not be null");
      return this;
    }

    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor, "executor must not be null");
      return this;
    }

    public Builder layerRegistry(LayerRegistry layerRegistry) {
      this.layerRegistry = requireNonNull(layerRegistry, "layerRegistry must not be null");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock, "clock must not be null");
      return this;
    }

    public SkymapOfflineCache build() {
      return new SkymapOfflineCache(this);
    }
  }
}
