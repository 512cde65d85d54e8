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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of the offline cache.
 * <p>
 * Instances are built with {@link #builder()}; every setting has a default, so
 * {@code OfflineCacheConfig.builder().build()} yields a working in-memory cache that only accepts
 * absolute URLs. {@link #fromEnvironment()} reads the settings a deployment usually overrides.
 *
 * <h2>Environment variables</h2>
 * <ul>
 *   <li>{@value #ENV_CACHE_DIR}: directory of the file-system store; unset means in-memory storage</li>
 *   <li>{@value #ENV_RESOURCE_ORIGIN}: absolute URI relative layer URLs are resolved against</li>
 *   <li>{@value #ENV_TILE_BATCH_SIZE}: concurrent tile fetches per batch</li>
 * </ul>
 * Invalid values are logged and replaced by the default.
 */
public final class OfflineCacheConfig {
  private static final Logger logger = LoggerFactory.getLogger(OfflineCacheConfig.class);

  public static final String ENV_CACHE_DIR = "SKYMAP_OFFLINE_CACHE_DIR";
  public static final String ENV_RESOURCE_ORIGIN = "SKYMAP_OFFLINE_RESOURCE_ORIGIN";
  public static final String ENV_TILE_BATCH_SIZE = "SKYMAP_OFFLINE_TILE_BATCH_SIZE";

  public static final String DEFAULT_CACHE_NAME_PREFIX = "skymap-offline-";
  public static final String DEFAULT_VERSION_SUFFIX = "v1";
  public static final int DEFAULT_TILE_BATCH_SIZE = 10;
  public static final long DEFAULT_COMPRESSION_THRESHOLD_BYTES = 1024;
  public static final long DEFAULT_AVERAGE_TILE_SIZE_BYTES = 50 * 1024;
  public static final long DEFAULT_MEMORY_CACHE_MAX_BYTES = 16 * 1024 * 1024;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final String cacheNamePrefix;
  private final String versionSuffix;
  private final List<String> legacyCachePrefixes;
  private final List<String> legacyMetadataKeys;
  private final URI resourceOrigin;
  private final Path cacheDirectory;
  private final int tileBatchSize;
  private final long compressionThresholdBytes;
  private final long averageTileSizeBytes;
  private final long memoryCacheMaxBytes;
  private final Duration requestTimeout;
  private final RetryPolicy retryPolicy;

  private OfflineCacheConfig(Builder builder) {
    this.cacheNamePrefix = builder.cacheNamePrefix;
    this.versionSuffix = builder.versionSuffix;
    this.legacyCachePrefixes = List.copyOf(builder.legacyCachePrefixes);
    this.legacyMetadataKeys = List.copyOf(builder.legacyMetadataKeys);
    this.resourceOrigin = builder.resourceOrigin;
    this.cacheDirectory = builder.cacheDirectory;
    this.tileBatchSize = builder.tileBatchSize;
    this.compressionThresholdBytes = builder.compressionThresholdBytes;
    this.averageTileSizeBytes = builder.averageTileSizeBytes;
    this.memoryCacheMaxBytes = builder.memoryCacheMaxBytes;
    this.requestTimeout = builder.requestTimeout;
    this.retryPolicy = builder.retryPolicy;
  }

  public String cacheNamePrefix() {
    return cacheNamePrefix;
  }

  public String versionSuffix() {
    return versionSuffix;
  }

  public List<String> legacyCachePrefixes() {
    return legacyCachePrefixes;
  }

  public List<String> legacyMetadataKeys() {
    return legacyMetadataKeys;
  }

  public Optional<URI> resourceOrigin() {
    return Optional.ofNullable(resourceOrigin);
  }

  public Optional<Path> cacheDirectory() {
    return Optional.ofNullable(cacheDirectory);
  }

  public int tileBatchSize() {
    return tileBatchSize;
  }

  public long compressionThresholdBytes() {
    return compressionThresholdBytes;
  }

  public long averageTileSizeBytes() {
    return averageTileSizeBytes;
  }

  public long memoryCacheMaxBytes() {
    return memoryCacheMaxBytes;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Defaults overridden by the {@code SKYMAP_OFFLINE_*} environment variables.
   */
  public static OfflineCacheConfig fromEnvironment() {
    var builder = builder();

    var cacheDir = System.getenv(ENV_CACHE_DIR);
    if (cacheDir != null && !cacheDir.isBlank()) {
      try {
        builder.cacheDirectory(Path.of(cacheDir.trim()));
      } catch (InvalidPathException e) {
        logger.warn("Invalid path in {}: {}. Using in-memory storage", ENV_CACHE_DIR, cacheDir);
      }
    }

    var origin = System.getenv(ENV_RESOURCE_ORIGIN);
    if (origin != null && !origin.isBlank()) {
      try {
        var uri = URI.create(origin.trim());
        if (uri.isAbsolute()) {
          builder.resourceOrigin(uri);
        } else {
          logger.warn("Invalid resource origin in {}: {} (must be absolute). Only absolute URLs will be fetched", ENV_RESOURCE_ORIGIN, origin);
        }
      } catch (IllegalArgumentException e) {
        logger.warn("Invalid URI in {}: {}. Only absolute URLs will be fetched", ENV_RESOURCE_ORIGIN, origin);
      }
    }

    var batchSize = System.getenv(ENV_TILE_BATCH_SIZE);
    if (batchSize != null && !batchSize.isBlank()) {
      try {
        var size = Integer.parseInt(batchSize.trim());
        if (size <= 0) {
          logger.warn("Invalid tile batch size in {}: {} (must be positive). Using default: {}", ENV_TILE_BATCH_SIZE, batchSize, DEFAULT_TILE_BATCH_SIZE);
        } else {
          builder.tileBatchSize(size);
        }
      } catch (NumberFormatException e) {
        logger.warn("Invalid number format for {}: {}. Using default: {}", ENV_TILE_BATCH_SIZE, batchSize, DEFAULT_TILE_BATCH_SIZE);
      }
    }

    return builder.build();
  }

  @Override
  public String toString() {
    return "OfflineCacheConfig{" +
      "cacheNamePrefix='" + cacheNamePrefix + '\'' +
      ", versionSuffix='" + versionSuffix + '\'' +
      ", legacyCachePrefixes=" + legacyCachePrefixes +
      ", legacyMetadataKeys=" + legacyMetadataKeys +
      ", resourceOrigin=" + resourceOrigin +
      ", cacheDirectory=" + cacheDirectory +
      ", tileBatchSize=" + tileBatchSize +
      ", compressionThresholdBytes=" + compressionThresholdBytes +
      ", averageTileSizeBytes=" + averageTileSizeBytes +
      ", memoryCacheMaxBytes=" + memoryCacheMaxBytes +
      ", requestTimeout=" + requestTimeout +
      ", retryPolicy=" + retryPolicy +
      '}';
  }

  public static final class Builder {
    private String cacheNamePrefix = DEFAULT_CACHE_NAME_PREFIX;
    private String versionSuffix = DEFAULT_VERSION_SUFFIX;
    private List<String> legacyCachePrefixes = List.of("skymap-cache-");
    private List<String> legacyMetadataKeys = List.of("skymap-cache-version");
    private URI resourceOrigin;
    private Path cacheDirectory;
    private int tileBatchSize = DEFAULT_TILE_BATCH_SIZE;
    private long compressionThresholdBytes = DEFAULT_COMPRESSION_THRESHOLD_BYTES;
    private long averageTileSizeBytes = DEFAULT_AVERAGE_TILE_SIZE_BYTES;
    private long memoryCacheMaxBytes = DEFAULT_MEMORY_CACHE_MAX_BYTES;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

    private Builder() {
    }

    public Builder cacheNamePrefix(String cacheNamePrefix) {
      this.cacheNamePrefix = cacheNamePrefix;
      return this;
    }

    public Builder versionSuffix(String versionSuffix) {
      this.versionSuffix = versionSuffix;
      return this;
    }

    public Builder legacyCachePrefixes(List<String> legacyCachePrefixes) {
      this.legacyCachePrefixes = requireNonNull(legacyCachePrefixes, "legacyCachePrefixes must not be null");
      return this;
    }

    public Builder legacyMetadataKeys(List<String> legacyMetadataKeys) {
      this.legacyMetadataKeys = requireNonNull(legacyMetadataKeys, "legacyMetadataKeys must not be null");
      return this;
    }

    public Builder resourceOrigin(URI resourceOrigin) {
      this.resourceOrigin = resourceOrigin;
      return this;
    }

    public Builder cacheDirectory(Path cacheDirectory) {
      this.cacheDirectory = cacheDirectory;
      return this;
    }

    public Builder tileBatchSize(int tileBatchSize) {
      this.tileBatchSize = tileBatchSize;
      return this;
    }

    public Builder compressionThresholdBytes(long compressionThresholdBytes) {
      this.compressionThresholdBytes = compressionThresholdBytes;
      return this;
    }

    public Builder averageTileSizeBytes(long averageTileSizeBytes) {
      this.averageTileSizeBytes = averageTileSizeBytes;
      return this;
    }

    public Builder memoryCacheMaxBytes(long memoryCacheMaxBytes) {
      this.memoryCacheMaxBytes = memoryCacheMaxBytes;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public OfflineCacheConfig build() {
      validate();
      return new OfflineCacheConfig(this);
    }

    private void validate() {
      if (cacheNamePrefix == null || cacheNamePrefix.isBlank())
        throw new IllegalArgumentException("cacheNamePrefix is required");

      if (versionSuffix == null || !versionSuffix.matches("v\\d+"))
        throw new IllegalArgumentException("versionSuffix must look like v{n}, got: " + versionSuffix);

      if (resourceOrigin != null && !resourceOrigin.isAbsolute())
        throw new IllegalArgumentException("resourceOrigin must be absolute, got: " + resourceOrigin);

      if (tileBatchSize < 1)
        throw new IllegalArgumentException("tileBatchSize must be >= 1, got: " + tileBatchSize);

      if (compressionThresholdBytes < 0)
        throw new IllegalArgumentException("compressionThresholdBytes must be >= 0, got: " + compressionThresholdBytes);

      if (averageTileSizeBytes < 0)
        throw new IllegalArgumentException("averageTileSizeBytes must be >= 0, got: " + averageTileSizeBytes);

      if (memoryCacheMaxBytes < 0)
        throw new IllegalArgumentException("memoryCacheMaxBytes must be >= 0, got: " + memoryCacheMaxBytes);

      if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative())
        throw new IllegalArgumentException("requestTimeout must be positive, got: " + requestTimeout);

      if (retryPolicy == null)
        throw new IllegalArgumentException("retryPolicy is required");
    }
  }
}
