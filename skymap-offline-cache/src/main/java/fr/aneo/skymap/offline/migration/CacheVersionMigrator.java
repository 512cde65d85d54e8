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
package fr.aneo.skymap.offline.migration;

import fr.aneo.skymap.offline.exception.StorageException;
import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.MetadataSlot;
import fr.aneo.skymap.offline.store.PartitionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Brings the stored cache schema up to {@link #CURRENT_VERSION}.
 * <p>
 * The stored version lives in the metadata slot under {@value #VERSION_KEY}. A missing stamp means a
 * fresh install (version 0). {@link #runMigrations()} applies, in ascending order, every registered
 * step whose version lies in {@code (stored, CURRENT_VERSION]}.
 * <p>
 * Migration is best effort: a failing step is logged and recorded in
 * {@link MigrationResult#errors()}, and the version stamp is still written, since every cached
 * payload can be downloaded again.
 * <p>
 * The migrator must run before any download starts; {@code SkymapOfflineCache.initializeCacheSystem()}
 * takes care of that ordering.
 */
public final class CacheVersionMigrator {
  private static final Logger logger = LoggerFactory.getLogger(CacheVersionMigrator.class);

  public static final int CURRENT_VERSION = 1;
  public static final String VERSION_KEY = "skymap-offline-cache-version";

  private final BlobStore store;
  private final MetadataSlot metadata;
  private final PartitionNames partitionNames;
  private final List<MigrationStep> steps;
  private final Set<String> legacyMetadataKeys;
  private final int currentVersion;
  private final Clock clock;
  private volatile MigrationState state = MigrationState.UNKNOWN;

  public CacheVersionMigrator(BlobStore store,
                              MetadataSlot metadata,
                              PartitionNames partitionNames,
                              Collection<? extends MigrationStep> steps,
                              Collection<String> legacyMetadataKeys,
                              Clock clock) {
    this(store, metadata, partitionNames, steps, legacyMetadataKeys, clock, CURRENT_VERSION);
  }

  CacheVersionMigrator(BlobStore store,
                       MetadataSlot metadata,
                       PartitionNames partitionNames,
                       Collection<? extends MigrationStep> steps,
                       Collection<String> legacyMetadataKeys,
                       Clock clock,
                       int currentVersion) {
    this.store = requireNonNull(store, "store must not be null");
    this.metadata = requireNonNull(metadata, "metadata must not be null");
    this.partitionNames = requireNonNull(partitionNames, "partitionNames must not be null");
    this.legacyMetadataKeys = Set.copyOf(requireNonNull(legacyMetadataKeys, "legacyMetadataKeys must not be null"));
    this.clock = requireNonNull(clock, "clock must not be null");
    this.currentVersion = currentVersion;

    var sorted = new ArrayList<MigrationStep>(requireNonNull(steps, "steps must not be null"));
    sorted.sort(Comparator.comparingInt(MigrationStep::version));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).version() == sorted.get(i - 1).version()) {
        throw new IllegalArgumentException("Duplicate migration step for version " + sorted.get(i).version());
      }
    }
    this.steps = List.copyOf(sorted);
  }

  /**
   * @return the stored version stamp; empty for a fresh install or an unreadable stamp
   */
  public Optional<CacheSchemaVersion> getCacheVersion() {
    try {
      return metadata.get(VERSION_KEY).flatMap(CacheVersionMigrator::parse);
    } catch (StorageException e) {
      logger.warn("Cannot read cache version", e);
      return Optional.empty();
    }
  }

  public boolean isMigrationNeeded() {
    var needed = storedVersion() < currentVersion;
    state = needed ? MigrationState.NEEDS_MIGRATION : MigrationState.UP_TO_DATE;
    return needed;
  }

  public MigrationState state() {
    return state;
  }

  public int currentVersion() {
    return currentVersion;
  }

  /**
   * Runs the pending migration steps and stamps the current version.
   * <p>
   * Calling it again right after is a no-op reporting zero items.
   *
   * @return what was migrated, deleted and what failed
   */
  public MigrationResult runMigrations() {
    var fromVersion = storedVersion();
    if (fromVersion >= currentVersion) {
      if (fromVersion > currentVersion) {
        logger.warn("Stored cache version {} is newer than supported version {}, leaving it untouched", fromVersion, currentVersion);
      }
      state = MigrationState.UP_TO_DATE;
      return MigrationResult.upToDate(fromVersion);
    }

    logger.atInfo()
          .addKeyValue("operation", "runMigrations")
          .addKeyValue("fromVersion", fromVersion)
          .addKeyValue("toVersion", currentVersion)
          .log("Migrating cache");

    var migrated = 0;
    var deleted = 0;
    var errors = new ArrayList<String>();
    var description = "Initial cache version";
    for (var step : steps) {
      if (step.version() <= fromVersion || step.version() > currentVersion) continue;
      try {
        var result = step.apply(store, metadata);
        migrated += result.migratedItems();
        deleted += result.deletedItems();
        description = step.description();
        logger.atDebug()
              .addKeyValue("operation", "runMigrations")
              .addKeyValue("version", step.version())
              .addKeyValue("migrated", result.migratedItems())
              .addKeyValue("deleted", result.deletedItems())
              .log("Migration step done");
      } catch (RuntimeException e) {
        logger.error("Migration to version {} failed", step.version(), e);
        errors.add("v" + step.version() + ": " + describe(e));
      }
    }

    try {
      var stamp = new CacheSchemaVersion(currentVersion, clock.instant(), description);
      metadata.put(VERSION_KEY, stamp.toJson());
    } catch (StorageException e) {
      logger.error("Failed to write cache version {}", currentVersion, e);
      errors.add("version stamp: " + describe(e));
    }
    state = MigrationState.UP_TO_DATE;

    if (!errors.isEmpty()) {
      logger.warn("Cache migrated to version {} with {} error(s): {}", currentVersion, errors.size(), errors);
    }
    return new MigrationResult(fromVersion, currentVersion, migrated, deleted, errors);
  }

  /**
   * Deletes every partition carrying the cache prefix, the prefixed and legacy metadata keys, and the
   * version stamp, so that the next startup migrates from scratch.
   *
   * @return {@code false} when storage is unavailable or fails
   */
  public boolean resetAllCaches() {
    if (!store.isAvailable()) return false;

    try {
      var partitions = store.listPartitions().stream().filter(partitionNames::isOwned).toList();
      partitions.forEach(store::deletePartition);
      var keys = metadata.keys().stream()
                         .filter(key -> key.startsWith(partitionNames.prefix()) || legacyMetadataKeys.contains(key))
                         .toList();
      keys.forEach(metadata::remove);
      metadata.remove(VERSION_KEY);
      state = MigrationState.NEEDS_MIGRATION;

      logger.atInfo()
            .addKeyValue("operation", "resetAllCaches")
            .addKeyValue("partitions", partitions.size())
            .addKeyValue("metadataKeys", keys.size())
            .log("All caches reset");
      return true;
    } catch (StorageException e) {
      logger.error("Failed to reset caches", e);
      return false;
    }
  }

  private int storedVersion() {
    return getCacheVersion().map(CacheSchemaVersion::version).orElse(0);
  }

  private static Optional<CacheSchemaVersion> parse(String json) {
    try {
      return Optional.of(CacheSchemaVersion.fromJson(json));
    } catch (IllegalArgumentException e) {
      logger.warn("Ignoring unreadable cache version stamp", e);
      return Optional.empty();
    }
  }

  private static String describe(Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
