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

import fr.aneo.skymap.offline.store.BlobStore;
import fr.aneo.skymap.offline.store.MetadataSlot;
import fr.aneo.skymap.offline.store.PartitionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Version 1: deletes partitions written before partition names carried a {@code -v{n}} suffix, and
 * the metadata keys those releases used.
 * <p>
 * A partition is legacy when it starts with the current cache prefix or one of the legacy prefixes
 * and does not end with a version suffix. Versioned partitions are never touched.
 */
public final class LegacyPartitionCleanup implements MigrationStep {
  private static final Logger logger = LoggerFactory.getLogger(LegacyPartitionCleanup.class);

  private final List<String> prefixes;
  private final List<String> legacyMetadataKeys;

  public LegacyPartitionCleanup(PartitionNames partitionNames, List<String> legacyPrefixes, List<String> legacyMetadataKeys) {
    requireNonNull(partitionNames, "partitionNames must not be null");
    requireNonNull(legacyPrefixes, "legacyPrefixes must not be null");
    this.legacyMetadataKeys = List.copyOf(requireNonNull(legacyMetadataKeys, "legacyMetadataKeys must not be null"));
    var all = new ArrayList<String>();
    all.add(partitionNames.prefix());
    all.addAll(legacyPrefixes);
    this.prefixes = List.copyOf(all);
  }

  @Override
  public int version() {
    return 1;
  }

  @Override
  public String description() {
    return "Remove unversioned legacy partitions";
  }

  @Override
  public MigrationStepResult apply(BlobStore store, MetadataSlot metadata) {
    var deleted = 0;
    for (var partition : store.listPartitions()) {
      if (isLegacy(partition) && store.deletePartition(partition)) {
        logger.info("Deleted legacy partition {}", partition);
        deleted++;
      }
    }
    for (var key : legacyMetadataKeys) {
      if (metadata.remove(key)) {
        logger.info("Removed legacy metadata key {}", key);
        deleted++;
      }
    }
    return new MigrationStepResult(0, deleted);
  }

  private boolean isLegacy(String partition) {
    return prefixes.stream().anyMatch(partition::startsWith) && !PartitionNames.isVersioned(partition);
  }
}
