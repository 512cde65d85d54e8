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

/**
 * Upgrades the cache from {@code version() - 1} to {@code version()}.
 * <p>
 * A step must be safe to run again after a partial failure: running it on an already migrated cache
 * reports zero items.
 */
public interface MigrationStep {

  /**
   * @return the schema version this step produces
   */
  int version();

  String description();

  /**
   * @throws RuntimeException when the step cannot complete; the migrator records it and goes on
   */
  MigrationStepResult apply(BlobStore store, MetadataSlot metadata);
}
