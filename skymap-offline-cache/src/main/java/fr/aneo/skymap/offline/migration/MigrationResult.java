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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of {@link CacheVersionMigrator#runMigrations()}.
 *
 * @param fromVersion   version found before migrating, 0 for a fresh install
 * @param toVersion     version stamped after migrating
 * @param migratedItems items migrated by all steps
 * @param deletedItems  items deleted by all steps
 * @param errors        one message per failed step or write
 */
public record MigrationResult(int fromVersion, int toVersion, int migratedItems, int deletedItems, List<String> errors) {

  public MigrationResult {
    errors = List.copyOf(requireNonNull(errors, "errors must not be null"));
  }

  public static MigrationResult upToDate(int version) {
    return new MigrationResult(version, version, 0, 0, List.of());
  }

  public boolean success() {
    return errors.isEmpty();
  }
}
