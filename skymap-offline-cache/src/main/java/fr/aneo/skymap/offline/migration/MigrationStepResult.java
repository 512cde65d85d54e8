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

/**
 * Counts reported by one {@link MigrationStep}.
 */
public record MigrationStepResult(int migratedItems, int deletedItems) {

  public static final MigrationStepResult NOTHING = new MigrationStepResult(0, 0);

  public MigrationStepResult {
    if (migratedItems < 0) throw new IllegalArgumentException("migratedItems must be >= 0, got: " + migratedItems);
    if (deletedItems < 0) throw new IllegalArgumentException("deletedItems must be >= 0, got: " + deletedItems);
  }
}
