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
package fr.aneo.skymap.offline.store;

import fr.aneo.skymap.offline.exception.StorageException;

import java.util.Optional;
import java.util.Set;

/**
 * Small persistent string key/value store holding the cache schema version and a few flags.
 * <p>
 * Writes throw {@link StorageException} when the host rejects them.
 */
public interface MetadataSlot {

  Optional<String> get(String key);

  void put(String key, String value);

  /**
   * @return {@code true} if the key was present
   */
  boolean remove(String key);

  Set<String> keys();
}
