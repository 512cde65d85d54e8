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

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

public final class InMemoryMetadataSlot implements MetadataSlot {
  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(requireNonNull(key, "key must not be null")));
  }

  @Override
  public void put(String key, String value) {
    values.put(requireNonNull(key, "key must not be null"), requireNonNull(value, "value must not be null"));
  }

  @Override
  public boolean remove(String key) {
    return values.remove(requireNonNull(key, "key must not be null")) != null;
  }

  @Override
  public Set<String> keys() {
    return Set.copyOf(values.keySet());
  }
}
