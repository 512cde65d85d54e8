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
package fr.aneo.skymap.offline.layer;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Static description of a downloadable data layer of the planetarium engine.
 *
 * @param id                 stable identifier, also part of the partition name
 * @param displayName        human-readable name
 * @param description        short description
 * @param baseUrl            prefix prepended to every file; absolute or relative to the resource origin
 * @param files              file paths relative to {@code baseUrl}, in download order; never empty
 * @param estimatedSizeBytes rough size of the whole layer
 * @param priority           download order, lower first
 */
public record LayerDescriptor(
  String id,
  String displayName,
  String description,
  String baseUrl,
  List<String> files,
  long estimatedSizeBytes,
  int priority
) {

  public LayerDescriptor {
    requireNonNull(id, "id must not be null");
    requireNonNull(displayName, "displayName must not be null");
    requireNonNull(description, "description must not be null");
    requireNonNull(baseUrl, "baseUrl must not be null");
    requireNonNull(files, "files must not be null");
    if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    if (files.isEmpty()) throw new IllegalArgumentException("files must not be empty for layer " + id);
    if (estimatedSizeBytes < 0) {
      throw new IllegalArgumentException("estimatedSizeBytes must be >= 0, got: " + estimatedSizeBytes);
    }
    files = List.copyOf(files);
  }

  /**
   * @return the URL of {@code file}, which is also its cache key
   */
  public String resolve(String file) {
    return baseUrl + file;
  }

  public List<String> urls() {
    return files.stream().map(this::resolve).toList();
  }
}
