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

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static java.util.Objects.requireNonNull;

/**
 * Schema version stamp of the cache, persisted as JSON in the metadata slot:
 * <pre>{@code
 * {"version": 1, "migratedAt": "2026-01-01T00:00:00Z", "description": "Remove unversioned legacy partitions"}
 * }</pre>
 *
 * @param version     schema version, &gt;= 1
 * @param migratedAt  when the version was written
 * @param description what the last migration did
 */
public record CacheSchemaVersion(int version, Instant migratedAt, String description) {

  public CacheSchemaVersion {
    requireNonNull(migratedAt, "migratedAt must not be null");
    requireNonNull(description, "description must not be null");
    if (version < 1) throw new IllegalArgumentException("version must be >= 1, got: " + version);
  }

  public String toJson() {
    var json = new JsonObject();
    json.addProperty("version", version);
    json.addProperty("migratedAt", migratedAt.toString());
    json.addProperty("description", description);
    return json.toString();
  }

  /**
   * @throws IllegalArgumentException if {@code json} is not a valid version stamp
   */
  public static CacheSchemaVersion fromJson(String json) {
    requireNonNull(json, "json must not be null");
    try {
      var root = JsonParser.parseString(json).getAsJsonObject();
      if (!root.has("version") || !root.has("migratedAt")) {
        throw new IllegalArgumentException("Cache version JSON must contain 'version' and 'migratedAt', got: " + json);
      }
      var description = root.has("description") ? root.get("description").getAsString() : "";
      return new CacheSchemaVersion(
        root.get("version").getAsInt(),
        Instant.parse(root.get("migratedAt").getAsString()),
        description);
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid cache version JSON: " + json, e);
    }
  }
}
