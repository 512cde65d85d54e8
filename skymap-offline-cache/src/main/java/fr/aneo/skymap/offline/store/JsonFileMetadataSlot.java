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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import fr.aneo.skymap.offline.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * {@link MetadataSlot} persisted as a flat JSON object in a single file.
 * <p>
 * The file is loaded once at construction and rewritten on every change. A missing file is an empty
 * slot; an unreadable or malformed one is logged and treated as empty so that the next write
 * replaces it.
 */
public final class JsonFileMetadataSlot implements MetadataSlot {
  private static final Logger logger = LoggerFactory.getLogger(JsonFileMetadataSlot.class);
  private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, String>>() {}.getType();

  private final Gson gson = new Gson();
  private final Path file;
  private final Map<String, String> values;

  public JsonFileMetadataSlot(Path file) {
    this.file = requireNonNull(file, "file must not be null").toAbsolutePath().normalize();
    this.values = load(this.file);
  }

  @Override
  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(values.get(requireNonNull(key, "key must not be null")));
  }

  @Override
  public synchronized void put(String key, String value) {
    requireNonNull(key, "key must not be null");
    requireNonNull(value, "value must not be null");
    var previous = values.put(key, value);
    try {
      save();
    } catch (StorageException e) {
      if (previous == null) values.remove(key);
      else values.put(key, previous);
      throw e;
    }
  }

  @Override
  public synchronized boolean remove(String key) {
    requireNonNull(key, "key must not be null");
    var previous = values.remove(key);
    if (previous == null) return false;
    try {
      save();
    } catch (StorageException e) {
      values.put(key, previous);
      throw e;
    }
    return true;
  }

  @Override
  public synchronized Set<String> keys() {
    return Set.copyOf(values.keySet());
  }

  private void save() {
    try {
      var parent = file.getParent();
      if (parent != null) Files.createDirectories(parent);
      var temp = file.resolveSibling(file.getFileName() + ".tmp");
      Files.writeString(temp, gson.toJson(values, MAP_TYPE), StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new StorageException("Failed to write metadata file " + file, e);
    }
  }

  private Map<String, String> load(Path source) {
    if (!Files.exists(source)) return new LinkedHashMap<>();
    try {
      Map<String, String> loaded = gson.fromJson(Files.readString(source, StandardCharsets.UTF_8), MAP_TYPE);
      return loaded == null ? new LinkedHashMap<>() : new LinkedHashMap<>(loaded);
    } catch (IOException | JsonParseException e) {
      logger.warn("Ignoring unreadable metadata file {}", source, e);
      return new LinkedHashMap<>();
    }
  }
}
