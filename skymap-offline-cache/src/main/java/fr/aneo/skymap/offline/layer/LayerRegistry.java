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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable catalog of the downloadable layers.
 * <p>
 * The bundled catalog is read from the {@value #DEFAULT_RESOURCE} class-path resource, a JSON array
 * of objects:
 * <pre>{@code
 * [
 *   {
 *     "id": "stars",
 *     "displayName": "Star Catalogs",
 *     "description": "Star catalogs for rendering",
 *     "baseUrl": "/stellarium-data/stars/",
 *     "files": ["info.json", "stars_0.json"],
 *     "estimatedSizeBytes": 5242880,
 *     "priority": 1
 *   }
 * ]
 * }</pre>
 * Layers are kept sorted by priority.
 */
public final class LayerRegistry {
  public static final String DEFAULT_RESOURCE = "skymap-layers.json";

  private final Map<String, LayerDescriptor> layers;

  private LayerRegistry(Collection<LayerDescriptor> descriptors) {
    var sorted = new ArrayList<>(descriptors);
    sorted.sort(Comparator.comparingInt(LayerDescriptor::priority));
    var byId = new LinkedHashMap<String, LayerDescriptor>();
    for (var descriptor : sorted) {
      if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
        throw new IllegalArgumentException("Duplicate layer id: " + descriptor.id());
      }
    }
    this.layers = byId;
  }

  public static LayerRegistry of(Collection<LayerDescriptor> descriptors) {
    requireNonNull(descriptors, "descriptors must not be null");
    return new LayerRegistry(descriptors);
  }

  /**
   * Loads the catalog bundled with the library.
   *
   * @throws IllegalStateException if the resource is missing
   */
  public static LayerRegistry loadDefault() {
    var stream = LayerRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (stream == null) {
      throw new IllegalStateException("Missing class-path resource " + DEFAULT_RESOURCE);
    }
    try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * Parses a catalog.
   *
   * @throws IllegalArgumentException if the JSON is malformed or a descriptor is invalid
   */
  public static LayerRegistry fromJson(Reader reader) {
    requireNonNull(reader, "reader must not be null");
    try {
      var root = JsonParser.parseReader(reader);
      if (!root.isJsonArray()) {
        throw new IllegalArgumentException("Layer catalog must be a JSON array");
      }
      var descriptors = new ArrayList<LayerDescriptor>();
      for (var element : root.getAsJsonArray()) {
        descriptors.add(parseDescriptor(element));
      }
      return new LayerRegistry(descriptors);
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
      throw new IllegalArgumentException("Invalid layer catalog", e);
    }
  }

  public Optional<LayerDescriptor> find(String layerId) {
    return Optional.ofNullable(layers.get(layerId));
  }

  /**
   * @throws IllegalArgumentException if no layer has this id
   */
  public LayerDescriptor get(String layerId) {
    return find(layerId).orElseThrow(() -> new IllegalArgumentException("Unknown layer: " + layerId));
  }

  public boolean contains(String layerId) {
    return layers.containsKey(layerId);
  }

  /**
   * @return every layer, by ascending priority
   */
  public List<LayerDescriptor> all() {
    return List.copyOf(layers.values());
  }

  public List<String> ids() {
    return List.copyOf(layers.keySet());
  }

  private static LayerDescriptor parseDescriptor(JsonElement element) {
    var object = element.getAsJsonObject();
    return new LayerDescriptor(
      requiredString(object, "id"),
      requiredString(object, "displayName"),
      object.has("description") ? object.get("description").getAsString() : "",
      requiredString(object, "baseUrl"),
      files(object),
      object.has("estimatedSizeBytes") ? object.get("estimatedSizeBytes").getAsLong() : 0L,
      object.has("priority") ? object.get("priority").getAsInt() : Integer.MAX_VALUE
    );
  }

  private static String requiredString(JsonObject object, String member) {
    if (!object.has(member) || !object.get(member).isJsonPrimitive()) {
      throw new IllegalArgumentException("Layer entry must contain '" + member + "' string, got: " + object);
    }
    return object.get(member).getAsString();
  }

  private static List<String> files(JsonObject object) {
    if (!object.has("files") || !object.get("files").isJsonArray()) {
      throw new IllegalArgumentException("Layer entry must contain 'files' array, got: " + object);
    }
    JsonArray array = object.getAsJsonArray("files");
    var files = new ArrayList<String>(array.size());
    array.forEach(file -> files.add(file.getAsString()));
    return files;
  }
}
