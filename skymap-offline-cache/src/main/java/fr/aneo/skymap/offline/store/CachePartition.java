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

import fr.aneo.skymap.offline.codec.CompressionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One named partition of a {@link BlobStore}, written and read through the {@link CompressionCodec}.
 * <p>
 * Payloads are compressed on the way in when the codec deems it worthwhile and transparently
 * decompressed on the way out. Every payload reads back byte for byte as it was written.
 */
public final class CachePartition {
  private static final Logger logger = LoggerFactory.getLogger(CachePartition.class);

  private final BlobStore store;
  private final String name;
  private final CompressionCodec codec;

  public CachePartition(BlobStore store, String name, CompressionCodec codec) {
    this.store = requireNonNull(store, "store must not be null");
    this.name = requireNonNull(name, "name must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
  }

  public String name() {
    return name;
  }

  /**
   * Stores {@code data} under {@code key}, compressing it when its content type and size allow.
   *
   * @return number of bytes actually written
   * @throws fr.aneo.skymap.offline.exception.StorageException if the store rejects the write
   */
  public long put(String key, byte[] data, String contentType) {
    requireNonNull(key, "key must not be null");
    requireNonNull(data, "data must not be null");

    var stored = codec.escapeRaw(data);
    if (codec.shouldCompress(data.length, contentType)) {
      var payload = codec.compress(data);
      if (payload.compressed()) {
        logger.trace("Compressed {} from {} to {} bytes", key, payload.originalSizeBytes(), payload.compressedSizeBytes());
        stored = payload.data();
      }
    }
    store.put(name, key, stored);
    return stored.length;
  }

  public Optional<byte[]> get(String key) {
    return store.match(name, key).map(codec::decompress);
  }

  public boolean contains(String key) {
    return store.contains(name, key);
  }

  public List<String> keys() {
    return store.listKeys(name);
  }

  public long sizeBytes() {
    return store.sizeOf(name);
  }

  public boolean delete() {
    return store.deletePartition(name);
  }
}
