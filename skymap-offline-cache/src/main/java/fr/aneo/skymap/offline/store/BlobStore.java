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

import java.util.List;
import java.util.Optional;

/**
 * Host key/value blob storage, organised in named partitions.
 * <p>
 * A partition is created implicitly by its first {@link #put}. Keys are opaque strings, typically
 * the URL a payload was fetched from. Listing order of keys is implementation-defined.
 * <p>
 * When {@link #isAvailable()} is {@code false} every other operation may fail; callers check it
 * first and degrade. Operations that modify the store throw {@link StorageException} when the host
 * rejects them.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must be thread-safe.
 * </p>
 */
public interface BlobStore {

  /**
   * @return whether the host storage can currently be used
   */
  boolean isAvailable();

  /**
   * Stores {@code data} under {@code key} in {@code partition}, replacing any previous value.
   *
   * @throws StorageException if the host rejects the write
   */
  void put(String partition, String key, byte[] data);

  /**
   * @return the stored bytes, or empty when the key or the partition does not exist
   */
  Optional<byte[]> match(String partition, String key);

  boolean contains(String partition, String key);

  /**
   * @return {@code true} if an entry was removed
   */
  boolean delete(String partition, String key);

  /**
   * @return the keys of {@code partition}, empty when the partition does not exist
   */
  List<String> listKeys(String partition);

  List<String> listPartitions();

  /**
   * @return {@code true} if the partition existed and was removed
   * @throws StorageException if the host rejects the removal
   */
  boolean deletePartition(String partition);

  /**
   * @return total stored bytes of {@code partition}, zero when it does not exist
   */
  long sizeOf(String partition);

  /**
   * Host storage usage and quota, when the store can tell.
   */
  default Optional<StorageEstimate> estimate() {
    return Optional.empty();
  }
}
