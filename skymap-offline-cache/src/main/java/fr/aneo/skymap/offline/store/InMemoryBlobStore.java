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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Heap-backed {@link BlobStore}.
 * <p>
 * Used when no cache directory is configured, and as the store of choice in tests. Availability can
 * be switched off to emulate a host where storage is disabled. An optional quota turns
 * {@link #estimate()} on and makes writes beyond it fail.
 */
public final class InMemoryBlobStore implements BlobStore {
  private final Map<String, Map<String, byte[]>> partitions = new ConcurrentHashMap<>();
  private final long quotaBytes;
  private volatile boolean available = true;

  public InMemoryBlobStore() {
    this(-1);
  }

  /**
   * @param quotaBytes maximum total bytes, or a negative value for no quota
   */
  public InMemoryBlobStore(long quotaBytes) {
    this.quotaBytes = quotaBytes;
  }

  public void setAvailable(boolean available) {
    this.available = available;
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public void put(String partition, String key, byte[] data) {
    requireNonNull(partition, "partition must not be null");
    requireNonNull(key, "key must not be null");
    requireNonNull(data, "data must not be null");
    checkAvailable();

    if (quotaBytes >= 0 && totalBytes() + data.length > quotaBytes) {
      throw new StorageException("Quota of " + quotaBytes + " bytes exceeded writing " + key);
    }
    partitions.computeIfAbsent(partition, p -> Collections.synchronizedMap(new LinkedHashMap<>()))
              .put(key, data.clone());
  }

  @Override
  public Optional<byte[]> match(String partition, String key) {
    checkAvailable();
    var entries = partitions.get(partition);
    if (entries == null) return Optional.empty();
    return Optional.ofNullable(entries.get(key)).map(byte[]::clone);
  }

  @Override
  public boolean contains(String partition, String key) {
    checkAvailable();
    var entries = partitions.get(partition);
    return entries != null && entries.containsKey(key);
  }

  @Override
  public boolean delete(String partition, String key) {
    checkAvailable();
    var entries = partitions.get(partition);
    return entries != null && entries.remove(key) != null;
  }

  @Override
  public List<String> listKeys(String partition) {
    checkAvailable();
    var entries = partitions.get(partition);
    if (entries == null) return List.of();
    synchronized (entries) {
      return List.copyOf(entries.keySet());
    }
  }

  @Override
  public List<String> listPartitions() {
    checkAvailable();
    return partitions.keySet().stream().sorted().toList();
  }

  @Override
  public boolean deletePartition(String partition) {
    checkAvailable();
    return partitions.remove(partition) != null;
  }

  @Override
  public long sizeOf(String partition) {
    checkAvailable();
    var entries = partitions.get(partition);
    if (entries == null) return 0;
    synchronized (entries) {
      return entries.values().stream().mapToLong(data -> data.length).sum();
    }
  }

  @Override
  public Optional<StorageEstimate> estimate() {
    if (quotaBytes < 0 || !available) return Optional.empty();
    return Optional.of(new StorageEstimate(totalBytes(), quotaBytes));
  }

  private long totalBytes() {
    return partitions.keySet().stream().mapToLong(this::sizeOf).sum();
  }

  private void checkAvailable() {
    if (!available) throw new StorageException("Storage is not available");
  }
}
