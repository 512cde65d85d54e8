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

import com.google.common.io.BaseEncoding;
import fr.aneo.skymap.offline.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * {@link BlobStore} persisting every partition as a directory under a root directory.
 * <p>
 * Keys are arbitrary strings (URLs), so each entry file is named after the unpadded URL-safe
 * Base64 encoding of its key. Writes go to a temporary file first and are moved into place, so a
 * crash never leaves a truncated entry behind.
 * <p>
 * Partition names are used verbatim as directory names and are restricted to
 * {@code [A-Za-z0-9._-]}; other directories under the root are not listed as partitions.
 */
public final class FileSystemBlobStore implements BlobStore {
  private static final Logger logger = LoggerFactory.getLogger(FileSystemBlobStore.class);
  private static final BaseEncoding KEY_ENCODING = BaseEncoding.base64Url().omitPadding();
  private static final Pattern PARTITION_NAME = Pattern.compile("[A-Za-z0-9._-]+");
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path root;

  public FileSystemBlobStore(Path root) {
    this.root = requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      logger.warn("Cannot create cache directory {}, storage will be unavailable", this.root, e);
    }
  }

  public Path root() {
    return root;
  }

  @Override
  public boolean isAvailable() {
    return Files.isDirectory(root) && Files.isWritable(root);
  }

  @Override
  public void put(String partition, String key, byte[] data) {
    requireNonNull(key, "key must not be null");
    requireNonNull(data, "data must not be null");
    var directory = partitionDirectory(partition);
    var target = directory.resolve(encode(key));
    try {
      Files.createDirectories(directory);
      var temp = Files.createTempFile(directory, "entry", TEMP_SUFFIX);
      Files.write(temp, data);
      moveIntoPlace(temp, target);
    } catch (IOException e) {
      throw new StorageException("Failed to store " + key + " in partition " + partition, e);
    }
  }

  @Override
  public Optional<byte[]> match(String partition, String key) {
    requireNonNull(key, "key must not be null");
    var file = partitionDirectory(partition).resolve(encode(key));
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key + " from partition " + partition, e);
    }
  }

  @Override
  public boolean contains(String partition, String key) {
    requireNonNull(key, "key must not be null");
    return Files.isRegularFile(partitionDirectory(partition).resolve(encode(key)));
  }

  @Override
  public boolean delete(String partition, String key) {
    requireNonNull(key, "key must not be null");
    try {
      return Files.deleteIfExists(partitionDirectory(partition).resolve(encode(key)));
    } catch (IOException e) {
      throw new StorageException("Failed to delete " + key + " from partition " + partition, e);
    }
  }

  @Override
  public List<String> listKeys(String partition) {
    var directory = partitionDirectory(partition);
    if (!Files.isDirectory(directory)) return List.of();
    try (Stream<Path> files = Files.list(directory)) {
      return files.map(file -> file.getFileName().toString())
                  .filter(name -> !name.endsWith(TEMP_SUFFIX))
                  .map(FileSystemBlobStore::decode)
                  .flatMap(Optional::stream)
                  .sorted()
                  .toList();
    } catch (IOException e) {
      throw new StorageException("Failed to list partition " + partition, e);
    }
  }

  @Override
  public List<String> listPartitions() {
    if (!Files.isDirectory(root)) return List.of();
    try (Stream<Path> entries = Files.list(root)) {
      return entries.filter(Files::isDirectory)
                    .map(directory -> directory.getFileName().toString())
                    .filter(FileSystemBlobStore::isPartitionName)
                    .sorted()
                    .toList();
    } catch (IOException e) {
      throw new StorageException("Failed to list partitions of " + root, e);
    }
  }

  @Override
  public boolean deletePartition(String partition) {
    var directory = partitionDirectory(partition);
    if (!Files.isDirectory(directory)) return false;
    try (Stream<Path> paths = Files.walk(directory)) {
      paths.sorted(Comparator.reverseOrder()).forEach(FileSystemBlobStore::deleteOrThrow);
      return true;
    } catch (IOException | UncheckedIOException e) {
      throw new StorageException("Failed to delete partition " + partition, e);
    }
  }

  @Override
  public long sizeOf(String partition) {
    var directory = partitionDirectory(partition);
    if (!Files.isDirectory(directory)) return 0;
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(Files::isRegularFile).mapToLong(FileSystemBlobStore::sizeOfFile).sum();
    } catch (IOException | UncheckedIOException e) {
      throw new StorageException("Failed to measure partition " + partition, e);
    }
  }

  @Override
  public Optional<StorageEstimate> estimate() {
    if (!isAvailable()) return Optional.empty();
    try {
      var usage = listPartitions().stream().mapToLong(this::sizeOf).sum();
      var usable = Files.getFileStore(root).getUsableSpace();
      return Optional.of(new StorageEstimate(usage, usage + usable));
    } catch (IOException | StorageException e) {
      logger.warn("Cannot estimate storage usage of {}", root, e);
      return Optional.empty();
    }
  }

  private static boolean isPartitionName(String name) {
    if (PARTITION_NAME.matcher(name).matches()) return true;
    logger.debug("Ignoring directory '{}', not a partition name", name);
    return false;
  }

  private Path partitionDirectory(String partition) {
    requireNonNull(partition, "partition must not be null");
    if (!PARTITION_NAME.matcher(partition).matches()) {
      throw new IllegalArgumentException("Invalid partition name: '" + partition + "'");
    }
    return root.resolve(partition);
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String encode(String key) {
    return KEY_ENCODING.encode(key.getBytes(StandardCharsets.UTF_8));
  }

  private static Optional<String> decode(String fileName) {
    try {
      return Optional.of(new String(KEY_ENCODING.decode(fileName), StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      logger.debug("Ignoring foreign file {} in cache directory", fileName);
      return Optional.empty();
    }
  }

  private static void deleteOrThrow(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static long sizeOfFile(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
