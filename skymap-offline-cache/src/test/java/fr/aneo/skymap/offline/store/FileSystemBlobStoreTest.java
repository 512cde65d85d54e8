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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemBlobStoreTest {

  @TempDir
  Path tempDir;

  private FileSystemBlobStore store;

  @BeforeEach
  void setUp() {
    store = new FileSystemBlobStore(tempDir.resolve("cache"));
  }

  @Test
  @DisplayName("creates the root directory and reports itself available")
  void creates_root_directory() {
    assertThat(store.isAvailable()).isTrue();
    assertThat(tempDir.resolve("cache")).isDirectory();
  }

  @Test
  @DisplayName("URL keys survive a round trip through file names")
  void url_keys_survive_file_names() {
    // Given
    var key = "https://alasky.test/DSS/Norder3/Dir0/Npix42.jpg?x=1&y=é";

    // When
    store.put("skymap-offline-hips-DSS-v1", key, "tile".getBytes(StandardCharsets.UTF_8));

    // Then
    assertThat(store.contains("skymap-offline-hips-DSS-v1", key)).isTrue();
    assertThat(store.listKeys("skymap-offline-hips-DSS-v1")).containsExactly(key);
    assertThat(store.match("skymap-offline-hips-DSS-v1", key)).hasValue("tile".getBytes(StandardCharsets.UTF_8));
    assertThat(store.sizeOf("skymap-offline-hips-DSS-v1")).isEqualTo(4);
  }

  @Test
  @DisplayName("put replaces an existing entry")
  void put_replaces_existing_entry() {
    // Given
    store.put("p", "k", new byte[]{1});

    // When
    store.put("p", "k", new byte[]{2, 3});

    // Then
    assertThat(store.match("p", "k")).hasValue(new byte[]{2, 3});
    assertThat(store.listKeys("p")).hasSize(1);
  }

  @Test
  @DisplayName("partitions are listed sorted and deleted recursively")
  void partitions_are_listed_and_deleted() {
    // Given
    store.put("b-v1", "k", new byte[]{1});
    store.put("a-v1", "k", new byte[]{1});

    // Then
    assertThat(store.listPartitions()).containsExactly("a-v1", "b-v1");
    assertThat(store.deletePartition("a-v1")).isTrue();
    assertThat(store.deletePartition("a-v1")).isFalse();
    assertThat(store.listPartitions()).containsExactly("b-v1");
    assertThat(store.delete("b-v1", "k")).isTrue();
    assertThat(store.delete("b-v1", "k")).isFalse();
  }

  @Test
  @DisplayName("missing partitions read as empty")
  void missing_partitions_read_as_empty() {
    assertThat(store.listKeys("absent")).isEmpty();
    assertThat(store.match("absent", "k")).isEmpty();
    assertThat(store.sizeOf("absent")).isZero();
  }

  @Test
  @DisplayName("partition names that could escape the root are rejected")
  void unsafe_partition_names_are_rejected() {
    assertThatThrownBy(() -> store.put("../escape", "k", new byte[1])).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.listKeys("a/b")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("foreign files in a partition directory are ignored")
  void foreign_files_are_ignored() throws IOException {
    // Given
    store.put("p", "k", new byte[]{1});
    Files.writeString(tempDir.resolve("cache").resolve("p").resolve("not base64!"), "x");

    // Then
    assertThat(store.listKeys("p")).containsExactly("k");
  }

  @Test
  @DisplayName("estimate reports the bytes held by the partitions")
  void estimate_reports_usage() {
    // Given
    store.put("p", "k", new byte[100]);

    // When
    var estimate = store.estimate();

    // Then
    assertThat(estimate).isPresent();
    assertThat(estimate.get().usageBytes()).isEqualTo(100);
    assertThat(estimate.get().quotaBytes()).isGreaterThanOrEqualTo(100);
  }

  @Test
  @DisplayName("directories that are not valid partition names are not listed")
  void invalid_directory_names_are_not_listed() throws IOException {
    // Given
    store.put("skymap-offline-stars-v1", "k", new byte[]{1});
    Files.createDirectories(tempDir.resolve("cache").resolve("skymap-offline-bad name"));

    // When
    var partitions = store.listPartitions();

    // Then
    assertThat(partitions).containsExactly("skymap-offline-stars-v1");
  }
}
