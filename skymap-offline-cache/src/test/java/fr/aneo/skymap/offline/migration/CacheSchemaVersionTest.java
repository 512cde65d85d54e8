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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheSchemaVersionTest {

  @Test
  @DisplayName("fromJson reads the stamp written by toJson")
  void fromJson_reads_stamp() {
    // Given
    var json = "{\"version\":1,\"migratedAt\":\"2026-03-01T10:00:00Z\",\"description\":\"Initial cache version\"}";

    // When
    var version = CacheSchemaVersion.fromJson(json);

    // Then
    assertThat(version).isEqualTo(new CacheSchemaVersion(1, Instant.parse("2026-03-01T10:00:00Z"), "Initial cache version"));
    assertThat(version.toJson()).isEqualTo(json);
  }

  @Test
  @DisplayName("description is optional")
  void description_is_optional() {
    assertThat(CacheSchemaVersion.fromJson("{\"version\":2,\"migratedAt\":\"2026-03-01T10:00:00Z\"}").description()).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "not json",
    "[]",
    "{\"version\":1}",
    "{\"version\":0,\"migratedAt\":\"2026-03-01T10:00:00Z\"}",
    "{\"version\":1,\"migratedAt\":\"yesterday\"}"
  })
  @DisplayName("fromJson rejects invalid stamps")
  void fromJson_rejects_invalid_stamps(String json) {
    assertThatThrownBy(() -> CacheSchemaVersion.fromJson(json)).isInstanceOf(IllegalArgumentException.class);
  }
}
