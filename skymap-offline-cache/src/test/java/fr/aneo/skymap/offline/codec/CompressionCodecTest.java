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
package fr.aneo.skymap.offline.codec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CompressionCodecTest {

  private CompressionCodec codec;

  @BeforeEach
  void setUp() {
    codec = CompressionCodec.gzip();
  }

  @Test
  @DisplayName("payloads at or below the threshold are not compressed")
  void small_payloads_are_not_compressed() {
    assertThat(codec.shouldCompress(100, "application/json")).isFalse();
    assertThat(codec.shouldCompress(1024, "application/json")).isFalse();
    assertThat(codec.shouldCompress(2000, "application/json")).isTrue();
  }

  @ParameterizedTest(name = "{0} is compressible")
  @ValueSource(strings = {
    "text/plain", "text/css; charset=utf-8", "application/json", "application/geo+json",
    "application/javascript", "application/x-javascript", "application/xml", "image/svg+xml", "APPLICATION/JSON"
  })
  @DisplayName("text-like content types are compressible")
  void text_like_content_types_are_compressible(String contentType) {
    assertThat(codec.shouldCompress(5000, contentType)).isTrue();
  }

  @ParameterizedTest(name = "{0} is not compressible")
  @NullSource
  @ValueSource(strings = {"image/jpeg", "image/png", "application/octet-stream", "application/fits"})
  @DisplayName("binary or unknown content types are not compressible")
  void binary_content_types_are_not_compressible(String contentType) {
    assertThat(codec.shouldCompress(5000, contentType)).isFalse();
  }

  @Test
  @DisplayName("compress shrinks repetitive JSON and decompress restores it")
  void compress_then_decompress_restores_payload() {
    // Given
    var json = "{\"stars\":[" + "{\"ra\":10.5,\"dec\":-20.25,\"mag\":4.1},".repeat(100) + "{}]}";
    var data = json.getBytes(StandardCharsets.UTF_8);

    // When
    var payload = codec.compress(data);

    // Then
    assertThat(payload.compressed()).isTrue();
    assertThat(payload.originalSizeBytes()).isEqualTo(data.length);
    assertThat(payload.compressedSizeBytes()).isLessThan(data.length);
    assertThat(payload.ratio()).isLessThan(1.0);
    assertThat(CompressionCodec.isCompressed(payload.data())).isTrue();
    assertThat(codec.decompress(payload.data())).isEqualTo(data);
  }

  @Test
  @DisplayName("incompressible input is kept as is")
  void incompressible_input_is_kept() {
    // Given
    var data = new byte[2048];
    new Random(42).nextBytes(data);

    // When
    var payload = codec.compress(data);

    // Then
    assertThat(payload.compressed()).isFalse();
    assertThat(payload.data()).isEqualTo(data);
    assertThat(payload.ratio()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("decompress passes raw entries through")
  void decompress_passes_raw_entries_through() {
    var raw = "plain entry".getBytes(StandardCharsets.UTF_8);

    assertThat(codec.decompress(raw)).isSameAs(raw);
    assertThat(codec.decompress(new byte[0])).isEmpty();
  }

  @Test
  @DisplayName("decompress returns the stored bytes when the compressed stream is corrupt")
  void decompress_returns_stored_bytes_when_corrupt() {
    // Given
    var corrupt = new byte[]{'S', 'K', 'Z', 1, 0x13, 0x37, 0x00};

    // When/Then
    assertThat(codec.decompress(corrupt)).isEqualTo(corrupt);
  }

  @Test
  @DisplayName("an unavailable facility disables compression")
  void unavailable_facility_disables_compression() {
    // Given
    var facility = mock(CompressionFacility.class);
    when(facility.isAvailable()).thenReturn(false);
    var disabled = new CompressionCodec(facility, 0);
    var data = "x".repeat(5000).getBytes(StandardCharsets.UTF_8);

    // Then
    assertThat(disabled.isAvailable()).isFalse();
    assertThat(disabled.shouldCompress(5000, "text/plain")).isFalse();
    assertThat(disabled.compress(data).compressed()).isFalse();
  }

  @Test
  @DisplayName("a failing facility falls back to the uncompressed payload")
  void failing_facility_falls_back_to_uncompressed() throws IOException {
    // Given
    var facility = mock(CompressionFacility.class);
    when(facility.isAvailable()).thenReturn(true);
    when(facility.compressing(any(OutputStream.class))).thenThrow(new IOException("deflater unavailable"));
    var failing = new CompressionCodec(facility, 0);
    var data = "x".repeat(5000).getBytes(StandardCharsets.UTF_8);

    // When
    var payload = failing.compress(data);

    // Then
    assertThat(payload.compressed()).isFalse();
    assertThat(payload.data()).isEqualTo(data);
  }

  @Test
  @DisplayName("escapeRaw only prefixes payloads that start with a marker")
  void escapeRaw_prefixes_marker_lookalikes_only() {
    // Given
    var plain = "plain entry".getBytes(StandardCharsets.UTF_8);
    var lookalike = new byte[]{'S', 'K', 'Z', 1, 7};

    // When
    var escaped = codec.escapeRaw(lookalike);

    // Then
    assertThat(codec.escapeRaw(plain)).isSameAs(plain);
    assertThat(escaped).startsWith(new byte[]{'S', 'K', 'Z', 0}).hasSize(lookalike.length + 4);
    assertThat(codec.decompress(escaped)).isEqualTo(lookalike);
  }
}
