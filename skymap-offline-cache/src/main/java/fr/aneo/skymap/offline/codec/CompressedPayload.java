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

import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of {@link CompressionCodec#compress(byte[])}.
 * <p>
 * When {@code compressed} is {@code false}, {@code data} is the original input and both sizes are
 * equal.
 *
 * @param compressed          whether {@code data} holds the compressed form
 * @param data                bytes to store
 * @param originalSizeBytes   size of the input
 * @param compressedSizeBytes size of {@code data}
 */
public record CompressedPayload(boolean compressed, byte[] data, long originalSizeBytes, long compressedSizeBytes) {

  public CompressedPayload {
    requireNonNull(data, "data must not be null");
    if (compressedSizeBytes != data.length) {
      throw new IllegalArgumentException("compressedSizeBytes must match data length, got: " + compressedSizeBytes);
    }
  }

  static CompressedPayload uncompressed(byte[] data) {
    return new CompressedPayload(false, data, data.length, data.length);
  }

  /**
   * @return {@code compressedSize / originalSize}, 1.0 for an empty input
   */
  public double ratio() {
    return originalSizeBytes == 0 ? 1.0 : (double) compressedSizeBytes / originalSizeBytes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CompressedPayload that)) return false;
    return compressed == that.compressed
      && originalSizeBytes == that.originalSizeBytes
      && compressedSizeBytes == that.compressedSizeBytes
      && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(compressed, originalSizeBytes, compressedSizeBytes) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "CompressedPayload{compressed=" + compressed +
      ", originalSizeBytes=" + originalSizeBytes +
      ", compressedSizeBytes=" + compressedSizeBytes + '}';
  }
}
