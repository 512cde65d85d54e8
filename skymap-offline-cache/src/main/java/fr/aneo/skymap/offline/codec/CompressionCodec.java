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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Conditional compression of cached payloads.
 * <p>
 * Text-like payloads above a size threshold are compressed before storage. A compressed payload is
 * stored as a four byte marker ({@code 'S' 'K' 'Z' 0x01}) followed by the compressed stream, so that
 * {@link #decompress(byte[])} can tell compressed entries from raw ones without side metadata. A raw
 * payload that itself starts with a marker is escaped by {@link #escapeRaw(byte[])} with the raw
 * marker ({@code 'S' 'K' 'Z' 0x00}), which {@link #decompress(byte[])} strips again.
 * <p>
 * Compression is an optimisation only: when the facility is unavailable or fails, both directions
 * fall back to returning their input unchanged and log the failure.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe.
 * </p>
 */
public final class CompressionCodec {
  private static final Logger logger = LoggerFactory.getLogger(CompressionCodec.class);

  static final byte[] MARKER = {'S', 'K', 'Z', 1};
  static final byte[] RAW_MARKER = {'S', 'K', 'Z', 0};
  public static final long DEFAULT_THRESHOLD_BYTES = 1024;

  private final CompressionFacility facility;
  private final long thresholdBytes;

  public CompressionCodec(CompressionFacility facility, long thresholdBytes) {
    this.facility = requireNonNull(facility, "facility must not be null");
    if (thresholdBytes < 0) {
      throw new IllegalArgumentException("thresholdBytes must be >= 0, got: " + thresholdBytes);
    }
    this.thresholdBytes = thresholdBytes;
  }

  public static CompressionCodec gzip() {
    return new CompressionCodec(new GzipCompressionFacility(), DEFAULT_THRESHOLD_BYTES);
  }

  public boolean isAvailable() {
    return facility.isAvailable();
  }

  /**
   * Whether a payload of {@code length} bytes and the given content type is worth compressing.
   *
   * @param length      payload size in bytes
   * @param contentType MIME type, possibly with parameters; {@code null} means unknown
   * @return {@code true} when the facility is available, {@code length} exceeds the threshold and
   * the content type is text-like
   */
  public boolean shouldCompress(long length, String contentType) {
    return facility.isAvailable() && length > thresholdBytes && isCompressible(contentType);
  }

  /**
   * Compresses {@code data}, keeping the result only if it is strictly smaller than the input.
   *
   * @param data the bytes to compress
   * @return the payload to store; check {@link CompressedPayload#compressed()}
   */
  public CompressedPayload compress(byte[] data) {
    requireNonNull(data, "data must not be null");
    if (!facility.isAvailable()) return CompressedPayload.uncompressed(data);

    try {
      var buffer = new ByteArrayOutputStream(Math.max(32, data.length / 2));
      buffer.write(MARKER);
      try (var out = facility.compressing(buffer)) {
        out.write(data);
      }
      var encoded = buffer.toByteArray();
      if (encoded.length >= data.length) {
        logger.trace("Compression of {} bytes not worth it ({} bytes)", data.length, encoded.length);
        return CompressedPayload.uncompressed(data);
      }
      return new CompressedPayload(true, encoded, data.length, encoded.length);
    } catch (IOException | RuntimeException e) {
      logger.warn("Compression failed, storing {} bytes uncompressed", data.length, e);
      return CompressedPayload.uncompressed(data);
    }
  }

  /**
   * Prepares a payload for raw storage: returned as is unless it starts with one of the markers, in
   * which case it is prefixed with the raw marker so that reading it back does not misinterpret it.
   *
   * @param data the payload to store uncompressed
   * @return the bytes to write
   */
  public byte[] escapeRaw(byte[] data) {
    requireNonNull(data, "data must not be null");
    if (!startsWith(data, MARKER) && !startsWith(data, RAW_MARKER)) return data;

    var escaped = new byte[RAW_MARKER.length + data.length];
    System.arraycopy(RAW_MARKER, 0, escaped, 0, RAW_MARKER.length);
    System.arraycopy(data, 0, escaped, RAW_MARKER.length, data.length);
    return escaped;
  }

  /**
   * Restores the original bytes of a stored entry. Entries without a marker are returned as is.
   *
   * @param stored bytes read from the store
   * @return the original payload
   */
  public byte[] decompress(byte[] stored) {
    requireNonNull(stored, "stored must not be null");
    if (startsWith(stored, RAW_MARKER)) return Arrays.copyOfRange(stored, RAW_MARKER.length, stored.length);
    if (!isCompressed(stored)) return stored;
    if (!facility.isAvailable()) {
      logger.warn("Compression facility unavailable, returning {} stored bytes as is", stored.length);
      return stored;
    }

    var source = new ByteArrayInputStream(stored, MARKER.length, stored.length - MARKER.length);
    try (var in = facility.decompressing(source)) {
      return in.readAllBytes();
    } catch (IOException | RuntimeException e) {
      logger.warn("Decompression failed, returning {} stored bytes as is", stored.length, e);
      return stored;
    }
  }

  /**
   * @return whether {@code stored} starts with the compression marker
   */
  public static boolean isCompressed(byte[] stored) {
    return startsWith(stored, MARKER);
  }

  private static boolean startsWith(byte[] data, byte[] marker) {
    return data.length >= marker.length
      && Arrays.equals(data, 0, marker.length, marker, 0, marker.length);
  }

  /**
   * Content types that compress well: {@code text/*}, JSON, JavaScript and XML, including the
   * structured {@code +json} and {@code +xml} suffixes.
   */
  static boolean isCompressible(String contentType) {
    if (contentType == null) return false;
    var mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return mediaType.startsWith("text/")
      || mediaType.equals("application/json")
      || mediaType.endsWith("+json")
      || mediaType.equals("application/javascript")
      || mediaType.equals("application/x-javascript")
      || mediaType.equals("application/xml")
      || mediaType.endsWith("+xml");
  }
}
