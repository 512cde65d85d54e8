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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP through {@code java.util.zip}; always available.
 */
public final class GzipCompressionFacility implements CompressionFacility {
  private static final int BUFFER_SIZE = 8192;

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public OutputStream compressing(OutputStream sink) throws IOException {
    return new GZIPOutputStream(sink, BUFFER_SIZE);
  }

  @Override
  public InputStream decompressing(InputStream source) throws IOException {
    return new GZIPInputStream(source, BUFFER_SIZE);
  }
}
