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

/**
 * Streaming compression primitive of the host.
 */
public interface CompressionFacility {

  /**
   * @return whether the facility can be used on this host
   */
  boolean isAvailable();

  /**
   * Wraps {@code sink} so that bytes written to the returned stream reach it compressed. Closing the
   * returned stream finishes the compressed stream and closes {@code sink}.
   */
  OutputStream compressing(OutputStream sink) throws IOException;

  /**
   * Wraps {@code source} so that reading the returned stream yields the decompressed bytes.
   */
  InputStream decompressing(InputStream source) throws IOException;
}
