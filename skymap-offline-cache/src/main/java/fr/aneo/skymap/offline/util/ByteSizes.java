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
package fr.aneo.skymap.offline.util;

import java.util.Locale;

/**
 * Human-readable rendering of byte counts, binary units ({@code 1 KB = 1024 B}).
 */
public final class ByteSizes {
  private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

  private ByteSizes() {
  }

  /**
   * Formats a byte count with one decimal above the byte unit, e.g. {@code 0 B}, {@code 512 B},
   * {@code 1.5 KB}, {@code 15.0 MB}.
   *
   * @param bytes a non-negative byte count
   * @return the formatted size
   * @throws IllegalArgumentException if {@code bytes} is negative
   */
  public static String format(long bytes) {
    if (bytes < 0) throw new IllegalArgumentException("bytes must be >= 0, got: " + bytes);
    if (bytes < 1024) return bytes + " B";

    double value = bytes;
    int unit = 0;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
  }
}
