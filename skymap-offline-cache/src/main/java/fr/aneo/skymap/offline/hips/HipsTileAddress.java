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
package fr.aneo.skymap.offline.hips;

import com.google.common.math.LongMath;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.stream.LongStream;

import static java.util.Objects.requireNonNull;

/**
 * Address of one tile in the HEALPix quad-tree of a HiPS survey.
 * <p>
 * Order {@code o} holds {@code 12·4^o} tiles. A tile is stored under
 * {@code {baseUrl}/Norder{o}/Dir{d}/Npix{p}.{ext}} where {@code d = floor(p / 10000) · 10000}.
 *
 * @param order      tree depth, 0..29
 * @param pixelIndex tile index within the order, {@code 0 .. 12·4^order − 1}
 */
public record HipsTileAddress(int order, long pixelIndex) {
  public static final int MAX_ORDER = 29;

  private static final long DIRECTORY_SIZE = 10_000;
  private static final Pattern ORDER_IN_KEY = Pattern.compile("/Norder(\\d+)/");

  public HipsTileAddress {
    checkOrder(order);
    if (pixelIndex < 0 || pixelIndex >= tileCount(order)) {
      throw new IllegalArgumentException("pixelIndex must be in [0, " + tileCount(order) + ") for order " + order + ", got: " + pixelIndex);
    }
  }

  /**
   * @return {@code 12·4^order}
   */
  public static long tileCount(int order) {
    checkOrder(order);
    return 12L << (2 * order);
  }

  /**
   * @return number of tiles of orders {@code 0..order}
   */
  public static long cumulativeTileCount(int order) {
    checkOrder(order);
    long total = 0;
    for (int o = 0; o <= order; o++) {
      total += tileCount(o);
    }
    return total;
  }

  /**
   * Rough cache footprint of one order.
   */
  public static long estimateCacheSize(int order, long averageTileSizeBytes) {
    if (averageTileSizeBytes < 0) {
      throw new IllegalArgumentException("averageTileSizeBytes must be >= 0, got: " + averageTileSizeBytes);
    }
    return LongMath.saturatedMultiply(tileCount(order), averageTileSizeBytes);
  }

  public long directoryBucket() {
    return pixelIndex / DIRECTORY_SIZE * DIRECTORY_SIZE;
  }

  public String toUrl(String baseUrl, String tileFormat) {
    requireNonNull(baseUrl, "baseUrl must not be null");
    var separator = baseUrl.endsWith("/") ? "" : "/";
    return baseUrl + separator
      + "Norder" + order
      + "/Dir" + directoryBucket()
      + "/Npix" + pixelIndex
      + "." + extension(tileFormat);
  }

  public String toUrl(HipsSurvey survey) {
    return toUrl(survey.baseUrl(), survey.tileFormat());
  }

  /**
   * Every tile URL of one order. Only sensible for shallow orders: order 5 already holds 12 288 tiles.
   */
  public static List<String> tileUrlsForOrder(HipsSurvey survey, int order) {
    requireNonNull(survey, "survey must not be null");
    return LongStream.range(0, tileCount(order))
                     .mapToObj(pixel -> new HipsTileAddress(order, pixel).toUrl(survey))
                     .toList();
  }

  /**
   * Extracts the order from a stored tile key.
   *
   * @return the order, or empty if the key has no {@code /Norder{n}/} segment
   */
  public static OptionalInt parseOrder(String key) {
    var matcher = ORDER_IN_KEY.matcher(key);
    if (!matcher.find()) return OptionalInt.empty();
    try {
      return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }

  /**
   * File extension for a tile format list: the first format, with {@code jpeg} written {@code jpg}.
   */
  static String extension(String tileFormat) {
    requireNonNull(tileFormat, "tileFormat must not be null");
    var first = tileFormat.trim().split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
    return first.equals("jpeg") ? "jpg" : first;
  }

  static void checkOrder(int order) {
    if (order < 0 || order > MAX_ORDER) {
      throw new IllegalArgumentException("order must be in [0, " + MAX_ORDER + "], got: " + order);
    }
  }
}
