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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Cache content of one HiPS survey, derived from the keys of its partition.
 *
 * @param surveyId            the survey
 * @param cachedTileCount     tiles present
 * @param cachedOrders        orders with at least one tile, ascending
 * @param tileCountByOrder    tiles present per order
 * @param cachedBytesEstimate {@code cachedTileCount × averageTileSizeBytes}
 * @param storedBytes         bytes actually held by the partition
 */
public record HipsSurveyCacheStatus(
  String surveyId,
  long cachedTileCount,
  List<Integer> cachedOrders,
  Map<Integer, Long> tileCountByOrder,
  long cachedBytesEstimate,
  long storedBytes
) {

  public HipsSurveyCacheStatus {
    requireNonNull(surveyId, "surveyId must not be null");
    cachedOrders = List.copyOf(requireNonNull(cachedOrders, "cachedOrders must not be null"));
    tileCountByOrder = Map.copyOf(requireNonNull(tileCountByOrder, "tileCountByOrder must not be null"));
  }

  /**
   * Builds the status from stored keys; keys without an order segment are ignored.
   */
  public static HipsSurveyCacheStatus fromKeys(String surveyId, Collection<String> keys, long averageTileSizeBytes, long storedBytes) {
    var byOrder = new TreeMap<Integer, Long>();
    for (var key : keys) {
      var order = HipsTileAddress.parseOrder(key);
      if (order.isPresent()) {
        byOrder.merge(order.getAsInt(), 1L, Long::sum);
      }
    }
    var count = byOrder.values().stream().mapToLong(Long::longValue).sum();
    return new HipsSurveyCacheStatus(surveyId, count, List.copyOf(byOrder.keySet()), byOrder,
      LongMath.saturatedMultiply(count, averageTileSizeBytes), storedBytes);
  }

  public static HipsSurveyCacheStatus empty(String surveyId) {
    return new HipsSurveyCacheStatus(surveyId, 0, List.of(), Map.of(), 0, 0);
  }

  public OptionalInt maxCachedOrder() {
    return cachedOrders.isEmpty() ? OptionalInt.empty() : OptionalInt.of(cachedOrders.get(cachedOrders.size() - 1));
  }

  /**
   * @return whether every tile of orders {@code 0..order} is cached
   */
  public boolean isCompleteThrough(int order) {
    for (int o = 0; o <= order; o++) {
      if (tileCountByOrder.getOrDefault(o, 0L) < HipsTileAddress.tileCount(o)) return false;
    }
    return true;
  }
}
