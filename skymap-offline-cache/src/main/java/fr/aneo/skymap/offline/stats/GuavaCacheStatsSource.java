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
package fr.aneo.skymap.offline.stats;

import com.google.common.cache.Cache;

import java.util.List;
import java.util.function.ToLongFunction;

import static java.util.Objects.requireNonNull;

/**
 * Reports an in-memory Guava {@link Cache}. Hits and misses come from {@link Cache#stats()}, so the
 * cache must be built with {@code recordStats()}.
 *
 * @param <V> value type of the cache
 */
public final class GuavaCacheStatsSource<V> implements CacheStatsSource {
  private final String name;
  private final Cache<?, V> cache;
  private final ToLongFunction<? super V> sizeOf;

  /**
   * @param sizeOf byte size of one value, used to sum the bytes held
   */
  public GuavaCacheStatsSource(String name, Cache<?, V> cache, ToLongFunction<? super V> sizeOf) {
    this.name = requireNonNull(name, "name must not be null");
    this.cache = requireNonNull(cache, "cache must not be null");
    this.sizeOf = requireNonNull(sizeOf, "sizeOf must not be null");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public CacheSubsystemStats collect() {
    var stats = cache.stats();
    var bytes = cache.asMap().values().stream().mapToLong(sizeOf).sum();
    return new CacheSubsystemStats(name, cache.size(), bytes, stats.hitCount(), stats.missCount(), List.of());
  }
}
