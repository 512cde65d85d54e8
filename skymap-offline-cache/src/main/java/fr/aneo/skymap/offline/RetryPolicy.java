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
package fr.aneo.skymap.offline;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Immutable retry policy applied to individual resource fetches.
 * <p>
 * A failed fetch is retried only when the failure is transient (no response, timeout or one of the
 * temporary HTTP statuses). The delay before attempt {@code n + 1} is
 * {@code initialBackoff × backoffMultiplier^(n - 1)}, capped at {@code maxBackoff}.
 *
 * @param maxAttempts       total number of attempts including the first one (must be &gt;= 1)
 * @param initialBackoff    delay before the first retry (must be &gt;= 0)
 * @param maxBackoff        upper bound of any delay (must be &gt;= initialBackoff)
 * @param backoffMultiplier growth factor between delays (must be &gt;= 1.0)
 */
public record RetryPolicy(
  int maxAttempts,
  Duration initialBackoff,
  Duration maxBackoff,
  double backoffMultiplier
) {
  /**
   * Three attempts, 200 ms then 400 ms between them, never more than 2 s.
   */
  public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(2), 2.0);

  /**
   * A single attempt, no retry.
   */
  public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);

  public RetryPolicy {
    requireNonNull(initialBackoff, "initialBackoff must not be null");
    requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (initialBackoff.isNegative()) {
      throw new IllegalArgumentException("initialBackoff must be >= 0, got: " + initialBackoff);
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= initialBackoff, got: " + maxBackoff);
    }
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
    }
  }
}
