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
package fr.aneo.skymap.offline.internal.retry;

import fr.aneo.skymap.offline.RetryPolicy;
import fr.aneo.skymap.offline.exception.ResourceFetchException;
import fr.aneo.skymap.offline.network.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.delayedExecutor;

/**
 * Executes a fetch with exponential backoff retry on transient failures.
 * <p>
 * Only a {@link ResourceFetchException} whose {@link ResourceFetchException#isTransient()} holds is
 * retried. A cancellation, or any failure once the token has been cancelled, ends the operation
 * immediately with a {@link CancellationException}.
 *
 * @see RetryPolicy
 */
public final class RetryableFetchOperation {
  private static final Logger log = LoggerFactory.getLogger(RetryableFetchOperation.class);

  private RetryableFetchOperation() {
  }

  /**
   * Executes {@code operation}, retrying it according to {@code policy}.
   *
   * @param operation supplier issuing one attempt
   * @param policy    retry policy specifying max attempts and backoff parameters
   * @param token     cancellation token checked before every attempt
   * @param <T>       the type of the operation result
   * @return a stage completing with the first successful result, or the last failure unwrapped
   * @throws NullPointerException if any argument is null
   */
  public static <T> CompletionStage<T> execute(Supplier<CompletionStage<T>> operation, RetryPolicy policy, CancellationToken token) {
    requireNonNull(operation, "operation must not be null");
    requireNonNull(policy, "policy must not be null");
    requireNonNull(token, "token must not be null");

    return executeAttempt(operation, policy, token, 1);
  }

  private static <T> CompletionStage<T> executeAttempt(Supplier<CompletionStage<T>> operation, RetryPolicy policy, CancellationToken token, int attempt) {
    if (token.isCancelled()) {
      return CompletableFuture.failedFuture(new CancellationException("Fetch cancelled before attempt " + attempt));
    }
    try {
      return operation.get()
                      .exceptionallyCompose(throwable -> {
                        var cause = unwrap(throwable);
                        if (!shouldRetry(cause, attempt, policy, token)) {
                          return CompletableFuture.failedFuture(cause);
                        }
                        Duration backoff = calculateBackoff(policy, attempt);
                        log.warn("Fetch failed({}), retrying after backoff. Attempt {}/{}, backoff {}ms",
                          cause.getMessage(), attempt, policy.maxAttempts(), backoff.toMillis());

                        return delayedRetry(operation, policy, token, attempt + 1, backoff);
                      });
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static <T> CompletionStage<T> delayedRetry(Supplier<CompletionStage<T>> operation, RetryPolicy policy, CancellationToken token, int nextAttempt, Duration backoff) {
    return CompletableFuture.supplyAsync(() -> null, delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS))
                            .thenCompose(ignored -> executeAttempt(operation, policy, token, nextAttempt));
  }

  private static boolean shouldRetry(Throwable cause, int attempt, RetryPolicy policy, CancellationToken token) {
    if (cause instanceof CancellationException || token.isCancelled()) {
      return false;
    }

    if (!(cause instanceof ResourceFetchException fetchException) || !fetchException.isTransient()) {
      log.debug("Error is not retryable:{}. Failing immediately after attempt {}", cause.getClass().getSimpleName(), attempt);
      return false;
    }

    if (attempt >= policy.maxAttempts()) {
      log.warn("Max retry attempts exhausted after {} attempts", policy.maxAttempts(), cause);
      return false;
    }

    return true;
  }

  /**
   * {@code initialBackoff × multiplier^(attempt - 1)}, capped at {@code maxBackoff}.
   */
  static Duration calculateBackoff(RetryPolicy policy, int attempt) {
    if (attempt <= 1) return policy.initialBackoff();

    var multiplier = Math.pow(policy.backoffMultiplier(), attempt - 1);
    var backoffMillis = (long) (policy.initialBackoff().toMillis() * multiplier);
    var cappedMillis = Math.min(backoffMillis, policy.maxBackoff().toMillis());
    return Duration.ofMillis(cappedMillis);
  }
}
