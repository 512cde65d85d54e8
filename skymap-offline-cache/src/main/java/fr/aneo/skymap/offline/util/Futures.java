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

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static java.util.concurrent.CompletableFuture.completedFuture;

public final class Futures {
  private Futures() {
  }

  /**
   * Returns a {@link CompletionStage} that completes when all the given stages complete.
   *
   * <p>The returned stage:</p>
   * <ul>
   *   <li>Completes successfully with a {@link List} of results in the same order
   *       as the input stages, if all succeed.</li>
   *   <li>Completes exceptionally if <em>any</em> stage fails. The exception from one
   *       failed stage is propagated (others are suppressed by default).</li>
   * </ul>
   * <p>
   * Callers that need every stage to settle regardless of failures map each stage with
   * {@code handle(...)} first, so that none of them completes exceptionally.
   *
   * @param stages the stages to combine
   * @param <T>    the result type
   * @return a stage that yields a list of results or fails if any input stage fails
   * @throws NullPointerException if {@code stages} is null
   */
  public static <T> CompletionStage<List<T>> allOf(Collection<? extends CompletionStage<T>> stages) {
    if (stages.isEmpty()) return completedFuture(List.of());

    var futures = stages.stream().map(CompletionStage::toCompletableFuture).toList();

    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                            .thenApply(v -> futures.stream()
                                                   // allOf ensures all futures are completed, so join() will not block here.
                                                   .map(CompletableFuture::join)
                                                   .toList());
  }

  /**
   * Unwraps nested {@link CompletionException} and {@link ExecutionException} to find the root
   * cause of an asynchronous failure.
   *
   * @param throwable the exception to unwrap
   * @return the first cause that is not a wrapper
   */
  public static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while (current.getCause() != null
      && (current instanceof CompletionException || current instanceof ExecutionException)) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Whether an asynchronous failure is a cancellation rather than an error.
   *
   * @param throwable the failure, possibly wrapped
   * @return {@code true} if the unwrapped failure is a {@link CancellationException}
   */
  public static boolean isCancellation(Throwable throwable) {
    return throwable instanceof CancellationException || unwrap(throwable) instanceof CancellationException;
  }
}
