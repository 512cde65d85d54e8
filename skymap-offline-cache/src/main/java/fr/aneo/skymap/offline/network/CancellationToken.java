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
package fr.aneo.skymap.offline.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * Shared cancellation flag of one download task.
 * <p>
 * The download manager owns the token and hands it to every fetch it issues; the caller that asked
 * for cancellation only flips it. Cancelling is idempotent and runs every registered callback
 * exactly once, on the cancelling thread. A callback registered after cancellation runs
 * immediately.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe.
 * </p>
 */
public final class CancellationToken {
  private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /**
   * Cancels this token.
   *
   * @return {@code true} if this call cancelled the token, {@code false} if it already was
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) return false;

    for (var callback : callbacks) {
      if (callbacks.remove(callback)) run(callback);
    }
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws if this token has been cancelled.
   *
   * @throws CancellationException if {@link #cancel()} was called
   */
  public void throwIfCancelled() {
    if (isCancelled()) throw new CancellationException("Operation cancelled");
  }

  /**
   * Registers a callback run when this token is cancelled.
   *
   * @param callback the action to run; must not be {@code null}
   * @return a registration whose {@code close()} removes the callback
   */
  public Registration onCancel(Runnable callback) {
    requireNonNull(callback, "callback must not be null");

    callbacks.add(callback);
    if (isCancelled() && callbacks.remove(callback)) {
      run(callback);
    }
    return () -> callbacks.remove(callback);
  }

  /**
   * Returns a future mirroring {@code stage} that is cancelled as soon as this token is, even if
   * {@code stage} itself never observes the token.
   *
   * @param stage the stage to follow
   * @param <T>   the result type
   * @return a future completing with the outcome of {@code stage}, or cancelled
   */
  public <T> CompletableFuture<T> bind(CompletionStage<T> stage) {
    requireNonNull(stage, "stage must not be null");

    var result = new CompletableFuture<T>();
    var registration = onCancel(() -> result.cancel(false));
    stage.whenComplete((value, failure) -> {
      registration.close();
      if (failure != null) {
        result.completeExceptionally(unwrap(failure));
      } else {
        result.complete(value);
      }
    });
    return result;
  }

  private static void run(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.warn("Cancellation callback failed", e);
    }
  }

  /**
   * Handle of a registered cancellation callback.
   */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
