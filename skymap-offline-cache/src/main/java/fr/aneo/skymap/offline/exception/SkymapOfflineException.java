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
package fr.aneo.skymap.offline.exception;

/**
 * Base exception for all errors raised by the Skymap offline cache.
 * <p>
 * Cache operations degrade instead of failing wherever the cache is only an optimization (storage
 * unavailable, codec failure, single missing file). This exception is reserved for the cases the
 * caller has to know about: invalid arguments that slipped past validation, unusable configuration
 * or storage that fails while it was expected to work.
 */
public class SkymapOfflineException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public SkymapOfflineException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   * <p>
   * This constructor is typically used to wrap lower-level I/O exceptions
   * with additional context about the cache operation that failed.
   * </p>
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public SkymapOfflineException(String message, Throwable cause) {
    super(message, cause);
  }
}
