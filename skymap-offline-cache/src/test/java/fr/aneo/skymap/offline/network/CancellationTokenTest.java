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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

  private CancellationToken token;

  @BeforeEach
  void setUp() {
    token = new CancellationToken();
  }

  @Test
  @DisplayName("cancel reports whether it changed the state")
  void cancel_reports_state_change() {
    assertThat(token.isCancelled()).isFalse();
    assertThat(token.cancel()).isTrue();
    assertThat(token.cancel()).isFalse();
    assertThat(token.isCancelled()).isTrue();
  }

  @Test
  @DisplayName("callbacks run exactly once, including those registered after cancellation")
  void callbacks_run_exactly_once() {
    // Given
    var before = new AtomicInteger();
    var after = new AtomicInteger();
    token.onCancel(before::incrementAndGet);

    // When
    token.cancel();
    token.cancel();
    token.onCancel(after::incrementAndGet);

    // Then
    assertThat(before).hasValue(1);
    assertThat(after).hasValue(1);
  }

  @Test
  @DisplayName("a closed registration is not run")
  void closed_registration_is_not_run() {
    // Given
    var calls = new AtomicInteger();
    var registration = token.onCancel(calls::incrementAndGet);

    // When
    registration.close();
    token.cancel();

    // Then
    assertThat(calls).hasValue(0);
  }

  @Test
  @DisplayName("a failing callback does not prevent the others")
  void failing_callback_does_not_prevent_others() {
    // Given
    var calls = new AtomicInteger();
    token.onCancel(() -> {
      throw new IllegalStateException("boom");
    });
    token.onCancel(calls::incrementAndGet);

    // When
    token.cancel();

    // Then
    assertThat(calls).hasValue(1);
  }

  @Test
  @DisplayName("throwIfCancelled throws only after cancellation")
  void throwIfCancelled_throws_after_cancellation() {
    token.throwIfCancelled();
    token.cancel();

    assertThatThrownBy(token::throwIfCancelled).isInstanceOf(CancellationException.class);
  }

  @Test
  @DisplayName("bind mirrors the stage outcome")
  void bind_mirrors_outcome() {
    assertThat(token.bind(CompletableFuture.completedFuture("value")).join()).isEqualTo("value");
  }

  @Test
  @DisplayName("bind is cancelled by the token even if the stage never completes")
  void bind_is_cancelled_by_token() {
    // Given
    var bound = token.bind(new CompletableFuture<String>());

    // When
    token.cancel();

    // Then
    assertThat(bound).isCancelled();
  }
}
