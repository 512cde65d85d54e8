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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuturesTest {

  @Test
  @DisplayName("allOf of empty list returns completed with empty list")
  void allOf_of_empty_list_returns_completed_with_empty_list() {
    // When
    var combined = Futures.allOf(List.<CompletionStage<String>>of()).toCompletableFuture().join();

    // Then
    assertThat(combined).isEmpty();
  }

  @Test
  @DisplayName("allOf list preserves order")
  void allOf_list_preserves_order() {
    // Given
    List<CompletionStage<String>> stages = List.of(completedFuture("A"), completedFuture("B"), completedFuture("C"));

    // When
    var combined = Futures.allOf(stages).toCompletableFuture().join();

    // Then
    assertThat(combined).containsExactly("A", "B", "C");
  }

  @Test
  @DisplayName("allOf list fails when any fails")
  void allOf_list_fails_when_any_fails() {
    // Given
    List<CompletionStage<String>> stages = List.of(
      completedFuture("A"),
      failedFuture(new IllegalStateException("boom")),
      completedFuture("B")
    );

    // When
    var combined = Futures.allOf(stages).toCompletableFuture();

    // Then
    assertThatThrownBy(combined::get)
      .isInstanceOf(ExecutionException.class)
      .hasCauseInstanceOf(IllegalStateException.class)
      .hasRootCauseMessage("boom");
  }

  @Test
  @DisplayName("unwrap strips nested completion and execution wrappers")
  void unwrap_strips_wrappers() {
    // Given
    var root = new IllegalStateException("root");
    var wrapped = new CompletionException(new ExecutionException(root));

    // Then
    assertThat(Futures.unwrap(wrapped)).isSameAs(root);
    assertThat(Futures.unwrap(root)).isSameAs(root);
  }

  @Test
  @DisplayName("isCancellation recognises wrapped cancellations only")
  void isCancellation_recognises_wrapped_cancellations() {
    assertThat(Futures.isCancellation(new CancellationException())).isTrue();
    assertThat(Futures.isCancellation(new CompletionException(new CancellationException()))).isTrue();
    assertThat(Futures.isCancellation(new CompletionException(new IllegalStateException()))).isFalse();
  }
}
