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

import fr.aneo.skymap.offline.RetryPolicy;
import fr.aneo.skymap.offline.exception.ResourceFetchException;
import fr.aneo.skymap.offline.internal.retry.RetryableFetchOperation;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Decorator retrying transient failures of another {@link ResourceFetcher}.
 * <p>
 * Responses with a temporary status (408, 429, 5xx gateway errors) are turned into a transient
 * {@link ResourceFetchException} so they can be retried; once attempts are exhausted that exception
 * is what the caller sees. Any other status is returned as is.
 */
public final class RetryingResourceFetcher implements ResourceFetcher {
  private final ResourceFetcher delegate;
  private final RetryPolicy retryPolicy;

  public RetryingResourceFetcher(ResourceFetcher delegate, RetryPolicy retryPolicy) {
    this.delegate = requireNonNull(delegate, "delegate must not be null");
    this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy must not be null");
  }

  @Override
  public CompletionStage<FetchResponse> fetch(String url, CancellationToken token) {
    requireNonNull(url, "url must not be null");
    requireNonNull(token, "token must not be null");

    return RetryableFetchOperation.execute(
      () -> delegate.fetch(url, token).thenApply(response -> {
        if (!response.isOk()) {
          var failure = new ResourceFetchException(url, response.statusCode());
          if (failure.isTransient()) throw failure;
        }
        return response;
      }),
      retryPolicy,
      token);
  }
}
