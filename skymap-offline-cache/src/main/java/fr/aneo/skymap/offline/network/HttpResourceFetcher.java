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

import fr.aneo.skymap.offline.exception.ResourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static fr.aneo.skymap.offline.util.Futures.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * {@link ResourceFetcher} backed by the JDK {@link HttpClient}.
 * <p>
 * Relative URLs are resolved against the resource origin given at construction; a relative URL
 * without an origin fails with a {@link ResourceFetchException}. Cancelling the token aborts the
 * pending exchange.
 */
public final class HttpResourceFetcher implements ResourceFetcher {
  private static final Logger logger = LoggerFactory.getLogger(HttpResourceFetcher.class);

  private final HttpClient httpClient;
  private final URI resourceOrigin;
  private final Duration requestTimeout;

  /**
   * @param httpClient     client used for every request
   * @param resourceOrigin base URI for relative URLs, or {@code null} to accept absolute URLs only
   * @param requestTimeout per-request timeout
   */
  public HttpResourceFetcher(HttpClient httpClient, URI resourceOrigin, Duration requestTimeout) {
    this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
    this.resourceOrigin = resourceOrigin;
    this.requestTimeout = requireNonNull(requestTimeout, "requestTimeout must not be null");
  }

  public static HttpResourceFetcher create(URI resourceOrigin, Duration requestTimeout) {
    var client = HttpClient.newBuilder()
                           .connectTimeout(requestTimeout)
                           .followRedirects(HttpClient.Redirect.NORMAL)
                           .build();
    return new HttpResourceFetcher(client, resourceOrigin, requestTimeout);
  }

  @Override
  public CompletionStage<FetchResponse> fetch(String url, CancellationToken token) {
    requireNonNull(url, "url must not be null");
    requireNonNull(token, "token must not be null");

    if (token.isCancelled()) {
      return CompletableFuture.failedFuture(new CancellationException("Fetch cancelled before start: " + url));
    }

    final URI uri;
    try {
      uri = resolve(url);
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(ResourceFetchException.invalidRequest(url, e));
    }

    logger.atTrace().addKeyValue("operation", "fetch").addKeyValue("uri", uri).log("Sending request");

    var request = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET().build();
    var pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    var registration = token.onCancel(() -> pending.cancel(true));

    return pending.handle((response, failure) -> {
      registration.close();
      if (failure != null) {
        var cause = unwrap(failure);
        if (cause instanceof CancellationException || token.isCancelled()) {
          throw new CancellationException("Fetch cancelled: " + url);
        }
        throw new ResourceFetchException(url, cause);
      }
      var contentType = response.headers().firstValue("Content-Type").orElse(null);
      return new FetchResponse(url, response.statusCode(), contentType, response.body());
    });
  }

  URI resolve(String url) {
    var uri = URI.create(url);
    if (uri.isAbsolute()) return uri;
    if (resourceOrigin == null) {
      throw new IllegalArgumentException("Relative URL '" + url + "' requires a resource origin");
    }
    return resourceOrigin.resolve(uri);
  }
}
