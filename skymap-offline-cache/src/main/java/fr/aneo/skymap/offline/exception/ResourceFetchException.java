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
 * Raised when a remote resource could not be fetched.
 * <p>
 * Carries the requested URL and, when the server answered, the HTTP status code. A status of
 * {@code -1} means no response was received at all (connection refused, DNS failure, timeout).
 * A request that could not even be built, such as a relative URL with no origin to resolve it
 * against, is reported through {@link #invalidRequest(String, Throwable)} and is never transient.
 */
public class ResourceFetchException extends SkymapOfflineException {
  private final String url;
  private final int statusCode;
  private final boolean invalidRequest;

  public ResourceFetchException(String url, int statusCode) {
    super("Failed to fetch " + url + ": HTTP " + statusCode);
    this.url = url;
    this.statusCode = statusCode;
    this.invalidRequest = false;
  }

  public ResourceFetchException(String url, Throwable cause) {
    this(url, cause, false);
  }

  private ResourceFetchException(String url, Throwable cause, boolean invalidRequest) {
    super("Failed to fetch " + url + ": " + cause.getMessage(), cause);
    this.url = url;
    this.statusCode = -1;
    this.invalidRequest = invalidRequest;
  }

  public static ResourceFetchException invalidRequest(String url, Throwable cause) {
    return new ResourceFetchException(url, cause, true);
  }

  public String url() {
    return url;
  }

  public int statusCode() {
    return statusCode;
  }

  /**
   * Whether the failure is worth retrying: no response at all to a well-formed request, or a status the server uses for
   * temporary conditions (408, 429, 500, 502, 503, 504).
   */
  public boolean isInvalidRequest() {
    return invalidRequest;
  }

  public boolean isTransient() {
    if (invalidRequest) return false;
    return statusCode == -1
      || statusCode == 408
      || statusCode == 429
      || statusCode == 500
      || statusCode == 502
      || statusCode == 503
      || statusCode == 504;
  }
}
