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

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Response of a completed network fetch, whatever its HTTP status.
 *
 * @param url         the requested URL, as given by the caller
 * @param statusCode  the HTTP status code
 * @param contentType the {@code Content-Type} header, or {@code null} when absent
 * @param body        the response body; never {@code null}, possibly empty
 */
public record FetchResponse(String url, int statusCode, String contentType, byte[] body) {

  public FetchResponse {
    requireNonNull(url, "url must not be null");
    requireNonNull(body, "body must not be null");
  }

  public static FetchResponse ok(String url, String contentType, byte[] body) {
    return new FetchResponse(url, 200, contentType, body);
  }

  public static FetchResponse status(String url, int statusCode) {
    return new FetchResponse(url, statusCode, null, new byte[0]);
  }

  /**
   * @return {@code true} for a 2xx status
   */
  public boolean isOk() {
    return statusCode >= 200 && statusCode < 300;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FetchResponse that)) return false;
    return statusCode == that.statusCode
      && url.equals(that.url)
      && java.util.Objects.equals(contentType, that.contentType)
      && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = java.util.Objects.hash(url, statusCode, contentType);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "FetchResponse{" +
      "url='" + url + '\'' +
      ", statusCode=" + statusCode +
      ", contentType='" + contentType + '\'' +
      ", bodySize=" + body.length +
      '}';
  }
}
