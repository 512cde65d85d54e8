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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;

/**
 * Network fetch primitive consumed by the download managers.
 * <p>
 * Implementations must honour the following contract:
 * <ul>
 *   <li>A response is returned for every HTTP status, including 4xx and 5xx; callers check
 *       {@link FetchResponse#isOk()}.</li>
 *   <li>When no response could be obtained, the stage completes exceptionally with a
 *       {@link ResourceFetchException}.</li>
 *   <li>When {@code token} is cancelled before the response arrives, the stage completes
 *       exceptionally with a {@link CancellationException}, and the underlying request is aborted.</li>
 * </ul>
 */
@FunctionalInterface
public interface ResourceFetcher {

  /**
   * Fetches {@code url}.
   *
   * @param url   absolute URL, or a path resolved against the configured resource origin
   * @param token cancellation token of the owning download task
   * @return a stage completing with the response
   */
  CompletionStage<FetchResponse> fetch(String url, CancellationToken token);
}
