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
package fr.aneo.skymap.offline.download;

/**
 * Receives a progress snapshot after every unit attempt and once more when the task ends.
 * <p>
 * Called on the download thread; implementations should return quickly. An exception thrown by a
 * listener is logged and does not affect the download.
 */
@FunctionalInterface
public interface DownloadProgressListener {

  void onProgress(DownloadProgress progress);

  static DownloadProgressListener noop() {
    return progress -> {
    };
  }
}
