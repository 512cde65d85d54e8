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
package fr.aneo.skymap.offline.hips;

import static java.util.Objects.requireNonNull;

/**
 * A remote HiPS sky survey.
 *
 * @param id         survey identifier, e.g. {@code CDS/P/DSS2/color}
 * @param name       human-readable name
 * @param baseUrl    root URL of the survey tiles
 * @param tileFormat space separated tile formats offered, e.g. {@code "jpeg png"}; the first one is used
 * @param maxOrder   deepest order the survey provides (0..29)
 */
public record HipsSurvey(String id, String name, String baseUrl, String tileFormat, int maxOrder) {

  public HipsSurvey {
    requireNonNull(id, "id must not be null");
    requireNonNull(name, "name must not be null");
    requireNonNull(baseUrl, "baseUrl must not be null");
    requireNonNull(tileFormat, "tileFormat must not be null");
    if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    if (tileFormat.isBlank()) throw new IllegalArgumentException("tileFormat must not be blank");
    HipsTileAddress.checkOrder(maxOrder);
  }
}
