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
package fr.aneo.skymap.offline.store;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Naming scheme of the cache partitions: {@code {prefix}{id}-{versionSuffix}} for layers and
 * {@code {prefix}hips-{sanitizedSurveyId}-{versionSuffix}} for HiPS surveys.
 * <p>
 * Survey ids such as {@code CDS/P/DSS2/color} are sanitized by replacing every character outside
 * {@code [A-Za-z0-9._]} with an underscore.
 */
public final class PartitionNames {
  private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._]");
  private static final Pattern VERSIONED = Pattern.compile(".*-v\\d+$");

  private final String prefix;
  private final String versionSuffix;

  public PartitionNames(String prefix, String versionSuffix) {
    this.prefix = requireNonNull(prefix, "prefix must not be null");
    this.versionSuffix = requireNonNull(versionSuffix, "versionSuffix must not be null");
  }

  public String prefix() {
    return prefix;
  }

  public String layer(String layerId) {
    requireNonNull(layerId, "layerId must not be null");
    return prefix + layerId + "-" + versionSuffix;
  }

  public String survey(String surveyId) {
    requireNonNull(surveyId, "surveyId must not be null");
    return prefix + "hips-" + sanitize(surveyId) + "-" + versionSuffix;
  }

  /**
   * @return whether {@code partition} belongs to this cache (carries the prefix)
   */
  public boolean isOwned(String partition) {
    return partition.startsWith(prefix);
  }

  public boolean isSurvey(String partition) {
    return partition.startsWith(prefix + "hips-");
  }

  /**
   * @return whether {@code partition} ends with a {@code -v{n}} version suffix
   */
  public static boolean isVersioned(String partition) {
    return VERSIONED.matcher(partition).matches();
  }

  public static String sanitize(String id) {
    return UNSAFE.matcher(id).replaceAll("_");
  }
}
