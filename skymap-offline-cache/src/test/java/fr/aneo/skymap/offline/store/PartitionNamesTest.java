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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PartitionNamesTest {

  private final PartitionNames names = new PartitionNames("skymap-offline-", "v1");

  @Test
  @DisplayName("layer partitions are prefixed and versioned")
  void layer_partitions_are_prefixed_and_versioned() {
    assertThat(names.layer("stars")).isEqualTo("skymap-offline-stars-v1");
  }

  @Test
  @DisplayName("survey partitions sanitize the survey id")
  void survey_partitions_sanitize_id() {
    assertThat(names.survey("CDS/P/DSS2/color")).isEqualTo("skymap-offline-hips-CDS_P_DSS2_color-v1");
    assertThat(PartitionNames.sanitize("P/2MASS:color v2.1")).isEqualTo("P_2MASS_color_v2.1");
  }

  @Test
  @DisplayName("ownership and survey detection rely on the prefix")
  void ownership_relies_on_prefix() {
    assertThat(names.isOwned("skymap-offline-stars-v1")).isTrue();
    assertThat(names.isOwned("other-stars-v1")).isFalse();
    assertThat(names.isSurvey(names.survey("CDS/P/DSS2/color"))).isTrue();
    assertThat(names.isSurvey(names.layer("stars"))).isFalse();
  }

  @Test
  @DisplayName("isVersioned requires a trailing -v{n} suffix")
  void isVersioned_requires_suffix() {
    assertThat(PartitionNames.isVersioned("skymap-cache-foo-v1")).isTrue();
    assertThat(PartitionNames.isVersioned("skymap-cache-foo-v12")).isTrue();
    assertThat(PartitionNames.isVersioned("skymap-cache-foo")).isFalse();
    assertThat(PartitionNames.isVersioned("skymap-cache-foo-v")).isFalse();
  }
}
