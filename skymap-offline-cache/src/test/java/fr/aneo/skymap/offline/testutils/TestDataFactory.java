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
package fr.aneo.skymap.offline.testutils;

import fr.aneo.skymap.offline.codec.CompressionCodec;
import fr.aneo.skymap.offline.hips.HipsSurvey;
import fr.aneo.skymap.offline.layer.LayerDescriptor;
import fr.aneo.skymap.offline.layer.LayerRegistry;
import fr.aneo.skymap.offline.store.PartitionNames;

import java.util.List;
import java.util.concurrent.Executor;

public class TestDataFactory {
  public static final String BASE = "https://data.test/";
  public static final Executor DIRECT = Runnable::run;

  public static PartitionNames partitionNames() {
    return new PartitionNames("skymap-offline-", "v1");
  }

  public static CompressionCodec codec() {
    return CompressionCodec.gzip();
  }

  public static LayerDescriptor layer(String id, int priority, String... files) {
    return new LayerDescriptor(id, id.toUpperCase(), "test layer " + id, BASE + id + "/", List.of(files), 3000, priority);
  }

  public static LayerDescriptor stars() {
    return layer("stars", 1, "a.json", "b.json", "c.json");
  }

  public static LayerDescriptor dso() {
    return layer("dso", 2, "dso.json");
  }

  public static LayerRegistry registry() {
    return LayerRegistry.of(List.of(dso(), stars()));
  }

  public static HipsSurvey survey(int maxOrder) {
    return new HipsSurvey("CDS/P/DSS2/color", "DSS colored", "https://alasky.test/DSS/DSSColor", "jpeg", maxOrder);
  }
}
