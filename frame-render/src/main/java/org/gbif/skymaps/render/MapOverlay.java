/*
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
package org.gbif.skymaps.render;

import org.gbif.skymaps.common.projection.Double2D;
import org.gbif.skymaps.common.raster.GridLabel;

import java.util.Collections;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The grid lines and their labels, drawn identically over every frame.
 */
@Data
@AllArgsConstructor
public class MapOverlay {
  public static final MapOverlay EMPTY =
    new MapOverlay(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

  private final List<Double2D> dots;
  private final List<GridLabel> longitudeLabels;
  private final List<GridLabel> latitudeLabels;
}
