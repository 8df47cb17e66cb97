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
package org.gbif.skymaps.common.raster;

import org.gbif.skymaps.common.projection.Double2D;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Where to write the label of a grid line: one anchor at each end of the line, usually one at the top of the map
 * and one at the bottom (or left and right, for parallels).
 */
@Data
@AllArgsConstructor
public class GridLabel implements Serializable {
  private static final long serialVersionUID = 2969380417640510361L;

  // the longitude or latitude of the line, in degrees
  private final double value;
  private final Double2D first;
  private final Double2D second;
}
