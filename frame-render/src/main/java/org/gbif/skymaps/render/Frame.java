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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One distance slice of an animated map.
 */
@Data
@AllArgsConstructor
public class Frame implements Serializable {
  private static final long serialVersionUID = -1617284019254816213L;

  // position in the animation, from 0
  private final int index;
  private final double distanceModulus;

  /**
   * @return the distance in parsecs
   */
  public double getDistance() {
    return DistanceSlices.toDistance(distanceModulus);
  }
}
