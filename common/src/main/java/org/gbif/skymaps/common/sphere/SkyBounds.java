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
package org.gbif.skymaps.common.sphere;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

import static org.gbif.skymaps.common.sphere.SkyCoordinates.floorMod;

/**
 * A region of sky bounded in longitude and latitude, in degrees.
 * <p/>
 * The longitude interval runs eastwards from {@code minLongitude} to {@code maxLongitude} and may cross the 0/360
 * meridian: (350, 10) is the twenty degree band centred on 0.  Latitude bounds are inclusive.
 */
@Data
@AllArgsConstructor
public class SkyBounds implements Serializable {
  private static final long serialVersionUID = 5163357418095313566L;

  public static final SkyBounds ALL_SKY = new SkyBounds(0, 360, -90, 90);

  private final double minLongitude;
  private final double maxLongitude;
  private final double minLatitude;
  private final double maxLatitude;

  /**
   * @return true if the position lies within the bounds, inclusive on all edges
   */
  public boolean contains(double longitude, double latitude) {
    double l0 = floorMod(minLongitude, 360);
    double width = floorMod(maxLongitude - l0, 360);
    // a full turn would otherwise collapse to a zero width interval
    if (width == 0 && maxLongitude != minLongitude) {
      width = 360;
    }
    double offset = floorMod(longitude - l0, 360);
    return offset <= width && latitude >= minLatitude && latitude <= maxLatitude;
  }
}
