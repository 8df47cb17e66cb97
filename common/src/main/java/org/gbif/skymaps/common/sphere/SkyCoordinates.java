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

/**
 * Utilities for longitudes and latitudes expressed in degrees.
 */
public class SkyCoordinates {

  private SkyCoordinates() {}

  /**
   * If the longitude is expressed from 0..360 it is converted to -180..180.
   */
  public static double to180Degrees(double longitude) {
    if (longitude > 180) {
      return longitude - 360;
    } else if (longitude < -180) {
      return longitude + 360;
    }
    return longitude;
  }

  /**
   * Shifts the longitude and wraps the result back into [0, 360).
   */
  public static double wrapLongitude(double longitude, double delta) {
    return floorMod(longitude + delta, 360);
  }

  /**
   * Shifts both angles without wrapping.  With clipping the result is held within [0, 360] × [−90, 90], so that
   * positions shifted off the edge of the map stay on its edge.
   * @return the shifted position
   */
  public static SkyPosition shift(double longitude, double latitude, double deltaLongitude, double deltaLatitude,
                                  boolean clip) {
    double l = longitude + deltaLongitude;
    double b = latitude + deltaLatitude;
    if (clip) {
      l = Math.max(0, Math.min(360, l));
      b = Math.max(-90, Math.min(90, b));
    }
    return new SkyPosition(l, b);
  }

  /**
   * Modulus that is always positive for a positive divisor, as Python's % operator and numpy.mod behave.
   */
  static double floorMod(double value, double divisor) {
    double m = value % divisor;
    return m < 0 ? m + divisor : m;
  }
}
