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
package org.gbif.skymaps.common.projection;

import static java.lang.Math.PI;

public abstract class AbstractSkyProjection implements SkyProjection {

  /*
   * Maps default to being centred on λ₀ = 180°, which puts Galactic longitude 0 in the middle of the map with
   * longitude increasing to the left.
   */
  public static final double DEFAULT_CENTRAL_MERIDIAN = 180;

  private final double centralMeridian;

  AbstractSkyProjection(double centralMeridianDegrees) {
    if (!Double.isFinite(centralMeridianDegrees)) {
      throw new IllegalArgumentException("Central meridian must be finite. Supplied: " + centralMeridianDegrees);
    }
    this.centralMeridian = Math.toRadians(centralMeridianDegrees);
  }

  @Override
  public double getCentralMeridian() {
    return centralMeridian;
  }

  /**
   * True if the inverted angles are unusable or fall outside λ ∈ [0, 2π], φ ∈ [−π, π].
   */
  static boolean outsideSky(double latitude, double longitude) {
    return !Double.isFinite(latitude) || !Double.isFinite(longitude)
           || longitude < 0 || longitude > 2 * PI
           || latitude < -PI || latitude > PI;
  }

  @Override
  public String toString() {
    return String.format("%s(λ₀=%.2f°)", getClass().getSimpleName(), Math.toDegrees(centralMeridian));
  }
}
