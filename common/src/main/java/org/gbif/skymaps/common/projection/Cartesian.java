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

import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Plots the angles directly, in degrees, performing no further projection (plate carrée).
 * This class is threadsafe.
 */
class Cartesian extends AbstractSkyProjection {

  Cartesian(double centralMeridianDegrees) {
    super(centralMeridianDegrees);
  }

  @Override
  public Double2D project(double latitude, double longitude) {
    return new Double2D(toDegrees(longitude - getCentralMeridian()), toDegrees(latitude));
  }

  @Override
  public Unprojected unproject(double x, double y) {
    double longitude = getCentralMeridian() + toRadians(x);
    double latitude = toRadians(y);
    return new Unprojected(latitude, longitude, outsideSky(latitude, longitude));
  }
}
