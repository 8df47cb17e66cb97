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

import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * The Hammer projection: equal-area like Mollweide, with curved parallels to reduce the distortion at the limbs.
 * Both directions are closed form; the map is bounded by the ellipse ¼x² + y² = 2.
 * See https://en.wikipedia.org/wiki/Hammer_projection
 *
 * This class is threadsafe.
 */
class Hammer extends AbstractSkyProjection {
  private static final double SQRT2 = sqrt(2);

  Hammer(double centralMeridianDegrees) {
    super(centralMeridianDegrees);
  }

  @Override
  public Double2D project(double latitude, double longitude) {
    double halfLongitude = (longitude - getCentralMeridian()) / 2;
    double denominator = sqrt(1 + cos(latitude) * cos(halfLongitude));
    double x = 2 * SQRT2 * cos(latitude) * sin(halfLongitude) / denominator;
    double y = SQRT2 * sin(latitude) / denominator;
    return new Double2D(x, y);
  }

  @Override
  public Unprojected unproject(double x, double y) {
    double z = sqrt(1 - (x / 4) * (x / 4) - (y / 2) * (y / 2));
    double longitude = getCentralMeridian() + 2 * atan2(z * x, 2 * (2 * z * z - 1));
    double latitude = asin(z * y);

    boolean outsideEllipse = 0.25 * x * x + y * y > 2;
    return new Unprojected(latitude, longitude, outsideEllipse || outsideSky(latitude, longitude));
  }
}
