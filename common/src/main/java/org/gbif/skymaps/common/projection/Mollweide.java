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

import com.google.common.annotations.VisibleForTesting;

import static java.lang.Math.PI;
import static java.lang.Math.asin;
import static java.lang.Math.cos;
import static java.lang.Math.signum;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * The Mollweide projection: pseudocylindrical and equal-area, mapping the sphere into the ellipse
 * x²/8 + y²/2 ≤ 1.
 * <p/>
 * The forward direction needs the auxiliary angle θ satisfying 2θ + sin 2θ = π sin φ, found with a fixed number of
 * Newton-Raphson steps.  The inverse is closed form.
 * See https://en.wikipedia.org/wiki/Mollweide_projection
 *
 * This class is threadsafe.
 */
class Mollweide extends AbstractSkyProjection {
  static final int ITERATIONS = 15;

  private static final double SQRT2 = sqrt(2);

  Mollweide(double centralMeridianDegrees) {
    super(centralMeridianDegrees);
  }

  @Override
  public Double2D project(double latitude, double longitude) {
    double theta = theta(latitude);
    double x = 2 * SQRT2 * (longitude - getCentralMeridian()) * cos(theta) / PI;
    double y = SQRT2 * sin(theta);
    return new Double2D(x, y);
  }

  @Override
  public Unprojected unproject(double x, double y) {
    double theta = asin(y / SQRT2);
    double latitude = asin((2 * theta + sin(2 * theta)) / PI);
    double longitude = getCentralMeridian() + PI * x / (2 * SQRT2 * cos(theta));

    boolean outsideEllipse = x * x / 8 + y * y / 2 > 1;
    return new Unprojected(latitude, longitude, outsideEllipse || outsideSky(latitude, longitude));
  }

  /**
   * Solves for the auxiliary angle.  At the poles the derivative vanishes and the iterate is no longer finite, in
   * which case the pole itself (±π/2) is the answer.
   */
  @VisibleForTesting
  static double theta(double latitude) {
    double sinLatitude = sin(latitude);
    double theta = asin(2 * latitude / PI);
    for (int i = 0; i < ITERATIONS; i++) {
      theta -= 0.5 * (2 * theta + sin(2 * theta) - PI * sinLatitude) / (1 + cos(2 * theta));
    }
    if (!Double.isFinite(theta)) {
      theta = signum(sinLatitude) * 0.5 * PI;
    }
    return theta;
  }
}
