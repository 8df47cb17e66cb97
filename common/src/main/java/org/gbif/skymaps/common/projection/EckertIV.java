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
import static java.lang.Math.abs;
import static java.lang.Math.asin;
import static java.lang.Math.copySign;
import static java.lang.Math.cos;
import static java.lang.Math.min;
import static java.lang.Math.signum;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * The Eckert IV projection: pseudocylindrical and equal-area, with straight parallels and semicircular outer
 * meridians.
 * <p/>
 * The axes are scaled so the whole sky spans x ∈ [−180, 180] and y ∈ [−90, 90], which lets the map share axis
 * extents with the {@link Cartesian} projection.
 * See https://en.wikipedia.org/wiki/Eckert_IV_projection
 *
 * This class is threadsafe.
 */
class EckertIV extends AbstractSkyProjection {
  static final int ITERATIONS = 10;

  private static final double A = sqrt(PI * (4 + PI));
  private static final double B = sqrt(PI / (4 + PI));
  private static final double C = 2 + PI / 2;

  // the unscaled projection reaches x = 4π/A at λ - λ₀ = π and y = 2B at φ = π/2
  static final double X_SCALE = 180 * A / (4 * PI);
  static final double Y_SCALE = 90 / (2 * B);

  EckertIV(double centralMeridianDegrees) {
    super(centralMeridianDegrees);
  }

  @Override
  public Double2D project(double latitude, double longitude) {
    double theta = theta(latitude);
    double x = X_SCALE * 2 / A * (longitude - getCentralMeridian()) * (1 + cos(theta));
    double y = Y_SCALE * 2 * B * sin(theta);
    return new Double2D(x, y);
  }

  @Override
  public Unprojected unproject(double x, double y) {
    double theta = asin((y / Y_SCALE) / 2 / B);
    double latitude = asin((theta + 0.5 * sin(2 * theta) + 2 * sin(theta)) / C);
    double longitude = getCentralMeridian() + A / 2 * (x / X_SCALE) / (1 + cos(theta));
    return new Unprojected(latitude, longitude, outsideSky(latitude, longitude));
  }

  /**
   * Solves θ + ½ sin 2θ + 2 sin θ = (2 + π/2) sin φ for the auxiliary angle.
   * <p/>
   * The derivative of the left side vanishes at the poles, so Newton's method is run on the distance δ = π/2 − |θ|
   * from the nearer pole instead, where the equation reads δ − ½ sin 2δ + 4 sin²(δ/2) = 2C sin²((π/2 − |φ|)/2).
   * Its leading term is δ², which gives the starting point δ₀ = √(right side) and keeps the iteration quadratic
   * right up to the pole.  Falls back to the pole if the iterate is no longer finite.
   */
  @VisibleForTesting
  static double theta(double latitude) {
    double halfColatitude = (0.5 * PI - abs(latitude)) / 2;
    double target = 2 * C * sin(halfColatitude) * sin(halfColatitude);
    double delta = min(0.5 * PI, sqrt(target));
    for (int i = 0; i < ITERATIONS; i++) {
      double sinDelta = sin(delta);
      double slope = 2 * sinDelta * (1 + sinDelta);
      double residual = delta - 0.5 * sin(2 * delta) + 4 * sin(delta / 2) * sin(delta / 2) - target;
      if (residual == 0 || slope == 0) {
        break;
      }
      delta -= residual / slope;
    }
    double theta = copySign(0.5 * PI - delta, latitude);
    if (!Double.isFinite(theta)) {
      theta = signum(latitude) * 0.5 * PI;
    }
    return theta;
  }
}
