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

import com.google.common.annotations.VisibleForTesting;

import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * A rotation of the sphere given by Euler angles (α, β, γ) about the z, y and x axes.
 * <p/>
 * The forward rotation of a unit vector v is X(γ)·Y(β)·Z(α)·v and the inverse is Z(−α)·Y(−β)·X(−γ)·v, so applying
 * one then the other returns the original position except at the poles, where longitude is undefined.
 * <p/>
 * Angles passed to the constructor and positions passed to {@link #apply} are in degrees.  This class is immutable
 * and threadsafe.
 */
public class EulerRotation implements Serializable {
  private static final long serialVersionUID = 7410338162271585163L;

  public static final EulerRotation IDENTITY = new EulerRotation(0, 0, 0);

  private final double alpha;
  private final double beta;
  private final double gamma;
  private final double[][] forward;
  private final double[][] inverse;

  public EulerRotation(double alpha, double beta, double gamma) {
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;

    double a = toRadians(alpha);
    double b = toRadians(beta);
    double c = toRadians(gamma);
    forward = multiply(rotX(c), multiply(rotY(b), rotZ(a)));
    inverse = multiply(rotZ(-a), multiply(rotY(-b), rotX(-c)));
  }

  /**
   * The rotation that brings the given position to (0, 0), used to recentre a map on an arbitrary point.
   * @param longitude of the new map centre, in degrees
   * @param latitude of the new map centre, in degrees
   */
  public static EulerRotation centredOn(double longitude, double latitude) {
    if (longitude == 0 && latitude == 0) {
      return IDENTITY;
    }
    return new EulerRotation(-longitude, latitude, 0);
  }

  /**
   * Rotates a single position.
   * @param longitude in degrees
   * @param latitude in degrees
   * @param alpha rotation about z, in degrees
   * @param beta rotation about y, in degrees
   * @param gamma rotation about x, in degrees
   * @param inverse true to undo the rotation with the same angles
   * @return the rotated position in degrees, longitude in (−180, 180]
   */
  public static SkyPosition rotate(double longitude, double latitude, double alpha, double beta, double gamma,
                                   boolean inverse) {
    EulerRotation r = new EulerRotation(alpha, beta, gamma);
    return inverse ? r.invert(longitude, latitude) : r.apply(longitude, latitude);
  }

  public SkyPosition apply(double longitude, double latitude) {
    return transform(forward, longitude, latitude);
  }

  public SkyPosition invert(double longitude, double latitude) {
    return transform(inverse, longitude, latitude);
  }

  public boolean isIdentity() {
    return alpha == 0 && beta == 0 && gamma == 0;
  }

  private static SkyPosition transform(double[][] m, double longitude, double latitude) {
    double[] v = toVector(toRadians(latitude), toRadians(longitude));
    double x = m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2];
    double y = m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2];
    double z = m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2];
    double[] angles = toAngles(x, y, z);
    return new SkyPosition(toDegrees(angles[1]), toDegrees(angles[0]));
  }

  /**
   * @param latitude in radians
   * @param longitude in radians
   * @return the unit vector {x, y, z}
   */
  public static double[] toVector(double latitude, double longitude) {
    double cosLatitude = cos(latitude);
    return new double[] {cos(longitude) * cosLatitude, sin(longitude) * cosLatitude, sin(latitude)};
  }

  /**
   * @return {latitude, longitude} in radians of the vector, which need not be of unit length
   */
  public static double[] toAngles(double x, double y, double z) {
    double r = sqrt(x * x + y * y + z * z);
    return new double[] {asin(z / r), atan2(y, x)};
  }

  @VisibleForTesting
  static double[][] multiply(double[][] a, double[][] b) {
    double[][] m = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        m[i][j] = a[i][0] * b[0][j] + a[i][1] * b[1][j] + a[i][2] * b[2][j];
      }
    }
    return m;
  }

  private static double[][] rotX(double gamma) {
    return new double[][] {
      {1, 0, 0},
      {0, cos(gamma), -sin(gamma)},
      {0, sin(gamma), cos(gamma)}
    };
  }

  private static double[][] rotY(double beta) {
    return new double[][] {
      {cos(beta), 0, sin(beta)},
      {0, 1, 0},
      {-sin(beta), 0, cos(beta)}
    };
  }

  private static double[][] rotZ(double alpha) {
    return new double[][] {
      {cos(alpha), -sin(alpha), 0},
      {sin(alpha), cos(alpha), 0},
      {0, 0, 1}
    };
  }

  public double getAlpha() {
    return alpha;
  }

  public double getBeta() {
    return beta;
  }

  public double getGamma() {
    return gamma;
  }

  @Override
  public String toString() {
    return String.format("EulerRotation(α=%s, β=%s, γ=%s)", alpha, beta, gamma);
  }
}
