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

/**
 * Defines the interface for converting between positions on the sphere and coordinates on the projected plane.
 * <p/>
 * All angles are in radians.  The longitude λ is measured such that the central meridian of the map sits at
 * {@link #getCentralMeridian()}, and a full turn of sky is covered by λ in [0, 2π].
 */
public interface SkyProjection {

  /**
   * Projects the position onto the plane.
   * @param latitude φ in radians
   * @param longitude λ in radians
   * @return The plane coordinate
   */
  Double2D project(double latitude, double longitude);

  /**
   * Inverts the projection for the plane coordinate given.  This never throws for coordinates off the map; those
   * are flagged instead.
   * @param x The plane x
   * @param y The plane y
   * @return The latitude and longitude in radians, and whether the coordinate is out of bounds
   */
  Unprojected unproject(double x, double y);

  /**
   * @return the central meridian λ₀ in radians
   */
  double getCentralMeridian();
}
