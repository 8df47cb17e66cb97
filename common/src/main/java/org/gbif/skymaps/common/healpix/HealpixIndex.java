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
package org.gbif.skymaps.common.healpix;

import org.gbif.skymaps.common.sphere.SkyPosition;

/**
 * Conversions between sky positions and HEALPix pixel indices in the NESTED ordering scheme, at any resolution.
 * <p/>
 * At resolution {@code nside} the sphere is divided into {@code 12·nside²} equal-area pixels, and the four children
 * of a pixel at {@code 2·nside} have contiguous indices.  Implementations must be deterministic and threadsafe.
 */
public interface HealpixIndex {

  /**
   * Returned for positions which have no pixel, such as non-finite coordinates.
   */
  long NO_PIXEL = -1;

  /**
   * @param nside the resolution
   * @param longitude in degrees, any range
   * @param latitude in degrees
   * @return the nested pixel index containing the position, or {@link #NO_PIXEL}
   */
  long angleToPixel(int nside, double longitude, double latitude);

  /**
   * Bulk form of {@link #angleToPixel(int, double, double)}, which implementations may do more efficiently.
   */
  default long[] angleToPixel(int nside, double[] longitudes, double[] latitudes) {
    long[] pixels = new long[longitudes.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = angleToPixel(nside, longitudes[i], latitudes[i]);
    }
    return pixels;
  }

  /**
   * @param nside the resolution
   * @param pixel the nested pixel index
   * @return the centre of the pixel in degrees, longitude folded into (−180, 180]
   */
  SkyPosition pixelToAngle(int nside, long pixel);

  /**
   * @return the number of pixels covering the sphere at the resolution, 12·nside²
   */
  static long npix(int nside) {
    return 12L * nside * nside;
  }

  /**
   * @return the approximate angular size of a pixel at the resolution in radians, √(4π / npix)
   */
  static double resolution(int nside) {
    return Math.sqrt(4 * Math.PI / npix(nside));
  }

  /**
   * @throws IllegalArgumentException if the resolution is not a positive power of two, as the nested scheme requires
   */
  static int checkNside(int nside) {
    if (nside <= 0 || Integer.bitCount(nside) != 1) {
      throw new IllegalArgumentException("nside must be a positive power of 2. Supplied: " + nside);
    }
    return nside;
  }
}
