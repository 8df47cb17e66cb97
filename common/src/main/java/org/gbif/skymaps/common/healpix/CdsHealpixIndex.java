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

import org.gbif.skymaps.common.sphere.SkyCoordinates;
import org.gbif.skymaps.common.sphere.SkyPosition;

import cds.healpix.HashComputer;
import cds.healpix.Healpix;
import cds.healpix.HealpixNested;

import static java.lang.Math.PI;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * HEALPix indexing backed by the CDS HEALPix library.
 * <p/>
 * The library's computers carry working state, so a new one is taken for each call.  This class is threadsafe.
 */
public class CdsHealpixIndex implements HealpixIndex {
  private static final double HALF_PI = PI / 2;
  private static final double TWO_PI = 2 * PI;

  @Override
  public long angleToPixel(int nside, double longitude, double latitude) {
    return hash(nested(nside).newHashComputer(), longitude, latitude);
  }

  @Override
  public long[] angleToPixel(int nside, double[] longitudes, double[] latitudes) {
    if (longitudes.length != latitudes.length) {
      throw new IllegalArgumentException("Longitudes and latitudes differ in length: " + longitudes.length + " and "
                                         + latitudes.length);
    }
    HashComputer computer = nested(nside).newHashComputer();
    long[] pixels = new long[longitudes.length];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = hash(computer, longitudes[i], latitudes[i]);
    }
    return pixels;
  }

  @Override
  public SkyPosition pixelToAngle(int nside, long pixel) {
    if (pixel < 0 || pixel >= HealpixIndex.npix(nside)) {
      throw new IllegalArgumentException("Pixel " + pixel + " is not valid at nside " + nside);
    }
    double[] lonLat = nested(nside).newVerticesAndPathComputer().center(pixel);
    return new SkyPosition(SkyCoordinates.to180Degrees(toDegrees(lonLat[0])), toDegrees(lonLat[1]));
  }

  private static long hash(HashComputer computer, double longitude, double latitude) {
    if (!Double.isFinite(longitude) || !Double.isFinite(latitude)) {
      return NO_PIXEL;
    }
    double lon = toRadians(longitude) % TWO_PI;
    if (lon < 0) {
      lon += TWO_PI;
    }
    if (lon >= TWO_PI) {
      lon = 0;
    }
    double lat = Math.max(-HALF_PI, Math.min(HALF_PI, toRadians(latitude)));
    return computer.hash(lon, lat);
  }

  private static HealpixNested nested(int nside) {
    return Healpix.getNested(Integer.numberOfTrailingZeros(HealpixIndex.checkNside(nside)));
  }
}
