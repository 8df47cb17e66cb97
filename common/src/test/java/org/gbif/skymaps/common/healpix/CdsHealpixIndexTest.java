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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class CdsHealpixIndexTest {

  static final double ε = 1e-9;

  private final HealpixIndex index = new CdsHealpixIndex();

  @Test
  public void testSizes() {
    assertEquals(12, HealpixIndex.npix(1));
    assertEquals(192, HealpixIndex.npix(4));
    assertEquals(12L * 8192 * 8192, HealpixIndex.npix(8192));
    assertEquals(Math.sqrt(Math.PI / 3), HealpixIndex.resolution(1), ε);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNsideNotPowerOfTwo() {
    index.angleToPixel(3, 0, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNsideZero() {
    HealpixIndex.checkNside(0);
  }

  @Test
  public void testBasePixels() {
    // At nside 1 the equatorial base pixels are centred on longitudes 0, 90, 180 and 270.
    assertEquals(4, index.angleToPixel(1, 0, 0));

    SkyPosition first = index.pixelToAngle(1, 0);
    assertEquals(45, first.getLongitude(), ε);
    assertEquals(Math.toDegrees(Math.asin(2.0 / 3)), first.getLatitude(), ε);

    SkyPosition equatorial = index.pixelToAngle(1, 4);
    assertEquals(0, equatorial.getLongitude(), ε);
    assertEquals(0, equatorial.getLatitude(), ε);
  }

  @Test
  public void testCentresRoundTrip() {
    int nside = 8;
    for (long p = 0; p < HealpixIndex.npix(nside); p++) {
      SkyPosition centre = index.pixelToAngle(nside, p);
      assertEquals("Pixel " + p, p, index.angleToPixel(nside, centre.getLongitude(), centre.getLatitude()));
    }
  }

  @Test
  public void testLongitudeConventions() {
    assertEquals(index.angleToPixel(16, 271.3, 10.2), index.angleToPixel(16, -88.7, 10.2));
    assertEquals(index.angleToPixel(16, 10.3, -40.2), index.angleToPixel(16, 370.3, -40.2));
    assertEquals(index.angleToPixel(16, 0.6, 5.1), index.angleToPixel(16, -719.4, 5.1));
  }

  @Test
  public void testNonFinite() {
    assertEquals(HealpixIndex.NO_PIXEL, index.angleToPixel(4, Double.NaN, 0));
    assertEquals(HealpixIndex.NO_PIXEL, index.angleToPixel(4, 0, Double.POSITIVE_INFINITY));
  }

  @Test
  public void testBulk() {
    double[] lons = {0, 45, -90, 200, Double.NaN};
    double[] lats = {0, 41.8, 10, -60, 0};
    long[] expected = new long[lons.length];
    for (int i = 0; i < lons.length; i++) {
      expected[i] = index.angleToPixel(32, lons[i], lats[i]);
    }
    assertArrayEquals(expected, index.angleToPixel(32, lons, lats));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBulkLengthMismatch() {
    index.angleToPixel(4, new double[2], new double[3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPixel() {
    index.pixelToAngle(1, 12);
  }
}
