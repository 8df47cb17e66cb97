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
package org.gbif.skymaps.common.raster;

import org.gbif.skymaps.common.healpix.CdsHealpixIndex;
import org.gbif.skymaps.common.healpix.PixelAddresses;
import org.gbif.skymaps.common.projection.Double2D;
import org.gbif.skymaps.common.projection.Projections;
import org.gbif.skymaps.common.sphere.EulerRotation;
import org.gbif.skymaps.common.sphere.SkyPosition;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.gbif.skymaps.common.projection.AssertOnDouble2D.assertEquals;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class GraticuleTest {

  static final double ε = 1e-9;

  @Test
  public void testArange() {
    assertArrayEquals(new double[] {0, 0.5, 1, 1.5}, Graticule.arange(0, 2, 0.5), ε);
    assertEquals(361, Graticule.arange(-180, 180.5, 1).length);
    assertEquals(180, Graticule.arange(-180, 180.5, 1)[360], ε);
    assertEquals(0, Graticule.arange(1, 0, 1).length);
  }

  @Test
  public void testPoints() {
    double[] lLines = {0, 90};
    double[] bLines = {0};

    List<SkyPosition> both = Graticule.points(lLines, bLines, 30, 45, GraticuleMode.BOTH);
    // 13 along the equator, from -180 to 180, then 5 along each meridian, from -90 to 90
    assertEquals(13 + 2 * 5, both.size());
    assertEquals(new SkyPosition(-180, 0), both.get(0));
    assertEquals(new SkyPosition(180, 0), both.get(12));
    assertEquals(new SkyPosition(0, -90), both.get(13));
    assertEquals(new SkyPosition(90, 90), both.get(22));

    assertEquals(13, Graticule.points(lLines, bLines, 30, 45, GraticuleMode.PARALLELS).size());
    assertEquals(10, Graticule.points(lLines, bLines, 30, 45, GraticuleMode.MERIDIANS).size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroSpacing() {
    Graticule.points(new double[] {0}, new double[] {0}, 0, 1, GraticuleMode.BOTH);
  }

  @Test
  public void testProjectUnrotated() {
    List<Double2D> xy = Graticule.project(Projections.CARTESIAN.create(), EulerRotation.IDENTITY,
                                          Arrays.asList(new SkyPosition(0, 0), new SkyPosition(90, 45)));
    // x = λ − λ₀ with λ = 180° − l
    assertEquals(new Double2D(0, 0), xy.get(0), ε);
    assertEquals(new Double2D(-90, 45), xy.get(1), ε);
  }

  @Test
  public void testLabel() {
    List<Double2D> line = Arrays.asList(new Double2D(0, 0), new Double2D(1, 0), new Double2D(2, 0),
                                        new Double2D(3, 0));
    // The widest gap is the wrap from the last dot back to the first, so the labels go beyond either end.
    GridLabel label = Graticule.label(45, line, 0.5);
    assertEquals(45, label.getValue(), ε);
    assertEquals(new Double2D(-0.5, 0), label.getFirst(), ε);
    assertEquals(new Double2D(3.5, 0), label.getSecond(), ε);
  }

  @Test
  public void testLinesWithinMap() {
    MapRasterizer r = new MapRasterizer(new CdsHealpixIndex(), PixelAddresses.allSky(4),
                                        RasterSpec.builder().width(100).height(50).projection(Projections.MOLLWEIDE)
                                          .build());
    Graticule graticule = new Graticule(r);
    double[] lLines = {-120, -60, 0, 60, 120};
    double[] bLines = {-60, -30, 0, 30, 60};

    List<Double2D> clipped = graticule.lines(lLines, bLines, GraticuleMode.BOTH);
    List<Double2D> all = graticule.lines(lLines, bLines, 1, 1, GraticuleMode.BOTH, false);
    assertFalse(clipped.isEmpty());
    assertEquals(Graticule.points(lLines, bLines, 1, 1, GraticuleMode.BOTH).size(), all.size());
    assertTrue(clipped.size() <= all.size());

    Extent sky = r.getSkyExtent();
    for (Double2D p : clipped) {
      assertTrue(p.getX() <= sky.getX0() && p.getX() >= sky.getX1());
      assertTrue(p.getY() >= sky.getY0() && p.getY() <= sky.getY1());
    }
  }

  @Test
  public void testLabels() {
    MapRasterizer r = new MapRasterizer(new CdsHealpixIndex(), PixelAddresses.allSky(4),
                                        RasterSpec.builder().width(100).height(50).projection(Projections.HAMMER)
                                          .build());
    Graticule graticule = new Graticule(r);

    List<GridLabel> meridians = graticule.longitudeLabels(new double[] {-90, 0, 90}, 0.05);
    assertEquals(3, meridians.size());
    assertEquals(-90, meridians.get(0).getValue(), ε);
    for (GridLabel label : meridians) {
      // either end of a meridian, one above the other
      assertTrue(label.getFirst().getY() * label.getSecond().getY() < 0);
    }

    List<GridLabel> parallels = graticule.latitudeLabels(new double[] {-45, 45}, 0.05);
    assertEquals(2, parallels.size());
    assertEquals(45, parallels.get(1).getValue(), ε);
  }
}
