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
package org.gbif.skymaps.render;

import org.gbif.skymaps.common.projection.Projections;
import org.gbif.skymaps.common.raster.GraticuleMode;
import org.gbif.skymaps.common.raster.RasterSpec;

import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RenderConfigurationTest {

  static final double ε = 1e-9;

  @Test
  public void testLoad() throws IOException {
    RenderConfiguration config = RenderConfiguration.load("/render-test.yml");

    RasterSpec spec = config.toRasterSpec();
    // 80% of a 4×2 inch figure at 50 dpi
    assertEquals(160, spec.getWidth());
    assertEquals(80, spec.getHeight());
    assertEquals(Projections.MOLLWEIDE, spec.getProjection());
    assertEquals(180, spec.getCenterLongitude(), ε);
    assertEquals(180, spec.getCentralMeridian(), ε);
    assertTrue(spec.isClip());

    assertEquals(DistanceSlices.Step.LINEAR, config.getSlices().getStep());
    assertEquals(3, config.frames().size());

    assertNotNull(config.getGraticule());
    assertEquals(Arrays.asList(-60d, -30d, 0d, 30d, 60d), config.getGraticule().getLatitudes());
    assertEquals(GraticuleMode.BOTH, config.getGraticule().getMode());
    assertEquals(1, config.getGraticule().getLongitudeSpacing(), ε);
    assertEquals(0.05, config.getGraticule().getLabelShift(), ε);

    assertEquals(2, config.getWorkers());
    assertEquals(2, config.getCacheCapacity());
    assertNull(config.getBounds());
  }

  @Test
  public void testDefaults() {
    RenderConfiguration config = RenderConfiguration.builder().build();
    RasterSpec spec = config.toRasterSpec();
    assertEquals(1280, spec.getWidth());
    assertEquals(640, spec.getHeight());
    assertEquals(Projections.CARTESIAN, spec.getProjection());
    assertTrue(spec.isClip());

    assertEquals(21, config.frames().size());
    assertEquals(1, config.getWorkers());
    assertEquals(0, config.getCacheCapacity());
  }

  @Test
  public void testExplicitImageSize() throws IOException {
    RenderConfiguration config = RenderConfiguration.load("/render-bounds.yml");
    assertEquals(60, config.toRasterSpec().getWidth());
    assertEquals(40, config.toRasterSpec().getHeight());
    assertEquals(-30, config.getBounds().getMinLongitude(), ε);
    assertFalse(config.getBounds().toSkyBounds().contains(40, 0));
    assertEquals(DistanceSlices.Step.LOG, config.getSlices().getStep());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownProjection() {
    RenderConfiguration.builder().projection("Robinson").build().toRasterSpec();
  }
}
