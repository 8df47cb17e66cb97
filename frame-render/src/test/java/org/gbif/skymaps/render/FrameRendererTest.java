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

import org.gbif.skymaps.common.healpix.CdsHealpixIndex;
import org.gbif.skymaps.common.healpix.HealpixIndex;
import org.gbif.skymaps.common.healpix.PixelAddresses;
import org.gbif.skymaps.common.raster.GraticuleMode;
import org.gbif.skymaps.common.raster.RasterizerCache;
import org.gbif.skymaps.common.sphere.SkyPosition;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.Lists;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class FrameRendererTest {

  private final HealpixIndex index = new CdsHealpixIndex();

  private static RenderConfiguration config() {
    return RenderConfiguration.builder()
      .imageWidth(60)
      .imageHeight(30)
      .projection("Hammer")
      .workers(3)
      .slices(RenderConfiguration.SlicesConfiguration.builder().dmMin(4).dmMax(12).count(5).build())
      .graticule(RenderConfiguration.GraticuleConfiguration.builder()
                   .longitudes(Arrays.asList(-120d, -60d, 0d, 60d, 120d))
                   .latitudes(Arrays.asList(-45d, 0d, 45d))
                   .mode(GraticuleMode.BOTH)
                   .build())
      .build();
  }

  /**
   * Every cell of a frame shows the value the source gave for that frame.
   */
  private static FrameSource constantPerFrame(int size) {
    return frame -> {
      double[] values = new double[size];
      Arrays.fill(values, frame.getIndex());
      return values;
    };
  }

  @Test
  public void testRendersFramesInOrder() throws Exception {
    PixelAddresses addresses = PixelAddresses.allSky(4);
    FrameRenderer renderer = new FrameRenderer(config(), index, addresses);

    List<FrameResult> sunk = Lists.newArrayList();
    List<FrameResult> results = renderer.render(constantPerFrame(addresses.size()), sunk::add);

    assertEquals(5, results.size());
    assertEquals(results, sunk);
    for (int i = 0; i < 5; i++) {
      FrameResult result = results.get(i);
      assertEquals(i, result.getFrame().getIndex());
      assertTrue(result.isSuccess());
      assertEquals(60, result.getImage().length);
      for (double[] column : result.getImage()) {
        for (double v : column) {
          assertTrue(Double.isNaN(v) || v == i);
        }
      }
    }
  }

  @Test
  public void testFailingFrameIsIsolated() throws Exception {
    PixelAddresses addresses = PixelAddresses.allSky(4);
    FrameRenderer renderer = new FrameRenderer(config(), index, addresses);

    FrameSource flaky = frame -> {
      if (frame.getIndex() == 2) {
        throw new IOException("Unable to read slice 2");
      }
      if (frame.getIndex() == 3) {
        return new double[1];
      }
      return constantPerFrame(addresses.size()).values(frame);
    };
    List<FrameResult> results = renderer.render(flaky, result -> {});

    assertEquals(5, results.size());
    assertTrue(results.get(0).isSuccess());
    assertTrue(results.get(1).isSuccess());
    assertFalse(results.get(2).isSuccess());
    assertTrue(results.get(2).getFailure() instanceof IOException);
    assertNull(results.get(2).getImage());
    assertTrue(results.get(3).getFailure() instanceof IllegalArgumentException);
    assertTrue(results.get(4).isSuccess());
  }

  @Test
  public void testOverlay() {
    FrameRenderer renderer = new FrameRenderer(config(), index, PixelAddresses.allSky(4));
    MapOverlay overlay = renderer.getOverlay();
    assertFalse(overlay.getDots().isEmpty());
    assertEquals(5, overlay.getLongitudeLabels().size());
    assertEquals(3, overlay.getLatitudeLabels().size());

    RenderConfiguration bare = config().toBuilder().graticule(null).build();
    assertSame(MapOverlay.EMPTY, new FrameRenderer(bare, index, PixelAddresses.allSky(4)).getOverlay());
  }

  @Test
  public void testBoundsRestrictPixels() throws Exception {
    RenderConfiguration config = RenderConfiguration.load("/render-bounds.yml");
    PixelAddresses addresses = PixelAddresses.allSky(8);
    FrameRenderer renderer = new FrameRenderer(config, index, addresses);
    assertTrue(renderer.getRasterizer().getAddressCount() < addresses.size());

    // each value is the position of its pixel among all the addresses
    double[] positions = new double[addresses.size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = i;
    }
    List<FrameResult> results = renderer.render(frame -> positions, result -> {});
    assertEquals(4, results.size());

    int shown = 0;
    for (double[] column : results.get(0).getImage()) {
      for (double v : column) {
        if (!Double.isNaN(v)) {
          SkyPosition centre = index.pixelToAngle(8, addresses.pixel((int) v));
          assertTrue(config.getBounds().toSkyBounds().contains(centre.getLongitude(), centre.getLatitude()));
          shown++;
        }
      }
    }
    assertTrue(shown > 0);
  }

  @Test
  public void testSharedCache() {
    try (RasterizerCache cache = new RasterizerCache(index, 2)) {
      FrameRenderer a = new FrameRenderer(config(), index, PixelAddresses.allSky(2), cache);
      FrameRenderer b = new FrameRenderer(config(), index, PixelAddresses.allSky(2), cache);
      assertSame(a.getRasterizer(), b.getRasterizer());
    }
  }

  @Test
  public void testNoFrames() throws Exception {
    FrameRenderer renderer = new FrameRenderer(config(), index, PixelAddresses.allSky(1));
    assertTrue(renderer.render(Lists.newArrayList(), constantPerFrame(12), result -> {}).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoWorkers() {
    new FrameRenderer(config().toBuilder().workers(0).build(), index, PixelAddresses.allSky(1));
  }
}
