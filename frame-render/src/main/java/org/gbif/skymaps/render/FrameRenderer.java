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

import org.gbif.skymaps.common.healpix.HealpixIndex;
import org.gbif.skymaps.common.healpix.PixelAddresses;
import org.gbif.skymaps.common.projection.Double2D;
import org.gbif.skymaps.common.raster.Graticule;
import org.gbif.skymaps.common.raster.GraticuleMode;
import org.gbif.skymaps.common.raster.GridLabel;
import org.gbif.skymaps.common.raster.MapRasterizer;
import org.gbif.skymaps.common.raster.RasterSpec;
import org.gbif.skymaps.common.raster.RasterizerCache;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the distance slices of a map on a pool of workers.  All frames share one rasterizer and one grid overlay,
 * so only the values differ between them.  A frame that fails is reported in its result and does not stop the
 * others.
 */
public class FrameRenderer {
  private static final Logger LOG = LoggerFactory.getLogger(FrameRenderer.class);

  private final RenderConfiguration config;
  private final int sourceCount;
  // positions of the drawn addresses among those the source supplies values for, or null if all are drawn
  private final int[] selection;
  private final MapRasterizer rasterizer;
  private final MapOverlay overlay;

  public FrameRenderer(RenderConfiguration config, HealpixIndex index, PixelAddresses addresses) {
    this(config, index, addresses, null);
  }

  /**
   * @param config the rendering settings
   * @param index used to locate the pixels
   * @param addresses the pixels the source supplies values for
   * @param cache to share rasterizers with other renderers, or null to build one directly
   * @throws IllegalArgumentException if there is nothing to draw
   */
  public FrameRenderer(RenderConfiguration config, HealpixIndex index, PixelAddresses addresses,
                       RasterizerCache cache) {
    this.config = Preconditions.checkNotNull(config, "A configuration is required");
    Preconditions.checkNotNull(index, "A HEALPix index is required");
    Preconditions.checkNotNull(addresses, "Pixel addresses are required");
    Preconditions.checkArgument(config.getWorkers() > 0, "Workers must be positive. Supplied: %s",
                                config.getWorkers());

    sourceCount = addresses.size();
    PixelAddresses drawn = addresses;
    if (config.getBounds() != null) {
      selection = addresses.selectWithin(index, config.getBounds().toSkyBounds());
      drawn = addresses.subset(selection);
      LOG.info("{} of {} pixels lie within {}", selection.length, sourceCount, config.getBounds());
    } else {
      selection = null;
    }

    RasterSpec spec = config.toRasterSpec();
    rasterizer = cache != null ? cache.get(drawn, spec) : new MapRasterizer(index, drawn, spec);
    overlay = overlay(rasterizer, config.getGraticule());
  }

  private static MapOverlay overlay(MapRasterizer rasterizer, RenderConfiguration.GraticuleConfiguration conf) {
    if (conf == null) {
      return MapOverlay.EMPTY;
    }
    double[] lLines = toArray(conf.getLongitudes());
    double[] bLines = toArray(conf.getLatitudes());
    GraticuleMode mode = conf.getMode();

    Graticule graticule = new Graticule(rasterizer);
    List<Double2D> dots = graticule.lines(lLines, bLines, conf.getLongitudeSpacing(), conf.getLatitudeSpacing(),
                                          mode, true);
    List<GridLabel> lLabels = mode.includesMeridians()
      ? graticule.longitudeLabels(lLines, conf.getLabelShift())
      : Collections.<GridLabel>emptyList();
    List<GridLabel> bLabels = mode.includesParallels()
      ? graticule.latitudeLabels(bLines, conf.getLabelShift())
      : Collections.<GridLabel>emptyList();
    LOG.debug("Grid overlay has {} dots, {} meridian and {} parallel labels", dots.size(), lLabels.size(),
              bLabels.size());
    return new MapOverlay(dots, lLabels, bLabels);
  }

  private static double[] toArray(List<Double> values) {
    return values == null ? new double[0] : Doubles.toArray(values);
  }

  /**
   * Renders the slices named in the configuration.
   * @see #render(List, FrameSource, FrameSink)
   */
  public List<FrameResult> render(FrameSource source, FrameSink sink) throws InterruptedException {
    return render(config.frames(), source, sink);
  }

  /**
   * Renders each frame, handing the results to the sink in frame order as they become available.
   *
   * @return the results in frame order, one per frame
   * @throws InterruptedException if interrupted while waiting for the workers
   */
  public List<FrameResult> render(List<Frame> frames, FrameSource source, FrameSink sink)
    throws InterruptedException {
    Preconditions.checkNotNull(source, "A frame source is required");
    Preconditions.checkNotNull(sink, "A frame sink is required");
    if (frames.isEmpty()) {
      return ImmutableList.of();
    }

    int workers = Math.min(config.getWorkers(), frames.size());
    LOG.info("Rendering {} frames of {}×{} on {} workers", frames.size(), rasterizer.getSpec().getWidth(),
             rasterizer.getSpec().getHeight(), workers);
    ExecutorService exec = Executors.newFixedThreadPool(
      workers, new ThreadFactoryBuilder().setNameFormat("frame-render-%d").setDaemon(true).build());
    try {
      List<Future<FrameResult>> futures = Lists.newArrayListWithCapacity(frames.size());
      for (Frame frame : frames) {
        futures.add(exec.submit(() -> renderFrame(frame, source)));
      }

      List<FrameResult> results = Lists.newArrayListWithCapacity(frames.size());
      for (int i = 0; i < frames.size(); i++) {
        FrameResult result = await(frames.get(i), futures.get(i));
        sink.accept(result);
        results.add(result);
      }
      return results;
    } finally {
      exec.shutdownNow();
    }
  }

  private FrameResult await(Frame frame, Future<FrameResult> future) throws InterruptedException {
    try {
      return future.get(config.getFrameTimeoutMinutes(), TimeUnit.MINUTES);
    } catch (ExecutionException e) {
      LOG.error("Frame {} failed", frame.getIndex(), e.getCause());
      return FrameResult.failure(frame, e.getCause());
    } catch (TimeoutException e) {
      LOG.error("Frame {} timed out after {} minutes", frame.getIndex(), config.getFrameTimeoutMinutes());
      future.cancel(true);
      return FrameResult.failure(frame, e);
    }
  }

  private FrameResult renderFrame(Frame frame, FrameSource source) {
    try {
      double[] values = source.values(frame);
      Preconditions.checkArgument(values != null && values.length == sourceCount,
                                  "Expected %s values for frame %s", sourceCount, frame.getIndex());
      double[][] image = rasterizer.rasterize(select(values));
      LOG.debug("Rendered frame {} at DM {}", frame.getIndex(), frame.getDistanceModulus());
      return FrameResult.success(frame, image);
    } catch (Exception e) {
      LOG.error("Unable to render frame {} at DM {}", frame.getIndex(), frame.getDistanceModulus(), e);
      return FrameResult.failure(frame, e);
    }
  }

  private double[] select(double[] values) {
    if (selection == null) {
      return values;
    }
    double[] drawn = new double[selection.length];
    for (int i = 0; i < selection.length; i++) {
      drawn[i] = values[selection[i]];
    }
    return drawn;
  }

  public MapRasterizer getRasterizer() {
    return rasterizer;
  }

  public MapOverlay getOverlay() {
    return overlay;
  }
}
