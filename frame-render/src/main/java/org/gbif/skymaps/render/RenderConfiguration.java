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

import org.gbif.skymaps.common.projection.AbstractSkyProjection;
import org.gbif.skymaps.common.projection.Projections;
import org.gbif.skymaps.common.raster.GraticuleMode;
import org.gbif.skymaps.common.raster.RasterSpec;
import org.gbif.skymaps.common.sphere.SkyBounds;

import java.io.IOException;
import java.net.URL;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings for rendering an animated map, read from YAML.  The image size is either given directly or derived
 * from a figure size in inches, of which the map takes 80%.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class RenderConfiguration {
  static final double FIGURE_FRACTION = 0.8;

  private int imageWidth;
  private int imageHeight;

  @Builder.Default
  private double figureWidth = 8;
  @Builder.Default
  private double figureHeight = 4;
  @Builder.Default
  private double dpi = 200;

  @Builder.Default
  private String projection = Projections.CARTESIAN.getDisplayName();
  @Builder.Default
  private double centralMeridian = AbstractSkyProjection.DEFAULT_CENTRAL_MERIDIAN;
  private double centerLongitude;
  private double centerLatitude;
  @Builder.Default
  private boolean clip = true;

  // only pixels within these bounds are drawn, if given
  private BoundsConfiguration bounds;

  @Builder.Default
  private SlicesConfiguration slices = SlicesConfiguration.builder().build();

  private GraticuleConfiguration graticule;

  @Builder.Default
  private int workers = 1;
  @Builder.Default
  private int frameTimeoutMinutes = 60;
  // rasterizers a RenderSession keeps for reuse; 0 disables the cache
  private int cacheCapacity;

  @Data
  @Builder
  @Jacksonized
  public static class SlicesConfiguration {
    @Builder.Default
    private double dmMin = 4;
    @Builder.Default
    private double dmMax = 19;
    @Builder.Default
    private int count = 21;
    @Builder.Default
    private DistanceSlices.Step step = DistanceSlices.Step.LOG;
  }

  @Data
  @Builder
  @Jacksonized
  public static class BoundsConfiguration {
    private double minLongitude;
    private double maxLongitude;
    private double minLatitude;
    private double maxLatitude;

    SkyBounds toSkyBounds() {
      return new SkyBounds(minLongitude, maxLongitude, minLatitude, maxLatitude);
    }
  }

  @Data
  @Builder
  @Jacksonized
  public static class GraticuleConfiguration {
    private List<Double> longitudes;
    private List<Double> latitudes;
    @Builder.Default
    private GraticuleMode mode = GraticuleMode.BOTH;
    @Builder.Default
    private double longitudeSpacing = 1;
    @Builder.Default
    private double latitudeSpacing = 1;
    // how far labels sit off the map, as a fraction of its size
    @Builder.Default
    private double labelShift = 0.02;
  }

  /** E.g. pass in the filename relative to the classpath, e.g. "/render.yml" */
  public static RenderConfiguration load(String filename) throws IOException {
    URL conf = Resources.getResource(RenderConfiguration.class, filename);
    log.info("Reading from {}", conf);
    return new ObjectMapper(new YAMLFactory()).readValue(conf, RenderConfiguration.class);
  }

  /**
   * @return the geometry of the images to render
   * @throws IllegalArgumentException if the projection is unknown or the image would have no area
   */
  public RasterSpec toRasterSpec() {
    int width = imageWidth > 0 ? imageWidth : (int) (figureWidth * FIGURE_FRACTION * dpi);
    int height = imageHeight > 0 ? imageHeight : (int) (figureHeight * FIGURE_FRACTION * dpi);
    Preconditions.checkArgument(width > 0 && height > 0, "Image dimensions must be positive. Derived: %s×%s", width,
                                height);
    return RasterSpec.builder()
      .width(width)
      .height(height)
      .projection(Projections.fromName(projection))
      .centralMeridian(centralMeridian)
      .centerLongitude(centerLongitude)
      .centerLatitude(centerLatitude)
      .clip(clip)
      .build();
  }

  public List<Frame> frames() {
    return DistanceSlices.of(slices.getDmMin(), slices.getDmMax(), slices.getCount(), slices.getStep());
  }
}
