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

import org.gbif.skymaps.common.healpix.HealpixIndex;
import org.gbif.skymaps.common.healpix.PixelAddresses;
import org.gbif.skymaps.common.projection.Double2D;
import org.gbif.skymaps.common.projection.SkyProjection;
import org.gbif.skymaps.common.projection.Unprojected;
import org.gbif.skymaps.common.sphere.EulerRotation;
import org.gbif.skymaps.common.sphere.SkyCoordinates;
import org.gbif.skymaps.common.sphere.SkyPosition;

import java.util.Arrays;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Rasterizes a multi-resolution HEALPix map onto a fixed size image.
 * <p/>
 * Construction works out, once, which of the supplied pixel addresses each image cell shows.  Rasterizing a set
 * of pixel values is then a lookup per cell, so many maps over the same addresses (e.g. one per distance) can be
 * drawn cheaply.
 * <p/>
 * Images are indexed {@code [x][y]}, with x increasing to the right and y upwards.  In sky terms the columns run
 * from the greatest longitude on the left to the least on the right, as is conventional for maps of the sky.
 * <p/>
 * Instances are immutable once constructed, and threadsafe.
 */
public class MapRasterizer {
  private static final Logger LOG = LoggerFactory.getLogger(MapRasterizer.class);

  /**
   * The address index of a cell that shows no pixel.
   */
  public static final int NONE = -1;

  /**
   * The value of image cells that have no data.
   */
  public static final double NO_DATA = Double.NaN;

  // the bounds are found by probing pixel centres offset by this fraction of the pixel scale
  private static final double PROBE_FRACTION = 0.75;
  private static final double MIN_EXTENT = 1e-9;

  private final RasterSpec spec;
  private final int addressCount;
  private final SkyProjection projection;
  private final EulerRotation rotation;

  private final int[] addressIndex;
  private final boolean[] outOfBounds;
  private final int resolvedCount;

  private final Extent displayExtent;
  private final Extent skyExtent;
  private final double xScale;
  private final double yScale;

  /**
   * Builds the mapping from image cells to pixel addresses.
   * <p/>
   * Where addresses at different resolutions cover the same sky, the resolution appearing first in the addresses
   * is the one shown.
   *
   * @param index to locate pixels
   * @param addresses the pixels of the map, whose order the values given to {@link #rasterize(double[])} follow
   * @param spec the size, projection and centring of the image
   * @throws IllegalArgumentException if there are no addresses or the image has no area
   */
  public MapRasterizer(HealpixIndex index, PixelAddresses addresses, RasterSpec spec) {
    Preconditions.checkNotNull(index, "A HEALPix index is required");
    Preconditions.checkNotNull(addresses, "Pixel addresses are required");
    Preconditions.checkNotNull(spec, "A raster spec is required");
    Preconditions.checkArgument(!addresses.isEmpty(), "At least one pixel address is required");
    Preconditions.checkArgument(spec.getWidth() > 0 && spec.getHeight() > 0,
                                "Image dimensions must be positive. Supplied: %s×%s", spec.getWidth(), spec.getHeight());

    this.spec = spec;
    this.addressCount = addresses.size();
    this.projection = spec.createProjection();
    this.rotation = spec.rotation();

    List<Integer> resolutions = addresses.resolutions();
    displayExtent = displayExtent(index, addresses, resolutions);

    int width = spec.getWidth();
    int height = spec.getHeight();
    int cells = Math.multiplyExact(width, height);

    // invert the centre of every cell back onto the sky
    double[] longitudes = new double[cells];
    double[] latitudes = new double[cells];
    outOfBounds = new boolean[cells];
    for (int i = 0; i < width; i++) {
      double x = displayExtent.getX0() + (displayExtent.getX1() - displayExtent.getX0()) * (i + 0.5) / width;
      for (int j = 0; j < height; j++) {
        double y = displayExtent.getY0() + (displayExtent.getY1() - displayExtent.getY0()) * (j + 0.5) / height;
        int cell = i * height + j;

        Unprojected u = projection.unproject(x, y);
        outOfBounds[cell] = u.isOutOfBounds();
        double l = 180 - toDegrees(u.getLongitude());
        double b = toDegrees(u.getLatitude());
        if (!rotation.isIdentity()) {
          SkyPosition p = rotation.invert(l, b);
          l = p.getLongitude();
          b = p.getLatitude();
        }
        longitudes[cell] = l;
        latitudes[cell] = b;
      }
    }

    addressIndex = new int[cells];
    Arrays.fill(addressIndex, NONE);
    for (int nside : resolutions) {
      resolve(index, addresses, nside, longitudes, latitudes);
    }

    // sky bounds of the cells that show a pixel
    double lMin = Double.POSITIVE_INFINITY, lMax = Double.NEGATIVE_INFINITY;
    double bMin = Double.POSITIVE_INFINITY, bMax = Double.NEGATIVE_INFINITY;
    int resolved = 0;
    for (int cell = 0; cell < cells; cell++) {
      if (addressIndex[cell] != NONE) {
        resolved++;
        lMin = Math.min(lMin, longitudes[cell]);
        lMax = Math.max(lMax, longitudes[cell]);
        bMin = Math.min(bMin, latitudes[cell]);
        bMax = Math.max(bMax, latitudes[cell]);
      }
    }
    resolvedCount = resolved;

    if (resolved == 0) {
      LOG.warn("No image cell shows any of the {} pixels; using display bounds as sky bounds", addressCount);
      skyExtent = displayExtent;
    } else {
      double[] l = widen(lMin, lMax);
      double[] b = widen(bMin, bMax);
      skyExtent = new Extent(l[1], l[0], b[0], b[1]);
    }

    xScale = (skyExtent.getX1() - skyExtent.getX0()) / (displayExtent.getX1() - displayExtent.getX0());
    yScale = (skyExtent.getY1() - skyExtent.getY0()) / (displayExtent.getY1() - displayExtent.getY0());

    LOG.debug("Rasterized {} pixels to {}×{} with {} cells resolved; display {}, sky {}", addressCount, width, height,
              resolvedCount, displayExtent, skyExtent);
  }

  /**
   * Finds the extent of the projected plane which holds every pixel, by projecting each pixel centre shifted by a
   * 3×3 grid of offsets scaled to the pixel size at its resolution.
   */
  private Extent displayExtent(HealpixIndex index, PixelAddresses addresses, List<Integer> resolutions) {
    double xMin = Double.POSITIVE_INFINITY, xMax = Double.NEGATIVE_INFINITY;
    double yMin = Double.POSITIVE_INFINITY, yMax = Double.NEGATIVE_INFINITY;

    for (int nside : resolutions) {
      int[] members = addresses.indicesAt(nside);
      double pixelScale = toDegrees(HealpixIndex.resolution(nside));

      // λ and b of each pixel centre, in the rotated frame
      double[] lambda = new double[members.length];
      double[] b = new double[members.length];
      for (int k = 0; k < members.length; k++) {
        SkyPosition centre = index.pixelToAngle(nside, addresses.pixel(members[k]));
        if (!rotation.isIdentity()) {
          centre = rotation.apply(centre.getLongitude(), centre.getLatitude());
        }
        lambda[k] = 180 - centre.getLongitude();
        b[k] = centre.getLatitude();
      }

      int probes = 0;
      for (int sx = -1; sx <= 1; sx++) {
        for (int sy = -1; sy <= 1; sy++) {
          for (int k = 0; k < members.length; k++) {
            SkyPosition shifted = SkyCoordinates.shift(lambda[k], b[k], PROBE_FRACTION * sx * pixelScale,
                                                       PROBE_FRACTION * sy * pixelScale, true);
            Double2D p = projection.project(toRadians(shifted.getLatitude()), toRadians(shifted.getLongitude()));
            if (Double.isFinite(p.getX()) && Double.isFinite(p.getY())) {
              xMin = Math.min(xMin, p.getX());
              xMax = Math.max(xMax, p.getX());
              yMin = Math.min(yMin, p.getY());
              yMax = Math.max(yMax, p.getY());
              probes++;
            }
          }
        }
      }

      if (probes == 0) {
        LOG.warn("No valid probe points at nside {}; skipping it when bounding the map", nside);
      } else {
        LOG.debug("Bounds after nside {} ({} pixels): x [{}, {}], y [{}, {}]", nside, members.length, xMin, xMax,
                  yMin, yMax);
      }
    }

    Preconditions.checkArgument(xMin <= xMax && yMin <= yMax, "No pixel could be projected with %s", projection);
    double[] x = widen(xMin, xMax);
    double[] y = widen(yMin, yMax);
    return new Extent(x[0], x[1], y[0], y[1]);
  }

  /**
   * Assigns cells not yet showing a pixel to the pixels listed at this resolution.
   */
  private void resolve(HealpixIndex index, PixelAddresses addresses, int nside, double[] longitudes,
                       double[] latitudes) {
    int[] members = addresses.indicesAt(nside);
    Long2IntMap pixelToAddress = new Long2IntOpenHashMap(members.length);
    pixelToAddress.defaultReturnValue(NONE);
    for (int member : members) {
      pixelToAddress.putIfAbsent(addresses.pixel(member), member);
    }

    int[] open = openCells();
    double[] l = new double[open.length];
    double[] b = new double[open.length];
    for (int k = 0; k < open.length; k++) {
      l[k] = longitudes[open[k]];
      b[k] = latitudes[open[k]];
    }

    long[] pixels = index.angleToPixel(nside, l, b);
    int filled = 0;
    for (int k = 0; k < open.length; k++) {
      if (pixels[k] == HealpixIndex.NO_PIXEL) {
        continue;
      }
      int address = pixelToAddress.get(pixels[k]);
      if (address != NONE) {
        addressIndex[open[k]] = address;
        filled++;
      }
    }
    LOG.debug("nside {}: {} of {} open cells resolved", nside, filled, open.length);
  }

  /**
   * @return the cells which show no pixel yet and are eligible to show one
   */
  private int[] openCells() {
    int n = 0;
    int[] open = new int[addressIndex.length];
    for (int cell = 0; cell < addressIndex.length; cell++) {
      if (addressIndex[cell] == NONE && !(spec.isClip() && outOfBounds[cell])) {
        open[n++] = cell;
      }
    }
    return Arrays.copyOf(open, n);
  }

  /**
   * Paints the image for the given pixel values.
   *
   * @param values one value per pixel address, in the order the addresses were supplied
   * @return the image indexed [x][y], with {@link #NO_DATA} where no pixel shows
   * @throws IllegalArgumentException if there is not exactly one value per address
   */
  public double[][] rasterize(double[] values) {
    Preconditions.checkNotNull(values, "Values are required");
    Preconditions.checkArgument(values.length == addressCount, "Expected %s values, one per pixel address, but got %s",
                                addressCount, values.length);

    int width = spec.getWidth();
    int height = spec.getHeight();
    double[][] image = new double[width][height];
    for (int i = 0; i < width; i++) {
      for (int j = 0; j < height; j++) {
        int address = addressIndex[i * height + j];
        image[i][j] = address == NONE ? NO_DATA : values[address];
      }
    }
    return image;
  }

  /**
   * Paints one image per band, for values with several measurements per pixel (e.g. samples).
   *
   * @param bands values indexed [band][address]
   * @return the images indexed [band][x][y]
   */
  public double[][][] rasterize(double[][] bands) {
    Preconditions.checkNotNull(bands, "Bands are required");
    double[][][] images = new double[bands.length][][];
    for (int band = 0; band < bands.length; band++) {
      images[band] = rasterize(bands[band]);
    }
    return images;
  }

  /**
   * Finds the pixel address shown at a point on the image, for picking pixels off a displayed map.
   *
   * @param x horizontal position, in sky or display units
   * @param y vertical position, in sky or display units
   * @param skyUnits true if the image was displayed with the {@link #getSkyExtent() sky extent}, false for the
   *                 {@link #getDisplayExtent() display extent}
   * @return the index of the address, or {@link #NONE} if the point is off the image or shows no pixel
   */
  public int cellAt(double x, double y, boolean skyUnits) {
    Extent extent = skyUnits ? skyExtent : displayExtent;
    double dx = (extent.getX1() - extent.getX0()) / spec.getWidth();
    double dy = (extent.getY1() - extent.getY0()) / spec.getHeight();

    double fx = Math.floor((x - extent.getX0()) / dx);
    double fy = Math.floor((y - extent.getY0()) / dy);
    if (!(fx >= 0 && fx < spec.getWidth() && fy >= 0 && fy < spec.getHeight())) {
      return NONE;
    }
    return addressIndex[(int) fx * spec.getHeight() + (int) fy];
  }

  /**
   * Converts a projected plane coordinate to the sky units the image is displayed in.
   */
  public Double2D toSkyUnits(Double2D display) {
    return new Double2D(skyExtent.getX0() + (display.getX() - displayExtent.getX0()) * xScale,
                        skyExtent.getY0() + (display.getY() - displayExtent.getY0()) * yScale);
  }

  /**
   * The inverse of {@link #toSkyUnits(Double2D)}.
   */
  public Double2D toDisplayUnits(Double2D sky) {
    return new Double2D((sky.getX() - skyExtent.getX0()) / xScale + displayExtent.getX0(),
                        (sky.getY() - skyExtent.getY0()) / yScale + displayExtent.getY0());
  }

  /**
   * @return the index of the pixel address shown by the cell, or {@link #NONE}
   */
  public int getAddressIndex(int x, int y) {
    return addressIndex[x * spec.getHeight() + y];
  }

  /**
   * @return true if the cell lies beyond the edge of the projection
   */
  public boolean isOutOfBounds(int x, int y) {
    return outOfBounds[x * spec.getHeight() + y];
  }

  /**
   * @return the number of cells showing a pixel
   */
  public int getResolvedCount() {
    return resolvedCount;
  }

  public int getAddressCount() {
    return addressCount;
  }

  /**
   * @return the extent of the image in projected plane units (x_min, x_max, y_min, y_max)
   */
  public Extent getDisplayExtent() {
    return displayExtent;
  }

  /**
   * @return the extent of the image in sky units (l_max, l_min, b_min, b_max) over the cells that show a pixel
   */
  public Extent getSkyExtent() {
    return skyExtent;
  }

  public RasterSpec getSpec() {
    return spec;
  }

  public SkyProjection getProjection() {
    return projection;
  }

  public EulerRotation getRotation() {
    return rotation;
  }

  /**
   * Returns {min, max}, pulled apart if they coincide so that the extent can be divided by.
   */
  @VisibleForTesting
  static double[] widen(double min, double max) {
    if (max - min < MIN_EXTENT) {
      double mid = (min + max) / 2;
      return new double[] {mid - MIN_EXTENT / 2, mid + MIN_EXTENT / 2};
    }
    return new double[] {min, max};
  }
}
