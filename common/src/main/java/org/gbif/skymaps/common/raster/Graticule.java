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

import org.gbif.skymaps.common.projection.Double2D;
import org.gbif.skymaps.common.projection.SkyProjection;
import org.gbif.skymaps.common.sphere.EulerRotation;
import org.gbif.skymaps.common.sphere.SkyPosition;

import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import static java.lang.Math.toRadians;

/**
 * Generates lines of constant longitude (meridians) and latitude (parallels) as dots placed along each line, in the
 * same units and orientation as the image of a {@link MapRasterizer}, so the lines can be overlaid on it at any
 * image size.
 */
public class Graticule {
  public static final double DEFAULT_SPACING = 1;

  private final MapRasterizer rasterizer;

  public Graticule(MapRasterizer rasterizer) {
    this.rasterizer = Preconditions.checkNotNull(rasterizer, "A rasterizer is required");
  }

  /**
   * Places dots along the grid lines, in the sky units of the rasterized image.
   *
   * @param lLines longitudes of the meridians, in degrees
   * @param bLines latitudes of the parallels, in degrees
   * @param lSpacing longitude step between dots along parallels
   * @param bSpacing latitude step between dots along meridians
   * @param mode which lines to include
   * @param clip true to drop dots beyond the sky extent of the image
   * @return the dots, parallels first
   */
  public List<Double2D> lines(double[] lLines, double[] bLines, double lSpacing, double bSpacing,
                              GraticuleMode mode, boolean clip) {
    List<SkyPosition> points = points(lLines, bLines, lSpacing, bSpacing, mode);
    List<Double2D> projected = project(rasterizer.getProjection(), rasterizer.getRotation(), points);

    Extent sky = rasterizer.getSkyExtent();
    double xLow = Math.min(sky.getX0(), sky.getX1());
    double xHigh = Math.max(sky.getX0(), sky.getX1());
    double yLow = Math.min(sky.getY0(), sky.getY1());
    double yHigh = Math.max(sky.getY0(), sky.getY1());

    List<Double2D> dots = Lists.newArrayListWithCapacity(projected.size());
    for (Double2D p : projected) {
      Double2D s = rasterizer.toSkyUnits(p);
      if (!clip || (s.getX() >= xLow && s.getX() <= xHigh && s.getY() >= yLow && s.getY() <= yHigh)) {
        dots.add(s);
      }
    }
    return dots;
  }

  public List<Double2D> lines(double[] lLines, double[] bLines, GraticuleMode mode) {
    return lines(lLines, bLines, DEFAULT_SPACING, DEFAULT_SPACING, mode, true);
  }

  /**
   * Finds where to write the longitude of each meridian.
   *
   * @param lLocs the longitudes to label
   * @param shiftFraction how far to move labels off the edge of the map, as a fraction of its size
   */
  public List<GridLabel> longitudeLabels(double[] lLocs, double shiftFraction) {
    List<GridLabel> labels = Lists.newArrayList();
    for (double l : lLocs) {
      List<Double2D> line = lines(new double[] {l}, new double[] {0}, GraticuleMode.MERIDIANS);
      if (!line.isEmpty()) {
        labels.add(label(l, line, standardDistance(shiftFraction)));
      }
    }
    return labels;
  }

  /**
   * Finds where to write the latitude of each parallel.
   *
   * @param bLocs the latitudes to label
   * @param shiftFraction how far to move labels off the edge of the map, as a fraction of its size
   */
  public List<GridLabel> latitudeLabels(double[] bLocs, double shiftFraction) {
    List<GridLabel> labels = Lists.newArrayList();
    for (double b : bLocs) {
      List<Double2D> line = lines(new double[] {0}, new double[] {b}, GraticuleMode.PARALLELS);
      if (!line.isEmpty()) {
        labels.add(label(b, line, standardDistance(shiftFraction)));
      }
    }
    return labels;
  }

  private double standardDistance(double shiftFraction) {
    Extent sky = rasterizer.getSkyExtent();
    return shiftFraction * Math.sqrt(sky.getWidth() * sky.getHeight());
  }

  /**
   * The line leaves the visible map where consecutive dots are furthest apart.  The labels go just outside the dots
   * either side of that gap, pushed outwards along the direction of the line.  The line is treated as closed, so
   * the step into the first dot comes from the last.
   */
  @VisibleForTesting
  static GridLabel label(double value, List<Double2D> line, double distance) {
    int n = line.size();
    double[] dx = new double[n];
    double[] dy = new double[n];
    int cut = 0;
    double longest = -1;
    for (int i = 0; i < n; i++) {
      Double2D previous = line.get((i + n - 1) % n);
      dx[i] = line.get(i).getX() - previous.getX();
      dy[i] = line.get(i).getY() - previous.getY();
      double ds = Math.hypot(dx[i], dy[i]);
      if (ds > longest) {
        longest = ds;
        cut = i;
      }
    }

    int after = cut + 1 < n ? cut + 1 : 0;
    int before = (cut + n - 1) % n;

    Double2D first = offset(line.get(cut), -dx[after], -dy[after], distance);
    Double2D second = offset(line.get(before), dx[before], dy[before], distance);
    return new GridLabel(value, first, second);
  }

  private static Double2D offset(Double2D p, double dx, double dy, double distance) {
    double ds = Math.hypot(dx, dy);
    if (ds == 0) {
      return p;
    }
    return new Double2D(p.getX() + dx * distance / ds, p.getY() + dy * distance / ds);
  }

  /**
   * Positions along the grid lines, in degrees.  Parallels run from longitude −180 to 180 and meridians from
   * latitude −90 to 90, both ends included.
   */
  public static List<SkyPosition> points(double[] lLines, double[] bLines, double lSpacing, double bSpacing,
                                         GraticuleMode mode) {
    Preconditions.checkArgument(lSpacing > 0 && bSpacing > 0, "Spacing must be positive. Supplied: %s, %s", lSpacing,
                                bSpacing);
    List<SkyPosition> points = Lists.newArrayList();
    if (mode.includesParallels()) {
      double[] row = arange(-180, 180 + lSpacing / 2, lSpacing);
      for (double b : bLines) {
        for (double l : row) {
          points.add(new SkyPosition(l, b));
        }
      }
    }
    if (mode.includesMeridians()) {
      double[] row = arange(-90, 90 + bSpacing / 2, bSpacing);
      for (double l : lLines) {
        for (double b : row) {
          points.add(new SkyPosition(l, b));
        }
      }
    }
    return points;
  }

  /**
   * Projects positions into the plane of the projection after recentring, without any scaling to an image.
   */
  public static List<Double2D> project(SkyProjection projection, EulerRotation rotation, List<SkyPosition> points) {
    List<Double2D> projected = Lists.newArrayListWithCapacity(points.size());
    for (SkyPosition p : points) {
      SkyPosition r = rotation.isIdentity() ? p : rotation.apply(p.getLongitude(), p.getLatitude());
      double lambda = 180 - r.getLongitude();
      projected.add(projection.project(toRadians(r.getLatitude()), toRadians(lambda)));
    }
    return projected;
  }

  /**
   * Evenly spaced values from start, stepping up while below stop.
   */
  @VisibleForTesting
  static double[] arange(double start, double stop, double step) {
    int n = (int) Math.max(0, Math.ceil((stop - start) / step));
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = start + i * step;
    }
    return values;
  }
}
