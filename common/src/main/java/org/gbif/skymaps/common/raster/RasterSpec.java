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

import org.gbif.skymaps.common.projection.AbstractSkyProjection;
import org.gbif.skymaps.common.projection.Projections;
import org.gbif.skymaps.common.projection.SkyProjection;
import org.gbif.skymaps.common.sphere.EulerRotation;

import java.io.Serializable;

import lombok.Builder;
import lombok.Data;

/**
 * Everything about the rendered image that fixes its geometry: size, projection and centring.  Two rasterizers
 * built from equal specs and equal pixel addresses are identical.
 */
@Data
@Builder(toBuilder = true)
public class RasterSpec implements Serializable {
  private static final long serialVersionUID = 8750275389722541390L;

  private final int width;
  private final int height;

  @Builder.Default
  private final Projections projection = Projections.CARTESIAN;

  // λ₀ in degrees
  @Builder.Default
  private final double centralMeridian = AbstractSkyProjection.DEFAULT_CENTRAL_MERIDIAN;

  // the (l, b) which is rotated to the middle of the map
  private final double centerLongitude;
  private final double centerLatitude;

  // blank out cells beyond the edge of the projection
  @Builder.Default
  private final boolean clip = true;

  public SkyProjection createProjection() {
    return projection.create(centralMeridian);
  }

  public EulerRotation rotation() {
    return EulerRotation.centredOn(centerLongitude, centerLatitude);
  }
}
