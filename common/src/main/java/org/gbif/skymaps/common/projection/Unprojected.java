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
package org.gbif.skymaps.common.projection;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The result of inverting a plane coordinate: latitude and longitude in radians, together with a flag set when the
 * coordinate lies outside the region the projection covers.  Out of bounds results may carry NaN angles.
 */
@Data
@AllArgsConstructor
public class Unprojected implements Serializable {
  private static final long serialVersionUID = -6307452158712092614L;

  private final double latitude;
  private final double longitude;
  private final boolean outOfBounds;
}
