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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The extent of an image along its two axes: x runs from {@code x0} at the first column to {@code x1} at the last,
 * y from {@code y0} at the first row to {@code y1} at the last.  Either axis may be descending, as the sky extent of
 * a map is, where longitude increases to the left.
 */
@Data
@AllArgsConstructor
public class Extent implements Serializable {
  private static final long serialVersionUID = -3290711632734562011L;

  private final double x0;
  private final double x1;
  private final double y0;
  private final double y1;

  public double getWidth() {
    return Math.abs(x1 - x0);
  }

  public double getHeight() {
    return Math.abs(y1 - y0);
  }

  /**
   * @return the extent in the {x0, x1, y0, y1} order most plotting tools expect
   */
  public double[] toArray() {
    return new double[] {x0, x1, y0, y1};
  }
}
