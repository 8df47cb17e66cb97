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
package org.gbif.skymaps.common.pick;

/**
 * Receives the pixel addresses picked off a displayed map, e.g. to draw the data behind that pixel.
 */
@FunctionalInterface
public interface PickListener {

  /**
   * @param addressIndex the index of the picked pixel address, or
   *                     {@link org.gbif.skymaps.common.raster.MapRasterizer#NONE} if the pick missed the map
   */
  void picked(int addressIndex);
}
