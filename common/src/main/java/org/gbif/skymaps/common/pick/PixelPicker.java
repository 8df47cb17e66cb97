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

import org.gbif.skymaps.common.raster.MapRasterizer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns positions on a displayed map into pixel addresses and passes them to the attached listeners.  Whatever
 * presents the map forwards its clicks to {@link #pick(double, double)}; no UI toolkit is involved here.
 */
public class PixelPicker {
  private static final Logger LOG = LoggerFactory.getLogger(PixelPicker.class);

  private final MapRasterizer rasterizer;
  private final boolean skyUnits;
  private final List<PickListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * @param rasterizer that drew the map
   * @param skyUnits true if the map is displayed in sky units rather than projected plane units
   */
  public PixelPicker(MapRasterizer rasterizer, boolean skyUnits) {
    this.rasterizer = Preconditions.checkNotNull(rasterizer, "A rasterizer is required");
    this.skyUnits = skyUnits;
  }

  public PixelPicker attach(PickListener listener) {
    listeners.add(Preconditions.checkNotNull(listener, "A listener is required"));
    return this;
  }

  public boolean detach(PickListener listener) {
    return listeners.remove(listener);
  }

  /**
   * Resolves the position and notifies every listener, including of misses.
   * @return the index of the picked pixel address, or {@link MapRasterizer#NONE}
   */
  public int pick(double x, double y) {
    int addressIndex = rasterizer.cellAt(x, y, skyUnits);
    LOG.debug("({}, {}) -> {}", x, y, addressIndex);
    for (PickListener listener : listeners) {
      listener.picked(addressIndex);
    }
    return addressIndex;
  }
}
