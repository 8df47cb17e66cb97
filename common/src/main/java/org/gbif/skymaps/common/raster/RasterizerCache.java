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

import java.io.Closeable;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;
import lombok.Data;
import org.cache2k.Cache;
import org.cache2k.Cache2kBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds recently built rasterizers so that callers drawing the same map geometry repeatedly share one.
 * <p/>
 * This is only an optimisation: a cached rasterizer is indistinguishable from one built directly with
 * {@link MapRasterizer#MapRasterizer(HealpixIndex, PixelAddresses, RasterSpec)}.
 */
public class RasterizerCache implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(RasterizerCache.class);
  private static final AtomicInteger SEQUENCE = new AtomicInteger();

  private final Cache<Key, MapRasterizer> cache;

  /**
   * @param index used to build rasterizers on a miss
   * @param capacity the most rasterizers held at once
   */
  public RasterizerCache(HealpixIndex index, int capacity) {
    Preconditions.checkNotNull(index, "A HEALPix index is required");
    Preconditions.checkArgument(capacity > 0, "Capacity must be positive. Supplied: %s", capacity);
    cache = new Cache2kBuilder<Key, MapRasterizer>() {}
      .name("skymaps-rasterizers-" + SEQUENCE.incrementAndGet())
      .entryCapacity(capacity)
      .loader(key -> {
        LOG.info("Building rasterizer for {} at {}", key.getAddresses(), key.getSpec());
        return new MapRasterizer(index, key.getAddresses(), key.getSpec());
      })
      .build();
  }

  /**
   * @return the rasterizer for the geometry, built on first request
   * @throws IllegalArgumentException if there are no addresses or the image has no area
   */
  public MapRasterizer get(PixelAddresses addresses, RasterSpec spec) {
    Preconditions.checkNotNull(addresses, "Pixel addresses are required");
    Preconditions.checkNotNull(spec, "A raster spec is required");
    // validated here so callers see the failure directly, not wrapped by the loader
    Preconditions.checkArgument(!addresses.isEmpty(), "At least one pixel address is required");
    Preconditions.checkArgument(spec.getWidth() > 0 && spec.getHeight() > 0,
                                "Image dimensions must be positive. Supplied: %s×%s", spec.getWidth(), spec.getHeight());
    return cache.get(new Key(spec, addresses));
  }

  @Override
  public void close() {
    cache.close();
  }

  @Data
  static class Key {
    private final RasterSpec spec;
    private final PixelAddresses addresses;
  }
}
