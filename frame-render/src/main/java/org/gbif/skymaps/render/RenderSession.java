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
import org.gbif.skymaps.common.raster.RasterizerCache;

import java.io.Closeable;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the renderers for one configuration.  When the configuration sets a positive {@code cacheCapacity} the
 * renderers share a {@link RasterizerCache} of that size, so maps drawn again for the same pixels reuse the
 * rasterizer built the first time.
 */
public class RenderSession implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(RenderSession.class);

  private final RenderConfiguration config;
  private final HealpixIndex index;
  // null when caching is disabled
  private final RasterizerCache cache;

  public RenderSession(RenderConfiguration config, HealpixIndex index) {
    this.config = Preconditions.checkNotNull(config, "A configuration is required");
    this.index = Preconditions.checkNotNull(index, "A HEALPix index is required");
    Preconditions.checkArgument(config.getCacheCapacity() >= 0, "Cache capacity must not be negative. Supplied: %s",
                                config.getCacheCapacity());
    if (config.getCacheCapacity() > 0) {
      LOG.info("Caching up to {} rasterizers", config.getCacheCapacity());
      cache = new RasterizerCache(index, config.getCacheCapacity());
    } else {
      cache = null;
    }
  }

  /**
   * @param addresses the pixels the source supplies values for
   * @return a renderer for the addresses, sharing this session's rasterizer cache if there is one
   */
  public FrameRenderer renderer(PixelAddresses addresses) {
    return new FrameRenderer(config, index, addresses, cache);
  }

  public boolean isCaching() {
    return cache != null;
  }

  @Override
  public void close() {
    if (cache != null) {
      cache.close();
    }
  }
}
