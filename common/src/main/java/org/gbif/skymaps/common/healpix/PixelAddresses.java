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
package org.gbif.skymaps.common.healpix;

import org.gbif.skymaps.common.sphere.SkyBounds;
import org.gbif.skymaps.common.sphere.SkyPosition;

import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An immutable, ordered collection of pixel addresses, possibly at several resolutions.  Values rasterized against
 * the collection are matched by position: the value at index i belongs to the address at index i.
 * <p/>
 * Addresses are held in columns to keep large maps compact.  Equality is by content, so a collection can take part
 * in cache keys.
 */
public class PixelAddresses implements Serializable {
  private static final long serialVersionUID = 4103917702437183528L;

  private final int[] nsides;
  private final long[] pixels;
  private final int hash;

  private PixelAddresses(int[] nsides, long[] pixels) {
    Preconditions.checkArgument(nsides.length == pixels.length, "Resolutions and pixels differ in length: %s and %s",
                                nsides.length, pixels.length);
    for (int i = 0; i < nsides.length; i++) {
      HealpixIndex.checkNside(nsides[i]);
      Preconditions.checkArgument(pixels[i] >= 0 && pixels[i] < HealpixIndex.npix(nsides[i]),
                                  "Pixel %s is not valid at nside %s", pixels[i], nsides[i]);
    }
    this.nsides = nsides;
    this.pixels = pixels;
    this.hash = 31 * Arrays.hashCode(nsides) + Arrays.hashCode(pixels);
  }

  /**
   * @param nsides the resolution of each address
   * @param pixels the nested pixel index of each address
   * @throws IllegalArgumentException if the arrays differ in length or any address is invalid
   */
  public static PixelAddresses of(int[] nsides, long[] pixels) {
    Preconditions.checkNotNull(nsides, "Resolutions are required");
    Preconditions.checkNotNull(pixels, "Pixels are required");
    return new PixelAddresses(nsides.clone(), pixels.clone());
  }

  public static PixelAddresses of(List<PixelAddress> addresses) {
    int[] nsides = new int[addresses.size()];
    long[] pixels = new long[addresses.size()];
    for (int i = 0; i < nsides.length; i++) {
      nsides[i] = addresses.get(i).getNside();
      pixels[i] = addresses.get(i).getPixel();
    }
    return new PixelAddresses(nsides, pixels);
  }

  /**
   * @return every pixel at the resolution, in index order
   */
  public static PixelAddresses allSky(int nside) {
    int n = Math.toIntExact(HealpixIndex.npix(HealpixIndex.checkNside(nside)));
    int[] nsides = new int[n];
    long[] pixels = new long[n];
    Arrays.fill(nsides, nside);
    for (int i = 0; i < n; i++) {
      pixels[i] = i;
    }
    return new PixelAddresses(nsides, pixels);
  }

  public int size() {
    return pixels.length;
  }

  public boolean isEmpty() {
    return pixels.length == 0;
  }

  public int nside(int index) {
    return nsides[index];
  }

  public long pixel(int index) {
    return pixels[index];
  }

  public PixelAddress get(int index) {
    return new PixelAddress(nsides[index], pixels[index]);
  }

  /**
   * @return the distinct resolutions present, in the order they first appear
   */
  public List<Integer> resolutions() {
    Set<Integer> seen = new LinkedHashSet<>();
    for (int nside : nsides) {
      seen.add(nside);
    }
    return ImmutableList.copyOf(seen);
  }

  /**
   * @return the positions in this collection of the addresses at the given resolution, ascending
   */
  public int[] indicesAt(int nside) {
    return IntStream.range(0, nsides.length).filter(i -> nsides[i] == nside).toArray();
  }

  /**
   * Finds the addresses whose pixel centres fall within the bounds, for restricting a map to a region of sky.
   * @return the positions in this collection of the matching addresses, ascending
   */
  public int[] selectWithin(HealpixIndex index, SkyBounds bounds) {
    return IntStream.range(0, pixels.length)
      .filter(i -> {
        SkyPosition centre = index.pixelToAngle(nsides[i], pixels[i]);
        return bounds.contains(centre.getLongitude(), centre.getLatitude());
      })
      .toArray();
  }

  /**
   * @param positions positions in this collection, as returned by {@link #selectWithin}
   * @return a new collection holding only those addresses, in the order given
   */
  public PixelAddresses subset(int[] positions) {
    int[] n = new int[positions.length];
    long[] p = new long[positions.length];
    for (int i = 0; i < positions.length; i++) {
      n[i] = nsides[positions[i]];
      p[i] = pixels[positions[i]];
    }
    return new PixelAddresses(n, p);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelAddresses)) {
      return false;
    }
    PixelAddresses that = (PixelAddresses) o;
    return hash == that.hash && Arrays.equals(nsides, that.nsides) && Arrays.equals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return String.format("PixelAddresses[%d addresses at nside %s]", pixels.length, resolutions());
  }
}
