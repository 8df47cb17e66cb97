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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Chooses the distances at which to draw the frames of an animated map.
 */
public final class DistanceSlices {

  /**
   * How the slices are spaced between the nearest and furthest distance.
   */
  public enum Step {
    // evenly in distance modulus, so logarithmically in distance
    LOG,
    // evenly in distance
    LINEAR
  }

  private DistanceSlices() {}

  /**
   * @param dmMin distance modulus of the first frame
   * @param dmMax distance modulus of the last frame
   * @param count number of frames, both ends included
   * @param step the spacing of the frames
   * @return the frames in order, indexed from 0
   */
  public static List<Frame> of(double dmMin, double dmMax, int count, Step step) {
    Preconditions.checkArgument(count > 0, "At least one slice is required. Supplied: %s", count);
    Preconditions.checkNotNull(step, "A step is required");

    ImmutableList.Builder<Frame> frames = ImmutableList.builder();
    if (step == Step.LOG) {
      for (int i = 0; i < count; i++) {
        frames.add(new Frame(i, interpolate(dmMin, dmMax, i, count)));
      }
    } else {
      double d0 = toDistance(dmMin);
      double d1 = toDistance(dmMax);
      for (int i = 0; i < count; i++) {
        frames.add(new Frame(i, toDistanceModulus(interpolate(d0, d1, i, count))));
      }
    }
    return frames.build();
  }

  /** Distance in parsecs for a distance modulus. */
  public static double toDistance(double distanceModulus) {
    return Math.pow(10, distanceModulus / 5 + 1);
  }

  /** Distance modulus for a distance in parsecs. */
  public static double toDistanceModulus(double distance) {
    return 5 * (Math.log10(distance) - 1);
  }

  // the ends are exact, as with a linspace
  private static double interpolate(double start, double stop, int i, int count) {
    if (count == 1) {
      return start;
    }
    if (i == count - 1) {
      return stop;
    }
    return start + (stop - start) * i / (count - 1);
  }
}
