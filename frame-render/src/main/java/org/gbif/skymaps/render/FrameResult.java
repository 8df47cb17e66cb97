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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The image of one frame, or why it could not be drawn.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FrameResult {
  private final Frame frame;
  // indexed [x][y], null on failure
  private final double[][] image;
  private final Throwable failure;

  public static FrameResult success(Frame frame, double[][] image) {
    return new FrameResult(frame, image, null);
  }

  public static FrameResult failure(Frame frame, Throwable failure) {
    return new FrameResult(frame, null, failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
