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

/**
 * Supplies the values to draw in a frame.  Implementations are called from several worker threads at once.
 */
@FunctionalInterface
public interface FrameSource {

  /**
   * @return one value per pixel address, in address order; NaN where there is no value
   * @throws Exception if the values cannot be produced, which fails only this frame
   */
  double[] values(Frame frame) throws Exception;
}
