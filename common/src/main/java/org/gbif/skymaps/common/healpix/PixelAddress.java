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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Identifies one cell of a nested HEALPix map: the resolution and the pixel index at that resolution.
 */
@Data
@AllArgsConstructor
public class PixelAddress implements Serializable {
  private static final long serialVersionUID = -3930283361914036312L;

  private final int nside;
  private final long pixel;
}
