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
package org.gbif.skymaps.common.sphere;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A position on the sky in degrees, longitude first (e.g. Galactic l, b).
 */
@Data
@AllArgsConstructor
public class SkyPosition implements Serializable {
  private static final long serialVersionUID = -1851826262400937310L;

  private final double longitude;
  private final double latitude;
}
