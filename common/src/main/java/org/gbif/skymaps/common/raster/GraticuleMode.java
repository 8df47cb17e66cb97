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

/**
 * Which grid lines to generate.
 */
public enum GraticuleMode {
  BOTH(true, true),
  PARALLELS(true, false),
  MERIDIANS(false, true);

  private final boolean parallels;
  private final boolean meridians;

  GraticuleMode(boolean parallels, boolean meridians) {
    this.parallels = parallels;
    this.meridians = meridians;
  }

  public boolean includesParallels() {
    return parallels;
  }

  public boolean includesMeridians() {
    return meridians;
  }
}
