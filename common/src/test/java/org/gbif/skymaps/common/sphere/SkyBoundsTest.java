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

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SkyBoundsTest {

  @Test
  public void testAllSky() {
    assertTrue(SkyBounds.ALL_SKY.contains(0, 0));
    assertTrue(SkyBounds.ALL_SKY.contains(-179, 89));
    assertTrue(SkyBounds.ALL_SKY.contains(359.9, -90));
  }

  @Test
  public void testContains() {
    SkyBounds b = new SkyBounds(30, 60, -10, 10);
    assertTrue(b.contains(30, -10));
    assertTrue(b.contains(45, 0));
    assertTrue(b.contains(60, 10));
    assertTrue(b.contains(405, 0));
    assertFalse(b.contains(61, 0));
    assertFalse(b.contains(45, 11));
  }

  @Test
  public void testAcrossZero() {
    // longitudes either side of l = 0, given in either convention
    SkyBounds b = new SkyBounds(-20, 20, -90, 90);
    assertTrue(b.contains(0, 0));
    assertTrue(b.contains(350, 0));
    assertTrue(b.contains(-10, 0));
    assertFalse(b.contains(180, 0));
    assertFalse(b.contains(30, 0));

    SkyBounds wrapped = new SkyBounds(340, 20, -90, 90);
    assertTrue(wrapped.contains(-10, 0));
    assertFalse(wrapped.contains(90, 0));
  }
}
