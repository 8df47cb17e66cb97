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
package org.gbif.skymaps.common.projection;

import org.junit.Test;

import static java.lang.Math.PI;
import static java.lang.Math.toRadians;
import static org.gbif.skymaps.common.projection.AssertOnDouble2D.assertEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CartesianTest {

  static final double ε = 1e-9;

  @Test
  public void testProject() {
    Cartesian c = new Cartesian(180);
    assertEquals(new Double2D(0, 0), c.project(0, PI), ε);
    assertEquals(new Double2D(-180, 90), c.project(PI / 2, 0), ε);
    assertEquals(new Double2D(90, -45), c.project(toRadians(-45), toRadians(270)), ε);
  }

  @Test
  public void testUnproject() {
    Cartesian c = new Cartesian(180);
    Unprojected u = c.unproject(-170, 20);
    assertEquals(toRadians(10), u.getLongitude(), ε);
    assertEquals(toRadians(20), u.getLatitude(), ε);
    assertFalse(u.isOutOfBounds());

    // λ = 380° is beyond the sky
    assertTrue(c.unproject(200, 0).isOutOfBounds());
    assertTrue(c.unproject(Double.NaN, 0).isOutOfBounds());
  }
}
