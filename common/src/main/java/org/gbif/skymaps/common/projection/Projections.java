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

import java.util.function.DoubleFunction;

/**
 * The projections supported for rendering maps.  The set is closed; each constant is a factory of the projection
 * at a chosen central meridian.
 */
public enum Projections {
  CARTESIAN("Cartesian", Cartesian::new),
  MOLLWEIDE("Mollweide", Mollweide::new),
  ECKERT_IV("Eckert IV", EckertIV::new),
  HAMMER("Hammer", Hammer::new);

  private final String displayName;
  private final DoubleFunction<SkyProjection> factory;

  Projections(String displayName, DoubleFunction<SkyProjection> factory) {
    this.displayName = displayName;
    this.factory = factory;
  }

  /**
   * @param centralMeridianDegrees λ₀ in degrees
   * @return a new projection centred on the given meridian
   */
  public SkyProjection create(double centralMeridianDegrees) {
    return factory.apply(centralMeridianDegrees);
  }

  /**
   * @return a new projection centred on λ₀ = 180°
   */
  public SkyProjection create() {
    return create(AbstractSkyProjection.DEFAULT_CENTRAL_MERIDIAN);
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Looks up the projection by its display name (e.g. "Eckert IV") or constant name (e.g. "ECKERT_IV"), ignoring
   * case, spaces and underscores.
   * @throws IllegalArgumentException If the projection is not supported
   */
  public static Projections fromName(String name) throws IllegalArgumentException {
    if (name != null) {
      String normalised = normalise(name);
      for (Projections p : values()) {
        if (normalise(p.displayName).equals(normalised) || normalise(p.name()).equals(normalised)) {
          return p;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported projection supplied: " + name);
  }

  private static String normalise(String name) {
    return name.replaceAll("[\\s_]", "").toUpperCase();
  }
}
