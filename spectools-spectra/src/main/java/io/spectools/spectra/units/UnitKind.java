package io.spectools.spectra.units;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Physical kind of a unit, derived from its [Dimension].
///
/// The first four kinds may label a spectral axis and are linked by the
/// spectral equivalence (λ = c/ν = hc/E = 1/k). The two flux-density kinds are
/// linked by the spectral-density equivalence F_ν = F_λ·λ²/c.
public enum UnitKind {
    LENGTH(new Dimension(1, 0, 0)),
    FREQUENCY(new Dimension(0, 0, -1)),
    ENERGY(new Dimension(2, 1, -2)),
    WAVENUMBER(new Dimension(-1, 0, 0)),
    FLUX_PER_WAVELENGTH(new Dimension(-1, 1, -3)),
    FLUX_PER_FREQUENCY(new Dimension(0, 1, -2)),
    DIMENSIONLESS(Dimension.NONE),
    OTHER(null);

    private final Dimension dimension;

    UnitKind(Dimension dimension) {
        this.dimension = dimension;
    }

    /// @return the canonical dimension, or null for [#OTHER]
    public Dimension dimension() {
        return dimension;
    }

    public boolean isSpectralAxis() {
        return this == LENGTH || this == FREQUENCY || this == ENERGY || this == WAVENUMBER;
    }

    public boolean isFluxDensity() {
        return this == FLUX_PER_WAVELENGTH || this == FLUX_PER_FREQUENCY;
    }

    public static UnitKind of(Dimension dimension) {
        for (UnitKind kind : values()) {
            if (kind.dimension != null && kind.dimension.sameAs(dimension)) {
                return kind;
            }
        }
        return OTHER;
    }
}
