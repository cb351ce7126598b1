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

/// Exponents of the SI base dimensions length, mass and time.
///
/// Every unit handled by this package is a power product of metres, kilograms
/// and seconds times a scale factor, so three exponents are enough to tell a
/// wavelength from a frequency or a flux per wavelength from a flux per frequency.
///
/// | Quantity | L | M | T |
/// |----------|---|---|---|
/// | length | 1 | 0 | 0 |
/// | frequency | 0 | 0 | -1 |
/// | energy | 2 | 1 | -2 |
/// | F_λ (W m⁻² m⁻¹) | -1 | 1 | -3 |
/// | F_ν (W m⁻² Hz⁻¹) | 0 | 1 | -2 |
///
/// @param length exponent of metres
/// @param mass exponent of kilograms
/// @param time exponent of seconds
public record Dimension(double length, double mass, double time) {

    public static final Dimension NONE = new Dimension(0, 0, 0);
    public static final Dimension LENGTH = new Dimension(1, 0, 0);
    public static final Dimension MASS = new Dimension(0, 1, 0);
    public static final Dimension TIME = new Dimension(0, 0, 1);

    private static final double EXPONENT_TOLERANCE = 1e-9;

    public Dimension {
        // fold -0.0 into 0.0 so record equality matches sameAs for zero exponents
        length += 0.0;
        mass += 0.0;
        time += 0.0;
    }

    public Dimension plus(Dimension other) {
        return new Dimension(length + other.length, mass + other.mass, time + other.time);
    }

    public Dimension minus(Dimension other) {
        return new Dimension(length - other.length, mass - other.mass, time - other.time);
    }

    public Dimension times(double power) {
        return new Dimension(length * power, mass * power, time * power);
    }

    public boolean isDimensionless() {
        return sameAs(NONE);
    }

    /// Compares exponents with a small tolerance so that fractional powers
    /// which round-trip through floating point still match.
    public boolean sameAs(Dimension other) {
        return Math.abs(length - other.length) < EXPONENT_TOLERANCE
            && Math.abs(mass - other.mass) < EXPONENT_TOLERANCE
            && Math.abs(time - other.time) < EXPONENT_TOLERANCE;
    }

    @Override
    public String toString() {
        return "L^" + length + " M^" + mass + " T^" + time;
    }
}
