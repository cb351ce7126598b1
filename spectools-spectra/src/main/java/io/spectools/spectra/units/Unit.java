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

import java.util.Objects;

/**
 * A physical unit: a display symbol, a scale factor to SI and a {@link Dimension}.
 *
 * <h2>Algebra</h2>
 *
 * <p>Units multiply, divide and raise to powers by multiplying scales and adding
 * dimension exponents. Two units are <em>equivalent</em> when they share a dimension
 * and their scales agree to 1e-12 relative, so {@code erg/(s cm2 AA)} and
 * {@code erg/(cm2 s AA)} compare equal regardless of spelling.
 *
 * <h2>AB maggies</h2>
 *
 * <p>The unit parsed from {@code mag} (aliases {@code ABmag}, {@code maggy}) is a
 * dimensionless unit flagged as an AB flux ratio: a flux expressed in it is the
 * flux density divided by 3631 Jy.
 *
 * <pre>{@code
 * Unit flambda = Unit.parse("erg/(s cm2 AA)");
 * flambda.kind();                         // FLUX_PER_WAVELENGTH
 * Unit.parse("nm").factorTo(Units.ANGSTROM); // 10.0
 * }</pre>
 *
 * @see UnitParser
 * @see UnitConverter
 */
public final class Unit {

    private static final double SCALE_TOLERANCE = 1e-12;

    private final String symbol;
    private final double scale;
    private final Dimension dimension;
    private final boolean abMaggy;

    /**
     * Creates a unit.
     *
     * @param symbol display symbol
     * @param scale factor converting one of this unit into SI base units; must be positive
     * @param dimension SI dimension exponents
     * @throws IllegalArgumentException if scale is not a positive finite number
     */
    public Unit(String symbol, double scale, Dimension dimension) {
        this(symbol, scale, dimension, false);
    }

    Unit(String symbol, double scale, Dimension dimension, boolean abMaggy) {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        Objects.requireNonNull(dimension, "dimension cannot be null");
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("Unit scale must be positive and finite, got: " + scale);
        }
        this.symbol = symbol;
        this.scale = scale;
        this.dimension = dimension;
        this.abMaggy = abMaggy;
    }

    /**
     * Parses an astropy-style unit string.
     *
     * @param text the unit text, e.g. {@code "erg/(s cm2 AA)"}
     * @return the parsed unit
     * @throws UnitConversionException if the text is not a valid unit
     */
    public static Unit parse(String text) {
        return UnitParser.parse(text);
    }

    public String symbol() {
        return symbol;
    }

    public double scale() {
        return scale;
    }

    public Dimension dimension() {
        return dimension;
    }

    public UnitKind kind() {
        return UnitKind.of(dimension);
    }

    /// @return true for the AB flux-ratio unit produced by converting to {@code mag}
    public boolean isAbMaggy() {
        return abMaggy;
    }

    public Unit multiply(Unit other) {
        return new Unit(compose(symbol, " ", other.symbol), scale * other.scale,
            dimension.plus(other.dimension));
    }

    public Unit divide(Unit other) {
        return new Unit(compose(symbol, "/", other.symbol), scale / other.scale,
            dimension.minus(other.dimension));
    }

    public Unit pow(double power) {
        String powered = power == 1.0 ? symbol : "(" + symbol + ")^" + formatPower(power);
        return new Unit(powered, Math.pow(scale, power), dimension.times(power));
    }

    public Unit inverse() {
        return new Unit(compose("1", "/", symbol), 1.0 / scale, dimension.times(-1));
    }

    /// Returns a copy of this unit displayed under another symbol.
    public Unit withSymbol(String newSymbol) {
        return new Unit(newSymbol, scale, dimension, abMaggy);
    }

    /// @return true if both units share a dimension and scale
    public boolean isEquivalentTo(Unit other) {
        if (other == null || abMaggy != other.abMaggy) {
            return false;
        }
        return dimension.sameAs(other.dimension)
            && Math.abs(scale - other.scale) <= SCALE_TOLERANCE * Math.max(scale, other.scale);
    }

    /**
     * Returns the factor that converts a value in this unit to the given unit
     * of the same dimension.
     *
     * @param target the target unit
     * @return multiplicative factor
     * @throws UnitConversionException if the dimensions differ
     */
    public double factorTo(Unit target) {
        if (!dimension.sameAs(target.dimension) || abMaggy != target.abMaggy) {
            throw new UnitConversionException(this, target);
        }
        return scale / target.scale;
    }

    private static String compose(String left, String operator, String right) {
        if (right.isEmpty()) {
            return left;
        }
        if (left.isEmpty()) {
            if (operator.equals(" ")) {
                return right;
            }
            left = "1";
        }
        String r = right.contains(" ") || right.contains("/") ? "(" + right + ")" : right;
        String l = left.contains("/") && operator.equals("/") ? "(" + left + ")" : left;
        return l + operator + r;
    }

    private static String formatPower(double power) {
        if (power == Math.rint(power)) {
            return Long.toString((long) power);
        }
        return Double.toString(power);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Unit)) return false;
        Unit unit = (Unit) o;
        return Double.compare(unit.scale, scale) == 0
            && abMaggy == unit.abMaggy
            && dimension.equals(unit.dimension);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scale, dimension, abMaggy);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
