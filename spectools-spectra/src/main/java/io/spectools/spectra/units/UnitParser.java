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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Recursive-descent parser for astropy-style unit strings.
///
/// ## Grammar
///
/// ```text
/// product  := factor ( ( '*' | '.' | whitespace ) factor | '/' factor )*
/// factor   := ( '(' product ')' | number | name ) exponent?
/// exponent := ( '**' | '^' )? signed-integer-or-decimal
/// ```
///
/// Division binds to the single factor that follows it, so `erg/s/cm2/AA`
/// and `erg/(s cm2 AA)` parse to the same unit. Names may carry an SI prefix
/// (`nm`, `mJy`, `keV`) when the base unit accepts one. A leading number is a
/// scale factor: `1e-17 erg/(s cm2 AA)`.
///
/// The AB flux-ratio unit (`mag`, `ABmag`, `maggy`) is only accepted on its own.
final class UnitParser {

    private static final Map<String, Unit> BASE = new LinkedHashMap<>();
    private static final Map<Character, Double> PREFIXES = new LinkedHashMap<>();
    private static final Set<String> PREFIXABLE = Set.of("m", "g", "s", "Hz", "J", "W", "eV", "Jy");
    private static final Set<String> MAGGY_NAMES = Set.of("mag", "ABmag", "maggy", "maggies");

    static {
        Dimension energy = new Dimension(2, 1, -2);
        Dimension power = new Dimension(2, 1, -3);
        base("m", 1.0, Dimension.LENGTH);
        base("g", 1e-3, Dimension.MASS);
        base("s", 1.0, Dimension.TIME);
        base("Hz", 1.0, new Dimension(0, 0, -1));
        base("J", 1.0, energy);
        base("W", 1.0, power);
        base("erg", 1e-7, energy);
        base("eV", PhysicalConstants.ELECTRON_VOLT, energy);
        base("Jy", 1e-26, new Dimension(0, 1, -2));
        base("AA", 1e-10, Dimension.LENGTH);
        base("Angstrom", 1e-10, Dimension.LENGTH);
        base("angstrom", 1e-10, Dimension.LENGTH);
        base("Å", 1e-10, Dimension.LENGTH);
        base("micron", 1e-6, Dimension.LENGTH);
        base("dimensionless", 1.0, Dimension.NONE);

        PREFIXES.put('p', 1e-12);
        PREFIXES.put('n', 1e-9);
        PREFIXES.put('u', 1e-6);
        PREFIXES.put('µ', 1e-6);
        PREFIXES.put('m', 1e-3);
        PREFIXES.put('c', 1e-2);
        PREFIXES.put('d', 1e-1);
        PREFIXES.put('k', 1e3);
        PREFIXES.put('M', 1e6);
        PREFIXES.put('G', 1e9);
        PREFIXES.put('T', 1e12);
    }

    private static void base(String name, double scale, Dimension dimension) {
        BASE.put(name, new Unit(name, scale, dimension));
    }

    private final String text;
    private int pos;

    private UnitParser(String text) {
        this.text = text;
    }

    static Unit parse(String text) {
        if (text == null) {
            throw new UnitConversionException("unit text cannot be null");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals("1")) {
            return new Unit(trimmed.isEmpty() ? "" : "1", 1.0, Dimension.NONE);
        }
        if (MAGGY_NAMES.contains(trimmed)) {
            return new Unit("mag", 1.0, Dimension.NONE, true);
        }
        UnitParser parser = new UnitParser(trimmed);
        Unit unit = parser.product();
        parser.skipWhitespace();
        if (parser.pos != parser.text.length()) {
            throw parser.error("unexpected character '" + parser.text.charAt(parser.pos) + "'");
        }
        return unit.withSymbol(trimmed);
    }

    private Unit product() {
        Unit result = factor();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                return result;
            }
            char c = text.charAt(pos);
            if (c == '/') {
                pos++;
                skipWhitespace();
                result = result.divide(factor());
            } else if (c == '*' || c == '.') {
                pos++;
                skipWhitespace();
                result = result.multiply(factor());
            } else if (c == '(' || Character.isLetter(c) || Character.isDigit(c) || c == 'Å' || c == 'µ') {
                result = result.multiply(factor());
            } else {
                return result;
            }
        }
    }

    private Unit factor() {
        if (pos >= text.length()) {
            throw error("unexpected end of unit");
        }
        char c = text.charAt(pos);
        Unit unit;
        if (c == '(') {
            pos++;
            skipWhitespace();
            unit = product();
            skipWhitespace();
            if (pos >= text.length() || text.charAt(pos) != ')') {
                throw error("missing ')'");
            }
            pos++;
        } else if (Character.isDigit(c)) {
            return number();
        } else if (Character.isLetter(c) || c == 'Å' || c == 'µ') {
            unit = name();
        } else {
            throw error("unexpected character '" + c + "'");
        }
        Double exponent = exponent();
        return exponent == null ? unit : unit.pow(exponent);
    }

    private Unit number() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')
            && pos + 1 < text.length()
            && (Character.isDigit(text.charAt(pos + 1)) || text.charAt(pos + 1) == '-' || text.charAt(pos + 1) == '+')) {
            pos += 2;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        String literal = text.substring(start, pos);
        try {
            double value = Double.parseDouble(literal);
            return new Unit(literal, value, Dimension.NONE);
        } catch (NumberFormatException e) {
            throw error("bad scale factor '" + literal + "'");
        } catch (IllegalArgumentException e) {
            throw error("scale factor must be positive: '" + literal + "'");
        }
    }

    private Unit name() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetter(c) || c == 'Å' || c == 'µ') {
                pos++;
            } else {
                break;
            }
        }
        String name = text.substring(start, pos);
        Unit base = BASE.get(name);
        if (base != null) {
            return base;
        }
        if (name.length() > 1) {
            Double prefix = PREFIXES.get(name.charAt(0));
            String rest = name.substring(1);
            if (prefix != null && PREFIXABLE.contains(rest)) {
                Unit root = BASE.get(rest);
                return new Unit(name, prefix * root.scale(), root.dimension());
            }
        }
        if (MAGGY_NAMES.contains(name)) {
            throw error("'" + name + "' cannot be combined with other units");
        }
        throw error("unknown unit '" + name + "'");
    }

    private Double exponent() {
        int start = pos;
        if (text.startsWith("**", pos)) {
            pos += 2;
        } else if (pos < text.length() && text.charAt(pos) == '^') {
            pos++;
        }
        int numberStart = pos;
        if (pos < text.length() && (text.charAt(pos) == '-' || text.charAt(pos) == '+')) {
            pos++;
        }
        if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
            if (start != numberStart) {
                throw error("missing exponent");
            }
            pos = start;
            return null;
        }
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        String literal = text.substring(numberStart, pos);
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw error("bad exponent '" + literal + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private UnitConversionException error(String detail) {
        return new UnitConversionException("Invalid unit '" + text + "' at position " + pos + ": " + detail);
    }
}
