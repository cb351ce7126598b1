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

/// Frequently used units.
public final class Units {

    public static final Unit ANGSTROM = Unit.parse("AA");
    public static final Unit NANOMETER = Unit.parse("nm");
    public static final Unit MICRON = Unit.parse("um");
    public static final Unit METER = Unit.parse("m");
    public static final Unit HERTZ = Unit.parse("Hz");
    public static final Unit ELECTRON_VOLT = Unit.parse("eV");
    public static final Unit INVERSE_MICRON = Unit.parse("1/um");

    /// erg s⁻¹ cm⁻² Å⁻¹, the default flux unit of optical spectra.
    public static final Unit FLAMBDA_CGS = Unit.parse("erg/(s cm2 AA)");

    /// erg s⁻¹ cm⁻² Hz⁻¹.
    public static final Unit FNU_CGS = Unit.parse("erg/(s cm2 Hz)");

    public static final Unit JANSKY = Unit.parse("Jy");
    public static final Unit MILLIJANSKY = Unit.parse("mJy");

    public static final Unit DIMENSIONLESS = Unit.parse("");

    /// Linear AB flux ratio, F_ν / 3631 Jy.
    public static final Unit AB_MAGGY = Unit.parse("mag");

    private Units() {
    }
}
