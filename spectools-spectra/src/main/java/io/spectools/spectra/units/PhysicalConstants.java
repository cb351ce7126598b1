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

/// SI values (2019 redefinition) of the constants used by unit conversion,
/// photometry and the blackbody curve.
public final class PhysicalConstants {

    /// Speed of light, m/s.
    public static final double SPEED_OF_LIGHT = 2.99792458e8;

    /// Speed of light, km/s.
    public static final double SPEED_OF_LIGHT_KMS = 2.99792458e5;

    /// Planck constant, J s.
    public static final double PLANCK = 6.62607015e-34;

    /// Boltzmann constant, J/K.
    public static final double BOLTZMANN = 1.380649e-23;

    /// Electron volt, J.
    public static final double ELECTRON_VOLT = 1.602176634e-19;

    /// AB magnitude zero point flux density, Jy.
    public static final double AB_REFERENCE_JANSKY = 3631.0;

    private PhysicalConstants() {
    }
}
