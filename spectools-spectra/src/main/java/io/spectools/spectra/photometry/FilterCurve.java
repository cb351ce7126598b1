package io.spectools.spectra.photometry;

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

import io.spectools.spectra.Spectrum;
import io.spectools.spectra.WavelengthMedium;
import io.spectools.spectra.units.Unit;
import io.spectools.spectra.units.Units;

import java.util.Objects;

/// A passband transmission curve.
///
/// @param id the filter identifier
/// @param wavelength wavelengths, ascending
/// @param transmission dimensionless response at each wavelength
/// @param medium the medium the wavelengths are given in
/// @param wavelengthUnit the unit of the wavelengths
public record FilterCurve(String id, double[] wavelength, double[] transmission,
                          WavelengthMedium medium, Unit wavelengthUnit) {

    public FilterCurve {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(wavelength, "wavelength cannot be null");
        Objects.requireNonNull(transmission, "transmission cannot be null");
        Objects.requireNonNull(medium, "medium cannot be null");
        Objects.requireNonNull(wavelengthUnit, "wavelengthUnit cannot be null");
        if (wavelength.length != transmission.length) {
            throw new IllegalArgumentException("wavelength and transmission must have equal lengths, got: "
                + wavelength.length + ", " + transmission.length);
        }
        if (wavelength.length < 2) {
            throw new IllegalArgumentException("filter '" + id + "' needs at least 2 points, got: " + wavelength.length);
        }
        wavelength = wavelength.clone();
        transmission = transmission.clone();
    }

    /// A curve in Å on vacuum wavelengths.
    public static FilterCurve of(String id, double[] wavelength, double[] transmission) {
        return new FilterCurve(id, wavelength, transmission, WavelengthMedium.VACUUM, Units.ANGSTROM);
    }

    /// @return a copy of the wavelengths
    @Override
    public double[] wavelength() {
        return wavelength.clone();
    }

    /// @return a copy of the transmission values
    @Override
    public double[] transmission() {
        return transmission.clone();
    }

    /// @return the curve as a noiseless spectrum with dimensionless flux
    public Spectrum toSpectrum() {
        return Spectrum.builder()
            .wavelength(wavelength)
            .flux(transmission)
            .name(id)
            .medium(medium)
            .wavelengthUnit(wavelengthUnit)
            .fluxUnit(Units.DIMENSIONLESS)
            .build();
    }
}
