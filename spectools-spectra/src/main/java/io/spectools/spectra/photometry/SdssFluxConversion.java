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

/**
 * Converts SDSS catalogue magnitudes to F_λ at the band's effective wavelength.
 *
 * <p>SDSS magnitudes are close to, but not exactly, AB: the u band is offset
 * by about 0.04 mag and the others by 0. The conversion is
 *
 * <pre>
 *   F_ν = 10^(−0.4·(m − offset) − 19.44)        erg s⁻¹ cm⁻² Hz⁻¹
 *   F_λ = 2.998e18 / λ² · F_ν                    erg s⁻¹ cm⁻² Å⁻¹
 *   σ_F = 0.4·ln(10)·F_λ·σ_m
 * </pre>
 */
public final class SdssFluxConversion {

    /// The u-band offset from SDSS to AB magnitudes.
    public static final double U_BAND_AB_OFFSET = 0.04;

    private static final double SPEED_OF_LIGHT_ANGSTROM = 2.998e18;
    private static final double MAG_TO_FLUX_ERROR = 0.4 * Math.log(10.0);

    private SdssFluxConversion() {
    }

    /**
     * @param effectiveWavelength band wavelength, Å
     * @param magnitude SDSS magnitude
     * @param magnitudeError magnitude uncertainty; zero or negative for none
     * @param offset SDSS-to-AB offset subtracted from the magnitude
     * @return {@code {flux, error}}, the error being 0 when no magnitude error is given
     */
    public static double[] magToFlux(double effectiveWavelength, double magnitude, double magnitudeError, double offset) {
        if (!(effectiveWavelength > 0)) {
            throw new IllegalArgumentException("effective wavelength must be positive, got: " + effectiveWavelength);
        }
        double fnu = Math.pow(10.0, -0.4 * (magnitude - offset) - 19.44);
        double flambda = SPEED_OF_LIGHT_ANGSTROM / (effectiveWavelength * effectiveWavelength) * fnu;
        double error = magnitudeError > 0 ? MAG_TO_FLUX_ERROR * flambda * magnitudeError : 0.0;
        return new double[]{flambda, error};
    }
}
