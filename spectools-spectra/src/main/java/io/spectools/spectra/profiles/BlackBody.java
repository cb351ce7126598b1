package io.spectools.spectra.profiles;

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
import io.spectools.spectra.units.PhysicalConstants;
import io.spectools.spectra.units.Units;

import java.util.Locale;
import java.util.Objects;

/**
 * Planck curve shape B_λ(T) ∝ λ⁻⁵ / (exp(hc/λkT) − 1).
 *
 * <p>Evaluated in log form to avoid overflow of λ⁻⁵ and exp. With
 * Q = hc/(λkT):
 *
 * <pre>
 *   ln B = −5·ln λ − ln(expm1 Q)   for Q &lt; 10
 *   ln B = −5·ln λ − Q             otherwise
 * </pre>
 *
 * <p>The unnormalised values carry no physical constants; only the shape is
 * meaningful. Normalisation divides by the maximum over the supplied grid.
 */
public final class BlackBody {

    /// hc/k in Å·K.
    public static final double HC_OVER_K_ANGSTROM =
        PhysicalConstants.PLANCK * PhysicalConstants.SPEED_OF_LIGHT / PhysicalConstants.BOLTZMANN / 1e-10;

    private BlackBody() {
    }

    /**
     * @param wavelength wavelengths in Å, positive
     * @param temperature temperature in K, positive
     * @param normalise scale so the largest value is exactly 1
     * @return the curve on the grid
     */
    public static double[] evaluate(double[] wavelength, double temperature, boolean normalise) {
        Objects.requireNonNull(wavelength, "wavelength cannot be null");
        if (!(temperature > 0)) {
            throw new IllegalArgumentException("temperature must be positive, got: " + temperature);
        }
        double[] logf = new double[wavelength.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < wavelength.length; i++) {
            double lambda = wavelength[i];
            if (!(lambda > 0)) {
                throw new IllegalArgumentException("wavelengths must be positive, got: " + lambda);
            }
            double q = HC_OVER_K_ANGSTROM / (lambda * temperature);
            logf[i] = q < 10.0
                ? -5.0 * Math.log(lambda) - Math.log(Math.expm1(q))
                : -5.0 * Math.log(lambda) - q;
            max = Math.max(max, logf[i]);
        }
        double[] out = new double[logf.length];
        for (int i = 0; i < logf.length; i++) {
            out[i] = Math.exp(normalise ? logf[i] - max : logf[i]);
        }
        return out;
    }

    /**
     * Builds a noiseless blackbody spectrum on vacuum Ångström wavelengths with a
     * dimensionless flux unit.
     */
    public static Spectrum spectrum(double[] wavelength, double temperature, boolean normalise) {
        return Spectrum.builder()
            .wavelength(wavelength)
            .flux(evaluate(wavelength, temperature, normalise))
            .name(String.format(Locale.ROOT, "blackbody_%.0fK", temperature))
            .medium(WavelengthMedium.VACUUM)
            .wavelengthUnit(Units.ANGSTROM)
            .fluxUnit(Units.DIMENSIONLESS)
            .build();
    }
}
