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

import org.apache.commons.math3.complex.Complex;

/**
 * Area-normalised Voigt profile, the convolution of a Gaussian and a Lorentzian.
 *
 * <pre>
 *   σ = fwhmG / (2·sqrt(2·ln 2))
 *   z = ((x − x₀) + i·fwhmL/2) / (σ·√2)
 *   V = Re w(z) / (σ·√(2π))
 * </pre>
 *
 * <p>Values carry the accuracy of {@link Faddeeva#w}: about 1e-4 relative to the
 * exact profile, not full double precision. Fits that need tighter profiles
 * should not rely on this class.
 */
public final class VoigtProfile {

    private static final double SIGMA_PER_FWHM = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));
    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    private VoigtProfile() {
    }

    /**
     * @param x where to evaluate
     * @param x0 line centre
     * @param fwhmG Gaussian FWHM, positive
     * @param fwhmL Lorentzian FWHM, non-negative
     * @return profile value
     */
    public static double evaluate(double x, double x0, double fwhmG, double fwhmL) {
        if (!(fwhmG > 0)) {
            throw new IllegalArgumentException("fwhmG must be positive, got: " + fwhmG);
        }
        if (!(fwhmL >= 0)) {
            throw new IllegalArgumentException("fwhmL must be non-negative, got: " + fwhmL);
        }
        double sigma = SIGMA_PER_FWHM * fwhmG;
        Complex z = new Complex(x - x0, 0.5 * fwhmL).divide(sigma * SQRT_2);
        return Faddeeva.w(z).getReal() / (sigma * SQRT_2PI);
    }

    public static double[] evaluate(double[] x, double x0, double fwhmG, double fwhmL) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = evaluate(x[i], x0, fwhmG, fwhmL);
        }
        return out;
    }
}
