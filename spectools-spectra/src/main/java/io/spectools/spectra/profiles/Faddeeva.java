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
 * The Faddeeva function {@code w(z) = exp(−z²)·erfc(−iz)} in the upper half plane.
 *
 * <p>Uses Humlíček's W4 rational approximation (JQSRT 27, 437, 1982), which
 * splits the plane into four regions by {@code s = |x| + y}. The relative
 * accuracy is about 1e-4, ample for line profiles.
 */
public final class Faddeeva {

    private static final double RSQRT_PI = 0.5641896;

    private Faddeeva() {
    }

    /**
     * Evaluates w(z).
     *
     * @param z argument with non-negative imaginary part
     * @return w(z)
     * @throws IllegalArgumentException if Im z is negative
     */
    public static Complex w(Complex z) {
        double x = z.getReal();
        double y = z.getImaginary();
        if (y < 0) {
            throw new IllegalArgumentException("Faddeeva approximation requires Im(z) >= 0, got: " + y);
        }
        Complex t = new Complex(y, -x);
        double s = Math.abs(x) + y;

        if (s >= 15.0) {
            return t.multiply(RSQRT_PI).divide(t.multiply(t).add(0.5));
        }
        if (s >= 5.5) {
            Complex u = t.multiply(t);
            Complex numerator = t.multiply(u.multiply(RSQRT_PI).add(1.410474));
            Complex denominator = u.multiply(u.add(3.0)).add(0.75);
            return numerator.divide(denominator);
        }
        if (y >= 0.195 * Math.abs(x) - 0.176) {
            Complex numerator = horner(t, 16.4955, 20.20933, 11.96482, 3.778987, 0.5642236);
            Complex denominator = horner(t, 16.4955, 38.82363, 39.27121, 21.69274, 6.699398, 1.0);
            return numerator.divide(denominator);
        }
        Complex u = t.multiply(t);
        Complex numerator = horner(u, 36183.31, -3321.9905, 1540.787, -219.0313, 35.76683, -1.320522, 0.56419);
        Complex denominator = horner(u, 32066.6, -24322.84, 9022.228, -2186.181, 364.2191, -61.57037, 1.841439, -1.0);
        return u.exp().subtract(t.multiply(numerator).divide(denominator));
    }

    /// Evaluates Σ cᵢ·vⁱ with coefficients in ascending powers.
    private static Complex horner(Complex v, double... coefficients) {
        Complex acc = new Complex(coefficients[coefficients.length - 1], 0);
        for (int i = coefficients.length - 2; i >= 0; i--) {
            acc = acc.multiply(v).add(coefficients[i]);
        }
        return acc;
    }
}
