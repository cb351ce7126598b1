package io.spectools.spectra.resample;

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

import java.util.Arrays;

/**
 * Piecewise-linear lookups on ascending abscissae.
 *
 * <p>These are the primitives shared by resampling, convolution and the
 * photometry engine. Abscissae must be ascending; no check is made.
 */
public final class Interpolation {

    private Interpolation() {
    }

    /**
     * Linear interpolation with a constant outside {@code [x[0], x[n-1]]}.
     *
     * @param x ascending abscissae
     * @param y ordinates
     * @param query points to evaluate
     * @param fill value for points outside the range
     * @return interpolated values
     */
    public static double[] linear(double[] x, double[] y, double[] query, double fill) {
        double[] out = new double[query.length];
        for (int i = 0; i < query.length; i++) {
            double q = query[i];
            if (!(q >= x[0] && q <= x[x.length - 1])) {
                out[i] = fill;
            } else {
                out[i] = evaluate(x, y, q);
            }
        }
        return out;
    }

    /**
     * Linear interpolation that clamps to the end values outside the range.
     */
    public static double[] linearClamped(double[] x, double[] y, double[] query) {
        double[] out = new double[query.length];
        for (int i = 0; i < query.length; i++) {
            double q = query[i];
            if (q <= x[0]) {
                out[i] = y[0];
            } else if (q >= x[x.length - 1]) {
                out[i] = y[y.length - 1];
            } else {
                out[i] = evaluate(x, y, q);
            }
        }
        return out;
    }

    /// Evaluates the linear interpolant at one point inside the range.
    public static double evaluate(double[] x, double[] y, double q) {
        int n = x.length;
        if (n == 1) {
            return y[0];
        }
        int j = Arrays.binarySearch(x, q);
        if (j >= 0) {
            return y[j];
        }
        int hi = -j - 1;
        if (hi <= 0) {
            return y[0];
        }
        if (hi >= n) {
            return y[n - 1];
        }
        int lo = hi - 1;
        double t = (q - x[lo]) / (x[hi] - x[lo]);
        return y[lo] + t * (y[hi] - y[lo]);
    }

    /// @return the smallest power of two that is at least n
    public static int nextPowerOfTwo(int n) {
        int out = 1;
        while (out < n) {
            out <<= 1;
        }
        return out;
    }
}
