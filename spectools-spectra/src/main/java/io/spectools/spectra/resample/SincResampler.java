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

/**
 * Band-limited resampling by direct summation of sinc kernels.
 *
 * <p>Each target wavelength is mapped to a fractional pixel index {@code t} by
 * linear interpolation of the pixel indices against the source wavelengths,
 * clamped at both ends. Then
 *
 * <pre>
 *   y(t) = Σᵢ y[i]·sinc(t − i)
 *   e(t) = sqrt( Σᵢ (e[i]·sinc(t − i))² )
 * </pre>
 *
 * with {@code sinc(u) = sin(πu)/(πu)}. The sums run over every source pixel,
 * so the cost is O(N·M).
 */
final class SincResampler {

    private SincResampler() {
    }

    static double[][] resample(double[] x, double[] y, double[] e, double[] grid) {
        double[] index = new double[x.length];
        for (int i = 0; i < index.length; i++) {
            index[i] = i;
        }
        double[] t = Interpolation.linearClamped(x, index, grid);
        double[] flux = new double[grid.length];
        double[] error = new double[grid.length];
        for (int j = 0; j < grid.length; j++) {
            double sum = 0;
            double variance = 0;
            for (int i = 0; i < x.length; i++) {
                double w = sinc(t[j] - i);
                sum += y[i] * w;
                double we = e[i] * w;
                variance += we * we;
            }
            flux[j] = sum;
            error[j] = Math.sqrt(variance);
        }
        return new double[][]{flux, error};
    }

    static double sinc(double u) {
        if (u == 0) {
            return 1.0;
        }
        double p = Math.PI * u;
        return Math.sin(p) / p;
    }
}
