package io.spectools.spectra.convolve;

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

import io.spectools.spectra.config.SpectraSettings;
import io.spectools.spectra.resample.Interpolation;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Gaussian smoothing by FFT on an oversampled uniform grid.
 *
 * <h2>Method</h2>
 *
 * <ol>
 *   <li>Linearly interpolate the data onto M = nextPowerOfTwo(oversample·N)
 *       uniform points spanning {@code [x[0], x[N-1]]}.</li>
 *   <li>Build the kernel {@code exp(−½((xᵢ−x₀)/σ)²)} plus its mirror image, so
 *       the peak sits at both ends of the periodic grid, and normalise it to
 *       unit sum.</li>
 *   <li>Multiply the forward transforms, invert, keep the real part, and
 *       interpolate back onto the original abscissae.</li>
 * </ol>
 *
 * <p>The transform is circular, so flux from one end of the spectrum wraps
 * into the other within a few σ of the edges. Callers that care should pad
 * or trim their spectra.
 *
 * <p>Abscissae must be ascending; uniform spacing is not required.
 */
public final class GaussianConvolver {

    private static final Logger logger = LogManager.getLogger(GaussianConvolver.class);

    /// FWHM / σ for a Gaussian, 2·sqrt(2·ln 2).
    public static final double FWHM_TO_SIGMA = 2.3548200450309493;

    public static final GaussianConvolver DEFAULT = new GaussianConvolver(SpectraSettings.defaults());

    private final int oversampleFactor;
    private final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

    public GaussianConvolver(SpectraSettings settings) {
        Objects.requireNonNull(settings, "settings cannot be null");
        this.oversampleFactor = settings.oversampleFactor();
    }

    /**
     * Convolves y(x) with a Gaussian of the given FWHM.
     *
     * @param x ascending abscissae
     * @param y ordinates
     * @param fwhm full width at half maximum, in the units of x
     * @return the smoothed ordinates at x
     * @throws IllegalArgumentException if fwhm is not positive, the arrays differ in
     *     length or fewer than two points are given
     */
    public double[] convolve(double[] x, double[] y, double fwhm) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (!(fwhm > 0)) {
            throw new IllegalArgumentException("fwhm must be positive, got: " + fwhm);
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have equal lengths, got: " + x.length + ", " + y.length);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("convolution needs at least 2 points, got: " + x.length);
        }
        int n = x.length;
        double sigma = fwhm / FWHM_TO_SIGMA;
        int m = Interpolation.nextPowerOfTwo(oversampleFactor * n);
        double x0 = x[0];
        double x1 = x[n - 1];

        double[] xi = new double[m];
        double step = (x1 - x0) / (m - 1);
        for (int i = 0; i < m; i++) {
            xi[i] = x0 + i * step;
        }
        xi[m - 1] = x1;
        double[] yi = Interpolation.linearClamped(x, y, xi);

        double[] half = new double[m];
        for (int i = 0; i < m; i++) {
            double u = (xi[i] - x0) / sigma;
            half[i] = Math.exp(-0.5 * u * u);
        }
        double[] kernel = new double[m];
        double total = 0;
        for (int i = 0; i < m; i++) {
            kernel[i] = half[i] + half[m - 1 - i];
            total += kernel[i];
        }
        for (int i = 0; i < m; i++) {
            kernel[i] /= total;
        }
        logger.debug("Convolving {} points on a {}-point grid, sigma={}", n, m, sigma);

        Complex[] dataF = fft.transform(yi, TransformType.FORWARD);
        Complex[] kernelF = fft.transform(kernel, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = dataF[i].multiply(kernelF[i]);
        }
        Complex[] inverse = fft.transform(product, TransformType.INVERSE);
        double[] smoothed = new double[m];
        for (int i = 0; i < m; i++) {
            smoothed[i] = inverse[i].getReal();
        }
        return Interpolation.linearClamped(xi, smoothed, x);
    }

    /**
     * Convolves to a constant resolving power R = λ/Δλ by smoothing along ln x
     * with FWHM 1/R.
     *
     * @throws IllegalArgumentException if R is not positive or any x is not positive
     */
    public double[] convolveResolution(double[] x, double[] y, double resolvingPower) {
        if (!(resolvingPower > 0)) {
            throw new IllegalArgumentException("resolving power must be positive, got: " + resolvingPower);
        }
        double[] lnx = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            if (!(x[i] > 0)) {
                throw new IllegalArgumentException("wavelengths must be positive for resolution convolution, got: " + x[i]);
            }
            lnx[i] = Math.log(x[i]);
        }
        return convolve(lnx, y, 1.0 / resolvingPower);
    }
}
