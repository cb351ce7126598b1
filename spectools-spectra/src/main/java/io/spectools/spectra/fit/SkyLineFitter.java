package io.spectools.spectra.fit;

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
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Measures the width of a sky emission line by fitting a Gaussian plus a
 * constant background.
 *
 * <h2>Method</h2>
 *
 * <p>Points strictly inside {@code (w0 − h, w0 + h)} are fitted, with h the
 * configured half width. Each point is weighted by 1/sqrt(flux) (Poisson
 * counting), with fluxes below the smallest positive flux raised to it. The
 * normalised residuals are multiplied by 1000 whenever the amplitude, width or
 * background goes negative, which keeps Levenberg–Marquardt in the physical
 * region. The Jacobian is taken by forward differences.
 *
 * <p>The starting point is amplitude = max − min of the window, centre = w0,
 * σ = 1 and background = max(min, 0).
 */
public final class SkyLineFitter {

    private static final Logger logger = LogManager.getLogger(SkyLineFitter.class);

    private static final double PENALTY = 1000.0;
    private static final double DIFF_STEP = 1.4901161193847656e-8;
    private static final int MAX_EVALUATIONS = 10_000;

    private final double halfWidth;

    public SkyLineFitter(SpectraSettings settings) {
        Objects.requireNonNull(settings, "settings cannot be null");
        this.halfWidth = settings.skyLineHalfWidth();
    }

    public SkyLineFitter() {
        this(SpectraSettings.defaults());
    }

    /**
     * Fits the line nearest w0.
     *
     * @param wavelength sky wavelengths
     * @param sky sky fluxes
     * @param w0 approximate line centre
     * @return the fitted parameters
     * @throws IllegalArgumentException if fewer than four points fall in the window
     * @throws IllegalStateException if the optimiser does not converge
     */
    public LineFitResult fit(double[] wavelength, double[] sky, double w0) {
        Objects.requireNonNull(wavelength, "wavelength cannot be null");
        Objects.requireNonNull(sky, "sky cannot be null");
        if (wavelength.length != sky.length) {
            throw new IllegalArgumentException("wavelength and sky must have equal lengths, got: "
                + wavelength.length + ", " + sky.length);
        }
        int count = 0;
        for (double w : wavelength) {
            if (w > w0 - halfWidth && w < w0 + halfWidth) count++;
        }
        if (count < 4) {
            throw new IllegalArgumentException("need at least 4 points within " + halfWidth
                + " of " + w0 + " to fit a line, got: " + count);
        }
        double[] x = new double[count];
        double[] y = new double[count];
        int j = 0;
        for (int i = 0; i < wavelength.length; i++) {
            if (wavelength[i] > w0 - halfWidth && wavelength[i] < w0 + halfWidth) {
                x[j] = wavelength[i];
                y[j] = sky[i];
                j++;
            }
        }

        double floor = Double.POSITIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : y) {
            if (v > 0) floor = Math.min(floor, v);
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (Double.isInfinite(floor)) {
            floor = 1.0;
        }
        double[] weight = new double[count];
        for (int i = 0; i < count; i++) {
            weight[i] = Math.sqrt(Math.max(y[i], floor));
        }

        double amplitude0 = max - min;
        double[] guess = {amplitude0 > 0 ? amplitude0 : 1.0, w0, 1.0, Math.max(min, 0.0)};
        double[] typical = {guess[0], Math.max(Math.abs(w0), 1.0), 1.0, guess[0]};

        int n = count;
        MultivariateJacobianFunction residuals = point -> {
            double[] p = point.toArray();
            double[] r = residuals(p, x, y, weight);
            double[][] jacobian = new double[n][4];
            for (int k = 0; k < 4; k++) {
                double[] shifted = p.clone();
                double h = DIFF_STEP * (p[k] != 0 ? Math.abs(p[k]) : typical[k]);
                shifted[k] += h;
                double[] rs = residuals(shifted, x, y, weight);
                for (int i = 0; i < n; i++) {
                    jacobian[i][k] = (rs[i] - r[i]) / h;
                }
            }
            return new Pair<RealVector, RealMatrix>(new ArrayRealVector(r, false),
                new Array2DRowRealMatrix(jacobian, false));
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(guess)
            .model(residuals)
            .target(new double[count])
            .maxEvaluations(MAX_EVALUATIONS)
            .maxIterations(MAX_EVALUATIONS)
            .build();
        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        } catch (ConvergenceException | TooManyEvaluationsException | TooManyIterationsException e) {
            throw new IllegalStateException("sky line fit near " + w0 + " did not converge", e);
        }
        double[] p = optimum.getPoint().toArray();
        logger.debug("Sky line near {} fitted in {} iterations: A={}, x0={}, sigma={}, c={}",
            w0, optimum.getIterations(), p[0], p[1], p[2], p[3]);
        return new LineFitResult(p[0], p[1], Math.abs(p[2]), p[3]);
    }

    /// Convenience for the common case where only the width matters.
    public double fwhm(double[] wavelength, double[] sky, double w0) {
        return fit(wavelength, sky, w0).fwhm();
    }

    static double[] residuals(double[] p, double[] x, double[] y, double[] weight) {
        double amplitude = p[0];
        double center = p[1];
        double sigma = p[2];
        double offset = p[3];
        double scale = (amplitude < 0 || sigma < 0 || offset < 0) ? PENALTY : 1.0;
        double[] r = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double u = (x[i] - center) / sigma;
            double model = amplitude * Math.exp(-0.5 * u * u) + offset;
            r[i] = scale * (y[i] - model) / weight[i];
        }
        return r;
    }
}
