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

import io.spectools.spectra.IncompatibleSpectraException;
import io.spectools.spectra.Spectrum;
import org.apache.commons.math3.analysis.interpolation.AkimaSplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Moves a spectrum onto a new wavelength grid.
 *
 * <p>Flux and error are interpolated independently with the same scheme. Spline
 * overshoot in the error column is clamped at zero. The
 * source wavelengths must be strictly monotonic; a descending axis is reversed
 * before interpolation. The target grid may be in any order and the result
 * follows it.
 *
 * <pre>{@code
 * Spectrum onModelGrid = Resampler.DEFAULT.interpolate(data, model, InterpolationKind.LINEAR);
 * Spectrum smooth = Resampler.DEFAULT.interpolate(data, grid, InterpolationKind.AKIMA);
 * }</pre>
 */
public final class Resampler {

    private static final Logger logger = LogManager.getLogger(Resampler.class);

    public static final Resampler DEFAULT = new Resampler();

    /**
     * Interpolates onto the wavelengths of another spectrum.
     *
     * @throws IncompatibleSpectraException if the two spectra are on different media
     *     or their wavelength units differ
     */
    public Spectrum interpolate(Spectrum spectrum, Spectrum target, InterpolationKind kind) {
        Objects.requireNonNull(target, "target cannot be null");
        if (spectrum.medium() != target.medium()) {
            throw new IncompatibleSpectraException(spectrum, target, "media differ ("
                + spectrum.medium().label() + " vs " + target.medium().label() + ")");
        }
        if (!spectrum.wavelengthUnit().isEquivalentTo(target.wavelengthUnit())) {
            throw new IncompatibleSpectraException(spectrum, target, "wavelength units differ ("
                + spectrum.wavelengthUnit() + " vs " + target.wavelengthUnit() + ")");
        }
        return interpolate(spectrum, target.wavelength(), kind);
    }

    /**
     * Interpolates onto a wavelength grid in the spectrum's own units.
     *
     * @throws IllegalArgumentException if the source axis is not strictly monotonic or
     *     has fewer points than the scheme needs
     */
    public Spectrum interpolate(Spectrum spectrum, double[] grid, InterpolationKind kind) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(grid, "grid cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        double[][] out = resample(spectrum.wavelength(), spectrum.flux(), spectrum.error(), grid, kind);
        return spectrum.withData(grid, out[0], out[1]);
    }

    /**
     * Interpolates raw arrays.
     *
     * @return {@code {flux, error}} on the grid
     */
    public double[][] resample(double[] x, double[] y, double[] e, double[] grid, InterpolationKind kind) {
        if (x.length < kind.minimumPoints()) {
            throw new IllegalArgumentException(kind + " interpolation needs at least "
                + kind.minimumPoints() + " points, got: " + x.length);
        }
        double[][] sorted = ascending(x, y, e);
        double[] xs = sorted[0];
        double[] ys = sorted[1];
        double[] es = sorted[2];
        logger.debug("Resampling {} points onto {} with {}", xs.length, grid.length, kind);
        return switch (kind) {
            case LINEAR -> new double[][]{
                Interpolation.linear(xs, ys, grid, 0.0),
                Interpolation.linear(xs, es, grid, 0.0)};
            case NEAREST -> new double[][]{nearest(xs, ys, grid), nearest(xs, es, grid)};
            case CUBIC -> new double[][]{
                spline(new SplineInterpolator(), xs, ys, grid),
                nonNegative(spline(new SplineInterpolator(), xs, es, grid))};
            case AKIMA -> new double[][]{
                spline(new AkimaSplineInterpolator(), xs, ys, grid),
                nonNegative(spline(new AkimaSplineInterpolator(), xs, es, grid))};
            case SINC -> SincResampler.resample(xs, ys, es, grid);
        };
    }

    private static double[][] ascending(double[] x, double[] y, double[] e) {
        if (x.length < 2) {
            return new double[][]{x, y, e};
        }
        boolean up = x[1] > x[0];
        for (int i = 1; i < x.length; i++) {
            if (up ? !(x[i] > x[i - 1]) : !(x[i] < x[i - 1])) {
                throw new IllegalArgumentException("wavelengths must be strictly monotonic, failed at index " + i);
            }
        }
        if (up) {
            return new double[][]{x, y, e};
        }
        return new double[][]{reversed(x), reversed(y), reversed(e)};
    }

    private static double[] reversed(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }

    private static double[] nearest(double[] x, double[] y, double[] grid) {
        double[] out = new double[grid.length];
        int n = x.length;
        for (int j = 0; j < grid.length; j++) {
            double q = grid[j];
            if (!(q >= x[0] && q <= x[n - 1])) {
                continue;
            }
            int lo = 0;
            int hi = n - 1;
            while (hi - lo > 1) {
                int mid = (lo + hi) >>> 1;
                if (x[mid] <= q) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            out[j] = (q - x[lo] <= x[hi] - q) ? y[lo] : y[hi];
        }
        return out;
    }

    private static double[] spline(UnivariateInterpolator interpolator, double[] x, double[] y, double[] grid) {
        PolynomialSplineFunction function = (PolynomialSplineFunction) interpolator.interpolate(x, y);
        double[] out = new double[grid.length];
        for (int j = 0; j < grid.length; j++) {
            double q = grid[j];
            if (function.isValidPoint(q)) {
                double v = function.value(q);
                out[j] = Double.isNaN(v) ? 0.0 : v;
            }
        }
        return out;
    }

    /// Splines can swing below zero next to a spike; an uncertainty cannot.
    private static double[] nonNegative(double[] values) {
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.max(0.0, values[i]);
        }
        return values;
    }
}
