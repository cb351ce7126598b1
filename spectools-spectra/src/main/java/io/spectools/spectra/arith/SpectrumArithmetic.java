package io.spectools.spectra.arith;

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
import io.spectools.spectra.config.SpectraSettings;

import java.util.Objects;

/**
 * Applies {@link ArithmeticOp} rules to spectra and keeps their units consistent.
 *
 * <p>Two spectra combine only when they have the same length, their wavelength
 * grids are close ({@code |a-b| <= atol + rtol*|b|}) and they share a wavelength
 * unit and equivalent flux units. Multiplication squares the flux unit and
 * division leaves a dimensionless one. The combined wavelength array is
 * the elementwise mean of both inputs, and the result keeps the name, medium and
 * metadata of the left operand.
 *
 * <p>A strict engine, built with {@code requireSameMedium}, also refuses to mix
 * air and vacuum spectra.
 */
public final class SpectrumArithmetic {

    /// Default tolerances, media not checked.
    public static final SpectrumArithmetic DEFAULT = new SpectrumArithmetic(SpectraSettings.defaults(), false);

    private final double rtol;
    private final double atol;
    private final boolean requireSameMedium;

    public SpectrumArithmetic(SpectraSettings settings, boolean requireSameMedium) {
        Objects.requireNonNull(settings, "settings cannot be null");
        this.rtol = settings.closeRtol();
        this.atol = settings.closeAtol();
        this.requireSameMedium = requireSameMedium;
    }

    /// Computes {@code spectrum op operand}.
    public Spectrum apply(Spectrum spectrum, ArithmeticOp op, Operand operand) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");
        return operand.combine(spectrum, op, this);
    }

    /// Computes {@code operand op spectrum}.
    public Spectrum applyReflected(Spectrum spectrum, ArithmeticOp op, Operand operand) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");
        return operand.combineReflected(spectrum, op, this);
    }

    /**
     * Raises the flux to a power. The error becomes {@code |p·y^p·e/y|} and the
     * flux unit is raised to the same power.
     */
    public Spectrum pow(Spectrum spectrum, double power) {
        double[] y = spectrum.flux();
        double[] e = spectrum.error();
        double[] y2 = new double[y.length];
        double[] e2 = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            y2[i] = Math.pow(y[i], power);
            e2[i] = Math.abs(power * y2[i] * e[i] / y[i]);
        }
        return spectrum.withFlux(y2, e2, spectrum.fluxUnit().pow(power));
    }

    public Spectrum negate(Spectrum spectrum) {
        double[] y = spectrum.flux();
        for (int i = 0; i < y.length; i++) {
            y[i] = -y[i];
        }
        return spectrum.withFlux(y, spectrum.error());
    }

    public Spectrum abs(Spectrum spectrum) {
        double[] y = spectrum.flux();
        for (int i = 0; i < y.length; i++) {
            y[i] = Math.abs(y[i]);
        }
        return spectrum.withFlux(y, spectrum.error());
    }

    Spectrum withConstants(Spectrum spectrum, ArithmeticOp op, double[] k, boolean reflected) {
        double[] y = spectrum.flux();
        double[] e = spectrum.error();
        double[] y2 = new double[y.length];
        double[] e2 = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            if (reflected) {
                y2[i] = op.reflectedFlux(y[i], k[i]);
                e2[i] = op.reflectedError(y[i], e[i], k[i]);
            } else {
                y2[i] = op.flux(y[i], k[i]);
                e2[i] = op.constantError(y[i], e[i], k[i]);
            }
        }
        return spectrum.withFlux(y2, e2, reflected ? op.reflectedUnit(spectrum.fluxUnit()) : spectrum.fluxUnit());
    }

    Spectrum withSpectrum(Spectrum left, ArithmeticOp op, Spectrum right) {
        checkCompatible(left, right);
        int n = left.size();
        double[] x = new double[n];
        double[] y = new double[n];
        double[] e = new double[n];
        for (int i = 0; i < n; i++) {
            double y1 = left.fluxAt(i);
            double y2 = right.fluxAt(i);
            x[i] = 0.5 * (left.wavelengthAt(i) + right.wavelengthAt(i));
            y[i] = op.flux(y1, y2);
            e[i] = op.pairError(y1, left.errorAt(i), y2, right.errorAt(i));
        }
        return left.withFlux(y, e, op.pairUnit(left.fluxUnit(), right.fluxUnit()))
            .withWavelength(x, left.wavelengthUnit());
    }

    private void checkCompatible(Spectrum left, Spectrum right) {
        if (left.size() != right.size()) {
            throw new IncompatibleSpectraException(left, right, "lengths differ");
        }
        if (!left.wavelengthUnit().isEquivalentTo(right.wavelengthUnit())) {
            throw new IncompatibleSpectraException(left, right, "wavelength units differ ("
                + left.wavelengthUnit() + " vs " + right.wavelengthUnit() + ")");
        }
        if (!left.isCloseTo(right, rtol, atol)) {
            throw new IncompatibleSpectraException(left, right, "wavelength grids are not close");
        }
        if (!left.fluxUnit().isEquivalentTo(right.fluxUnit())) {
            throw new IncompatibleSpectraException(left, right, "flux units differ ("
                + left.fluxUnit() + " vs " + right.fluxUnit() + ")");
        }
        if (requireSameMedium && left.medium() != right.medium()) {
            throw new IncompatibleSpectraException(left, right, "media differ ("
                + left.medium().label() + " vs " + right.medium().label() + ")");
        }
    }
}
