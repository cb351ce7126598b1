package io.spectools.spectra;

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

import io.spectools.spectra.units.Unit;
import io.spectools.spectra.units.VelocityUnit;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A single handle over a changing {@link Spectrum}.
 *
 * <p>Each operation computes the new value first and replaces the held spectrum
 * only when that succeeds, so a call that throws leaves the previous value in
 * place. Not thread-safe.
 *
 * <pre>{@code
 * MutableSpectrum m = new MutableSpectrum(observed);
 * m.airToVac().applyRedshift(-35.0, VelocityUnit.KM_PER_S).normPercentile(99);
 * Spectrum restFrame = m.get();
 * }</pre>
 */
public final class MutableSpectrum {

    private Spectrum current;

    public MutableSpectrum(Spectrum initial) {
        this.current = Objects.requireNonNull(initial, "initial cannot be null");
    }

    public Spectrum get() {
        return current;
    }

    /// Replaces the held spectrum with the result of the function, if it returns normally.
    public MutableSpectrum update(UnaryOperator<Spectrum> operation) {
        Spectrum next = operation.apply(current);
        this.current = Objects.requireNonNull(next, "operation returned null");
        return this;
    }

    public MutableSpectrum applyMask(boolean[] masked) {
        return update(s -> s.applyMask(masked));
    }

    public MutableSpectrum normPercentile(double percentile) {
        return update(s -> s.normPercentile(percentile));
    }

    public MutableSpectrum airToVac() {
        return update(Spectrum::airToVac);
    }

    public MutableSpectrum vacToAir() {
        return update(Spectrum::vacToAir);
    }

    public MutableSpectrum toMedium(WavelengthMedium medium) {
        return update(s -> s.toMedium(medium));
    }

    public MutableSpectrum applyRedshift(double velocity, VelocityUnit unit) {
        return update(s -> s.applyRedshift(velocity, unit));
    }

    public MutableSpectrum convertWavelengthUnit(Unit unit) {
        return update(s -> s.convertWavelengthUnit(unit));
    }

    public MutableSpectrum convertFluxUnit(Unit unit) {
        return update(s -> s.convertFluxUnit(unit));
    }

    public MutableSpectrum convolveGaussian(double fwhm) {
        return update(s -> s.convolveGaussian(fwhm));
    }

    public MutableSpectrum convolveResolution(double resolvingPower) {
        return update(s -> s.convolveResolution(resolvingPower));
    }

    public MutableSpectrum redden(double ebv, double rv) {
        return update(s -> s.redden(ebv, rv));
    }

    @Override
    public String toString() {
        return "MutableSpectrum{" + current + "}";
    }
}
