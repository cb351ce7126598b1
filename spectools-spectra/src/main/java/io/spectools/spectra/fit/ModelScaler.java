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

import io.spectools.spectra.Spectrum;
import io.spectools.spectra.resample.InterpolationKind;
import io.spectools.spectra.resample.Resampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Finds the single multiplicative factor that best matches a model to data.
 *
 * <p>The model is linearly interpolated onto the data wavelengths (both must be
 * on the same medium), and the factor minimises the squared residuals. The
 * returned model keeps its own wavelengths; resample it afterwards if it should
 * share the data grid.
 */
public final class ModelScaler {

    private static final Logger logger = LogManager.getLogger(ModelScaler.class);

    public static final ModelScaler DEFAULT = new ModelScaler(Resampler.DEFAULT);

    private final Resampler resampler;

    public ModelScaler(Resampler resampler) {
        this.resampler = Objects.requireNonNull(resampler, "resampler cannot be null");
    }

    /**
     * Inverse-variance weighted scaling, {@code A = Σ(d·m/σ²) / Σ(m²/σ²)}.
     * Data points with non-positive error are ignored.
     *
     * @param model the model, typically with zero errors
     * @param data the observed spectrum
     * @throws IllegalArgumentException if no data point has a positive error or the model is zero there
     */
    public ScaledModel scaleToData(Spectrum model, Spectrum data) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        boolean[] good = new boolean[data.size()];
        int kept = 0;
        for (int i = 0; i < good.length; i++) {
            good[i] = data.errorAt(i) > 0;
            if (good[i]) kept++;
        }
        if (kept == 0) {
            throw new IllegalArgumentException("data spectrum '" + data.name() + "' has no points with positive error");
        }
        Spectrum usable = data.select(good);
        Spectrum onData = resampler.interpolate(model, usable, InterpolationKind.LINEAR);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < usable.size(); i++) {
            double d = usable.fluxAt(i);
            double m = onData.fluxAt(i);
            double variance = usable.errorAt(i) * usable.errorAt(i);
            numerator += d * m / variance;
            denominator += m * m / variance;
        }
        return scaled(model, numerator, denominator);
    }

    /**
     * Unweighted scaling of one model to another, {@code A = Σ(d·m) / Σ(m²)}.
     *
     * @param model the model to scale
     * @param reference the model to match
     * @throws IllegalArgumentException if the model is zero everywhere on the reference grid
     */
    public ScaledModel scaleToModel(Spectrum model, Spectrum reference) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(reference, "reference cannot be null");
        Spectrum onReference = resampler.interpolate(model, reference, InterpolationKind.LINEAR);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < reference.size(); i++) {
            double d = reference.fluxAt(i);
            double m = onReference.fluxAt(i);
            numerator += d * m;
            denominator += m * m;
        }
        return scaled(model, numerator, denominator);
    }

    private static ScaledModel scaled(Spectrum model, double numerator, double denominator) {
        if (!(denominator > 0)) {
            throw new IllegalArgumentException("model '" + model.name() + "' is zero over the data; cannot scale");
        }
        double factor = numerator / denominator;
        logger.debug("Scaled model '{}' by {}", model.name(), factor);
        return new ScaledModel(model.multiply(factor), factor);
    }
}
