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

import io.spectools.spectra.config.SpectraSettings;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/// Operations over collections of spectra.
public final class Spectra {

    private Spectra() {
    }

    /**
     * Concatenates spectra end to end.
     *
     * @param spectra at least one spectrum, all with equivalent units and the same medium
     * @param sort sort the result by wavelength
     * @param name name of the result; null takes the first spectrum's name
     * @return the joined spectrum, carrying the first spectrum's metadata
     * @throws IncompatibleSpectraException if units or media differ
     */
    public static Spectrum join(List<Spectrum> spectra, boolean sort, String name) {
        Objects.requireNonNull(spectra, "spectra cannot be null");
        if (spectra.isEmpty()) {
            throw new IllegalArgumentException("cannot join an empty list of spectra");
        }
        Spectrum first = spectra.get(0);
        int total = 0;
        for (Spectrum s : spectra) {
            Objects.requireNonNull(s, "spectra cannot contain null");
            if (!s.wavelengthUnit().isEquivalentTo(first.wavelengthUnit())
                || !s.fluxUnit().isEquivalentTo(first.fluxUnit())) {
                throw new IncompatibleSpectraException(first, s, "units differ");
            }
            if (s.medium() != first.medium()) {
                throw new IncompatibleSpectraException(first, s, "media differ");
            }
            total += s.size();
        }
        double[] x = new double[total];
        double[] y = new double[total];
        double[] e = new double[total];
        int offset = 0;
        for (Spectrum s : spectra) {
            System.arraycopy(s.wavelength(), 0, x, offset, s.size());
            System.arraycopy(s.flux(), 0, y, offset, s.size());
            System.arraycopy(s.error(), 0, e, offset, s.size());
            offset += s.size();
        }
        Spectrum joined = first.withData(x, y, e).withName(name == null ? first.name() : name);
        if (!sort) {
            return joined;
        }
        int[] order = IntStream.range(0, total)
            .boxed()
            .sorted((a, b) -> Double.compare(x[a], x[b]))
            .mapToInt(Integer::intValue)
            .toArray();
        return joined.select(order);
    }

    /**
     * Inverse-variance weighted mean of spectra on a common grid. Wavelengths are
     * averaged, fluxes weighted by 1/e², and the error is 1/sqrt(Σ 1/e²).
     *
     * @throws IncompatibleSpectraException if lengths or grids differ
     * @throws IllegalArgumentException if any error is not positive
     */
    public static Spectrum weightedMean(List<Spectrum> spectra) {
        Objects.requireNonNull(spectra, "spectra cannot be null");
        if (spectra.isEmpty()) {
            throw new IllegalArgumentException("cannot average an empty list of spectra");
        }
        SpectraSettings defaults = SpectraSettings.defaults();
        Spectrum first = spectra.get(0);
        int n = first.size();
        for (Spectrum s : spectra) {
            if (s.size() != n) {
                throw new IncompatibleSpectraException(first, s, "lengths differ");
            }
            if (!s.isCloseTo(first, defaults.closeRtol(), defaults.closeAtol())) {
                throw new IncompatibleSpectraException(first, s, "wavelength grids are not close");
            }
            if (!s.fluxUnit().isEquivalentTo(first.fluxUnit())) {
                throw new IncompatibleSpectraException(first, s, "flux units differ");
            }
        }
        double[] x = new double[n];
        double[] y = new double[n];
        double[] e = new double[n];
        for (int i = 0; i < n; i++) {
            double sumX = 0;
            double sumWeights = 0;
            double sumWeighted = 0;
            for (Spectrum s : spectra) {
                double err = s.errorAt(i);
                if (!(err > 0)) {
                    throw new IllegalArgumentException("weighted mean needs positive errors, got: "
                        + err + " in '" + s.name() + "' at index " + i);
                }
                double w = 1.0 / (err * err);
                sumX += s.wavelengthAt(i);
                sumWeights += w;
                sumWeighted += s.fluxAt(i) * w;
            }
            x[i] = sumX / spectra.size();
            y[i] = sumWeighted / sumWeights;
            e[i] = 1.0 / Math.sqrt(sumWeights);
        }
        return first.withData(x, y, e);
    }
}
