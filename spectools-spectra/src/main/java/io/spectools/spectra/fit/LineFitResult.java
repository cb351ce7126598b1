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

import io.spectools.spectra.convolve.GaussianConvolver;

/// Parameters of a Gaussian-plus-constant fitted to an emission line,
/// {@code amplitude·exp(−½((x−center)/sigma)²) + offset}.
public record LineFitResult(double amplitude, double center, double sigma, double offset) {

    /// @return the full width at half maximum, sigma·2.3548
    public double fwhm() {
        return sigma * GaussianConvolver.FWHM_TO_SIGMA;
    }
}
