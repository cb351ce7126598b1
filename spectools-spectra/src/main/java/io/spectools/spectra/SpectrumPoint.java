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

/// A single pixel of a [Spectrum].
///
/// @param wavelength the pixel wavelength in the spectrum's wavelength unit
/// @param flux the pixel flux in the spectrum's flux unit
/// @param error the one-sigma flux uncertainty
public record SpectrumPoint(double wavelength, double flux, double error) {
}
