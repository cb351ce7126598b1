/// One-dimensional spectra with uncertainty propagation.
///
/// The central type is {@link io.spectools.spectra.Spectrum}, an immutable
/// triple of wavelength, flux and flux-error arrays together with their units,
/// the wavelength medium and a free-form metadata map.
///
/// ## Key Components
///
/// - {@link io.spectools.spectra.Spectrum}: the value type and its operators
/// - {@link io.spectools.spectra.MutableSpectrum}: a handle for chained in-place style updates
/// - {@link io.spectools.spectra.Spectra}: joining and averaging several spectra
/// - {@link io.spectools.spectra.WavelengthMedium}: air or vacuum
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
