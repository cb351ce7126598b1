/// File-system surfaces for spectra: writers, readers, filter curve
/// directories, region lists and settings files.
///
/// ## Key Components
///
/// - {@link io.spectools.spectra.io.SpectrumWriter}: text and `.npy` output with typed results
/// - {@link io.spectools.spectra.io.DirectoryFilterCatalogue}: transmission curves from disk
/// - {@link io.spectools.spectra.io.RegionMaskFile}: wavelength windows for masking
/// - {@link io.spectools.spectra.io.SettingsLoader}: JSON settings files
/// - {@link io.spectools.spectra.io.SpectrumReader}: the reader contract
package io.spectools.spectra.io;

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
