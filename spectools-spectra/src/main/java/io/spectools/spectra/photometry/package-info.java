/// Synthetic AB photometry through filter transmission curves.
///
/// - {@link io.spectools.spectra.photometry.SyntheticPhotometry}: magnitude integration and Monte-Carlo errors
/// - {@link io.spectools.spectra.photometry.FilterCatalogue}: where curves come from
/// - {@link io.spectools.spectra.photometry.PhotometricFilter}: the supported passbands
package io.spectools.spectra.photometry;

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
