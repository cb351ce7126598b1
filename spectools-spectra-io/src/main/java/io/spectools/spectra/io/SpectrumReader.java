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

import io.spectools.spectra.Spectrum;

import java.io.IOException;
import java.nio.file.Path;

/// Source of spectra from files.
///
/// Implementations for formats without an uncertainty column return spectra
/// whose errors are all zero.
@FunctionalInterface
public interface SpectrumReader {

    /**
     * @param path file to read
     * @return the spectrum held in the file
     * @throws IOException if the file cannot be read or its content is malformed
     */
    Spectrum read(Path path) throws IOException;
}
