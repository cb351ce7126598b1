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

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// On-disk encodings understood by [SpectrumWriter], chosen by file extension.
public enum OutputFormat {

    /// whitespace-separated columns, one pixel per line
    TEXT(List.of("txt", "dat", "asc")),
    /// NumPy `.npy` v1.0, little-endian float64, shape (columns, N)
    NPY(List.of("npy"));

    private final List<String> extensions;

    OutputFormat(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Picks the format for a path from its extension, case-insensitively.
     *
     * @return the format, or empty when the extension is not recognised
     */
    public static Optional<OutputFormat> forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
