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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Wavelength regions listed one pair per line, {@code x1 x2}.
 *
 * <p>Blank lines and {@code #} comments are ignored. A pair given in descending
 * order is swapped. The result feeds {@link Spectrum#keepRegions(List)}.
 */
public final class RegionMaskFile {

    private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");

    private RegionMaskFile() {
    }

    /**
     * @return the regions in file order, each as {@code {start, end}}
     * @throws IOException if the file cannot be read or a line is not a pair of numbers
     */
    public static List<double[]> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        List<double[]> regions = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] fields = SEPARATOR.split(trimmed);
                if (fields.length != 2) {
                    throw new IOException(path + ":" + lineNumber + ": expected 'x1 x2', got: '" + trimmed + "'");
                }
                try {
                    double a = Double.parseDouble(fields[0]);
                    double b = Double.parseDouble(fields[1]);
                    regions.add(new double[]{Math.min(a, b), Math.max(a, b)});
                } catch (NumberFormatException e) {
                    throw new IOException(path + ":" + lineNumber + ": not a number in '" + trimmed + "'", e);
                }
            }
        }
        return Collections.unmodifiableList(regions);
    }

    /// Reads the regions and keeps only the pixels of the spectrum that fall inside them.
    public static Spectrum apply(Spectrum spectrum, Path path) throws IOException {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        return spectrum.keepRegions(read(path));
    }
}
