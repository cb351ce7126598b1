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
import io.spectools.spectra.WavelengthMedium;
import io.spectools.spectra.units.Unit;
import io.spectools.spectra.units.Units;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads two- or three-column text spectra: wavelength, flux and optionally
 * error, separated by whitespace or commas.
 *
 * <p>Blank lines and lines starting with {@code #} are skipped. The column count
 * is fixed by the first data line; columns beyond the third are ignored. The
 * spectrum is named after the file, without its extension.
 */
public final class DelimitedTextReader implements SpectrumReader {

    private static final Logger logger = LogManager.getLogger(DelimitedTextReader.class);
    private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");

    private final WavelengthMedium medium;
    private final Unit wavelengthUnit;
    private final Unit fluxUnit;

    /// Air wavelengths in Ångström and F_λ in erg s⁻¹ cm⁻² Å⁻¹.
    public DelimitedTextReader() {
        this(WavelengthMedium.AIR, Units.ANGSTROM, Units.FLAMBDA_CGS);
    }

    public DelimitedTextReader(WavelengthMedium medium, Unit wavelengthUnit, Unit fluxUnit) {
        this.medium = Objects.requireNonNull(medium, "medium cannot be null");
        this.wavelengthUnit = Objects.requireNonNull(wavelengthUnit, "wavelengthUnit cannot be null");
        this.fluxUnit = Objects.requireNonNull(fluxUnit, "fluxUnit cannot be null");
    }

    @Override
    public Spectrum read(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        DoubleColumns columns = new DoubleColumns();
        int width = 0;
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
                if (width == 0) {
                    if (fields.length < 2) {
                        throw new IOException(path + ":" + lineNumber + ": expected at least 2 columns, got: " + fields.length);
                    }
                    width = Math.min(fields.length, 3);
                } else if (fields.length < width) {
                    throw new IOException(path + ":" + lineNumber + ": expected " + width + " columns, got: " + fields.length);
                }
                try {
                    columns.add(Double.parseDouble(fields[0]), Double.parseDouble(fields[1]),
                        width == 3 ? Double.parseDouble(fields[2]) : 0.0);
                } catch (NumberFormatException e) {
                    throw new IOException(path + ":" + lineNumber + ": not a number in '" + trimmed + "'", e);
                }
            }
        }
        if (columns.size() == 0) {
            throw new IOException("No data rows in " + path);
        }
        logger.debug("Read {} rows with {} columns from {}", columns.size(), width, path);
        try {
            return Spectrum.builder()
                .wavelength(columns.x())
                .flux(columns.y())
                .error(columns.e())
                .name(baseName(path))
                .medium(medium)
                .wavelengthUnit(wavelengthUnit)
                .fluxUnit(fluxUnit)
                .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid spectrum in " + path + ": " + e.getMessage(), e);
        }
    }

    static String baseName(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
