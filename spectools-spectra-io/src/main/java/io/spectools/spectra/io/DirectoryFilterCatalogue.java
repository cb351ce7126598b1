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

import io.spectools.spectra.WavelengthMedium;
import io.spectools.spectra.photometry.FilterCatalogue;
import io.spectools.spectra.photometry.FilterCurve;
import io.spectools.spectra.photometry.PhotometricFilter;
import io.spectools.spectra.photometry.UnsupportedFilterException;
import io.spectools.spectra.units.Units;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// A [FilterCatalogue] backed by a directory of transmission curve files.
///
/// ## Layout
///
/// Each [PhotometricFilter] has its curve in a file named by
/// [PhotometricFilter#fileName()], holding two whitespace-separated columns:
/// wavelength in Ångström and dimensionless response. Lines starting with `#`
/// are comments.
///
/// ```text
/// filters/
///   SLOAN_SDSS.g.dat
///   GAIA_GAIA2r.Gbp.dat
///   ...
/// ```
///
/// Curves are read on first lookup and cached for the catalogue's lifetime.
public final class DirectoryFilterCatalogue implements FilterCatalogue {

    private static final Logger logger = LogManager.getLogger(DirectoryFilterCatalogue.class);
    private static final Pattern SEPARATOR = Pattern.compile("\\s+");

    private final Path directory;
    private final WavelengthMedium medium;
    private final Map<String, FilterCurve> cache = new HashMap<>();

    /// Curves on vacuum wavelengths.
    public DirectoryFilterCatalogue(Path directory) {
        this(directory, WavelengthMedium.VACUUM);
    }

    /**
     * @param directory directory holding the curve files
     * @param medium the medium the curve wavelengths are given in
     * @throws IllegalArgumentException if the directory does not exist
     */
    public DirectoryFilterCatalogue(Path directory, WavelengthMedium medium) {
        Objects.requireNonNull(directory, "directory cannot be null");
        this.medium = Objects.requireNonNull(medium, "medium cannot be null");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("filter directory does not exist: " + directory);
        }
        this.directory = directory;
    }

    /**
     * @throws UnsupportedFilterException if the identifier is unknown or its curve file is missing
     * @throws UncheckedIOException if the curve file cannot be read or parsed
     */
    @Override
    public FilterCurve lookup(String id) {
        FilterCurve cached = cache.get(id);
        if (cached != null) {
            return cached;
        }
        PhotometricFilter filter = PhotometricFilter.fromId(id);
        Path file = directory.resolve(filter.fileName());
        if (!Files.isRegularFile(file)) {
            throw new UnsupportedFilterException(id, "No transmission curve for filter '" + id + "' at " + file);
        }
        FilterCurve curve;
        try {
            curve = readCurve(id, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read filter curve " + file, e);
        }
        cache.put(id, curve);
        logger.debug("Loaded filter '{}' with {} points from {}", id, curve.wavelength().length, file);
        return curve;
    }

    /// @return identifiers of the filters whose curve files are present
    @Override
    public Set<String> identifiers() {
        Set<String> present = new LinkedHashSet<>();
        for (PhotometricFilter filter : PhotometricFilter.values()) {
            if (Files.isRegularFile(directory.resolve(filter.fileName()))) {
                present.add(filter.id());
            }
        }
        return Collections.unmodifiableSet(present);
    }

    public Path directory() {
        return directory;
    }

    private FilterCurve readCurve(String id, Path file) throws IOException {
        DoubleColumns columns = new DoubleColumns();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] fields = SEPARATOR.split(trimmed);
                if (fields.length < 2) {
                    throw new IOException(file + ":" + lineNumber + ": expected 2 columns, got: " + fields.length);
                }
                try {
                    columns.add(Double.parseDouble(fields[0]), Double.parseDouble(fields[1]), 0.0);
                } catch (NumberFormatException e) {
                    throw new IOException(file + ":" + lineNumber + ": not a number in '" + trimmed + "'", e);
                }
            }
        }
        try {
            return new FilterCurve(id, columns.x(), columns.y(), medium, Units.ANGSTROM);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid filter curve in " + file + ": " + e.getMessage(), e);
        }
    }
}
