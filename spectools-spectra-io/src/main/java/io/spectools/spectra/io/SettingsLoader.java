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

import io.spectools.spectra.config.SpectraSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/// Reads and writes [SpectraSettings] as JSON files.
///
/// Saves go through a sibling `.tmp` file and an atomic rename.
public final class SettingsLoader {

    private static final Logger logger = LogManager.getLogger(SettingsLoader.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private SettingsLoader() {
    }

    /**
     * @throws IOException if the file cannot be read or does not hold valid settings
     */
    public static SpectraSettings load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.isRegularFile(path)) {
            throw new IOException("Settings file not found: " + path);
        }
        String json = Files.readString(path, StandardCharsets.UTF_8);
        try {
            SpectraSettings settings = SpectraSettings.fromJson(json);
            logger.debug("Loaded settings from {}: {}", path, settings);
            return settings;
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid settings in " + path + ": " + e.getMessage(), e);
        }
    }

    /// Loads the file when it exists, otherwise returns the defaults.
    public static SpectraSettings loadOrDefaults(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            logger.info("No settings file at {}, using defaults", path);
            return SpectraSettings.defaults();
        }
        return load(path);
    }

    public static void save(Path path, SpectraSettings settings) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(settings, "settings cannot be null");
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(settings.toJson());
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
