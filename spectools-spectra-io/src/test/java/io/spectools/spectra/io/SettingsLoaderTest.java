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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsPartialSettings() throws IOException {
        Path file = tempDir.resolve("spectra.json");
        Files.writeString(file, "{ \"integration_rule\": \"simpson\", \"monte_carlo_draws\": 25 }");
        SpectraSettings settings = SettingsLoader.load(file);
        assertEquals("simpson", settings.integrationRule());
        assertEquals(25, settings.monteCarloDraws());
        assertEquals(10, settings.oversampleFactor());
    }

    @Test
    void saveThenLoad() throws IOException {
        Path file = tempDir.resolve("saved.json");
        SettingsLoader.save(file, SpectraSettings.builder().randomSeed(99L).oversampleFactor(3).build());
        SpectraSettings back = SettingsLoader.load(file);
        assertEquals(99L, back.randomSeed());
        assertEquals(3, back.oversampleFactor());
        assertFalse(Files.exists(tempDir.resolve("saved.json.tmp")));
    }

    @Test
    void missingFiles() throws IOException {
        Path absent = tempDir.resolve("absent.json");
        assertThrows(IOException.class, () -> SettingsLoader.load(absent));
        assertSame(SpectraSettings.defaults(), SettingsLoader.loadOrDefaults(absent));
    }

    @Test
    void invalidSettingsBecomeIoErrors() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ \"oversample_factor\": -2 }");
        IOException e = assertThrows(IOException.class, () -> SettingsLoader.load(file));
        assertTrue(e.getMessage().contains("oversample_factor"));
    }
}
