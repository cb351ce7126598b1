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
import io.spectools.spectra.config.SpectraSettings;
import io.spectools.spectra.photometry.AbMagnitude;
import io.spectools.spectra.photometry.FilterCurve;
import io.spectools.spectra.photometry.SyntheticPhotometry;
import io.spectools.spectra.photometry.UnsupportedFilterException;
import io.spectools.spectra.units.Units;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DirectoryFilterCatalogueTest {

    @TempDir
    Path filterDir;

    @BeforeEach
    void writeCurves() throws IOException {
        StringBuilder g = new StringBuilder("# SDSS g, test curve\n# wavelength response\n");
        for (int w = 4000; w <= 5500; w += 10) {
            g.append(String.format(Locale.ROOT, "%d %.3f%n", w, 1.0));
        }
        Files.writeString(filterDir.resolve("SLOAN_SDSS.g.dat"), g.toString());
        Files.writeString(filterDir.resolve("GAIA_GAIA2r.Gbp.dat"), "3300 0.0\n\n4500 0.5\n6500 0.0\n");
    }

    @Test
    void readsCurvesByIdentifier() {
        DirectoryFilterCatalogue catalogue = new DirectoryFilterCatalogue(filterDir);
        FilterCurve g = catalogue.lookup("g");
        assertEquals("g", g.id());
        assertEquals(151, g.wavelength().length);
        assertEquals(WavelengthMedium.VACUUM, g.medium());
        assertEquals(Units.ANGSTROM, g.wavelengthUnit());
        assertSame(g, catalogue.lookup("g"));
        assertArrayEquals(new double[]{0.0, 0.5, 0.0}, catalogue.lookup("GaiaBp").transmission(), 0.0);
    }

    @Test
    void identifiersListPresentFiles() {
        assertThat(new DirectoryFilterCatalogue(filterDir).identifiers()).containsExactlyInAnyOrder("g", "GaiaBp");
    }

    @Test
    void missingAndUnknownFilters() {
        DirectoryFilterCatalogue catalogue = new DirectoryFilterCatalogue(filterDir);
        UnsupportedFilterException missing = assertThrows(UnsupportedFilterException.class, () -> catalogue.lookup("r"));
        assertEquals("r", missing.getFilterId());
        assertThrows(UnsupportedFilterException.class, () -> catalogue.lookup("not-a-filter"));
    }

    @Test
    void malformedCurvesAreReported() throws IOException {
        Files.writeString(filterDir.resolve("SLOAN_SDSS.r.dat"), "5500 1.0\n5600 abc\n");
        Files.writeString(filterDir.resolve("SLOAN_SDSS.i.dat"), "7000 1.0\n");
        DirectoryFilterCatalogue catalogue = new DirectoryFilterCatalogue(filterDir);
        UncheckedIOException bad = assertThrows(UncheckedIOException.class, () -> catalogue.lookup("r"));
        assertThat(bad.getCause().getMessage()).contains(":2:");
        assertThrows(UncheckedIOException.class, () -> catalogue.lookup("i"));
    }

    @Test
    void directoryMustExist() {
        assertThrows(IllegalArgumentException.class, () -> new DirectoryFilterCatalogue(filterDir.resolve("absent")));
    }

    @Test
    void drivesSyntheticPhotometry() {
        double[] x = new double[2001];
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = 3500 + i;
            y[i] = 3631.0;
        }
        Spectrum flat = Spectrum.builder().wavelength(x).flux(y).medium("air").fluxUnit(Units.JANSKY).build();
        SyntheticPhotometry phot = new SyntheticPhotometry(new DirectoryFilterCatalogue(filterDir), SpectraSettings.defaults());
        AbMagnitude g = phot.magnitude(flat, "g");
        assertEquals(0.0, g.value(), 0.01);
    }
}
