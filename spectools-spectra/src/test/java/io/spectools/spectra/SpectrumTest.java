package io.spectools.spectra;

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

import io.spectools.spectra.units.Units;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SpectrumTest {

    private static Spectrum sample() {
        return Spectrum.builder()
            .wavelength(new double[]{4000, 4001, 4002, 4003, 4004})
            .flux(new double[]{1, 2, 3, 4, 5})
            .error(new double[]{0.1, 0.2, 0.3, 0.4, 0.5})
            .name("sample")
            .build();
    }

    @Test
    void builderAppliesDefaults() {
        Spectrum s = Spectrum.builder().wavelength(new double[]{1, 2}).flux(new double[]{3, 4}).build();
        assertEquals(WavelengthMedium.AIR, s.medium());
        assertEquals(Units.ANGSTROM, s.wavelengthUnit());
        assertEquals(Units.FLAMBDA_CGS, s.fluxUnit());
        assertEquals("", s.name());
        assertArrayEquals(new double[]{0, 0}, s.error());
        assertTrue(s.hasZeroErrors());
    }

    @Test
    void rejectsMismatchedLengths() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Spectrum.of(new double[]{1, 2, 3}, new double[]{1, 2}, new double[]{0, 0, 0}));
        assertThat(e.getMessage()).contains("equal lengths");
    }

    @Test
    void rejectsNegativeErrors() {
        assertThrows(IllegalArgumentException.class,
            () -> Spectrum.of(new double[]{1, 2}, new double[]{1, 2}, new double[]{0.1, -0.1}));
    }

    @Test
    void rejectsNonSpectralUnits() {
        assertThrows(IllegalArgumentException.class, () -> Spectrum.builder()
            .wavelength(new double[]{1}).flux(new double[]{1}).wavelengthUnit("erg/s").build());
        assertThrows(IllegalArgumentException.class, () -> Spectrum.builder()
            .wavelength(new double[]{1}).flux(new double[]{1}).fluxUnit("s").build());
    }

    @Test
    void acceptsFrequencyDensityAndDimensionlessFlux() {
        Spectrum jy = Spectrum.builder().wavelength(new double[]{1}).flux(new double[]{1}).fluxUnit("mJy").build();
        Spectrum ratio = Spectrum.builder().wavelength(new double[]{1}).flux(new double[]{1}).fluxUnit("").build();
        assertEquals(Units.MILLIJANSKY, jy.fluxUnit());
        assertEquals(Units.DIMENSIONLESS, ratio.fluxUnit());
    }

    @Test
    void rejectsUnknownMediumLabel() {
        assertThrows(IllegalArgumentException.class, () -> Spectrum.builder().medium("water"));
        assertEquals(WavelengthMedium.VACUUM, WavelengthMedium.parse("Vacuum"));
    }

    @Test
    void arraysAreCopied() {
        double[] flux = {1, 2};
        Spectrum s = Spectrum.of(new double[]{1, 2}, flux, new double[]{0, 0});
        flux[0] = 99;
        assertEquals(1.0, s.fluxAt(0));
        s.flux()[1] = 99;
        assertEquals(2.0, s.fluxAt(1));
    }

    @Test
    void indexingSupportsNegativeIndices() {
        Spectrum s = sample();
        assertEquals(new SpectrumPoint(4004, 5, 0.5), s.get(-1));
        assertEquals(new SpectrumPoint(4000, 1, 0.1), s.get(0));
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(5));
        assertThrows(IndexOutOfBoundsException.class, () -> s.get(-6));
    }

    @Test
    void sliceAndSelectKeepAttributes() {
        Spectrum s = sample().withMedium(WavelengthMedium.VACUUM);
        Spectrum slice = s.slice(1, 3);
        assertArrayEquals(new double[]{4001, 4002}, slice.wavelength());
        assertEquals("sample", slice.name());
        assertEquals(WavelengthMedium.VACUUM, slice.medium());

        Spectrum picked = s.select(new int[]{4, 0});
        assertArrayEquals(new double[]{5, 1}, picked.flux());

        Spectrum masked = s.select(new boolean[]{true, false, true, false, false});
        assertArrayEquals(new double[]{1, 3}, masked.flux());
        assertThrows(IllegalArgumentException.class, () -> s.select(new boolean[]{true}));
    }

    @Test
    void iterationIsRestartable() {
        Spectrum s = sample();
        List<SpectrumPoint> first = new ArrayList<>();
        s.forEach(first::add);
        List<SpectrumPoint> second = new ArrayList<>();
        s.forEach(second::add);
        assertEquals(5, first.size());
        assertEquals(first, second);
        assertEquals(15.0, s.stream().mapToDouble(SpectrumPoint::flux).sum(), 1e-12);

        Iterator<SpectrumPoint> it = Spectrum.of(new double[0], new double[0], new double[0]).iterator();
        assertFalse(it.hasNext());
    }

    @Test
    void clipUsesOpenInterval() {
        Spectrum clipped = sample().clip(4001, 4003);
        assertArrayEquals(new double[]{4002}, clipped.wavelength());
        assertArrayEquals(new boolean[]{false, true, true, true, false}, sample().section(4000, 4004));
    }

    @Test
    void splitThenJoinReproducesPieces() {
        Spectrum s = sample();
        List<Spectrum> pieces = s.split(4002.5, 4000.5);
        assertEquals(3, pieces.size());
        assertArrayEquals(new double[]{4000}, pieces.get(0).wavelength());
        assertArrayEquals(new double[]{4001, 4002}, pieces.get(1).wavelength());
        assertArrayEquals(new double[]{4003, 4004}, pieces.get(2).wavelength());

        Spectrum joined = Spectra.join(pieces, false, null);
        assertArrayEquals(s.wavelength(), joined.wavelength());
        assertArrayEquals(s.flux(), joined.flux());
        assertArrayEquals(s.error(), joined.error());
        assertEquals("sample", joined.name());
    }

    @Test
    void joinCanSortByWavelength() {
        Spectrum red = sample().slice(3, 5);
        Spectrum blue = sample().slice(0, 3);
        Spectrum joined = red.join(blue, true);
        assertArrayEquals(sample().wavelength(), joined.wavelength());
        assertArrayEquals(sample().flux(), joined.flux());
    }

    @Test
    void closestIndexFindsNearestPixel() {
        assertEquals(2, sample().closestIndex(4002.2));
        assertEquals(0, sample().closestIndex(100));
        assertEquals(-1, Spectrum.of(new double[0], new double[0], new double[0]).closestIndex(1));
    }

    @Test
    void applyMaskDropsTrueEntries() {
        Spectrum kept = sample().applyMask(new boolean[]{true, false, false, true, false});
        assertArrayEquals(new double[]{2, 3, 5}, kept.flux());
    }

    @Test
    void keepRegionsUnionsRanges() {
        Spectrum kept = sample().keepRegions(List.of(new double[]{3999, 4000.5}, new double[]{4002.5, 4003.5}));
        assertArrayEquals(new double[]{4000, 4003}, kept.wavelength());
    }

    @Test
    void normPercentileDividesFluxAndError() {
        Spectrum norm = sample().normPercentile(50);
        assertArrayEquals(new double[]{1 / 3.0, 2 / 3.0, 1, 4 / 3.0, 5 / 3.0}, norm.flux(), 1e-12);
        assertEquals(0.1, norm.errorAt(2), 1e-12);
        assertEquals(1.0, sample().normPercentile(100).fluxAt(4), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> sample().normPercentile(0));
    }

    @Test
    void metadataIsSharedWithDerivedSpectra() {
        Map<String, Object> header = new HashMap<>();
        header.put("OBJECT", "WD 1856+534");
        Spectrum s = sample().withMetadata(header);
        Spectrum derived = s.multiply(2.0);
        s.metadata().put("EXPTIME", 600);
        assertSame(s.metadata(), derived.metadata());
        assertEquals(600, derived.metadata().get("EXPTIME"));
        assertFalse(header.containsKey("EXPTIME"));
    }

    @Test
    void closenessUsesRelativeAndAbsoluteTolerance() {
        Spectrum a = Spectrum.of(new double[]{5000, 6000}, new double[]{1, 1}, new double[]{0, 0});
        Spectrum b = Spectrum.of(new double[]{5000.01, 6000}, new double[]{1, 1}, new double[]{0, 0});
        Spectrum c = Spectrum.of(new double[]{5000.1, 6000}, new double[]{1, 1}, new double[]{0, 0});
        assertTrue(a.isCloseTo(b));
        assertFalse(a.isCloseTo(c));
        assertFalse(a.isCloseTo(sample()));
    }
}
