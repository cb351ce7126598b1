package io.spectools.spectra.resample;

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

import io.spectools.spectra.IncompatibleSpectraException;
import io.spectools.spectra.Spectrum;
import io.spectools.spectra.WavelengthMedium;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

public class ResamplerTest {

    private static Spectrum ramp(int n) {
        double[] x = new double[n];
        double[] y = new double[n];
        double[] e = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = 6000 + 2.0 * i;
            y[i] = 1.0 + 0.5 * i;
            e[i] = 0.1 + 0.01 * i;
        }
        return Spectrum.of(x, y, e);
    }

    @Test
    void linearSelfResamplingIsIdentity() {
        Spectrum s = ramp(20);
        Spectrum same = s.interpWave(s.wavelength());
        assertArrayEquals(s.flux(), same.flux(), 1e-12);
        assertArrayEquals(s.error(), same.error(), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(value = InterpolationKind.class, names = {"LINEAR", "CUBIC", "AKIMA"})
    void linearDataIsReproducedBetweenNodes(InterpolationKind kind) {
        Spectrum s = ramp(12);
        double[] grid = {6001.0, 6005.5, 6019.0};
        Spectrum out = s.interpWave(grid, kind);
        for (int j = 0; j < grid.length; j++) {
            assertEquals(1.0 + 0.25 * (grid[j] - 6000), out.fluxAt(j), 1e-9, kind + " at " + grid[j]);
        }
        assertArrayEquals(grid, out.wavelength(), 0.0);
    }

    @ParameterizedTest
    @EnumSource(value = InterpolationKind.class, names = {"LINEAR", "NEAREST", "CUBIC", "AKIMA"})
    void pointsOutsideTheSupportAreZero(InterpolationKind kind) {
        Spectrum out = ramp(10).interpWave(new double[]{5990, 6100}, kind);
        assertArrayEquals(new double[]{0, 0}, out.flux(), 0.0);
        assertArrayEquals(new double[]{0, 0}, out.error(), 0.0);
    }

    @Test
    void nearestPicksTheCloserNeighbour() {
        Spectrum s = Spectrum.of(new double[]{0, 1, 2}, new double[]{10, 20, 30}, new double[]{1, 2, 3});
        Spectrum out = s.interpWave(new double[]{0.4, 0.6, 1.5, 2.0}, InterpolationKind.NEAREST);
        assertArrayEquals(new double[]{10, 20, 20, 30}, out.flux(), 0.0);
        assertArrayEquals(new double[]{1, 2, 2, 3}, out.error(), 0.0);
    }

    @Test
    void descendingAxesAreAccepted() {
        Spectrum s = Spectrum.of(new double[]{3, 2, 1, 0}, new double[]{30, 20, 10, 0}, new double[]{0, 0, 0, 0});
        assertEquals(5.0, s.interpWave(new double[]{0.5}).fluxAt(0), 1e-12);
    }

    @Test
    void nonMonotonicAxesAreRejected() {
        Spectrum s = Spectrum.of(new double[]{0, 2, 1}, new double[]{1, 1, 1}, new double[]{0, 0, 0});
        assertThrows(IllegalArgumentException.class, () -> s.interpWave(new double[]{0.5}));
    }

    @Test
    void akimaNeedsFivePoints() {
        assertThrows(IllegalArgumentException.class,
            () -> ramp(4).interpWave(new double[]{6001}, InterpolationKind.AKIMA));
        assertDoesNotThrow(() -> ramp(5).interpWave(new double[]{6001}, InterpolationKind.AKIMA));
    }

    @ParameterizedTest
    @EnumSource(value = InterpolationKind.class, names = {"CUBIC", "AKIMA"})
    void splineErrorsNeverGoNegativeAroundASpike(InterpolationKind kind) {
        double[] x = new double[10];
        double[] y = new double[10];
        double[] e = new double[10];
        for (int i = 0; i < 10; i++) {
            x[i] = 5000 + i;
            y[i] = 1.0;
        }
        e[4] = 1.0;
        Spectrum s = Spectrum.of(x, y, e);
        double[] grid = new double[91];
        for (int j = 0; j < grid.length; j++) {
            grid[j] = 5000 + j / 10.0;
        }
        Spectrum out = assertDoesNotThrow(() -> s.interpWave(grid, kind));
        for (int j = 0; j < grid.length; j++) {
            assertTrue(out.errorAt(j) >= 0.0, kind + " error at " + grid[j] + ": " + out.errorAt(j));
        }
        assertEquals(1.0, out.errorAt(40), 1e-9);
        assertEquals(1.0, out.fluxAt(25), 1e-9);
    }

    @Test
    void sincOnTheSourceGridReproducesSamples() {
        Spectrum s = ramp(16);
        Spectrum out = s.interpWave(s.wavelength(), InterpolationKind.SINC);
        assertArrayEquals(s.flux(), out.flux(), 1e-9);
        assertArrayEquals(s.error(), out.error(), 1e-9);
    }

    @Test
    void sincErrorAddsKernelWeightsInQuadrature() {
        Spectrum s = Spectrum.of(new double[]{0, 1, 2, 3}, new double[]{0, 0, 0, 0}, new double[]{1, 1, 1, 1});
        Spectrum out = s.interpWave(new double[]{1.5}, InterpolationKind.SINC);
        double sum = 0;
        for (int i = 0; i < 4; i++) {
            double u = Math.PI * (1.5 - i);
            double w = Math.sin(u) / u;
            sum += w * w;
        }
        assertEquals(Math.sqrt(sum), out.errorAt(0), 1e-12);
    }

    @Test
    void targetSpectrumMustShareTheMedium() {
        Spectrum air = ramp(10);
        Spectrum vac = air.withMedium(WavelengthMedium.VACUUM);
        assertThrows(IncompatibleSpectraException.class, () -> air.interpWave(vac, InterpolationKind.LINEAR));
        assertEquals(10, air.interpWave(air, InterpolationKind.LINEAR).size());
    }

    @Test
    void interpolationHelpers() {
        double[] x = {0, 1, 2};
        double[] y = {0, 10, 40};
        assertArrayEquals(new double[]{-1, 5, 25, -1}, Interpolation.linear(x, y, new double[]{-0.5, 0.5, 1.5, 3}, -1), 0.0);
        assertArrayEquals(new double[]{0, 40}, Interpolation.linearClamped(x, y, new double[]{-3, 9}), 0.0);
        assertEquals(1024, Interpolation.nextPowerOfTwo(1000));
        assertEquals(1, Interpolation.nextPowerOfTwo(1));
        assertEquals(InterpolationKind.AKIMA, InterpolationKind.parse("akima"));
    }
}
