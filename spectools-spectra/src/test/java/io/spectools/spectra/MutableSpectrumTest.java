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
import io.spectools.spectra.units.VelocityUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MutableSpectrumTest {

    @Test
    void chainedOperationsReplaceTheHeldSpectrum() {
        Spectrum air = Spectrum.of(new double[]{5000, 5001, 5002}, new double[]{2, 4, 6}, new double[]{1, 1, 1});
        MutableSpectrum m = new MutableSpectrum(air);
        m.airToVac().normPercentile(100);
        assertEquals(WavelengthMedium.VACUUM, m.get().medium());
        assertEquals(1.0, m.get().fluxAt(2), 1e-12);
        assertEquals(WavelengthMedium.AIR, air.medium());
    }

    @Test
    void failedOperationKeepsPreviousValue() {
        Spectrum nm = Spectrum.builder()
            .wavelength(new double[]{500, 501})
            .flux(new double[]{1, 1})
            .wavelengthUnit(Units.NANOMETER)
            .build();
        MutableSpectrum m = new MutableSpectrum(nm);
        assertThrows(IllegalStateException.class, m::airToVac);
        assertSame(nm, m.get());
        assertThrows(IllegalArgumentException.class, () -> m.applyRedshift(2.0, VelocityUnit.FRACTION_OF_C));
        assertSame(nm, m.get());
    }
}
