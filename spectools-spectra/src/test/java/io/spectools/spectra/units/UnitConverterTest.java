package io.spectools.spectra.units;

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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

public class UnitConverterTest {

    private static Spectrum optical() {
        return Spectrum.builder()
            .wavelength(new double[]{4000, 5000, 6000})
            .flux(new double[]{1e-15, 1e-15, 1e-15})
            .error(new double[]{1e-16, 1e-16, 1e-16})
            .name("optical")
            .build();
    }

    @Test
    void airVacuumRoundTrip() {
        double air = AirVacuum.vacToAir(5000.0);
        assertThat(air).isLessThan(5000.0);
        assertEquals(5000.0, AirVacuum.airToVac(air), 5000.0 * 1e-6);
        assertEquals(5000.0, AirVacuum.vacToAir(AirVacuum.airToVac(5000.0)), 5000.0 * 1e-6);
    }

    @Test
    void vacuumWavelengthsAreLongerByAboutOnePartIn3600() {
        Spectrum vac = optical().airToVac();
        assertEquals(WavelengthMedium.VACUUM, vac.medium());
        assertThat(vac.wavelengthAt(1) - 5000.0).isCloseTo(1.39, within(0.02));
        Spectrum back = vac.vacToAir();
        assertArrayEquals(optical().wavelength(), back.wavelength(), 1e-6);
        assertEquals(WavelengthMedium.AIR, back.medium());
    }

    @Test
    void convertingToCurrentMediumIsANoOp() {
        Spectrum s = optical();
        assertSame(s, s.vacToAir());
        assertSame(s, s.toMedium(WavelengthMedium.AIR));
        Spectrum vac = s.airToVac();
        assertSame(vac, vac.airToVac());
    }

    @Test
    void mediumConversionRequiresAngstrom() {
        Spectrum nm = optical().convertWavelengthUnit(Units.NANOMETER);
        IllegalStateException e = assertThrows(IllegalStateException.class, nm::airToVac);
        assertThat(e.getMessage()).contains("convert units first");
    }

    @Test
    void wavelengthAxisConvertsAcrossEquivalences() {
        Spectrum nm = optical().convertWavelengthUnit("nm");
        assertArrayEquals(new double[]{400, 500, 600}, nm.wavelength(), 1e-9);

        Spectrum hz = optical().convertWavelengthUnit(Units.HERTZ);
        assertEquals(PhysicalConstants.SPEED_OF_LIGHT / 5000e-10, hz.wavelengthAt(1), 1e3);

        Spectrum ev = optical().convertWavelengthUnit(Units.ELECTRON_VOLT);
        assertEquals(2.4797, ev.wavelengthAt(1), 1e-3);

        Spectrum k = optical().convertWavelengthUnit(Units.INVERSE_MICRON);
        assertEquals(2.0, k.wavelengthAt(1), 1e-12);

        Spectrum back = hz.convertWavelengthUnit(Units.ANGSTROM);
        assertArrayEquals(optical().wavelength(), back.wavelength(), 1e-6);
        assertArrayEquals(optical().flux(), back.flux(), 0.0);
    }

    @Test
    void fluxDensityUsesEachPixelsWavelength() {
        Spectrum jy = optical().convertFluxUnit(Units.JANSKY);
        for (int i = 0; i < 3; i++) {
            double lambda = optical().wavelengthAt(i);
            double expected = 1e-15 * lambda * lambda / 2.99792458e18 * 1e23;
            assertEquals(expected, jy.fluxAt(i), expected * 1e-9);
            assertEquals(expected / 10, jy.errorAt(i), expected * 1e-9);
        }
        Spectrum back = jy.convertFluxUnit(Units.FLAMBDA_CGS);
        assertArrayEquals(optical().flux(), back.flux(), 1e-24);
        assertEquals(Units.FLAMBDA_CGS, back.fluxUnit());
    }

    @Test
    void fluxDensityWorksOnAFrequencyAxis() {
        Spectrum hz = optical().convertWavelengthUnit(Units.HERTZ);
        Spectrum viaHz = hz.convertFluxUnit(Units.JANSKY);
        Spectrum viaAngstrom = optical().convertFluxUnit(Units.JANSKY);
        assertArrayEquals(viaAngstrom.flux(), viaHz.flux(), 1e-12);
    }

    @Test
    void magnitudeTargetIsTheAbMaggy() {
        Spectrum jy = Spectrum.builder()
            .wavelength(new double[]{5000})
            .flux(new double[]{3631})
            .error(new double[]{36.31})
            .fluxUnit(Units.JANSKY)
            .build();
        Spectrum maggies = jy.convertFluxUnit("mag");
        assertEquals(1.0, maggies.fluxAt(0), 1e-12);
        assertEquals(0.01, maggies.errorAt(0), 1e-12);
        assertTrue(maggies.fluxUnit().isAbMaggy());

        Spectrum back = maggies.convertFluxUnit(Units.JANSKY);
        assertEquals(3631.0, back.fluxAt(0), 1e-9);
    }

    @Test
    void incompatibleFluxUnitsAreRejected() {
        assertThrows(UnitConversionException.class, () -> optical().convertFluxUnit("erg/s"));
        assertThrows(UnitConversionException.class, () -> optical().convertWavelengthUnit("Jy"));
    }

    @Test
    void shortcutsMatchTheGeneralConversion() {
        Spectrum jy = UnitConverter.fluxLambdaToNu(optical());
        assertArrayEquals(optical().convertFluxUnit(Units.JANSKY).flux(), jy.flux(), 0.0);
        assertArrayEquals(optical().flux(), UnitConverter.fluxNuToLambda(jy).flux(), 1e-24);
        assertThrows(UnitConversionException.class, () -> UnitConverter.fluxNuToLambda(optical()));
    }

    @Test
    void redshiftStretchesVacuumWavelengths() {
        Spectrum vac = optical().withMedium(WavelengthMedium.VACUUM);
        double beta = 0.01;
        Spectrum shifted = vac.applyRedshift(beta, VelocityUnit.FRACTION_OF_C);
        double factor = Math.sqrt((1 + beta) / (1 - beta));
        assertArrayEquals(new double[]{4000 * factor, 5000 * factor, 6000 * factor}, shifted.wavelength(), 1e-9);

        Spectrum kms = vac.applyRedshift(beta * PhysicalConstants.SPEED_OF_LIGHT_KMS, VelocityUnit.KM_PER_S);
        assertArrayEquals(shifted.wavelength(), kms.wavelength(), 1e-9);
    }

    @Test
    void redshiftOfAirSpectrumStaysInAir() {
        Spectrum shifted = optical().applyRedshift(300.0, VelocityUnit.KM_PER_S);
        assertEquals(WavelengthMedium.AIR, shifted.medium());
        double beta = 300.0 / PhysicalConstants.SPEED_OF_LIGHT_KMS;
        double expectedVac = AirVacuum.airToVac(5000.0) * Math.sqrt((1 + beta) / (1 - beta));
        assertEquals(AirVacuum.vacToAir(expectedVac), shifted.wavelengthAt(1), 1e-6);
        assertThrows(IllegalArgumentException.class, () -> optical().applyRedshift(-1.0, VelocityUnit.FRACTION_OF_C));
    }

    @Test
    void reddeningAttenuatesByCcmLaw() {
        Spectrum vac = Spectrum.builder()
            .wavelength(new double[]{1e4 / 1.82})
            .flux(new double[]{1.0})
            .error(new double[]{0.1})
            .medium(WavelengthMedium.VACUUM)
            .build();
        Spectrum red = vac.redden(0.1, 3.1);
        double expected = Math.pow(10, -0.4 * 0.31);
        assertEquals(expected, red.fluxAt(0), 1e-9);
        assertEquals(0.1 * expected, red.errorAt(0), 1e-9);
        assertEquals(1.0, vac.redden(0.0).fluxAt(0), 0.0);
    }

    @Test
    void vacuumShiftsWorkInAnySpectralUnit() {
        Spectrum vac = optical().withMedium(WavelengthMedium.VACUUM);
        double beta = 0.01;
        double factor = Math.sqrt((1 + beta) / (1 - beta));

        Spectrum nm = vac.convertWavelengthUnit(Units.NANOMETER).applyRedshift(beta, VelocityUnit.FRACTION_OF_C);
        assertArrayEquals(new double[]{400 * factor, 500 * factor, 600 * factor}, nm.wavelength(), 1e-9);
        assertEquals(Units.NANOMETER, nm.wavelengthUnit());

        Spectrum hz = vac.convertWavelengthUnit(Units.HERTZ);
        Spectrum hzShifted = hz.applyRedshift(beta, VelocityUnit.FRACTION_OF_C);
        assertEquals(hz.wavelengthAt(1) / factor, hzShifted.wavelengthAt(1), hz.wavelengthAt(1) * 1e-12);
    }

    @Test
    void reddeningReadsVacuumAxesInAnyLengthUnit() {
        Spectrum vac = optical().withMedium(WavelengthMedium.VACUUM);
        Spectrum inAngstrom = vac.redden(0.2, 3.1);
        Spectrum inNm = vac.convertWavelengthUnit(Units.NANOMETER).redden(0.2, 3.1);
        assertArrayEquals(inAngstrom.flux(), inNm.flux(), 1e-24);
        assertArrayEquals(inAngstrom.error(), inNm.error(), 1e-25);
        assertThat(inNm.fluxAt(0)).isLessThan(inNm.fluxAt(2));
    }

    @Test
    void airShiftsStillRequireAngstrom() {
        Spectrum airNm = optical().convertWavelengthUnit(Units.NANOMETER);
        assertThrows(IllegalStateException.class, () -> airNm.applyRedshift(100.0, VelocityUnit.KM_PER_S));
        assertThrows(IllegalStateException.class, () -> airNm.redden(0.1));
    }
}
