package io.spectools.spectra.arith;

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
import io.spectools.spectra.config.SpectraSettings;
import io.spectools.spectra.units.Unit;
import io.spectools.spectra.units.UnitKind;
import io.spectools.spectra.units.Units;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SpectrumArithmeticTest {

    private static final double[] X = {5000, 5001, 5002};

    private static Spectrum s1() {
        return Spectrum.of(X, new double[]{2, 4, 8}, new double[]{0.2, 0.4, 0.8}).withName("s1");
    }

    private static Spectrum s2() {
        return Spectrum.of(X, new double[]{1, 2, 4}, new double[]{0.3, 0.1, 0.2}).withName("s2");
    }

    @Test
    void addThenSubtractConstantRestoresFlux() {
        Spectrum s = s1();
        Spectrum back = s.add(3.5).subtract(3.5);
        assertArrayEquals(s.flux(), back.flux(), 1e-12);
        assertArrayEquals(s.error(), back.error(), 0.0);
        assertArrayEquals(s.wavelength(), back.wavelength(), 0.0);
        assertEquals("s1", back.name());
    }

    @Test
    void addingSpectraCombinesErrorsInQuadrature() {
        Spectrum sum = s1().add(s2());
        assertArrayEquals(new double[]{3, 6, 12}, sum.flux(), 1e-12);
        for (int i = 0; i < 3; i++) {
            assertEquals(Math.hypot(s1().errorAt(i), s2().errorAt(i)), sum.errorAt(i), 1e-12);
        }
        assertEquals("s1", sum.name());
        assertEquals(Units.FLAMBDA_CGS, sum.fluxUnit());
    }

    @Test
    void productErrorUsesRelativeErrors() {
        Spectrum product = s1().multiply(s2());
        for (int i = 0; i < 3; i++) {
            double y1 = s1().fluxAt(i);
            double y2 = s2().fluxAt(i);
            double expected = Math.abs(y1 * y2) * Math.hypot(s1().errorAt(i) / y1, s2().errorAt(i) / y2);
            assertEquals(y1 * y2, product.fluxAt(i), 1e-12);
            assertEquals(expected, product.errorAt(i), 1e-12);
        }
        assertThat(product.fluxUnit().kind()).isEqualTo(UnitKind.OTHER);
        assertTrue(product.fluxUnit().isEquivalentTo(Units.FLAMBDA_CGS.pow(2)));
    }

    @Test
    void ratioOfSameUnitsIsDimensionless() {
        Spectrum ratio = s1().divide(s2());
        assertArrayEquals(new double[]{2, 2, 2}, ratio.flux(), 1e-12);
        assertEquals(UnitKind.DIMENSIONLESS, ratio.fluxUnit().kind());
        double expected = 2 * Math.hypot(0.2 / 2, 0.3 / 1);
        assertEquals(expected, ratio.errorAt(0), 1e-12);
    }

    @Test
    void constantsScaleErrorsByMagnitude() {
        Spectrum s = s1().multiply(-2.0);
        assertArrayEquals(new double[]{-4, -8, -16}, s.flux(), 1e-12);
        assertArrayEquals(new double[]{0.4, 0.8, 1.6}, s.error(), 1e-12);
        Spectrum d = s1().divide(-4.0);
        assertArrayEquals(new double[]{0.05, 0.1, 0.2}, d.error(), 1e-12);
    }

    @Test
    void arrayOperandsApplyPerPixel() {
        Spectrum s = s1().multiply(new double[]{1, 2, 3});
        assertArrayEquals(new double[]{2, 8, 24}, s.flux(), 1e-12);
        assertArrayEquals(new double[]{0.2, 0.8, 2.4}, s.error(), 1e-12);
        assertThrows(IncompatibleSpectraException.class, () -> s1().add(new double[]{1, 2}));
    }

    @Test
    void reflectedSubtractionNegatesTheDifference() {
        Spectrum r = s1().rsubtract(10.0);
        assertArrayEquals(new double[]{8, 6, 2}, r.flux(), 1e-12);
        assertArrayEquals(s1().error(), r.error(), 0.0);
        assertArrayEquals(r.flux(), s1().subtract(10.0).negate().flux(), 1e-12);
    }

    @Test
    void reflectedDivisionInvertsTheUnit() {
        Spectrum r = s1().rdivide(8.0);
        assertArrayEquals(new double[]{4, 2, 1}, r.flux(), 1e-12);
        assertArrayEquals(new double[]{8 * 0.2 / 4, 8 * 0.4 / 16, 8 * 0.8 / 64}, r.error(), 1e-12);
        Unit expected = Units.FLAMBDA_CGS.inverse();
        assertTrue(r.fluxUnit().isEquivalentTo(expected));
    }

    @Test
    void reflectedAddAndMultiplyCommute() {
        assertArrayEquals(s1().add(2.0).flux(), s1().radd(2.0).flux(), 0.0);
        assertArrayEquals(s1().multiply(3.0).error(), s1().rmultiply(3.0).error(), 0.0);
    }

    @Test
    void powerPropagatesRelativeError() {
        Spectrum squared = s1().pow(2);
        assertArrayEquals(new double[]{4, 16, 64}, squared.flux(), 1e-12);
        assertArrayEquals(new double[]{0.8, 3.2, 12.8}, squared.error(), 1e-12);
        assertTrue(squared.fluxUnit().isEquivalentTo(Units.FLAMBDA_CGS.pow(2)));
        Spectrum root = s1().pow(-0.5);
        assertEquals(Math.abs(-0.5 * Math.pow(2, -0.5) * 0.2 / 2), root.errorAt(0), 1e-12);
    }

    @Test
    void negateAndAbsKeepErrors() {
        Spectrum neg = s1().negate();
        assertArrayEquals(new double[]{-2, -4, -8}, neg.flux(), 0.0);
        assertArrayEquals(s1().error(), neg.error(), 0.0);
        assertArrayEquals(s1().flux(), neg.abs().flux(), 0.0);
    }

    @Test
    void combinedWavelengthIsTheMean() {
        Spectrum shifted = Spectrum.of(new double[]{5000.01, 5001.01, 5002.01}, new double[]{1, 1, 1},
            new double[]{0, 0, 0});
        Spectrum sum = s1().add(shifted);
        assertArrayEquals(new double[]{5000.005, 5001.005, 5002.005}, sum.wavelength(), 1e-9);
    }

    @Test
    void rejectsIncompatibleSpectra() {
        Spectrum shortOne = Spectrum.of(new double[]{5000, 5001}, new double[]{1, 1}, new double[]{0, 0});
        IncompatibleSpectraException e = assertThrows(IncompatibleSpectraException.class, () -> s1().add(shortOne));
        assertEquals("s1", e.getLeftName());

        Spectrum farGrid = Spectrum.of(new double[]{6000, 6001, 6002}, new double[]{1, 1, 1}, new double[]{0, 0, 0});
        assertThrows(IncompatibleSpectraException.class, () -> s1().subtract(farGrid));

        Spectrum jansky = s2().withFlux(s2().flux(), s2().error(), Units.JANSKY);
        assertThrows(IncompatibleSpectraException.class, () -> s1().add(jansky));
        assertThrows(IncompatibleSpectraException.class, () -> s1().multiply(jansky));
        assertThrows(IncompatibleSpectraException.class, () -> s1().divide(jansky));

        Spectrum plain = s2().withFlux(s2().flux(), s2().error(), Units.DIMENSIONLESS);
        IncompatibleSpectraException mixed =
            assertThrows(IncompatibleSpectraException.class, () -> s1().multiply(plain));
        assertThat(mixed.getMessage()).contains("flux units differ");
    }

    @Test
    void strictEngineRejectsMixedMedia() {
        SpectrumArithmetic strict = new SpectrumArithmetic(SpectraSettings.defaults(), true);
        Spectrum vac = s2().withMedium(WavelengthMedium.VACUUM);
        assertThrows(IncompatibleSpectraException.class,
            () -> strict.apply(s1(), ArithmeticOp.ADD, Operand.spectrum(vac)));
        assertDoesNotThrow(() -> SpectrumArithmetic.DEFAULT.apply(s1(), ArithmeticOp.ADD, Operand.spectrum(vac)));
    }

    @Test
    void untypedOperandsAreClassified() {
        assertInstanceOf(Operand.Scalar.class, Operand.of(3));
        assertInstanceOf(Operand.Array.class, Operand.of(new double[]{1}));
        assertInstanceOf(Operand.SpectrumOperand.class, Operand.of(s1()));
        assertThrows(IllegalArgumentException.class, () -> Operand.of("two"));
        assertThrows(IllegalArgumentException.class, () -> Operand.of(null));
    }
}
