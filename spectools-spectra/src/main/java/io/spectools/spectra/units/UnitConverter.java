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
import io.spectools.spectra.profiles.Ccm89Extinction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Unit-aware transformations of a spectrum's wavelength axis and flux values.
 *
 * <h2>Equivalences</h2>
 *
 * <ul>
 *   <li><b>spectral</b>: a wavelength axis may be expressed as a length,
 *       frequency, photon energy or wavenumber, related by λ = c/ν = hc/E = 1/k.
 *       Array order is preserved, so converting to frequency reverses the sense
 *       of a monotonic axis.</li>
 *   <li><b>spectral density</b>: F_ν = F_λ·λ²/c, evaluated with each pixel's own
 *       wavelength. Errors are multiplied by the same per-pixel factor.</li>
 *   <li><b>AB maggies</b>: the {@code mag} unit holds F_ν / 3631 Jy.</li>
 * </ul>
 *
 * <h2>Media</h2>
 *
 * <p>Air/vacuum conversions act on Ångström wavelengths only; any other axis
 * unit is a state error and the caller must convert units first.
 */
public final class UnitConverter {

    private static final Logger logger = LogManager.getLogger(UnitConverter.class);

    private UnitConverter() {
    }

    // ---------------------------------------------------------------- wavelength axis

    /**
     * Re-expresses the wavelength axis in another spectral unit. Flux and error are untouched.
     *
     * @throws UnitConversionException if the target is not a length, frequency, energy or wavenumber
     */
    public static Spectrum convertWavelength(Spectrum spectrum, Unit target) {
        Objects.requireNonNull(target, "target cannot be null");
        Unit source = spectrum.wavelengthUnit();
        if (!target.kind().isSpectralAxis()) {
            throw new UnitConversionException(source, target);
        }
        double[] x = spectrum.wavelength();
        double[] converted = new double[x.length];
        if (source.kind() == target.kind()) {
            double factor = source.factorTo(target);
            for (int i = 0; i < x.length; i++) {
                converted[i] = x[i] * factor;
            }
        } else {
            for (int i = 0; i < x.length; i++) {
                converted[i] = fromMeters(toMeters(x[i], source), target);
            }
        }
        return spectrum.withWavelength(converted, target);
    }

    /**
     * Converts a spectral-axis value to a wavelength in metres.
     *
     * @param value the value in {@code unit}
     * @param unit a length, frequency, energy or wavenumber unit
     * @return the equivalent wavelength, m
     */
    public static double toMeters(double value, Unit unit) {
        double si = value * unit.scale();
        return switch (unit.kind()) {
            case LENGTH -> si;
            case FREQUENCY -> PhysicalConstants.SPEED_OF_LIGHT / si;
            case ENERGY -> PhysicalConstants.PLANCK * PhysicalConstants.SPEED_OF_LIGHT / si;
            case WAVENUMBER -> 1.0 / si;
            default -> throw new UnitConversionException("'" + unit + "' is not a spectral axis unit");
        };
    }

    /// Inverse of [#toMeters(double, Unit)].
    public static double fromMeters(double meters, Unit unit) {
        double si = switch (unit.kind()) {
            case LENGTH -> meters;
            case FREQUENCY -> PhysicalConstants.SPEED_OF_LIGHT / meters;
            case ENERGY -> PhysicalConstants.PLANCK * PhysicalConstants.SPEED_OF_LIGHT / meters;
            case WAVENUMBER -> 1.0 / meters;
            default -> throw new UnitConversionException("'" + unit + "' is not a spectral axis unit");
        };
        return si / unit.scale();
    }

    // ---------------------------------------------------------------- flux

    /**
     * Converts flux and error to another flux unit.
     *
     * <p>Per-wavelength and per-frequency densities convert through each pixel's
     * wavelength. Converting to {@code mag} goes through Jy and divides by 3631;
     * converting from {@code mag} multiplies by 3631 Jy first.
     *
     * @throws UnitConversionException if no equivalence links the two units
     */
    public static Spectrum convertFlux(Spectrum spectrum, Unit target) {
        Objects.requireNonNull(target, "target cannot be null");
        Unit source = spectrum.fluxUnit();
        if (source.isAbMaggy() && target.isAbMaggy()) {
            return spectrum.withFlux(spectrum.flux(), spectrum.error(), target);
        }
        if (source.isAbMaggy()) {
            Spectrum jansky = spectrum.multiply(PhysicalConstants.AB_REFERENCE_JANSKY);
            jansky = jansky.withFlux(jansky.flux(), jansky.error(), Units.JANSKY);
            return convertFlux(jansky, target);
        }
        if (target.isAbMaggy()) {
            Spectrum jansky = convertFlux(spectrum, Units.JANSKY);
            Spectrum maggies = jansky.divide(PhysicalConstants.AB_REFERENCE_JANSKY);
            return maggies.withFlux(maggies.flux(), maggies.error(), target);
        }

        double[] y = spectrum.flux();
        double[] e = spectrum.error();
        if (source.dimension().sameAs(target.dimension())) {
            double factor = source.factorTo(target);
            for (int i = 0; i < y.length; i++) {
                y[i] *= factor;
                e[i] *= factor;
            }
            return spectrum.withFlux(y, e, target);
        }

        UnitKind from = source.kind();
        UnitKind to = target.kind();
        boolean lambdaToNu = from == UnitKind.FLUX_PER_WAVELENGTH && to == UnitKind.FLUX_PER_FREQUENCY;
        boolean nuToLambda = from == UnitKind.FLUX_PER_FREQUENCY && to == UnitKind.FLUX_PER_WAVELENGTH;
        if (!lambdaToNu && !nuToLambda) {
            throw new UnitConversionException(source, target);
        }
        Unit axis = spectrum.wavelengthUnit();
        double scale = source.scale() / target.scale();
        for (int i = 0; i < y.length; i++) {
            double lambda = toMeters(spectrum.wavelengthAt(i), axis);
            double factor = lambdaToNu
                ? scale * lambda * lambda / PhysicalConstants.SPEED_OF_LIGHT
                : scale * PhysicalConstants.SPEED_OF_LIGHT / (lambda * lambda);
            y[i] *= factor;
            e[i] *= factor;
        }
        return spectrum.withFlux(y, e, target);
    }

    /// Converts erg s⁻¹ cm⁻² Å⁻¹ (or any per-wavelength density) to Jy.
    public static Spectrum fluxLambdaToNu(Spectrum spectrum) {
        if (spectrum.fluxUnit().kind() != UnitKind.FLUX_PER_WAVELENGTH) {
            throw new UnitConversionException("expected a per-wavelength flux density, got '"
                + spectrum.fluxUnit() + "'");
        }
        return convertFlux(spectrum, Units.JANSKY);
    }

    /// Converts Jy (or any per-frequency density) to erg s⁻¹ cm⁻² Å⁻¹.
    public static Spectrum fluxNuToLambda(Spectrum spectrum) {
        if (spectrum.fluxUnit().kind() != UnitKind.FLUX_PER_FREQUENCY) {
            throw new UnitConversionException("expected a per-frequency flux density, got '"
                + spectrum.fluxUnit() + "'");
        }
        return convertFlux(spectrum, Units.FLAMBDA_CGS);
    }

    // ---------------------------------------------------------------- media

    /**
     * Converts air wavelengths to vacuum. A spectrum already on vacuum wavelengths
     * is returned unchanged.
     *
     * @throws IllegalStateException if the wavelength unit is not Å
     */
    public static Spectrum airToVac(Spectrum spectrum) {
        return toMedium(spectrum, WavelengthMedium.VACUUM);
    }

    /**
     * Converts vacuum wavelengths to air. A spectrum already on air wavelengths
     * is returned unchanged.
     *
     * @throws IllegalStateException if the wavelength unit is not Å
     */
    public static Spectrum vacToAir(Spectrum spectrum) {
        return toMedium(spectrum, WavelengthMedium.AIR);
    }

    public static Spectrum toMedium(Spectrum spectrum, WavelengthMedium target) {
        Objects.requireNonNull(target, "target cannot be null");
        if (spectrum.medium() == target) {
            logger.info("Spectrum '{}' is already on {} wavelengths; nothing to convert",
                spectrum.name(), target.label());
            return spectrum;
        }
        requireAngstrom(spectrum);
        double[] x = target == WavelengthMedium.VACUUM
            ? AirVacuum.airToVac(spectrum.wavelength())
            : AirVacuum.vacToAir(spectrum.wavelength());
        return spectrum.withWavelength(x, spectrum.wavelengthUnit()).withMedium(target);
    }

    private static void requireAngstrom(Spectrum spectrum) {
        if (!spectrum.wavelengthUnit().isEquivalentTo(Units.ANGSTROM)) {
            throw new IllegalStateException("Air/vacuum conversion needs wavelengths in Angstrom, got '"
                + spectrum.wavelengthUnit() + "'; convert units first");
        }
    }

    // ---------------------------------------------------------------- physical effects

    /**
     * Doppler-shifts the wavelengths by the relativistic factor sqrt((1+β)/(1−β)).
     * Air wavelengths are shifted in vacuum and converted back. Vacuum axes may be
     * in any spectral unit; frequency, energy and wavenumber axes shift inversely.
     *
     * @param velocity the line-of-sight velocity, positive for recession
     * @param unit the velocity unit
     * @throws IllegalArgumentException if |β| ≥ 1
     * @throws IllegalStateException if an air spectrum is not in Å
     */
    public static Spectrum applyRedshift(Spectrum spectrum, double velocity, VelocityUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        double beta = unit.toBeta(velocity);
        if (!(Math.abs(beta) < 1)) {
            throw new IllegalArgumentException("velocity must be below the speed of light, got beta: " + beta);
        }
        double factor = Math.sqrt((1 + beta) / (1 - beta));
        Unit axis = spectrum.wavelengthUnit();
        double[] x = spectrum.wavelength();
        if (spectrum.medium() == WavelengthMedium.AIR) {
            requireAngstrom(spectrum);
            x = AirVacuum.airToVac(x);
            for (int i = 0; i < x.length; i++) {
                x[i] *= factor;
            }
            x = AirVacuum.vacToAir(x);
        } else {
            for (int i = 0; i < x.length; i++) {
                x[i] = fromMeters(toMeters(x[i], axis) * factor, axis);
            }
        }
        return spectrum.withWavelength(x, spectrum.wavelengthUnit());
    }

    /**
     * Applies Cardelli, Clayton &amp; Mathis (1989) extinction:
     * {@code A(λ) = Rv·E(B−V)·(A_λ/A_V)(x, Rv)} with x the inverse vacuum
     * wavelength in µm⁻¹; flux and error are multiplied by 10^(−0.4A).
     *
     * @param ebv colour excess E(B−V)
     * @param rv total-to-selective extinction ratio
     * @throws IllegalStateException if an air spectrum is not in Å
     */
    public static Spectrum redden(Spectrum spectrum, double ebv, double rv) {
        if (!(rv > 0)) {
            throw new IllegalArgumentException("rv must be positive, got: " + rv);
        }
        Unit axis = spectrum.wavelengthUnit();
        double[] vacuum = spectrum.wavelength();
        if (spectrum.medium() == WavelengthMedium.AIR) {
            requireAngstrom(spectrum);
            vacuum = AirVacuum.airToVac(vacuum);
        }
        double[] y = spectrum.flux();
        double[] e = spectrum.error();
        for (int i = 0; i < y.length; i++) {
            double inverseMicron = 1e-6 / toMeters(vacuum[i], axis);
            double extinction = rv * ebv * Ccm89Extinction.alambdaOverAv(inverseMicron, rv);
            double attenuation = Math.pow(10.0, -0.4 * extinction);
            y[i] *= attenuation;
            e[i] *= attenuation;
        }
        return spectrum.withFlux(y, e);
    }
}
