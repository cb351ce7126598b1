package io.spectools.spectra.photometry;

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
import io.spectools.spectra.config.SpectraSettings;
import io.spectools.spectra.resample.Interpolation;
import io.spectools.spectra.units.UnitKind;
import io.spectools.spectra.units.Units;
import io.spectools.spectra.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Synthetic AB magnitudes of a spectrum through a filter passband.
 *
 * <h2>Method</h2>
 *
 * <ol>
 *   <li>Fetch the filter curve and move it to the spectrum's medium.</li>
 *   <li>Express both on a frequency axis in Hz and the flux in Jy.</li>
 *   <li>Keep the spectrum pixels strictly inside the filter's frequency support
 *       and interpolate the transmission R linearly onto them.</li>
 *   <li>{@code m = −2.5·log10( ∫F_ν·R/ν dν / ∫R/ν dν ) + 8.90}, the photon-counting
 *       AB definition with F_ν in Jy.</li>
 * </ol>
 *
 * <h2>Errors</h2>
 *
 * <p>When the spectrum has non-zero errors and draws are requested, every draw
 * perturbs each flux by an independent Gaussian of width e, and the result is
 * the mean and population standard deviation of the drawn magnitudes. A model
 * spectrum (all errors zero) gets an exact magnitude with zero error.
 *
 * <pre>{@code
 * SyntheticPhotometry phot = new SyntheticPhotometry(catalogue, settings, RandomGenerators.create(42L));
 * AbMagnitude g = phot.magnitude(spectrum, "g");
 * }</pre>
 */
public final class SyntheticPhotometry {

    private static final Logger logger = LogManager.getLogger(SyntheticPhotometry.class);

    /// Zero point of the AB system for F_ν in Jy: 2.5·log10(3631).
    public static final double AB_ZERO_POINT_JY = 8.90;

    private final FilterCatalogue catalogue;
    private final int defaultDraws;
    private final IntegrationRule defaultRule;
    private final ContinuousSampler normal;

    public SyntheticPhotometry(FilterCatalogue catalogue, SpectraSettings settings, UniformRandomProvider rng) {
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue cannot be null");
        Objects.requireNonNull(settings, "settings cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");
        this.defaultDraws = settings.monteCarloDraws();
        this.defaultRule = IntegrationRule.parse(settings.integrationRule());
        this.normal = RandomGenerators.standardNormal(rng);
    }

    public SyntheticPhotometry(FilterCatalogue catalogue, SpectraSettings settings) {
        this(catalogue, settings, RandomGenerators.create(settings));
    }

    /// Magnitude with the configured number of draws and integration rule.
    public AbMagnitude magnitude(Spectrum spectrum, String filterId) {
        return magnitude(spectrum, filterId, defaultDraws, defaultRule);
    }

    /**
     * Computes the synthetic AB magnitude.
     *
     * @param spectrum the spectrum, with a spectral flux density unit
     * @param filterId filter identifier known to the catalogue
     * @param draws Monte-Carlo draws; 0 for an exact magnitude
     * @param rule quadrature rule
     * @throws UnsupportedFilterException if the filter is unknown
     * @throws IllegalArgumentException if fewer than two pixels fall inside the passband
     */
    public AbMagnitude magnitude(Spectrum spectrum, String filterId, int draws, IntegrationRule rule) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");
        if (draws < 0) {
            throw new IllegalArgumentException("draws must be non-negative, got: " + draws);
        }
        Passband band = passband(spectrum, catalogue.lookup(filterId));

        if (draws == 0 || band.hasZeroErrors()) {
            return AbMagnitude.exact(band.magnitude(band.flux, rule));
        }

        logger.debug("Monte-Carlo photometry through '{}' with {} draws over {} pixels",
            filterId, draws, band.frequency.length);
        double[] magnitudes = new double[draws];
        double[] perturbed = new double[band.flux.length];
        for (int d = 0; d < draws; d++) {
            for (int i = 0; i < perturbed.length; i++) {
                perturbed[i] = band.flux[i] + band.error[i] * normal.sample();
            }
            magnitudes[d] = band.magnitude(perturbed, rule);
        }
        double mean = 0;
        for (double m : magnitudes) {
            mean += m;
        }
        mean /= draws;
        double variance = 0;
        for (double m : magnitudes) {
            variance += (m - mean) * (m - mean);
        }
        return new AbMagnitude(mean, Math.sqrt(variance / draws), draws);
    }

    /**
     * The pivot wavelength {@code sqrt(∫R·λ dλ / ∫R/λ dλ)} of a curve, in the curve's units.
     */
    public static double pivotWavelength(FilterCurve curve, IntegrationRule rule) {
        double[] x = curve.wavelength();
        double[] r = curve.transmission();
        double[] rx = new double[x.length];
        double[] rOverX = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            rx[i] = r[i] * x[i];
            rOverX[i] = r[i] / x[i];
        }
        return Math.sqrt(rule.integrate(rx, x) / rule.integrate(rOverX, x));
    }

    public static double pivotWavelength(FilterCurve curve) {
        return pivotWavelength(curve, IntegrationRule.TRAPEZOID);
    }

    private Passband passband(Spectrum spectrum, FilterCurve curve) {
        UnitKind fluxKind = spectrum.fluxUnit().kind();
        if (!fluxKind.isFluxDensity() && !spectrum.fluxUnit().isAbMaggy()) {
            throw new IllegalArgumentException("photometry needs a spectral flux density, got: '"
                + spectrum.fluxUnit() + "'");
        }
        Spectrum filter = curve.toSpectrum();
        if (filter.medium() != spectrum.medium()) {
            filter = filter.convertWavelengthUnit(Units.ANGSTROM).toMedium(spectrum.medium());
        }
        filter = filter.convertWavelengthUnit(Units.HERTZ);
        Spectrum data = spectrum.convertFluxUnit(Units.JANSKY).convertWavelengthUnit(Units.HERTZ);

        double[] fx = filter.wavelength();
        double[] fr = filter.flux();
        int[] fOrder = ascendingOrder(fx);
        double[] filterNu = permute(fx, fOrder);
        double[] filterR = permute(fr, fOrder);
        double lo = filterNu[0];
        double hi = filterNu[filterNu.length - 1];

        Spectrum inside = data.clip(lo, hi);
        if (inside.size() < 2) {
            throw new IllegalArgumentException("spectrum '" + spectrum.name() + "' has " + inside.size()
                + " pixels inside filter '" + curve.id() + "'; at least 2 are needed");
        }
        double[] nu = inside.wavelength();
        int[] order = ascendingOrder(nu);
        nu = permute(nu, order);
        double[] flux = permute(inside.flux(), order);
        double[] error = permute(inside.error(), order);
        double[] response = Interpolation.linear(filterNu, filterR, nu, 0.0);
        return new Passband(nu, flux, error, response);
    }

    private static int[] ascendingOrder(double[] values) {
        return IntStream.range(0, values.length)
            .boxed()
            .sorted(Comparator.comparingDouble(i -> values[i]))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    private static double[] permute(double[] values, int[] order) {
        double[] out = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            out[i] = values[order[i]];
        }
        return out;
    }

    /// Spectrum pixels inside a passband, on ascending frequency, with the response at each.
    private static final class Passband {
        private final double[] frequency;
        private final double[] flux;
        private final double[] error;
        private final double[] weight;

        private Passband(double[] frequency, double[] flux, double[] error, double[] response) {
            this.frequency = frequency;
            this.flux = flux;
            this.error = error;
            this.weight = new double[frequency.length];
            for (int i = 0; i < frequency.length; i++) {
                weight[i] = response[i] / frequency[i];
            }
        }

        boolean hasZeroErrors() {
            return Arrays.stream(error).allMatch(e -> e == 0);
        }

        double magnitude(double[] fnu, IntegrationRule rule) {
            double[] integrand = new double[fnu.length];
            for (int i = 0; i < fnu.length; i++) {
                integrand[i] = fnu[i] * weight[i];
            }
            double mean = rule.integrate(integrand, frequency) / rule.integrate(weight, frequency);
            return -2.5 * Math.log10(mean) + AB_ZERO_POINT_JY;
        }
    }
}
