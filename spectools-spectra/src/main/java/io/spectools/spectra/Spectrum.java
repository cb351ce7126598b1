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

import io.spectools.spectra.arith.ArithmeticOp;
import io.spectools.spectra.arith.Operand;
import io.spectools.spectra.arith.SpectrumArithmetic;
import io.spectools.spectra.config.SpectraSettings;
import io.spectools.spectra.convolve.GaussianConvolver;
import io.spectools.spectra.fit.ModelScaler;
import io.spectools.spectra.fit.ScaledModel;
import io.spectools.spectra.resample.InterpolationKind;
import io.spectools.spectra.resample.Resampler;
import io.spectools.spectra.units.Unit;
import io.spectools.spectra.units.UnitConverter;
import io.spectools.spectra.units.UnitKind;
import io.spectools.spectra.units.Units;
import io.spectools.spectra.units.VelocityUnit;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A one-dimensional spectrum: wavelengths, fluxes and flux uncertainties with
 * their units and wavelength medium.
 *
 * <h2>Value Semantics</h2>
 *
 * <p>A spectrum is immutable. Arrays are copied on the way in and on the way out,
 * and every transformation (arithmetic, resampling, convolution, unit or medium
 * conversion, masking) returns a new instance that keeps the name, units, medium
 * and metadata of the receiver unless the operation changes them. The metadata
 * map is the one exception: it is passed <em>by reference</em> into derived
 * spectra, so callers that need independent headers must copy it themselves
 * with {@link #withMetadata(Map)}. For code that wants to apply a sequence of
 * conversions to one handle, see {@link MutableSpectrum}.
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>wavelength, flux and error all have the same length N ≥ 0</li>
 *   <li>no error value is negative</li>
 *   <li>the wavelength unit is a length, frequency, energy or wavenumber</li>
 *   <li>a spectrum built through {@link Builder} has a flux unit that is a
 *       spectral flux density or dimensionless; arithmetic may derive other
 *       units by dimensional algebra (e.g. the inverse unit of {@code k / S})</li>
 * </ul>
 *
 * <h2>Arithmetic</h2>
 *
 * <p>Operators propagate independent Gaussian uncertainties; the rules live in
 * {@link ArithmeticOp}. Combining two spectra requires equal length, close
 * wavelength grids and equal units, and the result takes the mean of the two
 * wavelength arrays.
 *
 * <pre>{@code
 * Spectrum s = Spectrum.builder()
 *     .wavelength(x).flux(y).error(e)
 *     .name("WD1234").medium(WavelengthMedium.AIR)
 *     .build();
 *
 * Spectrum ratio = s.divide(continuum);          // errors combined in quadrature
 * Spectrum smooth = s.convolveGaussian(2.0);     // 2 Å FWHM
 * Spectrum vac = s.airToVac();
 * }</pre>
 *
 * @see SpectrumArithmetic
 * @see UnitConverter
 * @see Resampler
 */
public final class Spectrum implements Iterable<SpectrumPoint> {

    private final double[] wavelength;
    private final double[] flux;
    private final double[] error;
    private final String name;
    private final WavelengthMedium medium;
    private final Unit wavelengthUnit;
    private final Unit fluxUnit;
    private final Map<String, Object> metadata;

    private Spectrum(double[] wavelength, double[] flux, double[] error, String name,
                     WavelengthMedium medium, Unit wavelengthUnit, Unit fluxUnit,
                     Map<String, Object> metadata, boolean requireFluxDensity) {
        Objects.requireNonNull(wavelength, "wavelength cannot be null");
        Objects.requireNonNull(flux, "flux cannot be null");
        Objects.requireNonNull(error, "error cannot be null");
        Objects.requireNonNull(medium, "medium cannot be null");
        Objects.requireNonNull(wavelengthUnit, "wavelengthUnit cannot be null");
        Objects.requireNonNull(fluxUnit, "fluxUnit cannot be null");
        if (wavelength.length != flux.length || wavelength.length != error.length) {
            throw new IllegalArgumentException(String.format(
                "wavelength, flux and error must have equal lengths, got: %d, %d, %d",
                wavelength.length, flux.length, error.length));
        }
        for (int i = 0; i < error.length; i++) {
            if (error[i] < 0) {
                throw new IllegalArgumentException("error values must be non-negative, got: "
                    + error[i] + " at index " + i);
            }
        }
        if (!wavelengthUnit.kind().isSpectralAxis()) {
            throw new IllegalArgumentException("wavelength unit must be a length, frequency, energy or wavenumber, got: '"
                + wavelengthUnit + "' (" + wavelengthUnit.kind() + ")");
        }
        if (requireFluxDensity) {
            UnitKind kind = fluxUnit.kind();
            if (!kind.isFluxDensity() && kind != UnitKind.DIMENSIONLESS) {
                throw new IllegalArgumentException("flux unit must be a spectral flux density or dimensionless, got: '"
                    + fluxUnit + "' (" + kind + ")");
            }
        }
        this.wavelength = wavelength;
        this.flux = flux;
        this.error = error;
        this.name = name == null ? "" : name;
        this.medium = medium;
        this.wavelengthUnit = wavelengthUnit;
        this.fluxUnit = fluxUnit;
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an unnamed air-wavelength spectrum in Å and erg s⁻¹ cm⁻² Å⁻¹.
     *
     * @param wavelength wavelengths
     * @param flux fluxes
     * @param error flux uncertainties
     * @return the new spectrum
     */
    public static Spectrum of(double[] wavelength, double[] flux, double[] error) {
        return builder().wavelength(wavelength).flux(flux).error(error).build();
    }

    /**
     * Creates a noiseless model spectrum (all errors zero) on vacuum wavelengths.
     *
     * @param wavelength wavelengths in Å
     * @param flux model fluxes in erg s⁻¹ cm⁻² Å⁻¹
     * @return the new spectrum
     */
    public static Spectrum model(double[] wavelength, double[] flux) {
        return builder().wavelength(wavelength).flux(flux).medium(WavelengthMedium.VACUUM).build();
    }

    // ---------------------------------------------------------------- accessors

    public int size() {
        return wavelength.length;
    }

    public boolean isEmpty() {
        return wavelength.length == 0;
    }

    /// @return a copy of the wavelength array
    public double[] wavelength() {
        return wavelength.clone();
    }

    /// @return a copy of the flux array
    public double[] flux() {
        return flux.clone();
    }

    /// @return a copy of the error array
    public double[] error() {
        return error.clone();
    }

    public double wavelengthAt(int index) {
        return wavelength[index];
    }

    public double fluxAt(int index) {
        return flux[index];
    }

    public double errorAt(int index) {
        return error[index];
    }

    public String name() {
        return name;
    }

    public WavelengthMedium medium() {
        return medium;
    }

    public Unit wavelengthUnit() {
        return wavelengthUnit;
    }

    public Unit fluxUnit() {
        return fluxUnit;
    }

    /// @return the live metadata map shared with spectra derived from this one
    public Map<String, Object> metadata() {
        return metadata;
    }

    /// @return true if every error value is zero, as for a model spectrum
    public boolean hasZeroErrors() {
        for (double e : error) {
            if (e != 0) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- derivation

    /**
     * Returns a spectrum with new arrays and the units, medium, name and metadata of this one.
     *
     * @throws IllegalArgumentException if the arrays violate the spectrum invariants
     */
    public Spectrum withData(double[] newWavelength, double[] newFlux, double[] newError) {
        return new Spectrum(newWavelength.clone(), newFlux.clone(), newError.clone(), name,
            medium, wavelengthUnit, fluxUnit, metadata, false);
    }

    /// Returns a spectrum on the same wavelengths with new flux and error arrays.
    public Spectrum withFlux(double[] newFlux, double[] newError) {
        return withFlux(newFlux, newError, fluxUnit);
    }

    /**
     * Returns a spectrum on the same wavelengths with new flux and error arrays in
     * the given unit. The unit is not restricted to flux densities so that units
     * derived by arithmetic can be carried.
     */
    public Spectrum withFlux(double[] newFlux, double[] newError, Unit newFluxUnit) {
        return new Spectrum(wavelength.clone(), newFlux.clone(), newError.clone(), name,
            medium, wavelengthUnit, newFluxUnit, metadata, false);
    }

    /// Returns a spectrum with a new wavelength axis, keeping flux and error.
    public Spectrum withWavelength(double[] newWavelength, Unit newWavelengthUnit) {
        return new Spectrum(newWavelength.clone(), flux.clone(), error.clone(), name,
            medium, newWavelengthUnit, fluxUnit, metadata, false);
    }

    /// Relabels the medium without touching the wavelength values.
    public Spectrum withMedium(WavelengthMedium newMedium) {
        return new Spectrum(wavelength, flux, error, name, newMedium, wavelengthUnit, fluxUnit, metadata, false);
    }

    public Spectrum withName(String newName) {
        return new Spectrum(wavelength, flux, error, newName, medium, wavelengthUnit, fluxUnit, metadata, false);
    }

    public Spectrum withMetadata(Map<String, Object> newMetadata) {
        return new Spectrum(wavelength, flux, error, name, medium, wavelengthUnit, fluxUnit,
            new LinkedHashMap<>(newMetadata), false);
    }

    /// @return an independent copy sharing only the metadata map
    public Spectrum copy() {
        return withData(wavelength, flux, error);
    }

    // ---------------------------------------------------------------- indexing

    /**
     * Returns the pixel at the given index. Negative indices count from the end.
     *
     * @throws IndexOutOfBoundsException if the index is outside [-N, N)
     */
    public SpectrumPoint get(int index) {
        int i = index < 0 ? index + size() : index;
        if (i < 0 || i >= size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for spectrum of " + size() + " pixels");
        }
        return new SpectrumPoint(wavelength[i], flux[i], error[i]);
    }

    /**
     * Returns pixels {@code [from, to)}.
     *
     * @throws IndexOutOfBoundsException if the range is not within the spectrum
     */
    public Spectrum slice(int from, int to) {
        Objects.checkFromToIndex(from, to, size());
        return new Spectrum(Arrays.copyOfRange(wavelength, from, to), Arrays.copyOfRange(flux, from, to),
            Arrays.copyOfRange(error, from, to), name, medium, wavelengthUnit, fluxUnit, metadata, false);
    }

    /**
     * Returns the pixels whose mask entry is true.
     *
     * @throws IllegalArgumentException if the mask length differs from the spectrum length
     */
    public Spectrum select(boolean[] mask) {
        Objects.requireNonNull(mask, "mask cannot be null");
        if (mask.length != size()) {
            throw new IllegalArgumentException("mask length must equal spectrum length " + size() + ", got: " + mask.length);
        }
        int count = 0;
        for (boolean m : mask) {
            if (m) count++;
        }
        int[] indices = new int[count];
        int j = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) indices[j++] = i;
        }
        return select(indices);
    }

    /// Returns the pixels at the given indices, in the order given.
    public Spectrum select(int[] indices) {
        Objects.requireNonNull(indices, "indices cannot be null");
        double[] x = new double[indices.length];
        double[] y = new double[indices.length];
        double[] e = new double[indices.length];
        for (int k = 0; k < indices.length; k++) {
            int i = indices[k] < 0 ? indices[k] + size() : indices[k];
            Objects.checkIndex(i, size());
            x[k] = wavelength[i];
            y[k] = flux[i];
            e[k] = error[i];
        }
        return new Spectrum(x, y, e, name, medium, wavelengthUnit, fluxUnit, metadata, false);
    }

    /**
     * Iterates pixels in wavelength-array order. Each call returns a fresh iterator.
     */
    @Override
    public Iterator<SpectrumPoint> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < wavelength.length;
            }

            @Override
            public SpectrumPoint next() {
                if (next >= wavelength.length) {
                    throw new NoSuchElementException();
                }
                SpectrumPoint point = new SpectrumPoint(wavelength[next], flux[next], error[next]);
                next++;
                return point;
            }
        };
    }

    public Stream<SpectrumPoint> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /// Compares wavelength grids with the default closeness tolerances.
    public boolean isCloseTo(Spectrum other) {
        SpectraSettings defaults = SpectraSettings.defaults();
        return isCloseTo(other, defaults.closeRtol(), defaults.closeAtol());
    }

    /**
     * Returns true if both spectra have the same length and every pair of
     * wavelengths satisfies {@code |a - b| <= atol + rtol * |b|}.
     */
    public boolean isCloseTo(Spectrum other, double rtol, double atol) {
        return allClose(wavelength, other.wavelength, rtol, atol);
    }

    /// Elementwise closeness of two arrays; false when lengths differ.
    public static boolean allClose(double[] a, double[] b, double rtol, double atol) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (!(Math.abs(a[i] - b[i]) <= atol + rtol * Math.abs(b[i]))) {
                return false;
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- arithmetic

    public Spectrum add(double k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.ADD, Operand.scalar(k));
    }

    public Spectrum add(double[] k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.ADD, Operand.array(k));
    }

    public Spectrum add(Spectrum other) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.ADD, Operand.spectrum(other));
    }

    public Spectrum subtract(double k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.SUB, Operand.scalar(k));
    }

    public Spectrum subtract(double[] k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.SUB, Operand.array(k));
    }

    public Spectrum subtract(Spectrum other) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.SUB, Operand.spectrum(other));
    }

    public Spectrum multiply(double k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.MUL, Operand.scalar(k));
    }

    public Spectrum multiply(double[] k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.MUL, Operand.array(k));
    }

    public Spectrum multiply(Spectrum other) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.MUL, Operand.spectrum(other));
    }

    public Spectrum divide(double k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.DIV, Operand.scalar(k));
    }

    public Spectrum divide(double[] k) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.DIV, Operand.array(k));
    }

    public Spectrum divide(Spectrum other) {
        return SpectrumArithmetic.DEFAULT.apply(this, ArithmeticOp.DIV, Operand.spectrum(other));
    }

    /// Returns {@code k + this}.
    public Spectrum radd(double k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.ADD, Operand.scalar(k));
    }

    /// Returns {@code k * this}.
    public Spectrum rmultiply(double k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.MUL, Operand.scalar(k));
    }

    /// Returns {@code k - this}.
    public Spectrum rsubtract(double k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.SUB, Operand.scalar(k));
    }

    /// Returns {@code k - this} elementwise.
    public Spectrum rsubtract(double[] k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.SUB, Operand.array(k));
    }

    /// Returns {@code k / this}; the flux unit is inverted.
    public Spectrum rdivide(double k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.DIV, Operand.scalar(k));
    }

    /// Returns {@code k / this} elementwise; the flux unit is inverted.
    public Spectrum rdivide(double[] k) {
        return SpectrumArithmetic.DEFAULT.applyReflected(this, ArithmeticOp.DIV, Operand.array(k));
    }

    public Spectrum pow(double power) {
        return SpectrumArithmetic.DEFAULT.pow(this, power);
    }

    public Spectrum negate() {
        return SpectrumArithmetic.DEFAULT.negate(this);
    }

    public Spectrum abs() {
        return SpectrumArithmetic.DEFAULT.abs(this);
    }

    // ---------------------------------------------------------------- resampling and smoothing

    /// Linearly interpolates onto a new wavelength grid; points outside the support become zero.
    public Spectrum interpWave(double[] grid) {
        return Resampler.DEFAULT.interpolate(this, grid, InterpolationKind.LINEAR);
    }

    public Spectrum interpWave(double[] grid, InterpolationKind kind) {
        return Resampler.DEFAULT.interpolate(this, grid, kind);
    }

    /// Interpolates onto the wavelengths of another spectrum, which must share this medium.
    public Spectrum interpWave(Spectrum target, InterpolationKind kind) {
        return Resampler.DEFAULT.interpolate(this, target, kind);
    }

    /// Smooths the flux with a Gaussian of the given FWHM in wavelength units. Errors are unchanged.
    public Spectrum convolveGaussian(double fwhm) {
        return withFlux(GaussianConvolver.DEFAULT.convolve(wavelength, flux, fwhm), error);
    }

    /// Smooths the flux to constant resolving power R. Errors are unchanged.
    public Spectrum convolveResolution(double resolvingPower) {
        return withFlux(GaussianConvolver.DEFAULT.convolveResolution(wavelength, flux, resolvingPower), error);
    }

    // ---------------------------------------------------------------- units and media

    public Spectrum airToVac() {
        return UnitConverter.airToVac(this);
    }

    public Spectrum vacToAir() {
        return UnitConverter.vacToAir(this);
    }

    public Spectrum toMedium(WavelengthMedium target) {
        return UnitConverter.toMedium(this, target);
    }

    public Spectrum convertWavelengthUnit(Unit target) {
        return UnitConverter.convertWavelength(this, target);
    }

    public Spectrum convertWavelengthUnit(String target) {
        return UnitConverter.convertWavelength(this, Unit.parse(target));
    }

    public Spectrum convertFluxUnit(Unit target) {
        return UnitConverter.convertFlux(this, target);
    }

    public Spectrum convertFluxUnit(String target) {
        return UnitConverter.convertFlux(this, Unit.parse(target));
    }

    public Spectrum applyRedshift(double velocity, VelocityUnit unit) {
        return UnitConverter.applyRedshift(this, velocity, unit);
    }

    /// Applies CCM89 dust extinction for the given colour excess and Rv.
    public Spectrum redden(double ebv, double rv) {
        return UnitConverter.redden(this, ebv, rv);
    }

    /// Applies CCM89 dust extinction with the diffuse-ISM value Rv = 3.1.
    public Spectrum redden(double ebv) {
        return UnitConverter.redden(this, ebv, 3.1);
    }

    // ---------------------------------------------------------------- fitting

    /**
     * Treats this spectrum as a model and scales it to best match the data by
     * inverse-variance weighted least squares.
     */
    public ScaledModel scaleModel(Spectrum data) {
        return ModelScaler.DEFAULT.scaleToData(this, data);
    }

    // ---------------------------------------------------------------- selection helpers

    /// @return a mask that is true where {@code x0 < wavelength < x1}
    public boolean[] section(double x0, double x1) {
        boolean[] mask = new boolean[size()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = wavelength[i] > x0 && wavelength[i] < x1;
        }
        return mask;
    }

    /// @return the pixels strictly between x0 and x1
    public Spectrum clip(double x0, double x1) {
        return select(section(x0, x1));
    }

    /**
     * Splits around the given wavelengths into {@code boundaries.length + 1}
     * pieces. Boundaries are sorted first; pixels that fall exactly on a
     * boundary belong to no piece.
     */
    public List<Spectrum> split(double... boundaries) {
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        double[] edges = new double[boundaries.length + 2];
        edges[0] = Double.NEGATIVE_INFINITY;
        double[] sorted = boundaries.clone();
        Arrays.sort(sorted);
        System.arraycopy(sorted, 0, edges, 1, sorted.length);
        edges[edges.length - 1] = Double.POSITIVE_INFINITY;
        List<Spectrum> pieces = new ArrayList<>(edges.length - 1);
        for (int i = 0; i < edges.length - 1; i++) {
            pieces.add(clip(edges[i], edges[i + 1]));
        }
        return Collections.unmodifiableList(pieces);
    }

    /// Concatenates another spectrum after this one, optionally sorting by wavelength.
    public Spectrum join(Spectrum other, boolean sort) {
        return Spectra.join(List.of(this, other), sort, name);
    }

    /// @return the index of the pixel whose wavelength is nearest x0, or -1 when empty
    public int closestIndex(double x0) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < wavelength.length; i++) {
            double d = Math.abs(wavelength[i] - x0);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    /**
     * Drops masked pixels. A true entry marks a pixel as masked.
     *
     * @throws IllegalArgumentException if the mask length differs from the spectrum length
     */
    public Spectrum applyMask(boolean[] masked) {
        Objects.requireNonNull(masked, "masked cannot be null");
        boolean[] keep = new boolean[masked.length];
        for (int i = 0; i < masked.length; i++) {
            keep[i] = !masked[i];
        }
        return select(keep);
    }

    /**
     * Keeps only pixels inside at least one of the open wavelength ranges.
     *
     * @param ranges pairs {@code {x1, x2}}
     */
    public Spectrum keepRegions(List<double[]> ranges) {
        Objects.requireNonNull(ranges, "ranges cannot be null");
        boolean[] keep = new boolean[size()];
        for (double[] range : ranges) {
            if (range.length != 2) {
                throw new IllegalArgumentException("each region must be a {start, end} pair, got length " + range.length);
            }
            for (int i = 0; i < keep.length; i++) {
                keep[i] |= wavelength[i] > range[0] && wavelength[i] < range[1];
            }
        }
        return select(keep);
    }

    /**
     * Divides flux and error by the given percentile of the flux values, using
     * linear interpolation between order statistics.
     *
     * @param percentile percentile in (0, 100]
     */
    public Spectrum normPercentile(double percentile) {
        if (!(percentile > 0 && percentile <= 100)) {
            throw new IllegalArgumentException("percentile must be in (0, 100], got: " + percentile);
        }
        if (isEmpty()) {
            throw new IllegalArgumentException("cannot normalise an empty spectrum");
        }
        double norm = new Percentile()
            .withEstimationType(Percentile.EstimationType.R_7)
            .evaluate(flux, percentile);
        return divide(norm);
    }

    @Override
    public String toString() {
        return "Spectrum{name='" + name + "', pixels=" + size() + ", medium=" + medium.label()
            + ", x=" + wavelengthUnit + ", y=" + fluxUnit + "}";
    }

    /**
     * Builder for spectra supplied by readers and callers.
     *
     * <p>Defaults: empty name, {@link WavelengthMedium#AIR}, Å, erg s⁻¹ cm⁻² Å⁻¹,
     * an empty metadata map and, if no error array is given, all-zero errors.
     */
    public static final class Builder {
        private double[] wavelength;
        private double[] flux;
        private double[] error;
        private String name = "";
        private WavelengthMedium medium = WavelengthMedium.AIR;
        private Unit wavelengthUnit = Units.ANGSTROM;
        private Unit fluxUnit = Units.FLAMBDA_CGS;
        private Map<String, Object> metadata;

        private Builder() {
        }

        public Builder wavelength(double[] wavelength) {
            this.wavelength = wavelength;
            return this;
        }

        public Builder flux(double[] flux) {
            this.flux = flux;
            return this;
        }

        public Builder error(double[] error) {
            this.error = error;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder medium(WavelengthMedium medium) {
            this.medium = medium;
            return this;
        }

        public Builder medium(String medium) {
            this.medium = WavelengthMedium.parse(medium);
            return this;
        }

        public Builder wavelengthUnit(Unit unit) {
            this.wavelengthUnit = unit;
            return this;
        }

        public Builder wavelengthUnit(String unit) {
            this.wavelengthUnit = Unit.parse(unit);
            return this;
        }

        public Builder fluxUnit(Unit unit) {
            this.fluxUnit = unit;
            return this;
        }

        public Builder fluxUnit(String unit) {
            this.fluxUnit = Unit.parse(unit);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any spectrum invariant is violated
         */
        public Spectrum build() {
            Objects.requireNonNull(wavelength, "wavelength cannot be null");
            Objects.requireNonNull(flux, "flux cannot be null");
            double[] e = error == null ? new double[wavelength.length] : error.clone();
            return new Spectrum(wavelength.clone(), flux.clone(), e, name, medium,
                wavelengthUnit, fluxUnit, metadata, true);
        }
    }
}
