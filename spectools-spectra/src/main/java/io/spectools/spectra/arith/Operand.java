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

import java.util.Arrays;
import java.util.Objects;

/**
 * The right-hand side of a spectrum operator: a scalar, an array of length N,
 * or another spectrum.
 *
 * <p>Each kind knows how to combine itself with a left-hand spectrum through the
 * engine, so {@link SpectrumArithmetic} has no type switch.
 */
public sealed interface Operand permits Operand.Scalar, Operand.Array, Operand.SpectrumOperand {

    static Operand scalar(double value) {
        return new Scalar(value);
    }

    static Operand array(double[] values) {
        return new Array(values);
    }

    static Operand spectrum(Spectrum spectrum) {
        return new SpectrumOperand(spectrum);
    }

    /**
     * Wraps an untyped value.
     *
     * @param value a {@link Number}, a {@code double[]} or a {@link Spectrum}
     * @return the matching operand
     * @throws IllegalArgumentException for any other type
     */
    static Operand of(Object value) {
        if (value instanceof Operand operand) {
            return operand;
        } else if (value instanceof Number number) {
            return new Scalar(number.doubleValue());
        } else if (value instanceof double[] values) {
            return new Array(values);
        } else if (value instanceof Spectrum spectrum) {
            return new SpectrumOperand(spectrum);
        }
        throw new IllegalArgumentException("Unsupported operand type: "
            + (value == null ? "null" : value.getClass().getName()));
    }

    /// Computes {@code left op this}.
    Spectrum combine(Spectrum left, ArithmeticOp op, SpectrumArithmetic engine);

    /// Computes {@code this op right}.
    Spectrum combineReflected(Spectrum right, ArithmeticOp op, SpectrumArithmetic engine);

    /// A constant applied to every pixel.
    record Scalar(double value) implements Operand {
        @Override
        public Spectrum combine(Spectrum left, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withConstants(left, op, constant(left.size()), false);
        }

        @Override
        public Spectrum combineReflected(Spectrum right, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withConstants(right, op, constant(right.size()), true);
        }

        private double[] constant(int n) {
            double[] k = new double[n];
            Arrays.fill(k, value);
            return k;
        }
    }

    /// Per-pixel constants without uncertainty.
    record Array(double[] values) implements Operand {
        public Array {
            Objects.requireNonNull(values, "values cannot be null");
        }

        @Override
        public Spectrum combine(Spectrum left, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withConstants(left, op, checked(left), false);
        }

        @Override
        public Spectrum combineReflected(Spectrum right, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withConstants(right, op, checked(right), true);
        }

        private double[] checked(Spectrum spectrum) {
            if (values.length != spectrum.size()) {
                throw new IncompatibleSpectraException(
                    "array operand length " + values.length + " does not match spectrum '"
                        + spectrum.name() + "' of " + spectrum.size() + " pixels");
            }
            return values;
        }
    }

    /// Another spectrum; uncertainties of both sides propagate.
    record SpectrumOperand(Spectrum spectrum) implements Operand {
        public SpectrumOperand {
            Objects.requireNonNull(spectrum, "spectrum cannot be null");
        }

        @Override
        public Spectrum combine(Spectrum left, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withSpectrum(left, op, spectrum);
        }

        @Override
        public Spectrum combineReflected(Spectrum right, ArithmeticOp op, SpectrumArithmetic engine) {
            return engine.withSpectrum(spectrum, op, right);
        }
    }
}
