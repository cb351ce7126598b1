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

import io.spectools.spectra.units.Unit;

/**
 * The four binary operators and their uncertainty propagation rules.
 *
 * <p>Uncertainties are treated as independent and Gaussian. Constants carry no
 * uncertainty.
 *
 * <table>
 *   <caption>Propagation rules</caption>
 *   <tr><th>op</th><th>S op k</th><th>k op S</th><th>S1 op S2</th></tr>
 *   <tr><td>ADD</td><td>y+k, e</td><td>k+y, e</td><td>y1+y2, hypot(e1, e2)</td></tr>
 *   <tr><td>SUB</td><td>y−k, e</td><td>k−y, e</td><td>y1−y2, hypot(e1, e2)</td></tr>
 *   <tr><td>MUL</td><td>y·k, |e·k|</td><td>k·y, |e·k|</td><td>y1·y2, |y1·y2|·hypot(e1/y1, e2/y2)</td></tr>
 *   <tr><td>DIV</td><td>y/k, |e/k|</td><td>k/y, |k|·e/y²</td><td>y1/y2, |y1/y2|·hypot(e1/y1, e2/y2)</td></tr>
 * </table>
 *
 * <p>Zero fluxes in the relative-error rules yield NaN errors, as IEEE arithmetic dictates.
 */
public enum ArithmeticOp {

    ADD("+") {
        @Override
        public double flux(double y, double k) {
            return y + k;
        }

        @Override
        public double constantError(double y, double e, double k) {
            return e;
        }

        @Override
        public double reflectedFlux(double y, double k) {
            return k + y;
        }

        @Override
        public double reflectedError(double y, double e, double k) {
            return e;
        }

        @Override
        public double pairError(double y1, double e1, double y2, double e2) {
            return Math.hypot(e1, e2);
        }
    },

    SUB("-") {
        @Override
        public double flux(double y, double k) {
            return y - k;
        }

        @Override
        public double constantError(double y, double e, double k) {
            return e;
        }

        @Override
        public double reflectedFlux(double y, double k) {
            return k - y;
        }

        @Override
        public double reflectedError(double y, double e, double k) {
            return e;
        }

        @Override
        public double pairError(double y1, double e1, double y2, double e2) {
            return Math.hypot(e1, e2);
        }
    },

    MUL("*") {
        @Override
        public double flux(double y, double k) {
            return y * k;
        }

        @Override
        public double constantError(double y, double e, double k) {
            return Math.abs(e * k);
        }

        @Override
        public double reflectedFlux(double y, double k) {
            return k * y;
        }

        @Override
        public double reflectedError(double y, double e, double k) {
            return Math.abs(e * k);
        }

        @Override
        public double pairError(double y1, double e1, double y2, double e2) {
            return Math.abs(y1 * y2) * Math.hypot(e1 / y1, e2 / y2);
        }

        @Override
        public Unit pairUnit(Unit left, Unit right) {
            return left.multiply(right);
        }
    },

    DIV("/") {
        @Override
        public double flux(double y, double k) {
            return y / k;
        }

        @Override
        public double constantError(double y, double e, double k) {
            return Math.abs(e / k);
        }

        @Override
        public double reflectedFlux(double y, double k) {
            return k / y;
        }

        @Override
        public double reflectedError(double y, double e, double k) {
            return Math.abs(k) * e / (y * y);
        }

        @Override
        public double pairError(double y1, double e1, double y2, double e2) {
            return Math.abs(y1 / y2) * Math.hypot(e1 / y1, e2 / y2);
        }

        @Override
        public Unit pairUnit(Unit left, Unit right) {
            return left.divide(right);
        }

        @Override
        public Unit reflectedUnit(Unit unit) {
            return unit.inverse();
        }
    };

    private final String symbol;

    ArithmeticOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /// Flux of {@code y op k}; also the flux rule for two spectra.
    public abstract double flux(double y, double k);

    /// Error of {@code y op k} where only y carries the error e.
    public abstract double constantError(double y, double e, double k);

    /// Flux of {@code k op y}.
    public abstract double reflectedFlux(double y, double k);

    /// Error of {@code k op y} where only y carries the error e.
    public abstract double reflectedError(double y, double e, double k);

    /// Error of {@code y1 op y2} where both sides carry errors.
    public abstract double pairError(double y1, double e1, double y2, double e2);

    /// Flux unit of {@code left op right} for two spectra whose flux units already agree.
    public Unit pairUnit(Unit left, Unit right) {
        return left;
    }

    /// Flux unit of {@code k op S}.
    public Unit reflectedUnit(Unit unit) {
        return unit;
    }

}
