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

import java.util.Locale;

/**
 * Numerical quadrature of sampled functions over possibly irregular abscissae.
 */
public enum IntegrationRule {

    /// Composite trapezoid rule.
    TRAPEZOID {
        @Override
        public double integrate(double[] y, double[] x) {
            check(y, x);
            double sum = 0;
            for (int i = 1; i < x.length; i++) {
                sum += 0.5 * (x[i] - x[i - 1]) * (y[i] + y[i - 1]);
            }
            return sum;
        }
    },

    /**
     * Composite Simpson rule for irregular spacing. With an even number of
     * points the result averages Simpson on the first N−1 points plus a trapezoid
     * on the last interval, and a trapezoid on the first interval plus Simpson on
     * the rest. Two points fall back to the trapezoid rule.
     */
    SIMPSON {
        @Override
        public double integrate(double[] y, double[] x) {
            check(y, x);
            int n = x.length;
            if (n < 3) {
                return TRAPEZOID.integrate(y, x);
            }
            if (n % 2 == 1) {
                return simpson(y, x, 0, n - 2);
            }
            double first = simpson(y, x, 0, n - 3)
                + 0.5 * (x[n - 1] - x[n - 2]) * (y[n - 1] + y[n - 2]);
            double last = 0.5 * (x[1] - x[0]) * (y[1] + y[0])
                + simpson(y, x, 1, n - 2);
            return 0.5 * (first + last);
        }
    };

    /**
     * Integrates y over x.
     *
     * @param y ordinates
     * @param x abscissae, same length as y
     * @return the integral
     */
    public abstract double integrate(double[] y, double[] x);

    /// Parses {@code "trapezoid"}/{@code "trapz"} or {@code "simpson"}/{@code "simps"}, case-insensitively.
    public static IntegrationRule parse(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "trapezoid", "trapz" -> TRAPEZOID;
            case "simpson", "simps" -> SIMPSON;
            default -> throw new IllegalArgumentException("Unknown integration rule: '" + name + "'");
        };
    }

    /// Simpson panels on points start..stop+1, each panel spanning points i, i+1, i+2.
    private static double simpson(double[] y, double[] x, int start, int stop) {
        double sum = 0;
        for (int i = start; i < stop; i += 2) {
            double h0 = x[i + 1] - x[i];
            double h1 = x[i + 2] - x[i + 1];
            double hsum = h0 + h1;
            double hprod = h0 * h1;
            double ratio = h0 / h1;
            sum += hsum / 6.0 * (y[i] * (2.0 - 1.0 / ratio)
                + y[i + 1] * hsum * hsum / hprod
                + y[i + 2] * (2.0 - ratio));
        }
        return sum;
    }

    private static void check(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("y and x must have equal lengths, got: " + y.length + ", " + x.length);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("integration needs at least 2 points, got: " + x.length);
        }
    }
}
