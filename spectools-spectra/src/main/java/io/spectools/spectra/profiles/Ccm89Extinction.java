package io.spectools.spectra.profiles;

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

/**
 * The Cardelli, Clayton &amp; Mathis (1989, ApJ 345, 245) extinction law
 * {@code A_λ/A_V = a(x) + b(x)/R_V} with x = 1/λ in µm⁻¹.
 *
 * <table>
 *   <caption>Regimes</caption>
 *   <tr><th>x range</th><th>regime</th></tr>
 *   <tr><td>0.3 – 1.1</td><td>infrared power law</td></tr>
 *   <tr><td>1.1 – 3.3</td><td>optical / near-IR polynomial in y = x − 1.82</td></tr>
 *   <tr><td>3.3 – 8</td><td>ultraviolet, with the far-UV curvature terms above x = 5.9</td></tr>
 *   <tr><td>8 – 10</td><td>far ultraviolet cubic</td></tr>
 * </table>
 *
 * <p>Inputs below 0.3 or above 10 are clamped to the nearest edge.
 */
public final class Ccm89Extinction {

    public static final double MIN_X = 0.3;
    public static final double MAX_X = 10.0;

    private Ccm89Extinction() {
    }

    /**
     * @param inverseMicron x = 1/λ, µm⁻¹
     * @param rv ratio of total to selective extinction
     * @return A_λ / A_V
     */
    public static double alambdaOverAv(double inverseMicron, double rv) {
        double x = Math.min(Math.max(inverseMicron, MIN_X), MAX_X);
        double a;
        double b;
        if (x < 1.1) {
            double p = Math.pow(x, 1.61);
            a = 0.574 * p;
            b = -0.527 * p;
        } else if (x < 3.3) {
            double y = x - 1.82;
            a = 1 + y * (0.17699 + y * (-0.50447 + y * (-0.02427 + y * (0.72085
                + y * (0.01979 + y * (-0.77530 + y * 0.32999))))));
            b = y * (1.41338 + y * (2.28305 + y * (1.07233 + y * (-5.38434
                + y * (-0.62251 + y * (5.30260 + y * -2.09002))))));
        } else if (x < 8.0) {
            double fa = 0;
            double fb = 0;
            if (x >= 5.9) {
                double d = x - 5.9;
                fa = -0.04473 * d * d - 0.009779 * d * d * d;
                fb = 0.2130 * d * d + 0.1207 * d * d * d;
            }
            a = 1.752 - 0.316 * x - 0.104 / ((x - 4.67) * (x - 4.67) + 0.341) + fa;
            b = -3.090 + 1.825 * x + 1.206 / ((x - 4.62) * (x - 4.62) + 0.263) + fb;
        } else {
            double d = x - 8.0;
            a = -1.073 - 0.628 * d + 0.137 * d * d - 0.070 * d * d * d;
            b = 13.670 + 4.257 * d - 0.420 * d * d + 0.374 * d * d * d;
        }
        return a + b / rv;
    }

    public static double[] alambdaOverAv(double[] inverseMicron, double rv) {
        double[] out = new double[inverseMicron.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = alambdaOverAv(inverseMicron[i], rv);
        }
        return out;
    }
}
