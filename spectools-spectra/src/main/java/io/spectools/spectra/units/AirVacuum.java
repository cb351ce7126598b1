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

/**
 * Refractive-index correction between air and vacuum wavelengths.
 *
 * <p>Both directions use the Edlén-type dispersion formula from the VALD3
 * documentation, written in terms of {@code s = 10⁴/λ} with λ in Ångström:
 *
 * <pre>
 * vacuum → air:  n = 1.0000834254 + 0.02406147/(130 − s²) + 0.00015998/(38.9 − s²)
 *                λ_air = λ_vac / n
 * air → vacuum:  n = 1.00008336624212083 + 0.02408926869968/(130.1065924522 − s²)
 *                    + 0.0001599740894897/(38.92568793293 − s²)
 *                λ_vac = λ_air · n
 * </pre>
 *
 * <p>The two formulas are fitted inverses of each other; a round trip through
 * both agrees to about 1e-11 relative across the optical range.
 */
public final class AirVacuum {

    private AirVacuum() {
    }

    /**
     * Converts an air wavelength in Ångström to vacuum.
     *
     * @param airAngstrom air wavelength, Å
     * @return vacuum wavelength, Å
     */
    public static double airToVac(double airAngstrom) {
        double s = 1e4 / airAngstrom;
        double s2 = s * s;
        double n = 1.00008336624212083
            + 0.02408926869968 / (130.1065924522 - s2)
            + 0.0001599740894897 / (38.92568793293 - s2);
        return airAngstrom * n;
    }

    /**
     * Converts a vacuum wavelength in Ångström to air.
     *
     * @param vacAngstrom vacuum wavelength, Å
     * @return air wavelength, Å
     */
    public static double vacToAir(double vacAngstrom) {
        double s = 1e4 / vacAngstrom;
        double s2 = s * s;
        double n = 1.0000834254
            + 0.02406147 / (130.0 - s2)
            + 0.00015998 / (38.9 - s2);
        return vacAngstrom / n;
    }

    public static double[] airToVac(double[] airAngstrom) {
        double[] out = new double[airAngstrom.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = airToVac(airAngstrom[i]);
        }
        return out;
    }

    public static double[] vacToAir(double[] vacAngstrom) {
        double[] out = new double[vacAngstrom.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = vacToAir(vacAngstrom[i]);
        }
        return out;
    }
}
