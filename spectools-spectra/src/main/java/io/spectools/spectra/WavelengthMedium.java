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

import java.util.Locale;

/// Medium in which wavelengths were measured.
///
/// Air wavelengths are shorter than vacuum wavelengths by the refractive index
/// of air, roughly 2.8 parts in 10⁴ in the optical.
public enum WavelengthMedium {
    AIR,
    VACUUM;

    /// Parses a medium label.
    ///
    /// Accepts `air`, `vac` and `vacuum` in any case.
    ///
    /// @param label the medium label
    /// @return the matching medium
    /// @throws IllegalArgumentException if the label is not a known medium
    public static WavelengthMedium parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("medium label cannot be null");
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "air":
                return AIR;
            case "vac":
            case "vacuum":
                return VACUUM;
            default:
                throw new IllegalArgumentException("Wavelength medium must be 'air' or 'vac', got: '" + label + "'");
        }
    }

    /// @return the short label used in headers, `air` or `vac`
    public String label() {
        return this == AIR ? "air" : "vac";
    }
}
