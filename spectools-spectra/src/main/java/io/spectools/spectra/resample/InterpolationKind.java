package io.spectools.spectra.resample;

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

/// Interpolation schemes understood by [Resampler].
public enum InterpolationKind {
    /// piecewise linear; zero outside the source range
    LINEAR(2),
    /// value of the nearest source point; zero outside the source range
    NEAREST(1),
    /// natural cubic spline; zero outside the source range
    CUBIC(3),
    /// Akima spline on flux and error separately; NaN and out-of-range points become zero
    AKIMA(5),
    /// band-limited sum of sinc kernels over all source points
    SINC(2);

    private final int minimumPoints;

    InterpolationKind(int minimumPoints) {
        this.minimumPoints = minimumPoints;
    }

    /// @return the fewest source points this scheme can work with
    public int minimumPoints() {
        return minimumPoints;
    }

    /**
     * Parses a kind by name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static InterpolationKind parse(String name) {
        if (name != null) {
            for (InterpolationKind kind : values()) {
                if (kind.name().equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown interpolation kind: '" + name + "'");
    }
}
