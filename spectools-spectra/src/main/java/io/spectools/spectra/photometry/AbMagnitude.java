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

/// A synthetic AB magnitude.
///
/// @param value the magnitude, or the Monte-Carlo mean
/// @param error the Monte-Carlo standard deviation; zero when no draws were made
/// @param draws the number of Monte-Carlo draws behind the value
public record AbMagnitude(double value, double error, int draws) {

    public AbMagnitude {
        if (draws < 0) {
            throw new IllegalArgumentException("draws must be non-negative, got: " + draws);
        }
    }

    public static AbMagnitude exact(double value) {
        return new AbMagnitude(value, 0.0, 0);
    }

    public boolean isMonteCarlo() {
        return draws > 0;
    }
}
