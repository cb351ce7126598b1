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

/// Unit in which a line-of-sight velocity is given to [UnitConverter#applyRedshift].
public enum VelocityUnit {
    /// kilometres per second
    KM_PER_S,
    /// a fraction of the speed of light, i.e. β itself
    FRACTION_OF_C;

    /**
     * Converts a velocity in this unit to β = v/c.
     *
     * @param velocity the velocity
     * @return β
     */
    public double toBeta(double velocity) {
        return switch (this) {
            case KM_PER_S -> velocity / PhysicalConstants.SPEED_OF_LIGHT_KMS;
            case FRACTION_OF_C -> velocity;
        };
    }
}
