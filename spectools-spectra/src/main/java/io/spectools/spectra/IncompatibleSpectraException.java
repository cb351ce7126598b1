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

/// Thrown when two spectra cannot be combined: different lengths, wavelength
/// grids that are not close, mismatched units, or mismatched media where the
/// operation requires them to agree.
public class IncompatibleSpectraException extends IllegalArgumentException {

    private final String leftName;
    private final String rightName;

    public IncompatibleSpectraException(Spectrum left, Spectrum right, String reason) {
        super(String.format("Cannot combine spectrum '%s' (%d px) with '%s' (%d px): %s",
            left.name(), left.size(), right.name(), right.size(), reason));
        this.leftName = left.name();
        this.rightName = right.name();
    }

    public IncompatibleSpectraException(String message) {
        super(message);
        this.leftName = null;
        this.rightName = null;
    }

    public String getLeftName() {
        return leftName;
    }

    public String getRightName() {
        return rightName;
    }
}
