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

/// Thrown when a unit string cannot be parsed or two units cannot be related
/// by a dimensional conversion or a supported equivalence.
public class UnitConversionException extends IllegalArgumentException {

    private final String from;
    private final String to;

    public UnitConversionException(String message) {
        super(message);
        this.from = null;
        this.to = null;
    }

    public UnitConversionException(Unit from, Unit to) {
        super(String.format("Cannot convert '%s' (%s) to '%s' (%s)",
            from.symbol(), from.kind(), to.symbol(), to.kind()));
        this.from = from.symbol();
        this.to = to.symbol();
    }

    /// @return the source unit symbol, or null for parse failures
    public String getFrom() {
        return from;
    }

    /// @return the target unit symbol, or null for parse failures
    public String getTo() {
        return to;
    }
}
