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

/// Thrown when a filter identifier is unknown to a [FilterCatalogue].
public class UnsupportedFilterException extends RuntimeException {

    private final String filterId;

    public UnsupportedFilterException(String filterId) {
        super("Invalid filter name: '" + filterId + "'");
        this.filterId = filterId;
    }

    public UnsupportedFilterException(String filterId, String message) {
        super(message);
        this.filterId = filterId;
    }

    public String getFilterId() {
        return filterId;
    }
}
