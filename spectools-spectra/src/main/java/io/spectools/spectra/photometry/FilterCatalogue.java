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

import java.util.Set;

/// Source of filter transmission curves by identifier.
public interface FilterCatalogue {

    /**
     * @param id a filter identifier such as {@code "g"} or {@code "GaiaBp"}
     * @return the transmission curve
     * @throws UnsupportedFilterException if the identifier is unknown
     */
    FilterCurve lookup(String id);

    /// @return every identifier this catalogue can resolve
    Set<String> identifiers();
}
