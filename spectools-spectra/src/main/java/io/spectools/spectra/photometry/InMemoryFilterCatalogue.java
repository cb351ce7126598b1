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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A [FilterCatalogue] over curves supplied by the caller.
public final class InMemoryFilterCatalogue implements FilterCatalogue {

    private final Map<String, FilterCurve> curves = new LinkedHashMap<>();

    public InMemoryFilterCatalogue() {
    }

    public InMemoryFilterCatalogue(Collection<FilterCurve> curves) {
        Objects.requireNonNull(curves, "curves cannot be null");
        curves.forEach(this::register);
    }

    /// Adds or replaces a curve under its own identifier.
    public InMemoryFilterCatalogue register(FilterCurve curve) {
        Objects.requireNonNull(curve, "curve cannot be null");
        curves.put(curve.id(), curve);
        return this;
    }

    @Override
    public FilterCurve lookup(String id) {
        FilterCurve curve = curves.get(id);
        if (curve == null) {
            throw new UnsupportedFilterException(id);
        }
        return curve;
    }

    @Override
    public Set<String> identifiers() {
        return Collections.unmodifiableSet(curves.keySet());
    }
}
