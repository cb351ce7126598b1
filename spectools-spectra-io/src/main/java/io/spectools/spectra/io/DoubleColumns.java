package io.spectools.spectra.io;

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

import java.util.Arrays;

/// Growable storage for up to three parallel columns of doubles.
final class DoubleColumns {

    private double[] x = new double[256];
    private double[] y = new double[256];
    private double[] e = new double[256];
    private int size;

    void add(double xv, double yv, double ev) {
        if (size == x.length) {
            int capacity = size * 2;
            x = Arrays.copyOf(x, capacity);
            y = Arrays.copyOf(y, capacity);
            e = Arrays.copyOf(e, capacity);
        }
        x[size] = xv;
        y[size] = yv;
        e[size] = ev;
        size++;
    }

    int size() {
        return size;
    }

    double[] x() {
        return Arrays.copyOf(x, size);
    }

    double[] y() {
        return Arrays.copyOf(y, size);
    }

    double[] e() {
        return Arrays.copyOf(e, size);
    }
}
