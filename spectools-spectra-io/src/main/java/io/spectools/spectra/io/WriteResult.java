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

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of writing a spectrum to disk.
 *
 * <p>Writers report failures as values so that a batch of writes can carry on
 * past one bad path and report every problem at the end.
 */
public sealed interface WriteResult permits WriteResult.Written, WriteResult.Failed {

    Path path();

    boolean isSuccess();

    /// The spectrum was written in full.
    record Written(Path path, OutputFormat format, int rows) implements WriteResult {
        public Written {
            Objects.requireNonNull(path, "path cannot be null");
            Objects.requireNonNull(format, "format cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /// Nothing was written to the target path.
    record Failed(Path path, String reason, Optional<Exception> cause) implements WriteResult {
        public Failed {
            Objects.requireNonNull(path, "path cannot be null");
            Objects.requireNonNull(reason, "reason cannot be null");
            Objects.requireNonNull(cause, "cause cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static WriteResult written(Path path, OutputFormat format, int rows) {
        return new Written(path, format, rows);
    }

    static WriteResult failed(Path path, String reason) {
        return new Failed(path, reason, Optional.empty());
    }

    static WriteResult failed(Path path, String reason, Exception cause) {
        return new Failed(path, reason, Optional.of(cause));
    }
}
