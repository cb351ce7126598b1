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

import io.spectools.spectra.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;

/// Writes spectra as text columns or NumPy arrays.
///
/// ## Formats
///
/// | extension | layout |
/// |---|---|
/// | `.txt`, `.dat`, `.asc` | `%9.3f %12.5E %11.5E` per pixel, error column optional |
/// | `.npy` | float64 array of shape (2, N) or (3, N), rows x, y, e |
///
/// ## Atomic writes
///
/// Output goes to a sibling `.tmp` file which is then moved over the target,
/// so an interrupted write never leaves a partial file at the requested path.
/// Failures come back as [WriteResult.Failed] and are logged at WARN.
///
/// ```java
/// WriteResult result = SpectrumWriter.write(spectrum, Path.of("out.npy"), true);
/// if (!result.isSuccess()) { ... }
/// ```
public final class SpectrumWriter {

    private static final Logger logger = LogManager.getLogger(SpectrumWriter.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final byte[] NPY_MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int NPY_ALIGNMENT = 64;

    private SpectrumWriter() {
    }

    /**
     * Writes a spectrum, choosing the format from the file extension.
     *
     * @param spectrum the spectrum to write
     * @param path target file; existing files are replaced
     * @param includeErrors whether to add the error column
     * @return the outcome; an unknown extension fails without touching the disk
     */
    public static WriteResult write(Spectrum spectrum, Path path, boolean includeErrors) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        return OutputFormat.forPath(path)
            .map(format -> write(spectrum, path, format, includeErrors))
            .orElseGet(() -> {
                logger.warn("Not writing '{}': unknown output extension", path);
                return WriteResult.failed(path, "unknown output extension for " + path.getFileName()
                    + "; expected one of .txt, .dat, .asc, .npy");
            });
    }

    /// Writes a spectrum in an explicit format, whatever the extension.
    public static WriteResult write(Spectrum spectrum, Path path, OutputFormat format, boolean includeErrors) {
        Objects.requireNonNull(spectrum, "spectrum cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            switch (format) {
                case TEXT -> writeText(spectrum, tempPath, includeErrors);
                case NPY -> writeNpy(spectrum, tempPath, includeErrors);
            }
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            logger.warn("Failed to write spectrum '{}' to {}: {}", spectrum.name(), path, e.getMessage());
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            return WriteResult.failed(path, "could not write " + path + ": " + e.getMessage(), e);
        }
        logger.debug("Wrote {} rows of '{}' to {} as {}", spectrum.size(), spectrum.name(), path, format);
        return WriteResult.written(path, format, spectrum.size());
    }

    /// Formats one pixel the way the text writer does.
    static String formatRow(double x, double y, double e, boolean includeErrors) {
        return includeErrors
            ? String.format(Locale.ROOT, "%9.3f %12.5E %11.5E", x, y, e)
            : String.format(Locale.ROOT, "%9.3f %12.5E", x, y);
    }

    private static void writeText(Spectrum spectrum, Path target, boolean includeErrors) throws IOException {
        double[] x = spectrum.wavelength();
        double[] y = spectrum.flux();
        double[] e = spectrum.error();
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (int i = 0; i < x.length; i++) {
                writer.write(formatRow(x[i], y[i], e[i], includeErrors));
                writer.write('\n');
            }
        }
    }

    private static void writeNpy(Spectrum spectrum, Path target, boolean includeErrors) throws IOException {
        int n = spectrum.size();
        double[][] rows = includeErrors
            ? new double[][]{spectrum.wavelength(), spectrum.flux(), spectrum.error()}
            : new double[][]{spectrum.wavelength(), spectrum.flux()};
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            out.write(npyHeader(rows.length, n));
            ByteBuffer buffer = ByteBuffer.allocate(8 * n).order(ByteOrder.LITTLE_ENDIAN);
            for (double[] row : rows) {
                buffer.clear();
                for (double v : row) {
                    buffer.putDouble(v);
                }
                out.write(buffer.array(), 0, buffer.position());
            }
        }
    }

    /// Magic, version 1.0, little-endian header length, then the dictionary padded with spaces and ending in a newline.
    static byte[] npyHeader(int rows, int columns) {
        String dict = "{'descr': '<f8', 'fortran_order': False, 'shape': (" + rows + ", " + columns + "), }";
        int preamble = NPY_MAGIC.length + 2 + 2;
        int unpadded = preamble + dict.length() + 1;
        int padding = (NPY_ALIGNMENT - unpadded % NPY_ALIGNMENT) % NPY_ALIGNMENT;
        byte[] dictBytes = (dict + " ".repeat(padding) + "\n").getBytes(StandardCharsets.US_ASCII);
        ByteBuffer header = ByteBuffer.allocate(preamble + dictBytes.length).order(ByteOrder.LITTLE_ENDIAN);
        header.put(NPY_MAGIC);
        header.put((byte) 1).put((byte) 0);
        header.putShort((short) dictBytes.length);
        header.put(dictBytes);
        return header.array();
    }
}
