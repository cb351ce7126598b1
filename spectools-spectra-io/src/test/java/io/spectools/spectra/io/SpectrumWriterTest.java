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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SpectrumWriterTest {

    @TempDir
    Path tempDir;

    private static Spectrum sample() {
        return Spectrum.of(
            new double[]{5000.123, 5001.5, 5003.0, 5004.25},
            new double[]{1.5e-17, 2.0e-17, 2.5e-17, 3.0e-17},
            new double[]{2.0e-18, 2.0e-18, 3.0e-18, 4.0e-18}).withName("sample");
    }

    @Test
    void textRowsUseFixedColumns() {
        assertEquals(" 5000.123  1.50000E-17 2.00000E-18", SpectrumWriter.formatRow(5000.123, 1.5e-17, 2.0e-18, true));
        assertEquals(" 5000.123  1.50000E-17", SpectrumWriter.formatRow(5000.123, 1.5e-17, 2.0e-18, false));
    }

    @Test
    void writesTextWithErrors() throws IOException {
        Path out = tempDir.resolve("spec.txt");
        WriteResult result = SpectrumWriter.write(sample(), out, true);

        assertTrue(result.isSuccess());
        assertThat(result).isInstanceOf(WriteResult.Written.class);
        WriteResult.Written written = (WriteResult.Written) result;
        assertEquals(OutputFormat.TEXT, written.format());
        assertEquals(4, written.rows());

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals(" 5004.250  3.00000E-17 4.00000E-18", lines.get(3));
        assertFalse(Files.exists(tempDir.resolve("spec.txt.tmp")));
    }

    @Test
    void textRowsEndWithLineFeedOnEveryPlatform() throws IOException {
        Path out = tempDir.resolve("rows.txt");
        assertTrue(SpectrumWriter.write(sample(), out, true).isSuccess());
        String content = Files.readString(out, StandardCharsets.UTF_8);
        assertThat(content).doesNotContain("\r").endsWith("\n");
        assertEquals(4, content.chars().filter(c -> c == '\n').count());
    }

    @Test
    void writesTextWithoutErrors() throws IOException {
        Path out = tempDir.resolve("spec.dat");
        assertTrue(SpectrumWriter.write(sample(), out, false).isSuccess());
        for (String line : Files.readAllLines(out, StandardCharsets.UTF_8)) {
            assertEquals(2, line.trim().split("\\s+").length);
        }
    }

    @Test
    void writesNpyRowMajor() throws IOException {
        Path out = tempDir.resolve("spec.npy");
        assertTrue(SpectrumWriter.write(sample(), out, true).isSuccess());

        byte[] bytes = Files.readAllBytes(out);
        assertEquals((byte) 0x93, bytes[0]);
        assertEquals("NUMPY", new String(bytes, 1, 5, StandardCharsets.US_ASCII));
        assertEquals(1, bytes[6]);
        assertEquals(0, bytes[7]);
        int headerLength = ByteBuffer.wrap(bytes, 8, 2).order(ByteOrder.LITTLE_ENDIAN).getShort();
        int dataStart = 10 + headerLength;
        assertEquals(0, dataStart % 64);
        String dict = new String(bytes, 10, headerLength, StandardCharsets.US_ASCII);
        assertThat(dict).contains("'descr': '<f8'").contains("'shape': (3, 4)").endsWith("\n");
        assertEquals(dataStart + 3 * 4 * 8, bytes.length);

        ByteBuffer data = ByteBuffer.wrap(bytes, dataStart, bytes.length - dataStart).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(5000.123, data.getDouble(), 0.0);
        data.position(dataStart + 4 * 8);
        assertEquals(1.5e-17, data.getDouble(), 0.0);
        data.position(dataStart + 11 * 8);
        assertEquals(4.0e-18, data.getDouble(), 0.0);
    }

    @Test
    void npyWithoutErrorsHasTwoRows() {
        byte[] header = SpectrumWriter.npyHeader(2, 1000);
        assertEquals(0, header.length % 64);
        assertThat(new String(header, StandardCharsets.US_ASCII)).contains("'shape': (2, 1000)");
    }

    @Test
    void unknownExtensionWritesNothing() {
        Path out = tempDir.resolve("spec.fits");
        WriteResult result = SpectrumWriter.write(sample(), out, true);
        assertFalse(result.isSuccess());
        assertEquals(out, result.path());
        assertThat(((WriteResult.Failed) result).reason()).contains("unknown output extension");
        assertFalse(Files.exists(out));
    }

    @Test
    void ioFailuresAreReturnedNotThrown() {
        Path out = tempDir.resolve("missing-dir").resolve("spec.txt");
        WriteResult result = SpectrumWriter.write(sample(), out, true);
        assertFalse(result.isSuccess());
        assertTrue(((WriteResult.Failed) result).cause().isPresent());
    }

    @Test
    void existingFilesAreReplaced() throws IOException {
        Path out = tempDir.resolve("spec.asc");
        Files.writeString(out, "old content\n");
        assertTrue(SpectrumWriter.write(sample().slice(0, 1), out, true).isSuccess());
        assertEquals(1, Files.readAllLines(out).size());
    }

    @Test
    void formatFollowsTheExtension() {
        assertEquals(OutputFormat.NPY, OutputFormat.forPath(Path.of("a/b/c.NPY")).orElseThrow());
        assertEquals(OutputFormat.TEXT, OutputFormat.forPath(Path.of("c.asc")).orElseThrow());
        assertTrue(OutputFormat.forPath(Path.of("noextension")).isEmpty());
        assertTrue(OutputFormat.forPath(Path.of("trailing.")).isEmpty());
    }
}
