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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegionMaskFileTest {

    @TempDir
    Path tempDir;

    @Test
    void readsPairsAndSkipsComments() throws IOException {
        Path file = tempDir.resolve("regions.txt");
        Files.writeString(file, "# continuum windows\n4000 4100\n\n4300, 4200\n");
        List<double[]> regions = RegionMaskFile.read(file);
        assertEquals(2, regions.size());
        assertArrayEquals(new double[]{4000, 4100}, regions.get(0), 0.0);
        assertArrayEquals(new double[]{4200, 4300}, regions.get(1), 0.0);
    }

    @Test
    void keepsPixelsInsideTheRegions() throws IOException {
        Path file = tempDir.resolve("regions.txt");
        Files.writeString(file, "1.5 3.5\n6.5 7.5\n");
        double[] x = {1, 2, 3, 4, 5, 6, 7, 8};
        Spectrum s = Spectrum.of(x, x.clone(), new double[8]);
        Spectrum kept = RegionMaskFile.apply(s, file);
        assertArrayEquals(new double[]{2, 3, 7}, kept.wavelength(), 0.0);
    }

    @Test
    void rejectsMalformedLines() throws IOException {
        Path triple = tempDir.resolve("triple.txt");
        Files.writeString(triple, "1 2 3\n");
        assertThrows(IOException.class, () -> RegionMaskFile.read(triple));

        Path word = tempDir.resolve("word.txt");
        Files.writeString(word, "1 two\n");
        assertThrows(IOException.class, () -> RegionMaskFile.read(word));

        assertThrows(IOException.class, () -> RegionMaskFile.read(tempDir.resolve("absent.txt")));
    }
}
