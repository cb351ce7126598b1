package io.spectools.spectra.util;

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

import io.spectools.spectra.config.SpectraSettings;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Random providers and samplers for Monte-Carlo error propagation.
 *
 * <p>Providers come from Apache Commons RNG. Runs are reproducible when a seed
 * is given, either directly or through {@link SpectraSettings#randomSeed()}.
 */
public final class RandomGenerators {

    /// Generator algorithms offered for Monte-Carlo work.
    public enum Algorithm {
        /// XorShiro256++: 256-bit state, fast, the default
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /// SplitMix64: 64-bit state, when a minimal state is enough
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
        /// Mersenne Twister, for comparison with other tools
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /// Creates the default generator with the given seed.
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /// Creates the default generator, seeded from settings when a seed is configured.
    public static UniformRandomProvider create(SpectraSettings settings) {
        Long seed = settings.randomSeed();
        if (seed != null) {
            return create(seed);
        }
        return Algorithm.XO_SHI_RO_256_PP.getSource().create();
    }

    /// @return a sampler of the standard normal distribution N(0, 1)
    public static ContinuousSampler standardNormal(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }
}
