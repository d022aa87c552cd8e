package io.hydrocast.ssm.sampler;

/*
 * Copyright (c) hydrocast
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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AhrensDieterMarsagliaTsangGammaSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Per-chain random number generation based on Apache Commons RNG.
 *
 * <p>Every chain owns one provider created from its own seed. Nothing here is
 * shared between chains, so draws are reproducible per chain regardless of
 * thread scheduling.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /** XorShiRo256++: 256-bit state, fast, the default for sampling chains. */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /** SplitMix64: 64-bit state, used to expand a base seed into chain seeds. */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64);

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

    /**
     * Creates a generator with the specified algorithm and seed.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a chain generator using {@link Algorithm#XO_SHI_RO_256_PP}.
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Expands one base seed into {@code count} chain seeds.
     *
     * <p>The same base seed always yields the same sequence, and seed {@code i}
     * does not depend on {@code count}.
     *
     * @param baseSeed the base seed
     * @param count number of chain seeds
     * @return chain seeds
     */
    public static long[] chainSeeds(long baseSeed, int count) {
        UniformRandomProvider expander = create(Algorithm.SPLIT_MIX_64, baseSeed);
        long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = expander.nextLong();
        }
        return seeds;
    }

    /**
     * Creates a standard normal sampler bound to {@code rng}.
     */
    public static NormalizedGaussianSampler gaussian(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }

    /**
     * Draws from {@code Gamma(shape, rate)}.
     *
     * @param rng the chain generator
     * @param shape shape parameter, positive
     * @param rate rate parameter, positive
     * @return one draw
     */
    public static double gamma(UniformRandomProvider rng, double shape, double rate) {
        return AhrensDieterMarsagliaTsangGammaSampler.of(rng, shape, 1.0 / rate).sample();
    }
}
