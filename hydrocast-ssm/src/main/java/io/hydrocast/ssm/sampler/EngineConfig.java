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

import java.util.Arrays;
import java.util.Objects;

/**
 * Run configuration of the {@link InferenceEngine}.
 *
 * <h2>Defaults</h2>
 *
 * <ul>
 *   <li>chains: {@value #DEFAULT_CHAINS}</li>
 *   <li>iterations: {@value #DEFAULT_ITERATIONS}</li>
 *   <li>thinning interval: 1 (every iteration is retained)</li>
 *   <li>seeds: derived from base seed {@value #DEFAULT_BASE_SEED} via
 *       {@link RandomGenerators#chainSeeds(long, int)}</li>
 *   <li>latent-state update: {@link StateUpdate#FORWARD_FILTER_BACKWARD_SAMPLE}</li>
 *   <li>initializer: {@link DispersedInitializer}</li>
 * </ul>
 *
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .chains(4)
 *     .iterations(10_000)
 *     .baseSeed(42L)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    public static final int DEFAULT_CHAINS = 3;
    public static final int DEFAULT_ITERATIONS = 5000;
    public static final long DEFAULT_BASE_SEED = 20_240_601L;

    private final int chains;
    private final int iterations;
    private final int thin;
    private final long[] seeds;
    private final StateUpdate stateUpdate;
    private final ChainInitializer initializer;

    private EngineConfig(Builder b, long[] seeds) {
        this.chains = b.chains;
        this.iterations = b.iterations;
        this.thin = b.thin;
        this.seeds = seeds;
        this.stateUpdate = b.stateUpdate;
        this.initializer = b.initializer;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .chains(chains)
            .iterations(iterations)
            .thin(thin)
            .seeds(seeds)
            .stateUpdate(stateUpdate)
            .initializer(initializer);
    }

    /// Same configuration with a different iteration count, keeping the chain seeds.
    public EngineConfig withIterations(int iterations) {
        return toBuilder().iterations(iterations).build();
    }

    public int chains() {
        return chains;
    }

    public int iterations() {
        return iterations;
    }

    public int thin() {
        return thin;
    }

    /// Number of draws each chain retains, `iterations / thin`.
    public int retainedDraws() {
        return iterations / thin;
    }

    public long seed(int chain) {
        return seeds[chain];
    }

    public long[] seeds() {
        return seeds.clone();
    }

    public StateUpdate stateUpdate() {
        return stateUpdate;
    }

    public ChainInitializer initializer() {
        return initializer;
    }

    @Override
    public String toString() {
        return "EngineConfig[chains=" + chains + ", iterations=" + iterations + ", thin=" + thin
            + ", stateUpdate=" + stateUpdate + ", seeds=" + Arrays.toString(seeds) + "]";
    }

    /**
     * Builder for {@link EngineConfig}; {@link #build()} rejects invalid
     * combinations before any sampling work starts.
     */
    public static final class Builder {
        private int chains = DEFAULT_CHAINS;
        private int iterations = DEFAULT_ITERATIONS;
        private int thin = 1;
        private long[] seeds;
        private long baseSeed = DEFAULT_BASE_SEED;
        private StateUpdate stateUpdate = StateUpdate.FORWARD_FILTER_BACKWARD_SAMPLE;
        private ChainInitializer initializer = new DispersedInitializer();

        private Builder() {
        }

        public Builder chains(int chains) {
            this.chains = chains;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder thin(int thin) {
            this.thin = thin;
            return this;
        }

        /// Explicit seeds, one per chain. Takes precedence over [#baseSeed(long)].
        public Builder seeds(long... seeds) {
            this.seeds = seeds == null ? null : seeds.clone();
            return this;
        }

        public Builder baseSeed(long baseSeed) {
            this.baseSeed = baseSeed;
            this.seeds = null;
            return this;
        }

        public Builder stateUpdate(StateUpdate stateUpdate) {
            this.stateUpdate = Objects.requireNonNull(stateUpdate, "stateUpdate");
            return this;
        }

        public Builder initializer(ChainInitializer initializer) {
            this.initializer = Objects.requireNonNull(initializer, "initializer");
            return this;
        }

        public EngineConfig build() {
            if (chains < 2) {
                throw new IllegalArgumentException("At least 2 chains are required, got: " + chains);
            }
            if (iterations < 1) {
                throw new IllegalArgumentException("Iteration count must be positive, got: " + iterations);
            }
            if (thin < 1) {
                throw new IllegalArgumentException("Thinning interval must be positive, got: " + thin);
            }
            if (thin > iterations) {
                throw new IllegalArgumentException(
                    "Thinning interval " + thin + " exceeds iteration count " + iterations);
            }
            long[] resolved = seeds != null ? seeds.clone() : RandomGenerators.chainSeeds(baseSeed, chains);
            if (resolved.length != chains) {
                throw new IllegalArgumentException(
                    "Expected one seed per chain (" + chains + "), got: " + resolved.length);
            }
            return new EngineConfig(this, resolved);
        }
    }
}
