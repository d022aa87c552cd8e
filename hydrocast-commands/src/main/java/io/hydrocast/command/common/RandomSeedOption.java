package io.hydrocast.command.common;

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

import picocli.CommandLine;

import java.util.Arrays;

/**
 * Shared seed options: one base seed, or one explicit seed per chain.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     * When the value is null, current time is used for non-deterministic behavior.
     *
     * @param value the seed value, or null for auto-generated seed
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the effective seed value, generating one from current time if needed.
         */
        public long effective() {
            return value != null ? value : System.currentTimeMillis();
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "auto (time-based)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Base seed from which every chain seed is derived (default: current time)",
        converter = SeedConverter.class
    )
    private Seed seed;

    @CommandLine.Option(
        names = {"--chain-seeds"},
        description = "Explicit comma-separated seed per chain; overrides --seed",
        split = ","
    )
    private long[] chainSeeds;

    /**
     * Gets the Seed record.
     */
    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Gets the effective base seed, using current time if not specified.
     */
    public long getSeed() {
        return getSeedRecord().effective();
    }

    public boolean isSeedSpecified() {
        return (seed != null && seed.isExplicit()) || chainSeeds != null;
    }

    /**
     * Explicit per-chain seeds, or null when chain seeds derive from the base seed.
     */
    public long[] getChainSeeds() {
        return chainSeeds == null ? null : chainSeeds.clone();
    }

    @Override
    public String toString() {
        return chainSeeds != null ? Arrays.toString(chainSeeds) : getSeedRecord().toString();
    }
}
