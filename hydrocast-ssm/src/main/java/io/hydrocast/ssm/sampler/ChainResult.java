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

import java.util.Optional;

/// Outcome of one chain: a complete trace, or the failure that aborted it.
///
/// @param chain chain index, 0-based
/// @param seed the chain's seed
/// @param trace retained draws; null when the chain failed
/// @param failure the numerical failure; null when the chain completed
public record ChainResult(int chain, long seed, ChainTrace trace, NumericalFailureException failure) {

    public ChainResult {
        if ((trace == null) == (failure == null)) {
            throw new IllegalArgumentException("A chain result holds exactly one of trace or failure");
        }
    }

    public static ChainResult completed(int chain, long seed, ChainTrace trace) {
        return new ChainResult(chain, seed, trace, null);
    }

    public static ChainResult failed(int chain, long seed, NumericalFailureException failure) {
        return new ChainResult(chain, seed, null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<NumericalFailureException> failureIfAny() {
        return Optional.ofNullable(failure);
    }
}
