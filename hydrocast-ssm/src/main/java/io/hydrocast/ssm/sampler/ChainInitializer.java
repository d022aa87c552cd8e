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

import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ModelSpecification;
import org.apache.commons.rng.UniformRandomProvider;

/// Supplies the starting state of a chain.
///
/// Implementations must return a fresh [ChainState] per call, fill every
/// parameter the specification samples and hold fixed values for the rest,
/// and use only the supplied generator for randomness so that a chain stays
/// reproducible from its seed.
@FunctionalInterface
public interface ChainInitializer {

    /// @param spec model specification
    /// @param data the fitting dataset; must not be modified
    /// @param chain chain index, 0-based
    /// @param rng the chain's own generator
    /// @return the starting state
    ChainState initialize(ModelSpecification spec, TimeSeriesDataset data, int chain, UniformRandomProvider rng);
}
