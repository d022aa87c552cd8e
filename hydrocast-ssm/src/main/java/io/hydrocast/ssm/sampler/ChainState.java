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

import io.hydrocast.ssm.model.ParameterVector;

import java.util.Objects;

/**
 * Mutable sampler state owned by one chain.
 *
 * <p>{@code rain} is the chain's working copy of the covariate: observed
 * entries are copied from the dataset and missing entries hold the current
 * imputed values. The dataset itself is never written.
 */
public final class ChainState {

    private final double[] states;
    private final double[] rain;
    private final ParameterVector parameters;

    public ChainState(double[] states, double[] rain, ParameterVector parameters) {
        this.states = Objects.requireNonNull(states, "states");
        this.rain = Objects.requireNonNull(rain, "rain");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        if (states.length != rain.length) {
            throw new IllegalArgumentException(
                "State path has " + states.length + " entries but rain has " + rain.length);
        }
    }

    public double[] states() {
        return states;
    }

    public double[] rain() {
        return rain;
    }

    public ParameterVector parameters() {
        return parameters;
    }

    public int length() {
        return states.length;
    }
}
