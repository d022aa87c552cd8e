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

/// Raised inside one chain when an update produces a non-finite value.
///
/// The engine catches it per chain and records it on the
/// [PosteriorSampleSet]; it never aborts the other chains.
public class NumericalFailureException extends RuntimeException {

    private final int chain;
    private final long iteration;
    private final String variable;
    private final double value;

    /// @param chain chain index, 0-based
    /// @param iteration iteration at fault, 1-based
    /// @param variable variable at fault, for example `x[3]` or `tau_add`
    /// @param value the offending value
    public NumericalFailureException(int chain, long iteration, String variable, double value) {
        this(chain, iteration, variable, value, null);
    }

    public NumericalFailureException(int chain, long iteration, String variable, double value, Throwable cause) {
        super("Chain " + chain + " produced non-finite " + variable + " = " + value
            + " at iteration " + iteration, cause);
        this.chain = chain;
        this.iteration = iteration;
        this.variable = variable;
        this.value = value;
    }

    public int getChain() {
        return chain;
    }

    public long getIteration() {
        return iteration;
    }

    public String getVariable() {
        return variable;
    }

    public double getValue() {
        return value;
    }
}
