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

import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;

/**
 * Retained draws of one chain, in iteration order.
 *
 * <p>Parameters are stored as one array per {@link Parameter} (fixed
 * parameters repeat their value), latent paths and imputed rainfall as one
 * row per draw. Imputed columns follow {@link PosteriorSampleSet#imputedRainIndices()}.
 * Written by a single chain and published only once complete.
 */
public final class ChainTrace {

    private final int thin;
    private final double[][] parameters;
    private final double[][] states;
    private final double[][] imputedRain;
    private int size;

    ChainTrace(int draws, int thin) {
        this.thin = thin;
        this.parameters = new double[Parameter.values().length][draws];
        this.states = new double[draws][];
        this.imputedRain = new double[draws][];
    }

    void record(ParameterVector p, double[] x, double[] rain, int[] imputedIndices) {
        for (Parameter parameter : Parameter.values()) {
            parameters[parameter.ordinal()][size] = p.get(parameter);
        }
        states[size] = x.clone();
        double[] imputed = new double[imputedIndices.length];
        for (int i = 0; i < imputedIndices.length; i++) {
            imputed[i] = rain[imputedIndices[i]];
        }
        imputedRain[size] = imputed;
        size++;
    }

    /// Number of retained draws.
    public int size() {
        return size;
    }

    /// 1-based iteration number of retained draw `draw`.
    public long iterationOf(int draw) {
        return (long) (draw + 1) * thin;
    }

    /// Trace of one parameter; the returned array is a copy.
    public double[] parameter(Parameter parameter) {
        double[] trace = new double[size];
        System.arraycopy(parameters[parameter.ordinal()], 0, trace, 0, size);
        return trace;
    }

    public double parameter(Parameter parameter, int draw) {
        checkDraw(draw);
        return parameters[parameter.ordinal()][draw];
    }

    public ParameterVector parameters(int draw) {
        checkDraw(draw);
        ParameterVector p = new ParameterVector();
        for (Parameter parameter : Parameter.values()) {
            p.set(parameter, parameters[parameter.ordinal()][draw]);
        }
        return p;
    }

    /// Latent state `x[t]` at a retained draw.
    public double state(int draw, int t) {
        checkDraw(draw);
        return states[draw][t];
    }

    public double[] states(int draw) {
        checkDraw(draw);
        return states[draw].clone();
    }

    /// Imputed rainfall at column `column` of a retained draw.
    public double imputedRain(int draw, int column) {
        checkDraw(draw);
        return imputedRain[draw][column];
    }

    public double[] imputedRain(int draw) {
        checkDraw(draw);
        return imputedRain[draw].clone();
    }

    private void checkDraw(int draw) {
        if (draw < 0 || draw >= size) {
            throw new IndexOutOfBoundsException("Draw " + draw + " outside [0, " + size + ")");
        }
    }
}
