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
import io.hydrocast.ssm.model.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Every retained draw of every chain, as produced by the {@link InferenceEngine}.
 *
 * <p>No burn-in has been removed. Failed chains are kept as
 * {@link ChainResult}s carrying their {@link NumericalFailureException};
 * diagnostics and summaries only read surviving chains.
 */
public final class PosteriorSampleSet {

    private final ModelSpecification specification;
    private final TimeSeriesDataset dataset;
    private final EngineConfig config;
    private final List<ChainResult> chains;
    private final int[] imputedRainIndices;

    public PosteriorSampleSet(ModelSpecification specification, TimeSeriesDataset dataset, EngineConfig config,
                              List<ChainResult> chains, int[] imputedRainIndices) {
        this.specification = Objects.requireNonNull(specification, "specification");
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.config = Objects.requireNonNull(config, "config");
        this.chains = List.copyOf(chains);
        this.imputedRainIndices = imputedRainIndices.clone();
    }

    public ModelSpecification specification() {
        return specification;
    }

    public TimeSeriesDataset dataset() {
        return dataset;
    }

    public EngineConfig config() {
        return config;
    }

    /// All chains, failed ones included, in chain order.
    public List<ChainResult> chains() {
        return chains;
    }

    public List<ChainResult> survivingChains() {
        List<ChainResult> surviving = new ArrayList<>();
        for (ChainResult chain : chains) {
            if (chain.succeeded()) {
                surviving.add(chain);
            }
        }
        return Collections.unmodifiableList(surviving);
    }

    public int survivingCount() {
        return survivingChains().size();
    }

    public boolean hasSurvivors() {
        return survivingCount() > 0;
    }

    public List<NumericalFailureException> failures() {
        List<NumericalFailureException> failures = new ArrayList<>();
        for (ChainResult chain : chains) {
            chain.failureIfAny().ifPresent(failures::add);
        }
        return Collections.unmodifiableList(failures);
    }

    /// Retained draws per surviving chain.
    public int drawsPerChain() {
        return config.retainedDraws();
    }

    public int thin() {
        return config.thin();
    }

    public int seriesLength() {
        return dataset.length();
    }

    /// Time indices of the imputed rainfall columns, ascending.
    public int[] imputedRainIndices() {
        return imputedRainIndices.clone();
    }

    /// Traces of one parameter, one row per surviving chain.
    public double[][] parameterTraces(Parameter parameter) {
        List<ChainResult> surviving = survivingChains();
        double[][] traces = new double[surviving.size()][];
        for (int c = 0; c < traces.length; c++) {
            traces[c] = surviving.get(c).trace().parameter(parameter);
        }
        return traces;
    }

    /**
     * Full view of one retained draw.
     *
     * @param chain chain index
     * @param draw retained draw index, 0-based
     * @return the draw
     * @throws IllegalStateException if the chain failed
     */
    public Draw draw(int chain, int draw) {
        ChainResult result = chains.get(chain);
        if (!result.succeeded()) {
            throw new IllegalStateException("Chain " + chain + " failed: " + result.failure().getMessage());
        }
        ChainTrace trace = result.trace();
        return new Draw(chain, trace.iterationOf(draw), trace.parameters(draw), trace.states(draw),
            trace.imputedRain(draw));
    }

    @Override
    public String toString() {
        return "PosteriorSampleSet[chains=" + chains.size() + ", surviving=" + survivingCount()
            + ", drawsPerChain=" + drawsPerChain() + ", n=" + dataset.length() + "]";
    }
}
