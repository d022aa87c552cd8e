package io.hydrocast.ssm.pipeline;

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

import io.hydrocast.ssm.diagnostics.BurnInPolicy;
import io.hydrocast.ssm.diagnostics.ConvergenceDiagnostics;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.summary.Scale;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a full fit-diagnose-summarise-validate run.
 *
 * <h2>Extension on non-convergence</h2>
 *
 * <p>When {@link #extendOnNonConvergence()} is set and the chains are not
 * approved, the run is repeated from the start with the same seeds and twice
 * the iterations, until approved or {@link #maxIterations()} is reached.
 * The final attempt's verdict is returned either way.
 */
public final class PipelineConfig {

    private final EngineConfig engine;
    private final BurnInPolicy burnIn;
    private final List<Parameter> monitored;
    private final double threshold;
    private final boolean extendOnNonConvergence;
    private final int maxIterations;
    private final boolean logScale;
    private final boolean agreementStatistics;
    private final Set<Scale> scales;

    private PipelineConfig(Builder b) {
        this.engine = b.engine;
        this.burnIn = b.burnIn;
        this.monitored = List.copyOf(b.monitored);
        this.threshold = b.threshold;
        this.extendOnNonConvergence = b.extendOnNonConvergence;
        this.maxIterations = b.maxIterations;
        this.logScale = b.logScale;
        this.agreementStatistics = b.agreementStatistics;
        this.scales = EnumSet.copyOf(b.scales);
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EngineConfig engine() {
        return engine;
    }

    public BurnInPolicy burnIn() {
        return burnIn;
    }

    public List<Parameter> monitored() {
        return monitored;
    }

    public double threshold() {
        return threshold;
    }

    public boolean extendOnNonConvergence() {
        return extendOnNonConvergence;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean logScale() {
        return logScale;
    }

    public boolean agreementStatistics() {
        return agreementStatistics;
    }

    public Set<Scale> scales() {
        return EnumSet.copyOf(scales);
    }

    public ConvergenceDiagnostics diagnostics() {
        return new ConvergenceDiagnostics(monitored, burnIn, threshold);
    }

    @Override
    public String toString() {
        return "PipelineConfig[engine=" + engine + ", burnIn=" + burnIn + ", monitored=" + monitored
            + ", threshold=" + threshold + ", extend=" + extendOnNonConvergence + ", maxIterations=" + maxIterations
            + ", scales=" + scales + "]";
    }

    /**
     * Builder for {@link PipelineConfig}.
     */
    public static final class Builder {
        private EngineConfig engine = EngineConfig.defaults();
        private BurnInPolicy burnIn = BurnInPolicy.fixedDefault();
        private List<Parameter> monitored = ConvergenceDiagnostics.DEFAULT_MONITORED;
        private double threshold = ConvergenceDiagnostics.DEFAULT_THRESHOLD;
        private boolean extendOnNonConvergence = false;
        private int maxIterations = -1;
        private boolean logScale = true;
        private boolean agreementStatistics = true;
        private Set<Scale> scales = EnumSet.allOf(Scale.class);

        private Builder() {
        }

        public Builder engine(EngineConfig engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
            return this;
        }

        public Builder burnIn(BurnInPolicy burnIn) {
            this.burnIn = Objects.requireNonNull(burnIn, "burnIn");
            return this;
        }

        public Builder monitored(List<Parameter> monitored) {
            this.monitored = Objects.requireNonNull(monitored, "monitored");
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder extendOnNonConvergence(boolean extend) {
            this.extendOnNonConvergence = extend;
            return this;
        }

        /// Upper bound on iterations when extending; defaults to four times the engine's count.
        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder logScale(boolean logScale) {
            this.logScale = logScale;
            return this;
        }

        public Builder agreementStatistics(boolean agreementStatistics) {
            this.agreementStatistics = agreementStatistics;
            return this;
        }

        public Builder scales(Set<Scale> scales) {
            this.scales = Objects.requireNonNull(scales, "scales");
            return this;
        }

        public PipelineConfig build() {
            if (maxIterations < 0) {
                maxIterations = engine.iterations() * 4;
            }
            if (maxIterations < engine.iterations()) {
                throw new IllegalArgumentException("Maximum iterations " + maxIterations
                    + " is below the engine's iteration count " + engine.iterations());
            }
            if (scales.isEmpty()) {
                throw new IllegalArgumentException("At least one validation scale is required");
            }
            if (monitored.isEmpty()) {
                throw new IllegalArgumentException("At least one monitored parameter is required");
            }
            return new PipelineConfig(this);
        }
    }
}
