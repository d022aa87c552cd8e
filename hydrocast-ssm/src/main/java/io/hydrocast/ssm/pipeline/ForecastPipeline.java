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

import io.hydrocast.ssm.data.GroundTruth;
import io.hydrocast.ssm.data.HeldOutSplit;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.diagnostics.ConvergenceDiagnostics;
import io.hydrocast.ssm.diagnostics.ConvergenceReport;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.sampler.InferenceEngine;
import io.hydrocast.ssm.sampler.PosteriorSampleSet;
import io.hydrocast.ssm.summary.PosteriorSummarizer;
import io.hydrocast.ssm.summary.PosteriorSummary;
import io.hydrocast.ssm.validation.ValidationEngine;
import io.hydrocast.ssm.validation.ValidationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Wires the engine, diagnostics, summarizer and validator into one run.
 *
 * <pre>{@code
 * dataset + specification -> InferenceEngine -> ConvergenceDiagnostics
 *                         -> PosteriorSummarizer -> ValidationEngine (with ground truth)
 * }</pre>
 *
 * <p>Ground truth is handed only to the validation step. Non-convergence is
 * reported on the result; a run in which every chain failed raises
 * {@link NoSurvivingChainsException}.
 */
public final class ForecastPipeline {

    private static final Logger logger = LogManager.getLogger(ForecastPipeline.class);

    private final InferenceEngine engine;
    private final PipelineConfig config;

    public ForecastPipeline(InferenceEngine engine, PipelineConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
    }

    public PipelineConfig config() {
        return config;
    }

    /// Fits the fitting half of a split and scores it against the withheld half.
    public ForecastResult run(ModelSpecification spec, HeldOutSplit split) {
        return run(spec, split.fitting(), split.truth());
    }

    /**
     * Runs the full data flow.
     *
     * @param spec model specification
     * @param dataset fitting dataset
     * @param truth withheld ground truth, or null to skip validation
     * @return the result of the final sampling attempt
     * @throws IllegalArgumentException for configuration or input-contract violations
     * @throws NoSurvivingChainsException if every chain failed
     */
    public ForecastResult run(ModelSpecification spec, TimeSeriesDataset dataset, GroundTruth truth) {
        ConvergenceDiagnostics diagnostics = config.diagnostics();
        for (Parameter parameter : config.monitored()) {
            if (!spec.isSampled(parameter)) {
                throw new IllegalArgumentException("Monitored parameter " + parameter
                    + " is not sampled under terms " + spec.terms());
            }
        }

        EngineConfig engineConfig = config.engine();
        int attempts = 0;
        PosteriorSampleSet samples;
        ConvergenceReport report;
        while (true) {
            attempts++;
            samples = engine.run(spec, dataset, engineConfig);
            if (!samples.hasSurvivors()) {
                throw new NoSurvivingChainsException(samples.failures());
            }
            report = diagnostics.evaluate(samples);
            if (report.approved() || !config.extendOnNonConvergence()
                || engineConfig.iterations() >= config.maxIterations()) {
                break;
            }
            int next = (int) Math.min((long) engineConfig.iterations() * 2, config.maxIterations());
            logger.info("Not converged after {} iterations; resampling with {} iterations",
                engineConfig.iterations(), next);
            engineConfig = engineConfig.withIterations(next);
        }

        PosteriorSummary summary = new PosteriorSummarizer(config.logScale()).summarize(samples, report);

        ValidationReport validation = null;
        if (truth != null && !truth.isEmpty()) {
            validation = new ValidationEngine(config.agreementStatistics())
                .validate(summary.forecast(), truth, config.scales());
        }
        return new ForecastResult(samples, report, summary, validation, attempts);
    }
}
