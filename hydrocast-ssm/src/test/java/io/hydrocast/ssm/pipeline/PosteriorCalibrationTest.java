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
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.sampler.InferenceEngine;
import io.hydrocast.ssm.simulate.SyntheticSeries;
import io.hydrocast.ssm.simulate.SyntheticSeriesGenerator;
import io.hydrocast.ssm.summary.ParameterSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Fits repeated synthetic years and checks that the 95% intervals of the
/// sampled parameters contain the values the data were drawn from.
@Tag("accuracy")
public class PosteriorCalibrationTest {

    private static final Logger logger = LogManager.getLogger(PosteriorCalibrationTest.class);

    private static final int TRIALS = 30;

    @Test
    void testParameterIntervalsCoverTrueValues() {
        ModelSpecification spec = ModelSpecification.randomWalkWithRain();
        ParameterVector truth = ParameterVector.fixedValuesOf(spec)
            .set(Parameter.TAU_OBS, 100.0)
            .set(Parameter.TAU_ADD, 25.0)
            .set(Parameter.BETA_RAIN, 0.05);
        PipelineConfig config = PipelineConfig.builder()
            .engine(EngineConfig.builder().iterations(3000).baseSeed(77L).build())
            .burnIn(BurnInPolicy.fixed(1000))
            .build();

        InferenceEngine engine = new InferenceEngine();
        int checks = 0;
        int covered = 0;
        try {
            ForecastPipeline pipeline = new ForecastPipeline(engine, config);
            for (int trial = 0; trial < TRIALS; trial++) {
                SyntheticSeries series = new SyntheticSeriesGenerator(spec, truth)
                    .length(365)
                    .startDate(LocalDate.of(2015, 1, 1))
                    .generate(1000L + trial);
                ForecastResult result = pipeline.run(spec, series.dataset(), null);
                List<ParameterSummary> summaries = result.summary().parameters();
                for (ParameterSummary summary : summaries) {
                    checks++;
                    if (summary.covers(truth.get(summary.parameter()))) {
                        covered++;
                    } else {
                        logger.info("Trial {}: {} = {} outside [{}, {}]", trial, summary.parameter(),
                            truth.get(summary.parameter()), summary.lower(), summary.upper());
                    }
                }
            }
        } finally {
            engine.shutdown();
        }

        assertThat(checks).isEqualTo(TRIALS * 3);
        assertThat((double) covered / checks).isGreaterThanOrEqualTo(0.90);
    }
}
