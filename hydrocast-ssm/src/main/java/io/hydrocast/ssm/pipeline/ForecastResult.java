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

import io.hydrocast.ssm.diagnostics.ConvergenceReport;
import io.hydrocast.ssm.sampler.PosteriorSampleSet;
import io.hydrocast.ssm.summary.PosteriorSummary;
import io.hydrocast.ssm.validation.ValidationReport;

import java.util.Optional;

/// Outcome of a [ForecastPipeline] run.
///
/// The sample set is kept so callers can inspect draws; it is not part of
/// any written artifact.
///
/// @param samples the final attempt's draws
/// @param convergence the final attempt's verdict
/// @param summary forecast, parameter and imputed-rain summaries
/// @param validation skill metrics; null when no ground truth was supplied
/// @param attempts number of sampling runs made
public record ForecastResult(PosteriorSampleSet samples, ConvergenceReport convergence, PosteriorSummary summary,
                             ValidationReport validation, int attempts) {

    public Optional<ValidationReport> validationIfAny() {
        return Optional.ofNullable(validation);
    }

    public boolean converged() {
        return convergence.approved();
    }
}
