package io.hydrocast.ssm.summary;

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

import java.util.List;
import java.util.Optional;

/// Everything the summarizer derives from one sample set.
///
/// @param forecast forecast envelope per time index
/// @param parameters summaries of every sampled parameter
/// @param imputedRain summaries of every imputed rainfall value
/// @param burnInDraws draws dropped from the start of each chain
/// @param pooledDraws number of draws pooled across surviving chains
public record PosteriorSummary(ForecastTable forecast, List<ParameterSummary> parameters,
                               List<ImputedRainSummary> imputedRain, int burnInDraws, int pooledDraws) {

    public PosteriorSummary {
        parameters = List.copyOf(parameters);
        imputedRain = List.copyOf(imputedRain);
    }

    public Optional<ParameterSummary> parameter(Parameter parameter) {
        return parameters.stream().filter(s -> s.parameter() == parameter).findFirst();
    }
}
