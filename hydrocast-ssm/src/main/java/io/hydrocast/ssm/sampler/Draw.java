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

/// One full retained draw of a chain: parameters, latent path and imputed rainfall.
///
/// @param chain chain index
/// @param iteration 1-based iteration number
/// @param parameters every parameter value at this draw
/// @param states latent path `x[1..n]`
/// @param imputedRain imputed rainfall, aligned with [PosteriorSampleSet#imputedRainIndices()]
public record Draw(int chain, long iteration, ParameterVector parameters, double[] states, double[] imputedRain) {
}
