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

/// Posterior summary of one scalar parameter over the pooled post-burn-in draws.
///
/// @param parameter the parameter
/// @param mean posterior mean
/// @param sd posterior standard deviation
/// @param lower 2.5th percentile
/// @param median 50th percentile
/// @param upper 97.5th percentile
public record ParameterSummary(Parameter parameter, double mean, double sd, double lower, double median,
                               double upper) {

    /// Whether `value` lies within the central 95% interval.
    public boolean covers(double value) {
        return value >= lower && value <= upper;
    }
}
