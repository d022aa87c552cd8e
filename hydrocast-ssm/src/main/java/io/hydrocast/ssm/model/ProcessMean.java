package io.hydrocast.ssm.model;

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

/// The process-model mean `mu[t]`, evaluated for any active term set.
///
/// ```text
/// mu[t] = mu0 + beta_decay * (x[t-1] - mu0)
///       + beta_rain * rain[t]
///       + beta_season_sin * season_sin[t] + beta_season_cos * season_cos[t]
/// ```
///
/// Inactive terms contribute nothing. Without the decay term `beta_decay` is
/// 1 and `mu0` cancels, which is the plain random walk.
///
/// The mean splits into an autoregressive part `decay * x[t-1]` and an
/// exogenous part that does not depend on the previous state; samplers use
/// the split form.
public final class ProcessMean {

    private ProcessMean() {
    }

    /// Full `mu[t]` for a given previous state.
    public static double evaluate(ModelSpecification spec, ParameterVector p, double previousState,
                                  double rain, double seasonSin, double seasonCos) {
        return decay(spec, p) * previousState + exogenous(spec, p, rain, seasonSin, seasonCos);
    }

    /// Effective autoregressive coefficient: `beta_decay`, or 1 without the decay term.
    public static double decay(ModelSpecification spec, ParameterVector p) {
        return spec.hasTerm(ModelTerm.DECAY) ? p.get(Parameter.BETA_DECAY) : 1.0;
    }

    /// The part of `mu[t]` that does not depend on `x[t-1]`.
    public static double exogenous(ModelSpecification spec, ParameterVector p,
                                   double rain, double seasonSin, double seasonCos) {
        double value = 0.0;
        if (spec.hasTerm(ModelTerm.DECAY)) {
            value += p.get(Parameter.MU0) * (1.0 - p.get(Parameter.BETA_DECAY));
        }
        value += covariateEffect(spec, p, rain, seasonSin, seasonCos);
        return value;
    }

    /// Sum of the active regression terms.
    public static double covariateEffect(ModelSpecification spec, ParameterVector p,
                                         double rain, double seasonSin, double seasonCos) {
        double value = 0.0;
        if (spec.hasTerm(ModelTerm.RAIN)) {
            value += p.get(Parameter.BETA_RAIN) * rain;
        }
        if (spec.hasTerm(ModelTerm.SEASONAL)) {
            value += p.get(Parameter.BETA_SEASON_SIN) * seasonSin
                + p.get(Parameter.BETA_SEASON_COS) * seasonCos;
        }
        return value;
    }
}
