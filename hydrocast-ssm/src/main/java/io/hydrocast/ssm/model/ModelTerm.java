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

import com.google.gson.annotations.SerializedName;

/// Optional terms of the process model.
///
/// With no term active the model is a pure random walk observed with noise.
public enum ModelTerm {

    /// Lagged log1p rainfall effect `beta_rain * rain[t]`.
    @SerializedName("rain")
    RAIN,

    /// Day-of-year harmonics `beta_season_sin * sin + beta_season_cos * cos`.
    @SerializedName("seasonal")
    SEASONAL,

    /// Autoregressive decay toward a baseline `mu0 + beta_decay * (x[t-1] - mu0)`.
    @SerializedName("decay")
    DECAY,

    /// Missing rainfall treated as latent `Normal(mu_rain, 1/tau_rain)` variables.
    @SerializedName("rain_imputation")
    RAIN_IMPUTATION
}
