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

/// Prior on the first latent state `x[1] ~ Normal(mean, 1/precision)`.
///
/// The simple variants fix both mean and precision. The decay variant ties
/// the mean to the baseline level `mu0`, so the first state is drawn around
/// the same level the process decays toward.
///
/// @param kind whether the mean is a constant or the baseline `mu0`
/// @param mean constant mean; ignored for [Kind#BASELINE]
/// @param precision prior precision `tau_ic`; must be positive and finite
public record InitialCondition(
    @SerializedName("kind") Kind kind,
    @SerializedName("mean") double mean,
    @SerializedName("precision") double precision
) {

    public enum Kind {
        @SerializedName("fixed")
        FIXED,
        @SerializedName("baseline")
        BASELINE
    }

    public InitialCondition {
        if (kind == null) {
            throw new IllegalArgumentException("Initial condition kind is required");
        }
        if (kind == Kind.FIXED && !Double.isFinite(mean)) {
            throw new IllegalArgumentException("Initial condition mean must be finite, got: " + mean);
        }
        if (!(precision > 0) || Double.isInfinite(precision)) {
            throw new IllegalArgumentException("Initial condition precision must be positive and finite, got: " + precision);
        }
    }

    public static InitialCondition fixed(double mean, double precision) {
        return new InitialCondition(Kind.FIXED, mean, precision);
    }

    public static InitialCondition baseline(double precision) {
        return new InitialCondition(Kind.BASELINE, 0.0, precision);
    }

    public boolean tiedToBaseline() {
        return kind == Kind.BASELINE;
    }

    /// Resolves the prior mean for the current baseline value.
    public double meanGiven(double mu0) {
        return tiedToBaseline() ? mu0 : mean;
    }
}
