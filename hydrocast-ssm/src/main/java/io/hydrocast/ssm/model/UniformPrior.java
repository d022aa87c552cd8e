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

/// Uniform prior on a closed interval, used for the decay coefficient.
///
/// @param lower lower bound
/// @param upper upper bound; must exceed the lower bound
public record UniformPrior(
    @SerializedName("lower") double lower,
    @SerializedName("upper") double upper
) {

    public UniformPrior {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Uniform bounds must be finite, got: [" + lower + ", " + upper + "]");
        }
        if (!(upper > lower)) {
            throw new IllegalArgumentException("Uniform upper bound must exceed lower bound, got: [" + lower + ", " + upper + "]");
        }
    }

    /// The unit interval `[0, 1]`.
    public static UniformPrior unit() {
        return new UniformPrior(0.0, 1.0);
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
