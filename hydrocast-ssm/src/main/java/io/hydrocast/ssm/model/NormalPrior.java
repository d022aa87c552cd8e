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

/// Normal prior in mean/variance form, used for regression coefficients and levels.
///
/// @param mean prior mean; must be finite
/// @param variance prior variance; must be positive and finite
public record NormalPrior(
    @SerializedName("mean") double mean,
    @SerializedName("variance") double variance
) {

    public NormalPrior {
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Normal prior mean must be finite, got: " + mean);
        }
        if (!(variance > 0) || Double.isInfinite(variance)) {
            throw new IllegalArgumentException("Normal prior variance must be positive and finite, got: " + variance);
        }
    }

    /// Zero-mean prior with the given variance.
    public static NormalPrior centered(double variance) {
        return new NormalPrior(0.0, variance);
    }

    public double precision() {
        return 1.0 / variance;
    }
}
