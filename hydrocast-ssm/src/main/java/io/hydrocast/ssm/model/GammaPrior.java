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

/// Gamma prior in shape/rate form, used for precisions.
///
/// Mean is `shape / rate`.
///
/// @param shape shape α; must be positive and finite
/// @param rate rate β; must be positive and finite
public record GammaPrior(
    @SerializedName("shape") double shape,
    @SerializedName("rate") double rate
) {

    public GammaPrior {
        if (!(shape > 0) || Double.isInfinite(shape)) {
            throw new IllegalArgumentException("Gamma shape must be positive and finite, got: " + shape);
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("Gamma rate must be positive and finite, got: " + rate);
        }
    }

    public double mean() {
        return shape / rate;
    }
}
