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

import org.apache.commons.rng.UniformRandomProvider;

/// Gamma full conditional of a precision parameter in shape/rate form.
///
/// @param shape posterior shape
/// @param rate posterior rate
public record GammaConditional(double shape, double rate) {

    public double mean() {
        return shape / rate;
    }

    public double sample(UniformRandomProvider rng) {
        return RandomGenerators.gamma(rng, shape, rate);
    }
}
