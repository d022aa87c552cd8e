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

import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

/// Normal full conditional in mean/precision form.
///
/// A precision of zero denotes a flat conditional (no information); its
/// mean is then undefined and only a bounded draw is meaningful.
///
/// @param mean conditional mean
/// @param precision conditional precision, non-negative
public record NormalConditional(double mean, double precision) {

    /// Builds a conditional from its total precision and the precision-weighted sum of its terms.
    public static NormalConditional fromNaturalParameters(double precision, double weightedSum) {
        return new NormalConditional(precision > 0 ? weightedSum / precision : Double.NaN, precision);
    }

    public double standardDeviation() {
        return 1.0 / Math.sqrt(precision);
    }

    public boolean isFlat() {
        return precision == 0.0;
    }

    /// Draws one value using a standard normal sampler.
    public double sample(NormalizedGaussianSampler gaussian) {
        return mean + gaussian.sample() / Math.sqrt(precision);
    }
}
