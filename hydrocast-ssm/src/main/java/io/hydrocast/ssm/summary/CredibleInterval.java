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

import com.google.gson.annotations.SerializedName;

/// Central 95% credible interval with its median.
///
/// The log and natural forms are related by the monotonic maps `exp` and
/// `log`, so converting an interval and converting it back reproduces it to
/// rounding error.
///
/// @param lower 2.5th percentile
/// @param median 50th percentile
/// @param upper 97.5th percentile
/// @param scale scale of the three values
public record CredibleInterval(
    @SerializedName("lower") double lower,
    @SerializedName("median") double median,
    @SerializedName("upper") double upper,
    @SerializedName("scale") Scale scale
) {

    public CredibleInterval {
        if (scale == null) {
            throw new IllegalArgumentException("Interval scale is required");
        }
        if (lower > median || median > upper) {
            throw new IllegalArgumentException(
                "Interval bounds out of order: [" + lower + ", " + median + ", " + upper + "]");
        }
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    /// Exponentiates a log-scale interval; a natural-scale interval is returned as is.
    public CredibleInterval toNaturalScale() {
        if (scale == Scale.NATURAL) {
            return this;
        }
        return new CredibleInterval(Math.exp(lower), Math.exp(median), Math.exp(upper), Scale.NATURAL);
    }

    /// Takes logs of a natural-scale interval; a log-scale interval is returned as is.
    ///
    /// @throws IllegalArgumentException if a bound is not positive
    public CredibleInterval toLogScale() {
        if (scale == Scale.LOG) {
            return this;
        }
        if (!(lower > 0)) {
            throw new IllegalArgumentException("Cannot take the log of a non-positive bound: " + lower);
        }
        return new CredibleInterval(Math.log(lower), Math.log(median), Math.log(upper), Scale.LOG);
    }
}
