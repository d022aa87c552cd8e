package io.hydrocast.ssm.validation;

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

import io.hydrocast.ssm.summary.Scale;

import java.time.LocalDate;

/// One paired held-out comparison.
///
/// @param index 0-based time index
/// @param date calendar date
/// @param scale scale of the values
/// @param observed ground truth
/// @param predicted posterior median
/// @param lower 2.5th percentile of the envelope
/// @param upper 97.5th percentile of the envelope
public record ResidualRow(int index, LocalDate date, Scale scale, double observed, double predicted,
                          double lower, double upper) {

    /// Observed minus predicted.
    public double residual() {
        return observed - predicted;
    }

    public boolean covered() {
        return observed >= lower && observed <= upper;
    }
}
