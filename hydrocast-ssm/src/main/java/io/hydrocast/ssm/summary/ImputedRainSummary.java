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

import java.time.LocalDate;

/// Posterior summary of one imputed rainfall value.
///
/// The transformed interval is on the log1p covariate scale and is tagged
/// [Scale#LOG]; the natural interval applies `expm1` to every draw before
/// taking percentiles. Both describe the lagged covariate at `index`, which
/// is the rainfall of the previous day.
///
/// @param index 0-based time index of the covariate
/// @param date calendar date of the covariate
/// @param transformed interval of the log1p covariate
/// @param natural interval in rainfall units
public record ImputedRainSummary(int index, LocalDate date, CredibleInterval transformed, CredibleInterval natural) {
}
