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

/// Forecast envelope at one time index.
///
/// @param index 0-based time index
/// @param date calendar date
/// @param natural interval of `exp(x[t])`
/// @param log interval of `x[t]`; null unless log-scale columns were requested
/// @param heldOut whether the response at this index was withheld from fitting
public record ForecastRow(int index, LocalDate date, CredibleInterval natural, CredibleInterval log, boolean heldOut) {

    public double median(Scale scale) {
        if (scale == Scale.NATURAL) {
            return natural.median();
        }
        if (log == null) {
            throw new IllegalStateException("Log-scale columns were not computed");
        }
        return log.median();
    }

    public CredibleInterval interval(Scale scale) {
        if (scale == Scale.NATURAL) {
            return natural;
        }
        if (log == null) {
            throw new IllegalStateException("Log-scale columns were not computed");
        }
        return log;
    }
}
