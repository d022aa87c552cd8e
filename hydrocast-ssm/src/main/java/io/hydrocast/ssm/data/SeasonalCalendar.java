package io.hydrocast.ssm.data;

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

/// Deterministic seasonal covariates derived from the calendar.
///
/// The phase is `2π · dayOfYear / 365`. Leap years are not special-cased:
/// day 366 lands slightly past a full cycle, and the phase of every later
/// day in a leap year drifts by one day's worth (about 1°).
public final class SeasonalCalendar {

    /// Divisor for the day-of-year phase.
    public static final double DAYS_PER_YEAR = 365.0;

    private SeasonalCalendar() {
    }

    /// Phase angle in radians for a calendar date.
    public static double phase(LocalDate date) {
        return 2.0 * Math.PI * date.getDayOfYear() / DAYS_PER_YEAR;
    }

    public static double[] sine(LocalDate[] dates) {
        double[] out = new double[dates.length];
        for (int i = 0; i < dates.length; i++) {
            out[i] = Math.sin(phase(dates[i]));
        }
        return out;
    }

    public static double[] cosine(LocalDate[] dates) {
        double[] out = new double[dates.length];
        for (int i = 0; i < dates.length; i++) {
            out[i] = Math.cos(phase(dates[i]));
        }
        return out;
    }
}
