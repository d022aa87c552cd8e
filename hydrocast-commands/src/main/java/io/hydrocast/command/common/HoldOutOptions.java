package io.hydrocast.command.common;

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

import io.hydrocast.ssm.data.HeldOutSplit;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import picocli.CommandLine;

import java.time.LocalDate;

/**
 * Shared held-out split options. At most one of the two may be given.
 */
public class HoldOutOptions {

    @CommandLine.Option(
        names = {"--holdout-from"},
        description = "Withhold every response dated on or after this ISO date for validation"
    )
    private LocalDate cutoff;

    @CommandLine.Option(
        names = {"--holdout-days"},
        description = "Withhold the final N days of response for validation"
    )
    private Integer days;

    public boolean isRequested() {
        return cutoff != null || days != null;
    }

    /**
     * @throws IllegalStateException if both a cutoff and a day count are given
     */
    public void validate() {
        if (cutoff != null && days != null) {
            throw new IllegalStateException("Cannot specify both --holdout-from and --holdout-days");
        }
    }

    /**
     * Splits the dataset, or returns null when no hold-out was requested.
     */
    public HeldOutSplit split(TimeSeriesDataset full) {
        if (cutoff != null) {
            return HeldOutSplit.fromCutoff(full, cutoff);
        }
        if (days != null) {
            return HeldOutSplit.lastDays(full, days);
        }
        return null;
    }
}
