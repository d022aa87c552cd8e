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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a dataset into a fitting dataset and separately held ground truth.
 *
 * <p>Masked responses are replaced by {@code NaN} in the fitting dataset and
 * the mask is recorded on it. The removed values travel only in the returned
 * {@link GroundTruth}; natural-scale truth is recovered as {@code exp(y)}.
 *
 * <pre>{@code
 * HeldOutSplit split = HeldOutSplit.fromCutoff(full, LocalDate.of(2021, 6, 1));
 * engine.run(spec, split.fitting());
 * validator.validate(table, split.truth());
 * }</pre>
 */
public final class HeldOutSplit {

    private final TimeSeriesDataset fitting;
    private final GroundTruth truth;

    private HeldOutSplit(TimeSeriesDataset fitting, GroundTruth truth) {
        this.fitting = fitting;
        this.truth = truth;
    }

    /**
     * Withholds every position where {@code mask} is true.
     *
     * @param full the complete dataset
     * @param mask held-out mask aligned with the dataset
     * @return the split
     */
    public static HeldOutSplit byMask(TimeSeriesDataset full, boolean[] mask) {
        Objects.requireNonNull(full, "full");
        Objects.requireNonNull(mask, "mask");
        if (mask.length != full.length()) {
            throw new IllegalArgumentException(
                "Mask has " + mask.length + " entries but dataset has " + full.length());
        }
        double[] response = full.response();
        boolean[] combined = full.heldOut();
        Map<Integer, Double> withheld = new LinkedHashMap<>();
        for (int t = 0; t < mask.length; t++) {
            if (!mask[t]) {
                continue;
            }
            if (!Double.isNaN(response[t])) {
                withheld.put(t, SeriesTransforms.naturalResponse(response[t]));
            }
            response[t] = Double.NaN;
            combined[t] = true;
        }
        TimeSeriesDataset fitting = full.toBuilder()
            .response(response)
            .heldOut(combined)
            .build();
        return new HeldOutSplit(fitting, GroundTruth.ofNatural(withheld));
    }

    /**
     * Withholds every position dated on or after {@code cutoff}.
     */
    public static HeldOutSplit fromCutoff(TimeSeriesDataset full, LocalDate cutoff) {
        Objects.requireNonNull(cutoff, "cutoff");
        boolean[] mask = new boolean[full.length()];
        for (int t = 0; t < mask.length; t++) {
            mask[t] = !full.date(t).isBefore(cutoff);
        }
        return byMask(full, mask);
    }

    /**
     * Withholds the final {@code days} positions.
     */
    public static HeldOutSplit lastDays(TimeSeriesDataset full, int days) {
        if (days < 0 || days >= full.length()) {
            throw new IllegalArgumentException(
                "Held-out tail must be between 0 and " + (full.length() - 1) + " days, got: " + days);
        }
        boolean[] mask = new boolean[full.length()];
        for (int t = full.length() - days; t < mask.length; t++) {
            mask[t] = true;
        }
        return byMask(full, mask);
    }

    public TimeSeriesDataset fitting() {
        return fitting;
    }

    public GroundTruth truth() {
        return truth;
    }
}
