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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable container of aligned daily series used as sampler input.
 *
 * <h2>Contents</h2>
 *
 * <ul>
 *   <li><b>dates</b> - calendar index, strictly ascending</li>
 *   <li><b>response</b> - log-scale observations {@code y[t]}; {@code NaN} when missing</li>
 *   <li><b>rain</b> - log1p rainfall covariate, already lagged one day; {@code NaN} when missing</li>
 *   <li><b>seasonSin / seasonCos</b> - calendar covariates, always defined</li>
 *   <li><b>heldOut</b> - true where the response was withheld for validation</li>
 * </ul>
 *
 * <p>The dataset never carries withheld ground truth: a held-out position has
 * {@code NaN} as its response. See {@link HeldOutSplit}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * // From natural-unit flow and rainfall (log transform, shift and lag applied)
 * TimeSeriesDataset data = TimeSeriesDataset.fromNaturalScale(dates, flow, rainfall, GapPolicy.REJECT);
 *
 * // From values already on the model scale
 * TimeSeriesDataset data = TimeSeriesDataset.builder()
 *     .startDate(LocalDate.of(2020, 1, 1))
 *     .response(new double[] {0.1, Double.NaN, 0.1})
 *     .build();
 * }</pre>
 */
public final class TimeSeriesDataset {

    private final LocalDate[] dates;
    private final double[] response;
    private final double[] rain;
    private final double[] seasonSin;
    private final double[] seasonCos;
    private final boolean[] heldOut;
    private final int observedCount;

    private TimeSeriesDataset(LocalDate[] dates, double[] response, double[] rain, boolean[] heldOut) {
        this.dates = dates;
        this.response = response;
        this.rain = rain;
        this.heldOut = heldOut;
        this.seasonSin = SeasonalCalendar.sine(dates);
        this.seasonCos = SeasonalCalendar.cosine(dates);
        int observed = 0;
        for (double v : response) {
            if (!Double.isNaN(v)) {
                observed++;
            }
        }
        this.observedCount = observed;
    }

    /**
     * Builds a dataset from natural-unit flow and rainfall.
     *
     * <p>Flow is log transformed, rainfall is log1p transformed and lagged by
     * one day, with the fixed shift of {@link SeriesTransforms#SHIFT} applied
     * to non-positive values.
     *
     * @param dates calendar index
     * @param flow flow in natural units, {@code NaN} when missing
     * @param rainfall rainfall in natural units, {@code NaN} when missing; may be null
     * @param gapPolicy how calendar gaps are treated
     * @return the dataset
     */
    public static TimeSeriesDataset fromNaturalScale(LocalDate[] dates, double[] flow, double[] rainfall,
                                                     GapPolicy gapPolicy) {
        Builder builder = builder()
            .dates(dates)
            .response(SeriesTransforms.logResponse(flow))
            .gapPolicy(gapPolicy);
        if (rainfall != null) {
            builder.rain(SeriesTransforms.lagByOneDay(SeriesTransforms.log1pRain(rainfall)));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this dataset's series.
     */
    public Builder toBuilder() {
        return new Builder()
            .dates(dates)
            .response(response)
            .rain(rain)
            .heldOut(heldOut)
            .gapPolicy(GapPolicy.TOLERATE);
    }

    public int length() {
        return response.length;
    }

    public LocalDate date(int t) {
        return dates[t];
    }

    public LocalDate[] dates() {
        return dates.clone();
    }

    /** Log-scale response at {@code t}, {@code NaN} when missing. */
    public double response(int t) {
        return response[t];
    }

    public double[] response() {
        return response.clone();
    }

    public boolean isObserved(int t) {
        return !Double.isNaN(response[t]);
    }

    public int observedCount() {
        return observedCount;
    }

    /** Lagged log1p rainfall at {@code t}, {@code NaN} when missing. */
    public double rain(int t) {
        return rain[t];
    }

    public double[] rain() {
        return rain.clone();
    }

    public boolean isRainMissing(int t) {
        return Double.isNaN(rain[t]);
    }

    /**
     * Indices where the rainfall covariate is missing, ascending.
     */
    public int[] missingRainIndices() {
        List<Integer> missing = new ArrayList<>();
        for (int t = 0; t < rain.length; t++) {
            if (Double.isNaN(rain[t])) {
                missing.add(t);
            }
        }
        return missing.stream().mapToInt(Integer::intValue).toArray();
    }

    public double seasonSin(int t) {
        return seasonSin[t];
    }

    public double seasonCos(int t) {
        return seasonCos[t];
    }

    public boolean isHeldOut(int t) {
        return heldOut[t];
    }

    public boolean[] heldOut() {
        return heldOut.clone();
    }

    public int heldOutCount() {
        int count = 0;
        for (boolean b : heldOut) {
            if (b) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeriesDataset)) return false;
        TimeSeriesDataset that = (TimeSeriesDataset) o;
        return Arrays.equals(dates, that.dates)
            && Arrays.equals(response, that.response)
            && Arrays.equals(rain, that.rain)
            && Arrays.equals(heldOut, that.heldOut);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(dates);
        result = 31 * result + Arrays.hashCode(response);
        result = 31 * result + Arrays.hashCode(rain);
        return 31 * result + Arrays.hashCode(heldOut);
    }

    @Override
    public String toString() {
        return String.format("TimeSeriesDataset[n=%d, observed=%d, heldOut=%d, from=%s, to=%s]",
            length(), observedCount, heldOutCount(), dates[0], dates[dates.length - 1]);
    }

    /**
     * Builder that validates the input contract on {@link #build()}.
     *
     * <p>Rejected inputs: empty series, mismatched lengths, infinite values,
     * unsorted dates, and calendar gaps under {@link GapPolicy#REJECT}.
     */
    public static final class Builder {
        private LocalDate[] dates;
        private LocalDate startDate;
        private double[] response;
        private double[] rain;
        private boolean[] heldOut;
        private GapPolicy gapPolicy = GapPolicy.REJECT;

        private Builder() {
        }

        public Builder dates(LocalDate[] dates) {
            this.dates = dates == null ? null : dates.clone();
            return this;
        }

        /** Generates consecutive daily dates beginning at {@code startDate}. */
        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder response(double[] response) {
            this.response = response == null ? null : response.clone();
            return this;
        }

        public Builder rain(double[] rain) {
            this.rain = rain == null ? null : rain.clone();
            return this;
        }

        public Builder heldOut(boolean[] heldOut) {
            this.heldOut = heldOut == null ? null : heldOut.clone();
            return this;
        }

        public Builder gapPolicy(GapPolicy gapPolicy) {
            this.gapPolicy = Objects.requireNonNull(gapPolicy, "gapPolicy");
            return this;
        }

        public TimeSeriesDataset build() {
            if (response == null || response.length == 0) {
                throw new IllegalArgumentException("Response series cannot be empty");
            }
            int n = response.length;
            LocalDate[] index = dates;
            if (index == null) {
                LocalDate start = startDate != null ? startDate : LocalDate.of(2000, 1, 1);
                index = new LocalDate[n];
                for (int t = 0; t < n; t++) {
                    index[t] = start.plusDays(t);
                }
            }
            if (index.length != n) {
                throw new IllegalArgumentException(
                    "Date index has " + index.length + " entries but response has " + n);
            }
            double[] covariate = rain;
            if (covariate == null) {
                covariate = new double[n];
                Arrays.fill(covariate, Double.NaN);
            } else if (covariate.length != n) {
                throw new IllegalArgumentException(
                    "Rain series has " + covariate.length + " entries but response has " + n);
            }
            boolean[] mask = heldOut != null ? heldOut : new boolean[n];
            if (mask.length != n) {
                throw new IllegalArgumentException(
                    "Held-out mask has " + mask.length + " entries but response has " + n);
            }

            checkFinite("response", response);
            checkFinite("rain", covariate);
            checkCalendar(index, gapPolicy);

            return new TimeSeriesDataset(index, response.clone(), covariate.clone(), mask.clone());
        }

        private static void checkFinite(String name, double[] values) {
            for (int t = 0; t < values.length; t++) {
                if (Double.isInfinite(values[t])) {
                    throw new IllegalArgumentException(name + "[" + (t + 1) + "] is not finite: " + values[t]);
                }
            }
        }

        private static void checkCalendar(LocalDate[] index, GapPolicy policy) {
            for (int t = 0; t < index.length; t++) {
                if (index[t] == null) {
                    throw new IllegalArgumentException("Date at position " + (t + 1) + " is missing");
                }
                if (t == 0) {
                    continue;
                }
                if (!index[t].isAfter(index[t - 1])) {
                    throw new IllegalArgumentException(
                        "Dates must be strictly ascending: " + index[t - 1] + " followed by " + index[t]);
                }
                if (policy == GapPolicy.REJECT && !index[t].equals(index[t - 1].plusDays(1))) {
                    throw new IllegalArgumentException(
                        "Calendar gap between " + index[t - 1] + " and " + index[t]);
                }
            }
        }
    }
}
