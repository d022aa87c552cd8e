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

import java.util.Objects;

/**
 * Descriptive statistics of a series with missing values.
 *
 * <h2>Purpose</h2>
 *
 * <p>Holds count, range, mean and variance of the non-missing entries of a
 * series. Used to derive dispersed starting values for the sampler and to
 * summarise parameter traces.
 *
 * <h2>Conventions</h2>
 *
 * <ul>
 *   <li>{@code NaN} entries are skipped</li>
 *   <li>variance is the unbiased sample variance (divisor {@code count - 1});
 *       it is {@code NaN} for fewer than two values</li>
 * </ul>
 */
public final class SeriesStatistics {

    static final double RELATIVE_SPREAD_TOLERANCE = 1e-12;

    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double variance;

    public SeriesStatistics(long count, double min, double max, double mean, double variance) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.variance = variance;
    }

    /**
     * Computes statistics over the non-missing values of an array.
     *
     * @param values the series, {@code NaN} for missing
     * @return computed statistics; mean is {@code NaN} when nothing is observed
     */
    public static SeriesStatistics compute(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        return compute(values, 0, values.length);
    }

    /**
     * Computes statistics over {@code values[from, to)}.
     */
    public static SeriesStatistics compute(double[] values, int from, int to) {
        long count = 0;
        double min = Double.NaN;
        double max = Double.NaN;
        double sum = 0;

        // First pass: count, range, mean
        for (int i = from; i < to; i++) {
            double v = values[i];
            if (Double.isNaN(v)) continue;
            if (count == 0 || v < min) min = v;
            if (count == 0 || v > max) max = v;
            sum += v;
            count++;
        }
        if (count == 0) {
            return new SeriesStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        double mean = sum / count;

        // Second pass: squared deviations
        double m2 = 0;
        for (int i = from; i < to; i++) {
            double v = values[i];
            if (Double.isNaN(v)) continue;
            double diff = v - mean;
            m2 += diff * diff;
        }
        double variance = count > 1 ? m2 / (count - 1) : Double.NaN;
        return new SeriesStatistics(count, min, max, mean, variance);
    }

    /**
     * Statistics of the first differences {@code v[t] - v[t-1]} where both are observed.
     */
    public static SeriesStatistics ofDifferences(double[] values) {
        if (values.length < 2) {
            return compute(new double[0]);
        }
        double[] diffs = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diffs[i - 1] = values[i] - values[i - 1];
        }
        return compute(diffs);
    }

    public long count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public double mean() {
        return mean;
    }

    public double variance() {
        return variance;
    }

    public double stdDev() {
        return Math.sqrt(variance);
    }

    /**
     * True when the variance is defined and exceeds rounding noise, i.e.
     * {@code variance > 1e-12 * max(1, mean^2)}.
     */
    public boolean hasSpread() {
        return count > 1 && Double.isFinite(variance)
            && variance > RELATIVE_SPREAD_TOLERANCE * Math.max(1.0, mean * mean);
    }

    @Override
    public String toString() {
        return String.format("SeriesStatistics[n=%d, mean=%.4f, sd=%.4f, range=[%.4f, %.4f]]",
            count, mean, stdDev(), min, max);
    }
}
