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

/// Log-scale transforms applied to natural-unit series before fitting.
///
/// ## Conventions
///
/// | series   | forward                  | inverse    |
/// |----------|--------------------------|------------|
/// | flow     | `log(flow)`              | `exp(y)`   |
/// | rainfall | `log1p(rain)`            | `expm1(r)` |
///
/// Values at or below zero are shifted by [#SHIFT] before the forward
/// transform so that exactly-zero flow or rainfall maps to a finite value.
/// A value that is still non-positive (flow) or negative (rainfall) after the
/// shift is rejected: negative flow is a data-preparation problem, not
/// something this layer repairs.
///
/// Missing values are `NaN` and pass through every transform as `NaN`.
public final class SeriesTransforms {

    /// Fixed additive shift applied to non-positive inputs before taking logs.
    public static final double SHIFT = 0.001;

    private SeriesTransforms() {
    }

    /// Transforms a natural-scale flow value to the log response scale.
    ///
    /// @param flow flow in natural units, or `NaN` when missing
    /// @return `log(flow)`, shifted when `flow <= 0`
    /// @throws IllegalArgumentException if the value is infinite or stays non-positive after shifting
    public static double logResponse(double flow) {
        if (Double.isNaN(flow)) {
            return Double.NaN;
        }
        if (Double.isInfinite(flow)) {
            throw new IllegalArgumentException("Flow must be finite, got: " + flow);
        }
        double shifted = flow > 0 ? flow : flow + SHIFT;
        if (shifted <= 0) {
            throw new IllegalArgumentException("Flow " + flow + " is still non-positive after shifting by " + SHIFT);
        }
        return Math.log(shifted);
    }

    /// Transforms a natural-scale rainfall value to the log1p covariate scale.
    ///
    /// @param rainfall rainfall in natural units, or `NaN` when missing
    /// @return `log1p(rainfall)`, shifted when `rainfall <= 0`
    /// @throws IllegalArgumentException if the value is infinite or stays negative after shifting
    public static double log1pRain(double rainfall) {
        if (Double.isNaN(rainfall)) {
            return Double.NaN;
        }
        if (Double.isInfinite(rainfall)) {
            throw new IllegalArgumentException("Rainfall must be finite, got: " + rainfall);
        }
        double shifted = rainfall > 0 ? rainfall : rainfall + SHIFT;
        if (shifted < 0) {
            throw new IllegalArgumentException("Rainfall " + rainfall + " is still negative after shifting by " + SHIFT);
        }
        return Math.log1p(shifted);
    }

    /// Inverse of [#logResponse(double)] for positive flows.
    public static double naturalResponse(double logValue) {
        return Math.exp(logValue);
    }

    /// Inverse of [#log1pRain(double)] for positive rainfall.
    public static double naturalRain(double log1pValue) {
        return Math.expm1(log1pValue);
    }

    /// Applies [#logResponse(double)] element-wise.
    public static double[] logResponse(double[] flow) {
        double[] out = new double[flow.length];
        for (int i = 0; i < flow.length; i++) {
            out[i] = logResponse(flow[i]);
        }
        return out;
    }

    /// Applies [#log1pRain(double)] element-wise.
    public static double[] log1pRain(double[] rainfall) {
        double[] out = new double[rainfall.length];
        for (int i = 0; i < rainfall.length; i++) {
            out[i] = log1pRain(rainfall[i]);
        }
        return out;
    }

    /// Shifts a series forward by one step so that `out[t] = values[t-1]`.
    ///
    /// The first element has no predecessor and is missing.
    ///
    /// @param values the series to lag
    /// @return a new array of the same length
    public static double[] lagByOneDay(double[] values) {
        double[] out = new double[values.length];
        if (values.length == 0) {
            return out;
        }
        out[0] = Double.NaN;
        System.arraycopy(values, 0, out, 1, values.length - 1);
        return out;
    }
}
