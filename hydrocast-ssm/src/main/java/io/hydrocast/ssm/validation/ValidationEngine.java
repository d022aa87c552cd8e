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

import io.hydrocast.ssm.data.GroundTruth;
import io.hydrocast.ssm.summary.CredibleInterval;
import io.hydrocast.ssm.summary.ForecastRow;
import io.hydrocast.ssm.summary.ForecastTable;
import io.hydrocast.ssm.summary.Scale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Scores forecasts against withheld ground truth.
 *
 * <h2>Metrics</h2>
 *
 * <table border="1">
 *   <caption>Metrics and their domains</caption>
 *   <tr><th>metric</th><th>definition</th><th>undefined when</th></tr>
 *   <tr><td>n</td><td>paired points</td><td>never</td></tr>
 *   <tr><td>rmse</td><td>sqrt(mean((obs - median)^2))</td><td>n = 0</td></tr>
 *   <tr><td>r_squared</td><td>squared Pearson correlation</td><td>n &lt; 2 or no spread</td></tr>
 *   <tr><td>bias</td><td>mean(obs - median)</td><td>n = 0</td></tr>
 *   <tr><td>coverage_95</td><td>fraction of obs inside [lower, upper]</td><td>n = 0</td></tr>
 *   <tr><td>correlation, sd_ratio, centered_rms_difference</td><td>see {@link AgreementStatistics}</td><td>n &lt; 2</td></tr>
 * </table>
 *
 * <p>Each scale is scored on its own: log-scale truth goes through the same
 * transform as the fitted response, natural-scale truth is compared with the
 * back-transformed envelope. The two sets of numbers are kept apart.
 */
public final class ValidationEngine {

    private static final Logger logger = LogManager.getLogger(ValidationEngine.class);

    private final boolean agreementStatistics;

    public ValidationEngine() {
        this(true);
    }

    /**
     * @param agreementStatistics whether to add correlation, dispersion ratio and centered RMS difference
     */
    public ValidationEngine(boolean agreementStatistics) {
        this.agreementStatistics = agreementStatistics;
    }

    /// Scores on both scales.
    public ValidationReport validate(ForecastTable forecast, GroundTruth truth) {
        return validate(forecast, truth, EnumSet.allOf(Scale.class));
    }

    /**
     * Scores the held-out indices of {@code truth}.
     *
     * @param forecast forecast table covering every truth index
     * @param truth withheld observations
     * @param scales scales to score
     * @return metrics per scale and the paired residuals
     * @throws IllegalArgumentException if a truth index lies outside the forecast table
     */
    public ValidationReport validate(ForecastTable forecast, GroundTruth truth, Set<Scale> scales) {
        Objects.requireNonNull(forecast, "forecast");
        Objects.requireNonNull(truth, "truth");
        if (scales.isEmpty()) {
            throw new IllegalArgumentException("At least one scale must be scored");
        }
        Map<Scale, MetricTable> tables = new EnumMap<>(Scale.class);
        List<ResidualRow> residuals = new ArrayList<>();
        for (Scale scale : EnumSet.copyOf(scales)) {
            List<ResidualRow> rows = pair(forecast, truth, scale);
            residuals.addAll(rows);
            MetricTable table = score(scale, rows);
            tables.put(scale, table);
            logger.info("Validation {}", table);
        }
        return new ValidationReport(tables, residuals);
    }

    private static List<ResidualRow> pair(ForecastTable forecast, GroundTruth truth, Scale scale) {
        List<ResidualRow> rows = new ArrayList<>();
        for (int index : truth.indices()) {
            if (index >= forecast.size()) {
                throw new IllegalArgumentException("Ground truth index " + index + " is outside the forecast of "
                    + forecast.size() + " days");
            }
            ForecastRow row = forecast.row(index);
            CredibleInterval interval = scale == Scale.NATURAL || row.log() != null
                ? row.interval(scale) : row.natural().toLogScale();
            double observed = scale == Scale.LOG ? truth.logValue(index) : truth.naturalValue(index);
            rows.add(new ResidualRow(index, row.date(), scale, observed, interval.median(),
                interval.lower(), interval.upper()));
        }
        return rows;
    }

    MetricTable score(Scale scale, List<ResidualRow> rows) {
        int n = rows.size();
        double[] observed = new double[n];
        double[] predicted = new double[n];
        double sumSquares = 0.0;
        double sumResiduals = 0.0;
        int covered = 0;
        for (int i = 0; i < n; i++) {
            ResidualRow row = rows.get(i);
            observed[i] = row.observed();
            predicted[i] = row.predicted();
            sumSquares += row.residual() * row.residual();
            sumResiduals += row.residual();
            if (row.covered()) {
                covered++;
            }
        }
        AgreementStatistics agreement = AgreementStatistics.compute(observed, predicted);

        Map<Metric, OptionalDouble> values = new LinkedHashMap<>();
        values.put(Metric.N, OptionalDouble.of(n));
        values.put(Metric.RMSE, n > 0 ? OptionalDouble.of(Math.sqrt(sumSquares / n)) : OptionalDouble.empty());
        values.put(Metric.R_SQUARED, agreement.rSquared());
        values.put(Metric.BIAS, n > 0 ? OptionalDouble.of(sumResiduals / n) : OptionalDouble.empty());
        values.put(Metric.COVERAGE_95, n > 0 ? OptionalDouble.of((double) covered / n) : OptionalDouble.empty());
        if (agreementStatistics) {
            values.put(Metric.CORRELATION, agreement.correlation());
            values.put(Metric.SD_RATIO, agreement.sdRatio());
            values.put(Metric.CENTERED_RMS_DIFFERENCE, agreement.centeredRmsDifference());
        }
        if (n < 2) {
            logger.warn("Only {} held-out point(s) on the {} scale; r_squared is undefined", n, scale);
        }
        return new MetricTable(scale, values);
    }
}
