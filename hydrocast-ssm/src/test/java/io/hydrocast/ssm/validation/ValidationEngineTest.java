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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ValidationEngineTest {

    private static ForecastTable table(double[] logMedians, double halfWidth, boolean logColumns) {
        List<ForecastRow> rows = new ArrayList<>();
        for (int t = 0; t < logMedians.length; t++) {
            CredibleInterval log = new CredibleInterval(logMedians[t] - halfWidth, logMedians[t],
                logMedians[t] + halfWidth, Scale.LOG);
            rows.add(new ForecastRow(t, LocalDate.of(2023, 1, 1).plusDays(t), log.toNaturalScale(),
                logColumns ? log : null, true));
        }
        return new ForecastTable(rows, logColumns);
    }

    private static GroundTruth logTruth(double... values) {
        Map<Integer, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(i, values[i]);
        }
        return GroundTruth.ofLog(map);
    }

    @Test
    void testThreePointScenarioOnLogScale() {
        ForecastTable forecast = table(new double[]{1.3, 1.4, 1.0}, 0.5, true);
        ValidationReport report = new ValidationEngine()
            .validate(forecast, logTruth(1.2, 1.5, 0.9), EnumSet.of(Scale.LOG));

        MetricTable log = report.table(Scale.LOG);
        assertEquals(3.0, log.get(Metric.N).getAsDouble());
        // residuals are -0.1, 0.1, -0.1
        assertEquals(0.1, log.get(Metric.RMSE).getAsDouble(), 1e-9);
        assertEquals(12.0 / 13.0, log.get(Metric.R_SQUARED).getAsDouble(), 1e-9);
        assertEquals(-0.1 / 3.0, log.get(Metric.BIAS).getAsDouble(), 1e-9);
        assertEquals(1.0, log.get(Metric.COVERAGE_95).getAsDouble(), 1e-12);
        assertEquals("3", log.format(Metric.N));
        assertFalse(report.hasScale(Scale.NATURAL));
        assertThat(report.residuals()).hasSize(3);
    }

    @Test
    void testThreePointScenarioOnNaturalScale() {
        double[] medians = {1.3, 1.4, 1.0};
        List<ForecastRow> rows = new ArrayList<>();
        for (int t = 0; t < medians.length; t++) {
            rows.add(new ForecastRow(t, LocalDate.of(2023, 1, 1).plusDays(t),
                new CredibleInterval(medians[t] - 0.25, medians[t], medians[t] + 0.25, Scale.NATURAL), null, true));
        }
        Map<Integer, Double> truth = new LinkedHashMap<>();
        truth.put(0, 1.2);
        truth.put(1, 1.5);
        truth.put(2, 0.9);
        ValidationReport report = new ValidationEngine()
            .validate(new ForecastTable(rows, false), GroundTruth.ofNatural(truth), EnumSet.of(Scale.NATURAL));

        assertEquals(0.1, report.metric(Scale.NATURAL, Metric.RMSE).getAsDouble(), 1e-9);
        double r2 = report.metric(Scale.NATURAL, Metric.R_SQUARED).getAsDouble();
        assertEquals(12.0 / 13.0, r2, 1e-9);
        assertThat(r2).isBetween(0.0, 1.0);
    }

    @Test
    void testNaturalScaleComparesBackTransformedEnvelope() {
        ForecastTable forecast = table(new double[]{1.3, 1.4, 1.0}, 0.5, true);
        ValidationReport report = new ValidationEngine().validate(forecast, logTruth(1.2, 1.5, 0.9));

        double[] observed = {Math.exp(1.2), Math.exp(1.5), Math.exp(0.9)};
        double[] predicted = {Math.exp(1.3), Math.exp(1.4), Math.exp(1.0)};
        double ss = 0.0;
        for (int i = 0; i < 3; i++) {
            ss += (observed[i] - predicted[i]) * (observed[i] - predicted[i]);
        }
        assertEquals(Math.sqrt(ss / 3), report.metric(Scale.NATURAL, Metric.RMSE).getAsDouble(), 1e-9);
        assertNotEquals(report.metric(Scale.LOG, Metric.RMSE).getAsDouble(),
            report.metric(Scale.NATURAL, Metric.RMSE).getAsDouble());
        assertThat(report.residuals(Scale.NATURAL)).allMatch(r -> r.scale() == Scale.NATURAL);
    }

    @Test
    void testSinglePointLeavesCorrelationMetricsUndefined() {
        ForecastTable forecast = table(new double[]{1.3, 1.4}, 0.5, true);
        Map<Integer, Double> one = Map.of(1, Math.exp(1.5));
        ValidationReport report = new ValidationEngine().validate(forecast, GroundTruth.ofNatural(one));

        MetricTable log = report.table(Scale.LOG);
        assertEquals(0.1, log.get(Metric.RMSE).getAsDouble(), 1e-9);
        assertTrue(log.get(Metric.R_SQUARED).isEmpty());
        assertTrue(log.get(Metric.CORRELATION).isEmpty());
        assertTrue(log.get(Metric.SD_RATIO).isEmpty());
        assertEquals("NA", log.format(Metric.R_SQUARED));
    }

    @Test
    void testEmptyTruthLeavesErrorMetricsUndefined() {
        ValidationReport report = new ValidationEngine().validate(table(new double[]{1.0}, 0.1, true),
            GroundTruth.empty());
        assertEquals(0.0, report.metric(Scale.LOG, Metric.N).getAsDouble());
        assertTrue(report.metric(Scale.LOG, Metric.RMSE).isEmpty());
        assertTrue(report.metric(Scale.NATURAL, Metric.COVERAGE_95).isEmpty());
    }

    @Test
    void testConstantPredictionsHaveNoCorrelation() {
        ForecastTable forecast = table(new double[]{1.0, 1.0, 1.0}, 0.5, true);
        ValidationReport report = new ValidationEngine()
            .validate(forecast, logTruth(0.8, 1.1, 1.3), EnumSet.of(Scale.LOG));
        assertTrue(report.metric(Scale.LOG, Metric.R_SQUARED).isEmpty());
        assertEquals(0.0, report.metric(Scale.LOG, Metric.SD_RATIO).getAsDouble(), 1e-12);
    }

    @Test
    void testLogScaleFallsBackToNaturalEnvelope() {
        ForecastTable forecast = table(new double[]{1.3, 1.4, 1.0}, 0.5, false);
        ValidationReport report = new ValidationEngine()
            .validate(forecast, logTruth(1.2, 1.5, 0.9), EnumSet.of(Scale.LOG));
        assertEquals(0.1, report.metric(Scale.LOG, Metric.RMSE).getAsDouble(), 1e-9);
    }

    @Test
    void testAgreementStatisticsCanBeSwitchedOff() {
        ValidationReport report = new ValidationEngine(false)
            .validate(table(new double[]{1.3, 1.4, 1.0}, 0.5, true), logTruth(1.2, 1.5, 0.9));
        assertFalse(report.table(Scale.LOG).contains(Metric.CORRELATION));
        assertTrue(report.table(Scale.LOG).contains(Metric.R_SQUARED));
    }

    @Test
    void testTruthBeyondForecastIsRejected() {
        Map<Integer, Double> beyond = Map.of(5, 2.0);
        assertThrows(IllegalArgumentException.class,
            () -> new ValidationEngine().validate(table(new double[]{1.0, 1.0}, 0.1, true),
                GroundTruth.ofNatural(beyond)));
    }

    @Test
    void testAgreementStatistics() {
        AgreementStatistics stats = AgreementStatistics.compute(new double[]{1, 2, 3, 4}, new double[]{2, 4, 6, 8});
        assertEquals(1.0, stats.correlation().getAsDouble(), 1e-12);
        assertEquals(2.0, stats.sdRatio().getAsDouble(), 1e-12);
        assertEquals(Math.sqrt(1.25), stats.centeredRmsDifference().getAsDouble(), 1e-12);
    }
}
