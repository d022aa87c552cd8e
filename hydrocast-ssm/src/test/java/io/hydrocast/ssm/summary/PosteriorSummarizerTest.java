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

import io.hydrocast.ssm.data.HeldOutSplit;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.sampler.InferenceEngine;
import io.hydrocast.ssm.sampler.PosteriorSampleSet;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PosteriorSummarizerTest {

    private static InferenceEngine engine;

    @BeforeAll
    static void startEngine() {
        engine = new InferenceEngine();
    }

    @AfterAll
    static void stopEngine() {
        engine.shutdown();
    }

    private static TimeSeriesDataset smallSeries() {
        return TimeSeriesDataset.builder()
            .startDate(LocalDate.of(2020, 5, 1))
            .response(new double[]{1.0, 1.2, Double.NaN, 1.1, 0.9, 1.0, 1.3, 1.25})
            .rain(new double[]{Double.NaN, 0.0, 1.2, Double.NaN, 0.4, 0.0, 2.0, 0.1})
            .build();
    }

    private static double[] quantiles(double[] values) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return new double[]{percentile.evaluate(2.5), percentile.evaluate(50.0), percentile.evaluate(97.5)};
    }

    @Test
    void testNaturalScaleIntervalsAreQuantilesOfExponentiatedDraws() {
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), smallSeries(),
            EngineConfig.builder().iterations(120).baseSeed(3L).build());
        int burnIn = 20;
        PosteriorSummary summary = new PosteriorSummarizer().summarize(samples, burnIn);
        assertEquals(300, summary.pooledDraws());
        assertEquals(burnIn, summary.burnInDraws());

        int t = 2;
        double[] pooledLog = new double[300];
        double[] pooledNatural = new double[300];
        int k = 0;
        for (int c = 0; c < 3; c++) {
            for (int d = burnIn; d < 120; d++) {
                double x = samples.draw(c, d).states()[t];
                pooledLog[k] = x;
                pooledNatural[k++] = Math.exp(x);
            }
        }
        double[] natural = quantiles(pooledNatural);
        double[] log = quantiles(pooledLog);
        ForecastRow row = summary.forecast().row(t);
        assertEquals(natural[0], row.natural().lower(), 1e-12);
        assertEquals(natural[1], row.natural().median(), 1e-12);
        assertEquals(natural[2], row.natural().upper(), 1e-12);
        assertEquals(log[1], row.log().median(), 1e-12);
        assertEquals(LocalDate.of(2020, 5, 3), row.date());
    }

    @Test
    void testSummarisingTwiceGivesTheSameResult() {
        PosteriorSampleSet samples = engine.run(ModelSpecification.full(), smallSeries(),
            EngineConfig.builder().iterations(100).baseSeed(4L).build());
        PosteriorSummarizer summarizer = new PosteriorSummarizer();
        assertEquals(summarizer.summarize(samples, 50), summarizer.summarize(samples, 50));
    }

    @Test
    void testParameterAndImputedRainSummaries() {
        PosteriorSampleSet samples = engine.run(ModelSpecification.full(), smallSeries(),
            EngineConfig.builder().iterations(200).baseSeed(5L).build());
        PosteriorSummary summary = new PosteriorSummarizer().summarize(samples, 100);

        assertThat(summary.parameters()).extracting(ParameterSummary::parameter)
            .containsExactlyElementsOf(ModelSpecification.full().sampledParameters());
        ParameterSummary decay = summary.parameter(Parameter.BETA_DECAY).orElseThrow();
        assertTrue(decay.lower() >= 0.0 && decay.upper() <= 1.0);
        assertTrue(decay.lower() <= decay.median() && decay.median() <= decay.upper());

        assertThat(summary.imputedRain()).extracting(ImputedRainSummary::index).containsExactly(0, 3);
        ImputedRainSummary first = summary.imputedRain().get(0);
        CredibleInterval natural = first.natural();
        CredibleInterval transformed = first.transformed();
        assertTrue(natural.lower() <= natural.median() && natural.median() <= natural.upper());
        // interpolated natural quantiles sit on or above expm1 of the log1p quantiles
        assertTrue(natural.lower() >= Math.expm1(transformed.lower()) - 1e-12);
        assertTrue(natural.median() >= Math.expm1(transformed.median()) - 1e-12);
        assertTrue(natural.upper() >= Math.expm1(transformed.upper()) - 1e-12);
        assertTrue(natural.median() <= Math.expm1(transformed.upper()));
    }

    @Test
    void testHeldOutRowsAreFlagged() {
        HeldOutSplit split = HeldOutSplit.lastDays(smallSeries(), 3);
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), split.fitting(),
            EngineConfig.builder().iterations(60).baseSeed(6L).build());
        ForecastTable table = new PosteriorSummarizer(false).summarize(samples, 10).forecast();

        assertFalse(table.hasLogScale());
        assertNull(table.row(0).log());
        assertThat(table.heldOutRows()).extracting(ForecastRow::index).containsExactly(5, 6, 7);
    }

    @Test
    void testBurnInConsumingEverythingIsRejected() {
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), smallSeries(),
            EngineConfig.builder().iterations(20).baseSeed(7L).build());
        assertThrows(IllegalStateException.class, () -> new PosteriorSummarizer().summarize(samples, 20));
        assertThrows(IllegalStateException.class, () -> new PosteriorSummarizer().summarize(samples, -1));
    }

    @Test
    void testMissingDaysAreAtLeastAsUncertainAsObservedDays() {
        TimeSeriesDataset gappy = TimeSeriesDataset.builder()
            .response(new double[]{0.1, Double.NaN, 0.1, Double.NaN, 0.1})
            .build();
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), gappy,
            EngineConfig.builder().iterations(4000).baseSeed(8L).build());
        ForecastTable table = new PosteriorSummarizer().summarize(samples, 1000).forecast();

        double observedWidth = table.row(2).log().width();
        assertThat(table.row(1).log().width()).isGreaterThanOrEqualTo(observedWidth);
        assertThat(table.row(3).log().width()).isGreaterThanOrEqualTo(observedWidth);
        for (ForecastRow row : table) {
            assertTrue(row.natural().lower() > 0.0);
        }
    }
}
