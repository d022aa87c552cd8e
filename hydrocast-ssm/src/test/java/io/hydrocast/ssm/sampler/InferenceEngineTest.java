package io.hydrocast.ssm.sampler;

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

import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import io.hydrocast.ssm.simulate.SyntheticSeriesGenerator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class InferenceEngineTest {

    private static InferenceEngine engine;

    @BeforeAll
    static void startEngine() {
        engine = new InferenceEngine();
    }

    @AfterAll
    static void stopEngine() {
        engine.shutdown();
    }

    private static TimeSeriesDataset rainSeries(int days, long seed) {
        ModelSpecification spec = ModelSpecification.randomWalkWithRain();
        ParameterVector truth = ParameterVector.fixedValuesOf(spec)
            .set(Parameter.TAU_OBS, 100.0)
            .set(Parameter.TAU_ADD, 25.0)
            .set(Parameter.BETA_RAIN, 0.05);
        return new SyntheticSeriesGenerator(spec, truth)
            .length(days)
            .startDate(LocalDate.of(2019, 1, 1))
            .generate(seed)
            .dataset();
    }

    private static EngineConfig shortRun(int iterations) {
        return EngineConfig.builder().iterations(iterations).baseSeed(1234L).build();
    }

    @Test
    void testRetainsEveryDrawOfEveryChain() {
        EngineConfig config = EngineConfig.builder().iterations(200).thin(2).baseSeed(5L).build();
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalkWithRain(), rainSeries(40, 1L), config);

        assertEquals(3, samples.chains().size());
        assertEquals(3, samples.survivingCount());
        assertThat(samples.failures()).isEmpty();
        assertEquals(100, samples.drawsPerChain());
        assertEquals(100, samples.chains().get(0).trace().size());
        assertEquals(2L, samples.chains().get(0).trace().iterationOf(0));
        assertEquals(200L, samples.draw(2, 99).iteration());
        assertEquals(40, samples.draw(1, 10).states().length);
        for (double[] trace : samples.parameterTraces(Parameter.TAU_ADD)) {
            assertTrue(Arrays.stream(trace).allMatch(v -> v > 0 && Double.isFinite(v)));
        }
    }

    @Test
    void testSameSeedsReproduceTheSameDraws() {
        TimeSeriesDataset data = rainSeries(30, 2L);
        ModelSpecification spec = ModelSpecification.randomWalkWithRain();
        PosteriorSampleSet first = engine.run(spec, data, shortRun(150));
        PosteriorSampleSet second = engine.run(spec, data, shortRun(150));

        for (Parameter parameter : spec.sampledParameters()) {
            double[][] a = first.parameterTraces(parameter);
            double[][] b = second.parameterTraces(parameter);
            for (int c = 0; c < a.length; c++) {
                assertArrayEquals(a[c], b[c], "trace of " + parameter + " chain " + c);
            }
        }
        assertArrayEquals(first.draw(0, 149).states(), second.draw(0, 149).states());

        PosteriorSampleSet reseeded = engine.run(spec, data,
            EngineConfig.builder().iterations(150).baseSeed(4321L).build());
        assertFalse(Arrays.equals(first.parameterTraces(Parameter.TAU_ADD)[0],
            reseeded.parameterTraces(Parameter.TAU_ADD)[0]));
    }

    @Test
    void testSamplingDoesNotModifyTheDataset() {
        TimeSeriesDataset data = rainSeries(30, 3L);
        TimeSeriesDataset copy = data.toBuilder().build();
        engine.run(ModelSpecification.full(), data, shortRun(100));
        assertEquals(copy, data);
    }

    @Test
    void testFailingChainIsIsolatedFromTheOthers() {
        DispersedInitializer dispersed = new DispersedInitializer();
        ChainInitializer poisoned = (spec, data, chain, rng) -> {
            ChainState state = dispersed.initialize(spec, data, chain, rng);
            if (chain == 0) {
                state.parameters().set(Parameter.TAU_ADD, Double.NaN);
            }
            return state;
        };
        EngineConfig config = EngineConfig.builder().iterations(100).baseSeed(9L).initializer(poisoned).build();
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), rainSeries(25, 4L), config);

        assertEquals(2, samples.survivingCount());
        assertEquals(1, samples.failures().size());
        NumericalFailureException failure = samples.failures().get(0);
        assertEquals(0, failure.getChain());
        assertEquals(1L, failure.getIteration());
        assertThat(failure.getVariable()).startsWith("x[");
        assertThat(failure.getMessage()).contains("Chain 0");
        assertEquals(2, samples.parameterTraces(Parameter.TAU_OBS).length);
        assertThrows(IllegalStateException.class, () -> samples.draw(0, 0));
    }

    @Test
    void testEntirelyMissingResponseIsRejectedBeforeSampling() {
        double[] response = new double[10];
        Arrays.fill(response, Double.NaN);
        TimeSeriesDataset data = TimeSeriesDataset.builder().response(response).build();
        assertThatThrownBy(() -> engine.run(ModelSpecification.randomWalk(), data, shortRun(10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entirely missing");
    }

    @Test
    void testMissingRainWithoutImputationIsRejected() {
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .response(new double[]{1.0, 1.1, 1.2, 1.3})
            .rain(new double[]{Double.NaN, 0.2, Double.NaN, 0.4})
            .build();
        assertThrows(IllegalArgumentException.class,
            () -> engine.run(ModelSpecification.randomWalkWithRain(), data, shortRun(10)));

        // rain[1] never enters the process, so only a later gap is fatal
        TimeSeriesDataset leading = data.toBuilder().rain(new double[]{Double.NaN, 0.2, 0.3, 0.4}).build();
        assertEquals(3, engine.run(ModelSpecification.randomWalkWithRain(), leading, shortRun(10)).survivingCount());
    }

    @Test
    void testSingleDaySeries() {
        TimeSeriesDataset data = TimeSeriesDataset.builder().response(new double[]{1.5}).build();
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), data, shortRun(200));
        assertEquals(3, samples.survivingCount());
        assertEquals(1, samples.draw(0, 199).states().length);
        assertTrue(Double.isFinite(samples.draw(1, 199).states()[0]));
    }

    @Test
    void testIdenticalObservationsAroundGapsKeepEveryChain() {
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .response(new double[]{0.1, Double.NaN, 0.1, Double.NaN, 0.1})
            .build();
        EngineConfig config = EngineConfig.builder().iterations(500).build();
        assertArrayEquals(RandomGenerators.chainSeeds(EngineConfig.DEFAULT_BASE_SEED, 3), config.seeds());
        PosteriorSampleSet samples = engine.run(ModelSpecification.randomWalk(), data, config);

        assertThat(samples.failures()).isEmpty();
        assertEquals(3, samples.survivingCount());
        for (int c = 0; c < 3; c++) {
            for (int d = 0; d < samples.drawsPerChain(); d += 50) {
                assertTrue(Arrays.stream(samples.draw(c, d).states()).allMatch(Double::isFinite));
            }
        }
        for (double[] trace : samples.parameterTraces(Parameter.TAU_OBS)) {
            assertTrue(Arrays.stream(trace).allMatch(v -> v > 0 && Double.isFinite(v)));
        }
    }

    @Test
    void testStartingPrecisionsAreCappedForNearlyConstantSeries() {
        ModelSpecification spec = ModelSpecification.randomWalk();
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .response(new double[]{0.1, 0.1 + 1e-5, 0.1, 0.1 + 1e-5, 0.1})
            .build();
        double obsCeiling = DispersedInitializer.precisionCeiling(spec.gammaPrior(Parameter.TAU_OBS), 5);
        assertEquals((0.01 + 2.5) / 0.01, obsCeiling, 1e-9);

        DispersedInitializer initializer = new DispersedInitializer();
        for (int chain = 0; chain < 3; chain++) {
            ChainState state = initializer.initialize(spec, data, chain, RandomGenerators.create(100L + chain));
            double tauObs = state.parameters().get(Parameter.TAU_OBS);
            double tauAdd = state.parameters().get(Parameter.TAU_ADD);
            assertTrue(Double.isFinite(tauObs) && tauObs < 100 * obsCeiling, "tau_obs " + tauObs);
            assertTrue(Double.isFinite(tauAdd) && tauAdd < 100 * obsCeiling, "tau_add " + tauAdd);
        }
    }

    @Test
    void testFullyMissingRainIsImputedEverywhere() {
        TimeSeriesDataset observed = rainSeries(30, 5L);
        double[] rain = new double[observed.length()];
        Arrays.fill(rain, Double.NaN);
        TimeSeriesDataset data = observed.toBuilder().rain(rain).build();
        ModelSpecification spec = ModelSpecification.randomWalkWithRain().toBuilder()
            .term(ModelTerm.RAIN_IMPUTATION)
            .build();

        PosteriorSampleSet samples = engine.run(spec, data, shortRun(200));
        assertEquals(3, samples.survivingCount());
        assertEquals(30, samples.imputedRainIndices().length);
        double[] imputed = samples.draw(2, 199).imputedRain();
        assertEquals(30, imputed.length);
        assertTrue(Arrays.stream(imputed).allMatch(Double::isFinite));
    }

    @Test
    void testDecayStaysWithinItsBounds() {
        PosteriorSampleSet samples = engine.run(ModelSpecification.full(), rainSeries(40, 6L), shortRun(200));
        for (double[] trace : samples.parameterTraces(Parameter.BETA_DECAY)) {
            assertTrue(Arrays.stream(trace).allMatch(v -> v >= 0.0 && v <= 1.0));
        }
    }

    @Test
    void testCallerExecutorIsNotShutDown() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            InferenceEngine shared = new InferenceEngine(executor);
            shared.run(ModelSpecification.randomWalk(), rainSeries(10, 7L), shortRun(20));
            shared.shutdown();
            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testInterpolationFillsGapsLinearly() {
        double[] filled = DispersedInitializer.interpolate(new double[]{Double.NaN, 1.0, Double.NaN, 3.0, Double.NaN}, 0.0);
        assertArrayEquals(new double[]{1.0, 1.0, 2.0, 3.0, 3.0}, filled, 1e-12);
        assertArrayEquals(new double[]{7.0, 7.0},
            DispersedInitializer.interpolate(new double[]{Double.NaN, Double.NaN}, 7.0), 1e-12);
    }
}
