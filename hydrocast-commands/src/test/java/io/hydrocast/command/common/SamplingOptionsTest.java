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
import io.hydrocast.ssm.diagnostics.BurnInPolicy;
import io.hydrocast.ssm.diagnostics.ConvergenceDiagnostics;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.sampler.StateUpdate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SamplingOptionsTest {

    @CommandLine.Command(name = "holder")
    static class Holder {
        @CommandLine.Mixin
        SamplingOptions sampling = new SamplingOptions();

        @CommandLine.Mixin
        RandomSeedOption seed = new RandomSeedOption();

        @CommandLine.Mixin
        HoldOutOptions holdOut = new HoldOutOptions();
    }

    private static Holder parse(String... args) {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs(args);
        return holder;
    }

    @Test
    void testDefaults() {
        Holder holder = parse("-s", "99");
        EngineConfig config = holder.sampling.engineConfig(holder.seed);
        assertEquals(3, config.chains());
        assertEquals(5000, config.iterations());
        assertEquals(StateUpdate.FORWARD_FILTER_BACKWARD_SAMPLE, config.stateUpdate());
        assertEquals(EngineConfig.builder().baseSeed(99L).build().seeds()[0], config.seed(0));
        assertEquals(BurnInPolicy.fixed(1000), holder.sampling.burnInPolicy());
        assertEquals(ConvergenceDiagnostics.DEFAULT_MONITORED, holder.sampling.monitoredParameters());
        assertEquals(1.1, holder.sampling.getThreshold());
        assertEquals(-1, holder.sampling.getMaxIterations());
        assertFalse(holder.sampling.isExtend());
    }

    @Test
    void testExplicitSettings() {
        Holder holder = parse("-c", "4", "-n", "800", "--thin", "2", "--burn-in", "adaptive:50",
            "--state-update", "single-site", "--monitor", "tau_obs,beta_rain", "--threshold", "1.05",
            "--extend", "--max-iterations", "3200", "--chain-seeds", "1,2,3,4");
        EngineConfig config = holder.sampling.engineConfig(holder.seed);

        assertEquals(4, config.chains());
        assertEquals(400, config.retainedDraws());
        assertEquals(StateUpdate.SINGLE_SITE, config.stateUpdate());
        assertArrayEquals(new long[]{1, 2, 3, 4}, config.seeds());
        assertEquals(BurnInPolicy.adaptive(50), holder.sampling.burnInPolicy());
        assertEquals(List.of(Parameter.TAU_OBS, Parameter.BETA_RAIN), holder.sampling.monitoredParameters());
        assertTrue(holder.sampling.isExtend());
        assertEquals(3200, holder.sampling.getMaxIterations());
        assertTrue(holder.seed.isSeedSpecified());
    }

    @Test
    void testChainSeedCountMustMatch() {
        Holder holder = parse("--chain-seeds", "1,2");
        assertThrows(IllegalArgumentException.class, () -> holder.sampling.engineConfig(holder.seed));
    }

    @Test
    void testHoldOutSelection() {
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .startDate(LocalDate.of(2020, 1, 1))
            .response(new double[]{1, 2, 3, 4, 5, 6})
            .build();

        Holder none = parse();
        assertFalse(none.holdOut.isRequested());
        assertNull(none.holdOut.split(data));

        HeldOutSplit byDays = parse("--holdout-days", "2").holdOut.split(data);
        assertEquals(2, byDays.truth().size());

        HeldOutSplit byDate = parse("--holdout-from", "2020-01-04").holdOut.split(data);
        assertEquals(3, byDate.truth().size());

        Holder both = parse("--holdout-days", "2", "--holdout-from", "2020-01-04");
        assertThrows(IllegalStateException.class, () -> both.holdOut.validate());
    }
}
