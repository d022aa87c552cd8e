package io.hydrocast.ssm.model;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ModelSpecificationTest {

    @Test
    void testRandomWalkSamplesOnlyPrecisions() {
        ModelSpecification spec = ModelSpecification.randomWalk();
        assertThat(spec.terms()).isEmpty();
        assertThat(spec.sampledParameters()).containsExactly(Parameter.TAU_OBS, Parameter.TAU_ADD);
        assertEquals(1.0, spec.fixedValue(Parameter.BETA_DECAY));
        assertEquals(0.0, spec.fixedValue(Parameter.BETA_RAIN));
        assertFalse(spec.initialCondition().tiedToBaseline());
        assertEquals(0.0, spec.initialCondition().mean());
        assertEquals(0.01, spec.initialCondition().precision());
    }

    @Test
    void testFullModelSamplesEveryParameterWithBaselineStart() {
        ModelSpecification spec = ModelSpecification.full();
        assertThat(spec.sampledParameters()).containsExactlyInAnyOrder(Parameter.values());
        assertTrue(spec.initialCondition().tiedToBaseline());
        assertEquals(5.5, spec.initialCondition().meanGiven(5.5));
        assertThat(spec.regressionCoefficients())
            .containsExactly(Parameter.BETA_RAIN, Parameter.BETA_SEASON_SIN, Parameter.BETA_SEASON_COS);
    }

    @Test
    void testDefaultPriors() {
        ModelSpecification spec = ModelSpecification.full();
        assertEquals(new GammaPrior(0.01, 0.01), spec.gammaPrior(Parameter.TAU_ADD));
        assertEquals(100.0, spec.normalPrior(Parameter.BETA_RAIN).variance());
        assertEquals(0.0, spec.normalPrior(Parameter.MU0).mean());
        assertEquals(UniformPrior.unit(), spec.decayPrior());
        assertThrows(IllegalArgumentException.class, () -> spec.gammaPrior(Parameter.MU0));
        assertThrows(IllegalArgumentException.class, () -> spec.normalPrior(Parameter.TAU_OBS));
    }

    @Test
    void testBaselineStartWithoutDecayIsRejected() {
        assertThatThrownBy(() -> ModelSpecification.builder()
            .term(ModelTerm.RAIN)
            .initialCondition(InitialCondition.baseline(0.01))
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("decay");
    }

    @Test
    void testDecayBoundsOutsideUnitIntervalAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ModelSpecification.builder()
            .term(ModelTerm.DECAY)
            .betaDecay(new UniformPrior(0.5, 1.5))
            .build());
    }

    @Test
    void testInvalidHyperparametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GammaPrior(0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new GammaPrior(1.0, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new NormalPrior(0.0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> new UniformPrior(0.6, 0.4));
        assertThrows(IllegalArgumentException.class, () -> InitialCondition.fixed(0.0, 0.0));
    }

    @Test
    void testToBuilderRoundTripsAndRemovesTerms() {
        ModelSpecification spec = ModelSpecification.randomWalkWithRain()
            .toBuilder()
            .tauObs(new GammaPrior(2.0, 0.5))
            .build();
        assertTrue(spec.hasTerm(ModelTerm.RAIN));
        assertEquals(2.0, spec.gammaPrior(Parameter.TAU_OBS).shape());
        assertEquals(spec, spec.toBuilder().build());

        ModelSpecification without = spec.toBuilder().withoutTerm(ModelTerm.RAIN).build();
        assertFalse(without.isSampled(Parameter.BETA_RAIN));
    }

    @Test
    void testParameterLabels() {
        assertEquals(Parameter.TAU_ADD, Parameter.fromLabel("tau_add"));
        assertEquals(Parameter.BETA_SEASON_SIN, Parameter.fromLabel("BETA_SEASON_SIN"));
        assertThrows(IllegalArgumentException.class, () -> Parameter.fromLabel("sigma"));
    }
}
