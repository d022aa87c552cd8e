package io.hydrocast.ssm.diagnostics;

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

import io.hydrocast.ssm.sampler.RandomGenerators;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PotentialScaleReductionTest {

    private static double[][] gaussianChains(int chains, int draws, double[] means, long seed) {
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(RandomGenerators.create(seed));
        double[][] traces = new double[chains][draws];
        for (int c = 0; c < chains; c++) {
            for (int i = 0; i < draws; i++) {
                traces[c][i] = means[c] + gaussian.sample();
            }
        }
        return traces;
    }

    /// Textbook evaluation without prefix sums.
    private static double direct(double[][] traces) {
        int m = traces.length;
        int n = traces[0].length;
        double[] means = new double[m];
        double grand = 0.0;
        double within = 0.0;
        for (int c = 0; c < m; c++) {
            double sum = 0.0;
            for (double v : traces[c]) {
                sum += v;
            }
            means[c] = sum / n;
            double ss = 0.0;
            for (double v : traces[c]) {
                ss += (v - means[c]) * (v - means[c]);
            }
            within += ss / (n - 1);
            grand += means[c];
        }
        grand /= m;
        within /= m;
        double between = 0.0;
        for (double mean : means) {
            between += (mean - grand) * (mean - grand);
        }
        between *= (double) n / (m - 1);
        return Math.sqrt(((n - 1.0) / n * within + between / n) / within);
    }

    @Test
    void testMatchesDirectComputation() {
        double[][] traces = gaussianChains(3, 500, new double[]{0.0, 0.3, -0.2}, 1L);
        assertEquals(direct(traces), PotentialScaleReduction.compute(traces), 1e-10);
    }

    @Test
    void testWindowMatchesSlicedTraces() {
        double[][] traces = gaussianChains(4, 300, new double[]{1000.0, 1000.5, 999.5, 1000.0}, 2L);
        double[][] sliced = new double[4][];
        for (int c = 0; c < 4; c++) {
            sliced[c] = Arrays.copyOfRange(traces[c], 100, 250);
        }
        assertEquals(direct(sliced), new PotentialScaleReduction(traces).ratio(100, 250), 1e-8);
    }

    @Test
    void testWellMixedChainsAreNearOne() {
        double[][] traces = gaussianChains(3, 2000, new double[]{0.0, 0.0, 0.0}, 3L);
        double r = PotentialScaleReduction.compute(traces);
        assertTrue(r < 1.01, "ratio " + r);
    }

    @Test
    void testSeparatedChainsAreFlagged() {
        double[][] traces = gaussianChains(3, 500, new double[]{0.0, 3.0, 6.0}, 4L);
        assertTrue(PotentialScaleReduction.compute(traces) > 2.0);
    }

    @Test
    void testConstantChains() {
        assertEquals(1.0, PotentialScaleReduction.compute(new double[][]{{2, 2, 2}, {2, 2, 2}}));
        assertEquals(Double.POSITIVE_INFINITY, PotentialScaleReduction.compute(new double[][]{{1, 1, 1}, {2, 2, 2}}));
    }

    @Test
    void testInvalidInputsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PotentialScaleReduction(new double[][]{{1, 2, 3}}));
        assertThrows(IllegalArgumentException.class, () -> new PotentialScaleReduction(new double[][]{{1, 2}, {1}}));
        PotentialScaleReduction psr = new PotentialScaleReduction(new double[][]{{1, 2, 3}, {3, 2, 1}});
        assertThrows(IllegalArgumentException.class, () -> psr.ratio(2, 3));
    }
}
