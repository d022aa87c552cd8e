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

/**
 * Gelman-Rubin potential scale reduction over equal-length chains.
 *
 * <h2>Definition</h2>
 *
 * <p>For {@code m} chains of {@code n} draws with chain means {@code mean_j}
 * and chain variances {@code s_j^2}:
 *
 * <pre>
 * B    = n / (m - 1) * sum_j (mean_j - mean)^2
 * W    = (1 / m) * sum_j s_j^2
 * Vhat = (n - 1) / n * W + B / n
 * R    = sqrt(Vhat / W)
 * </pre>
 *
 * <p>Degenerate cases: {@code W = 0, B = 0} (identical constant chains)
 * gives 1; {@code W = 0, B > 0} (constant but disagreeing chains) gives
 * positive infinity.
 *
 * <p>An instance precomputes prefix sums so that any window
 * {@code [from, to)} is evaluated in {@code O(m)}; the adaptive burn-in
 * search evaluates many windows.
 */
public final class PotentialScaleReduction {

    private final int chains;
    private final int length;
    private final double[][] prefixSum;
    private final double[][] prefixSquares;
    private final double[] offsets;

    /**
     * @param traces one row per chain, all rows the same length
     * @throws IllegalArgumentException for fewer than 2 chains or ragged rows
     */
    public PotentialScaleReduction(double[][] traces) {
        if (traces.length < 2) {
            throw new IllegalArgumentException("Potential scale reduction needs at least 2 chains, got: " + traces.length);
        }
        this.chains = traces.length;
        this.length = traces[0].length;
        this.prefixSum = new double[chains][length + 1];
        this.prefixSquares = new double[chains][length + 1];
        this.offsets = new double[chains];
        for (int c = 0; c < chains; c++) {
            if (traces[c].length != length) {
                throw new IllegalArgumentException("Chain " + c + " has " + traces[c].length
                    + " draws, expected " + length);
            }
            // Centre on the first draw to limit cancellation in the sums of squares
            double offset = length > 0 ? traces[c][0] : 0.0;
            offsets[c] = offset;
            for (int i = 0; i < length; i++) {
                double v = traces[c][i] - offset;
                prefixSum[c][i + 1] = prefixSum[c][i] + v;
                prefixSquares[c][i + 1] = prefixSquares[c][i] + v * v;
            }
        }
    }

    /// Ratio over the whole of every chain.
    public static double compute(double[][] traces) {
        PotentialScaleReduction psr = new PotentialScaleReduction(traces);
        return psr.ratio(0, psr.length());
    }

    public int chains() {
        return chains;
    }

    public int length() {
        return length;
    }

    /**
     * Ratio over draws {@code [from, to)} of every chain.
     *
     * @throws IllegalArgumentException if the window holds fewer than 2 draws
     */
    public double ratio(int from, int to) {
        int n = to - from;
        if (from < 0 || to > length || n < 2) {
            throw new IllegalArgumentException("Window [" + from + ", " + to + ") needs at least 2 draws within "
                + length);
        }
        double[] means = new double[chains];
        double grandMean = 0.0;
        double within = 0.0;
        for (int c = 0; c < chains; c++) {
            double sum = prefixSum[c][to] - prefixSum[c][from];
            double squares = prefixSquares[c][to] - prefixSquares[c][from];
            double centredMean = sum / n;
            double variance = Math.max(0.0, (squares - sum * centredMean) / (n - 1));
            means[c] = centredMean + offsets[c];
            grandMean += means[c];
            within += variance;
        }
        grandMean /= chains;
        within /= chains;

        double between = 0.0;
        for (int c = 0; c < chains; c++) {
            double d = means[c] - grandMean;
            between += d * d;
        }
        between *= (double) n / (chains - 1);

        if (within == 0.0) {
            return between == 0.0 ? 1.0 : Double.POSITIVE_INFINITY;
        }
        double pooled = (n - 1.0) / n * within + between / n;
        return Math.sqrt(pooled / within);
    }
}
