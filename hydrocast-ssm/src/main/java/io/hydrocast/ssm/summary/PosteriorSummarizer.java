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

import io.hydrocast.ssm.data.SeriesStatistics;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.diagnostics.ConvergenceReport;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.ChainResult;
import io.hydrocast.ssm.sampler.ChainTrace;
import io.hydrocast.ssm.sampler.PosteriorSampleSet;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Reduces post-burn-in draws to credible intervals and point forecasts.
 *
 * <h2>Procedure</h2>
 *
 * <ol>
 *   <li>Pool draws {@code [burnIn, end)} of every surviving chain.</li>
 *   <li>For each time index, back-transform every draw {@code exp(x[t])}.</li>
 *   <li>Take the 2.5th, 50th and 97.5th percentiles of the transformed draws.</li>
 * </ol>
 *
 * <p>Back-transformation always precedes the percentile step. Percentiles use
 * commons-math3 {@link Percentile} with the {@link Percentile.EstimationType#R_7}
 * definition (linear interpolation between order statistics).
 *
 * <p>The summarizer holds no state between calls: the same sample set and
 * burn-in always produce an equal result.
 */
public final class PosteriorSummarizer {

    private static final Logger logger = LogManager.getLogger(PosteriorSummarizer.class);

    public static final double LOWER_PERCENTILE = 2.5;
    public static final double MEDIAN_PERCENTILE = 50.0;
    public static final double UPPER_PERCENTILE = 97.5;

    private final boolean includeLogScale;

    public PosteriorSummarizer() {
        this(true);
    }

    /**
     * @param includeLogScale whether to add log-scale intervals to the forecast table
     */
    public PosteriorSummarizer(boolean includeLogScale) {
        this.includeLogScale = includeLogScale;
    }

    /**
     * Summarises using the burn-in chosen by the convergence check.
     */
    public PosteriorSummary summarize(PosteriorSampleSet samples, ConvergenceReport convergence) {
        return summarize(samples, convergence.burnInDraws());
    }

    /**
     * Summarises the pooled draws after dropping {@code burnInDraws} from each surviving chain.
     *
     * @throws IllegalStateException if no chain survived or nothing remains after burn-in
     */
    public PosteriorSummary summarize(PosteriorSampleSet samples, int burnInDraws) {
        List<ChainTrace> traces = new ArrayList<>();
        for (ChainResult chain : samples.survivingChains()) {
            traces.add(chain.trace());
        }
        if (traces.isEmpty()) {
            throw new IllegalStateException("No surviving chains to summarise");
        }
        int perChain = samples.drawsPerChain() - burnInDraws;
        if (burnInDraws < 0 || perChain < 1) {
            throw new IllegalStateException("Burn-in of " + burnInDraws + " draws leaves nothing of "
                + samples.drawsPerChain() + " draws per chain");
        }
        int pooled = perChain * traces.size();
        logger.debug("Summarising {} pooled draws from {} chains", pooled, traces.size());

        TimeSeriesDataset data = samples.dataset();
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);

        List<ForecastRow> rows = new ArrayList<>();
        double[] pool = new double[pooled];
        for (int t = 0; t < data.length(); t++) {
            int k = 0;
            for (ChainTrace trace : traces) {
                for (int d = burnInDraws; d < samples.drawsPerChain(); d++) {
                    pool[k++] = trace.state(d, t);
                }
            }
            CredibleInterval natural = interval(percentile, transform(pool, Math::exp), Scale.NATURAL);
            CredibleInterval log = includeLogScale ? interval(percentile, pool, Scale.LOG) : null;
            rows.add(new ForecastRow(t, data.date(t), natural, log, data.isHeldOut(t)));
        }

        List<ParameterSummary> parameters = new ArrayList<>();
        for (Parameter parameter : samples.specification().sampledParameters()) {
            int k = 0;
            for (ChainTrace trace : traces) {
                for (int d = burnInDraws; d < samples.drawsPerChain(); d++) {
                    pool[k++] = trace.parameter(parameter, d);
                }
            }
            SeriesStatistics stats = SeriesStatistics.compute(pool);
            percentile.setData(pool);
            parameters.add(new ParameterSummary(parameter, stats.mean(), stats.count() > 1 ? stats.stdDev() : 0.0,
                percentile.evaluate(LOWER_PERCENTILE),
                percentile.evaluate(MEDIAN_PERCENTILE),
                percentile.evaluate(UPPER_PERCENTILE)));
        }

        List<ImputedRainSummary> imputed = new ArrayList<>();
        int[] indices = samples.imputedRainIndices();
        for (int column = 0; column < indices.length; column++) {
            int k = 0;
            for (ChainTrace trace : traces) {
                for (int d = burnInDraws; d < samples.drawsPerChain(); d++) {
                    pool[k++] = trace.imputedRain(d, column);
                }
            }
            CredibleInterval transformed = interval(percentile, pool, Scale.LOG);
            CredibleInterval natural = interval(percentile, transform(pool, Math::expm1), Scale.NATURAL);
            imputed.add(new ImputedRainSummary(indices[column], data.date(indices[column]), transformed, natural));
        }

        return new PosteriorSummary(new ForecastTable(rows, includeLogScale), parameters, imputed,
            burnInDraws, pooled);
    }

    private static double[] transform(double[] values, DoubleUnaryOperator f) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = f.applyAsDouble(values[i]);
        }
        return out;
    }

    private static CredibleInterval interval(Percentile percentile, double[] values, Scale scale) {
        percentile.setData(values);
        return new CredibleInterval(
            percentile.evaluate(LOWER_PERCENTILE),
            percentile.evaluate(MEDIAN_PERCENTILE),
            percentile.evaluate(UPPER_PERCENTILE),
            scale);
    }
}
