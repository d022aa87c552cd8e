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

import io.hydrocast.ssm.data.SeriesStatistics;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.GammaPrior;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

import java.util.Arrays;

/**
 * Default starting values: moments of the observed series, perturbed per chain.
 *
 * <h2>Starting values</h2>
 *
 * <ul>
 *   <li>{@code x}: observed {@code y} linearly interpolated across gaps, held
 *       flat beyond the first and last observation, plus a chain-wide shift
 *       of up to about two standard deviations of {@code y}</li>
 *   <li>{@code tau_obs}: {@code 5 / var(y)}; {@code tau_add}: {@code 1 / var(diff y)};
 *       each capped at {@link #precisionCeiling} and multiplied by a
 *       log-normal factor with log-sd {@value #PRECISION_LOG_SPREAD}</li>
 *   <li>{@code mu0}: mean of {@code y} plus the same shift as the path</li>
 *   <li>{@code beta_decay}: uniform on the prior bounds</li>
 *   <li>regression coefficients: {@code Normal(0, 0.1^2)}</li>
 *   <li>{@code mu_rain}, {@code tau_rain}: moments of the observed rainfall;
 *       missing rainfall starts at {@code mu_rain}</li>
 * </ul>
 *
 * <p>Moments that are undefined for short or constant series fall back to
 * the prior means.
 */
public class DispersedInitializer implements ChainInitializer {

    static final double PRECISION_LOG_SPREAD = 0.5;
    static final double LEVEL_SPREAD = 2.0;
    static final double COEFFICIENT_SD = 0.1;

    @Override
    public ChainState initialize(ModelSpecification spec, TimeSeriesDataset data, int chain, UniformRandomProvider rng) {
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        double[] y = data.response();
        SeriesStatistics level = SeriesStatistics.compute(y);
        SeriesStatistics steps = SeriesStatistics.ofDifferences(y);

        double spread = level.hasSpread() ? level.stdDev() : 1.0;
        double shift = LEVEL_SPREAD * spread * clamp(gaussian.sample(), -1.0, 1.0);

        double[] states = interpolate(y, level.mean());
        for (int t = 0; t < states.length; t++) {
            states[t] += shift;
        }

        ParameterVector p = ParameterVector.fixedValuesOf(spec);
        GammaPrior obsPrior = spec.gammaPrior(Parameter.TAU_OBS);
        GammaPrior addPrior = spec.gammaPrior(Parameter.TAU_ADD);
        double tauObs = level.hasSpread() ? 5.0 / level.variance() : obsPrior.mean();
        double tauAdd = steps.hasSpread() ? 1.0 / steps.variance() : addPrior.mean();
        tauObs = Math.min(tauObs, precisionCeiling(obsPrior, level.count()));
        tauAdd = Math.min(tauAdd, precisionCeiling(addPrior, Math.max(0, y.length - 1)));
        p.set(Parameter.TAU_OBS, tauObs * Math.exp(PRECISION_LOG_SPREAD * gaussian.sample()));
        p.set(Parameter.TAU_ADD, tauAdd * Math.exp(PRECISION_LOG_SPREAD * gaussian.sample()));

        if (spec.hasTerm(ModelTerm.DECAY)) {
            p.set(Parameter.MU0, level.mean() + shift);
            double lower = spec.decayPrior().lower();
            double upper = spec.decayPrior().upper();
            p.set(Parameter.BETA_DECAY, lower + rng.nextDouble() * (upper - lower));
        }
        for (Parameter coefficient : spec.regressionCoefficients()) {
            p.set(coefficient, COEFFICIENT_SD * gaussian.sample());
        }

        double[] rain = data.rain();
        if (spec.hasTerm(ModelTerm.RAIN_IMPUTATION)) {
            SeriesStatistics rainStats = SeriesStatistics.compute(rain);
            double muRain = rainStats.count() > 0 ? rainStats.mean() : spec.normalPrior(Parameter.MU_RAIN).mean();
            GammaPrior rainPrior = spec.gammaPrior(Parameter.TAU_RAIN);
            double tauRain = rainStats.hasSpread() ? 1.0 / rainStats.variance() : rainPrior.mean();
            tauRain = Math.min(tauRain, precisionCeiling(rainPrior, rain.length));
            p.set(Parameter.MU_RAIN, muRain);
            p.set(Parameter.TAU_RAIN, tauRain);
            for (int t = 0; t < rain.length; t++) {
                if (Double.isNaN(rain[t])) {
                    rain[t] = muRain;
                }
            }
        }
        return new ChainState(states, rain, p);
    }

    /// Largest mean the Gamma full conditional of a precision can reach with
    /// `observations` terms: `(shape + observations / 2) / rate`.
    static double precisionCeiling(GammaPrior prior, long observations) {
        return (prior.shape() + observations / 2.0) / prior.rate();
    }

    /// Linear interpolation of the observed values; flat extrapolation at the ends.
    static double[] interpolate(double[] y, double fallback) {
        int n = y.length;
        double[] out = new double[n];
        int previous = -1;
        for (int t = 0; t < n; t++) {
            if (Double.isNaN(y[t])) {
                continue;
            }
            if (previous < 0) {
                for (int s = 0; s < t; s++) {
                    out[s] = y[t];
                }
            } else {
                for (int s = previous + 1; s < t; s++) {
                    double w = (double) (s - previous) / (t - previous);
                    out[s] = (1 - w) * y[previous] + w * y[t];
                }
            }
            out[t] = y[t];
            previous = t;
        }
        if (previous < 0) {
            Arrays.fill(out, Double.isNaN(fallback) ? 0.0 : fallback);
            return out;
        }
        for (int s = previous + 1; s < n; s++) {
            out[s] = y[previous];
        }
        return out;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
