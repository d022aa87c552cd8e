package io.hydrocast.ssm.simulate;

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

import io.hydrocast.ssm.data.GapPolicy;
import io.hydrocast.ssm.data.SeasonalCalendar;
import io.hydrocast.ssm.data.SeriesTransforms;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import io.hydrocast.ssm.model.ProcessMean;
import io.hydrocast.ssm.sampler.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Draws series from the model's own generative equations.
 *
 * <h2>Generation</h2>
 *
 * <ol>
 *   <li>Rainfall, by {@link RainfallMode}: either wet/dry days with gamma
 *       amounts in natural units (then log1p and lagged), or covariate values
 *       drawn directly from {@code Normal(mu_rain, 1/tau_rain)}.</li>
 *   <li>{@code x[1] ~ Normal(x_ic, 1/tau_ic)}, then
 *       {@code x[t] ~ Normal(mu[t], 1/tau_add)} with {@link ProcessMean}.</li>
 *   <li>{@code y[t] ~ Normal(x[t], 1/tau_obs)}.</li>
 *   <li>Each response and each rainfall value is masked independently with
 *       the configured probability.</li>
 * </ol>
 *
 * <p>Used by calibration tests and the {@code simulate} command.
 */
public final class SyntheticSeriesGenerator {

    private static final Logger logger = LogManager.getLogger(SyntheticSeriesGenerator.class);

    /// Source of the rainfall covariate.
    public enum RainfallMode {
        /// Wet days with probability [#wetDayProbability(double)], gamma-distributed amounts.
        WET_DAY,
        /// Covariate drawn from the imputation model `Normal(mu_rain, 1/tau_rain)`.
        IMPUTATION_MODEL
    }

    private final ModelSpecification spec;
    private final ParameterVector parameters;
    private int length = 365;
    private LocalDate startDate = LocalDate.of(2000, 1, 1);
    private double missingResponseProbability = 0.0;
    private double missingRainProbability = 0.0;
    private double wetDayProbability = 0.3;
    private double wetDayShape = 0.8;
    private double wetDayMean = 8.0;
    private RainfallMode rainfallMode;

    /**
     * @param spec the model to draw from
     * @param parameters true values; unsampled parameters should hold their fixed values
     */
    public SyntheticSeriesGenerator(ModelSpecification spec, ParameterVector parameters) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.parameters = Objects.requireNonNull(parameters, "parameters").copy();
        this.rainfallMode = spec.hasTerm(ModelTerm.RAIN_IMPUTATION) ? RainfallMode.IMPUTATION_MODEL : RainfallMode.WET_DAY;
    }

    public SyntheticSeriesGenerator length(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Length must be positive, got: " + length);
        }
        this.length = length;
        return this;
    }

    public SyntheticSeriesGenerator startDate(LocalDate startDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        return this;
    }

    public SyntheticSeriesGenerator missingResponseProbability(double p) {
        this.missingResponseProbability = probability("missing response", p);
        return this;
    }

    public SyntheticSeriesGenerator missingRainProbability(double p) {
        this.missingRainProbability = probability("missing rain", p);
        return this;
    }

    public SyntheticSeriesGenerator wetDayProbability(double p) {
        this.wetDayProbability = probability("wet day", p);
        return this;
    }

    /// Gamma shape and mean of wet-day amounts, in natural units.
    public SyntheticSeriesGenerator wetDayAmounts(double shape, double mean) {
        if (!(shape > 0) || !(mean > 0)) {
            throw new IllegalArgumentException("Wet-day shape and mean must be positive, got: " + shape + ", " + mean);
        }
        this.wetDayShape = shape;
        this.wetDayMean = mean;
        return this;
    }

    public SyntheticSeriesGenerator rainfallMode(RainfallMode mode) {
        this.rainfallMode = Objects.requireNonNull(mode, "mode");
        return this;
    }

    /**
     * Draws one series.
     *
     * @param seed generator seed
     * @return the series with its ground truth
     */
    public SyntheticSeries generate(long seed) {
        UniformRandomProvider rng = RandomGenerators.create(seed);
        NormalizedGaussianSampler gaussian = RandomGenerators.gaussian(rng);
        LocalDate[] dates = new LocalDate[length];
        for (int t = 0; t < length; t++) {
            dates[t] = startDate.plusDays(t);
        }
        double[] sin = SeasonalCalendar.sine(dates);
        double[] cos = SeasonalCalendar.cosine(dates);

        double[] naturalRainfall = null;
        double[] rain;
        if (rainfallMode == RainfallMode.WET_DAY) {
            naturalRainfall = new double[length];
            for (int t = 0; t < length; t++) {
                naturalRainfall[t] = rng.nextDouble() < wetDayProbability
                    ? RandomGenerators.gamma(rng, wetDayShape, wetDayShape / wetDayMean) : 0.0;
            }
            rain = SeriesTransforms.lagByOneDay(SeriesTransforms.log1pRain(naturalRainfall));
        } else {
            rain = new double[length];
            double muRain = parameters.get(Parameter.MU_RAIN);
            double sdRain = 1.0 / Math.sqrt(parameters.get(Parameter.TAU_RAIN));
            for (int t = 0; t < length; t++) {
                rain[t] = muRain + sdRain * gaussian.sample();
            }
        }

        double[] x = new double[length];
        double icSd = 1.0 / Math.sqrt(spec.initialCondition().precision());
        x[0] = spec.initialCondition().meanGiven(parameters.get(Parameter.MU0)) + icSd * gaussian.sample();
        double processSd = 1.0 / Math.sqrt(parameters.get(Parameter.TAU_ADD));
        for (int t = 1; t < length; t++) {
            double mu = ProcessMean.evaluate(spec, parameters, x[t - 1], rain[t], sin[t], cos[t]);
            x[t] = mu + processSd * gaussian.sample();
        }

        double observationSd = 1.0 / Math.sqrt(parameters.get(Parameter.TAU_OBS));
        double[] y = new double[length];
        double[] naturalFlow = new double[length];
        for (int t = 0; t < length; t++) {
            y[t] = x[t] + observationSd * gaussian.sample();
            if (rng.nextDouble() < missingResponseProbability) {
                y[t] = Double.NaN;
            }
            naturalFlow[t] = SeriesTransforms.naturalResponse(y[t]);
        }

        double[] observedRain = rain.clone();
        for (int t = 0; t < length; t++) {
            if (rng.nextDouble() < missingRainProbability) {
                observedRain[t] = Double.NaN;
                // Masking the covariate at t masks the previous day's rainfall
                if (naturalRainfall != null && t > 0) {
                    naturalRainfall[t - 1] = Double.NaN;
                }
            }
        }

        TimeSeriesDataset dataset = TimeSeriesDataset.builder()
            .dates(dates)
            .response(y)
            .rain(observedRain)
            .gapPolicy(GapPolicy.REJECT)
            .build();
        logger.debug("Generated {} days from seed {}: {} observed, {} rain missing",
            length, seed, dataset.observedCount(), dataset.missingRainIndices().length);
        return new SyntheticSeries(dataset, parameters.copy(), x, rain, naturalFlow, naturalRainfall);
    }

    private static double probability(String name, double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("Probability of " + name + " must be in [0, 1], got: " + p);
        }
        return p;
    }
}
