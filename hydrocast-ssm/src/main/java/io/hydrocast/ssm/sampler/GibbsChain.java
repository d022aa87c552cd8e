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
import io.hydrocast.ssm.model.InitialCondition;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import io.hydrocast.ssm.model.NormalPrior;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import io.hydrocast.ssm.model.ProcessMean;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * One Markov chain of the Gibbs sampler.
 *
 * <h2>Update order per iteration</h2>
 *
 * <ol>
 *   <li>latent path {@code x}: single-site or forward-filter backward-sample</li>
 *   <li>missing rainfall, when imputation is active</li>
 *   <li>regression coefficients jointly, then {@code beta_decay}, then {@code mu0}</li>
 *   <li>{@code tau_add}, {@code tau_obs}, then {@code mu_rain} and {@code tau_rain}</li>
 * </ol>
 *
 * <p>Every update is checked for finiteness; the first non-finite value
 * raises a {@link NumericalFailureException} naming the iteration and
 * variable, which ends this chain only.
 *
 * <p>The chain exclusively owns its generator and state. The dataset is read
 * through copies and never written.
 */
public final class GibbsChain implements Callable<ChainResult> {

    private static final Logger logger = LogManager.getLogger(GibbsChain.class);

    private final int chain;
    private final long seed;
    private final ModelSpecification spec;
    private final TimeSeriesDataset data;
    private final EngineConfig config;
    private final int[] imputedIndices;

    private final int n;
    private final double[] y;
    private final double[] seasonSin;
    private final double[] seasonCos;
    private final List<Parameter> coefficients;

    private UniformRandomProvider rng;
    private NormalizedGaussianSampler gaussian;
    private double[] x;
    private double[] rain;
    private ParameterVector p;
    private long iteration;

    // Filter scratch space
    private final double[] filteredMean;
    private final double[] filteredVariance;

    public GibbsChain(int chain, ModelSpecification spec, TimeSeriesDataset data, EngineConfig config,
                      int[] imputedIndices) {
        this.chain = chain;
        this.seed = config.seed(chain);
        this.spec = spec;
        this.data = data;
        this.config = config;
        this.imputedIndices = imputedIndices.clone();
        this.n = data.length();
        this.y = data.response();
        this.seasonSin = new double[n];
        this.seasonCos = new double[n];
        for (int t = 0; t < n; t++) {
            seasonSin[t] = data.seasonSin(t);
            seasonCos[t] = data.seasonCos(t);
        }
        this.coefficients = spec.regressionCoefficients();
        this.filteredMean = new double[n];
        this.filteredVariance = new double[n];
    }

    @Override
    public ChainResult call() {
        rng = RandomGenerators.create(seed);
        gaussian = RandomGenerators.gaussian(rng);
        ChainState start = config.initializer().initialize(spec, data, chain, rng);
        if (start.length() != n) {
            throw new IllegalStateException("Initializer returned a path of length " + start.length()
                + " for a series of length " + n);
        }
        x = start.states().clone();
        rain = start.rain().clone();
        p = start.parameters().copy();

        ChainTrace trace = new ChainTrace(config.retainedDraws(), config.thin());
        logger.debug("Chain {} starting: seed={}, iterations={}", chain, seed, config.iterations());
        try {
            for (iteration = 1; iteration <= config.iterations(); iteration++) {
                step();
                if (iteration % config.thin() == 0) {
                    trace.record(p, x, rain, imputedIndices);
                }
            }
        } catch (NumericalFailureException e) {
            logger.warn("Chain {} aborted: {}", chain, e.getMessage());
            return ChainResult.failed(chain, seed, e);
        }
        logger.debug("Chain {} finished with {} retained draws", chain, trace.size());
        return ChainResult.completed(chain, seed, trace);
    }

    /// One full Gibbs sweep.
    void step() {
        if (config.stateUpdate() == StateUpdate.SINGLE_SITE) {
            updateStatesSingleSite();
        } else {
            updateStatesBlock();
        }
        for (int t = 0; t < n; t++) {
            checkFinite("x[" + (t + 1) + "]", x[t]);
        }
        if (spec.hasTerm(ModelTerm.RAIN_IMPUTATION)) {
            updateMissingRain();
        }
        if (!coefficients.isEmpty()) {
            updateRegressionCoefficients();
        }
        if (spec.hasTerm(ModelTerm.DECAY)) {
            updateDecay();
            updateBaseline();
        }
        updateProcessPrecision();
        updateObservationPrecision();
        if (spec.hasTerm(ModelTerm.RAIN_IMPUTATION)) {
            updateRainModel();
        }
    }

    private double exogenous(int t) {
        return ProcessMean.exogenous(spec, p, rain[t], seasonSin[t], seasonCos[t]);
    }

    private double covariates(int t) {
        return ProcessMean.covariateEffect(spec, p, rain[t], seasonSin[t], seasonCos[t]);
    }

    private double initialMean() {
        return spec.initialCondition().meanGiven(p.get(Parameter.MU0));
    }

    private void updateStatesSingleSite() {
        double b = ProcessMean.decay(spec, p);
        double tauAdd = p.get(Parameter.TAU_ADD);
        double tauObs = p.get(Parameter.TAU_OBS);
        InitialCondition ic = spec.initialCondition();
        for (int t = 0; t < n; t++) {
            double priorMean = t == 0 ? initialMean() : exogenous(t) + b * x[t - 1];
            double priorPrecision = t == 0 ? ic.precision() : tauAdd;
            double nextResidual = t < n - 1 ? x[t + 1] - exogenous(t + 1) : Double.NaN;
            NormalConditional conditional = FullConditionals.latentState(
                priorMean, priorPrecision, b, tauAdd, nextResidual, y[t], tauObs);
            x[t] = conditional.sample(gaussian);
        }
    }

    /// Kalman filter forward, then sample the path backward from the filtered moments.
    private void updateStatesBlock() {
        double b = ProcessMean.decay(spec, p);
        double tauAdd = p.get(Parameter.TAU_ADD);
        double tauObs = p.get(Parameter.TAU_OBS);
        double processVariance = 1.0 / tauAdd;

        double predictedMean = initialMean();
        double predictedVariance = 1.0 / spec.initialCondition().precision();
        for (int t = 0; t < n; t++) {
            if (t > 0) {
                predictedMean = exogenous(t) + b * filteredMean[t - 1];
                predictedVariance = b * b * filteredVariance[t - 1] + processVariance;
            }
            if (Double.isNaN(y[t])) {
                filteredMean[t] = predictedMean;
                filteredVariance[t] = predictedVariance;
            } else {
                double gain = predictedVariance * tauObs / (predictedVariance * tauObs + 1.0);
                filteredMean[t] = predictedMean + gain * (y[t] - predictedMean);
                filteredVariance[t] = (1.0 - gain) * predictedVariance;
            }
        }

        x[n - 1] = filteredMean[n - 1] + Math.sqrt(filteredVariance[n - 1]) * gaussian.sample();
        for (int t = n - 2; t >= 0; t--) {
            double precision = 1.0 / filteredVariance[t] + b * b * tauAdd;
            double weighted = filteredMean[t] / filteredVariance[t] + b * tauAdd * (x[t + 1] - exogenous(t + 1));
            x[t] = weighted / precision + gaussian.sample() / Math.sqrt(precision);
        }
    }

    private void updateMissingRain() {
        boolean entersProcess = spec.hasTerm(ModelTerm.RAIN);
        double b = ProcessMean.decay(spec, p);
        double betaRain = p.get(Parameter.BETA_RAIN);
        double tauAdd = p.get(Parameter.TAU_ADD);
        double muRain = p.get(Parameter.MU_RAIN);
        double tauRain = p.get(Parameter.TAU_RAIN);
        for (int t : imputedIndices) {
            double partialResidual = Double.NaN;
            if (entersProcess && t > 0) {
                partialResidual = x[t] - b * x[t - 1] - (exogenous(t) - betaRain * rain[t]);
            }
            NormalConditional conditional = FullConditionals.missingRain(
                muRain, tauRain, betaRain, tauAdd, partialResidual);
            rain[t] = conditional.sample(gaussian);
            checkFinite("rain[" + (t + 1) + "]", rain[t]);
        }
    }

    private void updateRegressionCoefficients() {
        int k = coefficients.size();
        double b = ProcessMean.decay(spec, p);
        double level = spec.hasTerm(ModelTerm.DECAY)
            ? p.get(Parameter.MU0) * (1.0 - p.get(Parameter.BETA_DECAY)) : 0.0;
        double[][] gram = new double[k][k];
        double[] cross = new double[k];
        double[] row = new double[k];
        for (int t = 1; t < n; t++) {
            for (int j = 0; j < k; j++) {
                row[j] = covariate(coefficients.get(j), t);
            }
            double target = x[t] - b * x[t - 1] - level;
            for (int i = 0; i < k; i++) {
                cross[i] += row[i] * target;
                for (int j = 0; j < k; j++) {
                    gram[i][j] += row[i] * row[j];
                }
            }
        }
        NormalPrior[] priors = new NormalPrior[k];
        for (int j = 0; j < k; j++) {
            priors[j] = spec.normalPrior(coefficients.get(j));
        }
        double[] draw;
        try {
            draw = FullConditionals.regression(priors, p.get(Parameter.TAU_ADD), gram, cross).sample(gaussian);
        } catch (MathIllegalArgumentException e) {
            throw new NumericalFailureException(chain, iteration, coefficients.get(0).label(), Double.NaN, e);
        }
        for (int j = 0; j < k; j++) {
            checkFinite(coefficients.get(j).label(), draw[j]);
            p.set(coefficients.get(j), draw[j]);
        }
    }

    private double covariate(Parameter coefficient, int t) {
        switch (coefficient) {
            case BETA_RAIN:
                return rain[t];
            case BETA_SEASON_SIN:
                return seasonSin[t];
            case BETA_SEASON_COS:
                return seasonCos[t];
            default:
                throw new IllegalArgumentException(coefficient + " is not a regression coefficient");
        }
    }

    private void updateDecay() {
        double mu0 = p.get(Parameter.MU0);
        double sumZZ = 0.0;
        double sumZR = 0.0;
        for (int t = 1; t < n; t++) {
            double z = x[t - 1] - mu0;
            double r = x[t] - mu0 - covariates(t);
            sumZZ += z * z;
            sumZR += z * r;
        }
        NormalConditional conditional = FullConditionals.scalarCoefficient(p.get(Parameter.TAU_ADD), sumZZ, sumZR);
        double value = TruncatedNormalSampler.sample(rng, conditional,
            spec.decayPrior().lower(), spec.decayPrior().upper());
        checkFinite(Parameter.BETA_DECAY.label(), value);
        p.set(Parameter.BETA_DECAY, value);
    }

    private void updateBaseline() {
        double b = p.get(Parameter.BETA_DECAY);
        double residualSum = 0.0;
        for (int t = 1; t < n; t++) {
            residualSum += x[t] - b * x[t - 1] - covariates(t);
        }
        InitialCondition ic = spec.initialCondition();
        NormalConditional conditional = FullConditionals.baselineLevel(
            spec.normalPrior(Parameter.MU0), b, p.get(Parameter.TAU_ADD), n - 1, residualSum,
            ic.tiedToBaseline() ? ic.precision() : 0.0, x[0]);
        double value = conditional.sample(gaussian);
        checkFinite(Parameter.MU0.label(), value);
        p.set(Parameter.MU0, value);
    }

    private void updateProcessPrecision() {
        double b = ProcessMean.decay(spec, p);
        double sumSquares = 0.0;
        for (int t = 1; t < n; t++) {
            double residual = x[t] - b * x[t - 1] - exogenous(t);
            sumSquares += residual * residual;
        }
        checkFinite(Parameter.TAU_ADD.label(), sumSquares);
        double value = FullConditionals.precision(spec.gammaPrior(Parameter.TAU_ADD), n - 1, sumSquares)
            .sample(rng);
        checkPrecision(Parameter.TAU_ADD, value);
    }

    private void updateObservationPrecision() {
        int count = 0;
        double sumSquares = 0.0;
        for (int t = 0; t < n; t++) {
            if (!Double.isNaN(y[t])) {
                double residual = y[t] - x[t];
                sumSquares += residual * residual;
                count++;
            }
        }
        checkFinite(Parameter.TAU_OBS.label(), sumSquares);
        double value = FullConditionals.precision(spec.gammaPrior(Parameter.TAU_OBS), count, sumSquares)
            .sample(rng);
        checkPrecision(Parameter.TAU_OBS, value);
    }

    /// Mean and precision of the imputation model, informed by every rainfall value.
    private void updateRainModel() {
        double sum = 0.0;
        for (double r : rain) {
            sum += r;
        }
        double muRain = FullConditionals.normalMean(spec.normalPrior(Parameter.MU_RAIN),
            p.get(Parameter.TAU_RAIN), n, sum).sample(gaussian);
        checkFinite(Parameter.MU_RAIN.label(), muRain);
        p.set(Parameter.MU_RAIN, muRain);

        double sumSquares = 0.0;
        for (double r : rain) {
            sumSquares += (r - muRain) * (r - muRain);
        }
        checkFinite(Parameter.TAU_RAIN.label(), sumSquares);
        double tauRain = FullConditionals.precision(spec.gammaPrior(Parameter.TAU_RAIN), n, sumSquares)
            .sample(rng);
        checkPrecision(Parameter.TAU_RAIN, tauRain);
    }

    private void checkPrecision(Parameter parameter, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new NumericalFailureException(chain, iteration, parameter.label(), value);
        }
        p.set(parameter, value);
    }

    private void checkFinite(String variable, double value) {
        if (!Double.isFinite(value)) {
            throw new NumericalFailureException(chain, iteration, variable, value);
        }
    }
}
