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

import io.hydrocast.ssm.model.GammaPrior;
import io.hydrocast.ssm.model.NormalPrior;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// Closed-form full conditional distributions of the state-space model.
///
/// Every method is a pure function of sufficient statistics; the chain
/// computes the statistics from its current state and draws from the
/// returned conditional. Keeping the algebra here makes each conditional
/// testable on its own.
///
/// ## Notation
///
/// | symbol | meaning |
/// |--------|---------|
/// | `b`    | effective decay (1 without the decay term) |
/// | `e[t]` | exogenous part of `mu[t]`, everything except `b * x[t-1]` |
public final class FullConditionals {

    private FullConditionals() {
    }

    /// Single-site conditional of one latent state `x[t]`.
    ///
    /// Combines the process (or initial-condition) prior on `x[t]`, the
    /// process term linking `x[t]` to `x[t+1]`, and the observation `y[t]`.
    ///
    /// @param priorMean `mu[t]` given `x[t-1]`, or the initial-condition mean at `t = 1`
    /// @param priorPrecision `tau_add`, or `tau_ic` at `t = 1`
    /// @param decay effective decay `b`
    /// @param tauAdd process precision
    /// @param nextResidual `x[t+1] - e[t+1]`, or `NaN` at the last index
    /// @param observation `y[t]`, or `NaN` when missing
    /// @param tauObs observation precision
    /// @return the conditional
    public static NormalConditional latentState(double priorMean, double priorPrecision,
                                                double decay, double tauAdd, double nextResidual,
                                                double observation, double tauObs) {
        double precision = priorPrecision;
        double weighted = priorPrecision * priorMean;
        if (!Double.isNaN(nextResidual)) {
            precision += decay * decay * tauAdd;
            weighted += decay * tauAdd * nextResidual;
        }
        if (!Double.isNaN(observation)) {
            precision += tauObs;
            weighted += tauObs * observation;
        }
        return NormalConditional.fromNaturalParameters(precision, weighted);
    }

    /// Conditional of one missing rainfall value.
    ///
    /// @param muRain imputation mean
    /// @param tauRain imputation precision
    /// @param betaRain rainfall coefficient
    /// @param tauAdd process precision
    /// @param partialResidual `x[t] - (mu[t] - beta_rain * rain[t])` when the value
    ///     enters the process mean, otherwise `NaN`
    /// @return the conditional
    public static NormalConditional missingRain(double muRain, double tauRain, double betaRain,
                                                double tauAdd, double partialResidual) {
        double precision = tauRain;
        double weighted = tauRain * muRain;
        if (!Double.isNaN(partialResidual)) {
            precision += betaRain * betaRain * tauAdd;
            weighted += betaRain * tauAdd * partialResidual;
        }
        return NormalConditional.fromNaturalParameters(precision, weighted);
    }

    /// Conjugate conditional of a normal mean with known data precision.
    ///
    /// @param prior normal prior on the mean
    /// @param dataPrecision precision of each data term
    /// @param count number of data terms
    /// @param sum sum of the data terms
    /// @return the conditional
    public static NormalConditional normalMean(NormalPrior prior, double dataPrecision, int count, double sum) {
        double precision = prior.precision() + dataPrecision * count;
        double weighted = prior.precision() * prior.mean() + dataPrecision * sum;
        return NormalConditional.fromNaturalParameters(precision, weighted);
    }

    /// Conditional of a scalar coefficient `beta` in `r = beta * z + noise`,
    /// noise precision `tauAdd`, before the prior is applied.
    ///
    /// @param tauAdd noise precision
    /// @param sumZZ `sum z^2`
    /// @param sumZR `sum z * r`
    /// @return the likelihood term; flat when `sumZZ` is zero
    public static NormalConditional scalarCoefficient(double tauAdd, double sumZZ, double sumZR) {
        return NormalConditional.fromNaturalParameters(tauAdd * sumZZ, tauAdd * sumZR);
    }

    /// Conditional of the baseline level `mu0`.
    ///
    /// With `c = 1 - b` and `r[t] = x[t] - b * x[t-1] - covariates[t]`, each
    /// process step contributes `r[t] ~ Normal(c * mu0, 1/tau_add)`. A baseline
    /// initial condition adds `x[1] ~ Normal(mu0, 1/tau_ic)`.
    ///
    /// @param prior normal prior on `mu0`
    /// @param decay `b`
    /// @param tauAdd process precision
    /// @param steps number of process steps (`n - 1`)
    /// @param residualSum `sum r[t]`
    /// @param initialPrecision `tau_ic` when the initial condition is tied to `mu0`, else 0
    /// @param initialState `x[1]`
    /// @return the conditional
    public static NormalConditional baselineLevel(NormalPrior prior, double decay, double tauAdd, int steps,
                                                  double residualSum, double initialPrecision,
                                                  double initialState) {
        double c = 1.0 - decay;
        double precision = prior.precision() + tauAdd * c * c * steps + initialPrecision;
        double weighted = prior.precision() * prior.mean() + tauAdd * c * residualSum;
        if (initialPrecision > 0) {
            weighted += initialPrecision * initialState;
        }
        return NormalConditional.fromNaturalParameters(precision, weighted);
    }

    /// Conjugate Gamma conditional of a precision.
    ///
    /// @param prior Gamma prior
    /// @param count number of residuals
    /// @param sumSquares sum of squared residuals
    /// @return `Gamma(shape + count/2, rate + sumSquares/2)`
    public static GammaConditional precision(GammaPrior prior, int count, double sumSquares) {
        return new GammaConditional(prior.shape() + count / 2.0, prior.rate() + sumSquares / 2.0);
    }

    /// Joint conditional of regression coefficients with independent normal priors.
    ///
    /// @param priors prior per coefficient, in design-matrix column order
    /// @param tauAdd noise precision
    /// @param gram `Z'Z`
    /// @param crossProduct `Z'r`
    /// @return the multivariate conditional
    public static RegressionConditional regression(NormalPrior[] priors, double tauAdd,
                                                   double[][] gram, double[] crossProduct) {
        int k = priors.length;
        RealMatrix precision = MatrixUtils.createRealMatrix(k, k);
        RealVector weighted = MatrixUtils.createRealVector(new double[k]);
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                precision.setEntry(i, j, tauAdd * gram[i][j]);
            }
            precision.addToEntry(i, i, priors[i].precision());
            weighted.setEntry(i, priors[i].precision() * priors[i].mean() + tauAdd * crossProduct[i]);
        }
        return new RegressionConditional(precision, weighted);
    }
}
