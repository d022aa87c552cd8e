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

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;

/**
 * Multivariate normal full conditional of the regression coefficients, held
 * in precision form {@code N(P^-1 h, P^-1)}.
 *
 * <p>The draw factors {@code P = L L'} once, solves for the mean and adds
 * {@code L'^-1 z} for a standard normal vector {@code z}.
 */
public final class RegressionConditional {

    private final RealMatrix precision;
    private final CholeskyDecomposition cholesky;
    private final double[] mean;

    RegressionConditional(RealMatrix precision, RealVector weightedSum) {
        this.precision = precision;
        this.cholesky = new CholeskyDecomposition(precision);
        this.mean = cholesky.getSolver().solve(weightedSum).toArray();
    }

    public int dimension() {
        return mean.length;
    }

    public double[] mean() {
        return mean.clone();
    }

    public RealMatrix precision() {
        return precision.copy();
    }

    /// Draws one coefficient vector.
    public double[] sample(NormalizedGaussianSampler gaussian) {
        double[] z = new double[mean.length];
        for (int i = 0; i < z.length; i++) {
            z[i] = gaussian.sample();
        }
        RealVector offset = MatrixUtils.createRealVector(z);
        MatrixUtils.solveUpperTriangularSystem(cholesky.getLT(), offset);
        double[] draw = new double[mean.length];
        for (int i = 0; i < draw.length; i++) {
            draw[i] = mean[i] + offset.getEntry(i);
        }
        return draw;
    }
}
