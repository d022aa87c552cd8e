package io.hydrocast.ssm.validation;

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

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.OptionalDouble;

/// Taylor-diagram statistics comparing predicted against observed values.
///
/// Standard deviations use the population divisor `n`, so that
/// `E'^2 = sd_p^2 + sd_o^2 - 2 * sd_p * sd_o * r` holds exactly.
///
/// All three need at least two pairs. Correlation additionally needs both
/// series to vary; the ratio needs the observed series to vary.
///
/// @param correlation Pearson correlation `r`
/// @param sdRatio `sd_p / sd_o`
/// @param centeredRmsDifference `E'`, RMS of the mean-removed differences
public record AgreementStatistics(OptionalDouble correlation, OptionalDouble sdRatio,
                                  OptionalDouble centeredRmsDifference) {

    public static AgreementStatistics compute(double[] observed, double[] predicted) {
        if (observed.length != predicted.length) {
            throw new IllegalArgumentException("Observed has " + observed.length + " values but predicted has "
                + predicted.length);
        }
        int n = observed.length;
        if (n < 2) {
            return new AgreementStatistics(OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        double meanObserved = mean(observed);
        double meanPredicted = mean(predicted);
        double sumObserved = 0.0;
        double sumPredicted = 0.0;
        double sumCentered = 0.0;
        for (int i = 0; i < n; i++) {
            double o = observed[i] - meanObserved;
            double p = predicted[i] - meanPredicted;
            sumObserved += o * o;
            sumPredicted += p * p;
            sumCentered += (p - o) * (p - o);
        }
        double sdObserved = Math.sqrt(sumObserved / n);
        double sdPredicted = Math.sqrt(sumPredicted / n);

        OptionalDouble correlation = OptionalDouble.empty();
        if (sdObserved > 0 && sdPredicted > 0) {
            double r = new PearsonsCorrelation().correlation(observed, predicted);
            if (Double.isFinite(r)) {
                correlation = OptionalDouble.of(r);
            }
        }
        OptionalDouble ratio = sdObserved > 0 ? OptionalDouble.of(sdPredicted / sdObserved) : OptionalDouble.empty();
        return new AgreementStatistics(correlation, ratio, OptionalDouble.of(Math.sqrt(sumCentered / n)));
    }

    /// Squared correlation, undefined whenever the correlation is.
    public OptionalDouble rSquared() {
        if (correlation.isEmpty()) {
            return OptionalDouble.empty();
        }
        double r = correlation.getAsDouble();
        return OptionalDouble.of(r * r);
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
