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

/// Skill metrics reported per scale.
public enum Metric {
    /// Number of paired held-out points.
    N("n"),
    /// Root mean squared residual.
    RMSE("rmse"),
    /// Squared Pearson correlation between observed and predicted.
    R_SQUARED("r_squared"),
    /// Pearson correlation between observed and predicted.
    CORRELATION("correlation"),
    /// Standard deviation of predicted over standard deviation of observed.
    SD_RATIO("sd_ratio"),
    /// Root mean square of the mean-removed differences.
    CENTERED_RMS_DIFFERENCE("centered_rms_difference"),
    /// Fraction of observed values inside the 95% envelope.
    COVERAGE_95("coverage_95"),
    /// Mean residual, observed minus predicted.
    BIAS("bias");

    private final String label;

    Metric(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Whether the metric belongs to the agreement (Taylor-style) summary.
    public boolean isAgreement() {
        return this == CORRELATION || this == SD_RATIO || this == CENTERED_RMS_DIFFERENCE;
    }

    @Override
    public String toString() {
        return label;
    }
}
