package io.hydrocast.ssm.model;

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

/// Scalar parameters of the state-space model.
///
/// Labels follow the usual model notation and are used in reports and logs.
public enum Parameter {
    TAU_OBS("tau_obs", true),
    TAU_ADD("tau_add", true),
    MU0("mu0", false),
    BETA_DECAY("beta_decay", false),
    BETA_RAIN("beta_rain", false),
    BETA_SEASON_SIN("beta_season_sin", false),
    BETA_SEASON_COS("beta_season_cos", false),
    MU_RAIN("mu_rain", false),
    TAU_RAIN("tau_rain", true);

    private final String label;
    private final boolean precision;

    Parameter(String label, boolean precision) {
        this.label = label;
        this.precision = precision;
    }

    public String label() {
        return label;
    }

    /// True for precision (inverse variance) parameters.
    public boolean isPrecision() {
        return precision;
    }

    /// Resolves a parameter from its label or enum name, case-insensitively.
    ///
    /// @throws IllegalArgumentException for an unknown name
    public static Parameter fromLabel(String name) {
        for (Parameter p : values()) {
            if (p.label.equalsIgnoreCase(name) || p.name().equalsIgnoreCase(name)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown parameter: " + name);
    }

    @Override
    public String toString() {
        return label;
    }
}
