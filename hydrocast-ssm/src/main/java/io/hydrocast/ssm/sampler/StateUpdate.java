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

/// Strategy for updating the latent path within one Gibbs iteration.
///
/// Both strategies leave the joint posterior invariant.
public enum StateUpdate {

    /// One-at-a-time draws of `x[t]` given `x[t-1]`, `x[t+1]` and `y[t]`.
    SINGLE_SITE,

    /// Block draw of the whole path by Kalman forward filtering and backward sampling.
    FORWARD_FILTER_BACKWARD_SAMPLE;

    /// Resolves a strategy from a short name (`single-site`, `ffbs`) or the enum name.
    public static StateUpdate fromName(String name) {
        String normalized = name.trim().toLowerCase().replace('_', '-');
        switch (normalized) {
            case "single-site":
            case "single":
                return SINGLE_SITE;
            case "ffbs":
            case "forward-filter-backward-sample":
            case "block":
                return FORWARD_FILTER_BACKWARD_SAMPLE;
            default:
                throw new IllegalArgumentException("Unknown state update: " + name
                    + " (expected single-site or ffbs)");
        }
    }
}
