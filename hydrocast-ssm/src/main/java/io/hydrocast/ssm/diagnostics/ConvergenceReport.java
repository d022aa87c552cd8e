package io.hydrocast.ssm.diagnostics;

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

import com.google.gson.annotations.SerializedName;
import io.hydrocast.ssm.model.Parameter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verdict of the convergence check.
 *
 * <p>A rejected verdict is information, not an error: {@link #burnInDraws()}
 * is still set so that a caller may summarise with a caveat.
 */
public final class ConvergenceReport {

    @SerializedName("approved")
    private final boolean approved;

    @SerializedName("threshold")
    private final double threshold;

    @SerializedName("burn_in_policy")
    private final String burnInPolicy;

    @SerializedName("burn_in_iterations")
    private final long burnInIterations;

    @SerializedName("burn_in_draws")
    private final int burnInDraws;

    @SerializedName("draws_per_chain")
    private final int drawsPerChain;

    @SerializedName("scale_reduction")
    private final Map<Parameter, Double> ratios;

    @SerializedName("surviving_chains")
    private final int survivingChains;

    @SerializedName("total_chains")
    private final int totalChains;

    @SerializedName("failures")
    private final List<String> failures;

    @SerializedName("reason")
    private final String reason;

    ConvergenceReport(boolean approved, double threshold, BurnInPolicy policy, int thin, int burnInDraws,
                      int drawsPerChain, Map<Parameter, Double> ratios, int survivingChains, int totalChains,
                      List<String> failures, String reason) {
        this.approved = approved;
        this.threshold = threshold;
        this.burnInPolicy = policy.toString();
        this.burnInIterations = (long) burnInDraws * thin;
        this.burnInDraws = burnInDraws;
        this.drawsPerChain = drawsPerChain;
        this.ratios = Collections.unmodifiableMap(new LinkedHashMap<>(ratios));
        this.survivingChains = survivingChains;
        this.totalChains = totalChains;
        this.failures = List.copyOf(failures);
        this.reason = reason;
    }

    public boolean approved() {
        return approved;
    }

    public double threshold() {
        return threshold;
    }

    public String burnInPolicy() {
        return burnInPolicy;
    }

    /// Burn-in in iterations.
    public long burnInIterations() {
        return burnInIterations;
    }

    /// Burn-in in retained draws; the summarizer drops this many from each chain.
    public int burnInDraws() {
        return burnInDraws;
    }

    public int drawsPerChain() {
        return drawsPerChain;
    }

    /// Scale reduction per monitored parameter over the post-burn-in window.
    public Map<Parameter, Double> ratios() {
        return ratios;
    }

    public double ratio(Parameter parameter) {
        Double value = ratios.get(parameter);
        return value == null ? Double.NaN : value;
    }

    public int survivingChains() {
        return survivingChains;
    }

    public int totalChains() {
        return totalChains;
    }

    public List<String> failures() {
        return failures;
    }

    /// Why the verdict was rejected, if it was.
    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return "ConvergenceReport[approved=" + approved + ", burnIn=" + burnInIterations + " iterations, ratios="
            + ratios + ", surviving=" + survivingChains + "/" + totalChains
            + (reason != null ? ", reason=" + reason : "") + "]";
    }
}
