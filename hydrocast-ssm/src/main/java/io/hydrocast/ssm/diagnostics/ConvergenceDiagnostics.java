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

import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.NumericalFailureException;
import io.hydrocast.ssm.sampler.PosteriorSampleSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Certifies that chains have mixed and decides the burn-in to discard.
 *
 * <h2>Verdict</h2>
 *
 * <p>Chains are judged converged when the potential scale reduction of every
 * monitored parameter, computed on the post-burn-in window, is below the
 * threshold (default {@value #DEFAULT_THRESHOLD}).
 *
 * <ul>
 *   <li>Only surviving chains participate. With fewer than 2 the verdict is
 *       rejected and the reason says so.</li>
 *   <li>Under {@link BurnInPolicy.Kind#FIXED} the configured count is
 *       discarded; if that leaves fewer than 2 draws, half of each chain is
 *       discarded instead.</li>
 *   <li>Under {@link BurnInPolicy.Kind#ADAPTIVE} the burn-in is the smallest
 *       multiple of the step, at most half the run, such that every window
 *       from it to {@code burnIn + k * step} (at least two steps long) and to
 *       the end of the run is below threshold. When none qualifies the
 *       verdict is rejected with half the run as burn-in.</li>
 * </ul>
 *
 * <p>A rejected verdict is logged at warn level and returned; it is never thrown.
 */
public final class ConvergenceDiagnostics {

    private static final Logger logger = LogManager.getLogger(ConvergenceDiagnostics.class);

    public static final double DEFAULT_THRESHOLD = 1.1;
    public static final List<Parameter> DEFAULT_MONITORED = List.of(Parameter.TAU_OBS, Parameter.TAU_ADD);

    private final List<Parameter> monitored;
    private final BurnInPolicy policy;
    private final double threshold;

    public ConvergenceDiagnostics() {
        this(DEFAULT_MONITORED, BurnInPolicy.fixedDefault(), DEFAULT_THRESHOLD);
    }

    public ConvergenceDiagnostics(List<Parameter> monitored, BurnInPolicy policy) {
        this(monitored, policy, DEFAULT_THRESHOLD);
    }

    /**
     * @param monitored parameters to check; must not be empty
     * @param policy burn-in policy
     * @param threshold scale-reduction threshold, greater than 1
     */
    public ConvergenceDiagnostics(List<Parameter> monitored, BurnInPolicy policy, double threshold) {
        if (monitored == null || monitored.isEmpty()) {
            throw new IllegalArgumentException("At least one monitored parameter is required");
        }
        if (!(threshold > 1.0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Scale-reduction threshold must be finite and above 1, got: " + threshold);
        }
        this.monitored = List.copyOf(monitored);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.threshold = threshold;
    }

    public List<Parameter> monitored() {
        return monitored;
    }

    public BurnInPolicy policy() {
        return policy;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Evaluates a sample set from the engine.
     *
     * @throws IllegalArgumentException if a monitored parameter is not sampled by the run's specification
     */
    public ConvergenceReport evaluate(PosteriorSampleSet samples) {
        Map<Parameter, double[][]> traces = new LinkedHashMap<>();
        for (Parameter parameter : monitored) {
            if (!samples.specification().isSampled(parameter)) {
                throw new IllegalArgumentException("Monitored parameter " + parameter
                    + " is not sampled under terms " + samples.specification().terms());
            }
            traces.put(parameter, samples.parameterTraces(parameter));
        }
        List<String> failures = new ArrayList<>();
        for (NumericalFailureException failure : samples.failures()) {
            failures.add(failure.getMessage());
        }
        return evaluate(traces, samples.drawsPerChain(), samples.thin(), samples.chains().size(), failures);
    }

    /**
     * Evaluates raw traces of the monitored parameters.
     *
     * @param traces per monitored parameter, one row per surviving chain
     * @param drawsPerChain retained draws per chain
     * @param thin thinning interval, converting iterations to draws
     * @param totalChains chains started, failed ones included
     * @param failures failure messages of the failed chains
     * @return the verdict
     */
    public ConvergenceReport evaluate(Map<Parameter, double[][]> traces, int drawsPerChain, int thin,
                                      int totalChains, List<String> failures) {
        int surviving = traces.isEmpty() ? 0 : traces.values().iterator().next().length;
        int fallbackBurnIn = drawsPerChain / 2;

        if (surviving < 2) {
            String reason = surviving + " of " + totalChains + " chains survived; at least 2 are needed";
            return reject(reason, fallbackBurnIn, drawsPerChain, thin, Map.of(), surviving, totalChains, failures);
        }
        if (drawsPerChain < 4) {
            String reason = "Only " + drawsPerChain + " draws per chain; at least 4 are needed";
            return reject(reason, fallbackBurnIn, drawsPerChain, thin, Map.of(), surviving, totalChains, failures);
        }

        Map<Parameter, PotentialScaleReduction> reductions = new LinkedHashMap<>();
        for (Parameter parameter : monitored) {
            double[][] rows = traces.get(parameter);
            if (rows == null) {
                throw new IllegalArgumentException("No traces supplied for monitored parameter " + parameter);
            }
            reductions.put(parameter, new PotentialScaleReduction(rows));
        }

        if (policy.isAdaptive()) {
            return adaptive(reductions, drawsPerChain, thin, surviving, totalChains, failures);
        }

        int burnIn = policy.iterations() / thin;
        if (drawsPerChain - burnIn < 2) {
            logger.warn("Burn-in of {} iterations leaves fewer than 2 of {} draws; discarding half of each chain",
                policy.iterations(), drawsPerChain);
            burnIn = fallbackBurnIn;
        }
        Map<Parameter, Double> ratios = ratiosOver(reductions, burnIn, drawsPerChain);
        List<Parameter> above = aboveThreshold(ratios);
        if (above.isEmpty()) {
            logger.info("Chains converged after burn-in of {} draws: {}", burnIn, ratios);
            return new ConvergenceReport(true, threshold, policy, thin, burnIn, drawsPerChain, ratios,
                surviving, totalChains, failures, null);
        }
        String reason = "Scale reduction at or above " + threshold + " for " + above;
        return reject(reason, burnIn, drawsPerChain, thin, ratios, surviving, totalChains, failures);
    }

    private ConvergenceReport adaptive(Map<Parameter, PotentialScaleReduction> reductions, int drawsPerChain,
                                       int thin, int surviving, int totalChains, List<String> failures) {
        int step = Math.max(1, policy.iterations() / thin);
        int limit = drawsPerChain / 2;
        for (int burnIn = 0; burnIn <= limit; burnIn += step) {
            if (stableFrom(reductions, burnIn, step, drawsPerChain)) {
                Map<Parameter, Double> ratios = ratiosOver(reductions, burnIn, drawsPerChain);
                logger.info("Chains converged; adaptive burn-in of {} draws: {}", burnIn, ratios);
                return new ConvergenceReport(true, threshold, policy, thin, burnIn, drawsPerChain, ratios,
                    surviving, totalChains, failures, null);
            }
        }
        Map<Parameter, Double> ratios = ratiosOver(reductions, limit, drawsPerChain);
        String reason = "No burn-in up to half the run keeps the scale reduction below " + threshold;
        return reject(reason, limit, drawsPerChain, thin, ratios, surviving, totalChains, failures);
    }

    private boolean stableFrom(Map<Parameter, PotentialScaleReduction> reductions, int burnIn, int step, int end) {
        int firstEnd = Math.max(burnIn + 2 * step, burnIn + 2);
        for (PotentialScaleReduction psr : reductions.values()) {
            for (int to = firstEnd; to < end; to += step) {
                if (!(psr.ratio(burnIn, to) < threshold)) {
                    return false;
                }
            }
            if (!(psr.ratio(burnIn, end) < threshold)) {
                return false;
            }
        }
        return true;
    }

    private static Map<Parameter, Double> ratiosOver(Map<Parameter, PotentialScaleReduction> reductions,
                                                     int from, int to) {
        Map<Parameter, Double> ratios = new LinkedHashMap<>();
        reductions.forEach((parameter, psr) -> ratios.put(parameter, psr.ratio(from, to)));
        return ratios;
    }

    private List<Parameter> aboveThreshold(Map<Parameter, Double> ratios) {
        List<Parameter> above = new ArrayList<>();
        ratios.forEach((parameter, ratio) -> {
            if (!(ratio < threshold)) {
                above.add(parameter);
            }
        });
        return above;
    }

    private ConvergenceReport reject(String reason, int burnIn, int drawsPerChain, int thin,
                                     Map<Parameter, Double> ratios, int surviving, int totalChains,
                                     List<String> failures) {
        logger.warn("Chains not converged: {}", reason);
        return new ConvergenceReport(false, threshold, policy, thin, burnIn, drawsPerChain, ratios,
            surviving, totalChains, failures, reason);
    }
}
