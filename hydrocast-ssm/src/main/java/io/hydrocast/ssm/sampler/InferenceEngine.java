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
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-chain Gibbs sampler for the state-space model.
 *
 * <h2>Execution</h2>
 *
 * <p>Each chain is one {@link GibbsChain} task submitted to an
 * {@link ExecutorService}. Chains share nothing mutable; each seeds its own
 * generator. The engine waits on every chain's {@link Future} before
 * returning, so callers always receive complete histories.
 *
 * <h2>Failure handling</h2>
 *
 * <ul>
 *   <li>Configuration and input-contract violations throw
 *       {@link IllegalArgumentException} before any chain is submitted.</li>
 *   <li>A chain that produces a non-finite value is recorded as failed in
 *       the returned {@link PosteriorSampleSet}; the remaining chains run to
 *       completion.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * InferenceEngine engine = new InferenceEngine();
 * try {
 *     PosteriorSampleSet samples = engine.run(ModelSpecification.full(), dataset, EngineConfig.defaults());
 * } finally {
 *     engine.shutdown();
 * }
 * }</pre>
 */
public final class InferenceEngine {

    private static final Logger logger = LogManager.getLogger(InferenceEngine.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates an engine with its own pool sized to the available processors.
     */
    public InferenceEngine() {
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()), r -> {
            Thread thread = new Thread(r, "hydrocast-chain-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.ownsExecutor = true;
    }

    /**
     * Creates an engine that submits chains to a caller-managed executor.
     *
     * @param executor the executor to run chains on
     */
    public InferenceEngine(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.ownsExecutor = false;
    }

    /**
     * Runs every chain to completion or failure.
     *
     * @param spec the model specification
     * @param data the fitting dataset; not modified
     * @param config chain count, iterations, thinning, seeds, update strategy
     * @return all retained draws and per-chain failures
     * @throws IllegalArgumentException for configuration or input-contract violations
     */
    public PosteriorSampleSet run(ModelSpecification spec, TimeSeriesDataset data, EngineConfig config) {
        Objects.requireNonNull(spec, "spec cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        validate(spec, data);

        int[] imputedIndices = spec.hasTerm(ModelTerm.RAIN_IMPUTATION) ? data.missingRainIndices() : new int[0];
        logger.info("Sampling {} chains x {} iterations (thin {}, {}) over {} days, {} observed, {} rain values imputed",
            config.chains(), config.iterations(), config.thin(), config.stateUpdate(),
            data.length(), data.observedCount(), imputedIndices.length);

        long startTime = System.currentTimeMillis();
        List<Future<ChainResult>> futures = new ArrayList<>();
        for (int c = 0; c < config.chains(); c++) {
            futures.add(executor.submit(new GibbsChain(c, spec, data, config, imputedIndices)));
        }

        List<ChainResult> results = new ArrayList<>();
        for (Future<ChainResult> future : futures) {
            results.add(await(future));
        }

        PosteriorSampleSet samples = new PosteriorSampleSet(spec, data, config, results, imputedIndices);
        long elapsed = System.currentTimeMillis() - startTime;
        if (samples.failures().isEmpty()) {
            logger.info("Sampling complete in {} ms", elapsed);
        } else {
            logger.warn("Sampling complete in {} ms with {} of {} chains failed",
                elapsed, samples.failures().size(), config.chains());
        }
        return samples;
    }

    /**
     * Fail-fast checks of the dataset against the specification.
     *
     * @throws IllegalArgumentException if the response is entirely missing, or
     *     the rain term needs a rainfall value that is missing while
     *     imputation is off
     */
    public static void validate(ModelSpecification spec, TimeSeriesDataset data) {
        if (data.length() == 0) {
            throw new IllegalArgumentException("Dataset is empty");
        }
        if (data.observedCount() == 0) {
            throw new IllegalArgumentException("Response series is entirely missing; nothing to fit");
        }
        if (spec.hasTerm(ModelTerm.RAIN) && !spec.hasTerm(ModelTerm.RAIN_IMPUTATION)) {
            // rain[1] has no lagged value and never enters the process mean
            for (int t = 1; t < data.length(); t++) {
                if (data.isRainMissing(t)) {
                    throw new IllegalArgumentException("Rainfall is missing at position " + (t + 1)
                        + " (" + data.date(t) + ") but rainfall imputation is not enabled");
                }
            }
        }
    }

    private static ChainResult await(Future<ChainResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for chains", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Chain failed unexpectedly", cause);
        }
    }

    /**
     * Shuts down the executor if owned by this engine.
     */
    public void shutdown() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }
}
