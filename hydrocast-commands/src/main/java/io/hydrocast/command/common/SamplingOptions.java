package io.hydrocast.command.common;

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

import io.hydrocast.ssm.diagnostics.BurnInPolicy;
import io.hydrocast.ssm.diagnostics.ConvergenceDiagnostics;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.sampler.EngineConfig;
import io.hydrocast.ssm.sampler.StateUpdate;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared sampler and convergence options.
 */
public class SamplingOptions {

    @CommandLine.Option(
        names = {"-c", "--chains"},
        description = "Number of independent chains, at least 2 (default: ${DEFAULT-VALUE})",
        defaultValue = "3"
    )
    private int chains = EngineConfig.DEFAULT_CHAINS;

    @CommandLine.Option(
        names = {"-n", "--iterations"},
        description = "Iterations per chain (default: ${DEFAULT-VALUE})",
        defaultValue = "5000"
    )
    private int iterations = EngineConfig.DEFAULT_ITERATIONS;

    @CommandLine.Option(
        names = {"--thin"},
        description = "Keep every k-th iteration (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private int thin = 1;

    @CommandLine.Option(
        names = {"--burn-in"},
        description = "Burn-in policy: <n>, fixed:<n>, adaptive or adaptive:<step> (default: ${DEFAULT-VALUE})",
        defaultValue = "fixed:1000"
    )
    private String burnIn = "fixed:1000";

    @CommandLine.Option(
        names = {"--state-update"},
        description = "Latent path update: ffbs or single-site (default: ${DEFAULT-VALUE})",
        defaultValue = "ffbs"
    )
    private String stateUpdate = "ffbs";

    @CommandLine.Option(
        names = {"--monitor"},
        description = "Comma-separated parameters checked for convergence (default: tau_obs,tau_add)",
        split = ","
    )
    private List<String> monitored;

    @CommandLine.Option(
        names = {"--threshold"},
        description = "Scale-reduction threshold (default: ${DEFAULT-VALUE})",
        defaultValue = "1.1"
    )
    private double threshold = ConvergenceDiagnostics.DEFAULT_THRESHOLD;

    @CommandLine.Option(
        names = {"--extend"},
        description = "Double the iterations and resample while chains are not converged"
    )
    private boolean extend = false;

    @CommandLine.Option(
        names = {"--max-iterations"},
        description = "Upper bound on iterations when extending (default: 4x --iterations)"
    )
    private Integer maxIterations;

    public EngineConfig engineConfig(RandomSeedOption seeds) {
        EngineConfig.Builder builder = EngineConfig.builder()
            .chains(chains)
            .iterations(iterations)
            .thin(thin)
            .stateUpdate(StateUpdate.fromName(stateUpdate));
        long[] explicit = seeds.getChainSeeds();
        if (explicit != null) {
            builder.seeds(explicit);
        } else {
            builder.baseSeed(seeds.getSeed());
        }
        return builder.build();
    }

    public BurnInPolicy burnInPolicy() {
        return BurnInPolicy.parse(burnIn);
    }

    public List<Parameter> monitoredParameters() {
        if (monitored == null || monitored.isEmpty()) {
            return ConvergenceDiagnostics.DEFAULT_MONITORED;
        }
        List<Parameter> parameters = new ArrayList<>();
        for (String name : monitored) {
            parameters.add(Parameter.fromLabel(name.trim()));
        }
        return parameters;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isExtend() {
        return extend;
    }

    /// Explicit maximum, or -1 to let the pipeline choose.
    public int getMaxIterations() {
        return maxIterations == null ? -1 : maxIterations;
    }
}
