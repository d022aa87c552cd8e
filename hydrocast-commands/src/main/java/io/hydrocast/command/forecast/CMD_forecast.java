package io.hydrocast.command.forecast;

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

import io.hydrocast.command.common.HoldOutOptions;
import io.hydrocast.command.common.ModelOptions;
import io.hydrocast.command.common.RandomSeedOption;
import io.hydrocast.command.common.SamplingOptions;
import io.hydrocast.command.common.VerbosityOption;
import io.hydrocast.command.io.DatasetCsvReader;
import io.hydrocast.command.io.ForecastArtifactWriter;
import io.hydrocast.ssm.data.GapPolicy;
import io.hydrocast.ssm.data.HeldOutSplit;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.pipeline.ForecastPipeline;
import io.hydrocast.ssm.pipeline.ForecastResult;
import io.hydrocast.ssm.pipeline.NoSurvivingChainsException;
import io.hydrocast.ssm.pipeline.PipelineConfig;
import io.hydrocast.ssm.sampler.InferenceEngine;
import io.hydrocast.ssm.summary.ParameterSummary;
import io.hydrocast.ssm.validation.Metric;
import io.hydrocast.ssm.validation.MetricTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Fit a model to a daily flow series and write forecast intervals.
///
/// Reads a cleaned CSV, optionally withholds a tail of the response for
/// validation, runs the multi-chain sampler, checks convergence, and writes
/// the forecast, parameter, imputed-rain, metric and convergence artifacts
/// into the output directory.
@CommandLine.Command(name = "forecast",
    header = "Fit a latent-state flow model and write forecast intervals",
    description = "Runs multi-chain Gibbs sampling on a daily flow series, checks convergence, "
        + "summarizes the posterior forecast and optionally scores withheld observations.",
    exitCodeList = {
        "0: Success",
        "1: Configuration or input error",
        "2: Every chain failed numerically"
    })
public class CMD_forecast implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_forecast.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_NO_SURVIVORS = 2;

    @CommandLine.Option(names = {"-i", "--input"}, required = true,
        description = "CSV with date, flow and optional rain columns")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, defaultValue = "forecast-out",
        description = "Directory for artifacts (default: ${DEFAULT-VALUE})")
    private Path output;

    @CommandLine.Option(names = {"--tolerate-gaps"},
        description = "Treat consecutive rows as consecutive days even when dates skip")
    private boolean tolerateGaps = false;

    @CommandLine.Option(names = {"--no-log-scale"},
        description = "Omit log-scale columns from forecast.csv")
    private boolean noLogScale = false;

    @CommandLine.Mixin
    private ModelOptions modelOptions = new ModelOptions();

    @CommandLine.Mixin
    private SamplingOptions samplingOptions = new SamplingOptions();

    @CommandLine.Mixin
    private HoldOutOptions holdOutOptions = new HoldOutOptions();

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    /// Run CMD_forecast
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_forecast()).execute(args));
    }

    @Override
    public Integer call() {
        InferenceEngine engine = null;
        try {
            verbosity.validate();
            verbosity.applyLogLevel();
            holdOutOptions.validate();

            ModelSpecification spec = modelOptions.resolve();
            PipelineConfig.Builder config = PipelineConfig.builder()
                .engine(samplingOptions.engineConfig(seedOption))
                .burnIn(samplingOptions.burnInPolicy())
                .monitored(samplingOptions.monitoredParameters())
                .threshold(samplingOptions.getThreshold())
                .extendOnNonConvergence(samplingOptions.isExtend())
                .logScale(!noLogScale);
            if (samplingOptions.getMaxIterations() > 0) {
                config.maxIterations(samplingOptions.getMaxIterations());
            }

            TimeSeriesDataset full = DatasetCsvReader.read(input,
                tolerateGaps ? GapPolicy.TOLERATE : GapPolicy.REJECT);
            logger.info("Loaded {} days from {} ({} observed)", full.length(), input, full.observedCount());

            engine = new InferenceEngine();
            ForecastPipeline pipeline = new ForecastPipeline(engine, config.build());
            HeldOutSplit split = holdOutOptions.split(full);
            ForecastResult result = split != null
                ? pipeline.run(spec, split)
                : pipeline.run(spec, full, null);

            new ForecastArtifactWriter(output).writeAll(result);
            report(result);
            return EXIT_SUCCESS;
        } catch (NoSurvivingChainsException e) {
            logger.error("Forecast failed: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_NO_SURVIVORS;
        } catch (Exception e) {
            logger.error("Forecast failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } finally {
            if (engine != null) {
                engine.shutdown();
            }
        }
    }

    private void report(ForecastResult result) {
        if (!verbosity.showNormalOutput()) {
            return;
        }
        System.out.println("Convergence: " + (result.converged() ? "approved" : "NOT approved")
            + " (burn-in " + result.convergence().burnInIterations() + " iterations, "
            + result.convergence().survivingChains() + "/" + result.convergence().totalChains() + " chains)");
        result.convergence().reason().ifPresent(reason -> System.out.println("  " + reason));
        if (verbosity.showVerbose()) {
            for (ParameterSummary s : result.summary().parameters()) {
                System.out.printf("  %-16s median %.4f  [%.4f, %.4f]%n",
                    s.parameter().label(), s.median(), s.lower(), s.upper());
            }
        }
        result.validationIfAny().ifPresent(validation -> {
            for (MetricTable table : validation.tables().values()) {
                System.out.println("Validation (" + table.scale() + "): n=" + table.format(Metric.N)
                    + " rmse=" + table.format(Metric.RMSE) + " r2=" + table.format(Metric.R_SQUARED));
            }
        });
        System.out.println("Artifacts written to " + output);
    }
}
