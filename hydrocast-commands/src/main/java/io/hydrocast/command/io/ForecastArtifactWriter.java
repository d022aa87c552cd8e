package io.hydrocast.command.io;

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

import io.hydrocast.ssm.diagnostics.ConvergenceReport;
import io.hydrocast.ssm.io.HydrocastGsonConfig;
import io.hydrocast.ssm.pipeline.ForecastResult;
import io.hydrocast.ssm.summary.CredibleInterval;
import io.hydrocast.ssm.summary.ForecastRow;
import io.hydrocast.ssm.summary.ForecastTable;
import io.hydrocast.ssm.summary.ImputedRainSummary;
import io.hydrocast.ssm.summary.ParameterSummary;
import io.hydrocast.ssm.validation.Metric;
import io.hydrocast.ssm.validation.MetricTable;
import io.hydrocast.ssm.validation.ResidualRow;
import io.hydrocast.ssm.validation.ValidationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the artifacts of a forecast run into an output directory.
 *
 * <ul>
 *   <li>{@value #FORECAST_FILE}: per-day credible intervals</li>
 *   <li>{@value #PARAMETERS_FILE}: parameter posterior summaries</li>
 *   <li>{@value #IMPUTED_RAIN_FILE}: imputed rainfall, when any was imputed</li>
 *   <li>{@value #METRICS_FILE} and {@value #RESIDUALS_FILE}: validation, when ground truth was supplied</li>
 *   <li>{@value #CONVERGENCE_FILE}: the convergence verdict</li>
 * </ul>
 *
 * Undefined numbers are written as {@code NA}.
 */
public final class ForecastArtifactWriter {

    private static final Logger logger = LogManager.getLogger(ForecastArtifactWriter.class);

    public static final String FORECAST_FILE = "forecast.csv";
    public static final String PARAMETERS_FILE = "parameters.csv";
    public static final String IMPUTED_RAIN_FILE = "imputed_rain.csv";
    public static final String METRICS_FILE = "metrics.csv";
    public static final String RESIDUALS_FILE = "residuals.csv";
    public static final String CONVERGENCE_FILE = "convergence.json";

    private final Path outputDir;

    public ForecastArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes every artifact the result carries.
     *
     * @return the files written
     */
    public List<Path> writeAll(ForecastResult result) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        written.add(writeForecast(result.summary().forecast()));
        written.add(writeParameters(result.summary().parameters()));
        if (!result.summary().imputedRain().isEmpty()) {
            written.add(writeImputedRain(result.summary().imputedRain()));
        }
        if (result.validation() != null) {
            written.add(writeMetrics(result.validation()));
            written.add(writeResiduals(result.validation()));
        }
        written.add(writeConvergence(result.convergence()));
        logger.info("Wrote {} artifacts to {}", written.size(), outputDir);
        return written;
    }

    public Path writeForecast(ForecastTable table) throws IOException {
        Path path = outputDir.resolve(FORECAST_FILE);
        boolean logScale = table.hasLogScale();
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("date,lower,median,upper");
            if (logScale) {
                out.write(",log_lower,log_median,log_upper");
            }
            out.write(",held_out");
            out.newLine();
            for (ForecastRow row : table) {
                StringBuilder line = new StringBuilder();
                line.append(row.date()).append(',').append(interval(row.natural()));
                if (logScale) {
                    line.append(',').append(interval(row.log()));
                }
                line.append(',').append(row.heldOut());
                out.write(line.toString());
                out.newLine();
            }
        }
        return path;
    }

    public Path writeParameters(List<ParameterSummary> parameters) throws IOException {
        Path path = outputDir.resolve(PARAMETERS_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("parameter,mean,sd,lower,median,upper");
            out.newLine();
            for (ParameterSummary s : parameters) {
                out.write(s.parameter().label() + "," + format(s.mean()) + "," + format(s.sd()) + ","
                    + format(s.lower()) + "," + format(s.median()) + "," + format(s.upper()));
                out.newLine();
            }
        }
        return path;
    }

    public Path writeImputedRain(List<ImputedRainSummary> imputed) throws IOException {
        Path path = outputDir.resolve(IMPUTED_RAIN_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("date,lower,median,upper,log1p_lower,log1p_median,log1p_upper");
            out.newLine();
            for (ImputedRainSummary s : imputed) {
                out.write(s.date() + "," + interval(s.natural()) + "," + interval(s.transformed()));
                out.newLine();
            }
        }
        return path;
    }

    public Path writeMetrics(ValidationReport report) throws IOException {
        Path path = outputDir.resolve(METRICS_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("scale,metric,value");
            out.newLine();
            for (MetricTable table : report.tables().values()) {
                for (Metric metric : table.values().keySet()) {
                    out.write(table.scale() + "," + metric.label() + "," + table.format(metric));
                    out.newLine();
                }
            }
        }
        return path;
    }

    public Path writeResiduals(ValidationReport report) throws IOException {
        Path path = outputDir.resolve(RESIDUALS_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            out.write("date,scale,observed,predicted,residual,lower,upper,covered");
            out.newLine();
            for (ResidualRow row : report.residuals()) {
                out.write(row.date() + "," + row.scale() + "," + format(row.observed()) + ","
                    + format(row.predicted()) + "," + format(row.residual()) + "," + format(row.lower()) + ","
                    + format(row.upper()) + "," + row.covered());
                out.newLine();
            }
        }
        return path;
    }

    public Path writeConvergence(ConvergenceReport report) throws IOException {
        Path path = outputDir.resolve(CONVERGENCE_FILE);
        Files.writeString(path, HydrocastGsonConfig.gson().toJson(report), StandardCharsets.UTF_8);
        return path;
    }

    static String interval(CredibleInterval interval) {
        return format(interval.lower()) + "," + format(interval.median()) + "," + format(interval.upper());
    }

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NA";
        }
        return Double.toString(value);
    }
}
