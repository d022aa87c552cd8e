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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * {@code -v/--verbose} and {@code -q/--quiet} for every subcommand.
 *
 * <p>Quiet keeps stdout to errors and raises the {@value #LOGGER_NAME}
 * loggers to {@code ERROR}; verbose adds run details to stdout and lowers
 * them to {@code DEBUG}. The two are mutually exclusive.
 */
public class VerbosityOption {

    static final String LOGGER_NAME = "io.hydrocast";

    @CommandLine.Option(names = {"-v", "--verbose"},
        description = "Print run details and log at DEBUG")
    private boolean verbose = false;

    @CommandLine.Option(names = {"-q", "--quiet"},
        description = "Print errors only")
    private boolean quiet = false;

    /// True unless `--quiet` was given.
    public boolean showNormalOutput() {
        return !quiet;
    }

    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /**
     * @throws IllegalStateException if both flags are set
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /// Adjusts the log level of the hydrocast loggers; with neither flag the
    /// configured level is kept.
    public void applyLogLevel() {
        if (showVerbose()) {
            Configurator.setLevel(LOGGER_NAME, Level.DEBUG);
        } else if (quiet) {
            Configurator.setLevel(LOGGER_NAME, Level.ERROR);
        }
    }
}
