package io.hydrocast.command;

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

import io.hydrocast.command.forecast.CMD_forecast;
import io.hydrocast.command.simulate.CMD_simulate;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Top-level command for the streamflow forecasting tools.
@CommandLine.Command(name = "hydrocast",
    header = "Latent-state streamflow forecasting",
    description = "Fits hierarchical state-space models of daily log-flow by multi-chain Gibbs sampling.",
    mixinStandardHelpOptions = true,
    version = "hydrocast 0.1.0",
    subcommands = {
        CMD_forecast.class,
        CMD_simulate.class,
        CommandLine.HelpCommand.class
    })
public class CMD_hydrocast implements Callable<Integer> {

    /// Run CMD_hydrocast
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /// A command line configured the way `main` runs it.
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_hydrocast())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
