package io.hydrocast.command.simulate;

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
import io.hydrocast.command.io.ForecastArtifactWriter;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.Parameter;
import io.hydrocast.ssm.model.ParameterVector;
import io.hydrocast.ssm.simulate.SyntheticSeries;
import io.hydrocast.ssm.simulate.SyntheticSeriesGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CMD_simulateTest {

    @TempDir
    Path tempDir;

    @Test
    void testSimulatedSeriesCanBeForecast() throws IOException {
        Path series = tempDir.resolve("sim").resolve("series.csv");
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent));
        int simulateExit;
        int forecastExit;
        try {
            simulateExit = new CommandLine(new CMD_simulate()).execute("-o", series.toString(),
                "--model", "rain", "-d", "60", "--start", "2018-10-01", "-p", "tau_add=30",
                "--missing-flow", "0.1", "-s", "5");
            forecastExit = new CommandLine(new CMD_forecast()).execute("-i", series.toString(),
                "-o", tempDir.resolve("fit").toString(), "--model", "rain", "-n", "200",
                "--burn-in", "100", "-s", "6", "--holdout-from", "2018-11-20");
        } finally {
            System.setOut(originalOut);
        }

        assertEquals(0, simulateExit);
        assertEquals(0, forecastExit);
        assertThat(outContent.toString()).contains("Wrote 60 days to");

        List<String> lines = Files.readAllLines(series);
        assertEquals("date,flow,rain", lines.get(0));
        assertEquals(61, lines.size());
        assertThat(lines.get(1)).startsWith("2018-10-01,");
        assertTrue(Files.exists(tempDir.resolve("fit").resolve(ForecastArtifactWriter.METRICS_FILE)));
    }

    @Test
    void testMissingRainIsWrittenAsNA() throws IOException {
        Path series = tempDir.resolve("full.csv");
        int exitCode = new CommandLine(new CMD_simulate()).execute("-o", series.toString(),
            "--model", "full", "-d", "30", "--missing-rain", "0.2", "-s", "9", "-q");
        assertEquals(0, exitCode);
        assertEquals("date,flow,rain", Files.readAllLines(series).get(0));
        assertThat(Files.readAllLines(series)).anyMatch(line -> line.endsWith(",NA"));
    }

    @Test
    void testRandomWalkHasNoRainColumn() throws IOException {
        Path series = tempDir.resolve("rw.csv");
        assertEquals(0, new CommandLine(new CMD_simulate()).execute("-o", series.toString(),
            "--model", "random-walk", "-d", "10", "-s", "2", "-q"));
        List<String> lines = Files.readAllLines(series);
        assertEquals("date,flow", lines.get(0));
        assertEquals(11, lines.size());
        assertThat(lines.subList(1, lines.size())).allMatch(line -> line.split(",").length == 2);
    }

    @Test
    void testRainColumnFollowsTheModelTerms() throws IOException {
        ModelSpecification spec = ModelSpecification.randomWalkWithRain();
        SyntheticSeries series = new SyntheticSeriesGenerator(spec, CMD_simulate.defaultsFor(spec))
            .length(5)
            .generate(3L);
        assertTrue(series.hasNaturalRainfall());

        Path withRain = tempDir.resolve("with.csv");
        Path withoutRain = tempDir.resolve("without.csv");
        CMD_simulate.write(series, withRain, true);
        CMD_simulate.write(series, withoutRain, false);
        assertEquals("date,flow,rain", Files.readAllLines(withRain).get(0));
        assertEquals("date,flow", Files.readAllLines(withoutRain).get(0));
        assertEquals(6, Files.readAllLines(withoutRain).size());
    }

    @Test
    void testParameterUnusedByModelIsRejected() {
        int exitCode = new CommandLine(new CMD_simulate()).execute("-o", tempDir.resolve("x.csv").toString(),
            "--model", "random-walk", "-p", "beta_rain=0.1", "-q");
        assertEquals(1, exitCode);
        assertFalse(Files.exists(tempDir.resolve("x.csv")));
    }

    @Test
    void testDefaultsDependOnTerms() {
        ParameterVector full = CMD_simulate.defaultsFor(ModelSpecification.full());
        assertEquals(2.0, full.get(Parameter.MU0));
        assertEquals(0.9, full.get(Parameter.BETA_DECAY));
        assertEquals(1.0, full.get(Parameter.TAU_RAIN));

        ParameterVector walk = CMD_simulate.defaultsFor(ModelSpecification.randomWalk());
        assertEquals(25.0, walk.get(Parameter.TAU_ADD));
        assertEquals(0.0, walk.get(Parameter.BETA_RAIN));
    }
}
