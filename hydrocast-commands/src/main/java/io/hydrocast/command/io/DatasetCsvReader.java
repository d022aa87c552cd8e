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

import io.hydrocast.ssm.data.GapPolicy;
import io.hydrocast.ssm.data.TimeSeriesDataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads daily flow and rainfall from a comma-separated file.
 *
 * <p>The header must name a {@code date} column (ISO-8601) and a {@code flow}
 * column; a {@code rain} or {@code rainfall} column is optional. Values are in
 * natural units. Empty cells, {@code NA} and {@code NaN} mark missing values.
 * Lines starting with {@code #} are ignored.
 */
public final class DatasetCsvReader {

    private static final Logger logger = LogManager.getLogger(DatasetCsvReader.class);

    private DatasetCsvReader() {
    }

    /**
     * Reads the file and applies the fitting transforms.
     *
     * @param path CSV file
     * @param gapPolicy how calendar gaps are treated
     * @return the dataset
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is malformed or the series is invalid
     */
    public static TimeSeriesDataset read(Path path, GapPolicy gapPolicy) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString(), gapPolicy);
        }
    }

    static TimeSeriesDataset read(BufferedReader reader, String source, GapPolicy gapPolicy) throws IOException {
        String header = nextContentLine(reader);
        if (header == null) {
            throw new IllegalArgumentException(source + ": file is empty");
        }
        String[] names = header.split(",", -1);
        int dateColumn = -1;
        int flowColumn = -1;
        int rainColumn = -1;
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim().toLowerCase(Locale.ROOT);
            if (name.equals("date")) {
                dateColumn = i;
            } else if (name.equals("flow")) {
                flowColumn = i;
            } else if (name.equals("rain") || name.equals("rainfall")) {
                rainColumn = i;
            }
        }
        if (dateColumn < 0 || flowColumn < 0) {
            throw new IllegalArgumentException(source + ": header must contain 'date' and 'flow' columns, got: " + header);
        }

        List<LocalDate> dates = new ArrayList<>();
        List<Double> flow = new ArrayList<>();
        List<Double> rain = new ArrayList<>();
        int lineNumber = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] cells = line.split(",", -1);
            if (cells.length < names.length) {
                throw new IllegalArgumentException(source + ":" + lineNumber + ": expected " + names.length
                    + " columns but found " + cells.length);
            }
            try {
                dates.add(LocalDate.parse(cells[dateColumn].trim()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(source + ":" + lineNumber + ": invalid date '"
                    + cells[dateColumn].trim() + "'", e);
            }
            flow.add(parseValue(cells[flowColumn], source, lineNumber, "flow"));
            if (rainColumn >= 0) {
                rain.add(parseValue(cells[rainColumn], source, lineNumber, "rain"));
            }
        }

        LocalDate[] dateArray = dates.toArray(new LocalDate[0]);
        double[] flowArray = toArray(flow);
        double[] rainArray = rainColumn >= 0 ? toArray(rain) : null;
        logger.debug("Read {} rows from {} (rain column: {})", dateArray.length, source, rainColumn >= 0);
        return TimeSeriesDataset.fromNaturalScale(dateArray, flowArray, rainArray, gapPolicy);
    }

    static double parseValue(String cell, String source, int lineNumber, String column) {
        String value = cell.trim();
        if (value.isEmpty() || value.equalsIgnoreCase("NA") || value.equalsIgnoreCase("NaN")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(source + ":" + lineNumber + ": invalid " + column + " value '"
                + value + "'", e);
        }
    }

    private static String nextContentLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return trimmed;
            }
        }
        return null;
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
