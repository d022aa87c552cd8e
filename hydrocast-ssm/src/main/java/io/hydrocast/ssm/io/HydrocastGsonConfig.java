package io.hydrocast.ssm.io;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.hydrocast.ssm.model.ModelSpecification;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/// Centralized Gson configuration for model specifications and reports.
///
/// ## Usage
///
/// ```java
/// Gson gson = HydrocastGsonConfig.gson();
/// String json = gson.toJson(ModelSpecification.full());
///
/// ModelSpecification spec = HydrocastGsonConfig.readSpecification(Path.of("model.json"));
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floating point | Enabled | `Infinity` scale reductions and `NaN` values |
///
/// A specification read from JSON passes through
/// [ModelSpecification#toBuilder()], so omitted priors take their defaults
/// and the usual validation applies.
public final class HydrocastGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private HydrocastGsonConfig() {
    }

    /// Returns the shared, thread-safe Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the project defaults.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }

    /// Reads and validates a model specification.
    ///
    /// @param reader JSON source
    /// @return the validated specification
    /// @throws IllegalArgumentException if the JSON is malformed or describes an invalid model
    public static ModelSpecification readSpecification(Reader reader) {
        ModelSpecification parsed;
        try {
            parsed = INSTANCE.fromJson(reader, ModelSpecification.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed model specification: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Record constructors reject invalid hyperparameters during binding
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Invalid model specification: " + cause.getMessage(), e);
        }
        if (parsed == null) {
            throw new IllegalArgumentException("Model specification is empty");
        }
        return parsed.toBuilder().build();
    }

    /// Reads and validates a model specification from a file.
    public static ModelSpecification readSpecification(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readSpecification(reader);
        }
    }

    /// Serializes a specification to pretty-printed JSON.
    public static String toJson(ModelSpecification spec) {
        return INSTANCE.toJson(spec);
    }
}
