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

import io.hydrocast.ssm.io.HydrocastGsonConfig;
import io.hydrocast.ssm.model.ModelSpecification;
import io.hydrocast.ssm.model.ModelTerm;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shared model selection options: a preset, an explicit term list, or a JSON
 * specification file carrying priors.
 *
 * <p>Precedence: {@code --spec} over {@code --terms} over {@code --model}.
 */
public class ModelOptions {

    /// Named model variants.
    public enum Preset {
        RANDOM_WALK,
        RAIN,
        FULL;

        public ModelSpecification specification() {
            switch (this) {
                case RANDOM_WALK:
                    return ModelSpecification.randomWalk();
                case RAIN:
                    return ModelSpecification.randomWalkWithRain();
                default:
                    return ModelSpecification.full();
            }
        }
    }

    /**
     * Accepts preset names with dashes or underscores in any case.
     */
    public static class PresetConverter implements CommandLine.ITypeConverter<Preset> {
        @Override
        public Preset convert(String value) {
            try {
                return Preset.valueOf(value.trim().toUpperCase().replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    "Unknown model '" + value + "' (expected random-walk, rain or full)");
            }
        }
    }

    /**
     * Parses term names such as {@code rain} or {@code rain-imputation}.
     */
    public static class TermConverter implements CommandLine.ITypeConverter<ModelTerm> {
        @Override
        public ModelTerm convert(String value) {
            try {
                return ModelTerm.valueOf(value.trim().toUpperCase().replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    "Unknown term '" + value + "' (expected rain, seasonal, decay or rain-imputation)");
            }
        }
    }

    @CommandLine.Option(
        names = {"-m", "--model"},
        description = "Model preset: random-walk, rain or full (default: ${DEFAULT-VALUE})",
        defaultValue = "full",
        converter = PresetConverter.class
    )
    private Preset preset = Preset.FULL;

    @CommandLine.Option(
        names = {"--terms"},
        description = "Comma-separated active terms, replacing the preset's: rain, seasonal, decay, rain-imputation",
        split = ",",
        converter = TermConverter.class
    )
    private List<ModelTerm> terms;

    @CommandLine.Option(
        names = {"--spec"},
        description = "JSON model specification with terms, priors and initial condition"
    )
    private Path specPath;

    /**
     * Resolves the model specification.
     *
     * @throws IOException if the specification file cannot be read
     * @throws IllegalArgumentException if the specification is invalid
     */
    public ModelSpecification resolve() throws IOException {
        if (specPath != null) {
            return HydrocastGsonConfig.readSpecification(specPath);
        }
        if (terms != null) {
            Set<ModelTerm> active = terms.isEmpty() ? EnumSet.noneOf(ModelTerm.class) : EnumSet.copyOf(terms);
            return ModelSpecification.builder().terms(active).build();
        }
        return preset.specification();
    }

    public Preset getPreset() {
        return preset;
    }
}
