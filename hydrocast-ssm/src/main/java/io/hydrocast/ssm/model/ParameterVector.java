package io.hydrocast.ssm.model;

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

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/// Mutable assignment of a value to every [Parameter].
///
/// Parameters that a specification does not sample hold their fixed values
/// (see [ModelSpecification#fixedValue(Parameter)]). Not thread-safe; each
/// chain owns its own instance.
public final class ParameterVector {

    private final double[] values = new double[Parameter.values().length];

    public ParameterVector() {
    }

    /// Creates a vector holding the fixed values of `spec` for every parameter.
    public static ParameterVector fixedValuesOf(ModelSpecification spec) {
        ParameterVector vector = new ParameterVector();
        for (Parameter p : Parameter.values()) {
            vector.set(p, spec.fixedValue(p));
        }
        return vector;
    }

    public double get(Parameter parameter) {
        return values[parameter.ordinal()];
    }

    public ParameterVector set(Parameter parameter, double value) {
        values[parameter.ordinal()] = value;
        return this;
    }

    public ParameterVector copy() {
        ParameterVector copy = new ParameterVector();
        System.arraycopy(values, 0, copy.values, 0, values.length);
        return copy;
    }

    public Map<Parameter, Double> asMap() {
        Map<Parameter, Double> map = new EnumMap<>(Parameter.class);
        for (Parameter p : Parameter.values()) {
            map.put(p, values[p.ordinal()]);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterVector)) return false;
        return Arrays.equals(values, ((ParameterVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ParameterVector" + asMap();
    }
}
