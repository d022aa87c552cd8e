package io.hydrocast.ssm.validation;

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

import io.hydrocast.ssm.summary.Scale;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Metric values for one scale.
 *
 * <p>An undefined metric is an empty {@link OptionalDouble}; it is never
 * replaced by a default such as 0 or 1.
 */
public final class MetricTable {

    private final Scale scale;
    private final Map<Metric, OptionalDouble> values;

    MetricTable(Scale scale, Map<Metric, OptionalDouble> values) {
        this.scale = scale;
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public Scale scale() {
        return scale;
    }

    /// Value of a metric; empty when undefined or not computed.
    public OptionalDouble get(Metric metric) {
        OptionalDouble value = values.get(metric);
        return value == null ? OptionalDouble.empty() : value;
    }

    public boolean contains(Metric metric) {
        return values.containsKey(metric);
    }

    /// Every computed metric in declaration order, undefined ones included.
    public Map<Metric, OptionalDouble> values() {
        return values;
    }

    /// Value formatted for tabular output, `NA` when undefined.
    public String format(Metric metric) {
        OptionalDouble value = get(metric);
        if (value.isEmpty()) {
            return "NA";
        }
        if (metric == Metric.N) {
            return Long.toString(Math.round(value.getAsDouble()));
        }
        return Double.toString(value.getAsDouble());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MetricTable[").append(scale);
        values.forEach((metric, value) -> sb.append(", ").append(metric).append('=').append(format(metric)));
        return sb.append(']').toString();
    }
}
