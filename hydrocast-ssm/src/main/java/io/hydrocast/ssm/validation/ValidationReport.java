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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/// Metrics per scale plus the residual rows they were computed from.
public final class ValidationReport {

    private final Map<Scale, MetricTable> tables;
    private final List<ResidualRow> residuals;

    ValidationReport(Map<Scale, MetricTable> tables, List<ResidualRow> residuals) {
        this.tables = Collections.unmodifiableMap(new EnumMap<>(tables));
        this.residuals = List.copyOf(residuals);
    }

    public boolean hasScale(Scale scale) {
        return tables.containsKey(scale);
    }

    public MetricTable table(Scale scale) {
        MetricTable table = tables.get(scale);
        if (table == null) {
            throw new IllegalArgumentException("Scale " + scale + " was not scored");
        }
        return table;
    }

    public Map<Scale, MetricTable> tables() {
        return tables;
    }

    public OptionalDouble metric(Scale scale, Metric metric) {
        return table(scale).get(metric);
    }

    public List<ResidualRow> residuals() {
        return residuals;
    }

    public List<ResidualRow> residuals(Scale scale) {
        List<ResidualRow> rows = new ArrayList<>();
        for (ResidualRow row : residuals) {
            if (row.scale() == scale) {
                rows.add(row);
            }
        }
        return rows;
    }

    @Override
    public String toString() {
        return "ValidationReport" + tables.values();
    }
}
