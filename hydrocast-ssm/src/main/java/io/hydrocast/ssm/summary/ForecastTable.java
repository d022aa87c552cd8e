package io.hydrocast.ssm.summary;

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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Forecast envelope for every time index, in time order.
 *
 * <p>The natural-scale columns are always present; log-scale columns are
 * present when {@link #hasLogScale()} is true.
 */
public final class ForecastTable implements Iterable<ForecastRow> {

    private final List<ForecastRow> rows;
    private final boolean logScale;

    public ForecastTable(List<ForecastRow> rows, boolean logScale) {
        this.rows = List.copyOf(rows);
        this.logScale = logScale;
        for (int i = 0; i < this.rows.size(); i++) {
            if (this.rows.get(i).index() != i) {
                throw new IllegalArgumentException("Row " + i + " carries index " + this.rows.get(i).index());
            }
            if (logScale && this.rows.get(i).log() == null) {
                throw new IllegalArgumentException("Row " + i + " is missing its log-scale interval");
            }
        }
    }

    public int size() {
        return rows.size();
    }

    public ForecastRow row(int index) {
        return rows.get(index);
    }

    public List<ForecastRow> rows() {
        return rows;
    }

    public boolean hasLogScale() {
        return logScale;
    }

    /// Medians on the given scale, one per index.
    public double[] medians(Scale scale) {
        double[] medians = new double[rows.size()];
        for (int i = 0; i < medians.length; i++) {
            medians[i] = rows.get(i).median(scale);
        }
        return medians;
    }

    /// Rows whose response was withheld from fitting.
    public List<ForecastRow> heldOutRows() {
        List<ForecastRow> heldOut = new ArrayList<>();
        for (ForecastRow row : rows) {
            if (row.heldOut()) {
                heldOut.add(row);
            }
        }
        return heldOut;
    }

    @Override
    public Iterator<ForecastRow> iterator() {
        return rows.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForecastTable)) return false;
        ForecastTable that = (ForecastTable) o;
        return logScale == that.logScale && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * rows.hashCode() + Boolean.hashCode(logScale);
    }
}
