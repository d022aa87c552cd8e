package io.hydrocast.ssm.data;

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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// Withheld observations kept apart from the fitting dataset.
///
/// Values are stored on the natural scale keyed by time index. The log-scale
/// view applies [SeriesTransforms#logResponse(double)] so that log-scale
/// scoring compares against exactly what fitting would have seen.
///
/// Only the validation step should hold a reference to this object.
public final class GroundTruth {

    private final SortedMap<Integer, Double> natural;

    private GroundTruth(SortedMap<Integer, Double> natural) {
        this.natural = natural;
    }

    /// Creates ground truth from natural-scale values keyed by time index.
    ///
    /// @param values index to natural-scale value; `NaN` entries are dropped
    /// @return the ground truth
    public static GroundTruth ofNatural(Map<Integer, Double> values) {
        Objects.requireNonNull(values, "values");
        SortedMap<Integer, Double> copy = new TreeMap<>();
        values.forEach((index, value) -> {
            if (index == null || index < 0) {
                throw new IllegalArgumentException("Ground truth index must be non-negative, got: " + index);
            }
            if (value != null && !Double.isNaN(value)) {
                copy.put(index, value);
            }
        });
        return new GroundTruth(copy);
    }

    /// Creates ground truth from log-scale values keyed by time index.
    public static GroundTruth ofLog(Map<Integer, Double> logValues) {
        Objects.requireNonNull(logValues, "logValues");
        SortedMap<Integer, Double> copy = new TreeMap<>();
        logValues.forEach((index, value) -> {
            if (value != null && !Double.isNaN(value)) {
                copy.put(index, SeriesTransforms.naturalResponse(value));
            }
        });
        return ofNatural(copy);
    }

    public static GroundTruth empty() {
        return new GroundTruth(new TreeMap<>());
    }

    /// Indices with a known value, ascending.
    public Iterable<Integer> indices() {
        return Collections.unmodifiableSet(natural.keySet());
    }

    public boolean contains(int index) {
        return natural.containsKey(index);
    }

    public double naturalValue(int index) {
        Double v = natural.get(index);
        if (v == null) {
            throw new IllegalArgumentException("No ground truth at index " + index);
        }
        return v;
    }

    public double logValue(int index) {
        return SeriesTransforms.logResponse(naturalValue(index));
    }

    public int size() {
        return natural.size();
    }

    public boolean isEmpty() {
        return natural.isEmpty();
    }

    @Override
    public String toString() {
        return "GroundTruth[" + natural.size() + " values]";
    }
}
