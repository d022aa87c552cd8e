package io.hydrocast.ssm.diagnostics;

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

/// How many leading iterations of each chain to discard.
///
/// - [#fixed(int)]: a configured iteration count (default [#DEFAULT_FIXED_ITERATIONS]).
/// - [#adaptive(int)]: the smallest multiple of `step` iterations, at most half
///   the run, after which the scale reduction stays below threshold on every
///   growing window to the end of the run.
///
/// Counts are in iterations; with thinning they are converted to retained draws.
public final class BurnInPolicy {

    public static final int DEFAULT_FIXED_ITERATIONS = 1000;
    public static final int DEFAULT_ADAPTIVE_STEP = 100;

    public enum Kind {
        FIXED,
        ADAPTIVE
    }

    private final Kind kind;
    private final int iterations;

    private BurnInPolicy(Kind kind, int iterations) {
        this.kind = kind;
        this.iterations = iterations;
    }

    public static BurnInPolicy fixed(int iterations) {
        if (iterations < 0) {
            throw new IllegalArgumentException("Burn-in cannot be negative, got: " + iterations);
        }
        return new BurnInPolicy(Kind.FIXED, iterations);
    }

    public static BurnInPolicy fixedDefault() {
        return fixed(DEFAULT_FIXED_ITERATIONS);
    }

    public static BurnInPolicy adaptive(int step) {
        if (step < 1) {
            throw new IllegalArgumentException("Adaptive burn-in step must be positive, got: " + step);
        }
        return new BurnInPolicy(Kind.ADAPTIVE, step);
    }

    public static BurnInPolicy adaptive() {
        return adaptive(DEFAULT_ADAPTIVE_STEP);
    }

    /// Parses `fixed:<n>`, `adaptive` or `adaptive:<step>`; a bare number means fixed.
    public static BurnInPolicy parse(String text) {
        String value = text.trim().toLowerCase();
        try {
            if (value.equals("adaptive")) {
                return adaptive();
            }
            if (value.startsWith("adaptive:")) {
                return adaptive(Integer.parseInt(value.substring("adaptive:".length())));
            }
            if (value.startsWith("fixed:")) {
                return fixed(Integer.parseInt(value.substring("fixed:".length())));
            }
            return fixed(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid burn-in policy: " + text
                + " (expected <n>, fixed:<n>, adaptive or adaptive:<step>)", e);
        }
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAdaptive() {
        return kind == Kind.ADAPTIVE;
    }

    /// Burn-in iterations for [Kind#FIXED], step size for [Kind#ADAPTIVE].
    public int iterations() {
        return iterations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BurnInPolicy)) return false;
        BurnInPolicy that = (BurnInPolicy) o;
        return kind == that.kind && iterations == that.iterations;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + iterations;
    }

    @Override
    public String toString() {
        return kind == Kind.FIXED ? "fixed:" + iterations : "adaptive:" + iterations;
    }
}
