package io.hydrocast.ssm.pipeline;

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

import io.hydrocast.ssm.sampler.NumericalFailureException;

import java.util.List;

/// Thrown when every chain of a run failed, so nothing can be summarised.
public class NoSurvivingChainsException extends RuntimeException {

    private final List<NumericalFailureException> failures;

    public NoSurvivingChainsException(List<NumericalFailureException> failures) {
        super("All " + failures.size() + " chains failed"
            + (failures.isEmpty() ? "" : "; first failure: " + failures.get(0).getMessage()));
        this.failures = List.copyOf(failures);
        failures.forEach(this::addSuppressed);
    }

    public List<NumericalFailureException> getFailures() {
        return failures;
    }
}
