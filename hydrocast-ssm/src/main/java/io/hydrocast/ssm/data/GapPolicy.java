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

/// How a dataset treats calendar gaps between consecutive rows.
public enum GapPolicy {
    /// Every row must be exactly one day after the previous one.
    REJECT,
    /// Rows only need to be strictly ascending; consecutive rows are consecutive time steps.
    TOLERATE
}
