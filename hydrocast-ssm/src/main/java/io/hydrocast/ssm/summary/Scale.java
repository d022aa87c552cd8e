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

import com.google.gson.annotations.SerializedName;

/// Scale on which a quantity is expressed.
///
/// Log-scale and natural-scale scores are reported separately and are not comparable.
public enum Scale {
    /// Model scale: log flow (log1p for rainfall).
    @SerializedName("log")
    LOG("log"),
    /// Back-transformed natural units.
    @SerializedName("natural")
    NATURAL("natural");

    private final String label;

    Scale(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
