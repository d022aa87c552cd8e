package io.hydrocast.ssm.simulate;

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

import io.hydrocast.ssm.data.TimeSeriesDataset;
import io.hydrocast.ssm.model.ParameterVector;

/// A series drawn from the model with known latent path and parameters.
///
/// `naturalFlow` and `naturalRainfall` are the natural-unit columns a data
/// file would carry (missing as `NaN`); `dataset` is the same data after the
/// fitting transforms. `naturalRainfall` is null when rainfall was drawn on
/// the covariate scale from the imputation model.
///
/// @param dataset the fitting dataset
/// @param parameters true parameter values
/// @param states true latent path
/// @param rain complete covariate before masking
/// @param naturalFlow observed flow, `NaN` where masked
/// @param naturalRainfall observed rainfall, `NaN` where masked; may be null
public record SyntheticSeries(TimeSeriesDataset dataset, ParameterVector parameters, double[] states, double[] rain,
                              double[] naturalFlow, double[] naturalRainfall) {

    public int length() {
        return states.length;
    }

    public boolean hasNaturalRainfall() {
        return naturalRainfall != null;
    }
}
