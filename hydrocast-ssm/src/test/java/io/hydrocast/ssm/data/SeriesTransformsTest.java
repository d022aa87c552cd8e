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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SeriesTransformsTest {

    @Test
    void testPositiveFlowIsLogged() {
        assertEquals(Math.log(12.5), SeriesTransforms.logResponse(12.5), 1e-12);
        assertEquals(12.5, SeriesTransforms.naturalResponse(SeriesTransforms.logResponse(12.5)), 1e-12);
    }

    @Test
    void testZeroFlowIsShiftedBeforeLog() {
        assertEquals(Math.log(SeriesTransforms.SHIFT), SeriesTransforms.logResponse(0.0), 1e-12);
        assertTrue(Double.isFinite(SeriesTransforms.logResponse(0.0)));
    }

    @Test
    void testFlowStillNonPositiveAfterShiftIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SeriesTransforms.logResponse(-1.0));
        assertThrows(IllegalArgumentException.class, () -> SeriesTransforms.logResponse(Double.POSITIVE_INFINITY));
    }

    @Test
    void testMissingValuesStayMissing() {
        assertTrue(Double.isNaN(SeriesTransforms.logResponse(Double.NaN)));
        assertTrue(Double.isNaN(SeriesTransforms.log1pRain(Double.NaN)));
    }

    @Test
    void testRainfallUsesLog1p() {
        assertEquals(Math.log1p(4.0), SeriesTransforms.log1pRain(4.0), 1e-12);
        assertEquals(Math.log1p(SeriesTransforms.SHIFT), SeriesTransforms.log1pRain(0.0), 1e-12);
        assertEquals(4.0, SeriesTransforms.naturalRain(SeriesTransforms.log1pRain(4.0)), 1e-12);
    }

    @Test
    void testLagShiftsForwardAndLeavesFirstMissing() {
        double[] lagged = SeriesTransforms.lagByOneDay(new double[]{1.0, 2.0, 3.0});
        assertEquals(3, lagged.length);
        assertTrue(Double.isNaN(lagged[0]));
        assertEquals(1.0, lagged[1]);
        assertEquals(2.0, lagged[2]);
    }
}
