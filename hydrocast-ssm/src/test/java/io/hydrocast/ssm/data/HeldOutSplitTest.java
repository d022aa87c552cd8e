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

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class HeldOutSplitTest {

    private static TimeSeriesDataset dataset() {
        return TimeSeriesDataset.builder()
            .startDate(LocalDate.of(2022, 6, 1))
            .response(new double[]{0.5, 0.6, Double.NaN, 0.8, 0.9})
            .build();
    }

    @Test
    void testLastDaysWithholdsTailAndKeepsTruth() {
        HeldOutSplit split = HeldOutSplit.lastDays(dataset(), 2);

        TimeSeriesDataset fitting = split.fitting();
        assertEquals(5, fitting.length());
        assertFalse(fitting.isObserved(3));
        assertFalse(fitting.isObserved(4));
        assertTrue(fitting.isHeldOut(3));
        assertEquals(2, fitting.heldOutCount());

        GroundTruth truth = split.truth();
        assertEquals(2, truth.size());
        assertEquals(0.8, truth.logValue(3), 1e-12);
        assertEquals(Math.exp(0.9), truth.naturalValue(4), 1e-12);
    }

    @Test
    void testCutoffSkipsAlreadyMissingValues() {
        HeldOutSplit split = HeldOutSplit.fromCutoff(dataset(), LocalDate.of(2022, 6, 3));
        assertEquals(3, split.fitting().heldOutCount());
        assertEquals(2, split.truth().size());
        assertFalse(split.truth().contains(2));
        assertTrue(split.truth().contains(3));
    }

    @Test
    void testOriginalDatasetIsUntouched() {
        TimeSeriesDataset full = dataset();
        HeldOutSplit.lastDays(full, 2);
        assertTrue(full.isObserved(4));
        assertEquals(0, full.heldOutCount());
    }

    @Test
    void testInvalidSplitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> HeldOutSplit.lastDays(dataset(), 5));
        assertThrows(IllegalArgumentException.class, () -> HeldOutSplit.byMask(dataset(), new boolean[3]));
    }
}
