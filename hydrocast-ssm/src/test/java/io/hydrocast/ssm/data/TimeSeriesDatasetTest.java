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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TimeSeriesDatasetTest {

    private static final LocalDate START = LocalDate.of(2021, 3, 1);

    private static LocalDate[] days(int n) {
        LocalDate[] dates = new LocalDate[n];
        for (int t = 0; t < n; t++) {
            dates[t] = START.plusDays(t);
        }
        return dates;
    }

    @Test
    void testNaturalScaleInputIsTransformedAndLagged() {
        double[] flow = {10.0, Double.NaN, 20.0, 0.0};
        double[] rain = {5.0, 0.0, Double.NaN, 1.0};
        TimeSeriesDataset data = TimeSeriesDataset.fromNaturalScale(days(4), flow, rain, GapPolicy.REJECT);

        assertEquals(4, data.length());
        assertEquals(Math.log(10.0), data.response(0), 1e-12);
        assertFalse(data.isObserved(1));
        assertEquals(Math.log(SeriesTransforms.SHIFT), data.response(3), 1e-12);
        assertEquals(3, data.observedCount());

        // rain[t] is the previous day's log1p rainfall
        assertTrue(data.isRainMissing(0));
        assertEquals(Math.log1p(5.0), data.rain(1), 1e-12);
        assertEquals(Math.log1p(SeriesTransforms.SHIFT), data.rain(2), 1e-12);
        assertTrue(data.isRainMissing(3));
        assertThat(data.missingRainIndices()).containsExactly(0, 3);
    }

    @Test
    void testMissingRainColumnMeansEveryValueMissing() {
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .startDate(START)
            .response(new double[]{1.0, 1.1, 1.2})
            .build();
        assertThat(data.missingRainIndices()).containsExactly(0, 1, 2);
        assertEquals(START.plusDays(2), data.date(2));
    }

    @Test
    void testSeasonalCovariatesFollowDayOfYear() {
        LocalDate[] dates = {LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 2)};
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .dates(dates)
            .response(new double[]{0.0, 0.0})
            .build();
        double phase = 2 * Math.PI * 1 / SeasonalCalendar.DAYS_PER_YEAR;
        assertEquals(Math.sin(phase), data.seasonSin(0), 1e-12);
        assertEquals(Math.cos(phase), data.seasonCos(0), 1e-12);
    }

    @Test
    void testEmptyResponseIsRejected() {
        assertThatThrownBy(() -> TimeSeriesDataset.builder().response(new double[0]).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void testLengthMismatchIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesDataset.builder()
            .dates(days(3))
            .response(new double[]{1.0, 2.0})
            .build());
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesDataset.builder()
            .dates(days(2))
            .response(new double[]{1.0, 2.0})
            .rain(new double[]{0.0})
            .build());
    }

    @Test
    void testUnsortedDatesAreRejected() {
        LocalDate[] dates = {START.plusDays(1), START};
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesDataset.builder()
            .dates(dates)
            .response(new double[]{1.0, 2.0})
            .build());
    }

    @Test
    void testCalendarGapRejectedUnlessTolerated() {
        LocalDate[] dates = {START, START.plusDays(1), START.plusDays(5)};
        double[] response = {1.0, 2.0, 3.0};
        assertThatThrownBy(() -> TimeSeriesDataset.builder().dates(dates).response(response).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gap");

        TimeSeriesDataset tolerated = TimeSeriesDataset.builder()
            .dates(dates)
            .response(response)
            .gapPolicy(GapPolicy.TOLERATE)
            .build();
        assertEquals(3, tolerated.length());
    }

    @Test
    void testInfiniteValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesDataset.builder()
            .startDate(START)
            .response(new double[]{1.0, Double.NEGATIVE_INFINITY})
            .build());
    }

    @Test
    void testAccessorsReturnCopies() {
        TimeSeriesDataset data = TimeSeriesDataset.builder()
            .startDate(START)
            .response(new double[]{1.0, 2.0})
            .build();
        double[] response = data.response();
        response[0] = 99.0;
        assertEquals(1.0, data.response(0));
    }
}
