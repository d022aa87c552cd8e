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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CredibleIntervalTest {

    @Test
    void testScaleConversionRoundTrips() {
        CredibleInterval log = new CredibleInterval(-0.4, 0.25, 1.3, Scale.LOG);
        CredibleInterval natural = log.toNaturalScale();
        assertEquals(Scale.NATURAL, natural.scale());
        assertEquals(Math.exp(0.25), natural.median(), 1e-12);

        CredibleInterval back = natural.toLogScale();
        assertEquals(log.lower(), back.lower(), 1e-12);
        assertEquals(log.median(), back.median(), 1e-12);
        assertEquals(log.upper(), back.upper(), 1e-12);
        assertSame(log, log.toLogScale());
    }

    @Test
    void testBoundsMustBeOrdered() {
        assertThrows(IllegalArgumentException.class, () -> new CredibleInterval(1.0, 0.5, 2.0, Scale.LOG));
        assertThrows(IllegalArgumentException.class, () -> new CredibleInterval(0.0, 0.5, 1.0, null));
    }

    @Test
    void testNonPositiveBoundHasNoLog() {
        CredibleInterval natural = new CredibleInterval(0.0, 1.0, 2.0, Scale.NATURAL);
        assertThrows(IllegalArgumentException.class, natural::toLogScale);
    }

    @Test
    void testWidthAndContainment() {
        CredibleInterval interval = new CredibleInterval(1.0, 2.0, 4.0, Scale.NATURAL);
        assertEquals(3.0, interval.width(), 1e-12);
        assertTrue(interval.contains(1.0));
        assertTrue(interval.contains(4.0));
        assertFalse(interval.contains(4.01));
    }
}
