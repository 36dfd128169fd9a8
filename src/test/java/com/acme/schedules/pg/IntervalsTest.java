package com.acme.schedules.pg;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PGInterval;

import static org.junit.jupiter.api.Assertions.*;

class IntervalsTest {

    @Test
    void testLiteral() {
        assertEquals("90000000 milliseconds", Intervals.toLiteral(90_000_000L));
        assertEquals("0 milliseconds", Intervals.toLiteral(0L));
    }

    @Test
    void testTwentyFiveHoursRoundTrip() {
        // postgres normalizes '90000000 milliseconds' to 25:00:00
        assertEquals(90_000_000L, Intervals.toMillis(new PGInterval(0, 0, 0, 25, 0, 0)));
        assertEquals(90_000_000L, Intervals.toMillis(new PGInterval(0, 0, 1, 1, 0, 0)));
    }

    @Test
    void testZero() {
        assertEquals(0L, Intervals.toMillis(new PGInterval()));
        assertEquals(0L, Intervals.toMillis(null));
    }

    @Test
    void testFixedUnitWeights() {
        assertEquals(31_536_000_000L, Intervals.toMillis(new PGInterval(1, 0, 0, 0, 0, 0)));
        assertEquals(2_592_000_000L, Intervals.toMillis(new PGInterval(0, 1, 0, 0, 0, 0)));
        assertEquals(86_400_000L, Intervals.toMillis(new PGInterval(0, 0, 1, 0, 0, 0)));
        assertEquals(3_600_000L, Intervals.toMillis(new PGInterval(0, 0, 0, 1, 0, 0)));
        assertEquals(60_000L, Intervals.toMillis(new PGInterval(0, 0, 0, 0, 1, 0)));
        assertEquals(1_000L, Intervals.toMillis(new PGInterval(0, 0, 0, 0, 0, 1)));
    }

    @Test
    void testYearIsNotCalendarAccurate() {
        // 365 days and 12 thirty-day months both differ from a calendar year
        assertEquals(365 * Intervals.DAY_MS, Intervals.toMillis(1, 0, 0, 0, 0, 0));
        assertNotEquals(Intervals.toMillis(1, 0, 0, 0, 0, 0), Intervals.toMillis(0, 12, 0, 0, 0, 0));
    }

    @Test
    void testFractionalSeconds() {
        assertEquals(1_500L, Intervals.toMillis(new PGInterval(0, 0, 0, 0, 0, 1.5)));
        assertEquals(61_001L, Intervals.toMillis(0, 0, 0, 0, 1, 1.001));
    }

    @Test
    void testMixedFields() {
        long expected = 2 * 31_536_000_000L + 3 * 2_592_000_000L + 4 * 86_400_000L
            + 5 * 3_600_000L + 6 * 60_000L + 7_250L;
        assertEquals(expected, Intervals.toMillis(new PGInterval(2, 3, 4, 5, 6, 7.25)));
    }
}
