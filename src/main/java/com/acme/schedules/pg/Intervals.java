package com.acme.schedules.pg;

import org.postgresql.util.PGInterval;

/**
 * Converts between millisecond frequencies and PostgreSQL intervals.
 * <p>
 * Decoding uses fixed weights (365-day years, 30-day months) rather than calendar
 * arithmetic. Stored schedules depend on these exact weights; do not change them.
 */
public final class Intervals {
    static final long YEAR_MS = 31_536_000_000L;
    static final long MONTH_MS = 2_592_000_000L;
    static final long DAY_MS = 86_400_000L;
    static final long HOUR_MS = 3_600_000L;
    static final long MINUTE_MS = 60_000L;
    static final long SECOND_MS = 1_000L;

    private Intervals() {}

    /** Interval literal accepted by {@code ?::interval}, e.g. {@code "90000000 milliseconds"}. */
    public static String toLiteral(long frequencyMs) {
        return frequencyMs + " milliseconds";
    }

    public static long toMillis(PGInterval interval) {
        if (interval == null) {
            return 0L;
        }
        return toMillis(
            interval.getYears(),
            interval.getMonths(),
            interval.getDays(),
            interval.getHours(),
            interval.getMinutes(),
            interval.getSeconds()
        );
    }

    /** Seconds may carry a fraction; it contributes whole milliseconds. */
    public static long toMillis(int years, int months, int days, int hours, int minutes, double seconds) {
        return years * YEAR_MS
            + months * MONTH_MS
            + days * DAY_MS
            + hours * HOUR_MS
            + minutes * MINUTE_MS
            + Math.round(seconds * SECOND_MS);
    }
}
