package org.panchanga.core.time;

/**
 * Deterministic conversions between civil dates and the continuous Julian time axis.
 *
 * <p>An integral Julian Day Number denotes noon UT of its civil date; fractional parts carry the
 * time of day and are added by callers that need sub-day resolution.</p>
 */
public final class JulianDay {

    /** Julian Date of the J2000.0 epoch (2000-01-01 12:00 TT). */
    public static final double J2000 = 2451545.0d;
    /** Days per Julian century. */
    public static final double DAYS_PER_CENTURY = 36525.0d;

    private static final double HOURS_PER_DAY = 24.0d;
    private static final double NOON_HOURS = 12.0d;

    /**
     * Prevents instantiation of this utility class.
     */
    private JulianDay() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Converts a proleptic-Gregorian date to its Julian Day Number.
     *
     * <p>Integer month/year adjustment followed by the standard JDN polynomial. The date must already
     * be valid; this method has no error path.</p>
     *
     * @param date valid civil date.
     * @return integral Julian Day Number.
     */
    public static long toJulianDayNumber(CivilDate date) {
        return toJulianDayNumber(date.getYear(), date.getMonth(), date.getDay());
    }

    /**
     * Converts year/month/day to Julian Day Number.
     */
    public static long toJulianDayNumber(int year, int month, int day) {
        long a = (14 - month) / 12;
        long y = (long) year + 4800L - a;
        long m = month + 12L * a - 3L;
        return day + (153L * m + 2L) / 5L + 365L * y + Math.floorDiv(y, 4L)
                - Math.floorDiv(y, 100L) + Math.floorDiv(y, 400L) - 32045L;
    }

    /**
     * Converts a Julian Day Number back to its proleptic-Gregorian civil date.
     *
     * @param julianDayNumber integral Julian Day Number.
     * @return civil date whose noon is {@code julianDayNumber}.
     */
    public static CivilDate toCivilDate(long julianDayNumber) {
        long a = julianDayNumber + 32044L;
        long b = Math.floorDiv(4L * a + 3L, 146097L);
        long c = a - Math.floorDiv(146097L * b, 4L);
        long d = Math.floorDiv(4L * c + 3L, 1461L);
        long e = c - Math.floorDiv(1461L * d, 4L);
        long m = Math.floorDiv(5L * e + 2L, 153L);

        int day = (int) (e - Math.floorDiv(153L * m + 2L, 5L) + 1L);
        int month = (int) (m + 3L - 12L * Math.floorDiv(m, 10L));
        int year = (int) (100L * b + d - 4800L + Math.floorDiv(m, 10L));
        return CivilDate.of(year, month, day);
    }

    /**
     * Returns Julian centuries elapsed since J2000.0.
     */
    public static double centuriesSinceJ2000(double julianInstant) {
        return (julianInstant - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Returns the instant of a universal-time hour on one civil day.
     *
     * @param julianDayNumber civil day (noon UT).
     * @param universalHours hours since 00:00 UT of that day (may fall outside {@code [0, 24)}).
     * @return Julian instant.
     */
    public static double instantOfUniversalHour(long julianDayNumber, double universalHours) {
        return julianDayNumber + (universalHours - NOON_HOURS) / HOURS_PER_DAY;
    }

    /**
     * Returns local clock hours elapsed since the local midnight that opens civil day
     * {@code julianDayNumber}.
     *
     * <p>Instants on the following civil day read {@code >= 24}.</p>
     *
     * @param julianDayNumber civil day whose local midnight is the origin.
     * @param julianInstant instant to read.
     * @param utcOffsetHours fixed local offset from UT.
     * @return local clock hours.
     */
    public static double localClockHours(long julianDayNumber, double julianInstant, double utcOffsetHours) {
        double universalHours = (julianInstant - julianDayNumber) * HOURS_PER_DAY + NOON_HOURS;
        return universalHours + utcOffsetHours;
    }

    /**
     * Returns the integral weekday index {@code floor(jdn + 1) mod 7} where Sunday = 0.
     */
    public static int weekdayIndex(long julianDayNumber) {
        return (int) Math.floorMod(julianDayNumber + 1L, 7L);
    }
}
