package org.panchanga.engine;

import lombok.Value;
import org.panchanga.astronomy.HorizonEvent;
import org.panchanga.astronomy.RiseSetResult;
import org.panchanga.astronomy.RiseSetSolver;
import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.ClockTime;
import org.panchanga.core.time.JulianDay;

/**
 * Observed day {@code [sunrise(d), sunrise(d + 1))} on the Julian axis.
 *
 * <p>Both anchors come from consecutive solar dates, so the window spans one solar day even when the
 * local clock reads sunrise next to midnight. When either sunrise does not exist the anchor is local
 * mean solar 06:00 of that day and {@link #isAnchorFallback()} is set.</p>
 */
@Value
class DayWindow {
    static final double FALLBACK_ANCHOR_SOLAR_HOURS = 6.0d;

    long julianDayNumber;
    double utcOffsetHours;
    /** Anchor instant of the queried date. */
    double startInstant;
    /** Anchor instant of the following date. */
    double endInstant;
    /** Sunrise/sunset of the queried date. */
    RiseSetResult riseSet;
    /** Sunrise/sunset of the following date, which closes the window. */
    RiseSetResult nextRiseSet;
    boolean anchorFallback;

    static DayWindow resolve(RiseSetSolver solver, long julianDayNumber, GeoLocation location) {
        RiseSetResult today = solver.solveSun(julianDayNumber, location);
        RiseSetResult tomorrow = solver.solveSun(julianDayNumber + 1L, location);
        HorizonEvent start = anchor(solver, today, julianDayNumber, location);
        HorizonEvent end = anchor(solver, tomorrow, julianDayNumber + 1L, location);
        return new DayWindow(
                julianDayNumber,
                location.getUtcOffsetHours(),
                start.getJulianInstant(),
                end.getJulianInstant(),
                today,
                tomorrow,
                !today.isAvailable() || !tomorrow.isAvailable()
        );
    }

    double lengthDays() {
        return endInstant - startInstant;
    }

    /**
     * Returns local clock reading of an instant, counted from the midnight that opens the queried date.
     */
    ClockTime localClock(double julianInstant) {
        return ClockTime.fromDecimalHours(JulianDay.localClockHours(julianDayNumber, julianInstant, utcOffsetHours));
    }

    private static HorizonEvent anchor(RiseSetSolver solver, RiseSetResult riseSet, long julianDayNumber, GeoLocation location) {
        return riseSet.getSunrise()
                .orElseGet(() -> solver.atLocalSolarHour(julianDayNumber, FALLBACK_ANCHOR_SOLAR_HOURS, location));
    }
}
