package org.panchanga.core.time;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Sexagesimal clock reading of a decimal-hour value.
 *
 * <p>Hours are unbounded: an end time after the following midnight reads {@code 26:10:00}, and a
 * negative reading carries its sign on the hour field only.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClockTime {
    private static final int SECONDS_PER_MINUTE = 60;
    private static final int SECONDS_PER_HOUR = 3600;

    int hours;
    int minutes;
    int seconds;
    boolean negative;

    /**
     * Creates a non-negative clock reading.
     *
     * @param hours whole hours, {@code >= 0}.
     * @param minutes minutes in {@code [0, 60)}.
     * @param seconds seconds in {@code [0, 60)}.
     */
    public static ClockTime of(int hours, int minutes, int seconds) {
        if (hours < 0) {
            throw new IllegalArgumentException("hours must be >= 0, got " + hours);
        }
        if (minutes < 0 || minutes >= SECONDS_PER_MINUTE) {
            throw new IllegalArgumentException("minutes must be in [0, 60), got " + minutes);
        }
        if (seconds < 0 || seconds >= SECONDS_PER_MINUTE) {
            throw new IllegalArgumentException("seconds must be in [0, 60), got " + seconds);
        }
        return new ClockTime(hours, minutes, seconds, false);
    }

    /**
     * Renders decimal hours to the nearest second.
     *
     * <p>Rounding happens on the total second count, so {@code 59.6} seconds carries into the next
     * minute instead of producing {@code seconds == 60}.</p>
     *
     * @param decimalHours finite hour value.
     * @return sexagesimal reading.
     */
    public static ClockTime fromDecimalHours(double decimalHours) {
        if (!Double.isFinite(decimalHours)) {
            throw new IllegalArgumentException("decimalHours must be finite, got " + decimalHours);
        }
        boolean negative = decimalHours < 0.0d;
        long totalSeconds = Math.round(Math.abs(decimalHours) * SECONDS_PER_HOUR);
        int hours = Math.toIntExact(totalSeconds / SECONDS_PER_HOUR);
        int minutes = (int) ((totalSeconds % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE);
        int seconds = (int) (totalSeconds % SECONDS_PER_MINUTE);
        return new ClockTime(hours, minutes, seconds, negative && totalSeconds != 0L);
    }

    /**
     * Converts back to decimal hours.
     */
    public double toDecimalHours() {
        double magnitude = hours + minutes / 60.0d + seconds / 3600.0d;
        return negative ? -magnitude : magnitude;
    }

    /**
     * Returns total signed seconds represented by this reading.
     */
    public long toTotalSeconds() {
        long magnitude = (long) hours * SECONDS_PER_HOUR + (long) minutes * SECONDS_PER_MINUTE + seconds;
        return negative ? -magnitude : magnitude;
    }

    @Override
    public String toString() {
        return String.format("%s%02d:%02d:%02d", negative ? "-" : "", hours, minutes, seconds);
    }
}
