package org.panchanga.astronomy;

import lombok.Value;
import org.panchanga.core.time.ClockTime;

/**
 * One horizon crossing on the Julian axis together with its local clock reading.
 */
@Value
public class HorizonEvent {
    private static final int HOURS_PER_DAY = 24;

    /** Julian instant of the crossing. */
    double julianInstant;
    /** Local clock hours in {@code [0, 24)}. */
    double localHours;

    /**
     * Returns local clock reading rounded to the second, always below {@code 24:00:00}.
     */
    public ClockTime localTime() {
        ClockTime reading = ClockTime.fromDecimalHours(localHours);
        if (reading.getHours() < HOURS_PER_DAY) {
            return reading;
        }
        return ClockTime.of(reading.getHours() % HOURS_PER_DAY, reading.getMinutes(), reading.getSeconds());
    }
}
