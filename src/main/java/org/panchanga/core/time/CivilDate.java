package org.panchanga.core.time;

import lombok.Value;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Immutable proleptic-Gregorian civil date.
 *
 * <p>Construction never validates; callers check {@link #isValid()} at the engine boundary so an
 * out-of-range request can be rejected with a reason code instead of a construction failure.</p>
 */
@Value
public class CivilDate {
    int year;
    int month;
    int day;

    /**
     * Creates a civil date value.
     */
    public static CivilDate of(int year, int month, int day) {
        return new CivilDate(year, month, day);
    }

    /**
     * Creates a civil date from a {@link LocalDate}.
     */
    public static CivilDate from(LocalDate date) {
        return new CivilDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Returns whether this triple denotes a constructible calendar date.
     */
    public boolean isValid() {
        try {
            LocalDate.of(year, month, day);
            return true;
        } catch (DateTimeException ex) {
            return false;
        }
    }

    /**
     * Converts to {@link LocalDate}.
     *
     * @throws DateTimeException when the date is not valid.
     */
    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02d", year, month, day);
    }
}
