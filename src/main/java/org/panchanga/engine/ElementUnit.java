package org.panchanga.engine;

import lombok.Builder;
import lombok.Value;
import org.panchanga.core.time.ClockTime;
import org.panchanga.names.NameCategory;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One Tithi, Nakshatra or Yoga as observed over a sunrise-to-sunrise day.
 *
 * <p>{@code endTime} is read on the local clock of the queried date; hours at or past 24 mean the
 * unit ends after the following midnight.</p>
 */
@Value
@Builder
public class ElementUnit {
    /** Element category. */
    NameCategory category;
    /** 1-based unit number. */
    int number;
    /** Resolved display name. */
    String name;
    /** Local end time, absent when the unit outlasts the observed day. */
    ClockTime endTime;
    /** Julian instant of the end, absent together with {@code endTime}. */
    Double endInstant;
    /** Whether this unit began and ended between two consecutive sunrises. */
    boolean skipped;

    public Optional<ClockTime> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public OptionalDouble getEndInstant() {
        return endInstant == null ? OptionalDouble.empty() : OptionalDouble.of(endInstant);
    }
}
