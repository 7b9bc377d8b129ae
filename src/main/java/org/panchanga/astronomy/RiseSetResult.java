package org.panchanga.astronomy;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Sunrise/sunset outcome for one civil day.
 *
 * <p>When {@link #getStatus()} is not {@link RiseSetStatus#NORMAL} both events are absent and
 * {@link #getDayDurationHours()} is {@code 24} (polar day) or {@code 0} (polar night).</p>
 */
@Value
@Builder
public class RiseSetResult {
    RiseSetStatus status;
    HorizonEvent sunrise;
    HorizonEvent sunset;
    double dayDurationHours;

    /**
     * Returns sunrise, or empty when the sun does not cross the horizon.
     */
    public Optional<HorizonEvent> getSunrise() {
        return Optional.ofNullable(sunrise);
    }

    /**
     * Returns sunset, or empty when the sun does not cross the horizon.
     */
    public Optional<HorizonEvent> getSunset() {
        return Optional.ofNullable(sunset);
    }

    /**
     * Returns whether both horizon crossings exist.
     */
    public boolean isAvailable() {
        return status == RiseSetStatus.NORMAL;
    }
}
