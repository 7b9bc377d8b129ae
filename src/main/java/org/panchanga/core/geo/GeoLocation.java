package org.panchanga.core.geo;

import lombok.Builder;
import lombok.Value;

/**
 * Observer location with a fixed civil offset from UT.
 *
 * <p>Range checks happen at the engine boundary through {@link #isValid()}; everything past that
 * boundary may assume a valid location.</p>
 */
@Value
@Builder
public class GeoLocation {
    public static final double MIN_LATITUDE = -90.0d;
    public static final double MAX_LATITUDE = 90.0d;
    public static final double MIN_LONGITUDE = -180.0d;
    public static final double MAX_LONGITUDE = 180.0d;
    public static final double MIN_UTC_OFFSET_HOURS = -12.0d;
    public static final double MAX_UTC_OFFSET_HOURS = 14.0d;

    /** Geodetic latitude in degrees, north positive. */
    double latitude;
    /** Geodetic longitude in degrees, east positive. */
    double longitude;
    /** Local clock offset from UT in hours (for example {@code 5.5}). */
    double utcOffsetHours;
    /** Optional display name, or {@code null}. */
    String name;

    /**
     * Creates an unnamed location.
     */
    public static GeoLocation of(double latitude, double longitude, double utcOffsetHours) {
        return new GeoLocation(latitude, longitude, utcOffsetHours, null);
    }

    /**
     * Creates a named location.
     */
    public static GeoLocation of(double latitude, double longitude, double utcOffsetHours, String name) {
        return new GeoLocation(latitude, longitude, utcOffsetHours, name);
    }

    /**
     * Returns whether all coordinates are finite and inside their documented ranges.
     */
    public boolean isValid() {
        return inRange(latitude, MIN_LATITUDE, MAX_LATITUDE)
                && inRange(longitude, MIN_LONGITUDE, MAX_LONGITUDE)
                && inRange(utcOffsetHours, MIN_UTC_OFFSET_HOURS, MAX_UTC_OFFSET_HOURS);
    }

    private static boolean inRange(double value, double min, double max) {
        return Double.isFinite(value) && value >= min && value <= max;
    }
}
