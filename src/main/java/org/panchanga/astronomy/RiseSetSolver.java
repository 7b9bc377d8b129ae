package org.panchanga.astronomy;

import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.JulianDay;

import java.util.Objects;
import java.util.Optional;

/**
 * Hour-angle solver for sunrise/sunset and the approximate moonrise/moonset placeholder.
 *
 * <p>Rise and set are computed in local apparent solar time ({@code 12 -/+ H/15}) on the solar date
 * paired with the requested civil date, shifted to UT by the observer longitude, and read on the local
 * clock through the fixed UTC offset. The pairing is fixed per location: the solar date whose mean
 * 06:00 falls on the civil date. Consecutive civil dates therefore always get consecutive sunrises,
 * even where the UTC offset puts sunrise next to local midnight. Event instants stay on the solar
 * axis; only the clock reading is wrapped into {@code [0, 24)}, so it can belong to the adjacent
 * civil date.</p>
 */
public final class RiseSetSolver {
    /** Above this absolute latitude the placeholder moonrise model is not meaningful. */
    public static final double MOON_MODEL_LATITUDE_LIMIT_DEGREES = 61.5d;

    private static final double DEGREES_PER_HOUR = 15.0d;
    private static final double HOURS_PER_DAY = 24.0d;
    private static final double SOLAR_NOON_HOURS = 12.0d;
    private static final double MEAN_SUNRISE_SOLAR_HOURS = 6.0d;
    private static final double MOONRISE_AMPLITUDE_HOURS = 2.0d;

    private final CelestialModel celestialModel;

    /**
     * Creates a solver bound to one celestial model.
     *
     * @param celestialModel position model used for declination and lunar longitude.
     */
    public RiseSetSolver(CelestialModel celestialModel) {
        this.celestialModel = Objects.requireNonNull(celestialModel, "celestialModel");
    }

    /**
     * Solves sunrise and sunset for one local civil day.
     *
     * @param julianDayNumber civil day (noon UT).
     * @param location valid observer location.
     * @return rise/set outcome; polar day and night are reported through the status.
     */
    public RiseSetResult solveSun(long julianDayNumber, GeoLocation location) {
        long solarDay = solarDayOf(julianDayNumber, location);
        double noonInstant = JulianDay.instantOfUniversalHour(solarDay, localNoonUniversalHours(location));
        double declinationRad = Math.toRadians(celestialModel.solarDeclination(noonInstant));
        double latitudeRad = Math.toRadians(location.getLatitude());

        double cosHourAngle = -Math.tan(latitudeRad) * Math.tan(declinationRad);
        if (cosHourAngle > 1.0d) {
            return unavailable(RiseSetStatus.NEVER_RISES);
        }
        if (cosHourAngle < -1.0d) {
            return unavailable(RiseSetStatus.NEVER_SETS);
        }

        double hourAngleHours = Math.toDegrees(Math.acos(cosHourAngle)) / DEGREES_PER_HOUR;
        return RiseSetResult.builder()
                .status(RiseSetStatus.NORMAL)
                .sunrise(toEvent(solarDay, SOLAR_NOON_HOURS - hourAngleHours, location))
                .sunset(toEvent(solarDay, SOLAR_NOON_HOURS + hourAngleHours, location))
                .dayDurationHours(2.0d * hourAngleHours)
                .build();
    }

    /**
     * Approximates moonrise as a small sinusoidal offset from local noon.
     *
     * <p>Low-confidence placeholder; empty beyond {@link #MOON_MODEL_LATITUDE_LIMIT_DEGREES}.</p>
     */
    public Optional<HorizonEvent> moonrise(long julianDayNumber, GeoLocation location) {
        if (!moonModelApplies(location)) {
            return Optional.empty();
        }
        long solarDay = solarDayOf(julianDayNumber, location);
        double solarHours = SOLAR_NOON_HOURS + MOONRISE_AMPLITUDE_HOURS * lunarLongitudeSine(solarDay);
        return Optional.of(toEvent(solarDay, solarHours, location));
    }

    /**
     * Approximates moonset as a small sinusoidal offset from local midnight.
     *
     * <p>Low-confidence placeholder; empty beyond {@link #MOON_MODEL_LATITUDE_LIMIT_DEGREES}.</p>
     */
    public Optional<HorizonEvent> moonset(long julianDayNumber, GeoLocation location) {
        if (!moonModelApplies(location)) {
            return Optional.empty();
        }
        long solarDay = solarDayOf(julianDayNumber, location);
        double solarHours = HOURS_PER_DAY - MOONRISE_AMPLITUDE_HOURS * lunarLongitudeSine(solarDay);
        return Optional.of(toEvent(solarDay, solarHours, location));
    }

    /**
     * Returns the event at a local mean solar hour, read on the local clock.
     *
     * <p>Used as the day anchor when the sun does not rise.</p>
     */
    public HorizonEvent atLocalSolarHour(long julianDayNumber, double solarHours, GeoLocation location) {
        return toEvent(solarDayOf(julianDayNumber, location), solarHours, location);
    }

    /**
     * Returns the solar date paired with a local civil date.
     *
     * <p>Differs from {@code julianDayNumber} by at most one day, for locations whose UTC offset
     * moves mean solar 06:00 across local midnight.</p>
     */
    public static long solarDayOf(long julianDayNumber, GeoLocation location) {
        double meanSunriseLocalHours = MEAN_SUNRISE_SOLAR_HOURS
                - location.getLongitude() / DEGREES_PER_HOUR
                + location.getUtcOffsetHours();
        return julianDayNumber - (long) Math.floor(meanSunriseLocalHours / HOURS_PER_DAY);
    }

    private static HorizonEvent toEvent(long solarDay, double solarHours, GeoLocation location) {
        double universalHours = solarHours - location.getLongitude() / DEGREES_PER_HOUR;
        double instant = JulianDay.instantOfUniversalHour(solarDay, universalHours);
        return new HorizonEvent(instant, wrapClockHours(universalHours + location.getUtcOffsetHours()));
    }

    private static double wrapClockHours(double hours) {
        double wrapped = hours - Math.floor(hours / HOURS_PER_DAY) * HOURS_PER_DAY;
        return wrapped >= HOURS_PER_DAY ? wrapped - HOURS_PER_DAY : wrapped;
    }

    private double lunarLongitudeSine(long solarDay) {
        return Math.sin(Math.toRadians(celestialModel.lunarLongitude(solarDay)));
    }

    private static boolean moonModelApplies(GeoLocation location) {
        return Math.abs(location.getLatitude()) <= MOON_MODEL_LATITUDE_LIMIT_DEGREES;
    }

    private static double localNoonUniversalHours(GeoLocation location) {
        return SOLAR_NOON_HOURS - location.getLongitude() / DEGREES_PER_HOUR;
    }

    private static RiseSetResult unavailable(RiseSetStatus status) {
        return RiseSetResult.builder()
                .status(status)
                .dayDurationHours(status == RiseSetStatus.NEVER_SETS ? HOURS_PER_DAY : 0.0d)
                .build();
    }
}
