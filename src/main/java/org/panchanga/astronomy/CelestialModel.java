package org.panchanga.astronomy;

import org.panchanga.core.math.Angles;

/**
 * Capability contract for solar and lunar positions on the Julian time axis.
 *
 * <p>Implementations are pure functions of the Julian instant. Every longitude is tropical,
 * ecliptic, and normalized into {@code [0, 360)}; sidereal positions are derived by the engine's
 * zodiac policy using {@link #ayanamsa(double)}. A higher-fidelity ephemeris can replace the default
 * model without touching element derivation.</p>
 */
public interface CelestialModel {

    /**
     * Returns stable model identifier.
     */
    String id();

    /**
     * Returns apparent solar ecliptic longitude in degrees, {@code [0, 360)}.
     */
    double solarLongitude(double julianInstant);

    /**
     * Returns lunar ecliptic longitude in degrees, {@code [0, 360)}.
     */
    double lunarLongitude(double julianInstant);

    /**
     * Returns signed lunar ecliptic latitude in degrees (not normalized).
     */
    double lunarLatitude(double julianInstant);

    /**
     * Returns the sidereal correction angle in degrees, {@code [0, 360)}.
     */
    double ayanamsa(double julianInstant);

    /**
     * Returns mean obliquity of the ecliptic in degrees.
     */
    double obliquity(double julianInstant);

    /**
     * Returns Moon-minus-Sun elongation in degrees, {@code [0, 360)}.
     *
     * <p>This is the single driver of tithi and karana.</p>
     */
    default double lunarPhase(double julianInstant) {
        return Angles.elongation(solarLongitude(julianInstant), lunarLongitude(julianInstant));
    }

    /**
     * Returns solar declination in degrees.
     */
    default double solarDeclination(double julianInstant) {
        double obliquityRad = Math.toRadians(obliquity(julianInstant));
        double longitudeRad = Math.toRadians(solarLongitude(julianInstant));
        return Math.toDegrees(Math.asin(Math.sin(obliquityRad) * Math.sin(longitudeRad)));
    }
}
