package org.panchanga.astronomy;

import org.panchanga.core.math.Angles;
import org.panchanga.core.time.JulianDay;

/**
 * Default low-order celestial model built from truncated periodic-term series.
 *
 * <p>All series are evaluated in Julian centuries from J2000.0. Lunar longitude keeps only the four
 * largest periodic terms (equation of centre, evection, variation, annual equation), which is enough
 * to place tithi and nakshatra boundaries inside the right day but is not astronomical-grade.</p>
 */
public final class TruncatedSeriesCelestialModel implements CelestialModel {
    public static final String MODEL_ID = "TRUNCATED_SERIES";

    private static final TruncatedSeriesCelestialModel INSTANCE = new TruncatedSeriesCelestialModel();

    // Lahiri approximation: value at J2000.0 and general precession per century.
    private static final double AYANAMSA_J2000_DEGREES = 23.85d;
    private static final double AYANAMSA_RATE_DEGREES_PER_CENTURY = 1.396971d;

    private static final double OBLIQUITY_J2000_DEGREES = 23.4393d;
    private static final double OBLIQUITY_RATE_DEGREES_PER_CENTURY = 0.013d;

    /**
     * Returns the shared stateless instance.
     */
    public static TruncatedSeriesCelestialModel instance() {
        return INSTANCE;
    }

    @Override
    public String id() {
        return MODEL_ID;
    }

    /**
     * Mean longitude plus a three-term equation of centre.
     */
    @Override
    public double solarLongitude(double julianInstant) {
        double t = JulianDay.centuriesSinceJ2000(julianInstant);
        double meanLongitude = 280.46646d + 36000.76983d * t + 0.0003032d * t * t;
        double meanAnomaly = Math.toRadians(357.52911d + 35999.05029d * t - 0.0001537d * t * t);

        double center = (1.914602d - 0.004817d * t - 0.000014d * t * t) * Math.sin(meanAnomaly)
                + (0.019993d - 0.000101d * t) * Math.sin(2.0d * meanAnomaly)
                + 0.000289d * Math.sin(3.0d * meanAnomaly);
        return Angles.normalize(meanLongitude + center);
    }

    @Override
    public double lunarLongitude(double julianInstant) {
        double t = JulianDay.centuriesSinceJ2000(julianInstant);
        double meanLongitude = 218.3164477d + 481267.88123421d * t - 0.0015786d * t * t;
        double elongation = 297.8501921d + 445267.1114034d * t - 0.0018819d * t * t;
        double sunAnomaly = 357.5291092d + 35999.0502909d * t - 0.0001536d * t * t;
        double moonAnomaly = 134.9633964d + 477198.8675055d * t + 0.0087414d * t * t;

        double longitude = meanLongitude
                + 6.288774d * sinDegrees(moonAnomaly)
                + 1.274027d * sinDegrees(2.0d * elongation - moonAnomaly)
                + 0.658314d * sinDegrees(2.0d * elongation)
                - 0.185116d * sinDegrees(sunAnomaly);
        return Angles.normalize(longitude);
    }

    @Override
    public double lunarLatitude(double julianInstant) {
        double t = JulianDay.centuriesSinceJ2000(julianInstant);
        double argumentOfLatitude = 93.2720950d + 483202.0175233d * t - 0.0036539d * t * t;
        double moonAnomaly = 134.9633964d + 477198.8675055d * t + 0.0087414d * t * t;

        return 5.128122d * sinDegrees(argumentOfLatitude)
                + 0.280602d * sinDegrees(moonAnomaly + argumentOfLatitude)
                + 0.277693d * sinDegrees(moonAnomaly - argumentOfLatitude);
    }

    @Override
    public double ayanamsa(double julianInstant) {
        double t = JulianDay.centuriesSinceJ2000(julianInstant);
        return Angles.normalize(AYANAMSA_J2000_DEGREES + AYANAMSA_RATE_DEGREES_PER_CENTURY * t);
    }

    @Override
    public double obliquity(double julianInstant) {
        double t = JulianDay.centuriesSinceJ2000(julianInstant);
        return OBLIQUITY_J2000_DEGREES - OBLIQUITY_RATE_DEGREES_PER_CENTURY * t;
    }

    private static double sinDegrees(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }
}
