package org.panchanga.traits.zodiac;

import org.panchanga.astronomy.CelestialModel;

/**
 * Zodiac reference contract used for longitude-indexed elements.
 *
 * <p>Nakshatra, yoga, masa and samvatsara index the longitude returned by the bound policy; tithi
 * and karana use the Moon-Sun elongation, which no policy changes.</p>
 */
public interface ZodiacPolicy {

    /**
     * Returns stable policy identifier.
     */
    String id();

    /**
     * Converts a tropical longitude into this policy's reference frame.
     *
     * @param tropicalLongitude tropical ecliptic longitude in degrees.
     * @param julianInstant instant the longitude belongs to.
     * @param celestialModel model supplying the ayanamsa.
     * @return longitude in degrees, {@code [0, 360)}.
     */
    double toZodiacLongitude(double tropicalLongitude, double julianInstant, CelestialModel celestialModel);
}
