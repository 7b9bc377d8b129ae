package org.panchanga.engine;

import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.CivilDate;

/**
 * Public panchanga computation contract.
 *
 * <p>Implementations validate inputs deterministically before any astronomical computation and
 * throw {@link PanchangaException} for contract failures.</p>
 */
public interface PanchangaService {

    /**
     * Computes the full five-limb almanac plus month, year and season for one civil date.
     *
     * @param date civil date (proleptic Gregorian).
     * @param location observer location.
     * @return composite result; sub-results that could not be computed are absent and explained
     *         in {@link PanchangaResult#getDiagnostics()}.
     */
    PanchangaResult computePanchanga(CivilDate date, GeoLocation location);

    /**
     * Tithi prevailing at sunrise with its end time.
     */
    ElementUnit computeTithi(CivilDate date, GeoLocation location);

    /**
     * Nakshatra prevailing at sunrise with its end time.
     */
    ElementUnit computeNakshatra(CivilDate date, GeoLocation location);

    /**
     * Yoga prevailing at sunrise with its end time.
     */
    ElementUnit computeYoga(CivilDate date, GeoLocation location);

    /**
     * Karana prevailing at sunrise.
     */
    KaranaUnit computeKarana(CivilDate date, GeoLocation location);

    /**
     * Weekday of the civil date; independent of location.
     */
    VaraUnit computeVara(CivilDate date);

    /**
     * Lunar month containing the sunrise of the civil date.
     */
    MasaUnit computeMasa(CivilDate date, GeoLocation location);
}
