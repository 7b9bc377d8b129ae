package org.panchanga.engine;

import lombok.Value;
import org.panchanga.astronomy.CelestialModel;
import org.panchanga.core.math.Angles;
import org.panchanga.core.time.CivilDate;
import org.panchanga.names.NameCategory;
import org.panchanga.names.NameResolver;
import org.panchanga.traits.zodiac.ZodiacPolicy;

import java.util.Objects;

/**
 * Amanta month, year and season derivation from the new moons around an anchor instant.
 *
 * <p>The month is named after the solar sign entered after the opening new moon: with the Sun in
 * Mina at that new moon the month is Chaitra. When the Sun stays in one sign across the whole
 * lunation the month is a leap month.</p>
 */
final class LunationCalculator {
    static final double MEAN_SYNODIC_MONTH_DAYS = 29.530588853d;
    static final double NEW_MOON_SEARCH_MARGIN_DAYS = 3.0d;

    static final int MONTHS_PER_YEAR = 12;
    static final double RASHI_SPAN_DEGREES = 30.0d;

    static final int SAMVATSARA_CYCLE_YEARS = 60;
    static final int PRABHAVA_EPOCH_YEAR = 1987;
    static final int LAST_CIVIL_MONTH_BEFORE_NEW_YEAR = 4;
    static final int FIRST_MASA_OF_YEAR_END = 9;

    private static final double MEAN_PHASE_RATE_DEGREES_PER_DAY = Angles.FULL_CIRCLE / MEAN_SYNODIC_MONTH_DAYS;

    private final CelestialModel celestialModel;
    private final ZodiacPolicy zodiacPolicy;
    private final NameResolver nameResolver;
    private final BoundarySearch boundarySearch;

    LunationCalculator(
            CelestialModel celestialModel,
            ZodiacPolicy zodiacPolicy,
            NameResolver nameResolver,
            BoundarySearch boundarySearch
    ) {
        this.celestialModel = Objects.requireNonNull(celestialModel, "celestialModel");
        this.zodiacPolicy = Objects.requireNonNull(zodiacPolicy, "zodiacPolicy");
        this.nameResolver = Objects.requireNonNull(nameResolver, "nameResolver");
        this.boundarySearch = Objects.requireNonNull(boundarySearch, "boundarySearch");
    }

    /**
     * Finds the new moons opening and closing the lunation that contains {@code anchorInstant}.
     *
     * @throws BoundarySearch.BoundarySearchException when a new moon is not bracketed.
     */
    NewMoonPair newMoonsAround(double anchorInstant) {
        double phase = celestialModel.lunarPhase(anchorInstant);
        double previousEstimate = anchorInstant - phase / MEAN_PHASE_RATE_DEGREES_PER_DAY;
        double previous = newMoonNear(previousEstimate);
        double next = newMoonNear(previous + MEAN_SYNODIC_MONTH_DAYS);
        return new NewMoonPair(previous, next);
    }

    /**
     * Derives month, year and season for one observed day.
     *
     * @param date civil date of the observed day.
     * @param anchorInstant day anchor (sunrise or its fallback).
     * @throws BoundarySearch.BoundarySearchException when a new moon is not bracketed.
     */
    Lunation lunation(CivilDate date, double anchorInstant) {
        NewMoonPair newMoons = newMoonsAround(anchorInstant);
        int openingRashi = rashiAt(newMoons.getPrevious());
        int closingRashi = rashiAt(newMoons.getNext());

        int masaNumber = Math.floorMod(openingRashi + 1, MONTHS_PER_YEAR) + 1;
        MasaUnit masa = new MasaUnit(
                masaNumber,
                nameResolver.resolve(NameCategory.MASA, masaNumber),
                openingRashi == closingRashi
        );

        int samvatsaraNumber = samvatsaraNumber(date, masaNumber);
        SamvatsaraUnit samvatsara = new SamvatsaraUnit(
                samvatsaraNumber,
                nameResolver.resolve(NameCategory.SAMVATSARA, samvatsaraNumber)
        );

        int rituNumber = (masaNumber - 1) / 2 + 1;
        RituUnit ritu = new RituUnit(rituNumber, nameResolver.resolve(NameCategory.RITU, rituNumber));
        return new Lunation(masa, samvatsara, ritu, newMoons);
    }

    static int samvatsaraNumber(CivilDate date, int masaNumber) {
        int lunarYear = date.getYear();
        if (date.getMonth() <= LAST_CIVIL_MONTH_BEFORE_NEW_YEAR && masaNumber >= FIRST_MASA_OF_YEAR_END) {
            lunarYear--;
        }
        return Math.floorMod(lunarYear - PRABHAVA_EPOCH_YEAR, SAMVATSARA_CYCLE_YEARS) + 1;
    }

    private double newMoonNear(double estimate) {
        return boundarySearch.findCrossing(
                celestialModel::lunarPhase,
                estimate - NEW_MOON_SEARCH_MARGIN_DAYS,
                estimate + NEW_MOON_SEARCH_MARGIN_DAYS,
                0.0d
        );
    }

    private int rashiAt(double julianInstant) {
        double sun = zodiacPolicy.toZodiacLongitude(
                celestialModel.solarLongitude(julianInstant), julianInstant, celestialModel);
        return (int) Math.floor(sun / RASHI_SPAN_DEGREES) % MONTHS_PER_YEAR;
    }

    @Value
    static class NewMoonPair {
        double previous;
        double next;
    }

    @Value
    static class Lunation {
        MasaUnit masa;
        SamvatsaraUnit samvatsara;
        RituUnit ritu;
        NewMoonPair newMoons;
    }
}
