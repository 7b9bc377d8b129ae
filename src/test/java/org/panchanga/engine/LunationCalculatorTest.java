package org.panchanga.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.panchanga.astronomy.CelestialModel;
import org.panchanga.astronomy.RiseSetSolver;
import org.panchanga.astronomy.TruncatedSeriesCelestialModel;
import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.CivilDate;
import org.panchanga.core.time.JulianDay;
import org.panchanga.names.TableNameResolver;
import org.panchanga.traits.zodiac.ZodiacPolicyRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LunationCalculator Tests")
class LunationCalculatorTest {
    private static final GeoLocation BENGALURU = GeoLocation.of(12.9716d, 77.5946d, 5.5d);
    private static final CelestialModel MODEL = TruncatedSeriesCelestialModel.instance();

    private final LunationCalculator calculator = new LunationCalculator(
            MODEL,
            ZodiacPolicyRegistry.defaultRegistry().policy(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI),
            TableNameResolver.defaults(),
            BoundarySearch.defaults()
    );

    @Test
    @DisplayName("New moons bracket the anchor one lunation apart")
    void testNewMoonsAround() {
        double anchor = sunrise(2024, 1, 15);
        LunationCalculator.NewMoonPair pair = calculator.newMoonsAround(anchor);

        // 2024-01-11 ~11:44 UT and 2024-02-09 ~22:54 UT
        assertEquals(2460320.98907d, pair.getPrevious(), 1e-4);
        assertEquals(2460350.45458d, pair.getNext(), 1e-4);
        assertTrue(pair.getPrevious() <= anchor && anchor < pair.getNext());
        assertTrue(Math.min(MODEL.lunarPhase(pair.getPrevious()), 360.0d - MODEL.lunarPhase(pair.getPrevious())) < 1e-4);
    }

    @Test
    @DisplayName("Mid January 2024 is Pausha of Shobhakrit in Hemanta")
    void testPausha2024() {
        LunationCalculator.Lunation lunation = calculator.lunation(CivilDate.of(2024, 1, 15), sunrise(2024, 1, 15));

        assertEquals(10, lunation.getMasa().getNumber());
        assertEquals("Puṣya", lunation.getMasa().getName());
        assertFalse(lunation.getMasa().isLeapMonth());
        assertEquals(37, lunation.getSamvatsara().getNumber());
        assertEquals("Śobhakṛt", lunation.getSamvatsara().getName());
        assertEquals(5, lunation.getRitu().getNumber());
    }

    @ParameterizedTest
    @CsvSource({
            "2023, 7, 20, 5, true",   // adhika Shravana
            "2023, 8, 1, 5, true",
            "2023, 8, 20, 5, false",  // nija Shravana
            "2024, 3, 20, 12, false",
            "2024, 4, 10, 1, false",
            "2023, 12, 20, 9, false"
    })
    @DisplayName("Masa number and leap flag on known dates")
    void testMasaOnKnownDates(int year, int month, int day, int expectedMasa, boolean expectedLeap) {
        MasaUnit masa = calculator.lunation(CivilDate.of(year, month, day), sunrise(year, month, day)).getMasa();

        assertEquals(expectedMasa, masa.getNumber());
        assertEquals(expectedLeap, masa.isLeapMonth());
    }

    @Test
    @DisplayName("Samvatsara turns over with Chaitra, not with January")
    void testSamvatsaraYearBoundary() {
        assertEquals(37, calculator.lunation(CivilDate.of(2024, 3, 20), sunrise(2024, 3, 20)).getSamvatsara().getNumber());
        assertEquals(38, calculator.lunation(CivilDate.of(2024, 4, 10), sunrise(2024, 4, 10)).getSamvatsara().getNumber());

        assertEquals(1, LunationCalculator.samvatsaraNumber(CivilDate.of(1987, 6, 1), 3));
        assertEquals(60, LunationCalculator.samvatsaraNumber(CivilDate.of(1987, 2, 1), 11));
        assertEquals(60, LunationCalculator.samvatsaraNumber(CivilDate.of(2046, 12, 1), 9));
        assertEquals(1, LunationCalculator.samvatsaraNumber(CivilDate.of(2047, 5, 1), 2));
    }

    @Test
    @DisplayName("Ritu pairs consecutive months")
    void testRituPairsMonths() {
        LunationCalculator.Lunation spring = calculator.lunation(CivilDate.of(2024, 4, 10), sunrise(2024, 4, 10));
        assertEquals(1, spring.getRitu().getNumber());
        assertEquals("Vasanta", spring.getRitu().getName());

        LunationCalculator.Lunation lateWinter = calculator.lunation(CivilDate.of(2024, 3, 20), sunrise(2024, 3, 20));
        assertEquals(6, lateWinter.getRitu().getNumber());
    }

    private static double sunrise(int year, int month, int day) {
        return new RiseSetSolver(MODEL)
                .solveSun(JulianDay.toJulianDayNumber(year, month, day), BENGALURU)
                .getSunrise()
                .orElseThrow()
                .getJulianInstant();
    }
}
