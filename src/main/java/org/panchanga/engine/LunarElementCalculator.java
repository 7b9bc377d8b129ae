package org.panchanga.engine;

import org.panchanga.astronomy.CelestialModel;
import org.panchanga.core.math.Angles;
import org.panchanga.names.NameCategory;
import org.panchanga.names.NameResolver;
import org.panchanga.traits.zodiac.ZodiacPolicy;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Derives Tithi, Nakshatra, Yoga and Karana over one observed day.
 *
 * <p>Unit numbers come from the angle at the window start. End times come from bracketed crossings
 * of the unit boundary inside the window; at most one intermediate unit can be skipped because
 * every tracked angle advances less than two spans per day.</p>
 */
final class LunarElementCalculator {
    static final String REASON_UNIT_SKIP_OVERFLOW = "UNIT_SKIP_OVERFLOW";

    static final double KARANA_SPAN_DEGREES = 6.0d;
    static final int KARANA_COUNT = 60;

    private final CelestialModel celestialModel;
    private final ZodiacPolicy zodiacPolicy;
    private final NameResolver nameResolver;
    private final BoundarySearch boundarySearch;

    LunarElementCalculator(
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
     * Returns the element angle at one instant in {@code [0, 360)}.
     */
    double angle(LunarElement element, double julianInstant) {
        switch (element) {
            case TITHI:
                return celestialModel.lunarPhase(julianInstant);
            case NAKSHATRA:
                return zodiacMoon(julianInstant);
            case YOGA:
                return Angles.normalize(zodiacSun(julianInstant) + zodiacMoon(julianInstant));
            default:
                throw new IllegalArgumentException("unsupported element: " + element);
        }
    }

    int unitAt(LunarElement element, double julianInstant) {
        return Angles.unitNumber(angle(element, julianInstant), element.spanDegrees(), element.unitCount());
    }

    /**
     * Unit prevailing at the window start, without an end time.
     */
    ElementUnit prevailing(LunarElement element, DayWindow window) {
        return unit(element, unitAt(element, window.getStartInstant()), null, window, false);
    }

    /**
     * Unit prevailing at the window start with its end time and any skipped successor.
     *
     * @throws BoundarySearch.BoundarySearchException when the angle does not advance monotonically
     *                                                across the window.
     */
    ElementSpan span(LunarElement element, DayWindow window) {
        double start = window.getStartInstant();
        double end = window.getEndInstant();
        int count = element.unitCount();
        int first = unitAt(element, start);
        int last = unitAt(element, end);
        int steps = Angles.forwardSteps(first, last, count);

        if (steps == 0) {
            return new ElementSpan(unit(element, first, null, window, false), null);
        }
        if (steps > 2) {
            throw new BoundarySearch.BoundarySearchException(
                    REASON_UNIT_SKIP_OVERFLOW,
                    element + " advanced " + steps + " units within one day (" + first + " -> " + last + ")"
            );
        }

        DoubleUnaryOperator angleFunction = instant -> angle(element, instant);
        double firstEnd = boundarySearch.findCrossing(
                angleFunction, start, end, Angles.unitEndAngle(first, element.spanDegrees()));
        ElementUnit primary = unit(element, first, firstEnd, window, false);
        if (steps == 1) {
            return new ElementSpan(primary, null);
        }

        int skippedNumber = Angles.nextUnit(first, count);
        double skippedEnd = boundarySearch.findCrossing(
                angleFunction, firstEnd, end, Angles.unitEndAngle(skippedNumber, element.spanDegrees()));
        return new ElementSpan(primary, unit(element, skippedNumber, skippedEnd, window, true));
    }

    /**
     * Karana prevailing at the window start.
     */
    KaranaUnit karana(DayWindow window) {
        double phase = celestialModel.lunarPhase(window.getStartInstant());
        int number = Angles.unitNumber(phase, KARANA_SPAN_DEGREES, KARANA_COUNT);
        return new KaranaUnit(number, nameResolver.resolve(NameCategory.KARANA, number));
    }

    private ElementUnit unit(LunarElement element, int number, Double endInstant, DayWindow window, boolean skipped) {
        return ElementUnit.builder()
                .category(element.category())
                .number(number)
                .name(nameResolver.resolve(element.category(), number))
                .endInstant(endInstant)
                .endTime(endInstant == null ? null : window.localClock(endInstant))
                .skipped(skipped)
                .build();
    }

    private double zodiacSun(double julianInstant) {
        return zodiacPolicy.toZodiacLongitude(celestialModel.solarLongitude(julianInstant), julianInstant, celestialModel);
    }

    private double zodiacMoon(double julianInstant) {
        return zodiacPolicy.toZodiacLongitude(celestialModel.lunarLongitude(julianInstant), julianInstant, celestialModel);
    }
}
