package org.panchanga.engine;

import lombok.Builder;
import org.panchanga.astronomy.CelestialModel;
import org.panchanga.astronomy.HorizonEvent;
import org.panchanga.astronomy.RiseSetResult;
import org.panchanga.astronomy.RiseSetSolver;
import org.panchanga.astronomy.TruncatedSeriesCelestialModel;
import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.CivilDate;
import org.panchanga.core.time.JulianDay;
import org.panchanga.names.NameCategory;
import org.panchanga.names.NameResolver;
import org.panchanga.names.TableNameResolver;
import org.panchanga.traits.zodiac.ZodiacPolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Panchanga engine facade.
 *
 * <p>Holds only immutable collaborators, so one instance can serve any number of threads. Inputs
 * are validated before the celestial model is consulted. In the composite result a failed boundary
 * search only removes the affected end time (or the lunation-derived units) and is recorded as an
 * {@link ElementDiagnostic}; per-element entry points surface it as a {@link PanchangaException}.</p>
 */
public final class PanchangaCore implements PanchangaService {
    public static final String REASON_DATE_REQUIRED = "P_DATE_REQUIRED";
    public static final String REASON_LOCATION_REQUIRED = "P_LOCATION_REQUIRED";
    public static final String REASON_INVALID_DATE = "P_INVALID_DATE";
    public static final String REASON_INVALID_LOCATION = "P_INVALID_LOCATION";
    public static final String REASON_BOUNDARY_SEARCH_FAILED = "P_BOUNDARY_SEARCH_FAILED";
    public static final String REASON_CONFIG_REQUIRED = "P_CONFIG_REQUIRED";
    public static final String REASON_UNKNOWN_ZODIAC_POLICY = "P_UNKNOWN_ZODIAC_POLICY";
    public static final String REASON_SUNRISE_UNAVAILABLE = "P_SUNRISE_UNAVAILABLE";
    public static final String REASON_MOON_MODEL_UNAVAILABLE = "P_MOON_MODEL_UNAVAILABLE";

    public static final String DEFAULT_ZODIAC_POLICY_ID = ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI;

    private static final Logger LOGGER = LoggerFactory.getLogger(PanchangaCore.class);

    private final CelestialModel celestialModel;
    private final NameResolver nameResolver;
    private final PanchangaRuntimeBinder.Binding binding;
    private final RiseSetSolver riseSetSolver;
    private final LunarElementCalculator lunarElementCalculator;
    private final LunationCalculator lunationCalculator;

    /**
     * Creates the engine facade and binds the runtime config once.
     *
     * @param celestialModel optional position model (defaults to the truncated series model).
     * @param nameResolver optional name resolver (defaults to the bundled name table).
     * @param runtimeConfig optional runtime config (defaults to sidereal Lahiri).
     * @param zodiacPolicyRegistry optional policy registry (defaults to built-ins).
     * @throws PanchangaException when the runtime config cannot be bound.
     */
    @Builder
    public PanchangaCore(
            CelestialModel celestialModel,
            NameResolver nameResolver,
            PanchangaRuntimeConfig runtimeConfig,
            ZodiacPolicyRegistry zodiacPolicyRegistry
    ) {
        this.celestialModel = celestialModel == null ? TruncatedSeriesCelestialModel.instance() : celestialModel;
        this.nameResolver = nameResolver == null ? TableNameResolver.defaults() : nameResolver;
        this.binding = new PanchangaRuntimeBinder().bind(
                runtimeConfig == null ? PanchangaRuntimeConfig.defaults() : runtimeConfig,
                zodiacPolicyRegistry == null ? ZodiacPolicyRegistry.defaultRegistry() : zodiacPolicyRegistry
        );

        BoundarySearch boundarySearch = BoundarySearch.defaults();
        this.riseSetSolver = new RiseSetSolver(this.celestialModel);
        this.lunarElementCalculator = new LunarElementCalculator(
                this.celestialModel, binding.getZodiacPolicy(), this.nameResolver, boundarySearch);
        this.lunationCalculator = new LunationCalculator(
                this.celestialModel, binding.getZodiacPolicy(), this.nameResolver, boundarySearch);
        LOGGER.debug("Panchanga engine bound: model={}, zodiacPolicy={}",
                this.celestialModel.id(), binding.getZodiacPolicyId());
    }

    /**
     * Returns the bound runtime binding.
     */
    public PanchangaRuntimeBinder.Binding binding() {
        return binding;
    }

    @Override
    public PanchangaResult computePanchanga(CivilDate date, GeoLocation location) {
        validate(date, location);
        long julianDayNumber = JulianDay.toJulianDayNumber(date);
        DayWindow window = DayWindow.resolve(riseSetSolver, julianDayNumber, location);
        RiseSetResult riseSet = window.getRiseSet();

        PanchangaResult.PanchangaResultBuilder builder = PanchangaResult.builder()
                .date(date)
                .location(location)
                .riseSetStatus(riseSet.getStatus())
                .dayDurationHours(riseSet.getDayDurationHours())
                .sunrise(riseSet.getSunrise().map(HorizonEvent::localTime).orElse(null))
                .sunset(riseSet.getSunset().map(HorizonEvent::localTime).orElse(null));
        if (window.isAnchorFallback()) {
            diagnose(builder, null, REASON_SUNRISE_UNAVAILABLE, sunriseFallbackMessage(window));
        }

        ElementSpan tithi = spanOrPrevailing(LunarElement.TITHI, window, builder);
        ElementSpan nakshatra = spanOrPrevailing(LunarElement.NAKSHATRA, window, builder);
        ElementSpan yoga = spanOrPrevailing(LunarElement.YOGA, window, builder);
        builder.tithi(tithi.getPrimary())
                .additionalTithi(tithi.getSkipped())
                .nakshatra(nakshatra.getPrimary())
                .additionalNakshatra(nakshatra.getSkipped())
                .yoga(yoga.getPrimary())
                .additionalYoga(yoga.getSkipped())
                .karana(lunarElementCalculator.karana(window))
                .vara(vara(julianDayNumber));

        try {
            LunationCalculator.Lunation lunation = lunationCalculator.lunation(date, window.getStartInstant());
            builder.masa(lunation.getMasa())
                    .samvatsara(lunation.getSamvatsara())
                    .ritu(lunation.getRitu());
        } catch (BoundarySearch.BoundarySearchException ex) {
            LOGGER.warn("New moon search failed for {} at {}: [{}] {}", date, location, ex.reasonCode(), ex.getMessage());
            diagnose(builder, NameCategory.MASA, REASON_BOUNDARY_SEARCH_FAILED,
                    "masa, samvatsara and ritu unavailable: " + ex.getMessage());
        }

        riseSetSolver.moonrise(julianDayNumber, location)
                .ifPresent(event -> builder.moonrise(event.localTime()));
        riseSetSolver.moonset(julianDayNumber, location)
                .ifPresent(event -> builder.moonset(event.localTime()));
        if (Math.abs(location.getLatitude()) > RiseSetSolver.MOON_MODEL_LATITUDE_LIMIT_DEGREES) {
            diagnose(builder, null, REASON_MOON_MODEL_UNAVAILABLE,
                    "moonrise/moonset not modelled beyond latitude "
                            + RiseSetSolver.MOON_MODEL_LATITUDE_LIMIT_DEGREES);
        }

        PanchangaResult result = builder.build();
        LOGGER.debug("Computed panchanga for {} at {}: tithi={}, nakshatra={}, diagnostics={}",
                date, location, result.getTithi().getNumber(), result.getNakshatra().getNumber(),
                result.getDiagnostics().size());
        return result;
    }

    @Override
    public ElementUnit computeTithi(CivilDate date, GeoLocation location) {
        return computeElement(LunarElement.TITHI, date, location);
    }

    @Override
    public ElementUnit computeNakshatra(CivilDate date, GeoLocation location) {
        return computeElement(LunarElement.NAKSHATRA, date, location);
    }

    @Override
    public ElementUnit computeYoga(CivilDate date, GeoLocation location) {
        return computeElement(LunarElement.YOGA, date, location);
    }

    @Override
    public KaranaUnit computeKarana(CivilDate date, GeoLocation location) {
        validate(date, location);
        return lunarElementCalculator.karana(resolveWindow(date, location));
    }

    @Override
    public VaraUnit computeVara(CivilDate date) {
        validateDate(date);
        return vara(JulianDay.toJulianDayNumber(date));
    }

    @Override
    public MasaUnit computeMasa(CivilDate date, GeoLocation location) {
        validate(date, location);
        DayWindow window = resolveWindow(date, location);
        try {
            return lunationCalculator.lunation(date, window.getStartInstant()).getMasa();
        } catch (BoundarySearch.BoundarySearchException ex) {
            throw boundaryFailure(NameCategory.MASA, ex);
        }
    }

    private ElementUnit computeElement(LunarElement element, CivilDate date, GeoLocation location) {
        validate(date, location);
        DayWindow window = resolveWindow(date, location);
        try {
            return lunarElementCalculator.span(element, window).getPrimary();
        } catch (BoundarySearch.BoundarySearchException ex) {
            throw boundaryFailure(element.category(), ex);
        }
    }

    private ElementSpan spanOrPrevailing(LunarElement element, DayWindow window, PanchangaResult.PanchangaResultBuilder builder) {
        try {
            return lunarElementCalculator.span(element, window);
        } catch (BoundarySearch.BoundarySearchException ex) {
            LOGGER.warn("End time search failed for {} on JDN {}: [{}] {}",
                    element, window.getJulianDayNumber(), ex.reasonCode(), ex.getMessage());
            diagnose(builder, element.category(), REASON_BOUNDARY_SEARCH_FAILED,
                    element.category().displayName() + " end time unavailable: " + ex.getMessage());
            return new ElementSpan(lunarElementCalculator.prevailing(element, window), null);
        }
    }

    private DayWindow resolveWindow(CivilDate date, GeoLocation location) {
        return DayWindow.resolve(riseSetSolver, JulianDay.toJulianDayNumber(date), location);
    }

    private VaraUnit vara(long julianDayNumber) {
        int number = JulianDay.weekdayIndex(julianDayNumber) + 1;
        return new VaraUnit(number, nameResolver.resolve(NameCategory.VARA, number));
    }

    private static void diagnose(
            PanchangaResult.PanchangaResultBuilder builder,
            NameCategory category,
            String reasonCode,
            String message
    ) {
        builder.diagnostic(new ElementDiagnostic(category, reasonCode, message));
    }

    private static String sunriseFallbackMessage(DayWindow window) {
        if (!window.getRiseSet().isAvailable()) {
            return "sun does not cross the horizon on the observed date (" + window.getRiseSet().getStatus()
                    + "); day starts at local mean solar 06:00";
        }
        return "sun does not cross the horizon on the following date (" + window.getNextRiseSet().getStatus()
                + "); day ends at local mean solar 06:00";
    }

    private static PanchangaException boundaryFailure(NameCategory category, BoundarySearch.BoundarySearchException ex) {
        return new PanchangaException(
                REASON_BOUNDARY_SEARCH_FAILED,
                category.displayName() + " boundary search failed [" + ex.reasonCode() + "]: " + ex.getMessage(),
                ex
        );
    }

    private static void validate(CivilDate date, GeoLocation location) {
        validateDate(date);
        if (location == null) {
            throw new PanchangaException(REASON_LOCATION_REQUIRED, "location must be provided");
        }
        if (!location.isValid()) {
            throw new PanchangaException(
                    REASON_INVALID_LOCATION,
                    "location out of range: latitude=" + location.getLatitude()
                            + ", longitude=" + location.getLongitude()
                            + ", utcOffsetHours=" + location.getUtcOffsetHours()
            );
        }
    }

    private static void validateDate(CivilDate date) {
        if (date == null) {
            throw new PanchangaException(REASON_DATE_REQUIRED, "date must be provided");
        }
        if (!date.isValid()) {
            throw new PanchangaException(REASON_INVALID_DATE, "not a valid civil date: " + date);
        }
    }
}
