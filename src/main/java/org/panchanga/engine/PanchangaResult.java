package org.panchanga.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.panchanga.astronomy.RiseSetStatus;
import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.CivilDate;
import org.panchanga.core.time.ClockTime;

import java.util.List;
import java.util.Optional;

/**
 * Client-facing composite almanac for one civil date and location.
 *
 * <p>Times are local clock readings at the location's fixed UTC offset. When the sun does not
 * rise or set, {@code sunrise} and {@code sunset} are absent and {@code riseSetStatus} says why.</p>
 */
@Value
@Builder
public class PanchangaResult {
    CivilDate date;
    GeoLocation location;

    ElementUnit tithi;
    ElementUnit nakshatra;
    ElementUnit yoga;
    KaranaUnit karana;
    VaraUnit vara;
    MasaUnit masa;
    SamvatsaraUnit samvatsara;
    RituUnit ritu;

    /** Unit that began and ended between the two sunrises, when one was skipped. */
    ElementUnit additionalTithi;
    ElementUnit additionalNakshatra;
    ElementUnit additionalYoga;

    ClockTime sunrise;
    ClockTime sunset;
    ClockTime moonrise;
    ClockTime moonset;
    RiseSetStatus riseSetStatus;
    double dayDurationHours;

    /** Sub-results that were unavailable or computed with a fallback. */
    @Singular
    List<ElementDiagnostic> diagnostics;

    public Optional<MasaUnit> getMasa() {
        return Optional.ofNullable(masa);
    }

    public Optional<SamvatsaraUnit> getSamvatsara() {
        return Optional.ofNullable(samvatsara);
    }

    public Optional<RituUnit> getRitu() {
        return Optional.ofNullable(ritu);
    }

    public Optional<ElementUnit> getAdditionalTithi() {
        return Optional.ofNullable(additionalTithi);
    }

    public Optional<ElementUnit> getAdditionalNakshatra() {
        return Optional.ofNullable(additionalNakshatra);
    }

    public Optional<ElementUnit> getAdditionalYoga() {
        return Optional.ofNullable(additionalYoga);
    }

    public Optional<ClockTime> getSunrise() {
        return Optional.ofNullable(sunrise);
    }

    public Optional<ClockTime> getSunset() {
        return Optional.ofNullable(sunset);
    }

    public Optional<ClockTime> getMoonrise() {
        return Optional.ofNullable(moonrise);
    }

    public Optional<ClockTime> getMoonset() {
        return Optional.ofNullable(moonset);
    }
}
