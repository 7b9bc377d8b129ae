package org.panchanga.app;

import org.panchanga.core.geo.GeoLocation;
import org.panchanga.core.time.CivilDate;
import org.panchanga.engine.ElementDiagnostic;
import org.panchanga.engine.ElementUnit;
import org.panchanga.engine.PanchangaCore;
import org.panchanga.engine.PanchangaResult;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Usage: {@code Main [yyyy-mm-dd [latitude longitude utcOffsetHours]]}. Defaults to today in
 * Bengaluru.</p>
 */
public class Main {
    private static final GeoLocation DEFAULT_LOCATION = GeoLocation.of(12.9716d, 77.5946d, 5.5d, "Bengaluru");

    /**
     * Prints the panchanga for one date and location.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        CivilDate date;
        GeoLocation location;
        try {
            date = args.length > 0 ? CivilDate.from(LocalDate.parse(args[0])) : CivilDate.from(LocalDate.now());
            location = args.length >= 4
                    ? GeoLocation.of(Double.parseDouble(args[1]), Double.parseDouble(args[2]), Double.parseDouble(args[3]))
                    : DEFAULT_LOCATION;
        } catch (DateTimeParseException | NumberFormatException ex) {
            System.err.println("Usage: Main [yyyy-mm-dd [latitude longitude utcOffsetHours]]: " + ex.getMessage());
            System.exit(2);
            return;
        }

        PanchangaResult result = PanchangaCore.builder().build().computePanchanga(date, location);
        System.out.printf("Panchanga for %s at %s%n", date, location.getName() == null ? location : location.getName());
        System.out.printf("  Sunrise    %s%n", result.getSunrise().map(Object::toString).orElse("-"));
        System.out.printf("  Sunset     %s%n", result.getSunset().map(Object::toString).orElse("-"));
        System.out.printf("  Moonrise   %s%n", result.getMoonrise().map(Object::toString).orElse("-"));
        System.out.printf("  Moonset    %s%n", result.getMoonset().map(Object::toString).orElse("-"));
        print("Tithi", result.getTithi());
        result.getAdditionalTithi().ifPresent(unit -> print("  + Tithi", unit));
        print("Nakshatra", result.getNakshatra());
        result.getAdditionalNakshatra().ifPresent(unit -> print("  + Naksh.", unit));
        print("Yoga", result.getYoga());
        result.getAdditionalYoga().ifPresent(unit -> print("  + Yoga", unit));
        System.out.printf("  Karana     %d %s%n", result.getKarana().getNumber(), result.getKarana().getName());
        System.out.printf("  Vara       %d %s%n", result.getVara().getNumber(), result.getVara().getName());
        result.getMasa().ifPresent(masa -> System.out.printf("  Masa       %d %s%s%n",
                masa.getNumber(), masa.getName(), masa.isLeapMonth() ? " (adhika)" : ""));
        result.getSamvatsara().ifPresent(year -> System.out.printf("  Samvatsara %d %s%n", year.getNumber(), year.getName()));
        result.getRitu().ifPresent(ritu -> System.out.printf("  Ritu       %d %s%n", ritu.getNumber(), ritu.getName()));
        for (ElementDiagnostic diagnostic : result.getDiagnostics()) {
            System.out.printf("  ! [%s] %s%n", diagnostic.getReasonCode(), diagnostic.getMessage());
        }
    }

    private static void print(String label, ElementUnit unit) {
        System.out.printf("  %-10s %d %s until %s%n",
                label, unit.getNumber(), unit.getName(),
                unit.getEndTime().map(Object::toString).orElse("next sunrise"));
    }
}
