package org.panchanga.names;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Panchanga element categories known to the name tables.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum NameCategory {
    MASA("Masa", "masa"),
    TITHI("Tithi", "tithi"),
    NAKSHATRA("Nakshatra", "nakshatra"),
    YOGA("Yoga", "yoga"),
    KARANA("Karana", "karana"),
    VARA("Vara", "vara"),
    SAMVATSARA("Samvatsara", "samvatsara"),
    RITU("Ritu", "ritu");

    /** Prefix of the deterministic fallback name, for example {@code Tithi-999}. */
    private final String displayName;
    /** Object key of this category in the JSON name table. */
    private final String tableKey;

    /**
     * Returns the deterministic fallback name {@code <Category>-<index>}.
     */
    public String fallbackName(int index) {
        return displayName + "-" + index;
    }
}
