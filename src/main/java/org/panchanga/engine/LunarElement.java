package org.panchanga.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.panchanga.names.NameCategory;

/**
 * Elements tracked with end times across the observed day.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
enum LunarElement {
    TITHI(NameCategory.TITHI, 12.0d, 30),
    NAKSHATRA(NameCategory.NAKSHATRA, 360.0d / 27.0d, 27),
    YOGA(NameCategory.YOGA, 360.0d / 27.0d, 27);

    private final NameCategory category;
    private final double spanDegrees;
    private final int unitCount;
}
