package org.panchanga.engine;

import lombok.Value;
import org.panchanga.names.NameCategory;

/**
 * Record of one composite sub-result that was unavailable or degraded.
 */
@Value
public class ElementDiagnostic {
    /** Affected category, or {@code null} for day-level conditions such as the sunrise anchor. */
    NameCategory category;
    String reasonCode;
    String message;
}
