package org.panchanga.engine;

import lombok.Value;

/**
 * Weekday of the civil date; {@code 1 = Sunday .. 7 = Saturday}.
 */
@Value
public class VaraUnit {
    int number;
    String name;
}
