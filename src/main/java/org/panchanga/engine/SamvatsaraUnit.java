package org.panchanga.engine;

import lombok.Value;

/**
 * Position in the sixty-year cycle; {@code 1 = Prabhava}.
 */
@Value
public class SamvatsaraUnit {
    int number;
    String name;
}
