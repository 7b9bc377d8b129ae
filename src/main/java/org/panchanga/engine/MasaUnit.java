package org.panchanga.engine;

import lombok.Value;

/**
 * Amanta lunar month containing the observed sunrise.
 */
@Value
public class MasaUnit {
    /** {@code 1 = Chaitra .. 12 = Phalguna}. */
    int number;
    String name;
    /** Whether no solar sign change happens between the bracketing new moons. */
    boolean leapMonth;
}
