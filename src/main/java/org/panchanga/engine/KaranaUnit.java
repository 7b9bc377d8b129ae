package org.panchanga.engine;

import lombok.Value;

/**
 * Half-tithi prevailing at sunrise, numbered 1..60 through the lunation.
 */
@Value
public class KaranaUnit {
    int number;
    String name;
}
