package org.panchanga.engine;

import lombok.Value;

/**
 * Season, two lunar months each; {@code 1 = Vasanta .. 6 = Shishira}.
 */
@Value
public class RituUnit {
    int number;
    String name;
}
