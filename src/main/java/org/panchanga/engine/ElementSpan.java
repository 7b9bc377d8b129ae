package org.panchanga.engine;

import lombok.Value;

/**
 * Prevailing unit at sunrise and, when one was skipped, the unit that began and ended inside the day.
 */
@Value
class ElementSpan {
    ElementUnit primary;
    ElementUnit skipped;
}
