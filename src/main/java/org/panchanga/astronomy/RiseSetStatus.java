package org.panchanga.astronomy;

/**
 * Outcome class of the sunrise hour-angle equation.
 */
public enum RiseSetStatus {
    /** The sun crosses the horizon twice on this day. */
    NORMAL,
    /** Polar night: {@code cos H > 1}, the sun stays below the horizon. */
    NEVER_RISES,
    /** Polar day: {@code cos H < -1}, the sun stays above the horizon. */
    NEVER_SETS
}
