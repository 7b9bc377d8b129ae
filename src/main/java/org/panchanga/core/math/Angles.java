package org.panchanga.core.math;

import lombok.experimental.UtilityClass;

/**
 * Circular-degree helpers shared by the celestial model and the element engine.
 */
@UtilityClass
public final class Angles {
    public static final double FULL_CIRCLE = 360.0d;

    /**
     * Reduces an angle into {@code [0, 360)} via {@code ((x mod 360) + 360) mod 360}.
     *
     * <p>The final guard folds the {@code 360.0} that floating-point rounding can produce for tiny
     * negative inputs back to zero.</p>
     */
    public static double normalize(double degrees) {
        double normalized = ((degrees % FULL_CIRCLE) + FULL_CIRCLE) % FULL_CIRCLE;
        if (normalized >= FULL_CIRCLE) {
            return 0.0d;
        }
        return normalized;
    }

    /**
     * Returns the elongation {@code normalize(to - from)}.
     */
    public static double elongation(double fromDegrees, double toDegrees) {
        return normalize(toDegrees - fromDegrees);
    }

    /**
     * Maps an angle onto a 1-based unit of equal span.
     *
     * <p>Uses {@code ceil(angle / span)}; a result of zero means the exact end of the last unit (for
     * tithi, phase 0 is the end of the 30th, not the start of the 1st) and is remapped to
     * {@code unitCount}. The angle is normalized first, so 360 behaves like 0.</p>
     *
     * @param degrees angle in degrees (normalized here).
     * @param spanDegrees angular width of one unit.
     * @param unitCount number of units in the full circle.
     * @return unit number in {@code [1, unitCount]}.
     */
    public static int unitNumber(double degrees, double spanDegrees, int unitCount) {
        if (!(spanDegrees > 0.0d)) {
            throw new IllegalArgumentException("spanDegrees must be > 0, got " + spanDegrees);
        }
        if (unitCount <= 0) {
            throw new IllegalArgumentException("unitCount must be > 0, got " + unitCount);
        }
        int number = (int) Math.ceil(normalize(degrees) / spanDegrees);
        if (number <= 0) {
            return unitCount;
        }
        // ceil can overshoot by one when the quotient rounds up at the top of the circle
        return Math.min(number, unitCount);
    }

    /**
     * Returns the angle that closes unit {@code number}, normalized into {@code [0, 360)}.
     */
    public static double unitEndAngle(int number, double spanDegrees) {
        return normalize(number * spanDegrees);
    }

    /**
     * Returns the forward step count from unit {@code from} to unit {@code to} on a cycle.
     */
    public static int forwardSteps(int from, int to, int unitCount) {
        return Math.floorMod(to - from, unitCount);
    }

    /**
     * Returns the unit following {@code number} on a 1-based cycle.
     */
    public static int nextUnit(int number, int unitCount) {
        return number % unitCount + 1;
    }
}
