package org.panchanga.engine;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.panchanga.core.math.Angles;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Bracketed bisection for the instant a monotonically advancing angle reaches a target.
 *
 * <p>The angle is unwrapped relative to its value at the window start, so the window must be short
 * enough that the angle advances by less than a full circle across it. Iteration count and tolerance
 * are fixed, which keeps results deterministic and the loop bounded.</p>
 */
final class BoundarySearch {
    static final String REASON_NOT_BRACKETED = "BOUNDARY_NOT_BRACKETED";
    static final String REASON_NON_FINITE_ANGLE = "BOUNDARY_NON_FINITE_ANGLE";
    static final String REASON_EMPTY_WINDOW = "BOUNDARY_EMPTY_WINDOW";

    static final int MAX_ITERATIONS = 64;
    static final double TOLERANCE_DAYS = 1.0e-7d;

    /**
     * Default search instance.
     */
    static BoundarySearch defaults() {
        return new BoundarySearch();
    }

    /**
     * Finds the first instant in {@code [start, end]} where {@code angle} reaches {@code targetDegrees}.
     *
     * @param angle monotonically advancing angle function of a Julian instant.
     * @param start window start instant.
     * @param end window end instant.
     * @param targetDegrees target angle in degrees.
     * @return crossing instant, within {@link #TOLERANCE_DAYS} after the true crossing.
     * @throws BoundarySearchException when the window does not bracket the target.
     */
    double findCrossing(DoubleUnaryOperator angle, double start, double end, double targetDegrees) {
        Objects.requireNonNull(angle, "angle");
        if (!(end > start)) {
            throw new BoundarySearchException(
                    REASON_EMPTY_WINDOW,
                    "search window must be non-empty, got [" + start + ", " + end + "]"
            );
        }
        double base = finiteAngle(angle, start);
        double required = Angles.elongation(base, targetDegrees);
        if (required == 0.0d) {
            return start;
        }
        double reached = Angles.elongation(base, finiteAngle(angle, end));
        if (reached < required) {
            throw new BoundarySearchException(
                    REASON_NOT_BRACKETED,
                    "angle advances " + reached + " deg over [" + start + ", " + end
                            + "] but target " + targetDegrees + " needs " + required
            );
        }

        double lo = start;
        double hi = end;
        for (int i = 0; i < MAX_ITERATIONS && hi - lo > TOLERANCE_DAYS; i++) {
            double mid = 0.5d * (lo + hi);
            if (Angles.elongation(base, finiteAngle(angle, mid)) >= required) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        return hi;
    }

    private static double finiteAngle(DoubleUnaryOperator angle, double instant) {
        double value = angle.applyAsDouble(instant);
        if (!Double.isFinite(value)) {
            throw new BoundarySearchException(
                    REASON_NON_FINITE_ANGLE,
                    "angle must be finite, got " + value + " at " + instant
            );
        }
        return value;
    }

    /**
     * Deterministic exception for a violated monotone-advance assumption.
     */
    @Getter
    @Accessors(fluent = true)
    static final class BoundarySearchException extends RuntimeException {
        private final String reasonCode;

        BoundarySearchException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
