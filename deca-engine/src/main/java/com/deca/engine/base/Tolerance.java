package com.deca.engine.base;

/**
 * Numeric tolerances shared by propagation, evaluation and moment code.
 */
public final class Tolerance {

    /** Consistency and comparison tolerance. */
    public static final double EPS = 1e-8;

    /** Normalization tolerance and minimum width of an active warp dimension. */
    public static final double EPS100 = 1e-6;

    /** Sentinel for an unset midpoint entry. */
    public static final double UNSET = -1.0;

    /** Sentinel in a midpoint box argument meaning "keep the current entry". */
    public static final double KEEP = -2.0;

    private Tolerance() {
    }
}
