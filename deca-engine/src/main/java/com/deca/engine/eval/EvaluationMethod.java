package com.deca.engine.eval;

/**
 * Expected-value evaluation methods.
 */
public enum EvaluationMethod {
    /** Point estimate from the probability and value mass points. */
    OMEGA,
    /** Interval of the alternative's expected value: extremal EV under the value hull, omega as middle. */
    PSI,
    /** Difference between two alternatives. */
    DELTA,
    /** Difference between one alternative and the mean of all others. */
    GAMMA,
    /** Difference between one alternative and the mean of a chosen subset. */
    DIGAMMA
}
