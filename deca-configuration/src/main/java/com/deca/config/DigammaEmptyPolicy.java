package com.deca.config;

/**
 * What a digamma evaluation does when the comparison set is empty.
 */
public enum DigammaEmptyPolicy {
    /** Answer with the plain psi bounds of the alternative. */
    DEGRADE_TO_PSI,
    /** Reject the call as an input error. */
    REJECT
}
