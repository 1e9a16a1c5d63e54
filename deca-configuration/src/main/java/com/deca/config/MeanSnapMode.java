package com.deca.config;

/**
 * How a value mass point is pulled into the admissible mean range of a triangular
 * distribution before its moments are computed.
 */
public enum MeanSnapMode {
    /** Use the mass point literally as the mean. */
    NONE,
    /** Clamp the mean into [(2lo+hi)/3, (lo+2hi)/3]. */
    FULL,
    /** Clamp, then move halfway back toward the unclamped mass point. */
    HALF
}
