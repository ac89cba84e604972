package com.scbr.engine;

/**
 * Error taxonomy reported on a round result. Only UNAVAILABLE reasoning escapes as an exception.
 */
public enum SpiralErrorKind {
    SCOPE_REJECTED,
    SECURITY_REJECTED,
    RETRIEVAL_EMPTY,
    STAGE_DEGRADED,
    STAGE_TIMEOUT,
    CONVERGENCE_FORCED
}
