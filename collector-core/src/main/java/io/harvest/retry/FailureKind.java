package io.harvest.retry;

/**
 * Why an attempt did not produce a usable answer.
 */
public enum FailureKind {
    /** The request threw or the transport failed. */
    TRANSIENT_ERROR,
    /** The upstream answered with no rows. */
    EMPTY_RESPONSE,
    /** The upstream answered with coarser data than requested. */
    COARSE_GRANULARITY
}
