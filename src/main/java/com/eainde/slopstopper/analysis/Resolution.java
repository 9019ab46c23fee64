package com.eainde.slopstopper.analysis;

/**
 * How a selected record left the batch.
 */
public enum Resolution {
    ANALYZED,
    TRANSPORT_ERROR,
    SCHEMA_VIOLATION,
    UNKNOWN_MODEL_PRICING,
    UNEXPECTED_ERROR,
    /** Not PENDING and not a stale claim: held by another worker, or already resolved. */
    NOT_CLAIMED,
    NOT_FOUND,
    /** Claim was taken by the staleness sweep of another run before this one resolved. */
    CLAIM_LOST,
    /** Interrupted; the record stays IN_PROGRESS until the staleness sweep reclaims it. */
    CANCELLED;

    public boolean isError() {
        return this == TRANSPORT_ERROR || this == SCHEMA_VIOLATION
                || this == UNKNOWN_MODEL_PRICING || this == UNEXPECTED_ERROR;
    }
}
