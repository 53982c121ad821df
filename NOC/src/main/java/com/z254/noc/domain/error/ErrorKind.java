package com.z254.noc.domain.error;

/**
 * Failure categories of the correlation and incident pipeline.
 * <p>
 * Only {@link #INVALID_INPUT} and uncaught top-level failures end a pipeline run
 * with an error status; every other kind degrades locally.
 */
public enum ErrorKind {

    /** Malformed event or arguments. Fails fast, never retried. */
    INVALID_INPUT,

    /** Snapshot, history or time-series source failed. Degrades to empty data. */
    UPSTREAM_UNAVAILABLE,

    /** Decision call failed. Group gets root cause "unknown" and confidence 0.0. */
    DECISION_UNAVAILABLE,

    /** One group, metric, action or channel failed. Isolated to that item. */
    PARTIAL_STAGE_FAILURE
}
