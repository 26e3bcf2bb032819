package com.cso.executioncontext;

/** Why an {@link ExecutionContext} was cancelled. */
public enum CancellationCause {
    /** The fixed task deadline elapsed. */
    DEADLINE_EXCEEDED,
    /** Cancelled explicitly (e.g. controller shutdown). */
    CANCELLED
}
