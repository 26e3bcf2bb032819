package com.cso.executioncontext;

/**
 * Thrown from a blocking operation that observed a cancelled {@link ExecutionContext}.
 */
public class ExecutionCancelledException extends Exception {

    private static final long serialVersionUID = 1L;

    private final CancellationCause cause;

    public ExecutionCancelledException(CancellationCause cause) {
        super(cause == CancellationCause.DEADLINE_EXCEEDED ? "context deadline exceeded" : "context cancelled");
        this.cause = cause;
    }

    public CancellationCause getCancellationCause() {
        return cause;
    }

    public boolean isDeadlineExceeded() {
        return cause == CancellationCause.DEADLINE_EXCEEDED;
    }
}
