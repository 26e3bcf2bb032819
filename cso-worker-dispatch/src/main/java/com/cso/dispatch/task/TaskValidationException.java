package com.cso.dispatch.task;

/**
 * Thrown when parsed parameters do not have the shape the dispatched handler expects. Signals a
 * caller bug rather than bad input; never retried.
 */
public class TaskValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    public TaskValidationException(String message) {
        super(message);
    }
}
