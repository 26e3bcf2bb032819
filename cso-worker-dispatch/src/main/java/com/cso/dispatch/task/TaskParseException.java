package com.cso.dispatch.task;

/**
 * Thrown when the task kind or its parameters are missing or malformed. Never retried by the
 * worker; the process exits with the parse error code.
 */
public class TaskParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public TaskParseException(String message) {
        super(message);
    }

    public TaskParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
