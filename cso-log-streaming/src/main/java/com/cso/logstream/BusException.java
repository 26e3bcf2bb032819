package com.cso.logstream;

/**
 * Thrown when the message bus cannot be reached or a publish is not acknowledged.
 */
public class BusException extends Exception {

    private static final long serialVersionUID = 1L;

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
