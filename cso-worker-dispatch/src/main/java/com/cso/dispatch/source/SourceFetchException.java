package com.cso.dispatch.source;

/** Thrown when a deployment's source cannot be cloned, downloaded or extracted. */
public class SourceFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
