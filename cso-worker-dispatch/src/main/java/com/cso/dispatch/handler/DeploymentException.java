package com.cso.dispatch.handler;

/** A deployment phase failed; the message names the phase and the last underlying error. */
public class DeploymentException extends Exception {

    private static final long serialVersionUID = 1L;

    public DeploymentException(String message) {
        super(message);
    }

    public DeploymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
