package com.cso.plugin;

/**
 * Thrown when an external tool (docker, git, gh, go, ...) exits non-zero.
 */
public class CommandFailedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int exitCode;
    private final String output;

    public CommandFailedException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    public int getExitCode() {
        return exitCode;
    }

    /** Captured tail of the tool's combined output. */
    public String getOutput() {
        return output;
    }
}
