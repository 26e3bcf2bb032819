package com.cso.plugin;

/** Exit code and captured output of one external command. */
public final class CommandResult {

    private final int exitCode;
    private final String stdout;
    private final String stderr;

    public CommandResult(int exitCode, String stdout, String stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /** Captured stdout (tail, bounded). */
    public String getStdout() {
        return stdout;
    }

    /** Captured stderr (tail, bounded). */
    public String getStderr() {
        return stderr;
    }
}
