package com.cso.dispatch;

/** Process exit status of one dispatch run. */
public enum ExitCode {
    SUCCESS(0),
    RUNTIME_ERROR(1),
    PARSE_ERROR(2),
    VALIDATION_ERROR(3),
    TIMEOUT(4);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
