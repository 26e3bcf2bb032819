package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal status in {@link BuildLogEndPayload}. */
public enum LogEndStatus {
    SUCCESS("success"),
    FAILED("failed"),
    TIMEOUT("timeout");

    private final String wireName;

    LogEndStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
