package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which process stream a build log line came from. */
public enum LogOutput {
    STDOUT("stdout"),
    STDERR("stderr");

    private final String wireName;

    LogOutput(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
