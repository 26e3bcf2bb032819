package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonValue;

/** Source of a deployment as reported in lifecycle events. */
public enum DeploymentType {
    GIT_REPO("git_repo"),
    IMAGE("image");

    private final String wireName;

    DeploymentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
