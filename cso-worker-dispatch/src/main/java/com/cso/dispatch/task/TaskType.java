package com.cso.dispatch.task;

import java.util.Arrays;

/** Kind of dispatched task, as given in {@code NOMAD_META_TASK}. */
public enum TaskType {
    DEPLOY_REPOSITORY("deploy-repository"),
    REDEPLOY_REPOSITORY("redeploy-repository"),
    DEPLOY_IMAGE("deploy-image"),
    DESTROY_JOB("destroy-job-pack");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the task type for the wire name, or null when it is not known
     */
    public static TaskType fromWireName(String wireName) {
        if (wireName == null) return null;
        String trimmed = wireName.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(trimmed))
                .findFirst()
                .orElse(null);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
