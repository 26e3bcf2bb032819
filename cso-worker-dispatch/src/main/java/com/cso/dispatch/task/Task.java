package com.cso.dispatch.task;

import java.util.Objects;

/**
 * One dispatched task: its kind and parsed parameters. Built once per process invocation.
 */
public final class Task {

    private final TaskType type;
    private final TaskParams params;

    public Task(TaskType type, TaskParams params) {
        this.type = Objects.requireNonNull(type, "type");
        this.params = Objects.requireNonNull(params, "params");
    }

    public TaskType getType() {
        return type;
    }

    public TaskParams getParams() {
        return params;
    }

    /** Deployment parameters when the task is a deployment, otherwise null. */
    public BaseDeploymentParams getDeploymentParams() {
        return params instanceof BaseDeploymentParams ? (BaseDeploymentParams) params : null;
    }

    @Override
    public String toString() {
        return "Task{type=" + type + ", params=" + params.getClass().getSimpleName() + "}";
    }
}
