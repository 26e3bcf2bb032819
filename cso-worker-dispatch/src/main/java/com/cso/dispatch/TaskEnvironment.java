package com.cso.dispatch;

import java.util.Map;
import java.util.Objects;

/** Read-only view of the variables a task is handed by the scheduler. */
public final class TaskEnvironment {

    private final Map<String, String> values;

    private TaskEnvironment(Map<String, String> values) {
        this.values = values;
    }

    public static TaskEnvironment fromSystem() {
        return new TaskEnvironment(System.getenv());
    }

    public static TaskEnvironment of(Map<String, String> values) {
        return new TaskEnvironment(Map.copyOf(Objects.requireNonNull(values, "values")));
    }

    /** @return the value, or null when unset */
    public String get(String name) {
        return values.get(name);
    }
}
