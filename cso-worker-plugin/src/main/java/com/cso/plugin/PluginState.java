package com.cso.plugin;

/**
 * Lifecycle of one build/push invocation:
 * CONFIGURED → BUILDING → (BUILT | BUILD_FAILED | BUILD_CANCELLED);
 * BUILT → PUSHING → (PUSHED | PUSH_FAILED | PUSH_CANCELLED).
 */
public enum PluginState {
    CONFIGURED,
    BUILDING,
    BUILT,
    BUILD_FAILED,
    BUILD_CANCELLED,
    PUSHING,
    PUSHED,
    PUSH_FAILED,
    PUSH_CANCELLED;

    /** Whether no further transition is possible. */
    public boolean isTerminal() {
        return this == BUILD_FAILED || this == BUILD_CANCELLED
                || this == PUSHED || this == PUSH_FAILED || this == PUSH_CANCELLED;
    }
}
