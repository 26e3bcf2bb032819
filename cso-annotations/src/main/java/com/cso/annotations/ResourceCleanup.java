package com.cso.annotations;

/**
 * Contract for resource cleanup when the worker process is about to exit.
 * Plugin providers that hold process-wide resources (HTTP client executors, registry logins)
 * implement this and release them in {@link #onExit()}. The worker invokes
 * {@code onExit()} on every registered provider after the dispatch run, before the process exits.
 */
public interface ResourceCleanup {

    /**
     * Called once when the worker is shutting down. Exceptions should be logged
     * and not rethrown so other components still get a chance to clean up.
     */
    void onExit();
}
