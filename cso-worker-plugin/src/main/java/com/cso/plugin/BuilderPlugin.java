package com.cso.plugin;

import com.cso.executioncontext.ExecutionContext;

/**
 * Produces one {@link Artifact} per invocation. Implementations must fail fast when the
 * context is already cancelled and must observe cancellation while building.
 */
public interface BuilderPlugin extends PluginComponent {

    Artifact build(ExecutionContext ctx) throws Exception;
}
