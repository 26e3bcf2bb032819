package com.cso.plugin;

import com.cso.executioncontext.ExecutionContext;

/**
 * Publishes one {@link Artifact} and returns where it landed.
 */
public interface RegistryPlugin extends PluginComponent {

    RegistryRef push(ExecutionContext ctx, Artifact artifact) throws Exception;
}
