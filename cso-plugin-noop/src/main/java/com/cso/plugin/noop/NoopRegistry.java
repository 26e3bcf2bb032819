package com.cso.plugin.noop;

import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.RegistryPlugin;
import com.cso.plugin.RegistryRef;

import java.time.Instant;
import java.util.Map;

/** Registry that pushes nothing and reports {@code noop-registry/noop:latest}. */
public final class NoopRegistry implements RegistryPlugin {

    @Override
    public void configure(Map<String, Object> options) {
    }

    @Override
    public RegistryRef push(ExecutionContext ctx, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        return new RegistryRef("noop-registry", "noop", "latest", null, "noop-registry/noop:latest", Instant.now());
    }
}
