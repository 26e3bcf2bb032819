package com.cso.plugin.noop;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.ContractType;
import com.cso.plugin.PluginOptions;

import java.time.Instant;
import java.util.Map;

/**
 * Builder that does nothing and returns a fixed {@code noop:latest} artifact. Used by tests and
 * by tasks that only need the deploy phase.
 */
@CsoPlugin(
        name = NoopPluginProvider.NAME,
        capability = ContractType.BUILDER,
        description = "Returns an empty artifact immediately",
        options = { @CsoPluginOption(name = "message") }
)
public final class NoopBuilder implements BuilderPlugin {

    private String message = "";

    @Override
    public void configure(Map<String, Object> options) {
        this.message = PluginOptions.getString(options, "message", "");
    }

    @Override
    public Artifact build(ExecutionContext ctx) throws Exception {
        ctx.throwIfCancelled();
        return Artifact.builder("noop-artifact")
                .image("noop")
                .tag("latest")
                .label(Artifact.METADATA_BUILDER, NoopPluginProvider.NAME)
                .metadata(Artifact.METADATA_BUILDER, NoopPluginProvider.NAME)
                .metadata("message", message)
                .buildTime(Instant.now())
                .build();
    }
}
