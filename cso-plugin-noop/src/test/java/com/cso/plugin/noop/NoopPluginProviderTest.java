package com.cso.plugin.noop;

import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.Deployment;
import com.cso.plugin.RegistryRef;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NoopPluginProviderTest {

    private final NoopPluginProvider provider = new NoopPluginProvider();

    @Test
    void build_returnsFixedArtifact() throws Exception {
        BuilderPlugin builder = provider.createBuilder();
        builder.configure(Map.of("message", "hello"));
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            Artifact artifact = builder.build(ctx);

            assertEquals("noop-artifact", artifact.getId());
            assertEquals("noop:latest", artifact.getImageReference());
            assertEquals("hello", artifact.getMetadata().get("message"));
        }
    }

    @Test
    void pushAndDeploy_reportFixedResults() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            Artifact artifact = provider.createBuilder().build(ctx);

            RegistryRef ref = provider.createRegistry().push(ctx, artifact);
            Deployment deployment = provider.createPlatform().deploy(ctx, artifact);

            assertEquals("noop-registry/noop:latest", ref.getFullImage());
            assertEquals(Deployment.State.RUNNING, deployment.getState());
            assertEquals("noop-artifact", deployment.getArtifactId());
        }
    }

    @Test
    void build_failsFastOnExpiredContext() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            ctx.cancel();

            assertThrows(ExecutionCancelledException.class, () -> provider.createBuilder().build(ctx));
        }
    }

    @Test
    void components_areFreshPerCall() {
        assertNotSame(provider.createBuilder(), provider.createBuilder());
    }
}
