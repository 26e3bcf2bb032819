package com.cso.plugin;

import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginInvokerTest {

    private static TestPlugins.FakeBuilder builder() {
        TestPlugins.FakeBuilder builder = new TestPlugins.FakeBuilder();
        builder.configure(Map.of("image", "web", "tag", "v1"));
        return builder;
    }

    @Test
    void buildThenPush_reachesPushed() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            PluginInvoker invoker = new PluginInvoker(ctx);
            assertEquals(PluginState.CONFIGURED, invoker.getState());

            Artifact artifact = invoker.build("fake", builder());
            assertEquals(PluginState.BUILT, invoker.getState());
            assertFalse(invoker.getState().isTerminal());

            RegistryRef ref = invoker.push("fake", new TestPlugins.FakeRegistry(), artifact);
            assertEquals(PluginState.PUSHED, invoker.getState());
            assertTrue(invoker.getState().isTerminal());
            assertEquals("registry.test/web:v1", ref.getFullImage());
        }
    }

    @Test
    void build_failureMovesToBuildFailed() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            PluginInvoker invoker = new PluginInvoker(ctx);
            TestPlugins.FakeBuilder failing = builder();
            failing.failure = new IOException("docker daemon unreachable");

            assertThrows(IOException.class, () -> invoker.build("fake", failing));
            assertEquals(PluginState.BUILD_FAILED, invoker.getState());
        }
    }

    @Test
    void build_onCancelledContextFailsFastWithoutInvokingBuilder() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            ctx.cancel();
            PluginInvoker invoker = new PluginInvoker(ctx);
            int before = TestPlugins.FakeBuilder.BUILDS.get();

            assertThrows(ExecutionCancelledException.class, () -> invoker.build("fake", builder()));
            assertEquals(PluginState.BUILD_CANCELLED, invoker.getState());
            assertEquals(before, TestPlugins.FakeBuilder.BUILDS.get());
        }
    }

    @Test
    void push_beforeBuildIsRejected() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            PluginInvoker invoker = new PluginInvoker(ctx);
            Artifact artifact = Artifact.builder("a").image("web").build();

            assertThrows(IllegalStateException.class,
                    () -> invoker.push("fake", new TestPlugins.FakeRegistry(), artifact));
        }
    }

    @Test
    void push_onCancelledContextMovesToPushCancelled() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            PluginInvoker invoker = new PluginInvoker(ctx);
            Artifact artifact = invoker.build("fake", builder());
            ctx.cancel();

            assertThrows(ExecutionCancelledException.class,
                    () -> invoker.push("fake", new TestPlugins.FakeRegistry(), artifact));
            assertEquals(PluginState.PUSH_CANCELLED, invoker.getState());
        }
    }
}
