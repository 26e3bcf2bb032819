package com.cso.plugin;

import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Drives one build → push invocation through {@link PluginState}. Checks the execution context
 * before each step, measures every step at the execution boundary and records it in
 * {@link DispatchMetrics}. One invoker per invocation; not reusable.
 */
public final class PluginInvoker {

    private static final Logger log = LoggerFactory.getLogger(PluginInvoker.class);

    private final ExecutionContext ctx;
    private volatile PluginState state = PluginState.CONFIGURED;

    public PluginInvoker(ExecutionContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public PluginState getState() {
        return state;
    }

    /**
     * Runs the builder. CONFIGURED → BUILDING → BUILT | BUILD_FAILED | BUILD_CANCELLED.
     *
     * @throws ExecutionCancelledException when the context is cancelled before or during the build
     * @throws Exception                   the builder's own failure
     */
    public Artifact build(String pluginName, BuilderPlugin builder) throws Exception {
        requireState(PluginState.CONFIGURED, "build");
        if (ctx.isCancelled()) {
            state = PluginState.BUILD_CANCELLED;
            ctx.throwIfCancelled();
        }
        state = PluginState.BUILDING;
        long start = System.currentTimeMillis();
        try {
            Artifact artifact = builder.build(ctx);
            if (artifact == null) {
                throw new IllegalStateException("plugin " + pluginName + " returned no artifact");
            }
            ctx.throwIfCancelled();
            state = PluginState.BUILT;
            record(pluginName, "build", start, true);
            log.info("Plugin {} built artifact {} in {} ms", pluginName, artifact.getId(), System.currentTimeMillis() - start);
            return artifact;
        } catch (Exception e) {
            state = isCancellation(e) ? PluginState.BUILD_CANCELLED : PluginState.BUILD_FAILED;
            record(pluginName, "build", start, false);
            throw e;
        }
    }

    /**
     * Runs the registry. BUILT → PUSHING → PUSHED | PUSH_FAILED | PUSH_CANCELLED.
     */
    public RegistryRef push(String pluginName, RegistryPlugin registry, Artifact artifact) throws Exception {
        requireState(PluginState.BUILT, "push");
        if (ctx.isCancelled()) {
            state = PluginState.PUSH_CANCELLED;
            ctx.throwIfCancelled();
        }
        state = PluginState.PUSHING;
        long start = System.currentTimeMillis();
        try {
            RegistryRef ref = registry.push(ctx, artifact);
            ctx.throwIfCancelled();
            state = PluginState.PUSHED;
            record(pluginName, "push", start, true);
            log.info("Plugin {} pushed {} in {} ms", pluginName, ref, System.currentTimeMillis() - start);
            return ref;
        } catch (Exception e) {
            state = isCancellation(e) ? PluginState.PUSH_CANCELLED : PluginState.PUSH_FAILED;
            record(pluginName, "push", start, false);
            throw e;
        }
    }

    /** Deploys through a platform; outside the build/push state machine. */
    public Deployment deploy(String pluginName, PlatformPlugin platform, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        long start = System.currentTimeMillis();
        try {
            Deployment deployment = platform.deploy(ctx, artifact);
            record(pluginName, "deploy", start, true);
            return deployment;
        } catch (Exception e) {
            record(pluginName, "deploy", start, false);
            throw e;
        }
    }

    /** Destroys one job through a platform. */
    public void destroy(String pluginName, PlatformPlugin platform, String jobId) throws Exception {
        ctx.throwIfCancelled();
        long start = System.currentTimeMillis();
        try {
            platform.destroy(ctx, jobId);
            record(pluginName, "destroy", start, true);
        } catch (Exception e) {
            record(pluginName, "destroy", start, false);
            throw e;
        }
    }

    private void requireState(PluginState expected, String step) {
        if (state != expected) {
            throw new IllegalStateException("cannot " + step + " in state " + state + " (expected " + expected + ")");
        }
    }

    private boolean isCancellation(Exception e) {
        return e instanceof ExecutionCancelledException || ctx.isCancelled();
    }

    private static void record(String plugin, String phase, long start, boolean success) {
        DispatchMetrics.pluginPhase(plugin, phase, System.currentTimeMillis() - start, success);
    }
}
