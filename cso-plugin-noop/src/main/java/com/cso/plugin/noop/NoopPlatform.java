package com.cso.plugin.noop;

import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.Deployment;
import com.cso.plugin.PlatformPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/** Platform that reports every deploy as running and every destroy as done. */
public final class NoopPlatform implements PlatformPlugin {

    private static final Logger log = LoggerFactory.getLogger(NoopPlatform.class);

    @Override
    public void configure(Map<String, Object> options) {
    }

    @Override
    public Deployment deploy(ExecutionContext ctx, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        return new Deployment("noop-deployment", "noop", NoopPluginProvider.NAME,
                artifact != null ? artifact.getId() : null, Deployment.State.RUNNING, Instant.now());
    }

    @Override
    public void destroy(ExecutionContext ctx, String jobId) throws Exception {
        ctx.throwIfCancelled();
        log.debug("noop destroy of job {}", jobId);
    }
}
