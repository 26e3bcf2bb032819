package com.cso.dispatch.handler;

import com.cso.config.CsoConfig;
import com.cso.dispatch.task.BaseDeploymentParams;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.BusException;
import com.cso.logstream.DeploymentEventPayload;
import com.cso.logstream.DeploymentType;
import com.cso.logstream.EventBusClient;
import com.cso.logstream.JobDestroyedPayload;
import com.cso.plugin.PluginLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Shared context for deployment handlers: execution context, plugin loader, worker config and
 * the bus client (null when the worker runs local-only). Lifecycle events are published best
 * effort; a failed publish is logged and never fails the task.
 */
public final class HandlerContext {

    private static final Logger log = LoggerFactory.getLogger(HandlerContext.class);

    private final ExecutionContext execution;
    private final EventBusClient bus;
    private final PluginLoader pluginLoader;
    private final CsoConfig config;

    public HandlerContext(ExecutionContext execution, EventBusClient bus, PluginLoader pluginLoader, CsoConfig config) {
        this.execution = Objects.requireNonNull(execution, "execution");
        this.bus = bus;
        this.pluginLoader = Objects.requireNonNull(pluginLoader, "pluginLoader");
        this.config = Objects.requireNonNull(config, "config");
    }

    public ExecutionContext getExecution() { return execution; }
    public EventBusClient getBus() { return bus; }
    public PluginLoader getPluginLoader() { return pluginLoader; }
    public CsoConfig getConfig() { return config; }

    public void publishStarted(int jobId) {
        if (bus == null) return;
        try {
            bus.publishDeploymentStarted(jobId);
            log.info("Published deployment started event (jobId={})", jobId);
        } catch (BusException e) {
            log.warn("Failed to publish deployment started event (jobId={}): {}", jobId, e.getMessage());
        }
    }

    public void publishSucceeded(BaseDeploymentParams params, DeploymentType type) {
        if (bus == null) return;
        try {
            bus.publishDeploymentSucceeded(eventPayload(params, type));
            log.info("Published deployment succeeded event (deploymentId={})", params.getDeploymentId());
        } catch (BusException e) {
            log.warn("Failed to publish deployment succeeded event (deploymentId={}): {}",
                    params.getDeploymentId(), e.getMessage());
        }
    }

    public void publishFailed(BaseDeploymentParams params, DeploymentType type, Throwable cause) {
        if (bus == null) return;
        try {
            bus.publishDeploymentFailed(eventPayload(params, type));
            log.info("Published deployment failed event (deploymentId={}, cause={})",
                    params.getDeploymentId(), cause != null ? cause.getMessage() : null);
        } catch (BusException e) {
            log.warn("Failed to publish deployment failed event (deploymentId={}): {}",
                    params.getDeploymentId(), e.getMessage());
        }
    }

    /** @return false when the event could not be published */
    public boolean publishJobDestroyed(String serviceId, String reason) {
        if (bus == null) return true;
        try {
            bus.publishJobDestroyed(new JobDestroyedPayload(serviceId, reason));
            log.info("Published job destroyed event (serviceId={})", serviceId);
            return true;
        } catch (BusException e) {
            log.warn("Failed to publish job destroyed event (serviceId={}): {}", serviceId, e.getMessage());
            return false;
        }
    }

    static DeploymentEventPayload eventPayload(BaseDeploymentParams params, DeploymentType type) {
        return new DeploymentEventPayload(
                params.getDeploymentJobId(),
                type,
                params.getDeploymentId(),
                params.getServiceId(),
                params.getTeamId(),
                String.valueOf(params.getUserId()),
                params.getOwnerId());
    }
}
