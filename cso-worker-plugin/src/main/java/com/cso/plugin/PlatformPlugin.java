package com.cso.plugin;

import com.cso.executioncontext.ExecutionContext;

/**
 * Runs artifacts on a scheduler and tears down deployed jobs.
 */
public interface PlatformPlugin extends PluginComponent {

    Deployment deploy(ExecutionContext ctx, Artifact artifact) throws Exception;

    /**
     * Stops and purges a deployed job.
     *
     * @param jobId scheduler job id
     */
    void destroy(ExecutionContext ctx, String jobId) throws Exception;
}
