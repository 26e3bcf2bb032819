package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Signals the end of a deployment's build log; exactly one per deployment. */
public final class BuildLogEndPayload {

    private final String deploymentId;
    private final int jobId;
    private final LogEndStatus status;

    @JsonCreator
    public BuildLogEndPayload(
            @JsonProperty("deploymentId") String deploymentId,
            @JsonProperty("jobId") int jobId,
            @JsonProperty("status") LogEndStatus status) {
        this.deploymentId = deploymentId;
        this.jobId = jobId;
        this.status = status;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public int getJobId() {
        return jobId;
    }

    public LogEndStatus getStatus() {
        return status;
    }
}
