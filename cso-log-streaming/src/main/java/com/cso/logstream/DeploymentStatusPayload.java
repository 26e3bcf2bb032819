package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DeploymentStatusPayload {

    private final int jobId;
    private final DeploymentStatus status;

    @JsonCreator
    public DeploymentStatusPayload(
            @JsonProperty("jobId") int jobId,
            @JsonProperty("status") DeploymentStatus status) {
        this.jobId = jobId;
        this.status = status;
    }

    public int getJobId() {
        return jobId;
    }

    public DeploymentStatus getStatus() {
        return status;
    }
}
