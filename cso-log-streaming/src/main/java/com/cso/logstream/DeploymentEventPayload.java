package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload of deployment succeeded / failed events. */
public final class DeploymentEventPayload {

    private final int jobId;
    private final DeploymentType type;
    private final String deploymentId;
    private final String serviceId;
    private final String teamId;
    private final String userId;
    private final String ownerId;

    @JsonCreator
    public DeploymentEventPayload(
            @JsonProperty("jobId") int jobId,
            @JsonProperty("type") DeploymentType type,
            @JsonProperty("deploymentId") String deploymentId,
            @JsonProperty("serviceId") String serviceId,
            @JsonProperty("teamId") String teamId,
            @JsonProperty("userId") String userId,
            @JsonProperty("ownerId") String ownerId) {
        this.jobId = jobId;
        this.type = type;
        this.deploymentId = deploymentId;
        this.serviceId = serviceId;
        this.teamId = teamId;
        this.userId = userId;
        this.ownerId = ownerId;
    }

    public int getJobId() {
        return jobId;
    }

    public DeploymentType getType() {
        return type;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getTeamId() {
        return teamId;
    }

    public String getUserId() {
        return userId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
