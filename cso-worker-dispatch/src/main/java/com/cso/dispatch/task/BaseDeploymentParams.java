package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Fields common to repository and image deployments. {@code jobId} is the scheduler job name;
 * {@code deploymentJobId} is the numeric ID reported in bus events and build logs.
 */
public abstract class BaseDeploymentParams implements TaskParams {

    @JsonProperty("jobId")
    private String jobId;

    @JsonProperty("deploymentId")
    private String deploymentId;

    @JsonProperty("serviceId")
    private String serviceId;

    @JsonProperty("teamId")
    private String teamId;

    @JsonProperty("userId")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int userId;

    @JsonProperty("ownerId")
    @JsonDeserialize(using = FlexStringDeserializer.class)
    private String ownerId;

    @JsonProperty("deploymentJobId")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int deploymentJobId;

    @JsonProperty("projectId")
    private String projectId;

    @JsonProperty("imageName")
    private String imageName;

    @JsonProperty("imageTag")
    private String imageTag;

    @JsonProperty("deploy")
    private String deploy;

    @JsonProperty("replicaCount")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int replicaCount;

    @JsonProperty("nomadAddress")
    private String nomadAddress;

    @JsonProperty("nomadToken")
    private String nomadToken;

    @JsonProperty("cpu")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int cpu;

    @JsonProperty("ram")
    @JsonDeserialize(using = FlexIntDeserializer.class)
    private int ram;

    @JsonProperty("networks")
    private List<NetworkPortSettings> networks;

    @JsonProperty("command")
    private String command;

    @JsonProperty("backendUrl")
    private String backendUrl;

    @JsonProperty("accessToken")
    private String accessToken;

    BaseDeploymentParams() {
    }

    public String getJobId() {
        return jobId;
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

    public int getUserId() {
        return userId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public int getDeploymentJobId() {
        return deploymentJobId;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getImageName() {
        return imageName;
    }

    public String getImageTag() {
        return imageTag;
    }

    public String getDeploy() {
        return deploy;
    }

    public int getReplicaCount() {
        return replicaCount;
    }

    public String getNomadAddress() {
        return nomadAddress;
    }

    public String getNomadToken() {
        return nomadToken;
    }

    public int getCpu() {
        return cpu;
    }

    public int getRam() {
        return ram;
    }

    public List<NetworkPortSettings> getNetworks() {
        return networks != null ? networks : List.of();
    }

    public String getCommand() {
        return command;
    }

    /**
     * Backend API base URL for deployment-state callbacks. Carried with the parameters so the
     * task shape matches what the scheduler sends; no handler in this worker calls the backend.
     */
    public String getBackendUrl() {
        return backendUrl;
    }

    /** Bearer token paired with {@link #getBackendUrl()}; carried, never used for calls here. */
    public String getAccessToken() {
        return accessToken;
    }

    /** Build settings; never null. */
    public abstract BuildOptions getBuild();

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
