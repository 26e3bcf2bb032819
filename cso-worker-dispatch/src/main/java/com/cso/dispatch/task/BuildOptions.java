package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Build settings of a repository deployment; for image deployments only the start command is used. */
public final class BuildOptions {

    @JsonProperty("builder")
    private String builder;

    @JsonProperty("dockerfilePath")
    private String dockerfilePath;

    @JsonProperty("buildCommand")
    private String buildCommand;

    @JsonProperty("startCommand")
    private String startCommand;

    @JsonProperty("rootDirectory")
    private String rootDirectory;

    @JsonProperty("buildArgs")
    private Map<String, String> buildArgs;

    @JsonProperty("staticBuildEnv")
    private Map<String, String> staticBuildEnv;

    @JsonProperty("disablePush")
    private boolean disablePush;

    @JsonProperty("registryUrl")
    private String registryUrl;

    @JsonProperty("registryNamespace")
    private String registryNamespace;

    @JsonProperty("registryUsername")
    private String registryUsername;

    @JsonProperty("registryPassword")
    private String registryPassword;

    BuildOptions() {
    }

    public String getBuilder() {
        return builder;
    }

    public String getDockerfilePath() {
        return dockerfilePath;
    }

    public String getBuildCommand() {
        return buildCommand;
    }

    public String getStartCommand() {
        return startCommand;
    }

    public String getRootDirectory() {
        return rootDirectory;
    }

    public Map<String, String> getBuildArgs() {
        return buildArgs != null ? buildArgs : Map.of();
    }

    public Map<String, String> getStaticBuildEnv() {
        return staticBuildEnv != null ? staticBuildEnv : Map.of();
    }

    public boolean isDisablePush() {
        return disablePush;
    }

    public String getRegistryUrl() {
        return registryUrl;
    }

    public String getRegistryNamespace() {
        return registryNamespace;
    }

    public String getRegistryUsername() {
        return registryUsername;
    }

    public String getRegistryPassword() {
        return registryPassword;
    }
}
