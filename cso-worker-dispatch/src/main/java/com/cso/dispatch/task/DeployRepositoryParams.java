package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Parameters of {@code deploy-repository} and {@code redeploy-repository}. */
public final class DeployRepositoryParams extends BaseDeploymentParams {

    public static final String SOURCE_LOCAL_UPLOAD = "local_upload";

    @JsonProperty("repository")
    private String repository;

    @JsonProperty("branch")
    private String branch;

    @JsonProperty("gitPass")
    private String gitPass;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("sourceType")
    private String sourceType;

    @JsonProperty("sourceUrl")
    private String sourceUrl;

    @JsonProperty("uploadId")
    private String uploadId;

    @JsonProperty("build")
    private BuildOptions build;

    DeployRepositoryParams() {
    }

    public String getRepository() {
        return repository;
    }

    public String getBranch() {
        return branch;
    }

    public String getGitPass() {
        return gitPass;
    }

    public String getProvider() {
        return provider;
    }

    public String getSourceType() {
        return sourceType;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getUploadId() {
        return uploadId;
    }

    public boolean isLocalUpload() {
        return SOURCE_LOCAL_UPLOAD.equals(sourceType);
    }

    @Override
    public BuildOptions getBuild() {
        return build != null ? build : new BuildOptions();
    }

    @Override
    public void validate() throws TaskParseException {
        if (isBlank(getJobId())) {
            throw new TaskParseException("jobId is required (received params: repository=" + repository
                    + ", branch=" + branch + ")");
        }
        if (isLocalUpload()) {
            if (isBlank(sourceUrl)) {
                throw new TaskParseException("sourceUrl is required for local_upload source type (received params: jobId="
                        + getJobId() + ", sourceType=" + sourceType + ")");
            }
        } else {
            if (isBlank(repository)) {
                throw new TaskParseException("repository is required (received params: jobId=" + getJobId()
                        + ", branch=" + branch + ")");
            }
            if (isBlank(branch)) {
                throw new TaskParseException("branch is required (received params: jobId=" + getJobId()
                        + ", repository=" + repository + ")");
            }
        }
        if (isBlank(getDeploymentId())) {
            throw new TaskParseException("deploymentId is required (received params: jobId=" + getJobId()
                    + ", repository=" + repository + ")");
        }
        if (isBlank(getServiceId())) {
            throw new TaskParseException("serviceId is required (received params: jobId=" + getJobId()
                    + ", repository=" + repository + ")");
        }
    }
}
