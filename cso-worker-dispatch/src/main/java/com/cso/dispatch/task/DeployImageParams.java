package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Parameters of {@code deploy-image}: a pre-built image, no build phase. */
public final class DeployImageParams extends BaseDeploymentParams {

    @JsonProperty("build")
    private BuildOptions build;

    DeployImageParams() {
    }

    @Override
    public BuildOptions getBuild() {
        return build != null ? build : new BuildOptions();
    }

    @Override
    public void validate() throws TaskParseException {
        if (isBlank(getJobId())) {
            throw new TaskParseException("jobId is required (received params: imageName=" + getImageName()
                    + ", deploymentId=" + getDeploymentId() + ")");
        }
        if (isBlank(getImageName())) {
            throw new TaskParseException("imageName is required (received params: jobId=" + getJobId()
                    + ", deploymentId=" + getDeploymentId() + ")");
        }
        if (isBlank(getDeploymentId())) {
            throw new TaskParseException("deploymentId is required (received params: jobId=" + getJobId()
                    + ", imageName=" + getImageName() + ")");
        }
        if (isBlank(getServiceId())) {
            throw new TaskParseException("serviceId is required (received params: jobId=" + getJobId()
                    + ", imageName=" + getImageName() + ")");
        }
    }
}
