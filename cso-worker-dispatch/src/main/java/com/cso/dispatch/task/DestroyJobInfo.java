package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One job to destroy, with the scheduler it runs on. */
public final class DestroyJobInfo {

    @JsonProperty("jobId")
    private String jobId;

    @JsonProperty("serviceId")
    private String serviceId;

    @JsonProperty("nomadAddress")
    private String nomadAddress;

    @JsonProperty("nomadToken")
    private String nomadToken;

    DestroyJobInfo() {
    }

    public String getJobId() {
        return jobId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getNomadAddress() {
        return nomadAddress;
    }

    public String getNomadToken() {
        return nomadToken;
    }
}
