package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One build log line. {@code content} includes its line terminator unless the line was the
 * unterminated tail emitted on flush. {@code sequence} starts at 1 per writer.
 */
public final class BuildLogPayload {

    private final String deploymentId;
    private final int jobId;
    private final String serviceId;
    private final String ownerId;
    private final LogOutput logOutput;
    private final String content;
    private final long timestamp;
    private final long sequence;
    private final String phase;

    @JsonCreator
    public BuildLogPayload(
            @JsonProperty("deploymentId") String deploymentId,
            @JsonProperty("jobId") int jobId,
            @JsonProperty("serviceId") String serviceId,
            @JsonProperty("ownerId") String ownerId,
            @JsonProperty("logOutput") LogOutput logOutput,
            @JsonProperty("content") String content,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("phase") String phase) {
        this.deploymentId = deploymentId;
        this.jobId = jobId;
        this.serviceId = serviceId;
        this.ownerId = ownerId;
        this.logOutput = logOutput;
        this.content = content;
        this.timestamp = timestamp;
        this.sequence = sequence;
        this.phase = phase;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public int getJobId() {
        return jobId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public LogOutput getLogOutput() {
        return logOutput;
    }

    public String getContent() {
        return content;
    }

    /** Unix milliseconds at emission. */
    public long getTimestamp() {
        return timestamp;
    }

    public long getSequence() {
        return sequence;
    }

    public String getPhase() {
        return phase;
    }
}
