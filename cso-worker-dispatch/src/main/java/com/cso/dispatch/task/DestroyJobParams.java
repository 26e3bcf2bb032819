package com.cso.dispatch.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of {@code destroy-job-pack}. The reason is passed through to the
 * {@code job.destroyed} event (delete, upgrade_volume, migrate_volume, suspend_account,
 * pause_service).
 */
public final class DestroyJobParams implements TaskParams {

    @JsonProperty("jobs")
    private List<DestroyJobInfo> jobs;

    @JsonProperty("reason")
    private String reason;

    DestroyJobParams() {
    }

    public List<DestroyJobInfo> getJobs() {
        return jobs != null ? jobs : List.of();
    }

    public String getReason() {
        return reason;
    }

    @Override
    public void validate() throws TaskParseException {
        if (getJobs().isEmpty()) {
            throw new TaskParseException("at least one job is required");
        }
        if (reason == null || reason.isEmpty()) {
            throw new TaskParseException("reason is required");
        }
    }
}
