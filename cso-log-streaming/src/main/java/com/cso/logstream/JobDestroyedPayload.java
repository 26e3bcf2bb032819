package com.cso.logstream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Published once per destroyed job. {@code reason} is one of delete, upgrade_volume,
 * migrate_volume, suspend_account, pause_service.
 */
public final class JobDestroyedPayload {

    private final String id;
    private final String reason;

    @JsonCreator
    public JobDestroyedPayload(
            @JsonProperty("id") String id,
            @JsonProperty("reason") String reason) {
        this.id = id;
        this.reason = reason;
    }

    public String getId() {
        return id;
    }

    public String getReason() {
        return reason;
    }
}
