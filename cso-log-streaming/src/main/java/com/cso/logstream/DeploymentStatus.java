package com.cso.logstream;

/** Deployment status carried by {@link DeploymentStatusPayload}; serialized by name. */
public enum DeploymentStatus {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED
}
