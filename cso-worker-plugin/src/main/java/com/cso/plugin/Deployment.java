package com.cso.plugin;

import java.time.Instant;

/** Result of a platform deploy. */
public final class Deployment {

    /** Coarse state reported by the platform right after submission. */
    public enum State {
        PENDING,
        RUNNING,
        FAILED
    }

    private final String id;
    private final String name;
    private final String platform;
    private final String artifactId;
    private final State state;
    private final Instant deployedAt;

    public Deployment(String id, String name, String platform, String artifactId, State state, Instant deployedAt) {
        this.id = id;
        this.name = name;
        this.platform = platform;
        this.artifactId = artifactId;
        this.state = state;
        this.deployedAt = deployedAt != null ? deployedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getPlatform() {
        return platform;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public State getState() {
        return state;
    }

    public Instant getDeployedAt() {
        return deployedAt;
    }
}
