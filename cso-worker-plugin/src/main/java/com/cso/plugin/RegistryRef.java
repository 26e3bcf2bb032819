package com.cso.plugin;

import java.time.Instant;

/**
 * Where a registry put an artifact. Terminal; only reported.
 */
public final class RegistryRef {

    private final String registry;
    private final String repository;
    private final String tag;
    private final String digest;
    private final String fullImage;
    private final Instant pushedAt;

    public RegistryRef(String registry, String repository, String tag, String digest, String fullImage,
                       Instant pushedAt) {
        this.registry = registry;
        this.repository = repository;
        this.tag = tag;
        this.digest = digest;
        this.fullImage = fullImage;
        this.pushedAt = pushedAt != null ? pushedAt : Instant.now();
    }

    /** Registry host or release store (e.g. "ghcr.io", "github.com"). */
    public String getRegistry() {
        return registry;
    }

    public String getRepository() {
        return repository;
    }

    public String getTag() {
        return tag;
    }

    public String getDigest() {
        return digest;
    }

    /** Full location (e.g. {@code registry/repository:tag} or a release URL). */
    public String getFullImage() {
        return fullImage;
    }

    public Instant getPushedAt() {
        return pushedAt;
    }

    @Override
    public String toString() {
        return fullImage + (digest != null && !digest.isEmpty() ? "@" + digest : "");
    }
}
