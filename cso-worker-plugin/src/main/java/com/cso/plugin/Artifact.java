package com.cso.plugin;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one builder invocation: an image reference, a set of compiled binaries or a package,
 * plus a content digest and metadata. Consumed by exactly one registry or platform call.
 */
public final class Artifact {

    /** Metadata key holding the list of built binary paths (release builders). */
    public static final String METADATA_BINARIES = "binaries";
    /** Metadata key holding the builder name. */
    public static final String METADATA_BUILDER = "builder";

    private final String id;
    private final String image;
    private final String tag;
    private final String digest;
    private final Map<String, String> labels;
    private final Map<String, Object> metadata;
    private final List<Integer> exposedPorts;
    private final Instant buildTime;
    private final String buildId;

    private Artifact(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.image = b.image;
        this.tag = b.tag;
        this.digest = b.digest;
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.exposedPorts = List.copyOf(b.exposedPorts);
        this.buildTime = b.buildTime != null ? b.buildTime : Instant.now();
        this.buildId = b.buildId;
    }

    public String getId() {
        return id;
    }

    /** Image name without tag (e.g. "myapp" or "registry.example.com/team/myapp"). */
    public String getImage() {
        return image;
    }

    public String getTag() {
        return tag;
    }

    /** {@code image:tag}, or the image alone when it has no tag. */
    public String getImageReference() {
        if (image == null) return null;
        if (tag == null || tag.isBlank() || image.contains(":")) return image;
        return image + ":" + tag;
    }

    /** Content fingerprint (e.g. {@code sha256:...}); null when unknown. */
    public String getDigest() {
        return digest;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<Integer> getExposedPorts() {
        return exposedPorts;
    }

    /** First exposed port, or 0 when none was detected. */
    public int getPrimaryPort() {
        return exposedPorts.isEmpty() ? 0 : exposedPorts.get(0);
    }

    public Instant getBuildTime() {
        return buildTime;
    }

    public String getBuildId() {
        return buildId;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String image;
        private String tag;
        private String digest;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<Integer> exposedPorts = new ArrayList<>();
        private Instant buildTime;
        private String buildId;

        private Builder(String id) {
            this.id = id;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder digest(String digest) {
            this.digest = digest;
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(key, value);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder exposedPorts(List<Integer> ports) {
            this.exposedPorts.clear();
            if (ports != null) this.exposedPorts.addAll(ports);
            return this;
        }

        public Builder buildTime(Instant buildTime) {
            this.buildTime = buildTime;
            return this;
        }

        public Builder buildId(String buildId) {
            this.buildId = buildId;
            return this;
        }

        public Artifact build() {
            return new Artifact(this);
        }
    }
}
