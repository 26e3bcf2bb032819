package com.cso.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the dispatch worker.
 * <p>
 * Bus: NATS_SERVERS (comma-separated), NATS_CLIENT_PRIVATE_KEY (NKey seed), NATS_STREAM_PREFIX.
 * Worker: CSO_TASK_TIMEOUT_SECONDS, CSO_EXIT_GRACE_MILLIS, CSO_PLUGINS_DIR, CSO_WORK_DIR.
 * Backend defaults injected into deployment parameters: BACKEND_URL, ACCESS_TOKEN.
 */
public final class CsoConfig {

    public static final String ENV_NATS_SERVERS = "NATS_SERVERS";
    public static final String ENV_NATS_CLIENT_PRIVATE_KEY = "NATS_CLIENT_PRIVATE_KEY";
    public static final String ENV_NATS_STREAM_PREFIX = "NATS_STREAM_PREFIX";
    public static final String ENV_NATS_PUBLISH_TIMEOUT_SECONDS = "CSO_NATS_PUBLISH_TIMEOUT_SECONDS";
    public static final String ENV_NATS_MAX_RECONNECTS = "CSO_NATS_MAX_RECONNECTS";
    public static final String ENV_NATS_RECONNECT_WAIT_SECONDS = "CSO_NATS_RECONNECT_WAIT_SECONDS";
    public static final String ENV_TASK_TIMEOUT_SECONDS = "CSO_TASK_TIMEOUT_SECONDS";
    public static final String ENV_EXIT_GRACE_MILLIS = "CSO_EXIT_GRACE_MILLIS";
    public static final String ENV_PLUGINS_DIR = "CSO_PLUGINS_DIR";
    public static final String ENV_WORK_DIR = "CSO_WORK_DIR";
    public static final String ENV_BACKEND_URL = "BACKEND_URL";
    public static final String ENV_ACCESS_TOKEN = "ACCESS_TOKEN";

    /** Fixed deadline for one dispatched task. */
    public static final int DEFAULT_TASK_TIMEOUT_SECONDS = 15 * 60;
    public static final int DEFAULT_EXIT_GRACE_MILLIS = 100;
    public static final int DEFAULT_NATS_PUBLISH_TIMEOUT_SECONDS = 5;
    public static final int DEFAULT_NATS_MAX_RECONNECTS = 5;
    public static final int DEFAULT_NATS_RECONNECT_WAIT_SECONDS = 2;
    public static final String DEFAULT_PLUGINS_DIR = "/opt/cso/plugins";

    private final List<String> natsServers;
    private final String natsClientPrivateKey;
    private final String natsStreamPrefix;
    private final int natsPublishTimeoutSeconds;
    private final int natsMaxReconnects;
    private final int natsReconnectWaitSeconds;
    private final int taskTimeoutSeconds;
    private final int exitGraceMillis;
    private final String pluginsDir;
    private final String workDir;
    private final String backendUrl;
    private final String accessToken;

    private CsoConfig(Builder b) {
        this.natsServers = Collections.unmodifiableList(new ArrayList<>(b.natsServers));
        this.natsClientPrivateKey = b.natsClientPrivateKey;
        this.natsStreamPrefix = b.natsStreamPrefix != null ? b.natsStreamPrefix : "";
        this.natsPublishTimeoutSeconds = b.natsPublishTimeoutSeconds;
        this.natsMaxReconnects = b.natsMaxReconnects;
        this.natsReconnectWaitSeconds = b.natsReconnectWaitSeconds;
        this.taskTimeoutSeconds = b.taskTimeoutSeconds;
        this.exitGraceMillis = b.exitGraceMillis;
        this.pluginsDir = b.pluginsDir != null ? b.pluginsDir : DEFAULT_PLUGINS_DIR;
        this.workDir = b.workDir != null ? b.workDir : System.getProperty("java.io.tmpdir");
        this.backendUrl = b.backendUrl;
        this.accessToken = b.accessToken;
    }

    /** NATS server URLs; empty when the bus is not configured. */
    public List<String> getNatsServers() {
        return natsServers;
    }

    /** NKey seed used to sign the server nonce; null when unset. */
    public String getNatsClientPrivateKey() {
        return natsClientPrivateKey;
    }

    /** Subject namespace prefix; empty string means bare subjects. */
    public String getNatsStreamPrefix() {
        return natsStreamPrefix;
    }

    /**
     * Whether a bus connection should be attempted: at least one server and a client key.
     * When false the worker runs local-only (no build log streaming, no lifecycle events).
     */
    public boolean isBusConfigured() {
        return !natsServers.isEmpty() && natsClientPrivateKey != null && !natsClientPrivateKey.isBlank();
    }

    public Duration getNatsPublishTimeout() {
        return Duration.ofSeconds(natsPublishTimeoutSeconds);
    }

    public int getNatsMaxReconnects() {
        return natsMaxReconnects;
    }

    public Duration getNatsReconnectWait() {
        return Duration.ofSeconds(natsReconnectWaitSeconds);
    }

    /** Deadline for one task, measured from parameter acceptance. Default 15 minutes. */
    public Duration getTaskTimeout() {
        return Duration.ofSeconds(taskTimeoutSeconds);
    }

    /** Delay before process exit so the scheduler's log capture observes the final lines. Default 100 ms. */
    public Duration getExitGrace() {
        return Duration.ofMillis(exitGraceMillis);
    }

    /** Community plugin directory (only {@code *.jar} files are loaded). Default {@value #DEFAULT_PLUGINS_DIR}. */
    public Path getPluginsDir() {
        return Path.of(pluginsDir);
    }

    /** Parent directory for clone and upload working directories. Default the JVM temp dir. */
    public Path getWorkDir() {
        return Path.of(workDir);
    }

    public String getBackendUrl() {
        return backendUrl;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public static CsoConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds configuration from an environment-style map. Unset, blank or unparsable values
     * fall back to their defaults.
     */
    public static CsoConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .natsServers(parseCommaSeparated(env.get(ENV_NATS_SERVERS)))
                .natsClientPrivateKey(getEnv(env, ENV_NATS_CLIENT_PRIVATE_KEY, null))
                .natsStreamPrefix(getEnv(env, ENV_NATS_STREAM_PREFIX, ""))
                .natsPublishTimeoutSeconds(parseInt(env.get(ENV_NATS_PUBLISH_TIMEOUT_SECONDS), DEFAULT_NATS_PUBLISH_TIMEOUT_SECONDS))
                .natsMaxReconnects(parseInt(env.get(ENV_NATS_MAX_RECONNECTS), DEFAULT_NATS_MAX_RECONNECTS))
                .natsReconnectWaitSeconds(parseInt(env.get(ENV_NATS_RECONNECT_WAIT_SECONDS), DEFAULT_NATS_RECONNECT_WAIT_SECONDS))
                .taskTimeoutSeconds(parseInt(env.get(ENV_TASK_TIMEOUT_SECONDS), DEFAULT_TASK_TIMEOUT_SECONDS))
                .exitGraceMillis(parseInt(env.get(ENV_EXIT_GRACE_MILLIS), DEFAULT_EXIT_GRACE_MILLIS))
                .pluginsDir(getEnv(env, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR))
                .workDir(getEnv(env, ENV_WORK_DIR, null))
                .backendUrl(getEnv(env, ENV_BACKEND_URL, null))
                .accessToken(getEnv(env, ENV_ACCESS_TOKEN, null))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> natsServers = List.of();
        private String natsClientPrivateKey;
        private String natsStreamPrefix = "";
        private int natsPublishTimeoutSeconds = DEFAULT_NATS_PUBLISH_TIMEOUT_SECONDS;
        private int natsMaxReconnects = DEFAULT_NATS_MAX_RECONNECTS;
        private int natsReconnectWaitSeconds = DEFAULT_NATS_RECONNECT_WAIT_SECONDS;
        private int taskTimeoutSeconds = DEFAULT_TASK_TIMEOUT_SECONDS;
        private int exitGraceMillis = DEFAULT_EXIT_GRACE_MILLIS;
        private String pluginsDir = DEFAULT_PLUGINS_DIR;
        private String workDir;
        private String backendUrl;
        private String accessToken;

        public Builder natsServers(List<String> natsServers) {
            this.natsServers = Objects.requireNonNull(natsServers, "natsServers");
            return this;
        }

        public Builder natsClientPrivateKey(String natsClientPrivateKey) {
            this.natsClientPrivateKey = natsClientPrivateKey;
            return this;
        }

        public Builder natsStreamPrefix(String natsStreamPrefix) {
            this.natsStreamPrefix = natsStreamPrefix;
            return this;
        }

        public Builder natsPublishTimeoutSeconds(int natsPublishTimeoutSeconds) {
            this.natsPublishTimeoutSeconds = natsPublishTimeoutSeconds;
            return this;
        }

        public Builder natsMaxReconnects(int natsMaxReconnects) {
            this.natsMaxReconnects = natsMaxReconnects;
            return this;
        }

        public Builder natsReconnectWaitSeconds(int natsReconnectWaitSeconds) {
            this.natsReconnectWaitSeconds = natsReconnectWaitSeconds;
            return this;
        }

        public Builder taskTimeoutSeconds(int taskTimeoutSeconds) {
            this.taskTimeoutSeconds = taskTimeoutSeconds;
            return this;
        }

        public Builder exitGraceMillis(int exitGraceMillis) {
            this.exitGraceMillis = exitGraceMillis;
            return this;
        }

        public Builder pluginsDir(String pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder workDir(String workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder backendUrl(String backendUrl) {
            this.backendUrl = backendUrl;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public CsoConfig build() {
            return new CsoConfig(this);
        }
    }
}
