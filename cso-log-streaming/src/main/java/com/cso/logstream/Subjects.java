package com.cso.logstream;

/**
 * Bus subjects. Base subjects are namespaced with the configured stream prefix
 * ({@code <prefix>.<base>}); an empty prefix leaves them bare.
 */
public final class Subjects {

    public static final String DEPLOYMENT_STATUS_CHANGED = "deployment.status.changed";
    public static final String DEPLOYMENT_SUCCEEDED = "deployment.succeeded";
    public static final String DEPLOYMENT_FAILED = "deployment.failed";
    public static final String JOB_DESTROYED = "job.destroyed";
    public static final String BUILD_LOG = "build.log";
    public static final String BUILD_LOG_END = "build.log.end";

    private Subjects() {
    }

    /** Build log subject for one deployment: {@code build.log.<deploymentId>}. */
    public static String buildLog(String deploymentId) {
        return BUILD_LOG + "." + deploymentId;
    }

    /** End-of-log subject for one deployment: {@code build.log.end.<deploymentId>}. */
    public static String buildLogEnd(String deploymentId) {
        return BUILD_LOG_END + "." + deploymentId;
    }

    /**
     * Applies the stream prefix to a base subject.
     *
     * @param prefix stream prefix (e.g. "cs"); null or blank means no namespacing
     * @param base   base subject (e.g. "deployment.succeeded")
     * @return {@code prefix.base} or {@code base}
     */
    public static String withPrefix(String prefix, String base) {
        if (prefix == null || prefix.isBlank()) {
            return base;
        }
        return prefix.trim() + "." + base;
    }
}
