package com.cso.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide metrics for one dispatch run: build log events published/failed per stream,
 * plugin phase timings and the task outcome. The run is a single short-lived process, so
 * the meters are summarized to the log at exit rather than scraped.
 * <p>
 * Uses a lazy, thread-safe holder: on first use the registry is created via CAS
 * and reused for the lifetime of the process.
 */
public final class DispatchMetrics {

    private static final Logger log = LoggerFactory.getLogger(DispatchMetrics.class);

    private static final AtomicReference<MeterRegistry> REGISTRY = new AtomicReference<>();

    public static final String LOG_EVENTS_PUBLISHED = "cso.log.events.published";
    public static final String LOG_EVENTS_FAILED = "cso.log.events.failed";
    public static final String BUS_EVENTS_PUBLISHED = "cso.bus.events.published";
    public static final String PLUGIN_PHASE = "cso.plugin.phase";
    public static final String TASK_OUTCOME = "cso.task.outcome";

    private DispatchMetrics() {
    }

    /**
     * Returns the shared meter registry, creating it on first call (lock-free CAS).
     * At most one registry is ever created.
     */
    public static MeterRegistry getRegistry() {
        MeterRegistry existing = REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return REGISTRY.get();
    }

    /** One build log line published for the given stream (stdout/stderr). */
    public static void logEventPublished(String stream) {
        getRegistry().counter(LOG_EVENTS_PUBLISHED, "stream", nullToUnknown(stream)).increment();
    }

    /** One build log line that could not be published. */
    public static void logEventFailed(String stream) {
        getRegistry().counter(LOG_EVENTS_FAILED, "stream", nullToUnknown(stream)).increment();
    }

    /** One lifecycle event (status changed, succeeded, failed, destroyed) published on the bus. */
    public static void busEventPublished(String subject) {
        getRegistry().counter(BUS_EVENTS_PUBLISHED, "subject", nullToUnknown(subject)).increment();
    }

    /**
     * Records the duration of one plugin phase.
     *
     * @param plugin  plugin name (e.g. "docker")
     * @param phase   build, push, deploy or destroy
     * @param durationMs elapsed milliseconds
     * @param success whether the phase completed without error
     */
    public static void pluginPhase(String plugin, String phase, long durationMs, boolean success) {
        Timer.builder(PLUGIN_PHASE)
                .tag("plugin", nullToUnknown(plugin))
                .tag("phase", nullToUnknown(phase))
                .tag("success", String.valueOf(success))
                .register(getRegistry())
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /** Final outcome of the task (exit code name). */
    public static void taskOutcome(String taskType, String outcome) {
        getRegistry().counter(TASK_OUTCOME, "task", nullToUnknown(taskType), "outcome", nullToUnknown(outcome))
                .increment();
    }

    /** Current count of a counter with the given name and tags, 0 when not registered. */
    public static double count(String name, String... tags) {
        Counter c = getRegistry().find(name).tags(tags).counter();
        return c != null ? c.count() : 0;
    }

    /** Logs every registered meter at info level. Called once before the process exits. */
    public static void logSummary() {
        for (Meter meter : getRegistry().getMeters()) {
            if (meter instanceof Counter) {
                log.info("metric {} {} = {}", meter.getId().getName(), meter.getId().getTags(), ((Counter) meter).count());
            } else if (meter instanceof Timer) {
                Timer timer = (Timer) meter;
                log.info("metric {} {} count={} totalMs={}", meter.getId().getName(), meter.getId().getTags(),
                        timer.count(), (long) timer.totalTime(TimeUnit.MILLISECONDS));
            }
        }
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
