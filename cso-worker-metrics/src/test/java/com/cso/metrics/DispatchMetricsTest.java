package com.cso.metrics;

import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class DispatchMetricsTest {

    @Test
    void getRegistry_returnsSameInstance() {
        assertSame(DispatchMetrics.getRegistry(), DispatchMetrics.getRegistry());
    }

    @Test
    void logEventPublished_incrementsPerStream() {
        double before = DispatchMetrics.count(DispatchMetrics.LOG_EVENTS_PUBLISHED, "stream", "stdout");

        DispatchMetrics.logEventPublished("stdout");
        DispatchMetrics.logEventPublished("stdout");
        DispatchMetrics.logEventPublished("stderr");

        assertEquals(before + 2, DispatchMetrics.count(DispatchMetrics.LOG_EVENTS_PUBLISHED, "stream", "stdout"));
    }

    @Test
    void pluginPhase_recordsTimer() {
        DispatchMetrics.pluginPhase("metrics-test", "build", 42, true);

        Timer timer = DispatchMetrics.getRegistry().find(DispatchMetrics.PLUGIN_PHASE)
                .tags("plugin", "metrics-test", "phase", "build", "success", "true").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(42.0, timer.totalTime(TimeUnit.MILLISECONDS));
        DispatchMetrics.logSummary();
    }

    @Test
    void count_isZeroForUnknownMeter() {
        assertEquals(0.0, DispatchMetrics.count("cso.never.registered"));
    }
}
