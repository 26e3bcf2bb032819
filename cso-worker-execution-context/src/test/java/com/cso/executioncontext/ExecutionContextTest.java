package com.cso.executioncontext;

import com.cso.logstream.BuildLogWriter;
import com.cso.logstream.EventBusClient;
import com.cso.logstream.LogOutput;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionContextTest {

    /** Bus client that discards everything. */
    private static final EventBusClient DISCARD = new EventBusClient() {
        @Override
        public void publish(String baseSubject, Object payload) {
        }

        @Override
        public void close() {
        }
    };

    @Test
    void deadline_firesDeadlineExceeded() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMillis(50))) {
            assertEquals(CancellationCause.DEADLINE_EXCEEDED, ctx.awaitCancellation());
            assertTrue(ctx.isCancelled());
            assertTrue(ctx.isDeadlineExceeded());
            assertEquals(Duration.ZERO, ctx.remaining());
            ExecutionCancelledException e = assertThrows(ExecutionCancelledException.class, ctx::throwIfCancelled);
            assertTrue(e.isDeadlineExceeded());
        }
    }

    @Test
    void cancel_firstCauseWins() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMillis(100))) {
            ctx.cancel();
            Thread.sleep(200);

            assertEquals(CancellationCause.CANCELLED, ctx.getCancellationCause());
            assertFalse(ctx.isDeadlineExceeded());
        }
    }

    @Test
    void liveContext_doesNotThrow() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            ctx.throwIfCancelled();
            assertNull(ctx.getCancellationCause());
            assertTrue(ctx.remaining().compareTo(Duration.ofMinutes(4)) > 0);
            assertFalse(ctx.awaitCancellation(Duration.ofMillis(10)));
        }
    }

    @Test
    void onCancel_runsCallbacksOnce() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            AtomicInteger calls = new AtomicInteger();
            ctx.onCancel(calls::incrementAndGet);

            ctx.cancel();
            ctx.cancel();
            assertEquals(1, calls.get());

            ctx.onCancel(calls::incrementAndGet);
            assertEquals(2, calls.get());
        }
    }

    @Test
    void onCancel_unregisteredCallbackIsNotRun() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            AtomicInteger calls = new AtomicInteger();
            Runnable unregister = ctx.onCancel(calls::incrementAndGet);

            unregister.run();
            ctx.cancel();

            assertEquals(0, calls.get());
        }
    }

    @Test
    void await_returnsFutureValue() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            assertEquals("done", ctx.await(CompletableFuture.completedFuture("done")));
        }
    }

    @Test
    void await_throwsWhenDeadlineFiresFirst() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMillis(50))) {
            CompletableFuture<String> never = new CompletableFuture<>();

            ExecutionCancelledException e = assertThrows(ExecutionCancelledException.class, () -> ctx.await(never));
            assertEquals(CancellationCause.DEADLINE_EXCEEDED, e.getCancellationCause());
        }
    }

    @Test
    void await_surfacesFutureFailure() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("boom"));

            ExecutionException e = assertThrows(ExecutionException.class, () -> ctx.await(failed));
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    void setPhase_updatesBothWriters() {
        BuildLogWriter out = new BuildLogWriter(DISCARD, "d", 1, "s", "o", LogOutput.STDOUT);
        BuildLogWriter err = new BuildLogWriter(DISCARD, "d", 1, "s", "o", LogOutput.STDERR);
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5)).withLogWriters(out, err)) {
            assertTrue(ctx.hasLogWriters());
            ctx.setPhase("clone");
            ctx.logLine("Cloning repository");

            assertEquals("clone", out.getPhase());
            assertEquals("clone", err.getPhase());
            assertEquals(1, out.getSequence());
        }
    }

    @Test
    void setPhase_withoutWritersIsNoOp() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(5))) {
            assertFalse(ctx.hasLogWriters());
            ctx.setPhase("build");
            ctx.logLine("local only");
        }
    }
}
