package com.cso.executioncontext;

import com.cso.logstream.BuildLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline-bound context for one dispatched task: a fixed deadline, a cancellation signal and
 * optional stdout/stderr build log writers.
 * <p>
 * Cancellation is cooperative. Handlers and plugins check {@link #throwIfCancelled()} before each
 * step, block through {@link #await(CompletableFuture)}, or register {@link #onCancel(Runnable)}
 * to abort external work (e.g. destroy a subprocess). The signal fires at most once; the first
 * cause wins.
 */
public final class ExecutionContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final Instant deadline;
    private final Clock clock;
    private final CompletableFuture<CancellationCause> signal = new CompletableFuture<>();
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final ScheduledFuture<?> deadlineTask;
    private volatile BuildLogWriter stdout;
    private volatile BuildLogWriter stderr;

    private ExecutionContext(Duration timeout, Clock clock) {
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cso-deadline");
            t.setDaemon(true);
            return t;
        });
        long delayMs = Math.max(0, timeout.toMillis());
        this.deadlineTask = scheduler.schedule(() -> fire(CancellationCause.DEADLINE_EXCEEDED),
                delayMs, TimeUnit.MILLISECONDS);
    }

    /** Creates a context whose deadline is {@code timeout} from now. */
    public static ExecutionContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    static ExecutionContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        return new ExecutionContext(timeout, clock);
    }

    /** Attaches the task's build log writers. Either may be null (local-only run). */
    public ExecutionContext withLogWriters(BuildLogWriter stdout, BuildLogWriter stderr) {
        this.stdout = stdout;
        this.stderr = stderr;
        return this;
    }

    /** Stdout build log writer, or null when the bus is unavailable. */
    public BuildLogWriter getStdout() {
        return stdout;
    }

    /** Stderr build log writer, or null when the bus is unavailable. */
    public BuildLogWriter getStderr() {
        return stderr;
    }

    public boolean hasLogWriters() {
        return stdout != null && stderr != null;
    }

    /** Sets the phase on both log writers (no-op when none are attached). */
    public void setPhase(String phase) {
        BuildLogWriter out = stdout;
        BuildLogWriter err = stderr;
        if (out != null) out.setPhase(phase);
        if (err != null) err.setPhase(phase);
    }

    /** Writes one progress line to the stdout log writer and to the application log. */
    public void logLine(String line) {
        log.info(line);
        BuildLogWriter out = stdout;
        if (out != null) {
            out.println(line);
        }
    }

    public Instant getDeadline() {
        return deadline;
    }

    /** Time left until the deadline; {@link Duration#ZERO} once it has passed. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /** Cancels the context with {@link CancellationCause#CANCELLED} unless already cancelled. */
    public void cancel() {
        fire(CancellationCause.CANCELLED);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** Whether the context was cancelled because its deadline elapsed. */
    public boolean isDeadlineExceeded() {
        return getCancellationCause() == CancellationCause.DEADLINE_EXCEEDED;
    }

    /** Cause of cancellation, or null while the context is live. */
    public CancellationCause getCancellationCause() {
        return signal.getNow(null);
    }

    /**
     * Throws when the context is cancelled. Call before each step of a handler or plugin.
     *
     * @throws ExecutionCancelledException carrying the cancellation cause
     */
    public void throwIfCancelled() throws ExecutionCancelledException {
        CancellationCause cause = getCancellationCause();
        if (cause != null) {
            throw new ExecutionCancelledException(cause);
        }
    }

    /** Blocks until the context is cancelled and returns the cause. */
    public CancellationCause awaitCancellation() throws InterruptedException {
        try {
            return signal.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("cancellation signal completed exceptionally", e.getCause());
        }
    }

    /**
     * Waits for {@code future} unless the context is cancelled first.
     *
     * @return the future's value
     * @throws ExecutionCancelledException when the context is cancelled before the future completes
     * @throws ExecutionException          when the future completed exceptionally
     */
    public <T> T await(CompletableFuture<T> future) throws ExecutionCancelledException, ExecutionException,
            InterruptedException {
        CompletableFuture.anyOf(future, signal).get();
        if (future.isDone()) {
            return future.get();
        }
        throw new ExecutionCancelledException(getCancellationCause());
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true when the context was cancelled within the wait
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        try {
            signal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("cancellation signal completed exceptionally", e.getCause());
        }
    }

    /**
     * Registers a callback run once on cancellation; runs it immediately when already cancelled.
     *
     * @return a handle that unregisters the callback when run
     */
    public Runnable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        cancelCallbacks.add(callback);
        if (isCancelled() && cancelCallbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> cancelCallbacks.remove(callback);
    }

    /** Stops the deadline timer. Does not cancel the context. */
    @Override
    public void close() {
        deadlineTask.cancel(false);
        scheduler.shutdownNow();
    }

    private void fire(CancellationCause cause) {
        if (!signal.complete(cause)) {
            return;
        }
        log.debug("Execution context cancelled: {}", cause);
        for (Runnable callback : cancelCallbacks) {
            if (cancelCallbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
