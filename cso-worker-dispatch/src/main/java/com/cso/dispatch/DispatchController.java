package com.cso.dispatch;

import com.cso.config.CsoConfig;
import com.cso.dispatch.handler.DeploymentHandler;
import com.cso.dispatch.handler.DeploymentHandlerRegistry;
import com.cso.dispatch.handler.HandlerContext;
import com.cso.dispatch.task.BaseDeploymentParams;
import com.cso.dispatch.task.Task;
import com.cso.dispatch.task.TaskParams;
import com.cso.dispatch.task.TaskParseException;
import com.cso.dispatch.task.TaskParser;
import com.cso.dispatch.task.TaskType;
import com.cso.dispatch.task.TaskValidationException;
import com.cso.executioncontext.CancellationCause;
import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.BuildLogEndPayload;
import com.cso.logstream.BuildLogWriter;
import com.cso.logstream.BusException;
import com.cso.logstream.EventBusClient;
import com.cso.logstream.LogEndStatus;
import com.cso.logstream.LogOutput;
import com.cso.metrics.DispatchMetrics;
import com.cso.plugin.PluginLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one dispatched task: parses it, builds a deadline-bound execution context, attaches the
 * build log writers when the bus is reachable, runs the matching handler on its own thread and
 * races it against the deadline.
 * <p>
 * Every path after parsing releases in the same order: both log writers are closed, one
 * {@code build.log.end} event is published, the bus connection is closed and the process waits
 * a short grace period so the scheduler captures the final output.
 */
public final class DispatchController {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    static final long MONITOR_JOIN_MILLIS = 1_000;

    private final CsoConfig config;
    private final DeploymentHandlerRegistry handlers;
    private final PluginLoader pluginLoader;
    private final BusConnector busConnector;
    private final PrintStream out;
    private final ErrorReporter errors;
    private final String version;

    public DispatchController(CsoConfig config, DeploymentHandlerRegistry handlers, PluginLoader pluginLoader,
                              BusConnector busConnector, PrintStream out, PrintStream err, String version) {
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.pluginLoader = Objects.requireNonNull(pluginLoader, "pluginLoader");
        this.busConnector = Objects.requireNonNull(busConnector, "busConnector");
        this.out = Objects.requireNonNull(out, "out");
        this.errors = new ErrorReporter(Objects.requireNonNull(err, "err"));
        this.version = version;
    }

    public ExitCode run(TaskEnvironment env) {
        Instant start = Instant.now();
        TaskParser parser = new TaskParser(config.getBackendUrl(), config.getAccessToken());

        TaskType type;
        try {
            type = parser.parseTaskType(env.get(TaskParser.ENV_TASK));
        } catch (TaskParseException e) {
            errors.report(ErrorReporter.PARSE_TASK_TYPE, e.getMessage());
            DispatchMetrics.taskOutcome(null, ExitCode.PARSE_ERROR.name());
            return ExitCode.PARSE_ERROR;
        }

        out.println("=== Dispatch Execution Started ===");
        out.println("Task: " + type.getWireName());
        out.println("Start time: " + DateTimeFormatter.ISO_OFFSET_DATE_TIME
                .format(start.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC)));
        out.println("Orchestrator version: " + version);

        TaskParams params;
        try {
            params = parser.parseParams(type, env.get(TaskParser.ENV_PARAMS));
        } catch (TaskParseException e) {
            errors.report(ErrorReporter.PARSE_PARAMS, e.getMessage());
            printCompleted(start);
            DispatchMetrics.taskOutcome(type.getWireName(), ExitCode.PARSE_ERROR.name());
            return ExitCode.PARSE_ERROR;
        }
        Task task = new Task(type, params);
        BaseDeploymentParams deployment = task.getDeploymentParams();
        if (deployment != null) {
            out.println("Deployment ID: " + deployment.getDeploymentId() + ", Job ID: " + deployment.getDeploymentJobId());
        }
        out.flush();

        ExitCode exit = execute(task);
        if (exit == ExitCode.SUCCESS) {
            out.println("Dispatch task completed successfully");
        }
        printCompleted(start);
        return exit;
    }

    private ExitCode execute(Task task) {
        BaseDeploymentParams deployment = task.getDeploymentParams();
        // the deadline counts from parameter acceptance, connect time included
        ExecutionContext ctx = ExecutionContext.withTimeout(config.getTaskTimeout());
        EventBusClient bus = connectBus();
        BuildLogWriter stdout = null;
        BuildLogWriter stderr = null;
        if (bus != null && deployment != null && !isBlank(deployment.getDeploymentId())) {
            stdout = newWriter(bus, deployment, LogOutput.STDOUT);
            stderr = newWriter(bus, deployment, LogOutput.STDERR);
            ctx.withLogWriters(stdout, stderr);
            log.info("Build log streaming enabled (deploymentId={})", deployment.getDeploymentId());
        }

        AtomicBoolean timedOut = new AtomicBoolean();
        Thread monitor = startMonitor(ctx, timedOut);
        ExitCode exit = ExitCode.RUNTIME_ERROR;
        try {
            exit = dispatch(task, ctx, bus, monitor, timedOut);
            return exit;
        } finally {
            closeWriter(stdout);
            closeWriter(stderr);
            if (stdout != null) {
                publishLogEnd(bus, deployment, exit);
            }
            if (bus != null) {
                bus.close();
            }
            ctx.close();
            monitor.interrupt();
            DispatchMetrics.taskOutcome(task.getType().getWireName(), exit.name());
            graceDelay();
        }
    }

    private ExitCode dispatch(Task task, ExecutionContext ctx, EventBusClient bus, Thread monitor, AtomicBoolean timedOut) {
        DeploymentHandler handler = handlers.forType(task.getType());
        if (handler == null) {
            errors.report(ErrorReporter.HANDLER_EXECUTION, "unsupported task type: " + task.getType(), ctx.getStderr());
            return ExitCode.RUNTIME_ERROR;
        }
        try {
            checkParams(handler, task);
        } catch (TaskValidationException e) {
            errors.report(ErrorReporter.VALIDATE, e.getMessage(), ctx.getStderr());
            return ExitCode.VALIDATION_ERROR;
        }

        HandlerContext hctx = new HandlerContext(ctx, bus, pluginLoader, config);
        CompletableFuture<Void> done = new CompletableFuture<>();
        Thread worker = new Thread(() -> {
            try {
                handler.handle(hctx, task.getParams());
                done.complete(null);
            } catch (Throwable t) {
                done.completeExceptionally(t);
            }
        }, "cso-handler");
        worker.setDaemon(true);
        log.info("Dispatching {} to {}", task.getType(), handler.getClass().getSimpleName());
        worker.start();

        Throwable failure = null;
        try {
            ctx.await(done);
        } catch (ExecutionCancelledException e) {
            failure = e;
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            failure = e;
        }

        if (ctx.isCancelled()) {
            joinQuietly(monitor);
        }
        if (timedOut.get()) {
            errors.report(ErrorReporter.TIMEOUT, "task execution timed out after " + format(config.getTaskTimeout()),
                    ctx.getStderr());
            return ExitCode.TIMEOUT;
        }
        if (failure != null) {
            errors.report(ErrorReporter.HANDLER_EXECUTION, messageOf(failure), ctx.getStderr());
            return ExitCode.RUNTIME_ERROR;
        }
        log.info("Dispatch task completed successfully");
        return ExitCode.SUCCESS;
    }

    private static void checkParams(DeploymentHandler handler, Task task) throws TaskValidationException {
        if (!handler.paramsType().isInstance(task.getParams())) {
            throw new TaskValidationException("invalid parameters for " + task.getType() + " task");
        }
    }

    private EventBusClient connectBus() {
        if (!config.isBusConfigured()) {
            log.warn("Event bus not configured ({} / {} unset); running without build log streaming",
                    CsoConfig.ENV_NATS_SERVERS, CsoConfig.ENV_NATS_CLIENT_PRIVATE_KEY);
            return null;
        }
        try {
            EventBusClient bus = busConnector.connect(config);
            log.info("Connected to event bus {}", config.getNatsServers());
            return bus;
        } catch (BusException e) {
            log.warn("Failed to connect to event bus, continuing without log streaming: {}", e.getMessage());
            return null;
        }
    }

    private static BuildLogWriter newWriter(EventBusClient bus, BaseDeploymentParams params, LogOutput stream) {
        return new BuildLogWriter(bus, params.getDeploymentId(), params.getDeploymentJobId(),
                params.getServiceId(), params.getOwnerId(), stream);
    }

    /** Blocks on the cancellation signal; records a deadline-caused cancellation as a timeout. */
    private Thread startMonitor(ExecutionContext ctx, AtomicBoolean timedOut) {
        Thread monitor = new Thread(() -> {
            try {
                CancellationCause cause = ctx.awaitCancellation();
                if (cause == CancellationCause.DEADLINE_EXCEEDED) {
                    timedOut.set(true);
                    log.error("Task execution timed out after {}", format(config.getTaskTimeout()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "cso-deadline-monitor");
        monitor.setDaemon(true);
        monitor.start();
        return monitor;
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(MONITOR_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeWriter(BuildLogWriter writer) {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to flush {} build log on close: {}", writer.getStream().getWireName(), e.getMessage());
        }
    }

    private static void publishLogEnd(EventBusClient bus, BaseDeploymentParams params, ExitCode exit) {
        LogEndStatus status = exit == ExitCode.SUCCESS ? LogEndStatus.SUCCESS
                : exit == ExitCode.TIMEOUT ? LogEndStatus.TIMEOUT
                : LogEndStatus.FAILED;
        try {
            bus.publishBuildLogEnd(new BuildLogEndPayload(params.getDeploymentId(), params.getDeploymentJobId(), status));
            log.info("Published build log end (deploymentId={}, status={})", params.getDeploymentId(), status.getWireName());
        } catch (BusException e) {
            log.warn("Failed to publish build log end (deploymentId={}): {}", params.getDeploymentId(), e.getMessage());
        }
    }

    private void graceDelay() {
        long millis = config.getExitGrace().toMillis();
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void printCompleted(Instant start) {
        out.println("=== Dispatch Execution Completed ===");
        out.println("Duration: " + format(Duration.between(start, Instant.now())));
        out.flush();
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    static String format(Duration d) {
        long millis = d.toMillis();
        if (millis < 1_000) return millis + "ms";
        long seconds = d.getSeconds();
        if (seconds < 60) return String.format(Locale.ROOT, "%.3fs", millis / 1000.0);
        return (seconds / 60) + "m" + (seconds % 60) + "s";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
