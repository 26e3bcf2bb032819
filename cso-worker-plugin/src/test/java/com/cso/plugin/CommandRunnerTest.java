package com.cso.plugin;

import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.BuildLogPayload;
import com.cso.logstream.BuildLogWriter;
import com.cso.logstream.EventBusClient;
import com.cso.logstream.LogOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandRunnerTest {

    private final List<BuildLogPayload> published = new CopyOnWriteArrayList<>();

    private final EventBusClient bus = new EventBusClient() {
        @Override
        public void publish(String baseSubject, Object payload) {
            if (payload instanceof BuildLogPayload) published.add((BuildLogPayload) payload);
        }

        @Override
        public void close() {
        }
    };

    @Test
    void run_capturesOutputAndExitCode() throws Exception {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            CommandResult result = CommandRunner.of("sh", "-c", "echo hello; echo oops 1>&2; exit 3").run(ctx);

            assertEquals(3, result.getExitCode());
            assertFalse(result.isSuccess());
            assertEquals("hello\n", result.getStdout());
            assertEquals("oops\n", result.getStderr());
        }
    }

    @Test
    void run_streamsIntoLogWriters() throws Exception {
        BuildLogWriter out = new BuildLogWriter(bus, "d", 1, "s", "o", LogOutput.STDOUT);
        BuildLogWriter err = new BuildLogWriter(bus, "d", 1, "s", "o", LogOutput.STDERR);
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1)).withLogWriters(out, err)) {
            CommandRunner.of("sh", "-c", "echo one; echo two; printf tail").run(ctx);
        }

        assertEquals(3, published.size());
        assertEquals("one\n", published.get(0).getContent());
        assertEquals("tail", published.get(2).getContent());
    }

    @Test
    void run_drainsOutputWhenBusRejectsLogLines() throws Exception {
        EventBusClient closed = new EventBusClient() {
            @Override
            public void publish(String baseSubject, Object payload) {
                throw new IllegalStateException("Connection is Closed");
            }

            @Override
            public void close() {
            }
        };
        BuildLogWriter out = new BuildLogWriter(closed, "d", 1, "s", "o", LogOutput.STDOUT);
        BuildLogWriter err = new BuildLogWriter(closed, "d", 1, "s", "o", LogOutput.STDERR);
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofSeconds(30)).withLogWriters(out, err)) {
            // more than a pipe buffer, so a dead pump would block the child
            CommandResult result = CommandRunner.of("sh", "-c", "i=0; while [ $i -lt 5000 ]; do echo line-$i-padding-padding; i=$((i+1)); done")
                    .run(ctx);

            assertTrue(result.isSuccess());
            assertEquals(5000, out.getSequence());
        }
    }

    @Test
    void run_quietDoesNotStream() throws Exception {
        BuildLogWriter out = new BuildLogWriter(bus, "d", 1, "s", "o", LogOutput.STDOUT);
        BuildLogWriter err = new BuildLogWriter(bus, "d", 1, "s", "o", LogOutput.STDERR);
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1)).withLogWriters(out, err)) {
            CommandResult result = CommandRunner.of("sh", "-c", "echo secret-ish").quiet().run(ctx);
            assertEquals("secret-ish\n", result.getStdout());
        }

        assertTrue(published.isEmpty());
    }

    @Test
    void run_passesStdinEnvAndDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("marker.txt"), "x");
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            CommandResult result = CommandRunner.of("sh", "-c", "read line; echo \"$line-$GREETING\"; ls")
                    .directory(dir)
                    .env("GREETING", "hi")
                    .stdin("input\n")
                    .run(ctx);

            assertEquals("input-hi\nmarker.txt\n", result.getStdout());
        }
    }

    @Test
    void runChecked_redactsSecretsInFailure() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            CommandRunner runner = CommandRunner.of("sh", "-c", "echo 'fatal: https://tok123@host/repo' 1>&2; exit 128")
                    .redact("tok123");

            CommandFailedException e = assertThrows(CommandFailedException.class, () -> runner.runChecked(ctx));
            assertEquals(128, e.getExitCode());
            assertTrue(e.getMessage().contains("***REDACTED***"), e.getMessage());
            assertFalse(e.getMessage().contains("tok123"));
            assertFalse(runner.describe().contains("tok123"));
        }
    }

    @Test
    void run_isCancelledByDeadline() {
        long start = System.currentTimeMillis();
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMillis(300))) {
            ExecutionCancelledException e = assertThrows(ExecutionCancelledException.class,
                    () -> CommandRunner.of("sleep", "30").run(ctx));
            assertTrue(e.isDeadlineExceeded());
        }
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void run_failsFastOnCancelledContext() {
        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            ctx.cancel();

            assertThrows(ExecutionCancelledException.class, () -> CommandRunner.of("echo", "never").run(ctx));
        }
    }

    @Test
    void lastLines_keepsTail() {
        assertEquals("c\nd", CommandRunner.lastLines("a\nb\nc\nd\n", 2));
        assertEquals("a", CommandRunner.lastLines("a\n", 5));
    }
}
