package com.cso.plugin;

import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.BuildLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one external tool under an {@link ExecutionContext}. The tool's stdout and stderr are
 * streamed into the context's build log writers (when attached) and a bounded tail of each is
 * captured for error reporting. Cancellation of the context destroys the process tree, so a
 * run never blocks past the deadline.
 * <p>
 * Secrets registered with {@link #redact(String)} are replaced in captured output and error
 * messages; they are never logged.
 */
public final class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    static final String REDACTED = "***REDACTED***";
    static final int CAPTURE_LIMIT = 64 * 1024;
    private static final long PUMP_JOIN_MILLIS = 5_000;

    private final List<String> command;
    private final Map<String, String> environment = new LinkedHashMap<>();
    private final List<String> secrets = new ArrayList<>();
    private Path directory;
    private String stdin;
    private boolean streamOutput = true;

    private CommandRunner(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must be non-empty");
        }
        this.command = List.copyOf(command);
    }

    public static CommandRunner of(String... command) {
        return new CommandRunner(List.of(command));
    }

    public static CommandRunner of(List<String> command) {
        return new CommandRunner(command);
    }

    public CommandRunner directory(Path directory) {
        this.directory = directory;
        return this;
    }

    public CommandRunner env(String key, String value) {
        if (key != null && value != null) {
            environment.put(key, value);
        }
        return this;
    }

    public CommandRunner env(Map<String, String> env) {
        if (env != null) env.forEach(this::env);
        return this;
    }

    /** Text written to the process's stdin, then stdin is closed (e.g. a registry password). */
    public CommandRunner stdin(String stdin) {
        this.stdin = stdin;
        return this;
    }

    /** Captures output without streaming it to the build log writers. */
    public CommandRunner quiet() {
        this.streamOutput = false;
        return this;
    }

    /** Registers a secret to be replaced with {@value #REDACTED} in captured output and messages. */
    public CommandRunner redact(String secret) {
        if (secret != null && !secret.isEmpty()) {
            secrets.add(secret);
        }
        return this;
    }

    /** Command line with secrets redacted, for logs and error messages. */
    public String describe() {
        return redactText(String.join(" ", command));
    }

    /**
     * Runs the command to completion.
     *
     * @return exit code and captured output (non-zero exit is not an error here)
     * @throws ExecutionCancelledException when the context is cancelled before or during the run
     * @throws IOException                 when the process cannot be started
     */
    public CommandResult run(ExecutionContext ctx) throws IOException, InterruptedException, ExecutionCancelledException {
        Objects.requireNonNull(ctx, "ctx");
        ctx.throwIfCancelled();
        ProcessBuilder pb = new ProcessBuilder(command);
        if (directory != null) {
            pb.directory(directory.toFile());
        }
        pb.environment().putAll(environment);
        log.debug("Running {} (dir={})", describe(), directory);

        Process process = pb.start();
        Runnable unregister = ctx.onCancel(() -> destroyTree(process));
        TailBuffer out = new TailBuffer();
        TailBuffer err = new TailBuffer();
        BuildLogWriter stdoutWriter = streamOutput ? ctx.getStdout() : null;
        BuildLogWriter stderrWriter = streamOutput ? ctx.getStderr() : null;
        Thread outPump = pump(process.getInputStream(), stdoutWriter, out, "cso-cmd-stdout");
        Thread errPump = pump(process.getErrorStream(), stderrWriter, err, "cso-cmd-stderr");
        try {
            writeStdin(process);
            int exitCode = process.waitFor();
            outPump.join(PUMP_JOIN_MILLIS);
            errPump.join(PUMP_JOIN_MILLIS);
            flushQuietly(stdoutWriter);
            flushQuietly(stderrWriter);
            ctx.throwIfCancelled();
            CommandResult result = new CommandResult(exitCode, redactText(out.text()), redactText(err.text()));
            if (!streamOutput || stdoutWriter == null) {
                log.debug("{} exited {} stdout={}", command.get(0), exitCode, result.getStdout());
            }
            return result;
        } catch (InterruptedException e) {
            destroyTree(process);
            throw e;
        } finally {
            unregister.run();
        }
    }

    /**
     * Runs the command and fails on a non-zero exit.
     *
     * @throws CommandFailedException with the redacted command, exit code and stderr tail
     */
    public CommandResult runChecked(ExecutionContext ctx)
            throws IOException, InterruptedException, ExecutionCancelledException, CommandFailedException {
        CommandResult result = run(ctx);
        if (!result.isSuccess()) {
            String output = !result.getStderr().isBlank() ? result.getStderr() : result.getStdout();
            String tool = command.get(0) + (command.size() > 1 ? " " + command.get(1) : "");
            throw new CommandFailedException(tool + " failed with exit code " + result.getExitCode()
                    + (output.isBlank() ? "" : ": " + lastLines(output, 20)), result.getExitCode(), output);
        }
        return result;
    }

    /** Replaces every registered secret in {@code text}. */
    String redactText(String text) {
        if (text == null) return null;
        String out = text;
        for (String secret : secrets) {
            out = out.replace(secret, REDACTED);
        }
        return out;
    }

    private void writeStdin(Process process) throws IOException {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    private static Thread pump(InputStream in, OutputStream target, TailBuffer capture, String name) {
        Thread t = new Thread(() -> {
            byte[] buf = new byte[8192];
            try (InputStream input = in) {
                int n;
                while ((n = input.read(buf)) != -1) {
                    capture.write(buf, n);
                    if (target != null) {
                        try {
                            target.write(buf, 0, n);
                        } catch (RuntimeException e) {
                            // keep draining so the child never blocks on a full pipe
                            log.warn("Output pump {} dropped {} bytes: {}", name, n, e.getMessage());
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Output pump {} ended: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void flushQuietly(BuildLogWriter writer) {
        if (writer == null) return;
        try {
            writer.flush();
        } catch (IOException e) {
            log.warn("Failed to flush build log writer ({}): {}", writer.getStream().getWireName(), e.getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    static String lastLines(String text, int max) {
        String[] lines = text.strip().split("\n");
        if (lines.length <= max) return text.strip();
        StringBuilder sb = new StringBuilder();
        for (int i = lines.length - max; i < lines.length; i++) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    /** Keeps the last {@link #CAPTURE_LIMIT} bytes written. */
    private static final class TailBuffer {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        synchronized void write(byte[] b, int len) {
            bytes.write(b, 0, len);
            if (bytes.size() > 2 * CAPTURE_LIMIT) {
                byte[] all = bytes.toByteArray();
                bytes.reset();
                bytes.write(all, all.length - CAPTURE_LIMIT, CAPTURE_LIMIT);
            }
        }

        synchronized String text() {
            byte[] all = bytes.toByteArray();
            int from = Math.max(0, all.length - CAPTURE_LIMIT);
            return new String(all, from, all.length - from, StandardCharsets.UTF_8);
        }
    }
}
