package com.cso.dispatch;

import com.cso.logstream.BuildLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Reports a fatal dispatch error: an error log entry plus an {@code ERROR [<phase>]: <message>}
 * line on the error stream and, when attached, the stderr build log.
 */
public final class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    public static final String PARSE_TASK_TYPE = "parse_task_type";
    public static final String PARSE_PARAMS = "parse_params";
    public static final String VALIDATE = "validate";
    public static final String HANDLER_EXECUTION = "handler_execution";
    public static final String TIMEOUT = "timeout";

    private final PrintStream err;

    public ErrorReporter(PrintStream err) {
        this.err = err;
    }

    public void report(String phase, String message) {
        report(phase, message, null);
    }

    public void report(String phase, String message, BuildLogWriter buildLog) {
        log.error("Operation failed (phase={}): {}", phase, message);
        String line = format(phase, message);
        err.println(line);
        err.flush();
        if (buildLog != null) {
            buildLog.println(line);
        }
    }

    static String format(String phase, String message) {
        return "ERROR [" + phase + "]: " + message;
    }
}
