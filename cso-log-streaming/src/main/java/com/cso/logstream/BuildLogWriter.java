package com.cso.logstream;

import com.cso.metrics.DispatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Byte-stream-to-event adapter for one output stream (stdout or stderr) of one deployment.
 * <p>
 * Bytes are buffered; every newline slices off one {@link BuildLogPayload} carrying the line
 * (terminator included), the next sequence number and the phase in effect at emission.
 * Unterminated bytes stay buffered until the next newline or {@link #flush()}.
 * Lines are decoded as UTF-8 only when emitted, so multi-byte characters split across writes
 * are kept intact.
 * <p>
 * A publish failure during {@code write} is logged and swallowed so the producing process is
 * never blocked by the bus; a failure during {@link #flush()} or {@link #close()} is thrown.
 * One lock guards buffer, sequence and phase.
 */
public final class BuildLogWriter extends OutputStream {

    private static final Logger log = LoggerFactory.getLogger(BuildLogWriter.class);

    /** Phase of a writer before any handler sets one. */
    public static final String INITIAL_PHASE = "init";

    private final EventBusClient client;
    private final String deploymentId;
    private final int jobId;
    private final String serviceId;
    private final String ownerId;
    private final LogOutput stream;
    private final LongSupplier clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private long sequence;
    private String phase = INITIAL_PHASE;

    public BuildLogWriter(EventBusClient client, String deploymentId, int jobId, String serviceId,
                          String ownerId, LogOutput stream) {
        this(client, deploymentId, jobId, serviceId, ownerId, stream, System::currentTimeMillis);
    }

    BuildLogWriter(EventBusClient client, String deploymentId, int jobId, String serviceId,
                   String ownerId, LogOutput stream, LongSupplier clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.deploymentId = deploymentId;
        this.jobId = jobId;
        this.serviceId = serviceId;
        this.ownerId = ownerId;
        this.stream = Objects.requireNonNull(stream, "stream");
        this.clock = clock;
    }

    /**
     * Consumes all of {@code data}, emitting one event per complete line.
     *
     * @return {@code data.length}, always
     */
    public int consume(byte[] data) {
        write(data, 0, data.length);
        return data.length;
    }

    /** Writes {@code line} followed by a newline. */
    public void println(String line) {
        consume((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void write(int b) {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) {
        Objects.checkFromIndexSize(off, len, b.length);
        lock.lock();
        try {
            int start = off;
            int end = off + len;
            for (int i = off; i < end; i++) {
                if (b[i] == '\n') {
                    buffer.write(b, start, i - start + 1);
                    BusException failure = emitBuffered();
                    if (failure != null) {
                        log.warn("Failed to publish build log line deploymentId={} stream={} sequence={}: {}",
                                deploymentId, stream.getWireName(), sequence, failure.getMessage());
                    }
                    start = i + 1;
                }
            }
            if (start < end) {
                buffer.write(b, start, end - start);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emits any buffered partial line as one event (no terminator appended) and clears the buffer.
     *
     * @throws IOException when the event could not be published
     */
    @Override
    public void flush() throws IOException {
        lock.lock();
        try {
            if (buffer.size() > 0) {
                BusException failure = emitBuffered();
                if (failure != null) {
                    throw new IOException("failed to publish build log: " + failure.getMessage(), failure);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /** Equivalent to {@link #flush()}; repeated calls are harmless. */
    @Override
    public void close() throws IOException {
        flush();
    }

    /** Sets the phase attached to events emitted from now on. */
    public void setPhase(String phase) {
        lock.lock();
        try {
            this.phase = phase;
        } finally {
            lock.unlock();
        }
    }

    public String getPhase() {
        lock.lock();
        try {
            return phase;
        } finally {
            lock.unlock();
        }
    }

    /** Sequence number of the last emitted event; 0 before the first. */
    public long getSequence() {
        lock.lock();
        try {
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    public LogOutput getStream() {
        return stream;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public int getJobId() {
        return jobId;
    }

    /** Emits the buffer as one event and clears it. Returns the publish failure, or null. */
    private BusException emitBuffered() {
        String content = buffer.toString(StandardCharsets.UTF_8);
        buffer.reset();
        sequence++;
        BuildLogPayload payload = new BuildLogPayload(deploymentId, jobId, serviceId, ownerId,
                stream, content, clock.getAsLong(), sequence, phase);
        try {
            client.publishBuildLog(payload);
            DispatchMetrics.logEventPublished(stream.getWireName());
            return null;
        } catch (BusException e) {
            DispatchMetrics.logEventFailed(stream.getWireName());
            return e;
        } catch (RuntimeException e) {
            DispatchMetrics.logEventFailed(stream.getWireName());
            return new BusException("failed to publish build log: " + e.getMessage(), e);
        }
    }
}
