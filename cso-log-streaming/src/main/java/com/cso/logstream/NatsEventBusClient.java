package com.cso.logstream;

import com.cso.config.CsoConfig;
import com.cso.metrics.DispatchMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.AuthHandler;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamOptions;
import io.nats.client.NKey;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventBusClient} over a single NKey-authenticated NATS connection with JetStream publish.
 * <p>
 * Reconnection is bounded (max reconnects and wait from {@link CsoConfig}); disconnects and
 * reconnects are logged, never fatal. Every publish waits for the JetStream ack within the
 * publish timeout and then flushes the connection; a flush failure is only a warning.
 */
public final class NatsEventBusClient implements EventBusClient {

    private static final Logger log = LoggerFactory.getLogger(NatsEventBusClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Connection connection;
    private final JetStream jetStream;
    private final String prefix;
    private final Duration publishTimeout;

    NatsEventBusClient(Connection connection, JetStream jetStream, String prefix, Duration publishTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.jetStream = Objects.requireNonNull(jetStream, "jetStream");
        this.prefix = prefix != null ? prefix : "";
        this.publishTimeout = publishTimeout;
    }

    /**
     * Connects to the servers in {@code config} authenticating with the configured NKey seed.
     *
     * @throws BusException when the seed is invalid or no server accepts the connection
     */
    public static NatsEventBusClient connect(CsoConfig config) throws BusException {
        if (!config.isBusConfigured()) {
            throw new BusException("NATS servers or client private key not configured");
        }
        AuthHandler authHandler = nkeyAuthHandler(config.getNatsClientPrivateKey());
        Options options = new Options.Builder()
                .servers(config.getNatsServers().toArray(new String[0]))
                .authHandler(authHandler)
                .maxReconnects(config.getNatsMaxReconnects())
                .reconnectWait(config.getNatsReconnectWait())
                .connectionListener(new LoggingConnectionListener())
                .build();
        try {
            Connection connection = Nats.connect(options);
            JetStream jetStream = connection.jetStream(JetStreamOptions.builder()
                    .requestTimeout(config.getNatsPublishTimeout())
                    .build());
            log.info("Connected to NATS {} (prefix={})", connection.getConnectedUrl(), config.getNatsStreamPrefix());
            return new NatsEventBusClient(connection, jetStream, config.getNatsStreamPrefix(), config.getNatsPublishTimeout());
        } catch (IOException e) {
            throw new BusException("failed to connect to NATS: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusException("interrupted while connecting to NATS", e);
        }
    }

    /**
     * Auth handler that answers the server nonce challenge by signing it with the seed's key pair.
     */
    static AuthHandler nkeyAuthHandler(String seed) throws BusException {
        NKey nkey;
        char[] publicKey;
        try {
            nkey = NKey.fromSeed(seed.trim().toCharArray());
            publicKey = nkey.getPublicKey();
        } catch (GeneralSecurityException | IOException | RuntimeException e) {
            throw new BusException("invalid NKey seed: " + e.getMessage(), e);
        }
        return new AuthHandler() {
            @Override
            public byte[] sign(byte[] nonce) {
                try {
                    return nkey.sign(nonce);
                } catch (GeneralSecurityException | IOException e) {
                    log.error("Failed to sign NATS nonce: {}", e.getMessage());
                    return null;
                }
            }

            @Override
            public char[] getID() {
                return publicKey;
            }

            @Override
            public char[] getJWT() {
                return null;
            }
        };
    }

    @Override
    public void publish(String baseSubject, Object payload) throws BusException {
        String subject = Subjects.withPrefix(prefix, baseSubject);
        byte[] data;
        try {
            data = MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new BusException("failed to serialize payload for " + subject + ": " + e.getMessage(), e);
        }
        try {
            jetStream.publish(subject, data);
        } catch (IOException | JetStreamApiException | RuntimeException e) {
            // a closed or draining connection surfaces as IllegalStateException
            log.error("Failed to publish event subject={} error={}", subject, e.getMessage());
            throw new BusException("failed to publish to " + subject + ": " + e.getMessage(), e);
        }
        try {
            connection.flush(publishTimeout);
        } catch (TimeoutException | IllegalStateException e) {
            log.warn("Failed to flush NATS connection subject={} error={}", subject, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing NATS connection subject={}", subject);
        }
        if (!baseSubject.startsWith(Subjects.BUILD_LOG + ".")) {
            DispatchMetrics.busEventPublished(baseSubject);
        }
        log.debug("Published and flushed event subject={}", subject);
    }

    /** Drains pending messages (bounded by the publish timeout) and closes the connection. */
    @Override
    public void close() {
        try {
            connection.drain(publishTimeout).get();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("NATS drain did not complete cleanly: {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing NATS connection");
        }
        log.info("NATS connection closed");
    }

    private static final class LoggingConnectionListener implements ConnectionListener {
        @Override
        public void connectionEvent(Connection conn, Events type) {
            switch (type) {
                case DISCONNECTED:
                    log.warn("Disconnected from NATS");
                    break;
                case RECONNECTED:
                    log.info("Reconnected to NATS {}", conn.getConnectedUrl());
                    break;
                case CLOSED:
                    log.debug("NATS connection closed event");
                    break;
                default:
                    log.debug("NATS connection event {}", type);
                    break;
            }
        }
    }
}
