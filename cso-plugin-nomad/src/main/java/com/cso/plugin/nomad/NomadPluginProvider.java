package com.cso.plugin.nomad;

import com.cso.annotations.ResourceCleanup;
import com.cso.plugin.PlatformPlugin;
import com.cso.plugin.PluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider for the {@code nomad} platform. Platform components share one {@link HttpClient}
 * whose executor is shut down on exit.
 */
public final class NomadPluginProvider implements PluginProvider, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(NomadPluginProvider.class);

    public static final String NAME = "nomad";

    private final ExecutorService executor;
    private final HttpClient httpClient;

    public NomadPluginProvider() {
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cso-nomad-http-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.httpClient = HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public PlatformPlugin createPlatform() {
        return new NomadPlatform(httpClient);
    }

    @Override
    public void onExit() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.debug("Nomad HTTP executor shut down");
    }
}
