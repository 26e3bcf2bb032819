package com.cso.plugin.docker;

import com.cso.annotations.ResourceCleanup;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.CommandResult;
import com.cso.plugin.CommandRunner;
import com.cso.plugin.PluginProvider;
import com.cso.plugin.RegistryPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider for the {@code docker} builder and registry. Remembers every registry its registry
 * components logged in to and runs {@code docker logout} for them on exit.
 */
public final class DockerPluginProvider implements PluginProvider, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(DockerPluginProvider.class);

    public static final String NAME = "docker";

    private static final Duration LOGOUT_TIMEOUT = Duration.ofSeconds(30);

    private final Set<String> loggedIn = ConcurrentHashMap.newKeySet();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BuilderPlugin createBuilder() {
        return new DockerBuilder();
    }

    @Override
    public RegistryPlugin createRegistry() {
        return new DockerRegistry(System::getenv, loggedIn);
    }

    @Override
    public void onExit() {
        List<String> registries = new ArrayList<>(loggedIn);
        loggedIn.clear();
        if (registries.isEmpty()) {
            return;
        }
        try (ExecutionContext ctx = ExecutionContext.withTimeout(LOGOUT_TIMEOUT)) {
            for (String registry : registries) {
                logout(ctx, registry);
            }
        }
    }

    private static void logout(ExecutionContext ctx, String registry) {
        try {
            CommandResult result = CommandRunner.of("docker", "logout", registry).quiet().run(ctx);
            if (!result.isSuccess()) {
                log.warn("docker logout {} exited {}: {}", registry, result.getExitCode(), result.getStderr().strip());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("docker logout {} interrupted", registry);
        } catch (Exception e) {
            log.warn("docker logout {} failed: {}", registry, e.getMessage());
        }
    }

    /** Registries logged in to and not yet logged out of. */
    Set<String> getLoggedInRegistries() {
        return Set.copyOf(loggedIn);
    }
}
