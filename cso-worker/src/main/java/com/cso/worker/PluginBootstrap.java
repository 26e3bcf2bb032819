package com.cso.worker;

import com.cso.annotations.ResourceCleanup;
import com.cso.plugin.PluginManager;
import com.cso.plugin.PluginProvider;
import com.cso.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers plugin providers with the {@link PluginRegistry} before any task is dispatched and
 * runs their exit hooks afterwards.
 */
public final class PluginBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PluginBootstrap.class);

    private PluginBootstrap() {
    }

    /**
     * Registers the manager's providers and seals the registry. A failing internal provider is
     * fatal; a failing community provider is logged and skipped.
     *
     * @return number of providers registered
     */
    public static int registerAll(PluginManager pluginManager, PluginRegistry registry) {
        int count = 0;
        // Internal plugins: any failure (duplicate name, no capability) is fatal.
        for (PluginProvider provider : pluginManager.getInternalProviders()) {
            if (!provider.isEnabled()) continue;
            registry.register(provider);
            count++;
            log.info("Registered plugin {} (version={})", provider.getName(), provider.getVersion());
        }
        // Community plugins: failure is log-and-skip.
        for (PluginProvider provider : pluginManager.getCommunityProviders()) {
            try {
                if (!provider.isEnabled()) continue;
                registry.register(provider);
                count++;
                log.info("Registered community plugin {} (version={})", provider.getName(), provider.getVersion());
            } catch (Exception e) {
                log.error("Community plugin failed to register (skipping): name={}, error={}",
                        provider != null ? provider.getName() : "?", e.getMessage(), e);
            }
        }
        if (count == 0) {
            log.warn("No plugins registered; check internal providers and CSO_PLUGINS_DIR for community JARs");
        }
        registry.seal();
        return count;
    }

    /**
     * Invokes {@link ResourceCleanup#onExit()} on every registered provider that implements it.
     */
    public static void invokeResourceCleanup(PluginRegistry registry) {
        for (PluginRegistry.PluginEntry e : registry.getAll().values()) {
            Object provider = e.getProvider();
            if (provider instanceof ResourceCleanup) {
                try {
                    ((ResourceCleanup) provider).onExit();
                } catch (Exception ex) {
                    log.warn("Plugin {} onExit failed: {}", e.getName(), ex.getMessage());
                }
            }
        }
    }
}
