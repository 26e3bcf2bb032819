package com.cso.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Collects plugin providers: built-in ones registered explicitly and community ones loaded from a
 * controlled directory with a hardened classloader. Only the configured directory is scanned
 * (e.g. /opt/cso/plugins); nothing else.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> internalProviders = new ArrayList<>();
    private final List<PluginProvider> communityProviders = new ArrayList<>();
    @SuppressWarnings("unused") // keep references so classloaders are not GC'd
    private final List<ClassLoader> communityLoaders = new ArrayList<>();

    /** Registers a built-in provider (on the worker classpath). */
    public void registerInternal(PluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Loads community plugins from {@code *.jar} files in the given directory. Each JAR gets a
     * {@link RestrictedPluginClassLoader} parent so it can only see the plugin API.
     * Load failures are logged and skipped; the worker continues.
     *
     * @param pluginsDir plugins directory; missing directory is not an error
     */
    public void loadCommunityPlugins(Path pluginsDir) {
        if (pluginsDir == null) {
            return;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Community plugins directory does not exist: {}", pluginsDir);
            return;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Community plugins path is not a directory: {}", pluginsDir);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                loadCommunityJar(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list community plugins directory {}: {}", pluginsDir, e.getMessage());
        }
    }

    private void loadCommunityJar(Path jar) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, new RestrictedPluginClassLoader());
            communityLoaders.add(loader);

            List<ServiceLoader.Provider<PluginProvider>> candidates = ServiceLoader.load(PluginProvider.class, loader)
                    .stream()
                    .collect(Collectors.toList());
            int n = 0;
            for (ServiceLoader.Provider<PluginProvider> candidate : candidates) {
                try {
                    communityProviders.add(candidate.get());
                    n++;
                } catch (Exception | ServiceConfigurationError e) {
                    log.error("Community plugin from JAR {} failed to instantiate (skipping this provider): {}",
                            jar.getFileName(), e.getMessage(), e);
                }
            }
            if (n > 0) {
                log.info("Loaded {} provider(s) from community JAR: {}", n, jar.getFileName());
            }
        } catch (Exception | ServiceConfigurationError e) {
            log.error("Failed to load community plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
        }
    }

    /** Built-in providers only (registration failure is fatal). */
    public List<PluginProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    /** Community providers only (registration failure is log-and-skip). */
    public List<PluginProvider> getCommunityProviders() {
        return new ArrayList<>(communityProviders);
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getCommunityCount() {
        return communityProviders.size();
    }
}
