package com.cso.internal.plugins;

import com.cso.config.CsoConfig;
import com.cso.plugin.PluginManager;
import com.cso.plugin.docker.DockerPluginProvider;
import com.cso.plugin.docker.NixpacksPluginProvider;
import com.cso.plugin.github.GitHubPluginProvider;
import com.cso.plugin.goreleaser.GoReleaserPluginProvider;
import com.cso.plugin.noop.NoopPluginProvider;
import com.cso.plugin.nomad.NomadPluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Plugin-side bootstrap: creates a {@link PluginManager} with the built-in providers registered
 * and community plugins loaded from {@link CsoConfig#getPluginsDir()}. The worker only calls
 * {@link #createPluginManager(CsoConfig)} and then registers the returned providers with
 * {@link com.cso.plugin.PluginRegistry}.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    private InternalPlugins() {
    }

    /**
     * Creates a PluginManager with the built-in providers (noop, docker, nixpacks, goreleaser,
     * github, nomad) and the community JARs found in the configured plugins directory.
     */
    public static PluginManager createPluginManager(CsoConfig config) {
        PluginManager pluginManager = new PluginManager();

        pluginManager.registerInternal(new NoopPluginProvider());
        pluginManager.registerInternal(new DockerPluginProvider());
        pluginManager.registerInternal(new NixpacksPluginProvider());
        pluginManager.registerInternal(new GoReleaserPluginProvider());
        pluginManager.registerInternal(new GitHubPluginProvider());
        pluginManager.registerInternal(new NomadPluginProvider());

        Path pluginsDir = config.getPluginsDir();
        pluginManager.loadCommunityPlugins(pluginsDir);

        log.info("Plugins: {} internal, {} community (dir={})",
                pluginManager.getInternalCount(), pluginManager.getCommunityCount(), pluginsDir);

        return pluginManager;
    }
}
