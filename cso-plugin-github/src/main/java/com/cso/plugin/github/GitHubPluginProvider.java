package com.cso.plugin.github;

import com.cso.plugin.PluginProvider;
import com.cso.plugin.RegistryPlugin;

/** Provider for the {@code github} release registry. */
public final class GitHubPluginProvider implements PluginProvider {

    public static final String NAME = "github";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RegistryPlugin createRegistry() {
        return new GitHubReleaseRegistry();
    }
}
