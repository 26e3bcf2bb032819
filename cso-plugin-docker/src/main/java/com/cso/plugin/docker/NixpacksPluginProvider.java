package com.cso.plugin.docker;

import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.PluginProvider;

/** Provider for the {@code nixpacks} builder. */
public final class NixpacksPluginProvider implements PluginProvider {

    public static final String NAME = "nixpacks";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BuilderPlugin createBuilder() {
        return new NixpacksBuilder();
    }
}
