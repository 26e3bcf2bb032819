package com.cso.plugin.noop;

import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.PlatformPlugin;
import com.cso.plugin.PluginProvider;
import com.cso.plugin.RegistryPlugin;

/** Provider for the {@code noop} builder, registry and platform. */
public final class NoopPluginProvider implements PluginProvider {

    public static final String NAME = "noop";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BuilderPlugin createBuilder() {
        return new NoopBuilder();
    }

    @Override
    public RegistryPlugin createRegistry() {
        return new NoopRegistry();
    }

    @Override
    public PlatformPlugin createPlatform() {
        return new NoopPlatform();
    }
}
