package com.cso.plugin.goreleaser;

import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.PluginProvider;

/** Provider for the {@code goreleaser} release builder. */
public final class GoReleaserPluginProvider implements PluginProvider {

    public static final String NAME = "goreleaser";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BuilderPlugin createBuilder() {
        return new GoReleaserBuilder();
    }
}
