package com.cso.internal.plugins;

import com.cso.annotations.ResourceCleanup;
import com.cso.config.CsoConfig;
import com.cso.plugin.PluginManager;
import com.cso.plugin.PluginProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InternalPluginsTest {

    @Test
    void createPluginManager_registersBuiltIns(@TempDir Path pluginsDir) {
        CsoConfig config = CsoConfig.fromMap(Map.of(CsoConfig.ENV_PLUGINS_DIR, pluginsDir.toString()));

        PluginManager manager = InternalPlugins.createPluginManager(config);

        List<String> names = manager.getInternalProviders().stream()
                .map(PluginProvider::getName)
                .collect(Collectors.toList());
        assertEquals(List.of("noop", "docker", "nixpacks", "goreleaser", "github", "nomad"), names);
        assertEquals(0, manager.getCommunityCount());

        manager.getInternalProviders().stream()
                .filter(p -> p instanceof ResourceCleanup)
                .forEach(p -> ((ResourceCleanup) p).onExit());
    }
}
