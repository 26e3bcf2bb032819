package com.cso.plugin.docker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DockerPluginProviderTest {

    @Test
    void providesBuilderAndRegistryButNoPlatform() {
        DockerPluginProvider provider = new DockerPluginProvider();

        assertTrue(provider.createBuilder() instanceof DockerBuilder);
        assertTrue(provider.createRegistry() instanceof DockerRegistry);
        assertNotSame(provider.createRegistry(), provider.createRegistry());
        assertNull(provider.createPlatform());
    }

    @Test
    void onExit_withoutLoginsDoesNothing() {
        DockerPluginProvider provider = new DockerPluginProvider();

        provider.onExit();

        assertTrue(provider.getLoggedInRegistries().isEmpty());
    }
}
