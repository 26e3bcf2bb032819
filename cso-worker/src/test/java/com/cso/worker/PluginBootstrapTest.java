package com.cso.worker;

import com.cso.annotations.ResourceCleanup;
import com.cso.plugin.Artifact;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.PluginManager;
import com.cso.plugin.PluginProvider;
import com.cso.plugin.PluginRegistry;
import com.cso.plugin.noop.NoopPluginProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PluginBootstrapTest {

    private final PluginRegistry registry = PluginRegistry.getInstance();

    @BeforeEach
    @AfterEach
    void reset() {
        registry.clear();
    }

    /** Builder-only provider that counts exit hooks and optionally fails them. */
    private static final class CleanupProvider implements PluginProvider, ResourceCleanup {
        private final String name;
        private final boolean enabled;
        private final boolean failOnExit;
        final AtomicInteger exits = new AtomicInteger();

        CleanupProvider(String name, boolean enabled, boolean failOnExit) {
            this.name = name;
            this.enabled = enabled;
            this.failOnExit = failOnExit;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public BuilderPlugin createBuilder() {
            return new BuilderPlugin() {
                @Override
                public void configure(Map<String, Object> options) {
                }

                @Override
                public Artifact build(com.cso.executioncontext.ExecutionContext ctx) {
                    return Artifact.builder(name).image(name).build();
                }
            };
        }

        @Override
        public void onExit() {
            exits.incrementAndGet();
            if (failOnExit) {
                throw new IllegalStateException("cleanup failed");
            }
        }
    }

    @Test
    void registerAll_registersEnabledProvidersAndSeals() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(new NoopPluginProvider());
        manager.registerInternal(new CleanupProvider("cached", true, false));
        manager.registerInternal(new CleanupProvider("disabled", false, false));

        int count = PluginBootstrap.registerAll(manager, registry);

        assertEquals(2, count);
        assertTrue(registry.contains("noop"));
        assertTrue(registry.contains("cached"));
        assertFalse(registry.contains("disabled"));
        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register(new CleanupProvider("late", true, false)));
    }

    @Test
    void registerAll_duplicateInternalProvider_isFatal() {
        PluginManager manager = new PluginManager();
        manager.registerInternal(new NoopPluginProvider());
        manager.registerInternal(new NoopPluginProvider());

        assertThrows(IllegalArgumentException.class, () -> PluginBootstrap.registerAll(manager, registry));
    }

    @Test
    void registerAll_withoutProviders_stillSeals() {
        assertEquals(0, PluginBootstrap.registerAll(new PluginManager(), registry));
        assertTrue(registry.isSealed());
    }

    @Test
    void invokeResourceCleanup_runsEveryHookEvenWhenOneFails() {
        CleanupProvider failing = new CleanupProvider("a-failing", true, true);
        CleanupProvider ok = new CleanupProvider("b-ok", true, false);
        registry.register(failing);
        registry.register(ok);
        registry.register(new NoopPluginProvider());

        PluginBootstrap.invokeResourceCleanup(registry);

        assertEquals(1, failing.exits.get());
        assertEquals(1, ok.exits.get());
    }
}
