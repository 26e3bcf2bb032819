package com.cso.plugin;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Small in-memory plugin components shared by the plugin tests. */
final class TestPlugins {

    private TestPlugins() {
    }

    @CsoPlugin(name = "fake", capability = ContractType.BUILDER,
            options = { @CsoPluginOption(name = "image", required = true), @CsoPluginOption(name = "tag") })
    static final class FakeBuilder implements BuilderPlugin {
        static final AtomicInteger BUILDS = new AtomicInteger();
        Map<String, Object> options;
        Exception failure;

        @Override
        public void configure(Map<String, Object> options) {
            this.options = options;
        }

        @Override
        public Artifact build(ExecutionContext ctx) throws Exception {
            BUILDS.incrementAndGet();
            ctx.throwIfCancelled();
            if (failure != null) throw failure;
            return Artifact.builder("fake-1")
                    .image(PluginOptions.getString(options, "image", "app"))
                    .tag(PluginOptions.getString(options, "tag", "latest"))
                    .build();
        }
    }

    static final class FakeRegistry implements RegistryPlugin {
        @Override
        public void configure(Map<String, Object> options) {
        }

        @Override
        public RegistryRef push(ExecutionContext ctx, Artifact artifact) {
            return new RegistryRef("registry.test", artifact.getImage(), artifact.getTag(), "sha256:abc",
                    "registry.test/" + artifact.getImageReference(), Instant.now());
        }
    }

    static PluginProvider builderOnly(String name) {
        return new PluginProvider() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public BuilderPlugin createBuilder() {
                return new FakeBuilder();
            }
        };
    }

    static PluginProvider builderAndRegistry(String name) {
        return new PluginProvider() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public BuilderPlugin createBuilder() {
                return new FakeBuilder();
            }

            @Override
            public RegistryPlugin createRegistry() {
                return new FakeRegistry();
            }
        };
    }
}
