package com.cso.plugin;

/**
 * SPI for pluggable build/publish back ends. Implementations are discovered via
 * {@link java.util.ServiceLoader} (META-INF/services/com.cso.plugin.PluginProvider) in community
 * JARs, or registered explicitly for built-in plugins. The worker registers every enabled
 * provider in {@link PluginRegistry} before any task is dispatched.
 * <p>
 * Each {@code create*} call must return a new, unconfigured component so that no state is shared
 * between invocations. Return null for capabilities the plugin does not provide.
 */
public interface PluginProvider {

    /** Plugin name used in task options and builder chains (e.g. "docker", "goreleaser"). */
    String getName();

    default BuilderPlugin createBuilder() {
        return null;
    }

    default RegistryPlugin createRegistry() {
        return null;
    }

    default PlatformPlugin createPlatform() {
        return null;
    }

    /** Plugin version for audit logging (e.g. "1.0"). */
    default String getVersion() {
        return "1.0";
    }

    /**
     * Whether this provider should be registered. Override to skip registration when a required
     * tool or environment setting is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
