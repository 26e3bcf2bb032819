package com.cso.plugin;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table from plugin name to its provider. Written once at bootstrap, then
 * {@link #seal() sealed}; lookups afterwards are read-only. Every lookup asks the provider for a
 * fresh component so invocations never share state.
 */
public final class PluginRegistry {

    private static final PluginRegistry INSTANCE = new PluginRegistry();

    /** name → PluginEntry */
    private final Map<String, PluginEntry> plugins = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public static PluginRegistry getInstance() {
        return INSTANCE;
    }

    private PluginRegistry() {
    }

    /**
     * Registers a provider under its name, recording which capabilities it offers.
     *
     * @throws IllegalArgumentException if the name is blank, already registered, or the provider offers no capability
     * @throws IllegalStateException    if the registry has been sealed
     */
    public void register(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        if (sealed) {
            throw new IllegalStateException("Plugin registry is sealed; cannot register " + provider.getName());
        }
        String name = Objects.requireNonNull(provider.getName(), "name").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Plugin name must be non-blank");
        }
        Set<String> capabilities = new LinkedHashSet<>();
        if (provider.createBuilder() != null) capabilities.add(ContractType.BUILDER);
        if (provider.createRegistry() != null) capabilities.add(ContractType.REGISTRY);
        if (provider.createPlatform() != null) capabilities.add(ContractType.PLATFORM);
        if (capabilities.isEmpty()) {
            throw new IllegalArgumentException("Plugin " + name + " provides no builder, registry or platform");
        }
        PluginEntry entry = new PluginEntry(name, provider.getVersion(), capabilities, provider);
        if (plugins.putIfAbsent(name, entry) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + name);
        }
    }

    /** Rejects further registration. Called once bootstrap has registered every provider. */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /** Returns the entry for the given name, or null if not registered. */
    public PluginEntry get(String name) {
        if (name == null || name.isBlank()) return null;
        return plugins.get(name.trim());
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /** Returns a new builder component of the named plugin. */
    public BuilderPlugin getBuilder(String name) throws UnknownPluginException {
        BuilderPlugin builder = require(name, ContractType.BUILDER).provider.createBuilder();
        if (builder == null) throw UnknownPluginException.missingCapability(name, ContractType.BUILDER);
        return builder;
    }

    /** Returns a new registry component of the named plugin. */
    public RegistryPlugin getRegistry(String name) throws UnknownPluginException {
        RegistryPlugin registry = require(name, ContractType.REGISTRY).provider.createRegistry();
        if (registry == null) throw UnknownPluginException.missingCapability(name, ContractType.REGISTRY);
        return registry;
    }

    /** Returns a new platform component of the named plugin. */
    public PlatformPlugin getPlatform(String name) throws UnknownPluginException {
        PlatformPlugin platform = require(name, ContractType.PLATFORM).provider.createPlatform();
        if (platform == null) throw UnknownPluginException.missingCapability(name, ContractType.PLATFORM);
        return platform;
    }

    private PluginEntry require(String name, String contractType) throws UnknownPluginException {
        PluginEntry entry = get(name);
        if (entry == null) {
            throw UnknownPluginException.notFound(name);
        }
        if (!entry.getCapabilities().contains(contractType)) {
            throw UnknownPluginException.missingCapability(entry.getName(), contractType);
        }
        return entry;
    }

    /** Returns all registrations: name → entry. For audit logging and shutdown. */
    public Map<String, PluginEntry> getAll() {
        return Collections.unmodifiableMap(plugins);
    }

    /** Removes all registrations and unseals (mainly for tests). */
    public void clear() {
        plugins.clear();
        sealed = false;
    }

    /** Registered plugin: name, version, capabilities and the provider that creates its components. */
    public static final class PluginEntry {
        private final String name;
        private final String version;
        private final Set<String> capabilities;
        private final PluginProvider provider;

        PluginEntry(String name, String version, Set<String> capabilities, PluginProvider provider) {
            this.name = name;
            this.version = version;
            this.capabilities = Collections.unmodifiableSet(capabilities);
            this.provider = provider;
        }

        public String getName() {
            return name;
        }

        public String getVersion() {
            return version;
        }

        /** Subset of {@link ContractType} constants. */
        public Set<String> getCapabilities() {
            return capabilities;
        }

        public PluginProvider getProvider() {
            return provider;
        }
    }
}
