package com.cso.plugin;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Looks up a component in the {@link PluginRegistry}, checks the options against the component's
 * {@link CsoPlugin#options()} declarations and configures it.
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private final PluginRegistry registry;

    public PluginLoader(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public BuilderPlugin loadBuilder(String name, Map<String, Object> options)
            throws UnknownPluginException, PluginConfigurationException {
        return configure(name, registry.getBuilder(name), options);
    }

    public RegistryPlugin loadRegistry(String name, Map<String, Object> options)
            throws UnknownPluginException, PluginConfigurationException {
        return configure(name, registry.getRegistry(name), options);
    }

    public PlatformPlugin loadPlatform(String name, Map<String, Object> options)
            throws UnknownPluginException, PluginConfigurationException {
        return configure(name, registry.getPlatform(name), options);
    }

    private static <T extends PluginComponent> T configure(String name, T component, Map<String, Object> options)
            throws PluginConfigurationException {
        Map<String, Object> opts = options != null ? options : Map.of();
        checkRequiredOptions(name, component, opts);
        component.configure(opts);
        log.debug("Configured plugin {} component {} with option keys {}", name,
                component.getClass().getSimpleName(), opts.keySet());
        return component;
    }

    /**
     * Fails when an option declared {@code required} in the component's {@link CsoPlugin}
     * annotation is absent or blank. Components without the annotation are not checked.
     */
    static void checkRequiredOptions(String name, PluginComponent component, Map<String, Object> options)
            throws PluginConfigurationException {
        CsoPlugin meta = component.getClass().getAnnotation(CsoPlugin.class);
        if (meta == null) {
            return;
        }
        for (CsoPluginOption option : meta.options()) {
            if (!option.required()) continue;
            Object v = options.get(option.name());
            if (v == null || v.toString().isBlank()) {
                throw new PluginConfigurationException(
                        "plugin " + name + " (" + meta.capability().toLowerCase() + ") requires option '" + option.name() + "'");
            }
        }
    }
}
