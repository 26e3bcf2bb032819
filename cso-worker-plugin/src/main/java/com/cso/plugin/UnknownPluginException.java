package com.cso.plugin;

/**
 * Thrown when a plugin name is not registered, or is registered without the requested capability.
 */
public class UnknownPluginException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String pluginName;

    public UnknownPluginException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public static UnknownPluginException notFound(String name) {
        return new UnknownPluginException(name, "plugin not found: " + name);
    }

    public static UnknownPluginException missingCapability(String name, String contractType) {
        return new UnknownPluginException(name,
                "plugin " + name + " does not provide a " + contractType.toLowerCase() + " component");
    }

    public String getPluginName() {
        return pluginName;
    }
}
