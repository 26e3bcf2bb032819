package com.cso.plugin;

/** Thrown when a plugin component rejects its options. */
public class PluginConfigurationException extends Exception {

    private static final long serialVersionUID = 1L;

    public PluginConfigurationException(String message) {
        super(message);
    }
}
