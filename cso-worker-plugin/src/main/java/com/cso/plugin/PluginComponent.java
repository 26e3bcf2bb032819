package com.cso.plugin;

import java.util.Map;

/**
 * Common contract of builder, registry and platform components: a component is configured once
 * from an option map and then used for exactly one invocation.
 */
public interface PluginComponent {

    /**
     * Applies options. Unknown keys are ignored; missing required options are reported here.
     *
     * @param options option map (values are strings, booleans, numbers, lists or maps)
     * @throws PluginConfigurationException when an option is missing or has the wrong type
     */
    void configure(Map<String, Object> options) throws PluginConfigurationException;
}
