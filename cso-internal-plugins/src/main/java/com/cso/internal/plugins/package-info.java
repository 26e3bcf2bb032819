/**
 * Aggregator for the built-in plugins (noop, docker, nixpacks, goreleaser, github, nomad).
 * Brings them onto the worker classpath and hands them to the worker as one
 * {@link com.cso.plugin.PluginManager}.
 */
package com.cso.internal.plugins;
