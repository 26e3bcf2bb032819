/**
 * Build/publish plugin contracts and the process-wide plugin table.
 * <ul>
 *   <li>{@link com.cso.plugin.BuilderPlugin}, {@link com.cso.plugin.RegistryPlugin}, {@link com.cso.plugin.PlatformPlugin} – component contracts</li>
 *   <li>{@link com.cso.plugin.Artifact}, {@link com.cso.plugin.RegistryRef}, {@link com.cso.plugin.Deployment} – invocation results</li>
 *   <li>{@link com.cso.plugin.PluginProvider} – SPI for discovery (ServiceLoader) and built-in registration</li>
 *   <li>{@link com.cso.plugin.PluginRegistry} – name → provider, sealed after bootstrap</li>
 *   <li>{@link com.cso.plugin.PluginLoader} – lookup, required-option check, configure</li>
 *   <li>{@link com.cso.plugin.PluginInvoker} – build → push state machine with timings</li>
 *   <li>{@link com.cso.plugin.PluginManager} / {@link com.cso.plugin.RestrictedPluginClassLoader} – community JAR loading</li>
 *   <li>{@link com.cso.plugin.CommandRunner} – cancellation-aware external tool execution</li>
 * </ul>
 */
package com.cso.plugin;
