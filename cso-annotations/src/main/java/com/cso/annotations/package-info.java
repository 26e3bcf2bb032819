/**
 * Dispatch worker annotations.
 * <ul>
 *   <li>{@link com.cso.annotations.CsoPlugin} – plugin component metadata (name, capability, options)</li>
 *   <li>{@link com.cso.annotations.CsoPluginOption} – one option of a component, optionally required</li>
 *   <li>{@link com.cso.annotations.ResourceCleanup} – onExit() hook invoked before process exit</li>
 * </ul>
 */
package com.cso.annotations;
