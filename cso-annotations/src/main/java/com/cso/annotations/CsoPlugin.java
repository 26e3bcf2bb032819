package com.cso.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a dispatch plugin component (builder, registry or platform).
 * The plugin loader reads {@link #options()} at configure time to reject invocations
 * that are missing required options before any external tool is started.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface CsoPlugin {

    /** Plugin name as registered in the plugin table (e.g. "docker", "goreleaser"). */
    String name();

    /** Capability of the annotated component: BUILDER, REGISTRY or PLATFORM. */
    String capability();

    /** Optional description. */
    String description() default "";

    /** Options accepted by {@code configure(Map)}. */
    CsoPluginOption[] options() default {};
}
