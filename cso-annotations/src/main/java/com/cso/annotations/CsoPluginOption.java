package com.cso.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * Defines one configuration option of a plugin component.
 * Used inside {@link CsoPlugin#options()}.
 */
@Retention(RetentionPolicy.RUNTIME)
public @interface CsoPluginOption {

    /** Option key (e.g. "image", "tag_name"). */
    String name();

    /** Type identifier (e.g. "STRING", "BOOLEAN", "LIST", "MAP"). */
    String type() default "STRING";

    /** Whether the option must be present and non-blank. */
    boolean required() default false;
}
