package com.cso.dispatch.handler;

/** Phase names carried by build log events. */
public final class Phases {

    public static final String INIT = "init";
    public static final String CLONE = "clone";
    public static final String BUILD = "build";
    public static final String REGISTRY = "registry";
    public static final String DEPLOY = "deploy";
    public static final String DESTROY = "destroy";

    private Phases() {
    }
}
