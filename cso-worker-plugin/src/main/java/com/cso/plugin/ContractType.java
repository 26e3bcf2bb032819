package com.cso.plugin;

/**
 * Plugin capabilities. A plugin name may provide any combination of them.
 */
public final class ContractType {

    /** Builder: source tree or configuration → {@link Artifact}. */
    public static final String BUILDER = "BUILDER";

    /** Registry: {@link Artifact} → {@link RegistryRef} (push to an image registry or release store). */
    public static final String REGISTRY = "REGISTRY";

    /** Platform: deploys an {@link Artifact} and destroys deployed jobs. */
    public static final String PLATFORM = "PLATFORM";

    private ContractType() {
    }
}
