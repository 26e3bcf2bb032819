package com.cso.plugin;

/**
 * Restricted parent classloader for community plugin JARs. Exposes only the plugin API and the
 * types it references; all other classes throw {@link ClassNotFoundException}, so community
 * plugins cannot reach dispatch internals (task parsing, handlers, controller).
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.cso.plugin.*},
 * {@code com.cso.annotations.*}, {@code com.cso.executioncontext.*}, {@code com.cso.logstream.*},
 * {@code com.cso.config.*}, {@code org.slf4j.*}
 * <p>
 * <b>Denied:</b> {@code com.cso.dispatch.*}, {@code com.cso.worker.*}, {@code com.cso.metrics.*}
 * and everything else.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.cso.plugin.",
            "com.cso.annotations.",
            "com.cso.executioncontext.",
            "com.cso.logstream.",
            "com.cso.config.",
            "org.slf4j."
    };

    private final ClassLoader kernelLoader;

    /** Creates a loader with no parent that delegates allowed names to the loader of {@link PluginProvider}. */
    public RestrictedPluginClassLoader() {
        super(null);
        this.kernelLoader = PluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isAllowed(name)) {
                    throw new ClassNotFoundException("Access denied: " + name
                            + " (community plugins may only use the plugin API, slf4j and the JDK)");
                }
                c = kernelLoader.loadClass(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
