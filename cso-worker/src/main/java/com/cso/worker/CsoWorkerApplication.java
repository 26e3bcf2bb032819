package com.cso.worker;

import com.cso.config.CsoConfig;
import com.cso.dispatch.BusConnector;
import com.cso.dispatch.DispatchController;
import com.cso.dispatch.ExitCode;
import com.cso.dispatch.TaskEnvironment;
import com.cso.dispatch.handler.DeploymentHandlerRegistry;
import com.cso.internal.plugins.InternalPlugins;
import com.cso.metrics.DispatchMetrics;
import com.cso.plugin.PluginLoader;
import com.cso.plugin.PluginManager;
import com.cso.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatch worker entry point. The scheduler starts one process per task with the task kind in
 * NOMAD_META_TASK and its parameters in NOMAD_META_PARAMS; the process exits with the
 * {@link ExitCode} of the run.
 */
public final class CsoWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(CsoWorkerApplication.class);

    static final String DEV_VERSION = "dev";

    private CsoWorkerApplication() {
    }

    public static void main(String[] args) {
        CsoConfig config = CsoConfig.fromEnvironment();
        String version = version();
        log.info("Starting dispatch worker {} (timeout={}, pluginsDir={})",
                version, config.getTaskTimeout(), config.getPluginsDir());

        PluginManager pluginManager = InternalPlugins.createPluginManager(config);
        PluginRegistry registry = PluginRegistry.getInstance();
        PluginBootstrap.registerAll(pluginManager, registry);

        ExitCode exit;
        try {
            DispatchController controller = new DispatchController(
                    config,
                    DeploymentHandlerRegistry.standard(),
                    new PluginLoader(registry),
                    BusConnector.nats(),
                    System.out,
                    System.err,
                    version);
            exit = controller.run(TaskEnvironment.fromSystem());
        } finally {
            PluginBootstrap.invokeResourceCleanup(registry);
            DispatchMetrics.logSummary();
        }
        log.info("Dispatch worker exiting with {} ({})", exit.getCode(), exit);
        System.exit(exit.getCode());
    }

    static String version() {
        String v = CsoWorkerApplication.class.getPackage().getImplementationVersion();
        return v != null && !v.isBlank() ? v : DEV_VERSION;
    }
}
