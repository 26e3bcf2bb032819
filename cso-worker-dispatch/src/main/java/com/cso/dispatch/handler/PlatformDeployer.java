package com.cso.dispatch.handler;

import com.cso.dispatch.task.BaseDeploymentParams;
import com.cso.dispatch.task.NetworkPortSettings;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.Deployment;
import com.cso.plugin.PlatformPlugin;
import com.cso.plugin.PluginInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deploy phase shared by the repository and image handlers: resolves the platform plugin from
 * the task's {@code deploy} field and runs it.
 * <p>
 * {@code nomad-pack} is an alias of {@code nomad}. A blank {@code deploy} selects {@code nomad}
 * when a Nomad address is given and {@code noop} otherwise.
 */
final class PlatformDeployer {

    private static final Logger log = LoggerFactory.getLogger(PlatformDeployer.class);

    static final String NOMAD = "nomad";
    static final String NOMAD_PACK = "nomad-pack";
    static final String NOOP = "noop";

    private PlatformDeployer() {
    }

    static String platformName(String deploy, String nomadAddress) {
        if (deploy == null || deploy.isBlank()) {
            return nomadAddress != null && !nomadAddress.isBlank() ? NOMAD : NOOP;
        }
        String name = deploy.trim();
        return NOMAD_PACK.equals(name) ? NOMAD : name;
    }

    static Map<String, Object> platformOptions(BaseDeploymentParams params) {
        Map<String, Object> options = new LinkedHashMap<>();
        putIfPresent(options, "address", params.getNomadAddress());
        putIfPresent(options, "token", params.getNomadToken());
        putIfPresent(options, "job_id", params.getJobId());
        if (params.getReplicaCount() > 0) options.put("count", params.getReplicaCount());
        if (params.getCpu() > 0) options.put("cpu", params.getCpu());
        if (params.getRam() > 0) options.put("memory", params.getRam());
        return options;
    }

    /** Ports of the task's network settings, in declaration order. */
    static List<Integer> declaredPorts(BaseDeploymentParams params) {
        return params.getNetworks().stream()
                .map(NetworkPortSettings::getPortNumber)
                .filter(p -> p > 0)
                .distinct()
                .collect(Collectors.toList());
    }

    /** Builder pre-filled with every field of {@code artifact}. */
    static Artifact.Builder copyOf(Artifact artifact) {
        Artifact.Builder b = Artifact.builder(artifact.getId())
                .image(artifact.getImage())
                .tag(artifact.getTag())
                .digest(artifact.getDigest())
                .exposedPorts(artifact.getExposedPorts())
                .buildTime(artifact.getBuildTime())
                .buildId(artifact.getBuildId());
        artifact.getLabels().forEach(b::label);
        artifact.getMetadata().forEach(b::metadata);
        return b;
    }

    /**
     * Deploys {@code built}. Ports declared in the task's networks are used when the builder
     * detected none.
     */
    static Deployment deploy(HandlerContext hctx, BaseDeploymentParams params, Artifact built) throws Exception {
        ExecutionContext ctx = hctx.getExecution();
        List<Integer> declared = declaredPorts(params);
        Artifact artifact = built.getExposedPorts().isEmpty() && !declared.isEmpty()
                ? copyOf(built).exposedPorts(declared).build()
                : built;
        String name = platformName(params.getDeploy(), params.getNomadAddress());
        ctx.setPhase(Phases.DEPLOY);
        ctx.logLine("=== Phase: Deploy ===");
        ctx.logLine("Deploying " + artifact.getImageReference() + " with " + name + "...");
        PlatformPlugin platform = hctx.getPluginLoader().loadPlatform(name, platformOptions(params));
        Deployment deployment = new PluginInvoker(ctx).deploy(name, platform, artifact);
        log.info("Deployed {} via {} (deployment={}, state={})", artifact.getImageReference(), name,
                deployment.getId(), deployment.getState());
        ctx.logLine("Deployment submitted: " + deployment.getId() + " (" + deployment.getState() + ")");
        return deployment;
    }

    private static void putIfPresent(Map<String, Object> options, String key, String value) {
        if (value != null && !value.isBlank()) {
            options.put(key, value);
        }
    }
}
