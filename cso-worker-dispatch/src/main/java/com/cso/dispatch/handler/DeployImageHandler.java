package com.cso.dispatch.handler;

import com.cso.dispatch.task.DeployImageParams;
import com.cso.dispatch.task.TaskParams;
import com.cso.dispatch.task.TaskType;
import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.DeploymentType;
import com.cso.plugin.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Set;

/**
 * Handles {@code deploy-image}: deploys a pre-built image without a build or registry phase.
 */
public final class DeployImageHandler implements DeploymentHandler {

    private static final Logger log = LoggerFactory.getLogger(DeployImageHandler.class);

    static final String DEFAULT_TAG = "latest";

    @Override
    public Set<TaskType> supportedTypes() {
        return Set.of(TaskType.DEPLOY_IMAGE);
    }

    @Override
    public Class<? extends TaskParams> paramsType() {
        return DeployImageParams.class;
    }

    @Override
    public void handle(HandlerContext hctx, TaskParams taskParams) throws Exception {
        DeployImageParams params = (DeployImageParams) taskParams;
        ExecutionContext ctx = hctx.getExecution();
        log.info("Handling image deployment (jobId={}, image={})", params.getJobId(), params.getImageName());
        ctx.logLine("Image: " + params.getImageName());
        ctx.logLine("Job ID: " + params.getJobId());

        hctx.publishStarted(params.getDeploymentJobId());
        try {
            PlatformDeployer.deploy(hctx, params, artifactOf(params));
        } catch (Exception e) {
            if (!(e instanceof ExecutionCancelledException) && ctx.getStderr() != null) {
                ctx.getStderr().println("ERROR: " + e.getMessage());
            }
            hctx.publishFailed(params, DeploymentType.IMAGE, e);
            throw e;
        }
        hctx.publishSucceeded(params, DeploymentType.IMAGE);
        ctx.logLine("Deployment completed successfully");
    }

    static Artifact artifactOf(DeployImageParams params) {
        String tag = params.getImageTag() != null && !params.getImageTag().isBlank()
                ? params.getImageTag() : DEFAULT_TAG;
        Artifact.Builder b = Artifact.builder("image-" + params.getServiceId())
                .image(params.getImageName())
                .tag(tag)
                .exposedPorts(PlatformDeployer.declaredPorts(params))
                .buildTime(Instant.now());
        String startCommand = params.getBuild().getStartCommand();
        if (startCommand != null && !startCommand.isBlank()) {
            b.metadata("start_command", startCommand);
        }
        return b.build();
    }
}
