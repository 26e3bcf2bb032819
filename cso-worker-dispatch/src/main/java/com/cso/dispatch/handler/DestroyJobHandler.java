package com.cso.dispatch.handler;

import com.cso.dispatch.task.DestroyJobInfo;
import com.cso.dispatch.task.DestroyJobParams;
import com.cso.dispatch.task.TaskParams;
import com.cso.dispatch.task.TaskType;
import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.PlatformPlugin;
import com.cso.plugin.PluginInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handles {@code destroy-job-pack}: destroys every listed job and publishes one
 * {@code job.destroyed} event per destroyed job, keyed by its service ID.
 * <p>
 * Jobs with a Nomad address are purged through the {@code nomad} platform; jobs without one go
 * to {@code noop}. A failed job does not stop the others; the task fails afterwards.
 */
public final class DestroyJobHandler implements DeploymentHandler {

    private static final Logger log = LoggerFactory.getLogger(DestroyJobHandler.class);

    @Override
    public Set<TaskType> supportedTypes() {
        return Set.of(TaskType.DESTROY_JOB);
    }

    @Override
    public Class<? extends TaskParams> paramsType() {
        return DestroyJobParams.class;
    }

    @Override
    public void handle(HandlerContext hctx, TaskParams taskParams) throws Exception {
        DestroyJobParams params = (DestroyJobParams) taskParams;
        ExecutionContext ctx = hctx.getExecution();
        ctx.setPhase(Phases.DESTROY);
        List<DestroyJobInfo> jobs = params.getJobs();
        log.info("Destroying {} job(s) (reason={})", jobs.size(), params.getReason());

        List<String> failed = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            DestroyJobInfo job = jobs.get(i);
            ctx.throwIfCancelled();
            ctx.logLine("Destroying job " + (i + 1) + "/" + jobs.size() + ": " + job.getJobId());
            try {
                destroy(hctx, job);
            } catch (ExecutionCancelledException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to destroy job {}: {}", job.getJobId(), e.getMessage(), e);
                ctx.logLine("Failed to destroy job " + job.getJobId() + ": " + e.getMessage());
                failed.add(job.getJobId());
                continue;
            }
            if (!hctx.publishJobDestroyed(job.getServiceId(), params.getReason())) {
                ctx.logLine("Failed to publish job destroyed event for " + job.getJobId());
            }
        }
        if (!failed.isEmpty()) {
            throw new DeploymentException("failed to destroy " + failed.size() + " of " + jobs.size()
                    + " job(s): " + String.join(", ", failed));
        }
        ctx.logLine("Destroyed " + jobs.size() + " job(s)");
    }

    private static void destroy(HandlerContext hctx, DestroyJobInfo job) throws Exception {
        String address = job.getNomadAddress();
        String name;
        Map<String, Object> options = new LinkedHashMap<>();
        if (address != null && !address.isBlank()) {
            name = PlatformDeployer.NOMAD;
            options.put("address", address);
            if (job.getNomadToken() != null && !job.getNomadToken().isBlank()) {
                options.put("token", job.getNomadToken());
            }
        } else {
            name = PlatformDeployer.NOOP;
            log.warn("No Nomad address for job {}; nothing to purge", job.getJobId());
        }
        PlatformPlugin platform = hctx.getPluginLoader().loadPlatform(name, options);
        new PluginInvoker(hctx.getExecution()).destroy(name, platform, job.getJobId());
    }
}
