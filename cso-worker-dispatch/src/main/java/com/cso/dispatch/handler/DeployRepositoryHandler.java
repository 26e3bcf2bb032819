package com.cso.dispatch.handler;

import com.cso.dispatch.source.BuilderChain;
import com.cso.dispatch.source.SourceFetcher;
import com.cso.dispatch.task.BuildOptions;
import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.dispatch.task.TaskParams;
import com.cso.dispatch.task.TaskType;
import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.executioncontext.ExecutionContext;
import com.cso.logstream.DeploymentType;
import com.cso.plugin.Artifact;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.PluginInvoker;
import com.cso.plugin.RegistryPlugin;
import com.cso.plugin.RegistryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Handles {@code deploy-repository} and {@code redeploy-repository}: fetch the source (git
 * clone or uploaded tarball), build it with the first builder of the chain that succeeds, push
 * the image unless pushing is disabled or no registry is set, then deploy it.
 * <p>
 * Publishes deployment started before the first phase and succeeded or failed at the end.
 */
public final class DeployRepositoryHandler implements DeploymentHandler {

    private static final Logger log = LoggerFactory.getLogger(DeployRepositoryHandler.class);

    static final String REGISTRY_PLUGIN = "docker";
    static final String DEFAULT_TAG = "latest";

    private final SourceFetcher sourceFetcher;

    public DeployRepositoryHandler(SourceFetcher sourceFetcher) {
        this.sourceFetcher = sourceFetcher;
    }

    @Override
    public Set<TaskType> supportedTypes() {
        return Set.of(TaskType.DEPLOY_REPOSITORY, TaskType.REDEPLOY_REPOSITORY);
    }

    @Override
    public Class<? extends TaskParams> paramsType() {
        return DeployRepositoryParams.class;
    }

    @Override
    public void handle(HandlerContext hctx, TaskParams taskParams) throws Exception {
        DeployRepositoryParams params = (DeployRepositoryParams) taskParams;
        ExecutionContext ctx = hctx.getExecution();
        log.info("Handling repository deployment (jobId={}, repository={}, sourceType={})",
                params.getJobId(), params.getRepository(), params.getSourceType());
        if (params.isLocalUpload()) {
            ctx.logLine("Source: uploaded archive " + nullToEmpty(params.getUploadId()));
        } else {
            ctx.logLine("Repository: " + params.getRepository());
            ctx.logLine("Branch: " + params.getBranch());
        }
        ctx.logLine("Job ID: " + params.getJobId());

        hctx.publishStarted(params.getDeploymentJobId());
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory(ensureDir(hctx.getConfig().getWorkDir()), "cso-deploy-");
            Path sourceDir = fetchSource(hctx, params, workDir);
            BuildResult build = build(hctx, params, sourceDir);
            Artifact artifact = build.artifact;
            if (shouldPush(params.getBuild())) {
                artifact = push(hctx, params, build);
            } else {
                log.info("Skipping registry push (disablePush={}, registryUrl={})",
                        params.getBuild().isDisablePush(), params.getBuild().getRegistryUrl());
            }
            PlatformDeployer.deploy(hctx, params, artifact);
        } catch (Exception e) {
            if (!(e instanceof ExecutionCancelledException)) {
                writeError(ctx, e);
            }
            if (workDir != null) {
                log.info("Preserving work directory for debugging: {}", workDir);
            }
            hctx.publishFailed(params, DeploymentType.GIT_REPO, e);
            throw e;
        }
        deleteWorkDir(workDir);
        hctx.publishSucceeded(params, DeploymentType.GIT_REPO);
        ctx.logLine("Deployment completed successfully");
    }

    private Path fetchSource(HandlerContext hctx, DeployRepositoryParams params, Path workDir) throws Exception {
        ExecutionContext ctx = hctx.getExecution();
        ctx.setPhase(Phases.CLONE);
        ctx.logLine(params.isLocalUpload() ? "=== Phase: Download & Extract ===" : "=== Phase: Clone ===");
        Path sourceDir = sourceFetcher.fetch(ctx, params, workDir);
        return resolveRoot(sourceDir, params.getBuild().getRootDirectory());
    }

    private BuildResult build(HandlerContext hctx, DeployRepositoryParams params, Path sourceDir) throws Exception {
        ExecutionContext ctx = hctx.getExecution();
        BuilderChain chain = BuilderChain.detect(sourceDir, params.getBuild().getBuilder());
        List<String> builders = chain.getBuilders();
        ctx.setPhase(Phases.BUILD);
        ctx.logLine("=== Phase: Build ===");
        ctx.logLine("Builder chain: " + builders);

        Exception lastError = null;
        for (int i = 0; i < builders.size(); i++) {
            String name = builders.get(i);
            if (i > 0) {
                ctx.logLine("Warning: Builder '" + builders.get(i - 1) + "' failed, trying '" + name
                        + "' (attempt " + (i + 1) + "/" + builders.size() + ")...");
            }
            ctx.logLine("Building with " + name + "...");
            PluginInvoker invoker = new PluginInvoker(ctx);
            try {
                BuilderPlugin builder = hctx.getPluginLoader().loadBuilder(name, builderOptions(params, sourceDir, chain));
                Artifact artifact = invoker.build(name, builder);
                ctx.logLine("Build succeeded with " + name);
                ctx.logLine("Artifact ID: " + artifact.getId());
                return new BuildResult(artifact, invoker);
            } catch (ExecutionCancelledException e) {
                throw e;
            } catch (Exception e) {
                if (ctx.isCancelled()) {
                    throw e;
                }
                lastError = e;
                log.warn("Builder {} failed (attempt {}/{}): {}", name, i + 1, builders.size(), e.getMessage());
                logError(ctx, "Builder '" + name + "' failed: " + e.getMessage());
            }
        }
        logError(ctx, "ERROR: All builders failed (" + builders.size() + " tried). Last error: "
                + (lastError != null ? lastError.getMessage() : "none"));
        throw new DeploymentException("build failed with all builders: "
                + (lastError != null ? lastError.getMessage() : "no builder available"), lastError);
    }

    private Artifact push(HandlerContext hctx, DeployRepositoryParams params, BuildResult build) throws Exception {
        ExecutionContext ctx = hctx.getExecution();
        ctx.setPhase(Phases.REGISTRY);
        ctx.logLine("=== Phase: Registry ===");
        ctx.logLine("Pushing image to registry...");
        RegistryPlugin registry = hctx.getPluginLoader().loadRegistry(REGISTRY_PLUGIN, registryOptions(params, build.artifact));
        RegistryRef ref = build.invoker.push(REGISTRY_PLUGIN, registry, build.artifact);
        ctx.logLine("Registry push completed");
        ctx.logLine("Image: " + ref.getFullImage());
        return pushedArtifact(build.artifact, ref);
    }

    static boolean shouldPush(BuildOptions build) {
        return !build.isDisablePush() && build.getRegistryUrl() != null && !build.getRegistryUrl().isBlank();
    }

    static Map<String, Object> builderOptions(DeployRepositoryParams params, Path sourceDir, BuilderChain chain) {
        BuildOptions build = params.getBuild();
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("image", imageName(params));
        options.put("tag", imageTag(params));
        options.put("context", sourceDir.toString());
        String dockerfile = build.getDockerfilePath() != null && !build.getDockerfilePath().isBlank()
                ? build.getDockerfilePath() : chain.getDockerfile();
        if (dockerfile != null) options.put("dockerfile", dockerfile);
        if (build.getBuildCommand() != null) options.put("build_command", build.getBuildCommand());
        if (build.getStartCommand() != null) options.put("start_command", build.getStartCommand());
        if (!build.getBuildArgs().isEmpty()) options.put("build_args", build.getBuildArgs());
        if (!build.getStaticBuildEnv().isEmpty()) options.put("env", build.getStaticBuildEnv());
        return options;
    }

    static Map<String, Object> registryOptions(DeployRepositoryParams params, Artifact artifact) {
        BuildOptions build = params.getBuild();
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("image", artifact.getImage());
        options.put("tag", artifact.getTag() != null ? artifact.getTag() : imageTag(params));
        options.put("registry", build.getRegistryUrl());
        if (build.getRegistryNamespace() != null) options.put("namespace", build.getRegistryNamespace());
        if (build.getRegistryUsername() != null) options.put("username", build.getRegistryUsername());
        if (build.getRegistryPassword() != null) options.put("password", build.getRegistryPassword());
        return options;
    }

    /** The built artifact, re-pointed at the pushed location. */
    static Artifact pushedArtifact(Artifact built, RegistryRef ref) {
        String full = ref.getFullImage();
        if (full == null || full.isBlank()) {
            return built;
        }
        String image = full;
        String tag = built.getTag();
        int colon = full.lastIndexOf(':');
        if (colon > full.lastIndexOf('/')) {
            image = full.substring(0, colon);
            tag = full.substring(colon + 1);
        }
        return PlatformDeployer.copyOf(built)
                .image(image)
                .tag(tag)
                .digest(ref.getDigest() != null ? ref.getDigest() : built.getDigest())
                .build();
    }

    static String imageName(DeployRepositoryParams params) {
        return params.getImageName() != null && !params.getImageName().isBlank()
                ? params.getImageName() : params.getServiceId();
    }

    static String imageTag(DeployRepositoryParams params) {
        return params.getImageTag() != null && !params.getImageTag().isBlank() ? params.getImageTag() : DEFAULT_TAG;
    }

    /** Resolves {@code rootDirectory} inside the source tree; escaping the tree is an error. */
    static Path resolveRoot(Path sourceDir, String rootDirectory) throws DeploymentException {
        if (rootDirectory == null || rootDirectory.isBlank() || rootDirectory.equals(".") || rootDirectory.equals("/")) {
            return sourceDir;
        }
        String relative = rootDirectory.startsWith("/") ? rootDirectory.substring(1) : rootDirectory;
        Path root = sourceDir.resolve(relative).normalize();
        if (!root.startsWith(sourceDir.normalize())) {
            throw new DeploymentException("root directory escapes the source tree: " + rootDirectory);
        }
        if (!Files.isDirectory(root)) {
            throw new DeploymentException("root directory not found in source: " + rootDirectory);
        }
        return root;
    }

    private static Path ensureDir(Path dir) throws IOException {
        return Files.createDirectories(dir);
    }

    /** Removes the work directory tree; a leftover file is only a warning. */
    static void deleteWorkDir(Path workDir) {
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to remove work directory {}: {}", workDir, e.getMessage());
        }
    }

    private static void writeError(ExecutionContext ctx, Exception e) {
        logError(ctx, "ERROR: " + e.getMessage());
    }

    private static void logError(ExecutionContext ctx, String line) {
        if (ctx.getStderr() != null) {
            ctx.getStderr().println(line);
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static final class BuildResult {
        final Artifact artifact;
        final PluginInvoker invoker;

        BuildResult(Artifact artifact, PluginInvoker invoker) {
            this.artifact = artifact;
            this.invoker = invoker;
        }
    }
}
