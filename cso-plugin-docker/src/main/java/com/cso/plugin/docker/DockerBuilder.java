package com.cso.plugin.docker;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.BuilderPlugin;
import com.cso.plugin.CommandRunner;
import com.cso.plugin.ContractType;
import com.cso.plugin.PluginConfigurationException;
import com.cso.plugin.PluginOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds an image with {@code docker build}, run inside the build context directory.
 * <p>
 * Options: {@code image} (or {@code name}), {@code tag} (default latest), {@code context}
 * (default the working directory), {@code dockerfile} (default Dockerfile), {@code build_args}
 * and {@code env}; both maps become {@code --build-arg} flags.
 */
@CsoPlugin(
        name = DockerPluginProvider.NAME,
        capability = ContractType.BUILDER,
        description = "Builds a container image from a Dockerfile",
        options = {
                @CsoPluginOption(name = "image"),
                @CsoPluginOption(name = "name"),
                @CsoPluginOption(name = "tag"),
                @CsoPluginOption(name = "context"),
                @CsoPluginOption(name = "dockerfile"),
                @CsoPluginOption(name = "build_args", type = "MAP"),
                @CsoPluginOption(name = "env", type = "MAP")
        }
)
public final class DockerBuilder implements BuilderPlugin {

    private static final Logger log = LoggerFactory.getLogger(DockerBuilder.class);

    static final String DEFAULT_DOCKERFILE = "Dockerfile";

    private String image;
    private String tag;
    private String context;
    private String dockerfile;
    private Map<String, String> buildArgs = Map.of();
    private Map<String, String> env = Map.of();

    @Override
    public void configure(Map<String, Object> options) throws PluginConfigurationException {
        image = PluginOptions.getString(options, "image", PluginOptions.getString(options, "name"));
        if (image == null) {
            throw new PluginConfigurationException("docker builder requires either 'name' or 'image' option");
        }
        tag = PluginOptions.getString(options, "tag", "latest");
        context = PluginOptions.getString(options, "context", ".");
        dockerfile = PluginOptions.getString(options, "dockerfile", DEFAULT_DOCKERFILE);
        buildArgs = PluginOptions.getStringMap(options, "build_args");
        env = PluginOptions.getStringMap(options, "env");
    }

    @Override
    public Artifact build(ExecutionContext ctx) throws Exception {
        ctx.throwIfCancelled();
        List<String> command = command();
        log.info("Starting docker build of {}:{} (context={})", image, tag, context);
        ctx.logLine("Building image " + image + ":" + tag + " with docker");
        CommandRunner.of(command)
                .directory(Path.of(context))
                .runChecked(ctx);
        log.info("Docker build of {}:{} completed", image, tag);

        return Artifact.builder("docker-" + image + "-" + Instant.now().getEpochSecond())
                .image(image)
                .tag(tag)
                .label(Artifact.METADATA_BUILDER, DockerPluginProvider.NAME)
                .metadata(Artifact.METADATA_BUILDER, DockerPluginProvider.NAME)
                .metadata("context", context)
                .metadata("dockerfile", dockerfile)
                .buildTime(Instant.now())
                .build();
    }

    /** The docker argv; the build context is "." because the process runs inside it. */
    List<String> command() {
        List<String> args = new ArrayList<>(List.of("docker", "build", ".", "-f", dockerfile, "-t", image + ":" + tag));
        buildArgs.forEach((k, v) -> {
            args.add("--build-arg");
            args.add(k + "=" + v);
        });
        env.forEach((k, v) -> {
            args.add("--build-arg");
            args.add(k + "=" + v);
        });
        return args;
    }
}
