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
 * Builds an image from source without a Dockerfile using {@code nixpacks build}. Fallback
 * builder when no Dockerfile is present or the docker build fails.
 */
@CsoPlugin(
        name = NixpacksPluginProvider.NAME,
        capability = ContractType.BUILDER,
        description = "Builds a container image with nixpacks",
        options = {
                @CsoPluginOption(name = "image"),
                @CsoPluginOption(name = "name"),
                @CsoPluginOption(name = "tag"),
                @CsoPluginOption(name = "context"),
                @CsoPluginOption(name = "build_command"),
                @CsoPluginOption(name = "start_command"),
                @CsoPluginOption(name = "build_args", type = "MAP"),
                @CsoPluginOption(name = "env", type = "MAP")
        }
)
public final class NixpacksBuilder implements BuilderPlugin {

    private static final Logger log = LoggerFactory.getLogger(NixpacksBuilder.class);

    private String image;
    private String tag;
    private String context;
    private String buildCommand;
    private String startCommand;
    private Map<String, String> buildArgs = Map.of();
    private Map<String, String> env = Map.of();

    @Override
    public void configure(Map<String, Object> options) throws PluginConfigurationException {
        image = PluginOptions.getString(options, "image", PluginOptions.getString(options, "name"));
        if (image == null) {
            throw new PluginConfigurationException("nixpacks builder requires 'name' or 'image' option");
        }
        tag = PluginOptions.getString(options, "tag", "latest");
        context = PluginOptions.getString(options, "context", ".");
        buildCommand = PluginOptions.getString(options, "build_command");
        startCommand = PluginOptions.getString(options, "start_command");
        buildArgs = PluginOptions.getStringMap(options, "build_args");
        env = PluginOptions.getStringMap(options, "env");
    }

    @Override
    public Artifact build(ExecutionContext ctx) throws Exception {
        ctx.throwIfCancelled();
        log.info("Starting nixpacks build of {}:{} (context={})", image, tag, context);
        ctx.logLine("Building image " + image + ":" + tag + " with nixpacks");
        CommandRunner.of(command())
                .directory(Path.of(context))
                .runChecked(ctx);
        log.info("Nixpacks build of {}:{} completed", image, tag);

        return Artifact.builder("nixpacks-" + image + "-" + Instant.now().getEpochSecond())
                .image(image)
                .tag(tag)
                .label(Artifact.METADATA_BUILDER, NixpacksPluginProvider.NAME)
                .metadata(Artifact.METADATA_BUILDER, NixpacksPluginProvider.NAME)
                .metadata("context", context)
                .buildTime(Instant.now())
                .build();
    }

    List<String> command() {
        List<String> args = new ArrayList<>(List.of("nixpacks", "build", ".", "--name", image, "--tag", tag));
        if (buildCommand != null) {
            args.add("--build-cmd");
            args.add(buildCommand);
        }
        if (startCommand != null) {
            args.add("--start-cmd");
            args.add(startCommand);
        }
        buildArgs.forEach((k, v) -> {
            args.add("--build-arg");
            args.add(k + "=" + v);
        });
        env.forEach((k, v) -> {
            args.add("--env");
            args.add(k + "=" + v);
        });
        return args;
    }
}
