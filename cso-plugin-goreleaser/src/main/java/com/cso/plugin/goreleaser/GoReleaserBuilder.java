package com.cso.plugin.goreleaser;

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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-compiles a Go program once per {@code GOOS/GOARCH} target with {@code go build}
 * (CGO disabled, stripped, version stamped through ldflags). The resulting binary paths are
 * recorded under {@link Artifact#METADATA_BINARIES} for the release registry.
 */
@CsoPlugin(
        name = GoReleaserPluginProvider.NAME,
        capability = ContractType.BUILDER,
        description = "Builds release binaries for several platforms",
        options = {
                @CsoPluginOption(name = "name", required = true),
                @CsoPluginOption(name = "path"),
                @CsoPluginOption(name = "version"),
                @CsoPluginOption(name = "output_dir"),
                @CsoPluginOption(name = "targets", type = "LIST"),
                @CsoPluginOption(name = "ldflags"),
                @CsoPluginOption(name = "build_args", type = "MAP")
        }
)
public final class GoReleaserBuilder implements BuilderPlugin {

    private static final Logger log = LoggerFactory.getLogger(GoReleaserBuilder.class);

    static final List<String> DEFAULT_TARGETS = List.of("linux/amd64", "darwin/arm64");
    static final String DEFAULT_OUTPUT_DIR = "./dist";

    private String name;
    private String path;
    private String version;
    private String outputDir;
    private String extraLdflags;
    private List<String> targets = DEFAULT_TARGETS;
    private Map<String, String> buildArgs = Map.of();

    @Override
    public void configure(Map<String, Object> options) throws PluginConfigurationException {
        name = PluginOptions.getString(options, "name");
        if (name == null) {
            throw new PluginConfigurationException("goreleaser builder requires 'name' option");
        }
        path = PluginOptions.getString(options, "path", ".");
        version = PluginOptions.getString(options, "version");
        outputDir = PluginOptions.getString(options, "output_dir", DEFAULT_OUTPUT_DIR);
        extraLdflags = PluginOptions.getString(options, "ldflags");
        List<String> configured = PluginOptions.getStringList(options, "targets");
        targets = configured.isEmpty() ? DEFAULT_TARGETS : configured;
        for (String target : targets) {
            if (target.split("/").length != 2) {
                throw new PluginConfigurationException("invalid target format '" + target + "': expected GOOS/GOARCH");
            }
        }
        buildArgs = PluginOptions.getStringMap(options, "build_args");
    }

    @Override
    public Artifact build(ExecutionContext ctx) throws Exception {
        ctx.throwIfCancelled();
        log.info("Starting Go build of {} (path={}, version={}, targets={})", name, path, version, targets);
        Path out = Path.of(outputDir);
        Files.createDirectories(out);

        List<String> binaries = new ArrayList<>();
        for (String target : targets) {
            ctx.throwIfCancelled();
            String[] parts = target.split("/");
            String goos = parts[0];
            String goarch = parts[1];
            Path binary = out.resolve(binaryName(goos, goarch));
            ctx.logLine("Building " + binary + " for " + target);
            CommandRunner.of(command(binary.toString()))
                    .env("CGO_ENABLED", "0")
                    .env("GOOS", goos)
                    .env("GOARCH", goarch)
                    .runChecked(ctx);
            if (!Files.exists(binary)) {
                throw new IOException("binary was not created at " + binary);
            }
            log.info("Built {} for {}", binary, target);
            binaries.add(binary.toString());
        }

        return Artifact.builder("goreleaser-" + name + "-" + Instant.now().getEpochSecond())
                .image(name)
                .tag(version)
                .label(Artifact.METADATA_BUILDER, GoReleaserPluginProvider.NAME)
                .metadata(Artifact.METADATA_BUILDER, GoReleaserPluginProvider.NAME)
                .metadata(Artifact.METADATA_BINARIES, List.copyOf(binaries))
                .metadata("targets", targets)
                .metadata("version", version != null ? version : "")
                .buildTime(Instant.now())
                .build();
    }

    String binaryName(String goos, String goarch) {
        String binary = name + "-" + goos + "-" + goarch;
        return "windows".equals(goos) ? binary + ".exe" : binary;
    }

    String ldflags() {
        StringBuilder sb = new StringBuilder("-s -w");
        if (version != null) {
            sb.append(" -X main.Version=").append(version).append(" -X main.version=").append(version);
        }
        if (extraLdflags != null) {
            sb.append(' ').append(extraLdflags);
        }
        return sb.toString();
    }

    List<String> command(String outputPath) {
        List<String> args = new ArrayList<>(List.of("go", "build", "-ldflags", ldflags(), "-o", outputPath));
        buildArgs.forEach((k, v) -> args.add("-" + k + "=" + v));
        args.add(path);
        return args;
    }
}
