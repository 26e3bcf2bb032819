package com.cso.plugin.github;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.CommandResult;
import com.cso.plugin.CommandRunner;
import com.cso.plugin.ContractType;
import com.cso.plugin.PluginConfigurationException;
import com.cso.plugin.PluginOptions;
import com.cso.plugin.RegistryPlugin;
import com.cso.plugin.RegistryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Publishes release assets to GitHub Releases with the {@code gh} CLI. Creates the release when
 * it does not exist (unless {@code create_release} is false), optionally writes a
 * {@code checksums.txt} (SHA-256) next to the first asset, then uploads every asset with
 * {@code --clobber}.
 * <p>
 * Assets come from the {@code assets} option, else from the artifact's {@code binaries},
 * {@code release_assets} or {@code binary_path} metadata.
 */
@CsoPlugin(
        name = GitHubPluginProvider.NAME,
        capability = ContractType.REGISTRY,
        description = "Uploads release assets to GitHub Releases",
        options = {
                @CsoPluginOption(name = "repository", required = true),
                @CsoPluginOption(name = "token"),
                @CsoPluginOption(name = "tag_name", required = true),
                @CsoPluginOption(name = "release_name"),
                @CsoPluginOption(name = "release_notes"),
                @CsoPluginOption(name = "generate_notes", type = "BOOLEAN"),
                @CsoPluginOption(name = "checksums", type = "BOOLEAN"),
                @CsoPluginOption(name = "draft", type = "BOOLEAN"),
                @CsoPluginOption(name = "prerelease", type = "BOOLEAN"),
                @CsoPluginOption(name = "create_release", type = "BOOLEAN"),
                @CsoPluginOption(name = "target_commit"),
                @CsoPluginOption(name = "assets", type = "LIST")
        }
)
public final class GitHubReleaseRegistry implements RegistryPlugin {

    private static final Logger log = LoggerFactory.getLogger(GitHubReleaseRegistry.class);

    static final String CHECKSUMS_FILE = "checksums.txt";

    private String repository;
    private String token;
    private String tagName;
    private String releaseName;
    private String releaseNotes;
    private boolean generateNotes;
    private boolean checksums;
    private boolean draft;
    private boolean prerelease;
    private boolean createRelease = true;
    private String targetCommit;
    private List<String> assets = List.of();

    @Override
    @SuppressWarnings("unchecked")
    public void configure(Map<String, Object> options) throws PluginConfigurationException {
        repository = PluginOptions.getString(options, "repository");
        token = PluginOptions.getString(options, "token");
        Object auth = options.get("auth");
        if (auth instanceof Map) {
            token = PluginOptions.getString((Map<String, Object>) auth, "token", token);
        }
        tagName = PluginOptions.getString(options, "tag_name");
        releaseName = PluginOptions.getString(options, "release_name");
        releaseNotes = PluginOptions.getString(options, "release_notes");
        generateNotes = PluginOptions.getBoolean(options, "generate_notes", false);
        checksums = PluginOptions.getBoolean(options, "checksums", false);
        draft = PluginOptions.getBoolean(options, "draft", false);
        prerelease = PluginOptions.getBoolean(options, "prerelease", false);
        createRelease = PluginOptions.getBoolean(options, "create_release", true);
        targetCommit = PluginOptions.getString(options, "target_commit");
        assets = PluginOptions.getStringList(options, "assets");
        if (repository == null) throw new PluginConfigurationException("github registry requires 'repository' option");
        if (token == null) throw new PluginConfigurationException("github registry requires 'token' option");
        if (tagName == null) throw new PluginConfigurationException("github registry requires 'tag_name' option");
    }

    @Override
    public RegistryRef push(ExecutionContext ctx, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        List<String> files = resolveAssets(artifact);
        if (files.isEmpty()) {
            throw new IllegalStateException("no assets found (set assets or provide binaries, release_assets or "
                    + "binary_path in artifact metadata)");
        }
        log.info("Publishing {} asset(s) to {} release {}", files.size(), repository, tagName);

        CommandResult view = gh("release", "view", tagName, "--repo", repository).quiet().run(ctx);
        if (!view.isSuccess()) {
            if (!createRelease) {
                throw new IllegalStateException("release " + tagName + " does not exist and create_release is false");
            }
            ctx.logLine("Creating release " + tagName + " in " + repository);
            gh(createArgs()).runChecked(ctx);
        }

        List<String> uploads = new ArrayList<>(files);
        if (checksums) {
            Path sums = writeChecksums(files);
            uploads.add(sums.toString());
        }
        for (String asset : uploads) {
            ctx.throwIfCancelled();
            ctx.logLine("Uploading " + Path.of(asset).getFileName());
            gh("release", "upload", tagName, asset, "--repo", repository, "--clobber").runChecked(ctx);
        }

        String url = "https://github.com/" + repository + "/releases/tag/" + tagName;
        log.info("Published release {}", url);
        return new RegistryRef("github.com", repository, tagName, null, url, Instant.now());
    }

    private CommandRunner gh(String... args) {
        return gh(List.of(args));
    }

    private CommandRunner gh(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add("gh");
        command.addAll(args);
        return CommandRunner.of(command).env("GH_TOKEN", token).redact(token);
    }

    List<String> createArgs() {
        List<String> args = new ArrayList<>(List.of("release", "create", tagName, "--repo", repository,
                "--title", releaseName != null ? releaseName : tagName));
        if (draft) args.add("--draft");
        if (prerelease) args.add("--prerelease");
        if (generateNotes) args.add("--generate-notes");
        if (releaseNotes != null) {
            args.add("--notes");
            args.add(releaseNotes);
        }
        if (targetCommit != null) {
            args.add("--target");
            args.add(targetCommit);
        }
        return args;
    }

    List<String> resolveAssets(Artifact artifact) {
        if (!assets.isEmpty()) {
            return assets;
        }
        if (artifact == null) {
            return List.of();
        }
        Map<String, Object> metadata = artifact.getMetadata();
        List<String> fromBinaries = PluginOptions.getStringList(metadata, Artifact.METADATA_BINARIES);
        if (!fromBinaries.isEmpty()) return fromBinaries;
        List<String> fromRelease = PluginOptions.getStringList(metadata, "release_assets");
        if (!fromRelease.isEmpty()) return fromRelease;
        String single = PluginOptions.getString(metadata, "binary_path");
        return single != null ? List.of(single) : List.of();
    }

    /** Writes {@code <sha256>  <file name>} lines to checksums.txt beside the first asset. */
    static Path writeChecksums(List<String> files) throws IOException {
        Path first = Path.of(files.get(0)).toAbsolutePath();
        Path sums = first.getParent().resolve(CHECKSUMS_FILE);
        StringBuilder sb = new StringBuilder();
        for (String file : files) {
            Path p = Path.of(file);
            sb.append(sha256(p)).append("  ").append(p.getFileName()).append('\n');
        }
        Files.writeString(sums, sb.toString(), StandardCharsets.UTF_8);
        return sums;
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = in.read(buf)) != -1) {
                digest.update(buf, 0, n);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
