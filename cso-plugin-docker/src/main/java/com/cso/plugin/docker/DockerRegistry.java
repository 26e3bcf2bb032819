package com.cso.plugin.docker;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.CommandResult;
import com.cso.plugin.CommandRunner;
import com.cso.plugin.ContractType;
import com.cso.plugin.PluginOptions;
import com.cso.plugin.RegistryPlugin;
import com.cso.plugin.RegistryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pushes a built image to a container registry: {@code docker login} (password on stdin),
 * {@code docker tag}, {@code docker push}. The digest is read from the push output.
 * <p>
 * The registry host is taken from the first segment of {@code image} when it looks like a host
 * (contains "." or ":"), otherwise from {@code registry}. Missing {@code registry},
 * {@code username}, {@code password} and {@code namespace} options fall back to
 * REGISTRY_URL, REGISTRY_USERNAME, REGISTRY_PASSWORD and REGISTRY_NAMESPACE.
 */
@CsoPlugin(
        name = DockerPluginProvider.NAME,
        capability = ContractType.REGISTRY,
        description = "Pushes an image with the docker CLI",
        options = {
                @CsoPluginOption(name = "image"),
                @CsoPluginOption(name = "tag"),
                @CsoPluginOption(name = "registry"),
                @CsoPluginOption(name = "namespace"),
                @CsoPluginOption(name = "username"),
                @CsoPluginOption(name = "password")
        }
)
public final class DockerRegistry implements RegistryPlugin {

    private static final Logger log = LoggerFactory.getLogger(DockerRegistry.class);

    private static final Pattern DIGEST = Pattern.compile("sha256:[0-9a-f]{64}");

    private final UnaryOperator<String> environment;
    private final Set<String> loggedIn;

    private String image;
    private String tag;
    private String registry;
    private String namespace;
    private String username;
    private String password;

    /**
     * @param environment source of the REGISTRY_* fallbacks
     * @param loggedIn    receives every registry host this component logged in to
     */
    DockerRegistry(UnaryOperator<String> environment, Set<String> loggedIn) {
        this.environment = environment;
        this.loggedIn = loggedIn;
    }

    @Override
    public void configure(Map<String, Object> options) {
        image = PluginOptions.getString(options, "image");
        tag = PluginOptions.getString(options, "tag");
        registry = PluginOptions.getString(options, "registry", env("REGISTRY_URL"));
        namespace = PluginOptions.getString(options, "namespace", env("REGISTRY_NAMESPACE"));
        username = PluginOptions.getString(options, "username", env("REGISTRY_USERNAME"));
        password = PluginOptions.getString(options, "password", env("REGISTRY_PASSWORD"));
    }

    @Override
    public RegistryRef push(ExecutionContext ctx, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        if (artifact == null || artifact.getImage() == null) {
            throw new IllegalArgumentException("artifact image is required");
        }
        if (username == null) {
            throw new IllegalStateException("registry username is required");
        }
        if (password == null) {
            throw new IllegalStateException("registry password is required");
        }
        Target target = resolveTarget(image != null ? image : artifact.getImage(), registry, namespace,
                tag != null ? tag : artifact.getTag());

        log.info("Pushing {} to {}", artifact.getImageReference(), target.fullImage);
        ctx.logLine("Pushing image " + target.fullImage);

        CommandRunner.of("docker", "login", target.registry, "-u", username, "--password-stdin")
                .stdin(password)
                .redact(password)
                .quiet()
                .runChecked(ctx);
        loggedIn.add(target.registry);
        CommandRunner.of("docker", "tag", sourceImage(artifact), target.fullImage).runChecked(ctx);
        CommandResult pushed = CommandRunner.of("docker", "push", target.fullImage).runChecked(ctx);

        String digest = parseDigest(pushed.getStdout());
        log.info("Pushed {} (digest={})", target.fullImage, digest);
        return new RegistryRef(target.registry, target.repository, target.tag, digest, target.fullImage, Instant.now());
    }

    private String env(String key) {
        String v = environment.apply(key);
        return v != null && !v.isBlank() ? v.trim() : null;
    }

    static String sourceImage(Artifact artifact) {
        String image = artifact.getImage();
        if (artifact.getTag() != null && !image.contains(":")) {
            return image + ":" + artifact.getTag();
        }
        return image;
    }

    /** First {@code sha256:<64 hex>} in the push output, or null. */
    static String parseDigest(String output) {
        if (output == null) return null;
        Matcher m = DIGEST.matcher(output);
        return m.find() ? m.group() : null;
    }

    static Target resolveTarget(String image, String registry, String namespace, String tag) {
        String registryUrl = registry;
        String repository = image;
        int slash = image.indexOf('/');
        if (slash > 0) {
            String first = image.substring(0, slash);
            if (first.contains(".") || first.contains(":")) {
                registryUrl = first;
                repository = image.substring(slash + 1);
            }
        }
        if (registryUrl == null || registryUrl.isBlank()) {
            throw new IllegalStateException("registry URL could not be determined from options");
        }
        String effectiveTag = tag != null && !tag.isBlank() ? tag : "latest";
        String path = namespace != null && !namespace.isBlank() ? namespace : repository;
        return new Target(registryUrl, repository, effectiveTag, registryUrl + "/" + path + ":" + effectiveTag);
    }

    static final class Target {
        final String registry;
        final String repository;
        final String tag;
        final String fullImage;

        Target(String registry, String repository, String tag, String fullImage) {
            this.registry = registry;
            this.repository = repository;
            this.tag = tag;
            this.fullImage = fullImage;
        }
    }
}
