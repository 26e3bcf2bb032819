package com.cso.dispatch.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of builders to try for a source tree. A tree with a Dockerfile is built with
 * {@code docker}, falling back to {@code nixpacks}; any other tree with {@code nixpacks}. A
 * user-selected builder goes first and is not repeated.
 */
public final class BuilderChain {

    private static final Logger log = LoggerFactory.getLogger(BuilderChain.class);

    public static final String DOCKER = "docker";
    public static final String NIXPACKS = "nixpacks";

    static final List<String> DOCKERFILE_NAMES = List.of(
            "Dockerfile",
            "dockerfile",
            "Dockerfile.prod",
            "Dockerfile.production",
            "Dockerfile.dev",
            "Dockerfile.development");

    private final List<String> builders;
    private final String dockerfile;

    private BuilderChain(List<String> builders, String dockerfile) {
        this.builders = Collections.unmodifiableList(builders);
        this.dockerfile = dockerfile;
    }

    /**
     * @param sourceDir   root of the source tree
     * @param userBuilder builder selected by the user; null or blank for detection only
     */
    public static BuilderChain detect(Path sourceDir, String userBuilder) {
        Optional<String> dockerfile = findDockerfile(sourceDir);
        List<String> detected = dockerfile.isPresent() ? List.of(DOCKER, NIXPACKS) : List.of(NIXPACKS);

        List<String> chain = new ArrayList<>();
        if (userBuilder != null && !userBuilder.isBlank()) {
            chain.add(userBuilder.trim());
        }
        for (String b : detected) {
            if (!chain.contains(b)) chain.add(b);
        }
        log.info("Builder chain {} (dockerfile={})", chain, dockerfile.orElse("none"));
        return new BuilderChain(chain, dockerfile.orElse(null));
    }

    static Optional<String> findDockerfile(Path dir) {
        return DOCKERFILE_NAMES.stream()
                .filter(name -> Files.isRegularFile(dir.resolve(name)))
                .findFirst();
    }

    public List<String> getBuilders() {
        return builders;
    }

    /** Name of the detected Dockerfile, or null. */
    public String getDockerfile() {
        return dockerfile;
    }

    @Override
    public String toString() {
        return builders.toString();
    }
}
