package com.cso.plugin.docker;

import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DockerRegistryTest {

    private static final String HEX = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

    @Test
    void resolveTarget_usesHostFromImage() {
        DockerRegistry.Target target = DockerRegistry.resolveTarget("registry.example.com/team/web", "ignored", null, "v1");

        assertEquals("registry.example.com", target.registry);
        assertEquals("team/web", target.repository);
        assertEquals("registry.example.com/team/web:v1", target.fullImage);
    }

    @Test
    void resolveTarget_namespaceOnlyImageUsesRegistryOption() {
        DockerRegistry.Target target = DockerRegistry.resolveTarget("team/web", "localhost:5000", null, null);

        assertEquals("localhost:5000/team/web:latest", target.fullImage);
    }

    @Test
    void resolveTarget_namespaceReplacesRepositoryPath() {
        DockerRegistry.Target target = DockerRegistry.resolveTarget("web", "reg.io", "cli/user_abc/web", "7");

        assertEquals("reg.io/cli/user_abc/web:7", target.fullImage);
        assertEquals("web", target.repository);
    }

    @Test
    void resolveTarget_failsWithoutRegistry() {
        assertThrows(IllegalStateException.class, () -> DockerRegistry.resolveTarget("web", null, null, "v1"));
    }

    @Test
    void parseDigest_takesFirstSha256() {
        String output = "The push refers to repository [reg.io/web]\n"
                + "v1: digest: sha256:" + HEX + " size: 1570\n"
                + "other sha256:" + HEX.replace('0', 'f') + "\n";

        assertEquals("sha256:" + HEX, DockerRegistry.parseDigest(output));
        assertNull(DockerRegistry.parseDigest("no digest here"));
    }

    @Test
    void sourceImage_appendsTagUnlessPresent() {
        assertEquals("web:v1", DockerRegistry.sourceImage(Artifact.builder("a").image("web").tag("v1").build()));
        assertEquals("web:pinned", DockerRegistry.sourceImage(Artifact.builder("a").image("web:pinned").tag("v1").build()));
    }

    @Test
    void push_requiresCredentialsFromOptionsOrEnvironment() {
        DockerRegistry registry = new DockerRegistry(key -> "REGISTRY_URL".equals(key) ? "reg.io" : null, new HashSet<>());
        registry.configure(Map.of("image", "web"));

        try (ExecutionContext ctx = ExecutionContext.withTimeout(Duration.ofMinutes(1))) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> registry.push(ctx, Artifact.builder("a").image("web").tag("v1").build()));
            assertTrue(e.getMessage().contains("username"));
        }
    }
}
