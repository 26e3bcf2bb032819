package com.cso.plugin.docker;

import com.cso.plugin.PluginConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DockerBuilderTest {

    @Test
    void command_appliesDefaults() throws Exception {
        DockerBuilder builder = new DockerBuilder();
        builder.configure(Map.of("image", "web"));

        assertEquals(List.of("docker", "build", ".", "-f", "Dockerfile", "-t", "web:latest"), builder.command());
    }

    @Test
    void command_addsBuildArgsAndEnv() throws Exception {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("NODE_ENV", "production");
        DockerBuilder builder = new DockerBuilder();
        builder.configure(Map.of(
                "name", "api",
                "tag", "v3",
                "dockerfile", "Dockerfile.prod",
                "build_args", args,
                "env", Map.of("API_KEY", "k")));

        assertEquals(List.of("docker", "build", ".", "-f", "Dockerfile.prod", "-t", "api:v3",
                "--build-arg", "NODE_ENV=production", "--build-arg", "API_KEY=k"), builder.command());
    }

    @Test
    void configure_requiresImageOrName() {
        assertThrows(PluginConfigurationException.class, () -> new DockerBuilder().configure(Map.of("tag", "v1")));
    }
}
