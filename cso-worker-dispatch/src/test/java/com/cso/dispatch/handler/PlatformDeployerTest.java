package com.cso.dispatch.handler;

import com.cso.dispatch.TestTasks;
import com.cso.dispatch.task.DeployImageParams;
import com.cso.dispatch.task.TaskType;
import com.cso.plugin.Artifact;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlatformDeployerTest {

    @Test
    void platformName_resolvesAliasesAndDefaults() {
        assertEquals("nomad", PlatformDeployer.platformName("nomad-pack", null));
        assertEquals("nomad", PlatformDeployer.platformName(null, "http://nomad.test:4646"));
        assertEquals("noop", PlatformDeployer.platformName("  ", null));
        assertEquals("noop", PlatformDeployer.platformName("noop", "http://nomad.test:4646"));
        assertEquals("fly", PlatformDeployer.platformName(" fly ", null));
    }

    @Test
    void platformOptions_omitUnsetResources() throws Exception {
        DeployImageParams params = TestTasks.parse(TaskType.DEPLOY_IMAGE,
                "{\"jobId\":\"job-9\",\"deploymentId\":\"d\",\"serviceId\":\"s\",\"imageName\":\"nginx\","
                        + "\"nomadAddress\":\"http://nomad.test:4646\",\"replicaCount\":2,\"ram\":\"512\"}");

        Map<String, Object> options = PlatformDeployer.platformOptions(params);

        assertEquals("http://nomad.test:4646", options.get("address"));
        assertEquals("job-9", options.get("job_id"));
        assertEquals(2, options.get("count"));
        assertEquals(512, options.get("memory"));
        assertFalse(options.containsKey("cpu"));
        assertFalse(options.containsKey("token"));
    }

    @Test
    void copyOf_keepsEveryField() {
        Instant built = Instant.parse("2024-05-01T10:00:00Z");
        Artifact original = Artifact.builder("a-1").image("app").tag("v1").digest("sha256:1")
                .label("team", "core").metadata("builder", "docker").exposedPorts(List.of(80, 443))
                .buildTime(built).buildId("b-7").build();

        Artifact copy = PlatformDeployer.copyOf(original).build();

        assertEquals("a-1", copy.getId());
        assertEquals("app:v1", copy.getImageReference());
        assertEquals("sha256:1", copy.getDigest());
        assertEquals("core", copy.getLabels().get("team"));
        assertEquals("docker", copy.getMetadata().get("builder"));
        assertEquals(List.of(80, 443), copy.getExposedPorts());
        assertEquals(built, copy.getBuildTime());
        assertEquals("b-7", copy.getBuildId());
    }
}
