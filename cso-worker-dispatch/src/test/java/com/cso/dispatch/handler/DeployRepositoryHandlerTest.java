package com.cso.dispatch.handler;

import com.cso.dispatch.FakePlugins;
import com.cso.dispatch.TestTasks;
import com.cso.dispatch.source.SourceFetcher;
import com.cso.dispatch.task.DeployRepositoryParams;
import com.cso.dispatch.task.TaskType;
import com.cso.logstream.DeploymentEventPayload;
import com.cso.logstream.DeploymentStatus;
import com.cso.logstream.DeploymentStatusPayload;
import com.cso.logstream.DeploymentType;
import com.cso.logstream.Subjects;
import com.cso.plugin.Artifact;
import com.cso.plugin.RegistryRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DeployRepositoryHandlerTest {

    private static final String BASE = "\"jobId\":\"job-1\",\"deploymentId\":\"dep-1\",\"serviceId\":\"svc-1\","
            + "\"teamId\":\"team-1\",\"userId\":42,\"ownerId\":\"7\",\"deploymentJobId\":99,"
            + "\"repository\":\"acme/app\",\"branch\":\"main\",\"deploy\":\"noop\"";

    @TempDir
    Path workDir;

    /** Fetcher that writes the given files into {@code <target>/src}. */
    private static SourceFetcher fetcherWith(String... files) {
        return (ctx, params, target) -> {
            Path src = Files.createDirectories(target.resolve("src"));
            for (String name : files) {
                Path file = src.resolve(name);
                Files.createDirectories(file.getParent());
                Files.writeString(file, "x");
            }
            return src;
        };
    }

    private static DeployRepositoryParams params(String extra) throws Exception {
        return TestTasks.parse(TaskType.DEPLOY_REPOSITORY, "{" + BASE + (extra.isEmpty() ? "" : "," + extra) + "}");
    }

    @Test
    void dockerFailure_fallsBackToNixpacksAndDeploys() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("docker", f.recorder, "daemon unavailable"),
                    FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith("Dockerfile")).handle(f.hctx, params(""));

            assertEquals(List.of("docker", "nixpacks"), f.recorder.builds);
            Map<String, Object> options = f.recorder.builderOptions.get(1);
            assertEquals("svc-1", options.get("image"));
            assertEquals("latest", options.get("tag"));
            assertEquals("Dockerfile", options.get("dockerfile"));

            assertEquals(1, f.recorder.deployed.size());
            assertEquals("svc-1:latest", f.recorder.deployed.get(0).getImageReference());
            assertEquals("job-1", f.recorder.platformOptions.get(0).get("job_id"));
            assertTrue(f.recorder.pushed.isEmpty());

            assertEquals(List.of(Subjects.DEPLOYMENT_STATUS_CHANGED, Subjects.DEPLOYMENT_SUCCEEDED), f.bus.subjects());
            DeploymentStatusPayload started = f.bus.payloads(DeploymentStatusPayload.class).get(0);
            assertEquals(99, started.getJobId());
            assertEquals(DeploymentStatus.IN_PROGRESS, started.getStatus());
            DeploymentEventPayload done = f.bus.payloads(DeploymentEventPayload.class).get(0);
            assertEquals(DeploymentType.GIT_REPO, done.getType());
            assertEquals("dep-1", done.getDeploymentId());
            assertEquals("42", done.getUserId());
            assertEquals("7", done.getOwnerId());
        }
    }

    @Test
    void allBuildersFail_publishesFailedAndThrows() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("docker", f.recorder, "daemon unavailable"),
                    FakePlugins.builder("nixpacks", f.recorder, "no provider matched"),
                    FakePlugins.platform("noop", f.recorder));

            DeploymentException e = assertThrows(DeploymentException.class,
                    () -> new DeployRepositoryHandler(fetcherWith("Dockerfile")).handle(f.hctx, params("")));

            assertEquals("build failed with all builders: no provider matched", e.getMessage());
            assertTrue(f.recorder.deployed.isEmpty());
            assertEquals(List.of(Subjects.DEPLOYMENT_STATUS_CHANGED, Subjects.DEPLOYMENT_FAILED), f.bus.subjects());
        }
    }

    @Test
    void unknownUserBuilder_fallsThroughToDetectedChain() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith("package.json"))
                    .handle(f.hctx, params("\"build\":{\"builder\":\"railpack\"}"));

            assertEquals(List.of("nixpacks"), f.recorder.builds);
            assertEquals(1, f.recorder.deployed.size());
        }
    }

    @Test
    void registryConfigured_pushesAndDeploysPushedImage() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.registry("docker", f.recorder),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith()).handle(f.hctx, params("\"imageName\":\"shop\",\"imageTag\":\"v2\","
                    + "\"build\":{\"registryUrl\":\"registry.test\",\"registryNamespace\":\"team\"}"));

            assertEquals(1, f.recorder.pushed.size());
            Artifact deployed = f.recorder.deployed.get(0);
            assertEquals("registry.test/team/shop", deployed.getImage());
            assertEquals("v2", deployed.getTag());
            assertEquals("sha256:abc", deployed.getDigest());
        }
    }

    @Test
    void disablePush_skipsRegistry() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.registry("docker", f.recorder),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith()).handle(f.hctx,
                    params("\"build\":{\"registryUrl\":\"registry.test\",\"disablePush\":true}"));

            assertTrue(f.recorder.pushed.isEmpty());
            assertEquals("svc-1", f.recorder.deployed.get(0).getImage());
        }
    }

    @Test
    void rootDirectory_becomesBuildContextAndPortsAreDeclared() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith("services/api/main.go")).handle(f.hctx,
                    params("\"networks\":[{\"portNumber\":8080},{\"portNumber\":\"8080\"},{\"portNumber\":0}],"
                            + "\"build\":{\"rootDirectory\":\"/services/api\"}"));

            String context = (String) f.recorder.builderOptions.get(0).get("context");
            assertTrue(Path.of(context).endsWith(Path.of("services", "api")), context);
            assertEquals(List.of(8080), f.recorder.deployed.get(0).getExposedPorts());
        }
    }

    @Test
    void fetchFailure_publishesFailed() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.platform("noop", f.recorder));
            SourceFetcher failing = (ctx, params, target) -> {
                throw new IllegalStateException("clone refused");
            };

            Exception e = assertThrows(IllegalStateException.class,
                    () -> new DeployRepositoryHandler(failing).handle(f.hctx, params("")));

            assertEquals("clone refused", e.getMessage());
            assertEquals(List.of(Subjects.DEPLOYMENT_STATUS_CHANGED, Subjects.DEPLOYMENT_FAILED), f.bus.subjects());
        }
    }

    @Test
    void busFailure_doesNotFailDeployment() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("nixpacks", f.recorder, null),
                    FakePlugins.platform("noop", f.recorder));
            f.bus.setFailing(true);

            new DeployRepositoryHandler(fetcherWith()).handle(f.hctx, params(""));

            assertEquals(1, f.recorder.deployed.size());
            assertTrue(f.bus.all().isEmpty());
        }
    }

    @Test
    void success_removesWorkDirectory() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("docker", f.recorder, null),
                    FakePlugins.platform("noop", f.recorder));

            new DeployRepositoryHandler(fetcherWith("Dockerfile", "src/index.js")).handle(f.hctx, params(""));

            assertEquals(1, f.recorder.deployed.size());
            try (Stream<Path> left = Files.list(workDir)) {
                assertEquals(0, left.count());
            }
        }
    }

    @Test
    void failure_preservesWorkDirectory() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.builder("docker", f.recorder, "daemon unavailable"),
                    FakePlugins.builder("nixpacks", f.recorder, "no provider matched"),
                    FakePlugins.platform("noop", f.recorder));

            assertThrows(DeploymentException.class,
                    () -> new DeployRepositoryHandler(fetcherWith("Dockerfile")).handle(f.hctx, params("")));

            try (Stream<Path> left = Files.list(workDir)) {
                List<Path> dirs = left.collect(Collectors.toList());
                assertEquals(1, dirs.size());
                assertTrue(dirs.get(0).getFileName().toString().startsWith("cso-deploy-"));
                assertTrue(Files.exists(dirs.get(0).resolve("src/Dockerfile")));
            }
        }
    }

    @Test
    void resolveRoot_rejectsEscapesAndMissingDirectories(@TempDir Path src) throws Exception {
        Files.createDirectories(src.resolve("app"));

        assertEquals(src, DeployRepositoryHandler.resolveRoot(src, null));
        assertEquals(src, DeployRepositoryHandler.resolveRoot(src, "."));
        assertEquals(src.resolve("app"), DeployRepositoryHandler.resolveRoot(src, "app"));
        assertThrows(DeploymentException.class, () -> DeployRepositoryHandler.resolveRoot(src, "../outside"));
        assertThrows(DeploymentException.class, () -> DeployRepositoryHandler.resolveRoot(src, "missing"));
    }

    @Test
    void pushedArtifact_splitsTagAfterLastSlash() {
        Artifact built = Artifact.builder("a-1").image("app").tag("latest").label("k", "v").build();

        Artifact pushed = DeployRepositoryHandler.pushedArtifact(built, new RegistryRef("registry.test:5000", "team/app",
                "v3", "sha256:def", "registry.test:5000/team/app:v3", Instant.now()));
        assertEquals("registry.test:5000/team/app", pushed.getImage());
        assertEquals("v3", pushed.getTag());
        assertEquals("sha256:def", pushed.getDigest());
        assertEquals("v", pushed.getLabels().get("k"));

        Artifact untagged = DeployRepositoryHandler.pushedArtifact(built, new RegistryRef("registry.test:5000", "team/app",
                null, null, "registry.test:5000/team/app", Instant.now()));
        assertEquals("registry.test:5000/team/app", untagged.getImage());
        assertEquals("latest", untagged.getTag());
    }
}
