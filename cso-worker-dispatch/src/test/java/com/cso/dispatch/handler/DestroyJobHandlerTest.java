package com.cso.dispatch.handler;

import com.cso.dispatch.FakePlugins;
import com.cso.dispatch.TestTasks;
import com.cso.dispatch.task.DestroyJobParams;
import com.cso.dispatch.task.TaskType;
import com.cso.executioncontext.ExecutionCancelledException;
import com.cso.logstream.JobDestroyedPayload;
import com.cso.plugin.noop.NoopPluginProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DestroyJobHandlerTest {

    private static final String NOMAD_JOBS = "{\"jobs\":["
            + "{\"jobId\":\"job-a\",\"serviceId\":\"svc-a\",\"nomadAddress\":\"http://nomad.test:4646\",\"nomadToken\":\"t\"},"
            + "{\"jobId\":\"job-b\",\"serviceId\":\"svc-b\",\"nomadAddress\":\"http://nomad.test:4646\"},"
            + "{\"jobId\":\"job-c\",\"serviceId\":\"svc-c\",\"nomadAddress\":\"http://nomad.test:4646\"}"
            + "],\"reason\":\"service deleted\"}";

    @TempDir
    Path workDir;

    @Test
    void jobsWithoutAddress_destroyedThroughNoop() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(new NoopPluginProvider());
            DestroyJobParams params = TestTasks.parse(TaskType.DESTROY_JOB, TestTasks.DESTROY_JSON);

            new DestroyJobHandler().handle(f.hctx, params);

            List<JobDestroyedPayload> events = f.bus.payloads(JobDestroyedPayload.class);
            assertEquals(2, events.size());
            assertEquals("svc-a", events.get(0).getId());
            assertEquals("svc-b", events.get(1).getId());
            assertEquals("service deleted", events.get(0).getReason());
        }
    }

    @Test
    void nomadJobs_passAddressAndToken() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.platform("nomad", f.recorder));

            new DestroyJobHandler().handle(f.hctx, TestTasks.parse(TaskType.DESTROY_JOB, NOMAD_JOBS));

            assertEquals(List.of("job-a", "job-b", "job-c"), f.recorder.destroyed);
            assertEquals("http://nomad.test:4646", f.recorder.platformOptions.get(0).get("address"));
            assertEquals("t", f.recorder.platformOptions.get(0).get("token"));
            assertFalse(f.recorder.platformOptions.get(1).containsKey("token"));
        }
    }

    @Test
    void oneFailure_continuesAndReportsAtEnd() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.platform("nomad", f.recorder, "job-b"));

            DeploymentException e = assertThrows(DeploymentException.class,
                    () -> new DestroyJobHandler().handle(f.hctx, TestTasks.parse(TaskType.DESTROY_JOB, NOMAD_JOBS)));

            assertEquals("failed to destroy 1 of 3 job(s): job-b", e.getMessage());
            assertEquals(List.of("job-a", "job-c"), f.recorder.destroyed);
            List<JobDestroyedPayload> events = f.bus.payloads(JobDestroyedPayload.class);
            assertEquals(2, events.size());
            assertEquals("svc-c", events.get(1).getId());
        }
    }

    @Test
    void cancelledContext_stopsBeforeFirstJob() throws Exception {
        try (HandlerFixture f = new HandlerFixture(workDir)) {
            f.register(FakePlugins.platform("nomad", f.recorder));
            f.ctx.cancel();

            assertThrows(ExecutionCancelledException.class,
                    () -> new DestroyJobHandler().handle(f.hctx, TestTasks.parse(TaskType.DESTROY_JOB, NOMAD_JOBS)));
            assertTrue(f.recorder.destroyed.isEmpty());
            assertTrue(f.bus.all().isEmpty());
        }
    }
}
