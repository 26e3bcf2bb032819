package com.cso.plugin.nomad;

import com.cso.annotations.CsoPlugin;
import com.cso.annotations.CsoPluginOption;
import com.cso.executioncontext.ExecutionContext;
import com.cso.plugin.Artifact;
import com.cso.plugin.ContractType;
import com.cso.plugin.Deployment;
import com.cso.plugin.PlatformPlugin;
import com.cso.plugin.PluginConfigurationException;
import com.cso.plugin.PluginOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Deploys a container image as a Nomad service job and purges jobs, through the Nomad HTTP API
 * ({@code POST /v1/jobs}, {@code DELETE /v1/job/<id>?purge=true}). Requests carry
 * {@code X-Nomad-Token} when a token is configured and are abandoned when the execution context
 * is cancelled.
 */
@CsoPlugin(
        name = NomadPluginProvider.NAME,
        capability = ContractType.PLATFORM,
        description = "Registers and purges Nomad jobs",
        options = {
                @CsoPluginOption(name = "address", required = true),
                @CsoPluginOption(name = "token"),
                @CsoPluginOption(name = "job_id"),
                @CsoPluginOption(name = "count", type = "INT"),
                @CsoPluginOption(name = "cpu", type = "INT"),
                @CsoPluginOption(name = "memory", type = "INT"),
                @CsoPluginOption(name = "datacenters", type = "LIST")
        }
)
public final class NomadPlatform implements PlatformPlugin {

    private static final Logger log = LoggerFactory.getLogger(NomadPlatform.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final String TOKEN_HEADER = "X-Nomad-Token";

    static final int DEFAULT_COUNT = 1;
    static final int DEFAULT_CPU = 100;
    static final int DEFAULT_MEMORY = 256;
    static final List<String> DEFAULT_DATACENTERS = List.of("dc1");

    private final HttpClient httpClient;

    private String address;
    private String token;
    private String jobId;
    private int count = DEFAULT_COUNT;
    private int cpu = DEFAULT_CPU;
    private int memory = DEFAULT_MEMORY;
    private List<String> datacenters = DEFAULT_DATACENTERS;

    public NomadPlatform(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public void configure(Map<String, Object> options) throws PluginConfigurationException {
        address = PluginOptions.getString(options, "address");
        if (address == null) {
            throw new PluginConfigurationException("nomad platform requires 'address' option");
        }
        while (address.endsWith("/")) {
            address = address.substring(0, address.length() - 1);
        }
        token = PluginOptions.getString(options, "token");
        jobId = PluginOptions.getString(options, "job_id");
        count = Math.max(1, PluginOptions.getInt(options, "count", DEFAULT_COUNT));
        cpu = PluginOptions.getInt(options, "cpu", DEFAULT_CPU);
        memory = PluginOptions.getInt(options, "memory", DEFAULT_MEMORY);
        List<String> dcs = PluginOptions.getStringList(options, "datacenters");
        datacenters = dcs.isEmpty() ? DEFAULT_DATACENTERS : dcs;
    }

    @Override
    public Deployment deploy(ExecutionContext ctx, Artifact artifact) throws Exception {
        ctx.throwIfCancelled();
        if (artifact == null || artifact.getImage() == null) {
            throw new IllegalArgumentException("artifact image is required");
        }
        String id = jobId != null ? jobId : artifact.getImage();
        String body = MAPPER.writeValueAsString(jobSpec(id, artifact));
        log.info("Registering Nomad job {} with image {} at {}", id, artifact.getImageReference(), address);
        ctx.logLine("Registering job " + id + " on " + address);

        HttpRequest request = request("/v1/jobs")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(ctx, request);
        if (response.statusCode() / 100 != 2) {
            throw new IOException("nomad job register failed: " + response.statusCode() + " " + response.body());
        }
        JsonNode result = MAPPER.readTree(response.body());
        String evalId = result.path("EvalID").asText("");
        log.info("Nomad job {} registered (eval={})", id, evalId);
        return new Deployment(evalId.isEmpty() ? id : evalId, id, NomadPluginProvider.NAME, artifact.getId(),
                Deployment.State.PENDING, Instant.now());
    }

    @Override
    public void destroy(ExecutionContext ctx, String id) throws Exception {
        ctx.throwIfCancelled();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id is required");
        }
        log.info("Purging Nomad job {} at {}", id, address);
        HttpRequest request = request("/v1/job/" + URLEncoder.encode(id, StandardCharsets.UTF_8) + "?purge=true")
                .DELETE()
                .build();
        HttpResponse<String> response = send(ctx, request);
        if (response.statusCode() == 404) {
            log.info("Nomad job {} not found; nothing to purge", id);
            return;
        }
        if (response.statusCode() / 100 != 2) {
            throw new IOException("nomad job purge failed for " + id + ": " + response.statusCode() + " " + response.body());
        }
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(address + path)).timeout(REQUEST_TIMEOUT);
        if (token != null) {
            builder.header(TOKEN_HEADER, token);
        }
        return builder;
    }

    private HttpResponse<String> send(ExecutionContext ctx, HttpRequest request) throws Exception {
        try {
            return ctx.await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) throw (IOException) cause;
            throw new IOException("nomad request to " + request.uri() + " failed", cause);
        }
    }

    /** {@code {"Job": {...}}} for a single-task docker service job. */
    ObjectNode jobSpec(String id, Artifact artifact) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode job = root.putObject("Job");
        job.put("ID", id);
        job.put("Name", id);
        job.put("Type", "service");
        ArrayNode dcs = job.putArray("Datacenters");
        datacenters.forEach(dcs::add);

        ObjectNode group = job.putArray("TaskGroups").addObject();
        group.put("Name", id);
        group.put("Count", count);
        int port = artifact.getPrimaryPort();
        if (port > 0) {
            ObjectNode network = group.putArray("Networks").addObject();
            ObjectNode dynamic = network.putArray("DynamicPorts").addObject();
            dynamic.put("Label", "http");
            dynamic.put("To", port);
        }

        ObjectNode task = group.putArray("Tasks").addObject();
        task.put("Name", id);
        task.put("Driver", "docker");
        ObjectNode config = task.putObject("Config");
        config.put("image", artifact.getImageReference());
        if (port > 0) {
            config.putArray("ports").add("http");
        }
        ObjectNode resources = task.putObject("Resources");
        resources.put("CPU", cpu);
        resources.put("MemoryMB", memory);
        return root;
    }
}
