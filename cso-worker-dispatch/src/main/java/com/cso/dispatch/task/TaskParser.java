package com.cso.dispatch.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Base64;

/**
 * Parses the task kind ({@value #ENV_TASK}) and its base64-encoded JSON parameters
 * ({@value #ENV_PARAMS}) handed to the worker by the scheduler.
 * <p>
 * Unknown JSON fields are ignored. For deployment kinds, {@code backendUrl} and
 * {@code accessToken} are filled from the worker's configuration when absent, so the parameters
 * carry the backend coordinates the scheduler expects; the worker itself makes no backend calls. The parsed
 * parameters are validated for the kind's required fields; a missing field is a parse failure.
 */
public final class TaskParser {

    private static final Logger log = LoggerFactory.getLogger(TaskParser.class);

    public static final String ENV_TASK = "NOMAD_META_TASK";
    public static final String ENV_PARAMS = "NOMAD_META_PARAMS";

    private static final int PREVIEW_LENGTH = 200;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String defaultBackendUrl;
    private final String defaultAccessToken;

    /**
     * @param defaultBackendUrl  injected into deployment params without {@code backendUrl}; may be null
     * @param defaultAccessToken injected into deployment params without {@code accessToken}; may be null
     */
    public TaskParser(String defaultBackendUrl, String defaultAccessToken) {
        this.defaultBackendUrl = defaultBackendUrl;
        this.defaultAccessToken = defaultAccessToken;
    }

    /**
     * @param value value of {@value #ENV_TASK}
     * @throws TaskParseException when the value is missing or not a known kind
     */
    public TaskType parseTaskType(String value) throws TaskParseException {
        if (value == null || value.isEmpty()) {
            throw new TaskParseException(ENV_TASK + " environment variable is not set");
        }
        TaskType type = TaskType.fromWireName(value);
        if (type == null) {
            throw new TaskParseException("unknown task type: " + value);
        }
        return type;
    }

    /**
     * Decodes and binds the parameters for {@code type}, then validates them.
     *
     * @param encoded value of {@value #ENV_PARAMS}
     * @throws TaskParseException when the value is missing, not base64, not JSON of the expected
     *                            shape, or lacks a required field
     */
    public TaskParams parseParams(TaskType type, String encoded) throws TaskParseException {
        if (encoded == null || encoded.isEmpty()) {
            throw new TaskParseException(ENV_PARAMS + " environment variable is not set");
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            log.error("Failed to decode base64 parameters (preview: {})", preview(encoded));
            throw new TaskParseException("failed to decode base64 parameters: " + e.getMessage(), e);
        }

        TaskParams params;
        try {
            JsonNode tree = MAPPER.readTree(json);
            if (tree == null || !tree.isObject()) {
                throw new TaskParseException("failed to parse " + type + " parameters: expected a JSON object");
            }
            params = MAPPER.treeToValue(applyDefaults(type, (ObjectNode) tree), paramsClass(type));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse {} parameters JSON: {}", type, e.getOriginalMessage());
            throw new TaskParseException("failed to parse " + type + " parameters: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TaskParseException("failed to parse " + type + " parameters: " + e.getMessage(), e);
        }

        try {
            params.validate();
        } catch (TaskParseException e) {
            log.error("Parameter validation failed for {}: {}", type, e.getMessage());
            throw e;
        }
        return params;
    }

    /** Parses both values into a task. */
    public Task parse(String taskValue, String paramsValue) throws TaskParseException {
        TaskType type = parseTaskType(taskValue);
        return new Task(type, parseParams(type, paramsValue));
    }

    static Class<? extends TaskParams> paramsClass(TaskType type) {
        switch (type) {
            case DEPLOY_REPOSITORY:
            case REDEPLOY_REPOSITORY:
                return DeployRepositoryParams.class;
            case DEPLOY_IMAGE:
                return DeployImageParams.class;
            case DESTROY_JOB:
                return DestroyJobParams.class;
            default:
                throw new IllegalArgumentException("unsupported task type: " + type);
        }
    }

    private ObjectNode applyDefaults(TaskType type, ObjectNode tree) {
        if (type == TaskType.DESTROY_JOB) {
            return tree;
        }
        injectIfAbsent(tree, "backendUrl", defaultBackendUrl);
        injectIfAbsent(tree, "accessToken", defaultAccessToken);
        log.debug("Backend config for {}: backendUrl={}, accessToken length={}", type,
                tree.path("backendUrl").asText(""), tree.path("accessToken").asText("").length());
        return tree;
    }

    private static void injectIfAbsent(ObjectNode tree, String field, String value) {
        JsonNode current = tree.get(field);
        boolean absent = current == null || current.isNull() || current.asText("").isEmpty();
        if (absent && value != null && !value.isEmpty()) {
            tree.put(field, value);
        }
    }

    private static String preview(String s) {
        return s.length() > PREVIEW_LENGTH ? s.substring(0, PREVIEW_LENGTH) : s;
    }
}
