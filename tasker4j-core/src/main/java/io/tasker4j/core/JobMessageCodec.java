package io.tasker4j.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wire format of queued one-shot jobs.
 *
 * <p>A message is a flat JSON object:
 * <pre>
 * {"taskClass":"...","taskParams":{...},"runAt":1700000000,"retryAttempts":2,"retryInterval":5,"failTimes":1}
 * </pre>
 * {@code runAt} is present only for delayed messages. The three retry fields are written for delayed messages
 * and for immediate messages that carry a retry policy.
 *
 * <p>Decoding is lenient about numeric fields sent as strings and about an empty JSON array in place of
 * {@code taskParams}; anything else that is not a usable message is rejected with {@link IllegalArgumentException}.
 */
public class JobMessageCodec {

    static final String TASK_CLASS = "taskClass";
    static final String TASK_PARAMS = "taskParams";
    static final String RUN_AT = "runAt";
    static final String RETRY_ATTEMPTS = "retryAttempts";
    static final String RETRY_INTERVAL = "retryInterval";
    static final String FAIL_TIMES = "failTimes";

    private final ObjectMapper objectMapper;

    public JobMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public JobMessageCodec() {
        this(new ObjectMapper());
    }

    public String encode(JobMessage message) {
        Objects.requireNonNull(message, "message must not be null");

        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put(TASK_CLASS, message.jobClass());
        wire.put(TASK_PARAMS, message.params());

        boolean withRetry = message.retryAttempts() > 0 || message.failTimes() > 0;
        if (message.isDelayed()) {
            wire.put(RUN_AT, message.runAt());
        }
        if (message.isDelayed() || withRetry) {
            wire.put(RETRY_ATTEMPTS, message.retryAttempts());
            wire.put(RETRY_INTERVAL, message.retryIntervalSeconds());
            wire.put(FAIL_TIMES, message.failTimes());
        }

        try {
            return objectMapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job params are not JSON serializable: " + message.jobClass(), e);
        }
    }

    /**
     * Parses a queued payload.
     *
     * <p>Params come back as Jackson's untyped JSON values: numbers are narrowed to the smallest fitting type,
     * so a {@code Long} param that fits an int is decoded as {@code Integer}. Jobs should read numeric params
     * through {@link Number}.
     */
    public JobMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload must not be blank");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not valid JSON", e);
        }
        if (root == null || !root.isObject() || root.isEmpty()) {
            throw new IllegalArgumentException("payload must be a non-empty JSON object");
        }

        JsonNode taskClass = root.path(TASK_CLASS);
        if (!taskClass.isTextual() || taskClass.asText().isBlank()) {
            throw new IllegalArgumentException("payload has no taskClass");
        }

        return new JobMessage(
                taskClass.asText(),
                params(root.path(TASK_PARAMS)),
                runAt(root.path(RUN_AT)),
                root.path(RETRY_ATTEMPTS).asInt(0),
                root.path(RETRY_INTERVAL).asInt(0),
                root.path(FAIL_TIMES).asInt(0)
        );
    }

    private Map<String, Object> params(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || (node.isArray() && node.isEmpty())) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("taskParams must be a JSON object");
        }
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }

    private static Long runAt(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("runAt is not a timestamp: " + node.asText());
        }
    }
}
