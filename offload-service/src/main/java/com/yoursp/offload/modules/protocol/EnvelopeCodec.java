package com.yoursp.offload.modules.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON codec for the two envelope shapes that cross the worker boundary.
 * <p>
 * Every envelope is serialized to text before it is handed to the other
 * side, so no object graph is ever shared between the pool and a worker.
 * Decoding is lenient: unknown fields are ignored and missing fields come
 * back as {@code null} so that the receiver can decide how to report them.
 * </p>
 */
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String encodeTask(TaskEnvelope task) {
        return write(task);
    }

    public String encodeResult(ResultEnvelope result) {
        return write(result);
    }

    /**
     * Decode a task. Structural problems (not JSON, not an object) throw;
     * missing {@code id}/{@code action} are returned as nulls.
     */
    public TaskEnvelope decodeTask(String json) {
        JsonNode node = readObject(json);
        return new TaskEnvelope(
                textOrNull(node, "id"),
                textOrNull(node, "action"),
                node.get("payload"));
    }

    public ResultEnvelope decodeResult(String json) {
        JsonNode node = readObject(json);
        ErrorDetail error = null;
        JsonNode errorNode = node.get("error");
        if (errorNode != null && errorNode.isObject()) {
            error = new ErrorDetail(
                    textOrNull(errorNode, "message"),
                    textOrNull(errorNode, "stack"),
                    textOrNull(errorNode, "code"));
        }
        JsonNode result = node.get("result");
        return new ResultEnvelope(
                textOrNull(node, "id"),
                node.path("success").asBoolean(false),
                result == null || result.isMissingNode() ? null : result,
                error);
    }

    private JsonNode readObject(String json) {
        if (json == null) {
            throw new MalformedEnvelopeException("Envelope is null", null);
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new MalformedEnvelopeException("Envelope is not a JSON object", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize envelope", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
