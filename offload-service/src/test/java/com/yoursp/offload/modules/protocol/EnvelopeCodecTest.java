package com.yoursp.offload.modules.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(objectMapper);

    @Test
    @DisplayName("Task encodes to {id, action, payload} with the enum name as action")
    void encodeTask() throws Exception {
        String json = codec.encodeTask(TaskEnvelope.of("t-1", WorkerAction.GENERATE_HASH,
                objectMapper.createObjectNode().put("data", "x")));

        JsonNode node = objectMapper.readTree(json);
        assertEquals("t-1", node.get("id").asText());
        assertEquals("GENERATE_HASH", node.get("action").asText());
        assertEquals("x", node.get("payload").get("data").asText());
    }

    @Test
    @DisplayName("Missing id/action decode as null instead of failing")
    void decodeTaskWithMissingFields() {
        TaskEnvelope task = codec.decodeTask("{\"payload\":{\"a\":1},\"extra\":true}");

        assertNull(task.id());
        assertNull(task.action());
        assertEquals(1, task.payload().get("a").asInt());
    }

    @Test
    @DisplayName("Unknown action strings are kept verbatim")
    void decodeTaskKeepsRawAction() {
        assertEquals("sign_jwt", codec.decodeTask("{\"id\":\"1\",\"action\":\"sign_jwt\"}").action());
        assertTrue(WorkerAction.fromWire("sign_jwt").isEmpty());
        assertEquals(WorkerAction.SIGN_JWT, WorkerAction.fromWire("SIGN_JWT").orElseThrow());
    }

    @Test
    @DisplayName("Invalid JSON, non-objects and null → MalformedEnvelopeException")
    void decodeRejectsNonObjects() {
        assertThrows(MalformedEnvelopeException.class, () -> codec.decodeTask("{not json"));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decodeTask("[1,2,3]"));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decodeTask("\"text\""));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decodeResult(null));
    }

    @Test
    @DisplayName("Successful result omits the error field")
    void encodeSuccessOmitsError() throws Exception {
        String json = codec.encodeResult(ResultEnvelope.ok("t-1", TextNode.valueOf("abc")));

        JsonNode node = objectMapper.readTree(json);
        assertTrue(node.get("success").asBoolean());
        assertEquals("abc", node.get("result").asText());
        assertFalse(node.has("error"));
        assertFalse(node.has("init"));
        assertFalse(node.has("fatal"));
    }

    @Test
    @DisplayName("Failed result carries message, stack and code")
    void failedResultRoundTrip() {
        String json = codec.encodeResult(ResultEnvelope.failed("t-2",
                new ErrorDetail("boom", "at x", ErrorCode.PRIMITIVE_FAILURE.name())));

        ResultEnvelope decoded = codec.decodeResult(json);
        assertEquals("t-2", decoded.id());
        assertFalse(decoded.success());
        assertNull(decoded.result());
        assertEquals("boom", decoded.error().message());
        assertEquals("at x", decoded.error().stack());
        assertEquals(ErrorCode.PRIMITIVE_FAILURE, decoded.error().errorCode());
    }

    @Test
    @DisplayName("Reserved ids are recognised")
    void reservedIds() {
        assertTrue(codec.decodeResult("{\"id\":\"init\",\"success\":true,\"result\":\"ready\"}").isInit());
        assertTrue(codec.decodeResult("{\"id\":\"error\",\"success\":false}").isFatal());
    }

    @Test
    @DisplayName("Unknown or missing error code falls back to PRIMITIVE_FAILURE")
    void lenientErrorCode() {
        ResultEnvelope decoded = codec.decodeResult(
                "{\"id\":\"1\",\"success\":false,\"error\":{\"message\":\"m\",\"code\":\"SOMETHING_NEW\"}}");

        assertEquals(ErrorCode.PRIMITIVE_FAILURE, decoded.error().errorCode());
        assertEquals(ErrorCode.PRIMITIVE_FAILURE, ErrorDetail.of(ErrorCode.PRIMITIVE_FAILURE, "m").errorCode());
        assertEquals(ErrorCode.PRIMITIVE_FAILURE, new ErrorDetail("m", null, null).errorCode());
    }
}
