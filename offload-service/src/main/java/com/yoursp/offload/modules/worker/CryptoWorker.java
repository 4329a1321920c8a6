package com.yoursp.offload.modules.worker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yoursp.offload.modules.primitive.CryptoPrimitiveException;
import com.yoursp.offload.modules.primitive.CryptoPrimitives;
import com.yoursp.offload.modules.primitive.JwtSignOptions;
import com.yoursp.offload.modules.primitive.JwtVerifyOptions;
import com.yoursp.offload.modules.primitive.PasswordHashAlgorithm;
import com.yoursp.offload.modules.protocol.EnvelopeCodec;
import com.yoursp.offload.modules.protocol.ErrorCode;
import com.yoursp.offload.modules.protocol.ErrorDetail;
import com.yoursp.offload.modules.protocol.MalformedEnvelopeException;
import com.yoursp.offload.modules.protocol.ResultEnvelope;
import com.yoursp.offload.modules.protocol.TaskEnvelope;
import com.yoursp.offload.modules.protocol.WorkerAction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Long-lived worker executing one crypto primitive per task.
 * <p>
 * A worker reads task JSON from its {@link WorkerChannel}, runs the primitive
 * for the task's action and emits exactly one result envelope with the same
 * id. Every {@link Exception} thrown by a primitive becomes a failed result;
 * anything else escapes the loop and is reported by the thread's uncaught
 * exception handler as an {@code "error"} envelope followed by exit code 1.
 * </p>
 * <p>
 * The only per-worker state is {@code workerId}, which salts the
 * {@link PasswordHashAlgorithm#WORKER_SALT} password digest.
 * </p>
 */
@Slf4j
public class CryptoWorker implements Runnable {

    static final String SALT_PREFIX = "worker-salt-";
    static final String WORKER_SALT_MARKER = "ws$";

    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private final String workerId;
    private final WorkerChannel channel;
    private final EnvelopeCodec codec;
    private final ObjectMapper objectMapper;
    private final CryptoPrimitives primitives;
    private final PasswordHashAlgorithm passwordAlgorithm;
    private final int bcryptRounds;

    public CryptoWorker(String workerId, WorkerChannel channel, EnvelopeCodec codec,
            CryptoPrimitives primitives, PasswordHashAlgorithm passwordAlgorithm, int bcryptRounds) {
        this.workerId = workerId;
        this.channel = channel;
        this.codec = codec;
        this.objectMapper = codec.objectMapper();
        this.primitives = primitives;
        this.passwordAlgorithm = passwordAlgorithm;
        this.bcryptRounds = bcryptRounds;
    }

    /**
     * Start this worker on its own daemon thread with the fatal-error handler installed.
     */
    public Thread start(String threadName) {
        Thread thread = new Thread(this, threadName);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> onFatal(e));
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        log.debug("[Worker {}] Starting...", workerId);
        channel.emit(codec.encodeResult(
                ResultEnvelope.ok(ResultEnvelope.INIT_ID, TextNode.valueOf("Worker " + workerId + " initialized"))));

        try {
            String message;
            while ((message = channel.receive()) != null) {
                channel.emit(codec.encodeResult(handle(message)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        log.debug("[Worker {}] Stopped", workerId);
        channel.exit(0);
    }

    /**
     * Process one inbound message and build its reply. Never throws for bad
     * input or primitive failures.
     */
    public ResultEnvelope handle(String message) {
        TaskEnvelope task;
        try {
            task = codec.decodeTask(message);
        } catch (MalformedEnvelopeException e) {
            return ResultEnvelope.failed(ResultEnvelope.ERROR_ID,
                    ErrorDetail.of(ErrorCode.MALFORMED_TASK, "Malformed task: " + e.getMessage()));
        }

        if (task.id() == null || task.action() == null) {
            String id = task.id() != null ? task.id() : ResultEnvelope.ERROR_ID;
            String missing = task.id() == null ? "id" : "action";
            return ResultEnvelope.failed(id,
                    ErrorDetail.of(ErrorCode.MALFORMED_TASK, "Malformed task: missing " + missing));
        }

        WorkerAction action = WorkerAction.fromWire(task.action()).orElse(null);
        if (action == null) {
            return ResultEnvelope.failed(task.id(),
                    ErrorDetail.of(ErrorCode.UNKNOWN_ACTION, "Unknown action: " + task.action()));
        }

        JsonNode payload = task.payload() != null ? task.payload() : MissingNode.getInstance();
        try {
            return ResultEnvelope.ok(task.id(), execute(action, payload));
        } catch (Exception e) {
            log.warn("[Worker {}] Task {} ({}) failed: {}", workerId, task.id(), action, messageOf(e));
            return ResultEnvelope.failed(task.id(),
                    new ErrorDetail(messageOf(e), stackTraceOf(e), ErrorCode.PRIMITIVE_FAILURE.name()));
        }
    }

    private JsonNode execute(WorkerAction action, JsonNode payload) throws IOException {
        return switch (action) {
            case VERIFY_JWT -> {
                JwtVerifyOptions options = optional(payload, "options", JwtVerifyOptions.class);
                Map<String, Object> claims = primitives.verifyJwt(
                        requireText(payload, "token"), requireText(payload, "secret"), options);
                yield objectMapper.valueToTree(claims);
            }
            case SIGN_JWT -> {
                JsonNode claimsNode = payload.has("payload") ? payload.get("payload") : payload.get("claims");
                if (claimsNode == null || !claimsNode.isObject()) {
                    throw new CryptoPrimitiveException("invalid claims: expected a JSON object");
                }
                Map<String, Object> claims = objectMapper.convertValue(claimsNode, CLAIMS_TYPE);
                JwtSignOptions options = optional(payload, "options", JwtSignOptions.class);
                yield TextNode.valueOf(primitives.signJwt(claims, requireText(payload, "secret"), options));
            }
            case GENERATE_HASH -> {
                byte[] digest = primitives.digest(
                        payload.path("algorithm").asText("sha256"),
                        requireText(payload, "data").getBytes(StandardCharsets.UTF_8));
                yield TextNode.valueOf(encode(digest, payload.path("encoding").asText("hex")));
            }
            case HASH_PASSWORD -> TextNode.valueOf(hashPassword(
                    requireText(payload, "password"), payload.path("saltRounds").asInt(bcryptRounds)));
            case COMPARE_PASSWORD -> BooleanNode.valueOf(comparePassword(
                    requireText(payload, "password"), requireText(payload, "hash")));
        };
    }

    String hashPassword(String password, int rounds) {
        if (passwordAlgorithm == PasswordHashAlgorithm.BCRYPT) {
            return primitives.bcryptHash(password, rounds);
        }
        return WORKER_SALT_MARKER + workerId + "$" + saltedDigestHex(password, workerId);
    }

    /**
     * Accepts bcrypt hashes, {@code ws$<workerId>$<hex>} worker-salt hashes and
     * bare hex digests salted with this worker's id.
     */
    boolean comparePassword(String password, String hash) {
        if (hash.startsWith("$2")) {
            return primitives.bcryptMatches(password, hash);
        }

        String saltId = workerId;
        String expectedHex = hash;
        if (hash.startsWith(WORKER_SALT_MARKER)) {
            String[] parts = hash.split("\\$", 3);
            if (parts.length != 3) {
                return false;
            }
            saltId = parts[1];
            expectedHex = parts[2];
        }

        String actualHex = saltedDigestHex(password, saltId);
        return MessageDigest.isEqual(
                actualHex.getBytes(StandardCharsets.UTF_8),
                expectedHex.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    private String saltedDigestHex(String password, String saltId) {
        byte[] digest = primitives.digest("sha256",
                (password + SALT_PREFIX + saltId).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    private void onFatal(Throwable error) {
        log.error("[Worker {}] Uncaught error, worker is no longer usable: {}", workerId, error.toString(), error);
        try {
            channel.emit(codec.encodeResult(ResultEnvelope.failed(ResultEnvelope.ERROR_ID,
                    new ErrorDetail(messageOf(error), stackTraceOf(error),
                            ErrorCode.WORKER_FATAL.name()))));
        } finally {
            channel.exit(1);
        }
    }

    // unknown option names fail the task instead of being dropped
    private <T> T optional(JsonNode payload, String field, Class<T> type) throws IOException {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.readerFor(type)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(node);
    }

    private static String requireText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw new CryptoPrimitiveException("Missing payload field: " + field);
        }
        return node.asText();
    }

    private static String encode(byte[] digest, String encoding) {
        return switch (encoding.toLowerCase(Locale.ROOT)) {
            case "hex" -> HexFormat.of().formatHex(digest);
            case "base64" -> Base64.getEncoder().encodeToString(digest);
            case "base64url" -> Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
            default -> throw new CryptoPrimitiveException("Unsupported digest encoding: " + encoding);
        };
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
