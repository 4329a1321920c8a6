package com.yoursp.offload.modules.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yoursp.offload.modules.pool.PoolStats;
import com.yoursp.offload.modules.pool.WorkerPoolManager;
import com.yoursp.offload.modules.primitive.JwtSignOptions;
import com.yoursp.offload.modules.primitive.JwtVerifyOptions;
import com.yoursp.offload.modules.protocol.WorkerAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for offloading JWT, hashing and password work to the worker pool.
 * <p>
 * Every method returns immediately; the future completes when a worker
 * answers, the task times out, or the pool rejects it. Any exceptional
 * completion means "operation failed": callers authenticating a subject
 * must fail closed, see {@link #tryVerifyJwt} and {@link #passwordMatches}.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CryptoOffloadService {

    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };

    private final WorkerPoolManager pool;
    private final ObjectMapper objectMapper;

    /**
     * Submit a raw task.
     *
     * @param timeout null for the pool default
     */
    public CompletableFuture<JsonNode> submit(WorkerAction action, JsonNode payload, Duration timeout) {
        return pool.submit(action, payload, timeout);
    }

    /**
     * Submit a raw task by wire action name. Unknown names are rejected
     * without contacting the pool.
     */
    public CompletableFuture<JsonNode> submit(String action, JsonNode payload, Duration timeout) {
        return WorkerAction.fromWire(action)
                .map(a -> pool.submit(a, payload, timeout))
                .orElseGet(() -> CompletableFuture.failedFuture(
                        new IllegalArgumentException("Unknown action: " + action)));
    }

    /**
     * Verify a JWT and return its claims.
     */
    public CompletableFuture<Map<String, Object>> verifyJwt(String token, String secret, JwtVerifyOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("token", token);
        payload.put("secret", secret);
        if (options != null) {
            payload.set("options", objectMapper.valueToTree(options));
        }
        return pool.submit(WorkerAction.VERIFY_JWT, payload, null)
                .thenApply(claims -> objectMapper.convertValue(claims, CLAIMS_TYPE));
    }

    /**
     * Fail-closed variant of {@link #verifyJwt}: any failure, including a
     * timeout or pool rejection, yields an empty result.
     */
    public CompletableFuture<Optional<Map<String, Object>>> tryVerifyJwt(String token, String secret,
            JwtVerifyOptions options) {
        return verifyJwt(token, secret, options).handle((claims, error) -> {
            if (error != null) {
                log.debug("JWT rejected: {}", unwrap(error).getMessage());
                return Optional.empty();
            }
            return Optional.of(claims);
        });
    }

    public CompletableFuture<String> signJwt(Map<String, Object> claims, String secret, JwtSignOptions options) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("payload", objectMapper.valueToTree(claims));
        payload.put("secret", secret);
        if (options != null) {
            payload.set("options", objectMapper.valueToTree(options));
        }
        return pool.submit(WorkerAction.SIGN_JWT, payload, null).thenApply(JsonNode::asText);
    }

    public CompletableFuture<String> generateHash(String data) {
        return generateHash(data, "sha256");
    }

    /**
     * Hex digest of {@code data}.
     *
     * @param algorithm lowercase digest name, e.g. {@code sha256}, {@code sha512}
     */
    public CompletableFuture<String> generateHash(String data, String algorithm) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("data", data);
        payload.put("algorithm", algorithm);
        return pool.submit(WorkerAction.GENERATE_HASH, payload, null).thenApply(JsonNode::asText);
    }

    public CompletableFuture<String> hashPassword(String password) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("password", password);
        return pool.submit(WorkerAction.HASH_PASSWORD, payload, null).thenApply(JsonNode::asText);
    }

    public CompletableFuture<Boolean> comparePassword(String password, String hash) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("password", password);
        payload.put("hash", hash);
        return pool.submit(WorkerAction.COMPARE_PASSWORD, payload, null).thenApply(JsonNode::asBoolean);
    }

    /**
     * Fail-closed variant of {@link #comparePassword}: any failure yields {@code false}.
     */
    public CompletableFuture<Boolean> passwordMatches(String password, String hash) {
        return comparePassword(password, hash).handle((matches, error) -> {
            if (error != null) {
                log.debug("Password comparison failed, treating as mismatch: {}", unwrap(error).getMessage());
                return false;
            }
            return Boolean.TRUE.equals(matches);
        });
    }

    public PoolStats stats() {
        return pool.stats();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
