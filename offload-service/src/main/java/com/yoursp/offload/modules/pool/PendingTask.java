package com.yoursp.offload.modules.pool;

import com.fasterxml.jackson.databind.JsonNode;
import com.yoursp.offload.modules.protocol.WorkerAction;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A submitted task and the caller's future, from submission until it is
 * resolved, rejected or timed out.
 */
@Getter
class PendingTask {

    private final String id;
    private final WorkerAction action;
    /** Encoded task envelope, ready to post to a worker. */
    private final String message;
    private final Duration timeout;
    private final Instant deadline;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();

    private ScheduledFuture<?> timeoutHandle;

    PendingTask(String id, WorkerAction action, String message, Duration timeout, Instant submittedAt) {
        this.id = id;
        this.action = action;
        this.message = message;
        this.timeout = timeout;
        this.deadline = submittedAt.plus(timeout);
    }

    void armTimeout(ScheduledFuture<?> handle) {
        this.timeoutHandle = handle;
    }

    void resolve(JsonNode result) {
        cancelTimeout();
        future.complete(result);
    }

    void reject(Throwable error) {
        cancelTimeout();
        future.completeExceptionally(error);
    }

    private void cancelTimeout() {
        if (timeoutHandle != null) {
            timeoutHandle.cancel(false);
        }
    }
}
