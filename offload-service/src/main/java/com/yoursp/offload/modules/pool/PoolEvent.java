package com.yoursp.offload.modules.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Events consumed by the pool's dispatcher thread. Every change to pool
 * state is the result of handling exactly one of these.
 */
interface PoolEvent {

    /** Spawn the initial workers. */
    record Start() implements PoolEvent {
    }

    record Submit(PendingTask task) implements PoolEvent {
    }

    record WorkerMessage(int slot, int generation, String json) implements PoolEvent {
    }

    record WorkerExit(int slot, int generation, int exitCode) implements PoolEvent {
    }

    record Timeout(String taskId) implements PoolEvent {
    }

    record Shutdown(CompletableFuture<Void> done) implements PoolEvent {
    }
}
