package com.yoursp.offload.modules.worker;

/**
 * Lifecycle of a worker slot as seen by the pool.
 */
public enum WorkerStatus {
    /** Thread started, {@code init} envelope not received yet. */
    STARTING,
    IDLE,
    BUSY,
    /** Reported a fatal error; exit and respawn follow. */
    ERROR,
    TERMINATED
}
