package com.yoursp.offload.modules.pool;

import com.yoursp.offload.modules.worker.WorkerChannel;
import com.yoursp.offload.modules.worker.WorkerStatus;
import lombok.Getter;

import java.time.Instant;

/**
 * Fixed position in the pool holding the current worker incarnation.
 * Mutated only by the dispatcher thread; fields are volatile so that
 * {@link WorkerPoolManager#stats()} can read them from any thread.
 */
@Getter
class WorkerSlot {

    private final int index;

    private volatile int generation;
    private volatile WorkerChannel channel;
    private volatile Thread thread;
    private volatile WorkerStatus status = WorkerStatus.STARTING;
    private volatile String currentTaskId;
    private volatile boolean initialized;
    private volatile long taskCount;
    private volatile long errors;
    private volatile Instant lastTaskAt;

    WorkerSlot(int index) {
        this.index = index;
    }

    int nextGeneration() {
        return generation + 1;
    }

    void attach(int generation, WorkerChannel channel) {
        this.generation = generation;
        this.channel = channel;
        this.thread = null;
        this.currentTaskId = null;
        this.status = WorkerStatus.STARTING;
    }

    void started(Thread thread) {
        this.thread = thread;
    }

    /**
     * @return true the first time this slot ever became ready
     */
    boolean markReady() {
        status = WorkerStatus.IDLE;
        if (!initialized) {
            initialized = true;
            return true;
        }
        return false;
    }

    void markBusy(String taskId) {
        currentTaskId = taskId;
        status = WorkerStatus.BUSY;
    }

    void completeTask() {
        currentTaskId = null;
        taskCount++;
        lastTaskAt = Instant.now();
        status = WorkerStatus.IDLE;
    }

    void markError() {
        errors++;
        status = WorkerStatus.ERROR;
    }

    void markTerminated() {
        status = WorkerStatus.TERMINATED;
    }

    boolean isIdle() {
        return status == WorkerStatus.IDLE;
    }

    PoolStats.WorkerInfo snapshot() {
        return new PoolStats.WorkerInfo(index, status, taskCount, errors, lastTaskAt);
    }
}
