package com.yoursp.offload.modules.pool;

import com.yoursp.offload.modules.worker.WorkerStatus;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the pool. Counters are read without locking and
 * may be slightly stale.
 */
public record PoolStats(
        int workers,
        int maxWorkers,
        int starting,
        int idle,
        int busy,
        int error,
        long completedTasks,
        int pendingTasks,
        int queuedTasks,
        long respawns,
        List<WorkerInfo> workerDetails) {

    public record WorkerInfo(
            int index,
            WorkerStatus status,
            long taskCount,
            long errors,
            Instant lastTaskAt) {
    }
}
