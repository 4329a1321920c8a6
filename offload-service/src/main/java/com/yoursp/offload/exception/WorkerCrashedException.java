package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

/**
 * Thrown for a task whose worker died while executing it.
 */
public class WorkerCrashedException extends OffloadException {

    public WorkerCrashedException(String taskId, int workerIndex, int exitCode) {
        super(ErrorCode.WORKER_CRASHED,
                "Worker " + workerIndex + " exited with code " + exitCode + " while running task " + taskId);
    }
}
