package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

import java.time.Duration;

/**
 * Thrown when no result arrived for a task within its timeout.
 * The worker is left running; a late result is dropped.
 */
public class TaskTimeoutException extends OffloadException {

    private final String taskId;

    public TaskTimeoutException(String taskId, String action, Duration timeout) {
        super(ErrorCode.TASK_TIMEOUT,
                "Task " + taskId + " (" + action + ") timed out after " + timeout.toMillis() + "ms");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
