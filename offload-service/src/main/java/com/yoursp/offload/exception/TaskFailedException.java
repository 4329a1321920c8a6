package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

/**
 * A failure reported by a worker in its result envelope: malformed task,
 * unknown action or primitive failure.
 */
public class TaskFailedException extends OffloadException {

    private final String taskId;
    private final String remoteStack;

    public TaskFailedException(String taskId, ErrorCode errorCode, String message, String remoteStack) {
        super(errorCode, message != null ? message : "Unknown error");
        this.taskId = taskId;
        this.remoteStack = remoteStack;
    }

    public String getTaskId() {
        return taskId;
    }

    /** Stack trace text captured inside the worker, may be null. */
    public String getRemoteStack() {
        return remoteStack;
    }
}
