package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

/**
 * Thrown for tasks still pending at shutdown and for every submission made after it began.
 */
public class PoolShuttingDownException extends OffloadException {

    public PoolShuttingDownException() {
        super(ErrorCode.POOL_SHUTTING_DOWN, "Worker pool is shutting down");
    }
}
