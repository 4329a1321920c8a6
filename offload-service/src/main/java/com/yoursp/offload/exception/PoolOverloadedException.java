package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

/**
 * Thrown when every worker is busy and the wait queue is at capacity.
 */
public class PoolOverloadedException extends OffloadException {

    public PoolOverloadedException(int maxQueueLength) {
        super(ErrorCode.POOL_OVERLOADED,
                "Worker pool overloaded: " + maxQueueLength + " tasks already queued");
    }
}
