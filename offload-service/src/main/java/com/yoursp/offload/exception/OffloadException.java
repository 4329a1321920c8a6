package com.yoursp.offload.exception;

import com.yoursp.offload.modules.protocol.ErrorCode;

/**
 * Base class of every failure a caller of the offload pool can observe.
 * Callers must treat any instance as "operation failed" and fail closed.
 */
public class OffloadException extends RuntimeException {

    private final ErrorCode errorCode;

    public OffloadException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OffloadException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
