package com.yoursp.offload.modules.protocol;

/**
 * Failure kinds surfaced by the offload subsystem.
 * <ul>
 * <li>Worker-local: {@link #MALFORMED_TASK}, {@link #UNKNOWN_ACTION},
 * {@link #PRIMITIVE_FAILURE}, {@link #WORKER_FATAL} travel inside a result
 * envelope.</li>
 * <li>Pool-local: {@link #TASK_TIMEOUT}, {@link #WORKER_CRASHED},
 * {@link #POOL_SHUTTING_DOWN}, {@link #POOL_OVERLOADED} never reach a
 * worker.</li>
 * </ul>
 */
public enum ErrorCode {
    MALFORMED_TASK,
    UNKNOWN_ACTION,
    PRIMITIVE_FAILURE,
    WORKER_FATAL,
    TASK_TIMEOUT,
    WORKER_CRASHED,
    POOL_SHUTTING_DOWN,
    POOL_OVERLOADED;

    /** Lenient parse for codes read off the wire; unknown values map to PRIMITIVE_FAILURE. */
    public static ErrorCode fromWire(String value) {
        if (value == null) {
            return PRIMITIVE_FAILURE;
        }
        try {
            return valueOf(value);
        } catch (IllegalArgumentException e) {
            return PRIMITIVE_FAILURE;
        }
    }
}
