package com.yoursp.offload.modules.protocol;

/**
 * Thrown when a message on the worker channel is not valid envelope JSON.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
