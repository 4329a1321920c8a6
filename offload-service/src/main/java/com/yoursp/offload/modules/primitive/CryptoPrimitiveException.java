package com.yoursp.offload.modules.primitive;

/**
 * Failure raised by a crypto primitive (bad signature, expired token,
 * unsupported algorithm, invalid key...).
 */
public class CryptoPrimitiveException extends RuntimeException {

    public CryptoPrimitiveException(String message) {
        super(message);
    }

    public CryptoPrimitiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
