package com.yoursp.offload.modules.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body of a failed {@link ResultEnvelope}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(
        String message,
        String stack,
        String code) {

    public static ErrorDetail of(ErrorCode code, String message) {
        return new ErrorDetail(message, null, code.name());
    }

    public ErrorCode errorCode() {
        return ErrorCode.fromWire(code);
    }
}
