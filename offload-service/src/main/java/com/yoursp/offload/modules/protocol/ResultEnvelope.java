package com.yoursp.offload.modules.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reply from a worker. {@code id} always echoes the originating task id,
 * except for the reserved {@link #INIT_ID} and {@link #ERROR_ID}.
 * <p>
 * {@code result} is present iff {@code success}; {@code error} iff not.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultEnvelope(
        String id,
        boolean success,
        JsonNode result,
        ErrorDetail error) {

    /** Worker to pool readiness signal. */
    public static final String INIT_ID = "init";

    /** Fatal error signal when no task id is known. */
    public static final String ERROR_ID = "error";

    public static ResultEnvelope ok(String id, JsonNode result) {
        return new ResultEnvelope(id, true, result, null);
    }

    public static ResultEnvelope failed(String id, ErrorDetail error) {
        return new ResultEnvelope(id, false, null, error);
    }

    @JsonIgnore
    public boolean isInit() {
        return INIT_ID.equals(id);
    }

    @JsonIgnore
    public boolean isFatal() {
        return ERROR_ID.equals(id);
    }
}
