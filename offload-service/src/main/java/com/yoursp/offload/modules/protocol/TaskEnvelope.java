package com.yoursp.offload.modules.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One unit of work sent to a worker.
 * <p>
 * {@code action} is kept as the raw wire string so that a worker can report
 * unknown or missing actions instead of failing to decode the envelope.
 * </p>
 *
 * @param id      correlation id, unique among outstanding tasks of one pool
 * @param action  action tag, see {@link WorkerAction}
 * @param payload action-specific arguments
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEnvelope(
        String id,
        String action,
        JsonNode payload) {

    public static TaskEnvelope of(String id, WorkerAction action, JsonNode payload) {
        return new TaskEnvelope(id, action.name(), payload);
    }
}
