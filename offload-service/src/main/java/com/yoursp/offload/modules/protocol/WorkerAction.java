package com.yoursp.offload.modules.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Actions a crypto worker knows how to execute.
 * The enum name is the wire value of {@code TaskEnvelope.action}.
 */
public enum WorkerAction {
    VERIFY_JWT,
    SIGN_JWT,
    GENERATE_HASH,
    HASH_PASSWORD,
    COMPARE_PASSWORD;

    /**
     * Resolve a wire value to an action.
     *
     * @param value the raw action string, may be null
     * @return the matching action, or empty for unknown values
     */
    public static Optional<WorkerAction> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.name().equals(value))
                .findFirst();
    }
}
