package com.yoursp.offload.modules.primitive;

/**
 * Algorithm used by workers for {@code HASH_PASSWORD}.
 */
public enum PasswordHashAlgorithm {
    /** SHA-256 over password + "worker-salt-" + workerId. */
    WORKER_SALT,
    /** Adaptive bcrypt hash with a random salt. */
    BCRYPT
}
