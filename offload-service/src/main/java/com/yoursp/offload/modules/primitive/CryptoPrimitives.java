package com.yoursp.offload.modules.primitive;

import java.util.Map;

/**
 * The cryptographic building blocks executed by workers.
 * <p>
 * Implementations must be thread-safe: one instance is shared by every
 * worker of a pool. Failures are reported as
 * {@link CryptoPrimitiveException}.
 * </p>
 */
public interface CryptoPrimitives {

    /**
     * Verify an HMAC-signed JWT and return its claims (dates as epoch seconds).
     */
    Map<String, Object> verifyJwt(String token, String secret, JwtVerifyOptions options);

    /**
     * Sign the given claims into a compact JWT.
     */
    String signJwt(Map<String, Object> claims, String secret, JwtSignOptions options);

    /**
     * Digest {@code data} with the named algorithm ({@code sha256}, {@code sha512}, ...).
     */
    byte[] digest(String algorithm, byte[] data);

    String bcryptHash(String password, int rounds);

    boolean bcryptMatches(String password, String hash);
}
