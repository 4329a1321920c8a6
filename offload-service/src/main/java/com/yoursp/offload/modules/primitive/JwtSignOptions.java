package com.yoursp.offload.modules.primitive;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Options for {@code SIGN_JWT}. Every field is optional; unknown option
 * names are rejected when a worker decodes them.
 *
 * @param algorithm        HMAC algorithm, defaults to {@code HS256}
 * @param expiresInSeconds sets {@code exp} relative to {@code iat}; also read as {@code expiresIn}
 * @param issuer           {@code iss}
 * @param audience         {@code aud}
 * @param subject          {@code sub}
 * @param jwtId            {@code jti}
 * @param keyId            {@code kid} header, used to pick the key on verify; also read as {@code keyid}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JwtSignOptions(
        String algorithm,
        @JsonAlias("expiresIn") Long expiresInSeconds,
        String issuer,
        String audience,
        String subject,
        @JsonAlias("jwtid") String jwtId,
        @JsonAlias("keyid") String keyId) {

    public static JwtSignOptions defaults() {
        return new JwtSignOptions(null, null, null, null, null, null, null);
    }

    public static JwtSignOptions expiringIn(long seconds) {
        return new JwtSignOptions(null, seconds, null, null, null, null, null);
    }
}
