package com.yoursp.offload.modules.primitive;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Options for {@code VERIFY_JWT}. Every field is optional; unknown option
 * names are rejected when a worker decodes them.
 *
 * @param algorithms            accepted JWS algorithms, e.g. {@code ["HS256"]}
 * @param issuer                required {@code iss}
 * @param audience              required member of {@code aud}
 * @param subject               required {@code sub}
 * @param clockToleranceSeconds leeway applied to {@code exp} and {@code nbf}; also read as {@code clockTolerance}
 * @param ignoreExpiration      skip the {@code exp} check
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JwtVerifyOptions(
        List<String> algorithms,
        String issuer,
        String audience,
        String subject,
        @JsonAlias("clockTolerance") Long clockToleranceSeconds,
        Boolean ignoreExpiration) {

    public static JwtVerifyOptions defaults() {
        return new JwtVerifyOptions(null, null, null, null, null, null);
    }
}
