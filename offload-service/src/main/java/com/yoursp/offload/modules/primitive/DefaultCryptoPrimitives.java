package com.yoursp.offload.modules.primitive;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Nimbus JOSE+JWT for HMAC JWTs, JCA {@link MessageDigest} for hashes and
 * Spring Security {@link BCryptPasswordEncoder} for bcrypt.
 */
@Component
public class DefaultCryptoPrimitives implements CryptoPrimitives {

    private static final Set<String> DATE_CLAIMS = Set.of("exp", "nbf", "iat");

    private final Clock clock;

    public DefaultCryptoPrimitives() {
        this(Clock.systemUTC());
    }

    public DefaultCryptoPrimitives(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<String, Object> verifyJwt(String token, String secret, JwtVerifyOptions options) {
        JwtVerifyOptions opts = options != null ? options : JwtVerifyOptions.defaults();
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new CryptoPrimitiveException("jwt malformed", e);
        }

        JWSAlgorithm alg = jwt.getHeader().getAlgorithm();
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(alg)
                || (opts.algorithms() != null && !opts.algorithms().contains(alg.getName()))) {
            throw new CryptoPrimitiveException("invalid algorithm: " + alg.getName());
        }

        try {
            if (!jwt.verify(new MACVerifier(secret.getBytes(StandardCharsets.UTF_8)))) {
                throw new CryptoPrimitiveException("invalid signature");
            }
        } catch (JOSEException e) {
            throw new CryptoPrimitiveException("jwt verification failed: " + e.getMessage(), e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new CryptoPrimitiveException("jwt payload malformed", e);
        }

        checkClaims(claims, opts);
        return claims.toJSONObject();
    }

    @Override
    public String signJwt(Map<String, Object> claims, String secret, JwtSignOptions options) {
        JwtSignOptions opts = options != null ? options : JwtSignOptions.defaults();
        JWSAlgorithm alg = JWSAlgorithm.parse(opts.algorithm() != null ? opts.algorithm() : "HS256");
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(alg)) {
            throw new CryptoPrimitiveException("unsupported signing algorithm: " + alg.getName());
        }

        Instant now = clock.instant();
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder();
        if (claims != null) {
            claims.forEach((name, value) -> builder.claim(name, toClaimValue(name, value)));
        }
        if (claims == null || !claims.containsKey("iat")) {
            builder.issueTime(Date.from(now));
        }
        if (opts.expiresInSeconds() != null) {
            builder.expirationTime(Date.from(now.plusSeconds(opts.expiresInSeconds())));
        }
        if (opts.issuer() != null) {
            builder.issuer(opts.issuer());
        }
        if (opts.audience() != null) {
            builder.audience(opts.audience());
        }
        if (opts.subject() != null) {
            builder.subject(opts.subject());
        }
        if (opts.jwtId() != null) {
            builder.jwtID(opts.jwtId());
        }

        JWSHeader.Builder header = new JWSHeader.Builder(alg).type(JOSEObjectType.JWT);
        if (opts.keyId() != null) {
            header.keyID(opts.keyId());
        }
        SignedJWT jwt = new SignedJWT(header.build(), builder.build());
        try {
            jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (JOSEException e) {
            throw new CryptoPrimitiveException("jwt signing failed: " + e.getMessage(), e);
        }
        return jwt.serialize();
    }

    @Override
    public byte[] digest(String algorithm, byte[] data) {
        String jcaName = jcaDigestName(algorithm != null ? algorithm : "sha256");
        try {
            return MessageDigest.getInstance(jcaName).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoPrimitiveException("Digest method not supported: " + algorithm, e);
        }
    }

    @Override
    public String bcryptHash(String password, int rounds) {
        try {
            return new BCryptPasswordEncoder(rounds).encode(password);
        } catch (IllegalArgumentException e) {
            throw new CryptoPrimitiveException("bcrypt hashing failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean bcryptMatches(String password, String hash) {
        return new BCryptPasswordEncoder().matches(password, hash);
    }

    /**
     * Map lowercase digest names ({@code sha256}, {@code sha3-512}) to JCA
     * names; anything else is passed through unchanged.
     */
    static String jcaDigestName(String algorithm) {
        String name = algorithm.toLowerCase(Locale.ROOT);
        return switch (name) {
            case "md5" -> "MD5";
            case "sha1" -> "SHA-1";
            case "sha224" -> "SHA-224";
            case "sha256" -> "SHA-256";
            case "sha384" -> "SHA-384";
            case "sha512" -> "SHA-512";
            case "sha512-256" -> "SHA-512/256";
            case "sha3-224", "sha3-256", "sha3-384", "sha3-512" -> name.toUpperCase(Locale.ROOT);
            default -> algorithm;
        };
    }

    private void checkClaims(JWTClaimsSet claims, JwtVerifyOptions opts) {
        long tolerance = opts.clockToleranceSeconds() != null ? opts.clockToleranceSeconds() : 0L;
        Instant now = clock.instant();

        Date exp = claims.getExpirationTime();
        if (!Boolean.TRUE.equals(opts.ignoreExpiration()) && exp != null
                && !now.isBefore(exp.toInstant().plusSeconds(tolerance))) {
            throw new CryptoPrimitiveException("jwt expired");
        }
        Date nbf = claims.getNotBeforeTime();
        if (nbf != null && now.plusSeconds(tolerance).isBefore(nbf.toInstant())) {
            throw new CryptoPrimitiveException("jwt not active");
        }
        if (opts.issuer() != null && !opts.issuer().equals(claims.getIssuer())) {
            throw new CryptoPrimitiveException("jwt issuer invalid. expected: " + opts.issuer());
        }
        if (opts.audience() != null) {
            List<String> audience = claims.getAudience();
            if (audience == null || !audience.contains(opts.audience())) {
                throw new CryptoPrimitiveException("jwt audience invalid. expected: " + opts.audience());
            }
        }
        if (opts.subject() != null && !opts.subject().equals(claims.getSubject())) {
            throw new CryptoPrimitiveException("jwt subject invalid. expected: " + opts.subject());
        }
    }

    private static Object toClaimValue(String name, Object value) {
        if (DATE_CLAIMS.contains(name) && value instanceof Number seconds) {
            return new Date(seconds.longValue() * 1000L);
        }
        return value;
    }
}
