package com.yoursp.offload.modules.primitive;

import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCryptoPrimitivesTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final String LONG_SECRET = SECRET + SECRET;
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final DefaultCryptoPrimitives atT0 = at(T0);

    // ================================================================
    // JWT
    // ================================================================

    @Test
    @DisplayName("sign → verify roundtrip returns the claims with iat and exp")
    void signVerifyRoundTrip() {
        String token = atT0.signJwt(Map.of("sub", "user-1", "scope", "read"), SECRET, JwtSignOptions.expiringIn(60));

        Map<String, Object> claims = atT0.verifyJwt(token, SECRET, null);

        assertEquals("user-1", claims.get("sub"));
        assertEquals("read", claims.get("scope"));
        assertEquals(T0.getEpochSecond(), ((Number) claims.get("iat")).longValue());
        assertEquals(T0.getEpochSecond() + 60, ((Number) claims.get("exp")).longValue());
    }

    @Test
    @DisplayName("numeric iat in the claims is kept instead of the current time")
    void explicitIssuedAt() {
        long iat = T0.getEpochSecond() - 10;
        String token = atT0.signJwt(Map.of("iat", iat), SECRET, null);

        assertEquals(iat, ((Number) atT0.verifyJwt(token, SECRET, null).get("iat")).longValue());
    }

    @Test
    @DisplayName("expired token → \"jwt expired\" unless tolerated or ignored")
    void expiredToken() {
        String token = atT0.signJwt(Map.of("sub", "u"), SECRET, JwtSignOptions.expiringIn(60));
        DefaultCryptoPrimitives later = at(T0.plusSeconds(120));

        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> later.verifyJwt(token, SECRET, null));
        assertEquals("jwt expired", ex.getMessage());

        assertNotNull(later.verifyJwt(token, SECRET, new JwtVerifyOptions(null, null, null, null, 120L, null)));
        assertNotNull(later.verifyJwt(token, SECRET, new JwtVerifyOptions(null, null, null, null, null, true)));
    }

    @Test
    @DisplayName("exp equal to now is already expired")
    void expiresAtBoundary() {
        String token = atT0.signJwt(Map.of("sub", "u"), SECRET, JwtSignOptions.expiringIn(60));

        assertThrows(CryptoPrimitiveException.class, () -> at(T0.plusSeconds(60)).verifyJwt(token, SECRET, null));
    }

    @Test
    @DisplayName("nbf in the future → \"jwt not active\"")
    void notYetActive() {
        String token = atT0.signJwt(Map.of("nbf", T0.getEpochSecond() + 100), SECRET, null);

        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.verifyJwt(token, SECRET, null));
        assertEquals("jwt not active", ex.getMessage());
    }

    @Test
    @DisplayName("wrong secret → \"invalid signature\"")
    void wrongSecret() {
        String token = atT0.signJwt(Map.of("sub", "u"), SECRET, null);

        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.verifyJwt(token, "ffffffffffffffffffffffffffffffff", null));
        assertEquals("invalid signature", ex.getMessage());
    }

    @Test
    @DisplayName("garbage token → \"jwt malformed\"")
    void malformedToken() {
        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.verifyJwt("not-a-token", SECRET, null));
        assertEquals("jwt malformed", ex.getMessage());
    }

    @Test
    @DisplayName("algorithm outside the allowed list → \"invalid algorithm\"")
    void algorithmAllowList() {
        String token = atT0.signJwt(Map.of("sub", "u"), LONG_SECRET,
                new JwtSignOptions("HS384", null, null, null, null, null, null));

        assertNotNull(atT0.verifyJwt(token, LONG_SECRET, null));
        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.verifyJwt(token, LONG_SECRET,
                        new JwtVerifyOptions(List.of("HS256"), null, null, null, null, null)));
        assertEquals("invalid algorithm: HS384", ex.getMessage());
    }

    @Test
    @DisplayName("issuer, audience and subject options are enforced")
    void registeredClaimChecks() {
        String token = atT0.signJwt(Map.of(), SECRET,
                new JwtSignOptions(null, 300L, "issuer-a", "svc", "user-1", "jti-1", null));

        Map<String, Object> claims = atT0.verifyJwt(token, SECRET,
                new JwtVerifyOptions(null, "issuer-a", "svc", "user-1", null, null));
        assertEquals("jti-1", claims.get("jti"));

        assertThrows(CryptoPrimitiveException.class, () -> atT0.verifyJwt(token, SECRET,
                new JwtVerifyOptions(null, "issuer-b", null, null, null, null)));
        assertThrows(CryptoPrimitiveException.class, () -> atT0.verifyJwt(token, SECRET,
                new JwtVerifyOptions(null, null, "other", null, null, null)));
        assertThrows(CryptoPrimitiveException.class, () -> atT0.verifyJwt(token, SECRET,
                new JwtVerifyOptions(null, null, null, "user-2", null, null)));
    }

    @Test
    @DisplayName("keyId option → kid header; absent keyId → no kid")
    void keyIdHeader() throws Exception {
        String withKid = atT0.signJwt(Map.of("sub", "u"), SECRET,
                new JwtSignOptions(null, null, null, null, null, null, "key-2026-01"));
        String withoutKid = atT0.signJwt(Map.of("sub", "u"), SECRET, null);

        assertEquals("key-2026-01", SignedJWT.parse(withKid).getHeader().getKeyID());
        assertNull(SignedJWT.parse(withoutKid).getHeader().getKeyID());
        assertEquals("u", atT0.verifyJwt(withKid, SECRET, null).get("sub"));
    }

    @Test
    @DisplayName("HMAC secret shorter than the algorithm's key size → signing fails")
    void shortSecretRejected() {
        assertThrows(CryptoPrimitiveException.class, () -> atT0.signJwt(Map.of("sub", "u"), "short", null));
        assertThrows(CryptoPrimitiveException.class, () -> atT0.signJwt(Map.of("sub", "u"), SECRET,
                new JwtSignOptions("HS512", null, null, null, null, null, null)));
    }

    @Test
    @DisplayName("non-HMAC signing algorithm → rejected")
    void nonHmacSigningRejected() {
        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.signJwt(Map.of("sub", "u"), SECRET,
                        new JwtSignOptions("RS256", null, null, null, null, null, null)));
        assertEquals("unsupported signing algorithm: RS256", ex.getMessage());
    }

    // ================================================================
    // Digest
    // ================================================================

    @Test
    @DisplayName("digest names map to JCA algorithms")
    void digestMatchesJca() throws Exception {
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(MessageDigest.getInstance("SHA-256").digest(data), atT0.digest("sha256", data));
        assertArrayEquals(MessageDigest.getInstance("SHA-1").digest(data), atT0.digest("SHA1", data));
        assertArrayEquals(MessageDigest.getInstance("SHA3-256").digest(data), atT0.digest("sha3-256", data));
        assertArrayEquals(MessageDigest.getInstance("SHA-512/256").digest(data), atT0.digest("sha512-256", data));
        assertArrayEquals(MessageDigest.getInstance("SHA-256").digest(data), atT0.digest(null, data));
    }

    @Test
    @DisplayName("unknown digest → \"Digest method not supported\"")
    void unsupportedDigest() {
        CryptoPrimitiveException ex = assertThrows(CryptoPrimitiveException.class,
                () -> atT0.digest("whirlpool-9000", new byte[0]));
        assertEquals("Digest method not supported: whirlpool-9000", ex.getMessage());
    }

    @Test
    void jcaDigestNamePassesUnknownThrough() {
        assertEquals("SHA-384", DefaultCryptoPrimitives.jcaDigestName("sha384"));
        assertEquals("MD5", DefaultCryptoPrimitives.jcaDigestName("md5"));
        assertEquals("SHA-256", DefaultCryptoPrimitives.jcaDigestName("SHA-256"));
    }

    // ================================================================
    // bcrypt
    // ================================================================

    @Test
    @DisplayName("bcrypt hash → matches only the hashed password")
    void bcryptRoundTrip() {
        String hash = atT0.bcryptHash("s3cret", 4);

        assertTrue(hash.startsWith("$2a$04$"));
        assertTrue(atT0.bcryptMatches("s3cret", hash));
        assertFalse(atT0.bcryptMatches("S3cret", hash));
    }

    @Test
    @DisplayName("bcrypt rounds outside 4..31 → CryptoPrimitiveException")
    void bcryptBadRounds() {
        assertThrows(CryptoPrimitiveException.class, () -> atT0.bcryptHash("pw", 3));
    }

    private static DefaultCryptoPrimitives at(Instant instant) {
        return new DefaultCryptoPrimitives(Clock.fixed(instant, ZoneOffset.UTC));
    }
}
