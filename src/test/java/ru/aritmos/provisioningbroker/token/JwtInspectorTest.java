package ru.aritmos.provisioningbroker.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JwtInspectorTest {

    private final JwtInspector inspector = new JwtInspector(new ObjectMapper());

    @Test
    void readsIssuedAndExpiryClaims() {
        Optional<JwtInspector.JwtClaims> claims = inspector.inspect(TestJwts.jwt(1_760_000_000L, 1_760_003_600L));

        assertTrue(claims.isPresent(), "TEST_EXPECTED: корректный JWT разбирается");
        assertEquals(Instant.ofEpochSecond(1_760_000_000L), claims.get().issuedAt());
        assertEquals(Instant.ofEpochSecond(1_760_003_600L), claims.get().expiresAt());
        assertEquals("user-1", claims.get().subject());
    }

    @Test
    void acceptsBearerPrefix() {
        assertTrue(inspector.inspect("Bearer " + TestJwts.jwt(1L, 2L)).isPresent());
    }

    @Test
    void missingClaimsAreNull() {
        JwtInspector.JwtClaims claims = inspector.inspect(TestJwts.jwt("{\"sub\":\"x\"}")).orElseThrow();
        assertNull(claims.issuedAt());
        assertNull(claims.expiresAt());
    }

    @Test
    void malformedTokensYieldEmpty() {
        assertTrue(inspector.inspect(null).isEmpty());
        assertTrue(inspector.inspect("not-a-jwt").isEmpty());
        assertTrue(inspector.inspect("a.b").isEmpty());
        assertTrue(inspector.inspect("aaa.!!!.ccc").isEmpty(), "TEST_EXPECTED: битый base64 не приводит к исключению");
        assertTrue(inspector.inspect("aaa.W10.ccc").isEmpty(), "TEST_EXPECTED: payload-массив не является claims");
    }
}
