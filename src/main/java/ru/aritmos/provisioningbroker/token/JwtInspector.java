package ru.aritmos.provisioningbroker.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Чтение claims из JWT без проверки подписи.
 * <p>
 * Используется только для учёта сроков (iat/exp) перехваченных токенов.
 * Подпись не проверяется, поэтому результат нельзя использовать для решений об авторизации.
 */
@Singleton
public class JwtInspector {

    private final ObjectMapper objectMapper;

    public JwtInspector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Claims, нужные для учёта сроков.
     *
     * @param issuedAt  iat (может быть null)
     * @param expiresAt exp (может быть null)
     * @param subject   sub (может быть null)
     */
    public record JwtClaims(Instant issuedAt, Instant expiresAt, String subject) {
    }

    /**
     * Разобрать токен.
     *
     * @param token JWT (допускается префикс {@code Bearer })
     * @return claims или пусто, если токен не является корректным JWT; исключения не выбрасываются
     */
    public Optional<JwtClaims> inspect(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String t = token.trim();
        if (t.regionMatches(true, 0, "Bearer ", 0, 7)) {
            t = t.substring(7).trim();
        }
        String[] parts = t.split("\\.", -1);
        if (parts.length != 3 || parts[1].isEmpty()) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(repad(parts[1]));
            JsonNode node = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new JwtClaims(epoch(node.get("iat")), epoch(node.get("exp")), text(node.get("sub"))));
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String repad(String segment) {
        int rem = segment.length() % 4;
        if (rem == 0) {
            return segment;
        }
        return segment + "=".repeat(4 - rem);
    }

    private static Instant epoch(JsonNode n) {
        if (n == null || !n.isNumber()) {
            return null;
        }
        return Instant.ofEpochSecond(n.asLong());
    }

    private static String text(JsonNode n) {
        return n == null || n.isNull() ? null : n.asText();
    }
}
