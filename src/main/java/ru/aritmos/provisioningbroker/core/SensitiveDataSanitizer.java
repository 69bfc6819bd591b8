package ru.aritmos.provisioningbroker.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Санитайзер чувствительных данных.
 * <p>
 * Брокер по своей природе работает с секретами: паролем консоли, одноразовыми кодами,
 * bearer/session-токенами и долгоживущим токеном интеграции. Ни одно из этих значений
 * не должно попадать в логи и ответы API в сыром виде.
 * <p>
 * Санитайзер работает эвристически и не является DLP-системой.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Заголовки/поля, которые нельзя логировать в сыром виде.
     */
    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "cookie",
            "set-cookie",
            "token-id",
            "x-auth-token",
            "x-access-token",
            "access_token",
            "refresh_token",
            "password"
    );

    private static final String MASK = "***";

    /**
     * Санитизировать карту заголовков (ключи сохраняются, чувствительные значения маскируются).
     */
    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }

        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            String k = e.getKey();
            if (k == null) {
                continue;
            }
            String keyNorm = k.toLowerCase(Locale.ROOT).trim();
            if (FORBIDDEN_KEYS.contains(keyNorm)) {
                out.put(k, MASK);
                continue;
            }
            out.put(k, sanitizeText(e.getValue()));
        }
        return out;
    }

    /**
     * Санитизировать текст (сообщения об ошибках Playwright/IMAP/JDBC).
     * <p>
     * Маскируются Bearer-токены, пары key=value с секретами, JWT и токены интеграции ({@code pit-...}).
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;

        // Bearer <token>
        t = t.replaceAll("(?i)bearer\\s+[^\\s\"']+", "Bearer " + MASK);

        // key=value / key: value
        t = t.replaceAll("(?i)(password|access_token|refresh_token|token-id)\\s*[=:]\\s*[^\\s&,\"']+", "$1=" + MASK);

        // JWT (три base64url сегмента)
        t = t.replaceAll("eyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]*", MASK);

        // Токен интеграции
        t = t.replaceAll("(?i)pit-[A-Za-z0-9-]{6,}", "pit-" + MASK);

        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Короткое превью секрета для логов и API: первые 4 символа и длина.
     */
    public static String preview(String secret) {
        if (secret == null || secret.isEmpty()) {
            return null;
        }
        String head = secret.length() <= 8 ? "" : secret.substring(0, 4);
        return head + MASK + "(" + secret.length() + ")";
    }
}
