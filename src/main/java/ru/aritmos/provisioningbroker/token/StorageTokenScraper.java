package ru.aritmos.provisioningbroker.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Поиск токенов в localStorage/sessionStorage страницы.
 * <p>
 * Резервный путь на случай, если перехват заголовков не дал bearer-токен. Известные формы:
 * <ul>
 *   <li>ключ {@code a}: base64 от JSON с полями {@code authToken}/{@code jwt} и {@code refreshToken}/{@code refreshJwt};</li>
 *   <li>ключи, содержащие {@code token} или {@code access}: JSON с {@code access_token}/{@code refresh_token}/{@code expires_in};</li>
 *   <li>те же ключи с «сырым» JWT в значении.</li>
 * </ul>
 */
@Singleton
public class StorageTokenScraper {

    private static final Logger log = LoggerFactory.getLogger(StorageTokenScraper.class);

    private static final String APP_STATE_KEY = "a";

    private final ObjectMapper objectMapper;

    public StorageTokenScraper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Извлечь токены из снимка хранилища.
     *
     * @param storage         ключ -&gt; значение
     * @param minTokenLength  минимальная длина правдоподобного токена
     * @param now             текущий момент (для expires_in)
     * @return найденные токены в порядке обнаружения (возможны несколько одного вида; приоритет у первого)
     */
    public List<CapturedToken> scrape(Map<String, String> storage, int minTokenLength, Instant now) {
        List<CapturedToken> out = new ArrayList<>();
        if (storage == null || storage.isEmpty()) {
            return out;
        }

        String appState = storage.get(APP_STATE_KEY);
        if (appState != null) {
            JsonNode node = decodeAppState(appState);
            if (node != null) {
                add(out, TokenKind.BEARER, firstText(node, "authToken", "jwt"), null, minTokenLength);
                add(out, TokenKind.REFRESH, firstText(node, "refreshToken", "refreshJwt"), null, minTokenLength);
            }
        }

        for (Map.Entry<String, String> e : storage.entrySet()) {
            String key = e.getKey();
            String value = e.getValue();
            if (key == null || value == null || APP_STATE_KEY.equals(key)) {
                continue;
            }
            String k = key.toLowerCase(Locale.ROOT);
            if (!k.contains("token") && !k.contains("access")) {
                continue;
            }
            String v = value.trim();
            if (v.startsWith("{")) {
                JsonNode node = readJson(v);
                if (node == null) {
                    continue;
                }
                Instant expiresAt = null;
                JsonNode expiresIn = node.get("expires_in");
                if (expiresIn != null && expiresIn.isNumber() && now != null) {
                    expiresAt = now.plusSeconds(expiresIn.asLong());
                }
                add(out, TokenKind.BEARER, firstText(node, "access_token"), expiresAt, minTokenLength);
                add(out, TokenKind.REFRESH, firstText(node, "refresh_token"), null, minTokenLength);
            } else if (looksLikeJwt(v)) {
                add(out, TokenKind.BEARER, v, null, minTokenLength);
            }
        }
        return out;
    }

    private JsonNode decodeAppState(String raw) {
        String s = raw.trim();
        if (s.startsWith("{")) {
            return readJson(s);
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(s);
            return readJson(new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            try {
                byte[] bytes = Base64.getUrlDecoder().decode(s);
                return readJson(new String(bytes, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e2) {
                log.debug("Значение ключа '{}' в хранилище не является base64", APP_STATE_KEY);
                return null;
            }
        }
    }

    private JsonNode readJson(String s) {
        try {
            JsonNode node = objectMapper.readTree(s);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            log.debug("Значение в хранилище не является JSON: {}", e.getClass().getSimpleName());
            return null;
        }
    }

    static boolean looksLikeJwt(String v) {
        return v.startsWith("eyJ") && v.chars().filter(c -> c == '.').count() == 2;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode n = node.get(f);
            if (n != null && n.isTextual() && !n.asText().isBlank()) {
                return n.asText().trim();
            }
        }
        return null;
    }

    private static void add(List<CapturedToken> out, TokenKind kind, String value, Instant expiresAt, int minLength) {
        if (value == null || value.length() < minLength) {
            return;
        }
        out.add(new CapturedToken(kind, value, null, expiresAt, CapturedToken.Source.STORAGE));
    }
}
