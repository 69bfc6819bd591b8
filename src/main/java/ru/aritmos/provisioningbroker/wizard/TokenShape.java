package ru.aritmos.provisioningbroker.wizard;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Форма токена интеграции: известный префикс и минимальная длина.
 * <p>
 * Пустой список префиксов означает, что подходит любая непробельная строка достаточной длины.
 */
public final class TokenShape {

    private final List<String> prefixes;
    private final int minLength;
    private final Pattern token;

    public TokenShape(List<String> prefixes, int minLength) {
        this.prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
        this.minLength = Math.max(1, minLength);
        this.token = Pattern.compile("[A-Za-z0-9._\\-]{" + this.minLength + ",}");
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        String v = candidate.trim();
        if (v.length() < minLength || !token.matcher(v).matches()) {
            return false;
        }
        if (prefixes.isEmpty()) {
            return true;
        }
        for (String p : prefixes) {
            if (v.startsWith(p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Найти первый подходящий токен в произвольном тексте.
     */
    public Optional<String> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = token.matcher(text);
        while (m.find()) {
            String candidate = m.group();
            if (matches(candidate)) {
                return Optional.of(candidate);
            }
            // Префикс может стоять внутри более длинного слова ("copiedpit-...").
            for (String p : prefixes) {
                int idx = candidate.indexOf(p);
                if (idx > 0 && matches(candidate.substring(idx))) {
                    return Optional.of(candidate.substring(idx));
                }
            }
        }
        return Optional.empty();
    }
}
