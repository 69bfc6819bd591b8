package ru.aritmos.provisioningbroker.token;

import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;

import java.time.Instant;

/**
 * Полученный токен.
 *
 * @param kind      вид
 * @param value     значение (секрет; не логировать)
 * @param issuedAt  момент выпуска, если известен
 * @param expiresAt момент истечения, если известен
 * @param source    откуда получен
 */
public record CapturedToken(TokenKind kind, String value, Instant issuedAt, Instant expiresAt, Source source) {

    public enum Source {
        /** перехвачен из заголовков исходящего запроса */
        INTERCEPTED,
        /** прочитан из localStorage/sessionStorage */
        STORAGE,
        /** создан мастером интеграции */
        WIZARD
    }

    public static CapturedToken of(TokenKind kind, String value, Source source) {
        return new CapturedToken(kind, value, null, null, source);
    }

    public CapturedToken withTimes(Instant issued, Instant expires) {
        return new CapturedToken(kind,
                value,
                issued == null ? issuedAt : issued,
                expires == null ? expiresAt : expires,
                source);
    }

    public String preview() {
        return SensitiveDataSanitizer.preview(value);
    }

    @Override
    public String toString() {
        return "CapturedToken{kind=" + kind + ", value=" + preview() + ", issuedAt=" + issuedAt
                + ", expiresAt=" + expiresAt + ", source=" + source + "}";
    }
}
