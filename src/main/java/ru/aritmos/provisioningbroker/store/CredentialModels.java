package ru.aritmos.provisioningbroker.store;

import ru.aritmos.provisioningbroker.token.CapturedToken;
import ru.aritmos.provisioningbroker.token.TokenKind;

import java.time.Instant;
import java.util.Map;

/**
 * Модели хранилища учётных данных арендатора.
 */
public final class CredentialModels {

    private CredentialModels() {
    }

    /**
     * Частичное обновление. Поля со значением {@code null} не меняют сохранённые значения.
     */
    public record CredentialUpdate(String bearerToken,
                                   Instant bearerIssuedAt,
                                   Instant bearerExpiresAt,
                                   String sessionToken,
                                   Instant sessionExpiresAt,
                                   String refreshToken,
                                   String integrationToken) {

        public static CredentialUpdate fromCaptured(Map<TokenKind, CapturedToken> captured) {
            if (captured == null || captured.isEmpty()) {
                return new CredentialUpdate(null, null, null, null, null, null, null);
            }
            CapturedToken bearer = captured.get(TokenKind.BEARER);
            CapturedToken session = captured.get(TokenKind.SESSION);
            CapturedToken refresh = captured.get(TokenKind.REFRESH);
            CapturedToken integration = captured.get(TokenKind.INTEGRATION);
            return new CredentialUpdate(
                    bearer == null ? null : bearer.value(),
                    bearer == null ? null : bearer.issuedAt(),
                    bearer == null ? null : bearer.expiresAt(),
                    session == null ? null : session.value(),
                    session == null ? null : session.expiresAt(),
                    refresh == null ? null : refresh.value(),
                    integration == null ? null : integration.value());
        }

        public boolean isEmpty() {
            return bearerToken == null && bearerIssuedAt == null && bearerExpiresAt == null
                    && sessionToken == null && sessionExpiresAt == null
                    && refreshToken == null && integrationToken == null;
        }
    }

    /**
     * Сохранённая запись арендатора.
     */
    public record TenantCredentialRecord(String tenantId,
                                         String bearerToken,
                                         Instant bearerIssuedAt,
                                         Instant bearerExpiresAt,
                                         String sessionToken,
                                         Instant sessionExpiresAt,
                                         String refreshToken,
                                         String integrationToken,
                                         Instant createdAt,
                                         Instant updatedAt) {
    }

    /**
     * Результат сохранения.
     *
     * @param ok       сохранено ли
     * @param inserted создана ли новая запись
     * @param error    краткое описание ошибки (санитизированное)
     */
    public record PersistOutcome(boolean ok, boolean inserted, String error) {

        public static PersistOutcome ok(boolean inserted) {
            return new PersistOutcome(true, inserted, null);
        }

        public static PersistOutcome fail(String error) {
            return new PersistOutcome(false, false, error);
        }
    }
}
