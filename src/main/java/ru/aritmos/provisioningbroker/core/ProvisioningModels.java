package ru.aritmos.provisioningbroker.core;

import io.micronaut.core.annotation.Introspected;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.CapturedToken;
import ru.aritmos.provisioningbroker.token.TokenKind;
import ru.aritmos.provisioningbroker.wizard.ExtractionPath;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Модели заданий выдачи учётных данных.
 */
public final class ProvisioningModels {

    private ProvisioningModels() {
    }

    /**
     * Статус задания. Меняет его только оркестратор.
     */
    public enum JobStatus {
        PENDING,
        AUTHENTICATING,
        AWAITING_MFA,
        CAPTURING,
        PROVISIONING,
        PERSISTING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    /**
     * Вариант задания.
     */
    public enum Flavor {
        /** вход, перехват токенов и создание токена интеграции мастером */
        FULL_PROVISIONING,
        /** только вход и перехват bearer/session токенов */
        TOKEN_REFRESH;

        /**
         * Вид токена, без которого результат не считается полным.
         */
        public TokenKind requiredKind() {
            return this == FULL_PROVISIONING ? TokenKind.INTEGRATION : TokenKind.BEARER;
        }

        /**
         * Виды токенов, которые задание пытается получить.
         */
        public Set<TokenKind> expectedKinds() {
            return this == FULL_PROVISIONING
                    ? EnumSet.of(TokenKind.BEARER, TokenKind.SESSION, TokenKind.INTEGRATION)
                    : EnumSet.of(TokenKind.BEARER, TokenKind.SESSION);
        }
    }

    public enum ResultStatus {
        COMPLETED,
        PARTIAL,
        FAILED
    }

    /**
     * Коды причин неуспеха задания.
     */
    public enum ErrorCode {
        FATAL_ENVIRONMENT,
        OTP_TIMEOUT,
        OTP_REJECTED,
        LOGIN_REJECTED,
        UNRECOGNIZED_PAGE,
        UI_STEP_EXHAUSTED,
        NAVIGATION_FAILED,
        JOB_TIMEOUT,
        CAPACITY_EXCEEDED,
        PERSISTENCE_FAILURE,
        INTERNAL
    }

    /**
     * Запрос на запуск задания.
     *
     * @param tenantId           идентификатор арендатора (ключ хранения)
     * @param targetTenantHandle идентификатор арендатора в целевой консоли (подставляется в URL)
     * @param flavor             вариант (по умолчанию FULL_PROVISIONING)
     * @param loginIdentity      логин (по умолчанию из конфигурации)
     * @param scopes             набор прав (по умолчанию из runtime-конфигурации)
     */
    @Introspected
    public record JobRequest(String tenantId,
                             String targetTenantHandle,
                             Flavor flavor,
                             String loginIdentity,
                             List<String> scopes) {

        /**
         * Проверить и нормализовать запрос.
         *
         * @throws IllegalArgumentException если не заданы обязательные поля
         */
        public JobRequest normalize() {
            String tenant = text(tenantId);
            if (tenant == null) {
                throw new IllegalArgumentException("tenantId обязателен");
            }
            String handle = text(targetTenantHandle);
            if (handle == null) {
                throw new IllegalArgumentException("targetTenantHandle обязателен");
            }
            List<String> s = scopes == null ? null : scopes.stream()
                    .map(ProvisioningModels::text)
                    .filter(v -> v != null)
                    .distinct()
                    .toList();
            return new JobRequest(tenant, handle, flavor == null ? Flavor.FULL_PROVISIONING : flavor,
                    text(loginIdentity), s == null || s.isEmpty() ? null : s);
        }
    }

    /**
     * Полная конфигурация одного задания: снимок runtime-конфигурации и секреты.
     */
    public record JobConfig(RuntimeConfigStore.RuntimeConfig runtime,
                            String loginIdentity,
                            String loginSecret,
                            String mailboxUsername,
                            String mailboxPassword,
                            List<String> scopes) {

        @Override
        public String toString() {
            return "JobConfig{revision=" + (runtime == null ? null : runtime.revision())
                    + ", loginIdentity=" + loginIdentity
                    + ", loginSecret=" + (loginSecret == null ? "<none>" : "***")
                    + ", mailboxUsername=" + mailboxUsername
                    + ", mailboxPassword=" + (mailboxPassword == null ? "<none>" : "***")
                    + ", scopes=" + (scopes == null ? 0 : scopes.size()) + "}";
        }
    }

    /**
     * Итог задания.
     *
     * @param captured           полученные токены по видам
     * @param missing            ожидавшиеся, но не полученные виды
     * @param skippedScopes      права, которые консоль не приняла
     * @param extractionPath     путь извлечения токена интеграции
     * @param persisted          сохранены ли токены в хранилище
     * @param persistenceWarning описание ошибки сохранения (не отменяет полученные токены)
     */
    public record ProvisioningResult(String jobId,
                                     String tenantId,
                                     Flavor flavor,
                                     ResultStatus status,
                                     Map<TokenKind, CapturedToken> captured,
                                     List<TokenKind> missing,
                                     List<String> skippedScopes,
                                     ExtractionPath extractionPath,
                                     ErrorCode errorCode,
                                     String errorMessage,
                                     boolean persisted,
                                     String persistenceWarning) {

        public boolean isSuccess() {
            return status == ResultStatus.COMPLETED || status == ResultStatus.PARTIAL;
        }
    }

    static String text(String v) {
        if (v == null) {
            return null;
        }
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
