package ru.aritmos.provisioningbroker.login;

import ru.aritmos.provisioningbroker.core.ProvisioningModels;

/**
 * Итог машины состояний входа.
 *
 * @param state       финальное состояние (AUTHENTICATED или FAILED)
 * @param errorCode   причина неуспеха
 * @param reason      пояснение
 * @param transitions число выполненных переходов
 * @param otpAttempts сколько раз запрашивался код
 */
public record LoginOutcome(LoginState state,
                           ProvisioningModels.ErrorCode errorCode,
                           String reason,
                           int transitions,
                           int otpAttempts) {

    public static LoginOutcome authenticated(int transitions, int otpAttempts) {
        return new LoginOutcome(LoginState.AUTHENTICATED, null, null, transitions, otpAttempts);
    }

    public static LoginOutcome failed(ProvisioningModels.ErrorCode code, String reason, int transitions, int otpAttempts) {
        return new LoginOutcome(LoginState.FAILED, code, reason, transitions, otpAttempts);
    }

    public boolean isAuthenticated() {
        return state == LoginState.AUTHENTICATED;
    }
}
