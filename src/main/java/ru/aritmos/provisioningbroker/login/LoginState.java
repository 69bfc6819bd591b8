package ru.aritmos.provisioningbroker.login;

/**
 * Состояние страницы входа.
 * <p>
 * {@link #UNKNOWN}: промежуточное состояние: страница ещё загружается или перерисовывается.
 */
public enum LoginState {
    LOGIN_FORM,
    MFA_CHALLENGE,
    AUTHENTICATED,
    FAILED,
    UNKNOWN
}
