package ru.aritmos.provisioningbroker.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Секреты, необходимые заданию: учётная запись консоли и доступ к почтовому ящику с OTP.
 * <p>
 * Читаются только из application.yml/ENV и никогда не попадают в runtime-конфигурацию,
 * Admin API или логи.
 */
@ConfigurationProperties("provisioningbroker.credentials")
public class ProvisioningCredentialsProperties {

    private String loginIdentity;
    private String loginSecret;
    private String mailboxUsername;
    private String mailboxPassword;

    public String getLoginIdentity() {
        return loginIdentity;
    }

    public void setLoginIdentity(String loginIdentity) {
        this.loginIdentity = normalize(loginIdentity);
    }

    public String getLoginSecret() {
        return loginSecret;
    }

    public void setLoginSecret(String loginSecret) {
        this.loginSecret = loginSecret;
    }

    /**
     * Логин почтового ящика; если не задан, используется логин консоли.
     */
    public String getMailboxUsername() {
        return mailboxUsername == null ? loginIdentity : mailboxUsername;
    }

    public void setMailboxUsername(String mailboxUsername) {
        this.mailboxUsername = normalize(mailboxUsername);
    }

    public String getMailboxPassword() {
        return mailboxPassword;
    }

    public void setMailboxPassword(String mailboxPassword) {
        this.mailboxPassword = mailboxPassword;
    }

    public boolean hasLoginSecret() {
        return loginSecret != null && !loginSecret.isEmpty();
    }

    public boolean hasMailboxPassword() {
        return mailboxPassword != null && !mailboxPassword.isEmpty();
    }

    @Override
    public String toString() {
        return "ProvisioningCredentialsProperties{loginIdentity=" + loginIdentity
                + ", loginSecret=" + (hasLoginSecret() ? "***" : "<none>")
                + ", mailboxUsername=" + getMailboxUsername()
                + ", mailboxPassword=" + (hasMailboxPassword() ? "***" : "<none>") + "}";
    }

    private static String normalize(String v) {
        if (v == null || v.isBlank()) {
            return null;
        }
        return v.trim();
    }
}
