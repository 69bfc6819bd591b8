package ru.aritmos.provisioningbroker.checks;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

/**
 * Конфигурация стартовых проверок зависимостей (fail-fast).
 * <p>
 * Политика настраиваемая: в некоторых окружениях допустим degraded-режим
 * (например, почтовый ящик временно недоступен, а задания ещё не запускаются).
 */
@Introspected
@ConfigurationProperties("provisioningbroker.startup-checks")
public class StartupChecksConfiguration {

    /**
     * Глобальный флаг включения стартовых проверок.
     */
    private boolean enabled = true;

    private CheckConfig runtimeConfig = new CheckConfig();
    private MailboxCheckConfig mailbox = new MailboxCheckConfig();
    private CheckConfig credentialStore = new CheckConfig();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CheckConfig getRuntimeConfig() {
        return runtimeConfig;
    }

    public void setRuntimeConfig(CheckConfig runtimeConfig) {
        this.runtimeConfig = runtimeConfig;
    }

    public MailboxCheckConfig getMailbox() {
        return mailbox;
    }

    public void setMailbox(MailboxCheckConfig mailbox) {
        this.mailbox = mailbox;
    }

    public CheckConfig getCredentialStore() {
        return credentialStore;
    }

    public void setCredentialStore(CheckConfig credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * Базовая конфигурация проверки зависимости.
     */
    @Introspected
    public static class CheckConfig {
        /** включена ли проверка */
        private boolean enabled = false;
        /** считать ли зависимость критичной */
        private boolean critical = false;
        /** «ронять» ли сервис при ошибке (если зависимость критична) */
        private boolean failFast = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isCritical() {
            return critical;
        }

        public void setCritical(boolean critical) {
            this.critical = critical;
        }

        public boolean isFailFast() {
            return failFast;
        }

        public void setFailFast(boolean failFast) {
            this.failFast = failFast;
        }
    }

    /**
     * Проверка почтового ящика: пробное подключение по IMAPS.
     */
    @Introspected
    public static class MailboxCheckConfig extends CheckConfig {
        /** проверять только наличие пароля, без подключения */
        private boolean credentialsOnly = false;

        public boolean isCredentialsOnly() {
            return credentialsOnly;
        }

        public void setCredentialsOnly(boolean credentialsOnly) {
            this.credentialsOnly = credentialsOnly;
        }
    }
}
