package ru.aritmos.provisioningbroker.checks;

import jakarta.inject.Singleton;
import ru.aritmos.provisioningbroker.config.ProvisioningCredentialsProperties;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.mailbox.MailboxClient;
import ru.aritmos.provisioningbroker.mailbox.MailboxModels;

/**
 * Проверка почтового ящика с одноразовыми кодами.
 * <p>
 * Проверяет наличие учётных данных и (если не задан режим credentialsOnly) открывает и закрывает IMAP-сессию.
 * Письма не читаются и флаги не меняются.
 */
@Singleton
public class MailboxChecker {

    private final MailboxClient mailboxClient;
    private final RuntimeConfigStore configStore;
    private final ProvisioningCredentialsProperties credentials;

    public MailboxChecker(MailboxClient mailboxClient,
                          RuntimeConfigStore configStore,
                          ProvisioningCredentialsProperties credentials) {
        this.mailboxClient = mailboxClient;
        this.configStore = configStore;
        this.credentials = credentials;
    }

    public void check(StartupChecksConfiguration.MailboxCheckConfig cfg) {
        if (credentials.getMailboxUsername() == null || !credentials.hasMailboxPassword()) {
            throw new IllegalStateException("не заданы учётные данные почтового ящика (PB_MAILBOX_PASSWORD)");
        }
        if (cfg != null && cfg.isCredentialsOnly()) {
            return;
        }
        RuntimeConfigStore.MailboxConfig m = configStore.getEffective().mailbox();
        MailboxModels.MailboxConnection connection = new MailboxModels.MailboxConnection(
                m.host(), m.port(), m.folder(), credentials.getMailboxUsername(), credentials.getMailboxPassword(),
                m.connectTimeoutMs(), m.readTimeoutMs());
        try (MailboxClient.MailboxSession ignored = mailboxClient.open(connection)) {
            // подключение и открытие папки прошли успешно
        }
    }
}
