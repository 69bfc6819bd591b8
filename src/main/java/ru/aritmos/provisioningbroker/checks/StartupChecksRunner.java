package ru.aritmos.provisioningbroker.checks;

import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.event.ApplicationStartupEvent;
import jakarta.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Исполнитель стартовых проверок зависимостей (fail-fast).
 * <p>
 * Реализовано как listener на {@link ApplicationStartupEvent}.
 * <ul>
 *   <li>если проверка помечена как critical и failFast=true: сервис падает на старте;</li>
 *   <li>если critical=false: ошибка логируется как предупреждение, сервис продолжает запуск.</li>
 * </ul>
 */
@Singleton
public class StartupChecksRunner implements ApplicationEventListener<ApplicationStartupEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupChecksRunner.class);

    private final StartupChecksConfiguration cfg;
    private final RuntimeConfigChecker runtimeConfigChecker;
    private final MailboxChecker mailboxChecker;
    private final CredentialStoreChecker credentialStoreChecker;

    public StartupChecksRunner(StartupChecksConfiguration cfg,
                               RuntimeConfigChecker runtimeConfigChecker,
                               MailboxChecker mailboxChecker,
                               CredentialStoreChecker credentialStoreChecker) {
        this.cfg = cfg;
        this.runtimeConfigChecker = runtimeConfigChecker;
        this.mailboxChecker = mailboxChecker;
        this.credentialStoreChecker = credentialStoreChecker;
    }

    @Override
    public void onApplicationEvent(ApplicationStartupEvent event) {
        if (!cfg.isEnabled()) {
            log.info("Стартовые проверки зависимостей отключены настройкой provisioningbroker.startup-checks.enabled=false");
            return;
        }

        runOne("runtime-config", cfg.getRuntimeConfig(), () -> runtimeConfigChecker.check(cfg.getRuntimeConfig()));
        runOne("mailbox", cfg.getMailbox(), () -> mailboxChecker.check(cfg.getMailbox()));
        runOne("credential-store", cfg.getCredentialStore(), () -> credentialStoreChecker.check(cfg.getCredentialStore()));
    }

    void runOne(String name, StartupChecksConfiguration.CheckConfig c, Runnable action) {
        if (c == null || !c.isEnabled()) {
            return;
        }
        try {
            action.run();
            log.info("Стартовая проверка '{}' успешно пройдена", name);
        } catch (RuntimeException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (c.isCritical() && c.isFailFast()) {
                throw new IllegalStateException("Критичная зависимость недоступна (" + name + "): " + msg, e);
            }
            if (c.isCritical()) {
                log.error("Критичная зависимость недоступна ({}), но fail-fast выключен: {}", name, msg);
            } else {
                log.warn("Некритичная зависимость недоступна ({}): {}", name, msg);
            }
        }
    }
}
