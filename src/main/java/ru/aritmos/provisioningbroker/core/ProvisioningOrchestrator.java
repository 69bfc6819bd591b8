package ru.aritmos.provisioningbroker.core;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.browser.BrowserSessionController;
import ru.aritmos.provisioningbroker.browser.FatalEnvironmentException;
import ru.aritmos.provisioningbroker.browser.UiSurface;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.login.LoginOutcome;
import ru.aritmos.provisioningbroker.login.LoginStateMachine;
import ru.aritmos.provisioningbroker.mailbox.ConsumedMessageRegistry;
import ru.aritmos.provisioningbroker.mailbox.MailboxClient;
import ru.aritmos.provisioningbroker.mailbox.MailboxModels;
import ru.aritmos.provisioningbroker.mailbox.MailboxPoller;
import ru.aritmos.provisioningbroker.retry.RetryOrchestrator;
import ru.aritmos.provisioningbroker.retry.StepOutcome;
import ru.aritmos.provisioningbroker.store.CredentialModels;
import ru.aritmos.provisioningbroker.store.CredentialStore;
import ru.aritmos.provisioningbroker.token.CapturedToken;
import ru.aritmos.provisioningbroker.token.JwtInspector;
import ru.aritmos.provisioningbroker.token.StorageTokenScraper;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;
import ru.aritmos.provisioningbroker.token.TokenKind;
import ru.aritmos.provisioningbroker.wizard.ExtractionPath;
import ru.aritmos.provisioningbroker.wizard.IntegrationWizardDriver;
import ru.aritmos.provisioningbroker.wizard.WizardOutcome;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Выполнение одного задания от запуска браузера до сохранения учётных данных.
 * <p>
 * Последовательность:
 * <ol>
 *   <li>сессия браузера с подключённым перехватчиком токенов;</li>
 *   <li>переход на страницу интеграций арендатора и вход (с подтверждением кодом из почты);</li>
 *   <li>ожидание bearer-токена, при необходимости чтение хранилищ страницы;</li>
 *   <li>для FULL_PROVISIONING мастер создания интеграции;</li>
 *   <li>повторное чтение хранилищ, закрытие браузера;</li>
 *   <li>разбор JWT (сроки действия) и сохранение.</li>
 * </ol>
 * {@link #run} не выбрасывает исключений: любая ошибка превращается в код причины в итоге задания.
 */
@Singleton
public class ProvisioningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningOrchestrator.class);

    private final BrowserSessionController sessions;
    private final MailboxClient mailboxClient;
    private final ConsumedMessageRegistry consumedMessages;
    private final StorageTokenScraper storageScraper;
    private final JwtInspector jwtInspector;
    private final CredentialStore credentialStore;
    private final Clock clock;
    private final Sleeper sleeper;

    @Inject
    public ProvisioningOrchestrator(BrowserSessionController sessions,
                                    MailboxClient mailboxClient,
                                    ConsumedMessageRegistry consumedMessages,
                                    StorageTokenScraper storageScraper,
                                    JwtInspector jwtInspector,
                                    CredentialStore credentialStore) {
        this(sessions, mailboxClient, consumedMessages, storageScraper, jwtInspector, credentialStore,
                Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public ProvisioningOrchestrator(BrowserSessionController sessions,
                                    MailboxClient mailboxClient,
                                    ConsumedMessageRegistry consumedMessages,
                                    StorageTokenScraper storageScraper,
                                    JwtInspector jwtInspector,
                                    CredentialStore credentialStore,
                                    Clock clock,
                                    Sleeper sleeper) {
        this.sessions = sessions;
        this.mailboxClient = mailboxClient;
        this.consumedMessages = consumedMessages;
        this.storageScraper = storageScraper;
        this.jwtInspector = jwtInspector;
        this.credentialStore = credentialStore;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    /**
     * Выполнить задание.
     *
     * @return итог (никогда не {@code null})
     */
    public ProvisioningModels.ProvisioningResult run(ProvisioningJob job, ProvisioningModels.JobConfig config) {
        RuntimeConfigStore.RuntimeConfig rc = config.runtime() == null
                ? RuntimeConfigStore.RuntimeConfig.defaultConfig()
                : config.runtime();
        String prefix = job.logPrefix();
        log.info("{} старт задания: flavor={}, handle={}, revision={}", prefix, job.flavor(), job.targetTenantHandle(), rc.revision());

        JobDeadline deadline = JobDeadline.after(Duration.ofSeconds(rc.jobs().jobTimeoutSec()), clock);
        TokenInterceptor interceptor = new TokenInterceptor(rc.tokenCapture(), storageScraper, clock, prefix);
        RunState state = new RunState();

        try {
            sessions.withSession(rc.browser(), interceptor, prefix, ui -> {
                drive(job, config, rc, ui, interceptor, deadline, state);
                return null;
            });
        } catch (FatalEnvironmentException e) {
            state.fail(ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT, e.getMessage());
        } catch (JobTimeoutException e) {
            state.fail(ProvisioningModels.ErrorCode.JOB_TIMEOUT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} непредвиденная ошибка задания", prefix, e);
            state.fail(ProvisioningModels.ErrorCode.INTERNAL,
                    e.getClass().getSimpleName() + ": " + SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }

        Map<TokenKind, CapturedToken> captured = enrichWithJwt(interceptor.capturedTokens());
        ProvisioningModels.ResultStatus status = resultStatus(job.flavor(), captured, state.authenticated);

        boolean persisted = false;
        String persistenceWarning = null;
        if (!captured.isEmpty()) {
            job.transition(ProvisioningModels.JobStatus.PERSISTING);
            CredentialModels.PersistOutcome outcome = persist(job, captured);
            persisted = outcome.ok();
            if (!outcome.ok()) {
                persistenceWarning = ProvisioningModels.ErrorCode.PERSISTENCE_FAILURE + ": " + outcome.error();
                log.warn("{} токены не сохранены, но возвращаются вызывающему: {}", prefix, outcome.error());
            }
        }

        WizardOutcome wizard = state.wizard;
        ProvisioningModels.ProvisioningResult result = new ProvisioningModels.ProvisioningResult(
                job.jobId(),
                job.tenantId(),
                job.flavor(),
                status,
                captured,
                missing(job.flavor(), captured),
                wizard == null ? List.of() : wizard.skippedScopes(),
                wizard == null ? ExtractionPath.NONE : wizard.path(),
                status == ProvisioningModels.ResultStatus.COMPLETED ? null : state.errorCode,
                status == ProvisioningModels.ResultStatus.COMPLETED ? null : state.errorMessage,
                persisted,
                persistenceWarning);
        job.complete(result);

        if (status == ProvisioningModels.ResultStatus.FAILED) {
            log.warn("{} задание завершено неуспешно: {} ({}), получено={}, не получено={}",
                    prefix, state.errorCode, state.errorMessage, captured.keySet(), result.missing());
        } else {
            log.info("{} задание завершено: {}, получено={}, не получено={}, путь извлечения={}, сохранено={}",
                    prefix, status, captured.keySet(), result.missing(), result.extractionPath(), persisted);
        }
        return result;
    }

    private void drive(ProvisioningJob job,
                       ProvisioningModels.JobConfig config,
                       RuntimeConfigStore.RuntimeConfig rc,
                       UiSurface ui,
                       TokenInterceptor interceptor,
                       JobDeadline deadline,
                       RunState state) {
        String prefix = job.logPrefix();
        RetryOrchestrator retry = new RetryOrchestrator(
                Duration.ofMillis(rc.retry().baseBackoffMs()),
                Duration.ofMillis(rc.retry().maxBackoffMs()),
                sleeper, deadline, prefix);

        job.transition(ProvisioningModels.JobStatus.AUTHENTICATING);
        String entryUrl = rc.console().integrationsUrl(job.targetTenantHandle());
        StepOutcome<Void> nav = ui.navigate(entryUrl, Duration.ofMillis(rc.browser().navigationTimeoutMs()));
        if (!nav.isOk()) {
            state.fail(nav.isFatal()
                            ? ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT
                            : ProvisioningModels.ErrorCode.NAVIGATION_FAILED,
                    "не удалось открыть консоль: " + nav.reason());
            return;
        }

        MailboxPoller poller = new MailboxPoller(mailboxClient, connection(rc.mailbox(), config), rc.mailbox(),
                consumedMessages, sleeper, deadline, prefix);
        LoginStateMachine login = new LoginStateMachine(ui, retry, poller, rc,
                config.loginIdentity(), config.loginSecret(), clock, deadline, job.jobId(), job::transition, prefix);
        LoginOutcome loginOutcome = login.run();
        if (!loginOutcome.isAuthenticated()) {
            state.fail(loginOutcome.errorCode(), loginOutcome.reason());
            return;
        }
        state.authenticated = true;

        job.transition(ProvisioningModels.JobStatus.CAPTURING);
        awaitBearer(ui, interceptor, rc.tokenCapture(), deadline, prefix);

        if (job.flavor() == ProvisioningModels.Flavor.FULL_PROVISIONING) {
            job.transition(ProvisioningModels.JobStatus.PROVISIONING);
            List<String> scopes = config.scopes() == null || config.scopes().isEmpty() ? job.scopes() : config.scopes();
            IntegrationWizardDriver wizard = new IntegrationWizardDriver(ui, retry, rc, scopes, deadline, prefix);
            WizardOutcome outcome = wizard.run(job.targetTenantHandle());
            state.wizard = outcome;
            if (outcome.success()) {
                interceptor.recordIntegrationToken(outcome.token());
            } else {
                state.fail(outcome.errorCode(), outcome.reason());
            }
        }

        scrapeStorage(ui, interceptor);
    }

    /**
     * Дождаться bearer-токена из исходящих запросов; если он не появился, прочитать хранилища страницы.
     * Ожидание идёт через страницу, чтобы браузер продолжал доставлять события запросов.
     */
    private void awaitBearer(UiSurface ui,
                             TokenInterceptor interceptor,
                             RuntimeConfigStore.TokenCaptureConfig capture,
                             JobDeadline deadline,
                             String prefix) {
        long waited = 0;
        Duration poll = Duration.ofMillis(capture.capturePollMs());
        while (!interceptor.has(TokenKind.BEARER) && waited < capture.captureWaitMs()) {
            deadline.check("перехват токенов");
            if (ui.settle(poll).isFatal()) {
                break;
            }
            waited += capture.capturePollMs();
        }
        if (!interceptor.has(TokenKind.BEARER)) {
            log.info("{} bearer-токен не перехвачен за {} мс, чтение хранилищ страницы", prefix, capture.captureWaitMs());
            scrapeStorage(ui, interceptor);
        }
    }

    private static void scrapeStorage(UiSurface ui, TokenInterceptor interceptor) {
        StepOutcome<Map<String, String>> local = ui.storage(UiSurface.StorageArea.LOCAL);
        StepOutcome<Map<String, String>> session = ui.storage(UiSurface.StorageArea.SESSION);
        interceptor.scrapeStorage(local.isOk() ? local.value() : null, session.isOk() ? session.value() : null);
    }

    private Map<TokenKind, CapturedToken> enrichWithJwt(Map<TokenKind, CapturedToken> captured) {
        Map<TokenKind, CapturedToken> out = new EnumMap<>(TokenKind.class);
        for (Map.Entry<TokenKind, CapturedToken> e : captured.entrySet()) {
            CapturedToken t = e.getValue();
            CapturedToken enriched = jwtInspector.inspect(t.value())
                    .map(c -> t.withTimes(c.issuedAt(), c.expiresAt()))
                    .orElse(t);
            out.put(e.getKey(), enriched);
        }
        return Collections.unmodifiableMap(out);
    }

    private CredentialModels.PersistOutcome persist(ProvisioningJob job, Map<TokenKind, CapturedToken> captured) {
        if (credentialStore == null) {
            return CredentialModels.PersistOutcome.fail("хранилище учётных данных не настроено");
        }
        try {
            return credentialStore.upsert(job.tenantId(), CredentialModels.CredentialUpdate.fromCaptured(captured));
        } catch (RuntimeException e) {
            return CredentialModels.PersistOutcome.fail(SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }
    }

    static ProvisioningModels.ResultStatus resultStatus(ProvisioningModels.Flavor flavor,
                                                         Map<TokenKind, CapturedToken> captured,
                                                         boolean authenticated) {
        if (captured.containsKey(flavor.requiredKind())) {
            return ProvisioningModels.ResultStatus.COMPLETED;
        }
        if (authenticated && !captured.isEmpty()) {
            return ProvisioningModels.ResultStatus.PARTIAL;
        }
        return ProvisioningModels.ResultStatus.FAILED;
    }

    static List<TokenKind> missing(ProvisioningModels.Flavor flavor, Map<TokenKind, CapturedToken> captured) {
        List<TokenKind> out = new ArrayList<>();
        for (TokenKind k : flavor.expectedKinds()) {
            if (!captured.containsKey(k)) {
                out.add(k);
            }
        }
        return List.copyOf(out);
    }

    private static MailboxModels.MailboxConnection connection(RuntimeConfigStore.MailboxConfig mailbox,
                                                              ProvisioningModels.JobConfig config) {
        return new MailboxModels.MailboxConnection(
                mailbox.host(),
                mailbox.port(),
                mailbox.folder(),
                config.mailboxUsername(),
                config.mailboxPassword(),
                mailbox.connectTimeoutMs(),
                mailbox.readTimeoutMs());
    }

    private static final class RunState {
        private boolean authenticated;
        private WizardOutcome wizard;
        private ProvisioningModels.ErrorCode errorCode;
        private String errorMessage;

        void fail(ProvisioningModels.ErrorCode code, String message) {
            // Первая причина остаётся основной.
            if (errorCode == null) {
                errorCode = code == null ? ProvisioningModels.ErrorCode.INTERNAL : code;
                errorMessage = message;
            }
        }
    }
}
