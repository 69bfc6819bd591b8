package ru.aritmos.provisioningbroker.login;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.browser.UiSurface;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.ProvisioningModels;
import ru.aritmos.provisioningbroker.mailbox.MailboxPoller;
import ru.aritmos.provisioningbroker.retry.ActionResult;
import ru.aritmos.provisioningbroker.retry.CandidateAction;
import ru.aritmos.provisioningbroker.retry.RetryOrchestrator;
import ru.aritmos.provisioningbroker.retry.StepOutcome;
import ru.aritmos.provisioningbroker.retry.StrategyTable;
import ru.aritmos.provisioningbroker.retry.UiActions;
import ru.aritmos.provisioningbroker.retry.UiLocator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Машина состояний входа в веб-консоль: форма входа, подтверждение кодом из почты, вход выполнен.
 * <p>
 * Каждый цикл заново определяет состояние страницы и выполняет один переход. Ограничения:
 * <ul>
 *   <li>общее число переходов ({@code login.maxTransitions});</li>
 *   <li>повторные появления формы входа ({@code login.maxLoginAttempts}) означают отказ в доступе;</li>
 *   <li>повторные появления запроса кода ({@code login.maxMfaAttempts}) означают неверный код;</li>
 *   <li>подряд идущие нераспознанные пробы ({@code login.maxUnknownProbes}).</li>
 * </ul>
 * Экземпляр создаётся на задание.
 */
public class LoginStateMachine {

    private static final Logger log = LoggerFactory.getLogger(LoginStateMachine.class);

    private static final String ENTER = "Enter";

    private final UiSurface ui;
    private final RetryOrchestrator retry;
    private final MailboxPoller poller;
    private final RuntimeConfigStore.RuntimeConfig config;
    private final StrategyTable strategies;
    private final PageStateClassifier classifier;
    private final String loginIdentity;
    private final String loginSecret;
    private final Clock clock;
    private final JobDeadline deadline;
    private final String jobId;
    private final Consumer<ProvisioningModels.JobStatus> statusListener;
    private final String logPrefix;

    private OtpChallenge lastChallenge;

    public LoginStateMachine(UiSurface ui,
                             RetryOrchestrator retry,
                             MailboxPoller poller,
                             RuntimeConfigStore.RuntimeConfig config,
                             String loginIdentity,
                             String loginSecret,
                             Clock clock,
                             JobDeadline deadline,
                             String jobId,
                             Consumer<ProvisioningModels.JobStatus> statusListener,
                             String logPrefix) {
        this.ui = ui;
        this.retry = retry;
        this.poller = poller;
        this.config = config == null ? RuntimeConfigStore.RuntimeConfig.defaultConfig() : config;
        this.strategies = this.config.strategies();
        this.classifier = new PageStateClassifier(ui, strategies,
                Pattern.compile(this.config.console().destinationUrlPattern()));
        this.loginIdentity = loginIdentity;
        this.loginSecret = loginSecret;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.deadline = deadline == null ? JobDeadline.unlimited() : deadline;
        this.jobId = jobId;
        this.statusListener = statusListener == null ? s -> { } : statusListener;
        this.logPrefix = logPrefix == null ? "[LOGIN]" : logPrefix;
    }

    /**
     * Довести страницу до состояния AUTHENTICATED.
     *
     * @return итог (AUTHENTICATED или FAILED с кодом причины)
     */
    public LoginOutcome run() {
        RuntimeConfigStore.LoginConfig limits = config.login();
        int transitions = 0;
        int loginVisits = 0;
        int mfaVisits = 0;
        int unknownProbes = 0;

        while (true) {
            deadline.check("вход");
            LoginState state = classifier.classify();
            log.debug("{} состояние страницы: {}", logPrefix, state);

            if (state == LoginState.AUTHENTICATED) {
                log.info("{} вход выполнен (переходов={}, запросов кода={})", logPrefix, transitions, mfaVisits);
                return LoginOutcome.authenticated(transitions, mfaVisits);
            }
            if (state == LoginState.FAILED) {
                return LoginOutcome.failed(ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT,
                        "страница браузера закрыта", transitions, mfaVisits);
            }
            if (state == LoginState.UNKNOWN) {
                unknownProbes++;
                if (unknownProbes > limits.maxUnknownProbes()) {
                    log.warn("{} страница не распознана после {} проб, url={}", logPrefix, unknownProbes, ui.currentUrl());
                    return LoginOutcome.failed(ProvisioningModels.ErrorCode.UNRECOGNIZED_PAGE,
                            "страница не распознана", transitions, mfaVisits);
                }
                ui.settle(Duration.ofMillis(limits.settleMs()));
                continue;
            }

            unknownProbes = 0;
            transitions++;
            if (transitions > limits.maxTransitions()) {
                return LoginOutcome.failed(ProvisioningModels.ErrorCode.UNRECOGNIZED_PAGE,
                        "превышено число переходов (" + limits.maxTransitions() + ")", transitions, mfaVisits);
            }

            LoginOutcome failure;
            if (state == LoginState.LOGIN_FORM) {
                loginVisits++;
                if (loginVisits > limits.maxLoginAttempts()) {
                    log.warn("{} форма входа показана повторно {} раз: учётные данные отклонены", logPrefix, loginVisits);
                    return LoginOutcome.failed(ProvisioningModels.ErrorCode.LOGIN_REJECTED,
                            "учётные данные отклонены консолью", transitions, mfaVisits);
                }
                statusListener.accept(ProvisioningModels.JobStatus.AUTHENTICATING);
                failure = submitCredentials(transitions, mfaVisits);
            } else {
                mfaVisits++;
                if (mfaVisits > limits.maxMfaAttempts()) {
                    log.warn("{} запрос кода показан повторно {} раз: код отклонён", logPrefix, mfaVisits);
                    return LoginOutcome.failed(ProvisioningModels.ErrorCode.OTP_REJECTED,
                            "код подтверждения отклонён консолью", transitions, mfaVisits - 1);
                }
                statusListener.accept(ProvisioningModels.JobStatus.AWAITING_MFA);
                failure = passMfa(transitions, mfaVisits);
            }
            if (failure != null) {
                return failure;
            }
        }
    }

    /**
     * Последний запрос кода (для диагностики).
     */
    public OtpChallenge lastChallenge() {
        return lastChallenge;
    }

    private LoginOutcome submitCredentials(int transitions, int otpAttempts) {
        if (loginIdentity == null || loginSecret == null) {
            return LoginOutcome.failed(ProvisioningModels.ErrorCode.LOGIN_REJECTED,
                    "не заданы учётные данные входа", transitions, otpAttempts);
        }
        log.info("{} заполнение формы входа", logPrefix);
        ActionResult<Void> identity = act(UiActions.LOGIN_IDENTITY, rounds(),
                (l, t) -> ui.fill(l.selector(), loginIdentity, t));
        if (!identity.success()) {
            return stepFailed(identity, transitions, otpAttempts);
        }
        ActionResult<Void> secret = act(UiActions.LOGIN_SECRET, rounds(),
                (l, t) -> ui.fill(l.selector(), loginSecret, t));
        if (!secret.success()) {
            return stepFailed(secret, transitions, otpAttempts);
        }
        LoginOutcome submitted = submit(UiActions.LOGIN_SUBMIT, transitions, otpAttempts);
        if (submitted != null) {
            return submitted;
        }
        ui.settle(Duration.ofMillis(config.login().settleMs()));
        return null;
    }

    private LoginOutcome passMfa(int transitions, int otpAttempts) {
        ActionResult<Void> emailOption = act(UiActions.MFA_EMAIL_OPTION, 1, (l, t) -> ui.click(l.selector(), t));
        if (emailOption.fatal()) {
            return stepFailed(emailOption, transitions, otpAttempts);
        }

        Instant sentAt = clock.instant();
        OtpChallenge challenge = new OtpChallenge(jobId, sentAt);
        lastChallenge = challenge;

        ActionResult<Void> send = act(UiActions.MFA_SEND_CODE, 1, (l, t) -> ui.click(l.selector(), t));
        if (send.fatal()) {
            return stepFailed(send, transitions, otpAttempts);
        }
        if (!send.success()) {
            log.info("{} кнопка отправки кода не найдена, код мог быть отправлен автоматически", logPrefix);
        }

        RuntimeConfigStore.MailboxConfig mailbox = config.mailbox();
        Optional<String> code = poller.awaitCode(sentAt, mailbox.pollAttempts(), mailbox.pollInterval());
        if (code.isEmpty()) {
            challenge.expire();
            return LoginOutcome.failed(ProvisioningModels.ErrorCode.OTP_TIMEOUT,
                    "код подтверждения не получен за " + mailbox.pollAttempts() + " попыток", transitions, otpAttempts);
        }
        challenge.received(code.get());
        String value = challenge.consume();

        ActionResult<Void> fill = act(UiActions.MFA_CODE_INPUT, rounds(), (l, t) -> fillCode(l, value, t));
        if (!fill.success()) {
            return stepFailed(fill, transitions, otpAttempts);
        }
        LoginOutcome submitted = submit(UiActions.MFA_SUBMIT, transitions, otpAttempts);
        if (submitted != null) {
            return submitted;
        }
        ui.settle(Duration.ofMillis(config.login().settleMs()));
        return null;
    }

    private StepOutcome<Void> fillCode(UiLocator locator, String code, Duration timeout) {
        if (locator.mode() == UiLocator.FillMode.PER_CHARACTER) {
            return ui.fillPerCharacter(locator.selector(), code, timeout);
        }
        return ui.fill(locator.selector(), code, timeout);
    }

    /**
     * Нажать кнопку отправки; если кнопка не найдена, отправить Enter.
     */
    private LoginOutcome submit(String action, int transitions, int otpAttempts) {
        ActionResult<Void> click = act(action, rounds(), (l, t) -> ui.click(l.selector(), t));
        if (click.success()) {
            return null;
        }
        if (click.fatal()) {
            return stepFailed(click, transitions, otpAttempts);
        }
        log.info("{} кнопка '{}' не найдена, отправка клавишей Enter", logPrefix, action);
        StepOutcome<Void> enter = ui.press(null, ENTER, config.retry().perTryTimeout());
        if (enter.isOk()) {
            return null;
        }
        return LoginOutcome.failed(enter.isFatal()
                        ? ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT
                        : ProvisioningModels.ErrorCode.UI_STEP_EXHAUSTED,
                "не удалось отправить форму: " + enter.reason(), transitions, otpAttempts);
    }

    private ActionResult<Void> act(String action, int rounds,
                                   CandidateAction<Void> candidate) {
        return retry.resolveAndAct(action, strategies.candidates(action), candidate,
                config.retry().perTryTimeout(), rounds);
    }

    private int rounds() {
        return config.retry().maxRounds();
    }

    private LoginOutcome stepFailed(ActionResult<?> r, int transitions, int otpAttempts) {
        ProvisioningModels.ErrorCode code = r.fatal()
                ? ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT
                : ProvisioningModels.ErrorCode.UI_STEP_EXHAUSTED;
        return LoginOutcome.failed(code, "действие '" + r.action() + "' не выполнено: " + r.reason(),
                transitions, otpAttempts);
    }
}
