package ru.aritmos.provisioningbroker.wizard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.browser.UiSurface;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.ProvisioningModels;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;
import ru.aritmos.provisioningbroker.retry.ActionResult;
import ru.aritmos.provisioningbroker.retry.CandidateAction;
import ru.aritmos.provisioningbroker.retry.RetryOrchestrator;
import ru.aritmos.provisioningbroker.retry.StepOutcome;
import ru.aritmos.provisioningbroker.retry.StrategyTable;
import ru.aritmos.provisioningbroker.retry.UiActions;
import ru.aritmos.provisioningbroker.retry.UiLocator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Мастер создания приватной интеграции в консоли и извлечение выданного токена.
 * <p>
 * Шаги: переход на страницу интеграций, открытие формы, имя, выбор прав, создание, извлечение токена.
 * Отклонённое консолью право пропускается с предупреждением. Токен читается из диалога результата,
 * затем (если не найден) через буфер обмена и соседние узлы.
 * <p>
 * Экземпляр создаётся на задание.
 */
public class IntegrationWizardDriver {

    private static final Logger log = LoggerFactory.getLogger(IntegrationWizardDriver.class);

    private static final String ENTER = "Enter";
    private static final String SUBMIT_ACTION = "wizard.submit";

    private final UiSurface ui;
    private final RetryOrchestrator retry;
    private final RuntimeConfigStore.RuntimeConfig config;
    private final StrategyTable strategies;
    private final List<String> scopes;
    private final TokenShape shape;
    private final JobDeadline deadline;
    private final String logPrefix;

    private final List<String> accepted = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();

    public IntegrationWizardDriver(UiSurface ui,
                                   RetryOrchestrator retry,
                                   RuntimeConfigStore.RuntimeConfig config,
                                   List<String> scopes,
                                   JobDeadline deadline,
                                   String logPrefix) {
        this.ui = ui;
        this.retry = retry;
        this.config = config == null ? RuntimeConfigStore.RuntimeConfig.defaultConfig() : config;
        this.strategies = this.config.strategies();
        this.scopes = scopes == null || scopes.isEmpty() ? this.config.wizard().scopes() : List.copyOf(scopes);
        this.shape = new TokenShape(this.config.wizard().tokenPrefixes(), this.config.wizard().tokenMinLength());
        this.deadline = deadline == null ? JobDeadline.unlimited() : deadline;
        this.logPrefix = logPrefix == null ? "[WIZARD]" : logPrefix;
    }

    /**
     * Пройти мастер для арендатора.
     *
     * @param tenantHandle идентификатор арендатора в консоли
     */
    public WizardOutcome run(String tenantHandle) {
        RuntimeConfigStore.WizardConfig wizard = config.wizard();
        Duration settle = Duration.ofMillis(wizard.settleMs());

        // NAVIGATE
        deadline.check(WizardStep.NAVIGATE.name());
        String target = config.console().integrationsUrl(tenantHandle);
        if (!onPage(ui.currentUrl(), target)) {
            log.info("{} переход на страницу интеграций: {}", logPrefix, target);
            StepOutcome<Void> nav = ui.navigate(target, Duration.ofMillis(config.browser().navigationTimeoutMs()));
            if (!nav.isOk()) {
                return fail(WizardStep.NAVIGATE, nav.isFatal()
                                ? ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT
                                : ProvisioningModels.ErrorCode.NAVIGATION_FAILED,
                        "не удалось открыть страницу интеграций: " + nav.reason());
            }
        }
        ui.settle(settle);
        ActionResult<Void> marker = act(UiActions.WIZARD_PAGE_MARKER, 1, (l, t) -> ui.waitVisible(l.selector(), t));
        if (marker.fatal()) {
            return stepFailed(WizardStep.NAVIGATE, marker);
        }
        if (!marker.success()) {
            log.info("{} маркер страницы интеграций не найден, продолжаем", logPrefix);
        }

        // OPEN_FORM
        deadline.check(WizardStep.OPEN_FORM.name());
        ActionResult<Void> create = act(UiActions.WIZARD_CREATE_BUTTON, rounds(), (l, t) -> ui.click(l.selector(), t));
        if (!create.success()) {
            return stepFailed(WizardStep.OPEN_FORM, create);
        }
        ui.settle(settle);

        // NAME
        deadline.check(WizardStep.NAME.name());
        ActionResult<Void> name = act(UiActions.WIZARD_NAME_INPUT, rounds(),
                (l, t) -> ui.fill(l.selector(), wizard.integrationName(), t));
        if (!name.success()) {
            return stepFailed(WizardStep.NAME, name);
        }
        ActionResult<Void> next = act(UiActions.WIZARD_NAME_NEXT, 1, (l, t) -> ui.click(l.selector(), t));
        if (next.fatal()) {
            return stepFailed(WizardStep.NAME, next);
        }
        ui.settle(settle);

        // SELECT_SCOPES
        WizardOutcome scopesFailure = selectScopes();
        if (scopesFailure != null) {
            return scopesFailure;
        }

        // SUBMIT
        deadline.check(WizardStep.SUBMIT.name());
        List<UiLocator> submitCandidates = new ArrayList<>(strategies.candidates(UiActions.WIZARD_SUBMIT_PRIMARY));
        submitCandidates.addAll(strategies.candidates(UiActions.WIZARD_SUBMIT_FALLBACK));
        ActionResult<Void> submit = retry.resolveAndAct(SUBMIT_ACTION, submitCandidates,
                (l, t) -> ui.click(l.selector(), t), perTry(), rounds());
        if (!submit.success()) {
            return stepFailed(WizardStep.SUBMIT, submit);
        }
        ui.settle(settle);

        // EXTRACT_TOKEN
        return extractToken();
    }

    private WizardOutcome selectScopes() {
        deadline.check(WizardStep.SELECT_SCOPES.name());
        ActionResult<Void> container = act(UiActions.WIZARD_SCOPE_CONTAINER, 1, (l, t) -> ui.click(l.selector(), t));
        if (container.fatal()) {
            return stepFailed(WizardStep.SELECT_SCOPES, container);
        }
        ActionResult<Void> input = act(UiActions.WIZARD_SCOPE_INPUT, rounds(), (l, t) -> ui.click(l.selector(), t));
        if (!input.success()) {
            return stepFailed(WizardStep.SELECT_SCOPES, input);
        }
        String inputSelector = input.used().selector();
        Duration perTry = perTry();

        for (String scope : scopes) {
            deadline.check(WizardStep.SELECT_SCOPES.name());
            StepOutcome<Void> typed = ui.fill(inputSelector, scope, perTry);
            if (typed.isOk()) {
                typed = ui.press(inputSelector, ENTER, perTry);
            }
            if (typed.isFatal()) {
                return fail(WizardStep.SELECT_SCOPES, ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT, typed.reason());
            }
            if (!typed.isOk()) {
                skip(scope, typed.reason());
                continue;
            }
            List<UiLocator> acceptance = strategies.candidates(UiActions.WIZARD_SCOPE_ACCEPTED).stream()
                    .map(l -> l.withPlaceholder("scope", scope))
                    .toList();
            ActionResult<Void> confirmed = retry.resolveAndAct(UiActions.WIZARD_SCOPE_ACCEPTED, acceptance,
                    (l, t) -> ui.waitVisible(l.selector(), t), perTry, 1);
            if (confirmed.fatal()) {
                return stepFailed(WizardStep.SELECT_SCOPES, confirmed);
            }
            if (confirmed.success()) {
                accepted.add(scope);
            } else {
                skip(scope, "право не появилось в списке выбранных");
            }
        }

        RuntimeConfigStore.WizardConfig wizard = config.wizard();
        StepOutcome<Void> close = ui.clickAt(wizard.clickOutsideX(), wizard.clickOutsideY());
        if (close.isFatal()) {
            return fail(WizardStep.SELECT_SCOPES, ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT, close.reason());
        }
        log.info("{} выбор прав завершён: принято={}, пропущено={}", logPrefix, accepted.size(), skipped);
        return null;
    }

    private WizardOutcome extractToken() {
        deadline.check(WizardStep.EXTRACT_TOKEN.name());
        int extractRounds = config.wizard().extractRounds();

        ActionResult<String> direct = act(UiActions.WIZARD_TOKEN_TEXT, extractRounds, this::readToken);
        if (direct.success()) {
            return extracted(direct.value(), ExtractionPath.DIRECT);
        }
        if (direct.fatal()) {
            return stepFailed(WizardStep.EXTRACT_TOKEN, direct);
        }
        log.info("{} токен в диалоге не найден, пробуем копирование", logPrefix);

        ActionResult<Void> copy = act(UiActions.WIZARD_TOKEN_COPY, 1, (l, t) -> ui.click(l.selector(), t));
        if (copy.fatal()) {
            return stepFailed(WizardStep.EXTRACT_TOKEN, copy);
        }
        if (copy.success()) {
            StepOutcome<String> clip = ui.readClipboard();
            if (clip.isFatal()) {
                return fail(WizardStep.EXTRACT_TOKEN, ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT, clip.reason());
            }
            Optional<String> token = clip.isOk() ? shape.find(clip.value()) : Optional.empty();
            if (token.isPresent()) {
                return extracted(token.get(), ExtractionPath.CLIPBOARD_FALLBACK);
            }
        }

        ActionResult<String> nearby = act(UiActions.WIZARD_TOKEN_NEARBY, 1, this::readToken);
        if (nearby.success()) {
            return extracted(nearby.value(), ExtractionPath.NEARBY_FALLBACK);
        }
        if (nearby.fatal()) {
            return stepFailed(WizardStep.EXTRACT_TOKEN, nearby);
        }
        return fail(WizardStep.EXTRACT_TOKEN, ProvisioningModels.ErrorCode.UI_STEP_EXHAUSTED,
                "токен интеграции не найден ни в диалоге, ни в буфере обмена, ни рядом с кнопкой копирования");
    }

    private StepOutcome<String> readToken(UiLocator locator, Duration timeout) {
        StepOutcome<List<String>> texts = ui.readAllTexts(locator.selector(), timeout);
        if (!texts.isOk()) {
            return texts.failureAs();
        }
        for (String text : texts.value()) {
            Optional<String> token = shape.find(text);
            if (token.isPresent()) {
                return StepOutcome.ok(token.get());
            }
        }
        return StepOutcome.retryable("текст не похож на токен");
    }

    private WizardOutcome extracted(String token, ExtractionPath path) {
        log.info("{} токен интеграции получен (путь {}): {}", logPrefix, path, SensitiveDataSanitizer.preview(token));
        return WizardOutcome.done(token, path, accepted, skipped);
    }

    private void skip(String scope, String reason) {
        skipped.add(scope);
        log.warn("{} право '{}' пропущено: {}", logPrefix, scope, reason);
    }

    private <T> ActionResult<T> act(String action, int rounds, CandidateAction<T> candidate) {
        return retry.resolveAndAct(action, strategies.candidates(action), candidate, perTry(), rounds);
    }

    private Duration perTry() {
        return config.retry().perTryTimeout();
    }

    private int rounds() {
        return config.retry().maxRounds();
    }

    private WizardOutcome stepFailed(WizardStep step, ActionResult<?> r) {
        return fail(step, r.fatal()
                        ? ProvisioningModels.ErrorCode.FATAL_ENVIRONMENT
                        : ProvisioningModels.ErrorCode.UI_STEP_EXHAUSTED,
                "действие '" + r.action() + "' не выполнено: " + r.reason());
    }

    private WizardOutcome fail(WizardStep step, ProvisioningModels.ErrorCode code, String reason) {
        log.warn("{} мастер остановлен на шаге {}: {} ({})", logPrefix, step, code, reason);
        return WizardOutcome.failed(step, accepted, skipped, code, reason);
    }

    static boolean onPage(String current, String target) {
        if (current == null || target == null) {
            return false;
        }
        return trimSlash(current).startsWith(trimSlash(target));
    }

    private static String trimSlash(String url) {
        String u = url.trim().toLowerCase(Locale.ROOT);
        int q = u.indexOf('?');
        if (q >= 0) {
            u = u.substring(0, q);
        }
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
