package ru.aritmos.provisioningbroker.config;

import ru.aritmos.provisioningbroker.retry.UiActions;
import ru.aritmos.provisioningbroker.retry.UiLocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Проверка runtime-конфигурации перед применением.
 * <p>
 * Ошибки делают конфигурацию непригодной для заданий (задание гарантированно упадёт),
 * предупреждения лишь сообщают о подозрительных значениях.
 * Используется admin API (dry-run и сохранение) и стартовой проверкой effective-конфигурации.
 */
public final class RuntimeConfigValidator {

    static final List<String> REQUIRED_ACTIONS = List.of(UiActions.LOGIN_IDENTITY, UiActions.LOGIN_SECRET,
            UiActions.MFA_CODE_INPUT, UiActions.WIZARD_CREATE_BUTTON, UiActions.WIZARD_SCOPE_INPUT,
            UiActions.WIZARD_TOKEN_TEXT);

    private RuntimeConfigValidator() {
    }

    public static Report validate(RuntimeConfigStore.RuntimeConfig cfg) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (cfg == null) {
            errors.add("Пустая конфигурация");
            return new Report(errors, warnings);
        }
        if (cfg.revision() == null || cfg.revision().isBlank() || "unknown".equalsIgnoreCase(cfg.revision())) {
            warnings.add("Рекомендуется явно задавать revision для runtime-конфигурации");
        }

        compile("console.destinationUrlPattern", cfg.console().destinationUrlPattern(), errors);
        if (!cfg.console().integrationsUrlTemplate().contains("{tenant}")) {
            warnings.add("console.integrationsUrlTemplate не содержит {tenant}: все арендаторы получат один URL");
        }

        for (String p : cfg.mailbox().codePatterns()) {
            compile("mailbox.codePatterns", p, errors);
        }
        if (cfg.mailbox().senders().isEmpty()) {
            warnings.add("mailbox.senders пуст: коды будут приниматься от любого отправителя");
        }
        long jobTimeoutMs = cfg.jobs().jobTimeoutSec() * 1000L;
        long otpWaitMs = cfg.mailbox().pollAttempts() * cfg.mailbox().pollIntervalMs();
        if (otpWaitMs >= jobTimeoutMs) {
            warnings.add("Ожидание кода в почте (" + otpWaitMs + " мс) не укладывается в jobs.jobTimeoutSec");
        }

        if (cfg.browser().launchTimeoutMs() >= jobTimeoutMs) {
            errors.add("browser.launchTimeoutMs превышает время задания (jobs.jobTimeoutSec)");
        }

        Map<String, List<UiLocator>> actions = cfg.strategies().actions();
        for (String required : REQUIRED_ACTIONS) {
            if (actions.get(required) == null || actions.get(required).isEmpty()) {
                errors.add("Для действия '" + required + "' не задано ни одной стратегии");
            }
        }
        if (cfg.wizard().tokenPrefixes().isEmpty()) {
            warnings.add("wizard.tokenPrefixes пуст: токеном будет считаться любая длинная строка");
        }
        return new Report(errors, warnings);
    }

    private static void compile(String field, String regex, List<String> errors) {
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            errors.add(field + ": некорректное регулярное выражение '" + regex + "'");
        }
    }

    public record Report(List<String> errors, List<String> warnings) {

        public Report {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean ok() {
            return errors.isEmpty();
        }
    }
}
