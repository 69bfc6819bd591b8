package ru.aritmos.provisioningbroker.retry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ru.aritmos.provisioningbroker.retry.UiActions.*;

/**
 * Версионированная таблица стратегий поиска UI-элементов.
 * <p>
 * Разметка целевой консоли не является контрактом и меняется между запусками, поэтому локаторы
 * вынесены в runtime-конфигурацию: их можно поправить через Admin API без пересборки.
 * Таблица не сохраняется в БД и живёт только в effective-конфигурации.
 * <p>
 * Порядок локаторов в списке значим: более специфичные идут первыми.
 *
 * @param version версия таблицы (для логов и аудита)
 * @param actions действие -&gt; упорядоченный список локаторов
 */
public record StrategyTable(String version, Map<String, List<UiLocator>> actions) {

    /**
     * Кандидаты для действия (пустой список, если действие не описано).
     */
    public List<UiLocator> candidates(String action) {
        if (actions == null || action == null) {
            return List.of();
        }
        List<UiLocator> list = actions.get(action);
        return list == null ? List.of() : list;
    }

    /**
     * Дополнить таблицу значениями по умолчанию для действий, не описанных в конфигурации.
     */
    public StrategyTable normalize() {
        StrategyTable defaults = defaults();
        Map<String, List<UiLocator>> merged = new LinkedHashMap<>(defaults.actions());
        if (actions != null) {
            for (Map.Entry<String, List<UiLocator>> e : actions.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) {
                    continue;
                }
                List<UiLocator> cleaned = e.getValue().stream()
                        .filter(l -> l != null && l.selector() != null && !l.selector().isBlank())
                        .toList();
                merged.put(e.getKey(), cleaned);
            }
        }
        String v = (version == null || version.isBlank()) ? defaults.version() : version.trim();
        return new StrategyTable(v, Map.copyOf(merged));
    }

    /**
     * Таблица по умолчанию, собранная по наблюдаемой разметке консоли.
     */
    public static StrategyTable defaults() {
        Map<String, List<UiLocator>> m = new LinkedHashMap<>();

        m.put(PROBE_LOGIN_FORM, single("input[type=\"password\"]"));
        m.put(PROBE_MFA_CHALLENGE, single(
                "text=Verify Security Code",
                "text=Send code to email",
                "input[maxlength=\"1\"]",
                "input[name*=\"otp\"]"));

        m.put(LOGIN_IDENTITY, single(
                "input[type=\"email\"]",
                "input[name=\"email\"]",
                "#email",
                "//input[@placeholder='Your email address']"));
        m.put(LOGIN_SECRET, single(
                "input[type=\"password\"]",
                "input[name=\"password\"]",
                "#password"));
        m.put(LOGIN_SUBMIT, single(
                "button:has-text(\"Sign in\")",
                "button[type=\"submit\"]",
                "text=Log in"));

        m.put(MFA_EMAIL_OPTION, single(
                "text=\"Email\"",
                "button:has-text(\"Email\")",
                "label:has-text(\"Email\")",
                "input[value=\"email\"]"));
        m.put(MFA_SEND_CODE, single(
                "text=\"Send Security Code\"",
                "button:has-text(\"Send Security Code\")",
                "button:has-text(\"Send\")",
                "[data-testid=\"send-code\"]"));
        m.put(MFA_CODE_INPUT, List.of(
                UiLocator.perCharacter("input[maxlength=\"1\"]"),
                UiLocator.perCharacter("input[type=\"text\"][maxlength=\"1\"]"),
                UiLocator.perCharacter(".otp-digit"),
                UiLocator.perCharacter(".digit-input"),
                UiLocator.perCharacter("[data-testid=\"digit-input\"]"),
                UiLocator.perCharacter("input[class*=\"digit\"]"),
                UiLocator.perCharacter("input[id*=\"digit\"]"),
                UiLocator.of("input[name*=\"code\"]"),
                UiLocator.of("input[name*=\"otp\"]"),
                UiLocator.of("input[placeholder*=\"code\"]"),
                UiLocator.of(".otp-input"),
                UiLocator.of("[data-testid=\"otp-input\"]")));
        m.put(MFA_SUBMIT, single(
                "button[type=\"submit\"]",
                "text=\"Verify\"",
                "text=\"Continue\"",
                "text=\"Confirm\""));

        m.put(WIZARD_PAGE_MARKER, single("text=Private Integrations"));
        m.put(WIZARD_CREATE_BUTTON, single(
                "text=Create new integration",
                ".n-button:has-text('Create new integration')",
                "#no-apps-found-btn-positive-action",
                "button:has-text('Create new integration')",
                "//span[contains(text(),'Create new integration')]/parent::button"));
        m.put(WIZARD_NAME_INPUT, single(
                "input[placeholder*=\"name\"]",
                "input[name=\"name\"]",
                "form input[type=\"text\"]"));
        m.put(WIZARD_NAME_NEXT, single(
                "button:has-text(\"Next\")",
                "button:has-text(\"Continue\")",
                "button[type=\"submit\"]"));
        m.put(WIZARD_SCOPE_CONTAINER, single(
                "div.n-base-selection",
                "div.vs__dropdown-toggle"));
        m.put(WIZARD_SCOPE_INPUT, single(
                "//input[@placeholder='Search scopes...']",
                "//div[contains(@class,'n-base-selection-input-tag')]//input",
                "//div[contains(@class,'vs__dropdown-toggle')]//input"));
        m.put(WIZARD_SCOPE_ACCEPTED, single(
                ".n-tag:has-text(\"{scope}\")",
                ".vs__selected:has-text(\"{scope}\")"));
        m.put(WIZARD_SUBMIT_PRIMARY, single(
                "//div[contains(@class,'n-card__footer')]//button[2]/span"));
        m.put(WIZARD_SUBMIT_FALLBACK, single(
                "//*[@id='btn-next']/span",
                "button:has-text(\"Create\")"));
        m.put(WIZARD_TOKEN_TEXT, single(
                "pre",
                "code",
                "div[class*='token']",
                "textarea"));
        m.put(WIZARD_TOKEN_COPY, single(
                "button:has-text(\"Copy\")",
                "[data-testid=\"copy-token\"]",
                ".copy-btn"));
        m.put(WIZARD_TOKEN_NEARBY, single(
                "//button[contains(.,'Copy')]/preceding-sibling::p",
                "p"));

        return new StrategyTable("builtin-1", Map.copyOf(m));
    }

    private static List<UiLocator> single(String... selectors) {
        return java.util.Arrays.stream(selectors).map(UiLocator::of).toList();
    }
}
