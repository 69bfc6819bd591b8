package ru.aritmos.provisioningbroker.retry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Один локатор стратегии поиска UI-элемента.
 * <p>
 * В runtime-конфигурации локатор может быть задан строкой (селектор Playwright: CSS, text=, XPath)
 * или объектом {@code {"selector": "...", "mode": "PER_CHARACTER"}}.
 *
 * @param selector селектор Playwright
 * @param mode     способ ввода значения в найденный элемент
 */
public record UiLocator(String selector, FillMode mode) {

    /**
     * Способ ввода.
     */
    public enum FillMode {
        /** значение вводится в одно поле целиком */
        SINGLE,
        /** значение раскладывается по отдельным полям, по одному символу на поле */
        PER_CHARACTER
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public UiLocator(@JsonProperty("selector") String selector,
                     @JsonProperty("mode") FillMode mode) {
        this.selector = selector == null ? null : selector.trim();
        this.mode = mode == null ? FillMode.SINGLE : mode;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UiLocator of(String selector) {
        return new UiLocator(selector, FillMode.SINGLE);
    }

    public static UiLocator perCharacter(String selector) {
        return new UiLocator(selector, FillMode.PER_CHARACTER);
    }

    /**
     * Подставить значение в шаблон селектора ({@code {scope}} и т.п.).
     */
    public UiLocator withPlaceholder(String placeholder, String value) {
        if (selector == null || placeholder == null) {
            return this;
        }
        return new UiLocator(selector.replace("{" + placeholder + "}", value == null ? "" : value), mode);
    }
}
