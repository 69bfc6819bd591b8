package ru.aritmos.provisioningbroker.browser;

import ru.aritmos.provisioningbroker.retry.StepOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Поверхность страницы, с которой работают машина входа и мастер интеграции.
 * <p>
 * Ни один метод не выбрасывает исключений браузера: неуспех возвращается как {@link StepOutcome}
 * с видом RETRYABLE (элемент не найден, таймаут) или FATAL (страница/браузер закрыты).
 */
public interface UiSurface {

    enum StorageArea {
        LOCAL,
        SESSION
    }

    StepOutcome<Void> navigate(String url, Duration timeout);

    String currentUrl();

    /**
     * Мгновенная проверка видимости без ожидания.
     */
    StepOutcome<Boolean> isVisible(String selector);

    StepOutcome<Void> waitVisible(String selector, Duration timeout);

    StepOutcome<Void> click(String selector, Duration timeout);

    StepOutcome<Void> fill(String selector, String value, Duration timeout);

    /**
     * Разложить значение по полям, найденным селектором: символ {@code i} в поле {@code i}.
     */
    StepOutcome<Void> fillPerCharacter(String selector, String value, Duration timeout);

    /**
     * Нажать клавишу. Если {@code selector == null}, клавиша отправляется в элемент с фокусом.
     */
    StepOutcome<Void> press(String selector, String key, Duration timeout);

    StepOutcome<String> readText(String selector, Duration timeout);

    StepOutcome<List<String>> readAllTexts(String selector, Duration timeout);

    StepOutcome<String> readClipboard();

    StepOutcome<Void> clickAt(int x, int y);

    StepOutcome<Void> settle(Duration duration);

    StepOutcome<Map<String, String>> storage(StorageArea area);

    boolean isClosed();
}
