package ru.aritmos.provisioningbroker.retry;

import java.util.List;

/**
 * Итог {@link RetryOrchestrator#resolveAndAct}.
 *
 * @param action   логическое действие
 * @param success  удалось ли выполнить действие хотя бы одной стратегией
 * @param value    значение, возвращённое успешной стратегией
 * @param used     сработавший локатор (null при неуспехе)
 * @param round    раунд, в котором достигнут результат (1..maxRounds)
 * @param attempts общее число попыток
 * @param tried    селекторы, которые пробовались (по порядку, без повторов)
 * @param fatal    прерван ли перебор фатальным исходом
 * @param reason   причина неуспеха
 */
public record ActionResult<T>(String action,
                              boolean success,
                              T value,
                              UiLocator used,
                              int round,
                              int attempts,
                              List<String> tried,
                              boolean fatal,
                              String reason) {
}
