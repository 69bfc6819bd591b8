package ru.aritmos.provisioningbroker.retry;

/**
 * Результат одного UI-действия.
 * <p>
 * Вместо исключений каждое действие над страницей возвращает типизированный исход:
 * <ul>
 *   <li>{@link Kind#OK}: действие выполнено;</li>
 *   <li>{@link Kind#RETRYABLE}: селектор не найден или не успел появиться, можно пробовать другую стратегию;</li>
 *   <li>{@link Kind#FATAL}: страница/браузер закрыты, продолжать бессмысленно.</li>
 * </ul>
 * Логика повторов анализирует только {@link #kind()}, текст ошибки используется исключительно для логов.
 *
 * @param kind   вид исхода
 * @param value  значение (для операций чтения)
 * @param reason краткая причина неуспеха (без секретов)
 * @param <T>    тип значения
 */
public record StepOutcome<T>(Kind kind, T value, String reason) {

    public enum Kind {
        OK,
        RETRYABLE,
        FATAL
    }

    public static StepOutcome<Void> ok() {
        return new StepOutcome<>(Kind.OK, null, null);
    }

    public static <T> StepOutcome<T> ok(T value) {
        return new StepOutcome<>(Kind.OK, value, null);
    }

    public static <T> StepOutcome<T> retryable(String reason) {
        return new StepOutcome<>(Kind.RETRYABLE, null, reason);
    }

    public static <T> StepOutcome<T> fatal(String reason) {
        return new StepOutcome<>(Kind.FATAL, null, reason);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    /**
     * Перенести неуспех в исход другого типа (значение при этом не переносится).
     */
    public <R> StepOutcome<R> failureAs() {
        return new StepOutcome<>(kind, null, reason);
    }
}
