package ru.aritmos.provisioningbroker.retry;

import java.time.Duration;

/**
 * Попытка выполнить действие с конкретным локатором.
 * <p>
 * Реализация сама ждёт появления элемента не дольше {@code perTryTimeout} и затем действует.
 */
@FunctionalInterface
public interface CandidateAction<T> {

    StepOutcome<T> attempt(UiLocator locator, Duration perTryTimeout);
}
