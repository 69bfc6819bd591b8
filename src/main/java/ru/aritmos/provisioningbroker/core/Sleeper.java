package ru.aritmos.provisioningbroker.core;

import java.time.Duration;

/**
 * Пауза между попытками. Выделена в интерфейс, чтобы тесты не ждали реального времени.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    Sleeper SYSTEM = duration -> {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobTimeoutException("Поток задания прерван во время ожидания");
        }
    };
}
