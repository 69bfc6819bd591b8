package ru.aritmos.provisioningbroker.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Крайний срок выполнения задания.
 */
public final class JobDeadline {

    private final Instant deadline;
    private final Clock clock;

    private JobDeadline(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static JobDeadline after(Duration timeout, Clock clock) {
        Clock c = clock == null ? Clock.systemUTC() : clock;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return new JobDeadline(null, c);
        }
        return new JobDeadline(c.instant().plus(timeout), c);
    }

    public static JobDeadline unlimited() {
        return new JobDeadline(null, Clock.systemUTC());
    }

    /**
     * Проверить срок.
     *
     * @param stage шаг, на котором выполняется проверка (для сообщения)
     * @throws JobTimeoutException если срок истёк
     */
    public void check(String stage) {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new JobTimeoutException("Истёк таймаут задания на шаге " + stage);
        }
    }
}
