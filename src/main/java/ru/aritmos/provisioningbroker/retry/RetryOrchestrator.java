package ru.aritmos.provisioningbroker.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.JobTimeoutException;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;
import ru.aritmos.provisioningbroker.core.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Перебор стратегий поиска UI-элемента с раундами и экспоненциальной паузой.
 * <p>
 * Один раунд = по одной попытке на каждый локатор. Если в раунде не сработал ни один,
 * выполняется пауза {@code base * 2^(round-1)} (не больше {@code maxBackoff}) и начинается следующий раунд.
 * <p>
 * Гарантии:
 * <ul>
 *   <li>при одном рабочем локаторе из N успех достигается в первом раунде;</li>
 *   <li>при отсутствии рабочих локаторов итоговый отказ наступает ровно после {@code maxRounds * N} попыток;</li>
 *   <li>исход {@link StepOutcome.Kind#FATAL} прекращает перебор немедленно;</li>
 *   <li>перед каждой попыткой проверяется срок задания.</li>
 * </ul>
 * Экземпляр создаётся на задание и используется из одного потока.
 */
public class RetryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;
    private final JobDeadline deadline;
    private final String logPrefix;

    public RetryOrchestrator(Duration baseBackoff,
                             Duration maxBackoff,
                             Sleeper sleeper,
                             JobDeadline deadline,
                             String logPrefix) {
        this.baseBackoff = baseBackoff == null ? Duration.ofMillis(250) : baseBackoff;
        this.maxBackoff = maxBackoff == null ? Duration.ofSeconds(5) : maxBackoff;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.deadline = deadline == null ? JobDeadline.unlimited() : deadline;
        this.logPrefix = logPrefix == null ? "[RETRY]" : logPrefix;
    }

    /**
     * Выполнить действие, перебирая стратегии.
     *
     * @param action          логическое имя действия (для логов)
     * @param strategies      упорядоченный список локаторов
     * @param candidateAction попытка для одного локатора
     * @param perTryTimeout   ожидание элемента в одной попытке
     * @param maxRounds       число раундов (минимум 1)
     * @return итог перебора (никогда не {@code null})
     */
    public <T> ActionResult<T> resolveAndAct(String action,
                                             List<UiLocator> strategies,
                                             CandidateAction<T> candidateAction,
                                             Duration perTryTimeout,
                                             int maxRounds) {
        List<UiLocator> candidates = strategies == null ? List.of() : strategies;
        int rounds = Math.max(1, maxRounds);
        Set<String> tried = new LinkedHashSet<>();
        if (candidates.isEmpty()) {
            log.warn("{} для действия '{}' не задано ни одной стратегии", logPrefix, action);
            return new ActionResult<>(action, false, null, null, 0, 0, List.of(), false, "нет стратегий");
        }

        int attempts = 0;
        String lastReason = null;
        for (int round = 1; round <= rounds; round++) {
            for (UiLocator locator : candidates) {
                deadline.check(action);
                attempts++;
                tried.add(locator.selector());

                StepOutcome<T> outcome;
                try {
                    outcome = candidateAction.attempt(locator, perTryTimeout);
                } catch (JobTimeoutException e) {
                    throw e;
                } catch (RuntimeException e) {
                    // Неожиданная ошибка реализации попытки: считаем её повторяемой для данного локатора.
                    outcome = StepOutcome.retryable(e.getClass().getSimpleName() + ": " + e.getMessage());
                }
                if (outcome == null) {
                    outcome = StepOutcome.retryable("пустой исход");
                }

                if (outcome.isOk()) {
                    if (round > 1 || attempts > 1) {
                        log.info("{} действие '{}' выполнено стратегией '{}' (раунд {}, попытка {})",
                                logPrefix, action, locator.selector(), round, attempts);
                    } else {
                        log.debug("{} действие '{}' выполнено стратегией '{}'", logPrefix, action, locator.selector());
                    }
                    return new ActionResult<>(action, true, outcome.value(), locator, round, attempts,
                            List.copyOf(tried), false, null);
                }

                lastReason = SensitiveDataSanitizer.sanitizeText(outcome.reason());
                if (outcome.isFatal()) {
                    log.warn("{} действие '{}' прервано фатальной ошибкой на стратегии '{}': {}",
                            logPrefix, action, locator.selector(), lastReason);
                    return new ActionResult<>(action, false, null, null, round, attempts,
                            List.copyOf(tried), true, lastReason);
                }
                log.debug("{} стратегия '{}' для '{}' не сработала: {}", logPrefix, locator.selector(), action, lastReason);
            }

            if (round < rounds) {
                Duration pause = backoff(round);
                log.debug("{} раунд {}/{} для '{}' неуспешен, пауза {} мс", logPrefix, round, rounds, action, pause.toMillis());
                sleeper.sleep(pause);
            }
        }

        log.warn("{} действие '{}' не выполнено: раундов={}, попыток={}, стратегии={}, последняя причина: {}",
                logPrefix, action, rounds, attempts, tried, lastReason);
        return new ActionResult<>(action, false, null, null, rounds, attempts,
                new ArrayList<>(tried), false, lastReason == null ? "стратегии исчерпаны" : lastReason);
    }

    Duration backoff(int round) {
        long base = Math.max(1, baseBackoff.toMillis());
        long max = Math.max(base, maxBackoff.toMillis());

        // Экспоненциальный рост: base * 2^(round-1)
        long delay = base * (1L << Math.min(20, Math.max(0, round - 1)));
        if (delay > max) {
            delay = max;
        }
        return Duration.ofMillis(delay);
    }
}
