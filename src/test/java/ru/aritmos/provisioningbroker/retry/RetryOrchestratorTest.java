package ru.aritmos.provisioningbroker.retry;

import org.junit.jupiter.api.Test;
import ru.aritmos.provisioningbroker.core.JobDeadline;
import ru.aritmos.provisioningbroker.core.JobTimeoutException;
import ru.aritmos.provisioningbroker.core.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryOrchestratorTest {

    private final List<Duration> pauses = new ArrayList<>();

    private RetryOrchestrator orchestrator() {
        return new RetryOrchestrator(Duration.ofMillis(100), Duration.ofMillis(300), pauses::add,
                JobDeadline.unlimited(), "[TEST]");
    }

    private static List<UiLocator> locators(String... selectors) {
        List<UiLocator> out = new ArrayList<>();
        for (String s : selectors) {
            out.add(UiLocator.of(s));
        }
        return out;
    }

    @Test
    void singleWorkingStrategySucceedsInFirstRound() {
        List<String> calls = new ArrayList<>();
        ActionResult<String> r = orchestrator().resolveAndAct("login.submit", locators("#a", "#b", "#c"),
                (loc, t) -> {
                    calls.add(loc.selector());
                    return "#c".equals(loc.selector()) ? StepOutcome.ok("clicked") : StepOutcome.retryable("нет элемента");
                }, Duration.ofSeconds(1), 3);

        assertTrue(r.success(), "TEST_EXPECTED: рабочая стратегия должна сработать");
        assertEquals(1, r.round(), "TEST_EXPECTED: успех в первом раунде");
        assertEquals(3, r.attempts());
        assertEquals("#c", r.used().selector());
        assertEquals("clicked", r.value());
        assertEquals(List.of("#a", "#b", "#c"), calls);
        assertTrue(pauses.isEmpty(), "TEST_EXPECTED: без пауз при успехе в первом раунде");
    }

    @Test
    void exhaustsExactlyRoundsTimesCandidates() {
        int[] calls = {0};
        ActionResult<Void> r = orchestrator().resolveAndAct("wizard.createButton", locators("#a", "#b"),
                (loc, t) -> {
                    calls[0]++;
                    return StepOutcome.retryable("нет элемента");
                }, Duration.ofSeconds(1), 3);

        assertFalse(r.success());
        assertFalse(r.fatal());
        assertEquals(6, calls[0], "TEST_EXPECTED: ровно maxRounds * N попыток");
        assertEquals(6, r.attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), pauses,
                "TEST_EXPECTED: пауза между раундами растёт экспоненциально, после последнего раунда паузы нет");
    }

    @Test
    void fatalOutcomeStopsImmediately() {
        int[] calls = {0};
        ActionResult<Void> r = orchestrator().resolveAndAct("mfa.submit", locators("#a", "#b", "#c"),
                (loc, t) -> {
                    calls[0]++;
                    return StepOutcome.fatal("страница закрыта");
                }, Duration.ofSeconds(1), 3);

        assertFalse(r.success());
        assertTrue(r.fatal(), "TEST_EXPECTED: фатальный исход прерывает перебор");
        assertEquals(1, calls[0]);
        assertTrue(pauses.isEmpty());
    }

    @Test
    void unexpectedExceptionIsTreatedAsRetryable() {
        ActionResult<Void> r = orchestrator().resolveAndAct("login.identity", locators("#a", "#b"),
                (loc, t) -> {
                    if ("#a".equals(loc.selector())) {
                        throw new IllegalStateException("boom");
                    }
                    return StepOutcome.ok();
                }, Duration.ofSeconds(1), 1);

        assertTrue(r.success());
        assertEquals("#b", r.used().selector());
    }

    @Test
    void emptyStrategiesFailWithoutAttempts() {
        ActionResult<Void> r = orchestrator().resolveAndAct("x", List.of(), (loc, t) -> StepOutcome.ok(),
                Duration.ofSeconds(1), 3);
        assertFalse(r.success());
        assertEquals(0, r.attempts());
    }

    @Test
    void backoffIsCappedByMax() {
        RetryOrchestrator o = orchestrator();
        assertEquals(Duration.ofMillis(100), o.backoff(1));
        assertEquals(Duration.ofMillis(200), o.backoff(2));
        assertEquals(Duration.ofMillis(300), o.backoff(3));
        assertEquals(Duration.ofMillis(300), o.backoff(10));
    }

    @Test
    void expiredDeadlineAbortsBeforeAttempt() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        JobDeadline deadline = JobDeadline.after(Duration.ofSeconds(5), clock);
        int[] calls = {0};
        RetryOrchestrator o = new RetryOrchestrator(Duration.ofSeconds(1), Duration.ofSeconds(10),
                clock::advance, deadline, "[TEST]");

        assertThrows(JobTimeoutException.class, () -> o.resolveAndAct("wizard.tokenText", locators("#a"),
                (loc, t) -> {
                    calls[0]++;
                    return StepOutcome.retryable("нет элемента");
                }, Duration.ofSeconds(1), 10), "TEST_EXPECTED: истёкший срок прерывает перебор");
        // паузы 1+2 с укладываются в срок, после паузы 4 с (итого 7 с) следующая попытка не начинается
        assertEquals(3, calls[0]);
    }
}
