package ru.aritmos.provisioningbroker.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeConfigValidatorTest {

    private static RuntimeConfigStore.RuntimeConfig withBrowserAndJobs(long launchTimeoutMs, long jobTimeoutSec) {
        RuntimeConfigStore.RuntimeConfig d = RuntimeConfigStore.RuntimeConfig.defaultConfig();
        RuntimeConfigStore.BrowserConfig b = d.browser();
        RuntimeConfigStore.BrowserConfig browser = new RuntimeConfigStore.BrowserConfig(b.headless(), b.launchArgs(),
                b.viewportWidth(), b.viewportHeight(), b.userAgent(), b.blockedResources(), launchTimeoutMs,
                b.navigationTimeoutMs());
        return new RuntimeConfigStore.RuntimeConfig("rev-3", d.console(), d.mailbox(), browser, d.retry(), d.login(),
                d.tokenCapture(), d.wizard(), d.strategies(),
                new RuntimeConfigStore.JobsConfig(jobTimeoutSec, d.jobs().archiveTtlSec()));
    }

    @Test
    void browserLaunchLongerThanJobIsError() {
        RuntimeConfigValidator.Report report = RuntimeConfigValidator.validate(withBrowserAndJobs(120_000, 60));

        assertFalse(report.ok());
        assertTrue(report.errors().get(0).contains("browser.launchTimeoutMs"));
    }

    @Test
    void otpWaitLongerThanJobIsOnlyWarning() {
        RuntimeConfigValidator.Report report = RuntimeConfigValidator.validate(withBrowserAndJobs(10_000, 20));

        assertTrue(report.ok(), "TEST_EXPECTED: ожидание кода может оборваться по таймауту задания: " + report.errors());
        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("Ожидание кода")));
    }

    @Test
    void missingConfigIsSingleError() {
        RuntimeConfigValidator.Report report = RuntimeConfigValidator.validate(null);

        assertEquals(List.of("Пустая конфигурация"), report.errors());
    }
}
