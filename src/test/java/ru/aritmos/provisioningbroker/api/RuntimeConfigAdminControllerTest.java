package ru.aritmos.provisioningbroker.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.Test;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.retry.StrategyTable;
import ru.aritmos.provisioningbroker.retry.UiActions;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeConfigAdminControllerTest {

    private static RuntimeConfigStore.RuntimeConfig with(RuntimeConfigStore.ConsoleConfig console,
                                                         StrategyTable strategies) {
        RuntimeConfigStore.RuntimeConfig d = RuntimeConfigStore.RuntimeConfig.defaultConfig();
        return new RuntimeConfigStore.RuntimeConfig("rev-2", console, d.mailbox(), d.browser(), d.retry(), d.login(),
                d.tokenCapture(), d.wizard(), strategies, d.jobs()).normalize();
    }

    @Test
    void defaultConfigIsValid() {
        RuntimeConfigAdminController.DryRunResponse r =
                RuntimeConfigAdminController.validate(RuntimeConfigStore.RuntimeConfig.defaultConfig());

        assertTrue(r.ok(), "TEST_EXPECTED: конфигурация по умолчанию проходит проверку: " + r.errors());
        assertEquals("builtin", r.revision());
    }

    @Test
    void brokenRegexAndEmptyStrategyAreErrors() {
        RuntimeConfigStore.RuntimeConfig cfg = with(
                new RuntimeConfigStore.ConsoleConfig("https://console.example.org/{tenant}/", "(unclosed"),
                new StrategyTable("v-test", Map.of(UiActions.MFA_CODE_INPUT, List.of())));

        RuntimeConfigAdminController.DryRunResponse r = RuntimeConfigAdminController.validate(cfg);

        assertFalse(r.ok());
        assertEquals(2, r.errors().size(), "TEST_EXPECTED: ошибка regex и пустая стратегия: " + r.errors());
        assertTrue(r.errors().stream().anyMatch(e -> e.contains(UiActions.MFA_CODE_INPUT)));
    }

    @Test
    void urlTemplateWithoutTenantIsOnlyWarning() {
        RuntimeConfigStore.RuntimeConfig cfg = with(
                new RuntimeConfigStore.ConsoleConfig("https://console.example.org/integrations/", ".*"), null);

        RuntimeConfigAdminController.DryRunResponse r = RuntimeConfigAdminController.validate(cfg);

        assertTrue(r.ok());
        assertTrue(r.warnings().stream().anyMatch(w -> w.contains("{tenant}")));
    }

    @Test
    void saveRejectsInvalidConfigAndKeepsEffective() {
        RuntimeConfigStore store = new RuntimeConfigStore(null, null, null, "unused", false, "/unused");
        RuntimeConfigAdminController controller = new RuntimeConfigAdminController(store);
        RuntimeConfigStore.RuntimeConfig bad = with(
                new RuntimeConfigStore.ConsoleConfig("https://console.example.org/{tenant}/", "(unclosed"), null);

        HttpResponse<RuntimeConfigAdminController.SaveResponse> resp = controller.save(bad, "qa", "broken");

        assertEquals(HttpStatus.BAD_REQUEST, resp.getStatus());
        assertEquals("builtin", store.getEffective().revision());
        assertTrue(store.getAuditTrail(10).isEmpty(), "TEST_EXPECTED: отклонённое изменение не попадает в аудит");
    }

    @Test
    void saveAppliesValidConfig() {
        RuntimeConfigStore store = new RuntimeConfigStore(null, null, null, "unused", false, "/unused");
        RuntimeConfigAdminController controller = new RuntimeConfigAdminController(store);

        HttpResponse<RuntimeConfigAdminController.SaveResponse> resp = controller.save(
                with(RuntimeConfigStore.ConsoleConfig.defaultConfig(), null), "qa", "tuning");

        assertEquals(HttpStatus.OK, resp.getStatus());
        assertEquals("rev-2", store.getEffective().revision());
        assertEquals(1, controller.audit(null).items().size());
    }
}
