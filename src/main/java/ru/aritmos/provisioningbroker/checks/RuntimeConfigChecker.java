package ru.aritmos.provisioningbroker.checks;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.config.RuntimeConfigValidator;

/**
 * Проверка runtime-конфигурации, с которой будут выполняться задания.
 * <p>
 * Если включён remote-config, сначала проверяется доступность источника.
 * Затем effective-конфигурация проходит ту же валидацию, что и сохранение через admin API:
 * от регулярных выражений до таймаута запуска браузера.
 */
@Singleton
public class RuntimeConfigChecker {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfigChecker.class);

    private final RuntimeConfigStore configStore;

    public RuntimeConfigChecker(RuntimeConfigStore configStore) {
        this.configStore = configStore;
    }

    public void check(StartupChecksConfiguration.CheckConfig cfg) {
        if (configStore.isRemoteEnabled()) {
            configStore.assertRemoteAvailable();
        }
        RuntimeConfigStore.RuntimeConfig effective = configStore.getEffective();
        RuntimeConfigValidator.Report report = RuntimeConfigValidator.validate(effective);
        for (String warning : report.warnings()) {
            log.warn("Runtime-конфигурация (revision={}): {}", effective.revision(), warning);
        }
        if (!report.ok()) {
            throw new IllegalStateException("Runtime-конфигурация revision=" + effective.revision()
                    + " непригодна для заданий: " + String.join("; ", report.errors()));
        }
    }
}
