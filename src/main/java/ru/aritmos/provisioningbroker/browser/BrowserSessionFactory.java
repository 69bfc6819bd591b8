package ru.aritmos.provisioningbroker.browser;

import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;

/**
 * Фабрика браузерных сессий.
 */
public interface BrowserSessionFactory {

    /**
     * Открыть сессию. Перехватчик должен быть подключён до первой навигации.
     *
     * @throws FatalEnvironmentException если браузер не удалось запустить
     */
    BrowserSession open(RuntimeConfigStore.BrowserConfig config, TokenInterceptor interceptor, String logPrefix);
}
