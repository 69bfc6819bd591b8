package ru.aritmos.provisioningbroker.browser;

/**
 * Изолированная браузерная сессия одного задания.
 * <p>
 * {@link #close()} идемпотентен и не выбрасывает исключений.
 */
public interface BrowserSession extends AutoCloseable {

    UiSurface ui();

    @Override
    void close();
}
