package ru.aritmos.provisioningbroker.browser;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Владелец жизненного цикла браузерных сессий.
 * <p>
 * {@link #withSession} гарантирует закрытие сессии на любом пути выхода, включая исключения.
 */
@Singleton
public class BrowserSessionController {

    private static final Logger log = LoggerFactory.getLogger(BrowserSessionController.class);

    private final BrowserSessionFactory factory;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public BrowserSessionController(BrowserSessionFactory factory) {
        this.factory = factory;
    }

    /**
     * Открыть сессию. Вызывающий обязан закрыть её.
     */
    public BrowserSession acquire(RuntimeConfigStore.BrowserConfig config, TokenInterceptor interceptor, String logPrefix) {
        BrowserSession session = factory.open(config, interceptor, logPrefix);
        activeSessions.incrementAndGet();
        return session;
    }

    /**
     * Выполнить работу в новой сессии и освободить её.
     */
    public <R> R withSession(RuntimeConfigStore.BrowserConfig config,
                             TokenInterceptor interceptor,
                             String logPrefix,
                             Function<UiSurface, R> work) {
        BrowserSession session = acquire(config, interceptor, logPrefix);
        try {
            return work.apply(session.ui());
        } finally {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("{} ошибка освобождения браузерной сессии: {}", logPrefix, e.getMessage());
            }
            activeSessions.decrementAndGet();
        }
    }

    /**
     * Число открытых сессий.
     */
    public int activeSessions() {
        return activeSessions.get();
    }
}
