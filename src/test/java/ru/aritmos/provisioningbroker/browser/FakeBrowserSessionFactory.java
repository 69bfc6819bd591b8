package ru.aritmos.provisioningbroker.browser;

import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Фабрика сессий поверх {@link FakeConsole}.
 */
public class FakeBrowserSessionFactory implements BrowserSessionFactory {

    private final FakeConsole console;
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private boolean failLaunch;

    public FakeBrowserSessionFactory(FakeConsole console) {
        this.console = console;
    }

    public FakeBrowserSessionFactory failLaunch() {
        this.failLaunch = true;
        return this;
    }

    @Override
    public BrowserSession open(RuntimeConfigStore.BrowserConfig config, TokenInterceptor interceptor, String logPrefix) {
        if (failLaunch) {
            throw new FatalEnvironmentException("Executable doesn't exist at /ms-playwright/chromium", null);
        }
        opened.incrementAndGet();
        console.attach(interceptor);
        return new BrowserSession() {
            private boolean done;

            @Override
            public UiSurface ui() {
                return console;
            }

            @Override
            public void close() {
                if (!done) {
                    done = true;
                    closed.incrementAndGet();
                }
            }
        };
    }

    public int opened() {
        return opened.get();
    }

    public int closed() {
        return closed.get();
    }
}
