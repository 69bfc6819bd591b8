package ru.aritmos.provisioningbroker.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Сессия Playwright: драйвер, процесс Chromium, изолированный контекст и одна страница.
 * <p>
 * Освобождение идёт в порядке страница, контекст, браузер, драйвер. Ошибка закрытия одного
 * ресурса логируется и не мешает закрыть остальные.
 */
public class PlaywrightBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final UiSurface ui;
    private final String logPrefix;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page, String logPrefix) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.ui = new PlaywrightUiSurface(page);
        this.logPrefix = logPrefix;
    }

    @Override
    public UiSurface ui() {
        return ui;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        release(page, "страница");
        release(context, "контекст");
        release(browser, "браузер");
        release(playwright, "драйвер");
        log.info("{} браузерная сессия закрыта", logPrefix);
    }

    static void release(AutoCloseable resource, String name) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Ошибка закрытия ресурса браузера ({}): {}", name, e.getMessage());
        }
    }
}
