package ru.aritmos.provisioningbroker.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Route;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;

import java.util.List;
import java.util.function.Supplier;

/**
 * Запуск Chromium через Playwright.
 * <p>
 * Порядок: драйвер, браузер с флагами экономии памяти, изолированный контекст (viewport, user agent,
 * доступ к буферу обмена), подписка перехватчика на исходящие запросы, блокировка тяжёлых ресурсов, страница.
 * Перехватчик подключается до создания страницы, то есть до любой навигации.
 * <p>
 * Любая ошибка запуска (распаковка драйвера, установка браузера, старт процесса) считается
 * ошибкой окружения: уже открытые ресурсы освобождаются, наружу уходит {@link FatalEnvironmentException}.
 */
@Singleton
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);

    private static final List<String> CLIPBOARD_PERMISSIONS = List.of("clipboard-read", "clipboard-write");

    private final Supplier<Playwright> driverFactory;

    @Inject
    public PlaywrightBrowserSessionFactory() {
        this(Playwright::create);
    }

    PlaywrightBrowserSessionFactory(Supplier<Playwright> driverFactory) {
        this.driverFactory = driverFactory;
    }

    @Override
    public BrowserSession open(RuntimeConfigStore.BrowserConfig config,
                               TokenInterceptor interceptor,
                               String logPrefix) {
        RuntimeConfigStore.BrowserConfig cfg = config == null
                ? RuntimeConfigStore.BrowserConfig.defaultConfig()
                : config.normalize();
        Playwright playwright = null;
        Browser browser = null;
        BrowserContext context = null;
        try {
            playwright = driverFactory.get();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(Boolean.TRUE.equals(cfg.headless()))
                    .setTimeout(cfg.launchTimeoutMs())
                    .setArgs(cfg.launchArgs()));

            Browser.NewContextOptions options = new Browser.NewContextOptions()
                    .setViewportSize(cfg.viewportWidth(), cfg.viewportHeight())
                    .setPermissions(CLIPBOARD_PERMISSIONS);
            if (cfg.userAgent() != null) {
                options.setUserAgent(cfg.userAgent());
            }
            context = browser.newContext(options);

            if (interceptor != null) {
                context.onRequest(request -> interceptor.onRequest(request.url(), request.allHeaders()));
            }
            for (String pattern : cfg.blockedResources()) {
                context.route(pattern, Route::abort);
            }

            Page page = context.newPage();
            page.setDefaultNavigationTimeout(cfg.navigationTimeoutMs());
            log.info("{} браузер запущен (headless={}, viewport={}x{}, блокируемых шаблонов={})",
                    logPrefix, cfg.headless(), cfg.viewportWidth(), cfg.viewportHeight(), cfg.blockedResources().size());
            return new PlaywrightBrowserSession(playwright, browser, context, page, logPrefix);
        } catch (RuntimeException e) {
            PlaywrightBrowserSession.release(context, "контекст");
            PlaywrightBrowserSession.release(browser, "браузер");
            PlaywrightBrowserSession.release(playwright, "драйвер");
            throw new FatalEnvironmentException("Не удалось запустить браузер: " + e.getMessage(), e);
        }
    }
}
