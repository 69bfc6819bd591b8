package ru.aritmos.provisioningbroker.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import ru.aritmos.provisioningbroker.retry.StepOutcome;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link UiSurface} поверх страницы Playwright.
 * <p>
 * Объект привязан к потоку задания, как и сама страница.
 */
public class PlaywrightUiSurface implements UiSurface {

    private static final String READ_VALUES_JS =
            "els => els.map(e => (typeof e.value === 'string' && e.value) ? e.value : (e.innerText || e.textContent || ''))";

    private static final String READ_STORAGE_JS =
            "area => { const s = area === 'local' ? window.localStorage : window.sessionStorage; const o = {};"
                    + " for (let i = 0; i < s.length; i++) { const k = s.key(i); o[k] = s.getItem(k); } return o; }";

    private static final double DEFAULT_TIMEOUT_MS = 3000;

    private final Page page;

    public PlaywrightUiSurface(Page page) {
        this.page = page;
    }

    @Override
    public StepOutcome<Void> navigate(String url, Duration timeout) {
        return guard(() -> {
            page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(ms(timeout))
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            return StepOutcome.ok();
        });
    }

    @Override
    public String currentUrl() {
        if (page.isClosed()) {
            return null;
        }
        return page.url();
    }

    @Override
    public StepOutcome<Boolean> isVisible(String selector) {
        return guard(() -> StepOutcome.ok(page.locator(selector).first().isVisible()));
    }

    @Override
    public StepOutcome<Void> waitVisible(String selector, Duration timeout) {
        return guard(() -> {
            waitFor(page.locator(selector).first(), timeout);
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Void> click(String selector, Duration timeout) {
        return guard(() -> {
            Locator l = page.locator(selector).first();
            waitFor(l, timeout);
            l.click(new Locator.ClickOptions().setTimeout(ms(timeout)));
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Void> fill(String selector, String value, Duration timeout) {
        return guard(() -> {
            Locator l = page.locator(selector).first();
            waitFor(l, timeout);
            l.fill(value, new Locator.FillOptions().setTimeout(ms(timeout)));
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Void> fillPerCharacter(String selector, String value, Duration timeout) {
        return guard(() -> {
            Locator all = page.locator(selector);
            waitFor(all.first(), timeout);
            int count = all.count();
            if (count < value.length()) {
                return StepOutcome.retryable("полей " + count + " меньше, чем символов " + value.length());
            }
            for (int i = 0; i < value.length(); i++) {
                all.nth(i).fill(String.valueOf(value.charAt(i)), new Locator.FillOptions().setTimeout(ms(timeout)));
            }
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Void> press(String selector, String key, Duration timeout) {
        return guard(() -> {
            if (selector == null) {
                page.keyboard().press(key);
            } else {
                page.locator(selector).first().press(key, new Locator.PressOptions().setTimeout(ms(timeout)));
            }
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<String> readText(String selector, Duration timeout) {
        StepOutcome<List<String>> all = readAllTexts(selector, timeout);
        if (!all.isOk()) {
            return all.failureAs();
        }
        return all.value().isEmpty() ? StepOutcome.retryable("текст не найден") : StepOutcome.ok(all.value().get(0));
    }

    @Override
    public StepOutcome<List<String>> readAllTexts(String selector, Duration timeout) {
        return guard(() -> {
            Locator all = page.locator(selector);
            waitFor(all.first(), timeout);
            Object raw = all.evaluateAll(READ_VALUES_JS);
            List<String> out = new ArrayList<>();
            if (raw instanceof List<?> list) {
                for (Object o : list) {
                    if (o != null) {
                        out.add(o.toString());
                    }
                }
            }
            return StepOutcome.ok(out);
        });
    }

    @Override
    public StepOutcome<String> readClipboard() {
        return guard(() -> {
            Object raw = page.evaluate("() => navigator.clipboard.readText()");
            return raw == null ? StepOutcome.retryable("буфер обмена пуст") : StepOutcome.ok(raw.toString());
        });
    }

    @Override
    public StepOutcome<Void> clickAt(int x, int y) {
        return guard(() -> {
            page.mouse().click(x, y);
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Void> settle(Duration duration) {
        return guard(() -> {
            page.waitForTimeout(ms(duration));
            return StepOutcome.ok();
        });
    }

    @Override
    public StepOutcome<Map<String, String>> storage(StorageArea area) {
        return guard(() -> {
            Object raw = page.evaluate(READ_STORAGE_JS, area == StorageArea.LOCAL ? "local" : "session");
            Map<String, String> out = new LinkedHashMap<>();
            if (raw instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (e.getKey() != null && e.getValue() != null) {
                        out.put(e.getKey().toString(), e.getValue().toString());
                    }
                }
            }
            return StepOutcome.ok(out);
        });
    }

    @Override
    public boolean isClosed() {
        return page.isClosed();
    }

    private <T> StepOutcome<T> guard(Supplier<StepOutcome<T>> call) {
        if (page.isClosed()) {
            return StepOutcome.fatal("страница закрыта");
        }
        try {
            return call.get();
        } catch (TimeoutError e) {
            return StepOutcome.retryable("таймаут: " + firstLine(e.getMessage()));
        } catch (PlaywrightException e) {
            if (page.isClosed() || isTargetClosed(e)) {
                return StepOutcome.fatal("браузер закрыт: " + firstLine(e.getMessage()));
            }
            return StepOutcome.retryable(firstLine(e.getMessage()));
        }
    }

    private static void waitFor(Locator l, Duration timeout) {
        l.waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.VISIBLE)
                .setTimeout(ms(timeout)));
    }

    static boolean isTargetClosed(PlaywrightException e) {
        String m = e.getMessage();
        if (m == null) {
            return false;
        }
        String s = m.toLowerCase(Locale.ROOT);
        return s.contains("target closed") || s.contains("has been closed") || s.contains("browser has disconnected");
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "ошибка Playwright";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static double ms(Duration d) {
        return d == null ? DEFAULT_TIMEOUT_MS : d.toMillis();
    }
}
