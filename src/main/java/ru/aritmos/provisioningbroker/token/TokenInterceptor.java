package ru.aritmos.provisioningbroker.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Пассивный перехватчик токенов из исходящих запросов браузера.
 * <p>
 * Подключается к контексту браузера до первой навигации и для каждого запроса просматривает
 * фиксированный набор заголовков:
 * <ul>
 *   <li>{@code authorization: Bearer ...} -&gt; {@link TokenKind#BEARER};</li>
 *   <li>заголовок идентичности сессии ({@code token-id}) -&gt; {@link TokenKind#SESSION}.</li>
 * </ul>
 * Для каждого вида выигрывает первое найденное значение, последующие игнорируются.
 * Обработчик не блокирует и не изменяет запрос.
 * <p>
 * Экземпляр создаётся на задание. Состояние хранится в {@link AtomicReference}, поэтому снимок
 * можно читать из любого потока.
 */
public class TokenInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TokenInterceptor.class);

    private static final String BEARER_PREFIX = "bearer ";

    private final RuntimeConfigStore.TokenCaptureConfig config;
    private final StorageTokenScraper scraper;
    private final Clock clock;
    private final String logPrefix;
    private final Map<TokenKind, AtomicReference<CapturedToken>> slots;

    public TokenInterceptor(RuntimeConfigStore.TokenCaptureConfig config,
                            StorageTokenScraper scraper,
                            Clock clock,
                            String logPrefix) {
        this.config = config == null ? RuntimeConfigStore.TokenCaptureConfig.defaultConfig() : config;
        this.scraper = scraper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.logPrefix = logPrefix == null ? "[TOKENS]" : logPrefix;
        Map<TokenKind, AtomicReference<CapturedToken>> m = new EnumMap<>(TokenKind.class);
        for (TokenKind k : TokenKind.values()) {
            m.put(k, new AtomicReference<>());
        }
        this.slots = Collections.unmodifiableMap(m);
    }

    /**
     * Обработать исходящий запрос.
     *
     * @param url     URL запроса
     * @param headers заголовки запроса (регистр имён не важен)
     */
    public void onRequest(String url, Map<String, String> headers) {
        if (headers == null || headers.isEmpty() || !hostAllowed(url)) {
            return;
        }
        String bearerHeader = config.bearerHeader().toLowerCase(Locale.ROOT);
        String sessionHeader = config.sessionHeader().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                continue;
            }
            String name = e.getKey().toLowerCase(Locale.ROOT);
            String value = e.getValue().trim();
            if (name.equals(bearerHeader)) {
                if (value.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
                    offer(TokenKind.BEARER, value.substring(BEARER_PREFIX.length()).trim(), CapturedToken.Source.INTERCEPTED);
                }
            } else if (name.equals(sessionHeader)) {
                offer(TokenKind.SESSION, value, CapturedToken.Source.INTERCEPTED);
            }
        }
    }

    /**
     * Предложить значение для вида. Принимается только первое правдоподобное значение.
     *
     * @return {@code true}, если значение принято
     */
    public boolean offer(TokenKind kind, String value, CapturedToken.Source source) {
        return offer(CapturedToken.of(kind, value, source));
    }

    private boolean offer(CapturedToken token) {
        if (token == null || token.kind() == null || token.value() == null) {
            return false;
        }
        if (token.kind() != TokenKind.INTEGRATION && token.value().length() < config.minTokenLength()) {
            return false;
        }
        CapturedToken stamped = token.issuedAt() == null && token.source() != CapturedToken.Source.STORAGE
                ? token.withTimes(clock.instant(), null)
                : token;
        boolean accepted = slots.get(token.kind()).compareAndSet(null, stamped);
        if (accepted) {
            log.info("{} получен токен {} (источник {}): {}", logPrefix, token.kind(), token.source(), stamped.preview());
        }
        return accepted;
    }

    /**
     * Зафиксировать токен интеграции, созданный мастером.
     */
    public boolean recordIntegrationToken(String value) {
        return offer(TokenKind.INTEGRATION, value, CapturedToken.Source.WIZARD);
    }

    /**
     * Резервный путь: прочитать токены из хранилищ страницы. Заполняются только пустые виды.
     *
     * @return число видов, заполненных этим вызовом
     */
    public int scrapeStorage(Map<String, String> localStorage, Map<String, String> sessionStorage) {
        if (scraper == null) {
            return 0;
        }
        Instant now = clock.instant();
        int filled = 0;
        for (Map<String, String> storage : List.of(nullSafe(localStorage), nullSafe(sessionStorage))) {
            for (CapturedToken t : scraper.scrape(storage, config.minTokenLength(), now)) {
                if (offer(t)) {
                    filled++;
                }
            }
        }
        if (filled == 0) {
            log.debug("{} в хранилищах страницы новых токенов не найдено", logPrefix);
        }
        return filled;
    }

    public Optional<CapturedToken> get(TokenKind kind) {
        return Optional.ofNullable(slots.get(kind).get());
    }

    public boolean has(TokenKind kind) {
        return slots.get(kind).get() != null;
    }

    /**
     * Неизменяемый снимок полученных токенов.
     */
    public Map<TokenKind, CapturedToken> capturedTokens() {
        Map<TokenKind, CapturedToken> out = new EnumMap<>(TokenKind.class);
        for (Map.Entry<TokenKind, AtomicReference<CapturedToken>> e : slots.entrySet()) {
            CapturedToken t = e.getValue().get();
            if (t != null) {
                out.put(e.getKey(), t);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private boolean hostAllowed(String url) {
        List<String> hosts = config.hosts();
        if (hosts == null || hosts.isEmpty()) {
            return true;
        }
        String host;
        try {
            host = url == null ? null : URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        for (String allowed : hosts) {
            String a = allowed.toLowerCase(Locale.ROOT);
            if (h.equals(a) || h.endsWith("." + a)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> nullSafe(Map<String, String> m) {
        return m == null ? Map.of() : m;
    }
}
