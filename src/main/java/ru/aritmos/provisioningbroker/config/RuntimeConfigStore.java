package ru.aritmos.provisioningbroker.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Value;
import io.micronaut.core.io.ResourceResolver;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;
import ru.aritmos.provisioningbroker.retry.StrategyTable;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime-хранилище конфигурации Provisioning Broker.
 * <p>
 * Поддерживаются два режима:
 * <ol>
 *   <li>Локальная конфигурация (classpath), используемая как baseline.</li>
 *   <li>Удалённая конфигурация (опционально), с periodic refresh и ETag.</li>
 * </ol>
 * Дополнительно конфигурацию можно заменить вручную через Admin API; каждое ручное изменение
 * попадает в журнал аудита.
 * <p>
 * Runtime-конфигурация описывает «как работать с консолью»: URL, фильтры почты, флаги браузера,
 * политику повторов и таблицу стратегий локаторов. Секреты (пароль консоли, пароль ящика)
 * сюда не входят и читаются только из application.yml/ENV ({@link ProvisioningCredentialsProperties}).
 */
@Singleton
public class RuntimeConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfigStore.class);

    private static final int AUDIT_CAPACITY = 500;

    private final ResourceResolver resourceResolver;
    private final ObjectMapper objectMapper;
    private final HttpClient remoteClient;

    private final String localPath;
    private final boolean remoteEnabled;
    private final String remotePath;

    private final AtomicReference<RuntimeConfig> effective = new AtomicReference<>();
    private final Deque<RuntimeConfigAuditEntry> auditTrail = new ArrayDeque<>();
    private volatile String lastEtag;

    public RuntimeConfigStore(ResourceResolver resourceResolver,
                              ObjectMapper objectMapper,
                              @Client("${provisioningbroker.remote-config.base-url:http://system-configuration:8080}") HttpClient remoteClient,
                              @Value("${provisioningbroker.local-config.path:classpath:examples/sample-provisioning-config.json}") String localPath,
                              @Value("${provisioningbroker.remote-config.enabled:false}") boolean remoteEnabled,
                              @Value("${provisioningbroker.remote-config.path:/configuration/config/system/provisioningbroker}") String remotePath) {
        this.resourceResolver = resourceResolver;
        this.objectMapper = objectMapper;
        this.remoteClient = remoteClient;
        this.localPath = localPath;
        this.remoteEnabled = remoteEnabled;
        this.remotePath = remotePath;
    }

    /**
     * Загрузка baseline из classpath и (если включено) первая попытка remote-конфигурации.
     */
    @PostConstruct
    void init() {
        RuntimeConfig local = loadLocal();
        effective.set(local);
        appendAudit("LOCAL_LOAD", "system", "baseline", null, local);
        log.info("Runtime-конфигурация загружена: revision={}, strategies={}",
                local.revision(), local.strategies().version());
        if (remoteEnabled) {
            refreshRemote();
        }
    }

    @Scheduled(fixedDelay = "${provisioningbroker.remote-config.refresh-interval-sec:30}s")
    void scheduledRefresh() {
        if (!remoteEnabled) {
            return;
        }
        refreshRemote();
    }

    /**
     * @return актуальная effective-конфигурация (никогда не {@code null})
     */
    public RuntimeConfig getEffective() {
        RuntimeConfig cfg = effective.get();
        if (cfg == null) {
            return RuntimeConfig.defaultConfig();
        }
        return cfg;
    }

    public boolean isRemoteEnabled() {
        return remoteEnabled;
    }

    /**
     * Применить конфигурацию вручную (Admin API).
     *
     * @param config новая конфигурация
     * @param actor  инициатор
     * @param reason причина изменения
     * @return применённая (нормализованная) конфигурация
     */
    public RuntimeConfig applyManual(RuntimeConfig config, String actor, String reason) {
        if (config == null) {
            throw new IllegalArgumentException("Конфигурация не передана");
        }
        RuntimeConfig normalized = config.normalize();
        RuntimeConfig previous = effective.getAndSet(normalized);
        appendAudit("MANUAL_UPDATE", actor, reason, previous, normalized);
        log.info("Runtime-конфигурация изменена вручную: actor={}, revision {} -> {}",
                normalizeText(actor), previous == null ? null : previous.revision(), normalized.revision());
        return normalized;
    }

    /**
     * Последние записи журнала изменений (от старых к новым).
     */
    public List<RuntimeConfigAuditEntry> getAuditTrail(int limit) {
        int lim = Math.max(1, Math.min(AUDIT_CAPACITY, limit));
        synchronized (auditTrail) {
            List<RuntimeConfigAuditEntry> all = new ArrayList<>(auditTrail);
            return List.copyOf(all.subList(Math.max(0, all.size() - lim), all.size()));
        }
    }

    /**
     * Строгая проверка доступности удалённой конфигурации (для стартовой проверки).
     */
    public void assertRemoteAvailable() {
        if (!remoteEnabled) {
            throw new IllegalStateException("remote-config отключён (provisioningbroker.remote-config.enabled=false)");
        }
        try {
            HttpResponse<byte[]> resp = remoteClient.toBlocking().exchange(remoteRequest(), byte[].class);
            int sc = resp.getStatus().getCode();
            if (sc == 304) {
                return;
            }
            if (sc < 200 || sc >= 300) {
                throw new IllegalStateException("remote-config вернул неожиданный HTTP статус: " + sc);
            }
            applyRemoteBody(resp, true);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Не удалось загрузить remote-config: " + e.getMessage(), e);
        }
    }

    private void refreshRemote() {
        try {
            HttpResponse<byte[]> resp = remoteClient.toBlocking().exchange(remoteRequest(), byte[].class);
            if (resp.getStatus().getCode() == 304) {
                return;
            }
            applyRemoteBody(resp, false);
        } catch (Exception e) {
            log.warn("Не удалось обновить удалённую конфигурацию (fallback на предыдущую): {}",
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }
    }

    private MutableHttpRequest<?> remoteRequest() {
        MutableHttpRequest<?> req = HttpRequest.GET(remotePath);
        if (lastEtag != null && !lastEtag.isBlank()) {
            req = req.header(HttpHeaders.IF_NONE_MATCH, lastEtag);
        }
        return req;
    }

    private void applyRemoteBody(HttpResponse<byte[]> resp, boolean strict) throws Exception {
        String etag = resp.getHeaders().get(HttpHeaders.ETAG);
        if (etag != null && !etag.isBlank()) {
            lastEtag = etag;
        }
        byte[] body = resp.body();
        if (body == null || body.length == 0) {
            if (strict) {
                throw new IllegalStateException("remote-config вернул пустое тело");
            }
            log.warn("Удалённая конфигурация вернула пустое тело. Оставляем предыдущую effective-конфигурацию.");
            return;
        }
        JsonNode root = objectMapper.readTree(new String(body, StandardCharsets.UTF_8));
        RuntimeConfig parsed = objectMapper.treeToValue(unwrapEnvelope(root), RuntimeConfig.class).normalize();
        RuntimeConfig previous = effective.getAndSet(parsed);
        if (previous == null || !Objects.equals(previous.revision(), parsed.revision())) {
            appendAudit("REMOTE_REFRESH", "remote-config", etag, previous, parsed);
        }
    }

    private RuntimeConfig loadLocal() {
        Optional<InputStream> streamOpt = resourceResolver.getResourceAsStream(localPath);
        if (streamOpt.isEmpty() && localPath != null && !localPath.startsWith("classpath:")) {
            streamOpt = resourceResolver.getResourceAsStream("classpath:" + localPath);
        }
        if (streamOpt.isEmpty()) {
            throw new IllegalStateException("Не найден локальный конфиг Provisioning Broker по пути: " + localPath);
        }
        try (InputStream is = streamOpt.get()) {
            JsonNode root = objectMapper.readTree(is);
            return objectMapper.treeToValue(unwrapEnvelope(root), RuntimeConfig.class).normalize();
        } catch (Exception e) {
            throw new IllegalStateException("Не удалось загрузить локальную конфигурацию Provisioning Broker: " + e.getMessage(), e);
        }
    }

    /**
     * Поддержка типовых «обёрток»: value/data/config/payload/settings, в том числе value как JSON-строка.
     */
    private JsonNode unwrapEnvelope(JsonNode root) {
        if (root == null) {
            return objectMapper.createObjectNode();
        }
        JsonNode candidate = root;
        for (String key : new String[]{"value", "data", "config", "payload", "settings"}) {
            if (candidate.has(key) && !candidate.get(key).isNull()) {
                candidate = candidate.get(key);
                break;
            }
        }
        if (candidate.isTextual()) {
            try {
                return objectMapper.readTree(candidate.asText());
            } catch (Exception e) {
                log.debug("Значение конфигурации не является JSON-строкой: {}", e.getMessage());
                return candidate;
            }
        }
        return candidate;
    }

    private void appendAudit(String source, String actor, String reason, RuntimeConfig from, RuntimeConfig to) {
        RuntimeConfigAuditEntry entry = new RuntimeConfigAuditEntry(
                Instant.now(),
                source,
                normalizeText(actor) == null ? "unknown" : normalizeText(actor),
                normalizeText(reason),
                from == null ? null : from.revision(),
                to == null ? null : to.revision(),
                String.join(",", changedSections(from, to))
        );
        synchronized (auditTrail) {
            auditTrail.addLast(entry);
            while (auditTrail.size() > AUDIT_CAPACITY) {
                auditTrail.removeFirst();
            }
        }
    }

    static List<String> changedSections(RuntimeConfig from, RuntimeConfig to) {
        List<String> out = new ArrayList<>();
        if (to == null) {
            return out;
        }
        if (from == null) {
            out.add("*");
            return out;
        }
        if (!Objects.equals(from.revision(), to.revision())) out.add("revision");
        if (!Objects.equals(from.console(), to.console())) out.add("console");
        if (!Objects.equals(from.mailbox(), to.mailbox())) out.add("mailbox");
        if (!Objects.equals(from.browser(), to.browser())) out.add("browser");
        if (!Objects.equals(from.retry(), to.retry())) out.add("retry");
        if (!Objects.equals(from.login(), to.login())) out.add("login");
        if (!Objects.equals(from.tokenCapture(), to.tokenCapture())) out.add("tokenCapture");
        if (!Objects.equals(from.wizard(), to.wizard())) out.add("wizard");
        if (!Objects.equals(from.strategies(), to.strategies())) out.add("strategies");
        if (!Objects.equals(from.jobs(), to.jobs())) out.add("jobs");
        if (out.isEmpty()) {
            out.add("none");
        }
        return out;
    }

    private static String normalizeText(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        return s.trim();
    }

    private static int positive(int v, int def) {
        return v > 0 ? v : def;
    }

    private static long positive(long v, long def) {
        return v > 0 ? v : def;
    }

    private static List<String> nonEmpty(List<String> v, List<String> def) {
        if (v == null) {
            return def;
        }
        List<String> cleaned = v.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toList();
        return cleaned.isEmpty() ? def : cleaned;
    }

    private static String text(String v, String def) {
        String n = normalizeText(v);
        return n == null ? def : n;
    }

    /**
     * Effective-конфигурация Provisioning Broker.
     */
    public record RuntimeConfig(
            String revision,
            ConsoleConfig console,
            MailboxConfig mailbox,
            BrowserConfig browser,
            RetryConfig retry,
            LoginConfig login,
            TokenCaptureConfig tokenCapture,
            WizardConfig wizard,
            StrategyTable strategies,
            JobsConfig jobs
    ) {
        public static RuntimeConfig defaultConfig() {
            return new RuntimeConfig("builtin", null, null, null, null, null, null, null, null, null).normalize();
        }

        public RuntimeConfig normalize() {
            return new RuntimeConfig(
                    text(revision, "unknown"),
                    console == null ? ConsoleConfig.defaultConfig() : console.normalize(),
                    mailbox == null ? MailboxConfig.defaultConfig() : mailbox.normalize(),
                    browser == null ? BrowserConfig.defaultConfig() : browser.normalize(),
                    retry == null ? RetryConfig.defaultConfig() : retry.normalize(),
                    login == null ? LoginConfig.defaultConfig() : login.normalize(),
                    tokenCapture == null ? TokenCaptureConfig.defaultConfig() : tokenCapture.normalize(),
                    wizard == null ? WizardConfig.defaultConfig() : wizard.normalize(),
                    strategies == null ? StrategyTable.defaults() : strategies.normalize(),
                    jobs == null ? JobsConfig.defaultConfig() : jobs.normalize()
            );
        }
    }

    /**
     * Адреса целевой веб-консоли.
     *
     * @param integrationsUrlTemplate URL страницы интеграций арендатора ({@code {tenant}} заменяется handle арендатора)
     * @param destinationUrlPattern   regex URL, означающего успешный вход
     */
    public record ConsoleConfig(String integrationsUrlTemplate, String destinationUrlPattern) {

        public static ConsoleConfig defaultConfig() {
            return new ConsoleConfig(
                    "https://app.onetoo.com/v2/location/{tenant}/settings/private-integrations/",
                    ".*/v2/location/[^/]+/.*");
        }

        public ConsoleConfig normalize() {
            ConsoleConfig d = defaultConfig();
            return new ConsoleConfig(text(integrationsUrlTemplate, d.integrationsUrlTemplate()),
                    text(destinationUrlPattern, d.destinationUrlPattern()));
        }

        public String integrationsUrl(String tenantHandle) {
            return integrationsUrlTemplate.replace("{tenant}", tenantHandle == null ? "" : tenantHandle.trim());
        }
    }

    /**
     * Параметры почтового ящика с одноразовыми кодами (без учётных данных).
     */
    public record MailboxConfig(
            String host,
            int port,
            String folder,
            List<String> senders,
            String subjectContains,
            List<String> codePatterns,
            int codeLength,
            int pollAttempts,
            long pollIntervalMs,
            Long clockSkewSec,
            int connectTimeoutMs,
            int readTimeoutMs,
            int maxCandidates,
            long consumedTtlSec
    ) {
        public static MailboxConfig defaultConfig() {
            return new MailboxConfig(
                    "imap.gmail.com",
                    993,
                    "INBOX",
                    List.of("noreply@gohighlevel.com", "no-reply@gohighlevel.com",
                            "support@gohighlevel.com", "noreply@talk.onetoo.com"),
                    "Login security code",
                    List.of("Your login security code:\\s*(\\d{6})",
                            "login security code:\\s*(\\d{6})",
                            "security code:\\s*(\\d{6})",
                            "code:\\s*(\\d{6})",
                            "\\b(\\d{6})\\b"),
                    6,
                    30,
                    1000,
                    60L,
                    10000,
                    10000,
                    10,
                    86400);
        }

        public MailboxConfig normalize() {
            MailboxConfig d = defaultConfig();
            return new MailboxConfig(
                    text(host, d.host()),
                    positive(port, d.port()),
                    text(folder, d.folder()),
                    nonEmpty(senders, d.senders()),
                    normalizeText(subjectContains),
                    nonEmpty(codePatterns, d.codePatterns()),
                    positive(codeLength, d.codeLength()),
                    positive(pollAttempts, d.pollAttempts()),
                    positive(pollIntervalMs, d.pollIntervalMs()),
                    clockSkewSec == null || clockSkewSec < 0 ? d.clockSkewSec() : clockSkewSec,
                    positive(connectTimeoutMs, d.connectTimeoutMs()),
                    positive(readTimeoutMs, d.readTimeoutMs()),
                    positive(maxCandidates, d.maxCandidates()),
                    positive(consumedTtlSec, d.consumedTtlSec()));
        }

        public Duration pollInterval() {
            return Duration.ofMillis(pollIntervalMs);
        }
    }

    /**
     * Параметры запуска браузера.
     *
     * @param blockedResources glob-шаблоны ресурсов, загрузка которых отменяется (экономия памяти)
     */
    public record BrowserConfig(
            Boolean headless,
            List<String> launchArgs,
            int viewportWidth,
            int viewportHeight,
            String userAgent,
            List<String> blockedResources,
            long launchTimeoutMs,
            long navigationTimeoutMs
    ) {
        public static BrowserConfig defaultConfig() {
            return new BrowserConfig(
                    true,
                    List.of("--disable-blink-features=AutomationControlled",
                            "--disable-extensions",
                            "--disable-plugins",
                            "--disable-background-networking",
                            "--disable-background-timer-throttling",
                            "--disable-renderer-backgrounding",
                            "--disable-backgrounding-occluded-windows",
                            "--no-sandbox",
                            "--disable-dev-shm-usage",
                            "--disable-gpu"),
                    1280,
                    720,
                    null,
                    List.of("**/*.{png,jpg,jpeg,gif,webp,ico}", "**/*.{woff,woff2,ttf,otf}"),
                    60000,
                    30000);
        }

        public BrowserConfig normalize() {
            BrowserConfig d = defaultConfig();
            return new BrowserConfig(
                    headless == null ? d.headless() : headless,
                    launchArgs == null ? d.launchArgs() : List.copyOf(launchArgs),
                    positive(viewportWidth, d.viewportWidth()),
                    positive(viewportHeight, d.viewportHeight()),
                    normalizeText(userAgent),
                    blockedResources == null ? d.blockedResources() : List.copyOf(blockedResources),
                    positive(launchTimeoutMs, d.launchTimeoutMs()),
                    positive(navigationTimeoutMs, d.navigationTimeoutMs()));
        }
    }

    /**
     * Политика повторов UI-действий.
     */
    public record RetryConfig(int maxRounds, long perTryTimeoutMs, long baseBackoffMs, long maxBackoffMs) {

        public static RetryConfig defaultConfig() {
            return new RetryConfig(3, 3000, 250, 4000);
        }

        public RetryConfig normalize() {
            RetryConfig d = defaultConfig();
            return new RetryConfig(
                    positive(maxRounds, d.maxRounds()),
                    positive(perTryTimeoutMs, d.perTryTimeoutMs()),
                    positive(baseBackoffMs, d.baseBackoffMs()),
                    positive(maxBackoffMs, d.maxBackoffMs()));
        }

        public Duration perTryTimeout() {
            return Duration.ofMillis(perTryTimeoutMs);
        }
    }

    /**
     * Ограничения машины состояний входа.
     */
    public record LoginConfig(int maxTransitions, int maxLoginAttempts, int maxMfaAttempts, int maxUnknownProbes, long settleMs) {

        public static LoginConfig defaultConfig() {
            return new LoginConfig(20, 2, 3, 5, 2000);
        }

        public LoginConfig normalize() {
            LoginConfig d = defaultConfig();
            return new LoginConfig(
                    positive(maxTransitions, d.maxTransitions()),
                    positive(maxLoginAttempts, d.maxLoginAttempts()),
                    positive(maxMfaAttempts, d.maxMfaAttempts()),
                    positive(maxUnknownProbes, d.maxUnknownProbes()),
                    positive(settleMs, d.settleMs()));
        }
    }

    /**
     * Параметры перехвата токенов из исходящих запросов браузера.
     *
     * @param hosts хосты (или суффиксы хостов), запросы к которым анализируются; пусто = все
     */
    public record TokenCaptureConfig(String bearerHeader,
                                     String sessionHeader,
                                     int minTokenLength,
                                     List<String> hosts,
                                     long captureWaitMs,
                                     long capturePollMs) {

        public static TokenCaptureConfig defaultConfig() {
            return new TokenCaptureConfig("authorization", "token-id", 20, List.of(), 15000, 500);
        }

        public TokenCaptureConfig normalize() {
            TokenCaptureConfig d = defaultConfig();
            return new TokenCaptureConfig(
                    text(bearerHeader, d.bearerHeader()),
                    text(sessionHeader, d.sessionHeader()),
                    positive(minTokenLength, d.minTokenLength()),
                    hosts == null ? List.of() : nonEmpty(hosts, List.of()),
                    positive(captureWaitMs, d.captureWaitMs()),
                    positive(capturePollMs, d.capturePollMs()));
        }
    }

    /**
     * Параметры мастера создания интеграции.
     */
    public record WizardConfig(String integrationName,
                               List<String> scopes,
                               List<String> tokenPrefixes,
                               int tokenMinLength,
                               int extractRounds,
                               Integer clickOutsideX,
                               Integer clickOutsideY,
                               long settleMs) {

        public static WizardConfig defaultConfig() {
            return new WizardConfig(
                    "location key",
                    List.of("View Contacts", "Edit Contacts", "View Conversation Reports", "Edit Conversations",
                            "View Calendars", "View Businesses", "View Conversation Messages",
                            "Edit Conversation Messages", "View Custom Fields", "Edit Custom Fields",
                            "View Custom Values", "Edit Custom Values", "View Medias", "Edit Tags", "View Tags"),
                    List.of("pit-"),
                    20,
                    2,
                    500,
                    300,
                    1500);
        }

        public WizardConfig normalize() {
            WizardConfig d = defaultConfig();
            return new WizardConfig(
                    text(integrationName, d.integrationName()),
                    nonEmpty(scopes, d.scopes()),
                    tokenPrefixes == null ? d.tokenPrefixes() : nonEmpty(tokenPrefixes, List.of()),
                    positive(tokenMinLength, d.tokenMinLength()),
                    positive(extractRounds, d.extractRounds()),
                    clickOutsideX == null || clickOutsideX < 0 ? d.clickOutsideX() : clickOutsideX,
                    clickOutsideY == null || clickOutsideY < 0 ? d.clickOutsideY() : clickOutsideY,
                    positive(settleMs, d.settleMs()));
        }
    }

    /**
     * Ограничения заданий.
     *
     * @param jobTimeoutSec общий таймаут одного задания
     * @param archiveTtlSec сколько завершённое задание остаётся доступным по id
     */
    public record JobsConfig(long jobTimeoutSec, long archiveTtlSec) {

        public static JobsConfig defaultConfig() {
            return new JobsConfig(600, 3600);
        }

        public JobsConfig normalize() {
            JobsConfig d = defaultConfig();
            return new JobsConfig(positive(jobTimeoutSec, d.jobTimeoutSec()), positive(archiveTtlSec, d.archiveTtlSec()));
        }
    }

    /**
     * Запись журнала изменений runtime-конфигурации.
     */
    public record RuntimeConfigAuditEntry(Instant at,
                                          String source,
                                          String actor,
                                          String reason,
                                          String fromRevision,
                                          String toRevision,
                                          String changedSections) {
    }
}
