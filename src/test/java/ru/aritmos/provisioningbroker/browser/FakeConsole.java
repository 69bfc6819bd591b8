package ru.aritmos.provisioningbroker.browser;

import ru.aritmos.provisioningbroker.retry.StepOutcome;
import ru.aritmos.provisioningbroker.token.TestJwts;
import ru.aritmos.provisioningbroker.token.TokenInterceptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Модель веб-консоли в памяти: форма входа, подтверждение кодом, страница интеграций и мастер.
 * <p>
 * Селекторы совпадают с таблицей стратегий по умолчанию. Сценарий настраивается сеттерами до запуска.
 */
public class FakeConsole implements UiSurface {

    public static final String BASE = "https://console.example.org";
    public static final String LOGIN_URL = BASE + "/login";

    public static final String PASSWORD = "input[type=\"password\"]";
    public static final String EMAIL = "input[type=\"email\"]";
    public static final String SIGN_IN = "button:has-text(\"Sign in\")";
    public static final String MFA_TITLE = "text=Verify Security Code";
    public static final String MFA_EMAIL = "text=\"Email\"";
    public static final String MFA_SEND = "text=\"Send Security Code\"";
    public static final String MFA_DIGITS = "input[maxlength=\"1\"]";
    public static final String MFA_SUBMIT = "button[type=\"submit\"]";
    public static final String PAGE_MARKER = "text=Private Integrations";
    public static final String CREATE = "text=Create new integration";
    public static final String NAME_INPUT = "input[placeholder*=\"name\"]";
    public static final String NAME_NEXT = "button:has-text(\"Next\")";
    public static final String SCOPE_CONTAINER = "div.n-base-selection";
    public static final String SCOPE_INPUT = "//input[@placeholder='Search scopes...']";
    public static final String SUBMIT_PRIMARY = "//div[contains(@class,'n-card__footer')]//button[2]/span";
    public static final String TOKEN_TEXT = "pre";
    public static final String TOKEN_COPY = "button:has-text(\"Copy\")";
    public static final String TOKEN_NEARBY = "//button[contains(.,'Copy')]/preceding-sibling::p";

    /**
     * Как консоль показывает созданный токен.
     */
    public enum TokenDisplay {
        DIALOG,
        CLIPBOARD_ONLY,
        NEARBY_ONLY,
        NONE
    }

    private final String identity;
    private final String secret;
    private final String tenantHandle;

    private String expectedCode = "123456";
    private boolean rejectCredentials;
    private Set<String> rejectedScopes = Set.of();
    private TokenDisplay tokenDisplay = TokenDisplay.DIALOG;
    private String integrationToken = "pit-0a1b2c3d-4e5f-6789-abcd-ef0123456789";
    private String bearer = TestJwts.jwt(1_772_359_200L, 1_772_445_600L);
    private String sessionToken = "session-identity-token-0123456789";
    private int bearerAfterSettles;
    private Map<String, String> localStorage = Map.of();
    private Map<String, String> sessionStorage = Map.of();

    private final Set<String> visible = new LinkedHashSet<>();
    private final Map<String, List<String>> texts = new HashMap<>();
    private final Map<String, String> values = new HashMap<>();
    private final Set<String> tags = new HashSet<>();
    private final List<String> navigations = new ArrayList<>();
    private final List<String> actions = new ArrayList<>();
    private String url = "about:blank";
    private String clipboard;
    private String typedScope;
    private String enteredCode;
    private boolean authenticated;
    private boolean bearerEmitted;
    private int settlesSinceAuth;
    private int codesSent;
    private int settles;
    private int clickAtCount;
    private boolean closed;
    private TokenInterceptor interceptor;

    public FakeConsole(String identity, String secret, String tenantHandle) {
        this.identity = identity;
        this.secret = secret;
        this.tenantHandle = tenantHandle;
    }

    public static String integrationsUrl(String tenantHandle) {
        return BASE + "/v2/location/" + tenantHandle + "/settings/private-integrations/";
    }

    public FakeConsole expectedCode(String code) {
        this.expectedCode = code;
        return this;
    }

    public FakeConsole rejectCredentials() {
        this.rejectCredentials = true;
        return this;
    }

    public FakeConsole rejectScopes(Set<String> scopes) {
        this.rejectedScopes = Set.copyOf(scopes);
        return this;
    }

    public FakeConsole tokenDisplay(TokenDisplay display) {
        this.tokenDisplay = display;
        return this;
    }

    public FakeConsole integrationToken(String token) {
        this.integrationToken = token;
        return this;
    }

    public FakeConsole bearer(String bearer) {
        this.bearer = bearer;
        return this;
    }

    /**
     * Bearer появляется в запросах только после N пауз после входа (0 = сразу, -1 = никогда).
     */
    public FakeConsole bearerAfterSettles(int settlesCount) {
        this.bearerAfterSettles = settlesCount;
        return this;
    }

    public FakeConsole storage(Map<String, String> local, Map<String, String> session) {
        this.localStorage = Map.copyOf(local);
        this.sessionStorage = Map.copyOf(session);
        return this;
    }

    /**
     * Начать со страницы интеграций уже вошедшего пользователя.
     */
    public FakeConsole signedIn() {
        authenticated = true;
        bearerEmitted = true;
        url = integrationsUrl(tenantHandle);
        visible.clear();
        showIntegrationsPage();
        return this;
    }

    /**
     * Подключить перехватчик (делает фабрика сессий при открытии).
     */
    public void attach(TokenInterceptor interceptor) {
        this.interceptor = interceptor;
    }

    /**
     * Имитация падения браузера: все последующие операции фатальны.
     */
    public void crash() {
        closed = true;
    }

    // ----- UiSurface -----

    @Override
    public StepOutcome<Void> navigate(String target, Duration timeout) {
        if (closed) {
            return StepOutcome.fatal("browser has disconnected");
        }
        navigations.add(target);
        visible.clear();
        if (!authenticated) {
            url = LOGIN_URL;
            showLoginForm();
        } else {
            url = target;
            showIntegrationsPage();
        }
        return StepOutcome.ok();
    }

    @Override
    public String currentUrl() {
        return url;
    }

    @Override
    public StepOutcome<Boolean> isVisible(String selector) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        return StepOutcome.ok(visible.contains(selector));
    }

    @Override
    public StepOutcome<Void> waitVisible(String selector, Duration timeout) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        if (visible.contains(selector) || tags.contains(selector)) {
            return StepOutcome.ok();
        }
        return StepOutcome.retryable("Timeout waiting for " + selector);
    }

    @Override
    public StepOutcome<Void> click(String selector, Duration timeout) {
        StepOutcome<Void> guard = requireVisible(selector);
        if (!guard.isOk()) {
            return guard;
        }
        actions.add("click " + selector);
        switch (selector) {
            case SIGN_IN -> signIn();
            case MFA_SEND -> codesSent++;
            case MFA_SUBMIT -> submitCode();
            case CREATE -> {
                visible.add(NAME_INPUT);
                visible.add(NAME_NEXT);
            }
            case NAME_NEXT -> {
                visible.add(SCOPE_CONTAINER);
                visible.add(SCOPE_INPUT);
                visible.add(SUBMIT_PRIMARY);
            }
            case SUBMIT_PRIMARY -> showToken();
            case TOKEN_COPY -> clipboard = tokenDisplay == TokenDisplay.CLIPBOARD_ONLY ? integrationToken : "";
            default -> {
                // остальные клики не меняют страницу
            }
        }
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<Void> fill(String selector, String value, Duration timeout) {
        StepOutcome<Void> guard = requireVisible(selector);
        if (!guard.isOk()) {
            return guard;
        }
        actions.add("fill " + selector);
        values.put(selector, value);
        if (SCOPE_INPUT.equals(selector)) {
            typedScope = value;
        }
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<Void> fillPerCharacter(String selector, String value, Duration timeout) {
        StepOutcome<Void> guard = requireVisible(selector);
        if (!guard.isOk()) {
            return guard;
        }
        actions.add("fillPerCharacter " + selector);
        if (MFA_DIGITS.equals(selector)) {
            enteredCode = value;
        }
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<Void> press(String selector, String key, Duration timeout) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        if (selector != null && !visible.contains(selector)) {
            return StepOutcome.retryable("element not visible: " + selector);
        }
        actions.add("press " + key);
        if (SCOPE_INPUT.equals(selector) && "Enter".equals(key) && typedScope != null) {
            if (!rejectedScopes.contains(typedScope)) {
                tags.add(".n-tag:has-text(\"" + typedScope + "\")");
            }
            typedScope = null;
        }
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<String> readText(String selector, Duration timeout) {
        StepOutcome<List<String>> all = readAllTexts(selector, timeout);
        if (!all.isOk()) {
            return all.failureAs();
        }
        return StepOutcome.ok(all.value().get(0));
    }

    @Override
    public StepOutcome<List<String>> readAllTexts(String selector, Duration timeout) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        List<String> t = texts.get(selector);
        if (t == null || t.isEmpty()) {
            return StepOutcome.retryable("Timeout waiting for " + selector);
        }
        return StepOutcome.ok(t);
    }

    @Override
    public StepOutcome<String> readClipboard() {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        return clipboard == null ? StepOutcome.retryable("clipboard is empty") : StepOutcome.ok(clipboard);
    }

    @Override
    public StepOutcome<Void> clickAt(int x, int y) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        clickAtCount++;
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<Void> settle(Duration duration) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        settles++;
        if (authenticated && !bearerEmitted && bearerAfterSettles > 0) {
            settlesSinceAuth++;
            if (settlesSinceAuth >= bearerAfterSettles) {
                emitBearer();
            }
        }
        return StepOutcome.ok();
    }

    @Override
    public StepOutcome<Map<String, String>> storage(StorageArea area) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        return StepOutcome.ok(area == StorageArea.LOCAL ? localStorage : sessionStorage);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    // ----- сценарий -----

    private StepOutcome<Void> requireVisible(String selector) {
        if (closed) {
            return StepOutcome.fatal("target closed");
        }
        if (!visible.contains(selector)) {
            return StepOutcome.retryable("Timeout waiting for " + selector);
        }
        return StepOutcome.ok();
    }

    private void showLoginForm() {
        visible.add(EMAIL);
        visible.add(PASSWORD);
        visible.add(SIGN_IN);
    }

    private void signIn() {
        boolean ok = !rejectCredentials
                && identity != null && identity.equals(values.get(EMAIL))
                && secret != null && secret.equals(values.get(PASSWORD));
        values.clear();
        if (!ok) {
            return;
        }
        visible.clear();
        visible.add(MFA_TITLE);
        visible.add(MFA_EMAIL);
        visible.add(MFA_SEND);
        visible.add(MFA_DIGITS);
        visible.add(MFA_SUBMIT);
    }

    private void submitCode() {
        if (expectedCode == null || !expectedCode.equals(enteredCode)) {
            enteredCode = null;
            return;
        }
        authenticated = true;
        url = integrationsUrl(tenantHandle);
        visible.clear();
        showIntegrationsPage();
        if (interceptor != null) {
            interceptor.onRequest(BASE + "/api/users/me", Map.of("token-id", sessionToken));
        }
        if (bearerAfterSettles == 0) {
            emitBearer();
        }
    }

    private void emitBearer() {
        bearerEmitted = true;
        if (interceptor != null && bearer != null) {
            interceptor.onRequest(BASE + "/api/locations/" + tenantHandle, Map.of("Authorization", "Bearer " + bearer));
        }
    }

    private void showIntegrationsPage() {
        visible.add(PAGE_MARKER);
        visible.add(CREATE);
    }

    private void showToken() {
        switch (tokenDisplay) {
            case DIALOG -> texts.put(TOKEN_TEXT, List.of("Your API key: " + integrationToken));
            case CLIPBOARD_ONLY -> visible.add(TOKEN_COPY);
            case NEARBY_ONLY -> {
                visible.add(TOKEN_COPY);
                texts.put(TOKEN_NEARBY, List.of(integrationToken));
            }
            case NONE -> visible.add(TOKEN_COPY);
        }
    }

    // ----- наблюдения для тестов -----

    public List<String> navigations() {
        return navigations;
    }

    public List<String> actions() {
        return actions;
    }

    public int codesSent() {
        return codesSent;
    }

    public int settles() {
        return settles;
    }

    public int clickAtCount() {
        return clickAtCount;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public String integrationToken() {
        return integrationToken;
    }

    public String bearer() {
        return bearer;
    }
}
