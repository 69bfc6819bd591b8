package ru.aritmos.provisioningbroker.retry;

/**
 * Имена логических UI-действий, для которых в {@link StrategyTable} хранятся списки локаторов.
 */
public final class UiActions {

    private UiActions() {
        // константы
    }

    public static final String PROBE_LOGIN_FORM = "probe.loginForm";
    public static final String PROBE_MFA_CHALLENGE = "probe.mfaChallenge";

    public static final String LOGIN_IDENTITY = "login.identity";
    public static final String LOGIN_SECRET = "login.secret";
    public static final String LOGIN_SUBMIT = "login.submit";

    public static final String MFA_EMAIL_OPTION = "mfa.emailOption";
    public static final String MFA_SEND_CODE = "mfa.sendCode";
    public static final String MFA_CODE_INPUT = "mfa.codeInput";
    public static final String MFA_SUBMIT = "mfa.submit";

    public static final String WIZARD_PAGE_MARKER = "wizard.pageMarker";
    public static final String WIZARD_CREATE_BUTTON = "wizard.createButton";
    public static final String WIZARD_NAME_INPUT = "wizard.nameInput";
    public static final String WIZARD_NAME_NEXT = "wizard.nameNext";
    public static final String WIZARD_SCOPE_CONTAINER = "wizard.scopeContainer";
    public static final String WIZARD_SCOPE_INPUT = "wizard.scopeInput";
    /** шаблон, {@code {scope}} заменяется названием права */
    public static final String WIZARD_SCOPE_ACCEPTED = "wizard.scopeAccepted";
    public static final String WIZARD_SUBMIT_PRIMARY = "wizard.submitPrimary";
    public static final String WIZARD_SUBMIT_FALLBACK = "wizard.submitFallback";
    public static final String WIZARD_TOKEN_TEXT = "wizard.tokenText";
    public static final String WIZARD_TOKEN_COPY = "wizard.tokenCopy";
    public static final String WIZARD_TOKEN_NEARBY = "wizard.tokenNearby";
}
