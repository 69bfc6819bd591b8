package ru.aritmos.provisioningbroker.login;

import ru.aritmos.provisioningbroker.browser.UiSurface;
import ru.aritmos.provisioningbroker.retry.StepOutcome;
import ru.aritmos.provisioningbroker.retry.StrategyTable;
import ru.aritmos.provisioningbroker.retry.UiActions;
import ru.aritmos.provisioningbroker.retry.UiLocator;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Определение состояния страницы входа.
 * <p>
 * Порядок проб: поле пароля, виджет подтверждения, URL целевой страницы. Если ничего не подошло, состояние UNKNOWN.
 * Закрытая страница даёт FAILED.
 */
public class PageStateClassifier {

    private final UiSurface ui;
    private final StrategyTable strategies;
    private final Pattern destination;

    public PageStateClassifier(UiSurface ui, StrategyTable strategies, Pattern destination) {
        this.ui = ui;
        this.strategies = strategies;
        this.destination = destination;
    }

    public LoginState classify() {
        if (ui.isClosed()) {
            return LoginState.FAILED;
        }
        Boolean login = anyVisible(strategies.candidates(UiActions.PROBE_LOGIN_FORM));
        if (login == null) {
            return LoginState.FAILED;
        }
        if (login) {
            return LoginState.LOGIN_FORM;
        }
        Boolean mfa = anyVisible(strategies.candidates(UiActions.PROBE_MFA_CHALLENGE));
        if (mfa == null) {
            return LoginState.FAILED;
        }
        if (mfa) {
            return LoginState.MFA_CHALLENGE;
        }
        String url = ui.currentUrl();
        if (url != null && destination != null && destination.matcher(url).matches()) {
            return LoginState.AUTHENTICATED;
        }
        return LoginState.UNKNOWN;
    }

    /**
     * @return true/false, либо null при фатальном исходе пробы
     */
    private Boolean anyVisible(List<UiLocator> probes) {
        for (UiLocator p : probes) {
            StepOutcome<Boolean> o = ui.isVisible(p.selector());
            if (o.isFatal()) {
                return null;
            }
            if (o.isOk() && Boolean.TRUE.equals(o.value())) {
                return true;
            }
        }
        return false;
    }
}
