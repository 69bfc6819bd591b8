package ru.aritmos.provisioningbroker.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Настройки доступа к API брокера.
 * <p>
 * Режимы:
 * <ul>
 *   <li>OPEN: доступ без аутентификации (локальная разработка, закрытый контур);</li>
 *   <li>PROTECTED: требуется JWT с ролью PB_OPERATOR или PB_ADMIN, кроме /health и /info.</li>
 * </ul>
 */
@ConfigurationProperties("provisioningbroker.security")
public class ProvisioningBrokerSecurityProperties {

    public enum Mode {
        OPEN,
        PROTECTED
    }

    private Mode mode = Mode.OPEN;

    /**
     * Разрешено ли оператору читать runtime-конфигурацию и журнал её изменений.
     */
    private boolean operatorsReadConfig = true;

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode == null ? Mode.OPEN : mode;
    }

    public boolean isOperatorsReadConfig() {
        return operatorsReadConfig;
    }

    public void setOperatorsReadConfig(boolean operatorsReadConfig) {
        this.operatorsReadConfig = operatorsReadConfig;
    }
}
