package ru.aritmos.provisioningbroker.security;

/**
 * Роли Provisioning Broker (claim roles в JWT).
 */
public final class ProvisioningRoles {

    /** Запуск заданий, просмотр их статуса и сохранённых учётных данных. */
    public static final String OPERATOR = "PB_OPERATOR";

    /** Всё, что доступно оператору, плюс изменение runtime-конфигурации. */
    public static final String ADMIN = "PB_ADMIN";

    private ProvisioningRoles() {
    }
}
