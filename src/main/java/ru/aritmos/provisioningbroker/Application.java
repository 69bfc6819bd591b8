package ru.aritmos.provisioningbroker;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Provisioning Broker.
 * <p>
 * Сервис по заявке входит в веб-консоль от имени арендатора (с подтверждением кодом из почты),
 * перехватывает выданные токены, создаёт токен приватной интеграции и сохраняет учётные данные.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
