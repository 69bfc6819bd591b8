package ru.aritmos.provisioningbroker.browser;

/**
 * Окружение задания не может быть создано (браузер не запускается, драйвер недоступен).
 * Повтор в рамках задания бессмысленен.
 */
public class FatalEnvironmentException extends RuntimeException {

    public FatalEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
