package ru.aritmos.provisioningbroker.core;

/**
 * Истёк общий таймаут задания (или поток задания был прерван).
 * <p>
 * Выбрасывается на границах шагов и внутри циклов повторов/опроса почты;
 * оркестратор переводит его в {@code FAILED(JOB_TIMEOUT)} после гарантированного освобождения браузера.
 */
public class JobTimeoutException extends RuntimeException {

    public JobTimeoutException(String message) {
        super(message);
    }
}
