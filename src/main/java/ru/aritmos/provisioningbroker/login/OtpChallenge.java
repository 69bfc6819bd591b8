package ru.aritmos.provisioningbroker.login;

import java.time.Instant;

/**
 * Запрос одноразового кода в рамках задания.
 * <p>
 * Код используется не более одного раза. Если код не пришёл за отведённое время, запрос помечается истёкшим.
 */
public final class OtpChallenge {

    private final String jobId;
    private final Instant sentAt;
    private String code;
    private boolean consumed;
    private boolean expired;

    public OtpChallenge(String jobId, Instant sentAt) {
        this.jobId = jobId;
        this.sentAt = sentAt;
    }

    public String jobId() {
        return jobId;
    }

    public Instant sentAt() {
        return sentAt;
    }

    public void received(String code) {
        this.code = code;
    }

    /**
     * Забрать код для ввода. Повторный вызов возвращает {@code null}.
     */
    public String consume() {
        if (consumed || expired || code == null) {
            return null;
        }
        consumed = true;
        return code;
    }

    public void expire() {
        this.expired = true;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public boolean isExpired() {
        return expired;
    }

    @Override
    public String toString() {
        return "OtpChallenge{jobId=" + jobId + ", sentAt=" + sentAt + ", code=" + (code == null ? "<none>" : "******")
                + ", consumed=" + consumed + ", expired=" + expired + "}";
    }
}
