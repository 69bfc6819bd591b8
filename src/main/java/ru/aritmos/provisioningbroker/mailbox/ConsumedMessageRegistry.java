package ru.aritmos.provisioningbroker.mailbox;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.provisioningbroker.core.TtlCache;

import java.time.Clock;

/**
 * Реестр уже использованных писем с кодами (на уровне процесса).
 * <p>
 * Письмо может быть «захвачено» только одним опросом; конкурентный опрос, увидевший то же письмо,
 * считает его ненайденным. Записи живут {@code ttlSeconds}: за это время письмо заведомо выпадает
 * из окна «получено после начала задания».
 */
@Singleton
public class ConsumedMessageRegistry {

    private static final int MAX_ENTRIES = 10_000;

    private final TtlCache<String, Boolean> consumed;

    @Inject
    public ConsumedMessageRegistry() {
        this(Clock.systemUTC());
    }

    public ConsumedMessageRegistry(Clock clock) {
        this.consumed = new TtlCache<>(clock, MAX_ENTRIES);
    }

    /**
     * Захватить письмо.
     *
     * @return {@code true}, если письмо захвачено этим вызовом; {@code false}, если оно уже использовано
     */
    public boolean claim(String key, long ttlSeconds) {
        return consumed.putIfAbsent(key, Boolean.TRUE, ttlSeconds);
    }

    public boolean isConsumed(String key) {
        return consumed.get(key).isPresent();
    }
}
