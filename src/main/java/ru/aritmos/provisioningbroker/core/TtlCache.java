package ru.aritmos.provisioningbroker.core;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Простой in-memory TTL-кэш.
 * <p>
 * Используется для:
 * <ul>
 *   <li>архива завершённых заданий (читаемы по id, пока не истёк TTL);</li>
 *   <li>реестра уже использованных OTP-писем.</li>
 * </ul>
 * Кэш не является источником истины: учётные данные хранятся только в БД.
 */
public final class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public TtlCache(Clock clock, int maxEntries) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Получить значение по ключу, если оно не истекло.
     */
    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> e = map.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiresAtMs <= clock.millis()) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value);
    }

    /**
     * Положить значение в кэш.
     */
    public void put(K key, V value, long ttlSeconds) {
        if (key == null) {
            return;
        }
        evictIfFull();
        map.put(key, new Entry<>(value, expiresAt(ttlSeconds)));
    }

    /**
     * Атомарно положить значение, если по ключу нет живой записи.
     *
     * @return {@code true}, если значение положено этим вызовом
     */
    public boolean putIfAbsent(K key, V value, long ttlSeconds) {
        if (key == null) {
            return false;
        }
        evictIfFull();
        Entry<V> fresh = new Entry<>(value, expiresAt(ttlSeconds));
        long now = clock.millis();
        boolean[] inserted = {false};
        map.compute(key, (k, existing) -> {
            if (existing != null && existing.expiresAtMs > now) {
                return existing;
            }
            inserted[0] = true;
            return fresh;
        });
        return inserted[0];
    }

    /**
     * Количество элементов в кэше (включая ещё не вычищенные истёкшие).
     */
    public int size() {
        return map.size();
    }

    private long expiresAt(long ttlSeconds) {
        return clock.millis() + Math.max(0, ttlSeconds) * 1000L;
    }

    private void evictIfFull() {
        if (map.size() < maxEntries) {
            return;
        }
        long now = clock.millis();
        map.entrySet().removeIf(e -> e.getValue().expiresAtMs <= now);
        if (map.size() >= maxEntries) {
            // LRU не нужен: при переполнении живыми записями очищаем кэш целиком.
            map.clear();
        }
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}
