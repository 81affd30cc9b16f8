package com.venue.scout.recommender.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-JVM implementation of {@link TtlStateStore}. Entries remember their own expiry instant,
 * so invalidation is driven by the injected clock.
 */
public final class InMemoryTtlStateStore implements TtlStateStore {

    private record Entry(String value, long expAtMillis) {
        boolean expiredAt(long now) {
            return expAtMillis > 0 && now >= expAtMillis;
        }
    }

    private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
    private final String prefix;
    private final Clock clock;

    public InMemoryTtlStateStore(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    private String k(String key) {
        return prefix + key;
    }

    private Entry entry(String value, Duration ttl, long now) {
        long exp = (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0L : now + ttl.toMillis();
        return new Entry(value, exp);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        map.put(k(key), entry(value, ttl, clock.millis()));
    }

    @Override
    public Optional<String> get(String key) {
        final String kk = k(key);
        final Entry e = map.get(kk);
        if (e == null) return Optional.empty();
        if (e.expiredAt(clock.millis())) {
            map.remove(kk, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value());
    }

    @Override
    public void delete(String key) {
        map.remove(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String kk = k(key);
        for (; ; ) {
            final long now = clock.millis();
            final Entry existing = map.get(kk);
            final Entry fresh = entry(value, ttl, now);
            if (existing == null) {
                if (map.putIfAbsent(kk, fresh) == null) return true;
            } else if (existing.expiredAt(now)) {
                if (map.replace(kk, existing, fresh)) return true;
            } else {
                return false;
            }
            // lost race; retry
        }
    }

    /** Number of live and not yet evicted entries. */
    public int size() {
        return map.size();
    }
}
