package com.venue.scout.recommender.core;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation; expiry is delegated to Redis key TTLs.
 */
public final class RedisTtlStateStore implements TtlStateStore {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisTtlStateStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    private static boolean noExpiry(Duration ttl) {
        return ttl == null || ttl.isZero() || ttl.isNegative();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (noExpiry(ttl)) {
            redis.opsForValue().set(k(key), value);
        } else {
            redis.opsForValue().set(k(key), value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean ok = noExpiry(ttl)
                ? redis.opsForValue().setIfAbsent(k(key), value)
                : redis.opsForValue().setIfAbsent(k(key), value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        return Boolean.TRUE.equals(ok);
    }
}
