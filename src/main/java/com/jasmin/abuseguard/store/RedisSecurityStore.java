package com.jasmin.abuseguard.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed store. Attempt logs are sorted sets updated by {@code lua/sliding_window.lua},
 * so prune, count and append run as one atomic step on the server.
 */
@Slf4j
public class RedisSecurityStore implements SecurityStore {

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> SLIDING_WINDOW =
            RedisScript.of(new ClassPathResource("lua/sliding_window.lua"), List.class);

    private static final RedisScript<Long> INCR_EXPIRE =
            RedisScript.of(new ClassPathResource("lua/incr_expire.lua"), Long.class);

    private final StringRedisTemplate redis;

    public RedisSecurityStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("get", key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set", key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(call("setIfAbsent", key, () -> redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Long value = call("increment", key,
                () -> redis.execute(INCR_EXPIRE, List.of(key), String.valueOf(ttl.toMillis())));
        if (value == null) {
            throw new StorageUnavailableException("Empty increment response for key " + key);
        }
        return value;
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> values = call("multiGet", keys.get(0), () -> redis.opsForValue().multiGet(keys));
        if (values == null) {
            throw new StorageUnavailableException("Empty multiGet response");
        }
        return values;
    }

    @Override
    public void delete(String key) {
        call("delete", key, () -> redis.delete(key));
    }

    @Override
    public WindowResult acquire(String key, long nowMillis, long windowMillis, int limit) {
        return window(key, nowMillis, windowMillis, limit, true);
    }

    @Override
    public WindowResult peek(String key, long nowMillis, long windowMillis, int limit) {
        return window(key, nowMillis, windowMillis, limit, false);
    }

    private WindowResult window(String key, long nowMillis, long windowMillis, int limit, boolean mutate) {
        String member = nowMillis + ":" + UUID.randomUUID();
        List<?> res = call("slidingWindow", key, () -> redis.execute(
                SLIDING_WINDOW,
                List.of(key),
                String.valueOf(nowMillis),
                String.valueOf(windowMillis),
                String.valueOf(limit),
                member,
                mutate ? "1" : "0"
        ));

        if (res == null || res.size() < 3 || res.get(0) == null || res.get(1) == null || res.get(2) == null) {
            log.warn("Invalid sliding-window script response for key={}, res={}", key, res);
            throw new StorageUnavailableException("Invalid sliding-window response for key " + key);
        }

        try {
            boolean allowed = ((Number) res.get(0)).intValue() == 1;
            long count = ((Number) res.get(1)).longValue();
            long oldest = ((Number) res.get(2)).longValue();
            return new WindowResult(allowed, count, oldest);
        } catch (ClassCastException e) {
            throw new StorageUnavailableException("Unexpected sliding-window response types for key " + key, e);
        }
    }

    private <T> T call(String op, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Redis " + op + " failed for key " + key, e);
        }
    }
}
