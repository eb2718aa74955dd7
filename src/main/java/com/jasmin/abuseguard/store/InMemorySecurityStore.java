package com.jasmin.abuseguard.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Single-process store on a Caffeine cache. Each key is updated inside
 * {@link ConcurrentMap#compute} on the cache's map view, which serializes writers of the same key
 * and leaves other keys free. Every entry carries its own deadline; Caffeine drops it once the
 * deadline passes, whether or not the key is read again. Cache time follows the injected clock.
 */
public class InMemorySecurityStore implements SecurityStore {

    private final Clock clock;
    private final Cache<String, Entry> cache;
    private final ConcurrentMap<String, Entry> entries;

    public InMemorySecurityStore(Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new EntryExpiry(clock))
                .executor(Runnable::run)
                .build();
        this.entries = cache.asMap();
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = live(key);
        if (e == null || !(e.value instanceof String)) {
            return Optional.empty();
        }
        return Optional.of((String) e.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        boolean[] stored = {false};
        entries.compute(key, (k, current) -> {
            if (current != null && !current.isExpired(clock.millis())) {
                return current;
            }
            stored[0] = true;
            return new Entry(value, expiry(ttl));
        });
        return stored[0];
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Entry updated = entries.compute(key, (k, current) -> {
            long next = 1L;
            if (current != null && !current.isExpired(clock.millis()) && current.value instanceof String s) {
                next = Long.parseLong(s) + 1L;
            }
            return new Entry(Long.toString(next), expiry(ttl));
        });
        return Long.parseLong((String) updated.value);
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(get(key).orElse(null));
        }
        return values;
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public WindowResult acquire(String key, long nowMillis, long windowMillis, int limit) {
        return window(key, nowMillis, windowMillis, limit, true);
    }

    @Override
    public WindowResult peek(String key, long nowMillis, long windowMillis, int limit) {
        return window(key, nowMillis, windowMillis, limit, false);
    }

    /** Live entries, after expired ones have been evicted. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private WindowResult window(String key, long nowMillis, long windowMillis, int limit, boolean mutate) {
        WindowResult[] result = new WindowResult[1];
        entries.compute(key, (k, current) -> {
            Deque<Long> log = new ArrayDeque<>();
            if (current != null && !current.isExpired(clock.millis()) && current.value instanceof Deque<?> d) {
                for (Object o : d) {
                    log.add((Long) o);
                }
            }

            long cutoff = nowMillis - windowMillis;
            log.removeIf(ts -> ts < cutoff);
            long oldest = log.stream().mapToLong(Long::longValue).min().orElse(-1L);

            if (log.size() >= limit) {
                result[0] = new WindowResult(false, log.size(), oldest);
                return log.isEmpty() ? null : new Entry(log, current.expiresAt);
            }

            if (!mutate) {
                result[0] = new WindowResult(true, log.size(), oldest);
                return log.isEmpty() ? null : new Entry(log, current.expiresAt);
            }

            log.addLast(nowMillis);
            result[0] = new WindowResult(true, log.size(), oldest < 0 ? nowMillis : oldest);
            return new Entry(log, clock.millis() + windowMillis);
        });
        return result[0];
    }

    private Entry live(String key) {
        Entry e = cache.getIfPresent(key);
        if (e != null && e.isExpired(clock.millis())) {
            return null;
        }
        return e;
    }

    private long expiry(Duration ttl) {
        return clock.millis() + ttl.toMillis();
    }

    private static final class Entry {
        private final Object value;
        private final long expiresAt;

        private Entry(Object value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAt;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {
        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Entry entry) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, entry.expiresAt - clock.millis()));
        }
    }
}
