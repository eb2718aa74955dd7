package com.jasmin.abuseguard.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Expiring key-value contract the engine keeps all of its mutable state in.
 * <p>
 * Every method may throw {@link StorageUnavailableException} when the backing store cannot be
 * reached or answers with something unusable. Implementations must apply
 * {@link #acquire} atomically per key; operations on different keys must not contend.
 */
public interface SecurityStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /** Stores the value only when the key holds nothing live. Returns true if it was stored. */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /** Increments the counter at {@code key} and (re)sets its TTL. Returns the new value. */
    long incrementAndExpire(String key, Duration ttl);

    /** Values for the given keys, in order; missing keys yield {@code null} elements. */
    List<String> multiGet(List<String> keys);

    void delete(String key);

    /**
     * Sliding-window acquire: drops timestamps older than {@code nowMillis - windowMillis}; if the
     * remaining count is below {@code limit} appends {@code nowMillis} and sets TTL = window.
     * A denial leaves the log untouched.
     */
    WindowResult acquire(String key, long nowMillis, long windowMillis, int limit);

    /** Same as {@link #acquire} but never appends. */
    WindowResult peek(String key, long nowMillis, long windowMillis, int limit);
}
