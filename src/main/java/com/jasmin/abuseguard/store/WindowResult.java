package com.jasmin.abuseguard.store;

/**
 * @param allowed      whether the attempt fitted under the limit
 * @param count        attempts in the window after the call
 * @param oldestMillis timestamp of the oldest counted attempt, or -1 when the log is empty
 */
public record WindowResult(boolean allowed, long count, long oldestMillis) {

    /** Milliseconds until the oldest counted attempt leaves the window. */
    public long retryAfterMillis(long nowMillis, long windowMillis) {
        if (oldestMillis < 0) {
            return windowMillis;
        }
        return Math.max(0L, oldestMillis + windowMillis - nowMillis);
    }
}
