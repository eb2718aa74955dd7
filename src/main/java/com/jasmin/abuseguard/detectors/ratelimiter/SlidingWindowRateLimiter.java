package com.jasmin.abuseguard.detectors.ratelimiter;

import com.jasmin.abuseguard.detectors.DetectorUtils;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.services.KeyManager;
import com.jasmin.abuseguard.services.SecurityEventPublisher;
import com.jasmin.abuseguard.store.SecurityStore;
import com.jasmin.abuseguard.store.WindowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Sliding-window log limiter. Each key keeps the timestamps of its recent attempts; an attempt is
 * allowed while fewer than {@code limit} of them lie inside the trailing window.
 * <p>
 * The prune-count-append sequence runs as one atomic store operation per key, so concurrent
 * checks on the same key cannot both slip under the limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlidingWindowRateLimiter {

    private final SecurityStore store;
    private final KeyManager keys;
    private final RateLimitProperties cfg;
    private final SecurityEventPublisher events;
    private final Clock clock;

    /** Checks against the configured rule for the key's action. */
    public RateLimitDecision check(RateLimitKey key) {
        ActionRule rule = cfg.ruleFor(key.getAction());
        return check(key, rule.getLimit(), rule.window());
    }

    public RateLimitDecision check(RateLimitKey key, int limit, Duration window) {
        validate(limit, window);
        long nowMs = clock.millis();
        long windowMs = window.toMillis();

        WindowResult res = store.acquire(keys.attemptLog(key), nowMs, windowMs, limit);
        if (res.allowed()) {
            return RateLimitDecision.allowed((int) (limit - res.count()));
        }

        long retryAfter = DetectorUtils.ceilSeconds(res.retryAfterMillis(nowMs, windowMs));
        log.info("Rate limit exceeded identifier={} action={} count={} limit={} windowSeconds={}",
                key.getIdentifier(), key.getAction(), res.count(), limit, window.toSeconds());
        events.publish(EventType.RATE_LIMIT_EXCEEDED, key, Severity.WARNING,
                String.format("%d/%d attempts within %d seconds", res.count(), limit, window.toSeconds()));
        return RateLimitDecision.rateLimited(retryAfter);
    }

    /** Attempts still available for the key, without recording one. */
    public int remaining(RateLimitKey key, int limit, Duration window) {
        validate(limit, window);
        WindowResult res = store.peek(keys.attemptLog(key), clock.millis(), window.toMillis(), limit);
        return (int) Math.max(0, limit - res.count());
    }

    public int remaining(RateLimitKey key) {
        ActionRule rule = cfg.ruleFor(key.getAction());
        return remaining(key, rule.getLimit(), rule.window());
    }

    /** Forgets every recorded attempt for the key. Penalties and blocks are untouched. */
    public void reset(RateLimitKey key) {
        store.delete(keys.attemptLog(key));
    }

    public static void validate(int limit, Duration window) {
        if (window == null || window.isNegative() || window.toMillis() <= 0) {
            throw new RateLimitConfigurationException("Rate limit window must be positive, got " + window);
        }
        if (limit < 0) {
            throw new RateLimitConfigurationException("Rate limit must not be negative, got " + limit);
        }
    }
}
