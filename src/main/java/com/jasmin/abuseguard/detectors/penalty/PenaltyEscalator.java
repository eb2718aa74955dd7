package com.jasmin.abuseguard.detectors.penalty;

import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.PenaltyRecord;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.services.KeyManager;
import com.jasmin.abuseguard.services.SecurityEventPublisher;
import com.jasmin.abuseguard.store.SecurityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Progressive lockouts. The n-th violation of a key within the tally lifetime locks it for the
 * n-th entry of the escalation sequence, capped at the last entry. The tally only grows; it is
 * reset by expiry of its storage entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PenaltyEscalator {

    private final SecurityStore store;
    private final KeyManager keys;
    private final PenaltyProperties cfg;
    private final SecurityEventPublisher events;
    private final Clock clock;

    public Duration recordViolation(RateLimitKey key) {
        long violations = store.incrementAndExpire(keys.violations(key), cfg.getViolationTtl());
        Duration duration = durationFor(violations);

        Instant until = clock.instant().plus(duration);
        store.set(keys.penaltyUntil(key), Long.toString(until.toEpochMilli()), duration);

        log.warn("Penalty applied identifier={} action={} violations={} durationSeconds={}",
                key.getIdentifier(), key.getAction(), violations, duration.toSeconds());
        events.publish(EventType.PENALTY_APPLIED, key, Severity.WARNING,
                String.format("violation %d, locked for %d seconds", violations, duration.toSeconds()));
        return duration;
    }

    /** A denial while a penalty is active, empty otherwise. */
    public Optional<RateLimitDecision> isPenalized(RateLimitKey key) {
        Instant now = clock.instant();
        return penaltyUntil(key)
                .filter(until -> until.isAfter(now))
                .map(until -> RateLimitDecision.penalized(until, now));
    }

    public PenaltyRecord status(RateLimitKey key) {
        long violations = store.get(keys.violations(key))
                .map(PenaltyEscalator::parseLong)
                .orElse(0L);
        Instant now = clock.instant();
        Instant until = penaltyUntil(key).filter(u -> u.isAfter(now)).orElse(null);
        return new PenaltyRecord(violations, until);
    }

    Duration durationFor(long violations) {
        List<Duration> sequence = cfg.getEscalation();
        int index = (int) Math.min(Math.max(violations - 1, 0), sequence.size() - 1);
        return sequence.get(index);
    }

    private Optional<Instant> penaltyUntil(RateLimitKey key) {
        return store.get(keys.penaltyUntil(key))
                .map(PenaltyEscalator::parseLong)
                .filter(ms -> ms > 0)
                .map(Instant::ofEpochMilli);
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed penalty value '{}'", value);
            return 0L;
        }
    }
}
