package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.constants.Constants;
import com.jasmin.abuseguard.detectors.DetectorUtils;
import com.jasmin.abuseguard.detectors.bruteforcedetector.BruteForceGuard;
import com.jasmin.abuseguard.detectors.penalty.PenaltyEscalator;
import com.jasmin.abuseguard.detectors.ratelimiter.ActionRule;
import com.jasmin.abuseguard.detectors.ratelimiter.FailurePolicy;
import com.jasmin.abuseguard.detectors.ratelimiter.RateLimitProperties;
import com.jasmin.abuseguard.detectors.ratelimiter.SlidingWindowRateLimiter;
import com.jasmin.abuseguard.models.BlockRecord;
import com.jasmin.abuseguard.models.BlockScope;
import com.jasmin.abuseguard.models.BlockStatus;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.LoginDecision;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.models.SubjectType;
import com.jasmin.abuseguard.store.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for the request-handling layer. Every gated operation runs
 * block → penalty → sliding window and stops at the first denial.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AbuseGuardService {

    private final SlidingWindowRateLimiter limiter;
    private final PenaltyEscalator escalator;
    private final BlockService blocks;
    private final BruteForceGuard bruteForceGuard;
    private final SecurityEventPublisher events;
    private final SecurityAlertService alerts;
    private final RateLimitProperties cfg;
    private final Clock clock;

    public RateLimitDecision checkRateLimit(String identifier, String action) {
        return checkRateLimit(identifier, action, null, null);
    }

    /**
     * @param limit  overrides the action's configured limit when not null
     * @param window overrides the action's configured window when not null
     */
    public RateLimitDecision checkRateLimit(String identifier, String action, Integer limit, Duration window) {
        ActionRule rule = cfg.ruleFor(action);
        int effectiveLimit = limit != null ? limit : rule.getLimit();
        Duration effectiveWindow = window != null ? window : rule.window();
        SlidingWindowRateLimiter.validate(effectiveLimit, effectiveWindow);

        RateLimitKey key = RateLimitKey.of(DetectorUtils.nullSafe(identifier), action);
        try {
            Instant now = clock.instant();
            Optional<BlockRecord> block = blocks.activeBlock(key.getIdentifier());
            if (block.isPresent()) {
                return RateLimitDecision.blocked(block.get(), now);
            }

            Optional<RateLimitDecision> penalty = escalator.isPenalized(key);
            if (penalty.isPresent()) {
                return penalty.get();
            }

            RateLimitDecision decision = limiter.check(key, effectiveLimit, effectiveWindow);
            if (decision.isAllowed()) {
                return decision;
            }

            Duration penaltyDuration = escalator.recordViolation(key);
            return RateLimitDecision.rateLimited(
                    Math.max(decision.getRetryAfterSeconds(), DetectorUtils.ceilSeconds(penaltyDuration)));
        } catch (StorageUnavailableException e) {
            return onStorageFailure(key, rule.getFailurePolicy(), e);
        }
    }

    public LoginDecision checkLoginAttempt(String username, String networkOrigin) {
        try {
            return bruteForceGuard.onLoginAttempt(username, networkOrigin);
        } catch (StorageUnavailableException e) {
            RateLimitDecision fallback = onStorageFailure(
                    RateLimitKey.origin(DetectorUtils.nullSafe(networkOrigin), Constants.LOGIN_ATTEMPT),
                    cfg.ruleFor(Constants.LOGIN_ATTEMPT).getFailurePolicy(), e);
            return fallback.isAllowed() ? LoginDecision.allow() : LoginDecision.unavailable(fallback);
        }
    }

    public void reportLoginFailure(String username, String networkOrigin) {
        bruteForceGuard.onLoginFailure(username, networkOrigin);
    }

    public void reportLoginSuccess(String username, String networkOrigin) {
        bruteForceGuard.onLoginSuccess(username, networkOrigin);
    }

    /** Reports a failed security-sensitive operation (bad token, rejected upload, ...) for an account. */
    public void reportFailedOperation(String accountId, String action, String details) {
        events.publish(EventType.OPERATION_FAILED, DetectorUtils.nullSafe(accountId), SubjectType.ACCOUNT,
                Severity.WARNING, action, details);
    }

    public BlockStatus isBlocked(String identifier) {
        return blocks.status(DetectorUtils.nullSafe(identifier));
    }

    public BlockStatus block(String identifier, BlockScope scope, Duration duration, String note) {
        BlockRecord record = blocks.forceBlock(DetectorUtils.nullSafe(identifier),
                scope == null ? BlockScope.IDENTIFIER : scope, duration);
        alerts.raise(Constants.MANUAL_BLOCK, Severity.INFO, record.getIdentifier(),
                String.format("blocked until %s%s", record.getBlockedUntil(), note == null ? "" : ": " + note));
        return BlockStatus.of(record);
    }

    public int remainingAttempts(String identifier, String action) {
        return limiter.remaining(RateLimitKey.of(DetectorUtils.nullSafe(identifier), action));
    }

    private RateLimitDecision onStorageFailure(RateLimitKey key, FailurePolicy policy, StorageUnavailableException e) {
        if (policy == FailurePolicy.FAIL_OPEN) {
            log.warn("Fail-open: store unavailable identifier={} action={}", key.getIdentifier(), key.getAction(), e);
            return RateLimitDecision.builder().allowed(true).build();
        }
        log.warn("Fail-closed: store unavailable identifier={} action={}", key.getIdentifier(), key.getAction(), e);
        return RateLimitDecision.storageUnavailable(cfg.getStorageFailureRetryAfterSeconds());
    }
}
