package com.jasmin.abuseguard.detectors.bruteforcedetector;

import com.jasmin.abuseguard.constants.Constants;
import com.jasmin.abuseguard.detectors.DetectorUtils;
import com.jasmin.abuseguard.detectors.penalty.PenaltyEscalator;
import com.jasmin.abuseguard.detectors.ratelimiter.SlidingWindowRateLimiter;
import com.jasmin.abuseguard.models.BlockReason;
import com.jasmin.abuseguard.models.BlockScope;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.LoginDecision;
import com.jasmin.abuseguard.models.LoginDenial;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.models.SubjectType;
import com.jasmin.abuseguard.services.BlockService;
import com.jasmin.abuseguard.services.KeyManager;
import com.jasmin.abuseguard.services.SecurityAlertService;
import com.jasmin.abuseguard.services.SecurityEventPublisher;
import com.jasmin.abuseguard.store.SecurityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Login protection over two independent identities: the client's network origin and the account
 * being logged into. Each has its own failure window, taken from the {@code login_attempt} and
 * {@code login_account} rate-limit rules; exceeding either escalates the key's penalty and places a
 * hard block on that identity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BruteForceGuard {

    private final SlidingWindowRateLimiter limiter;
    private final PenaltyEscalator escalator;
    private final BlockService blocks;
    private final SecurityEventPublisher events;
    private final SecurityAlertService alerts;
    private final AccountResolver accounts;
    private final SecurityStore store;
    private final KeyManager keys;
    private final BruteForceProperties cfg;
    private final Clock clock;

    /**
     * Records a failed login. Unknown usernames still consume the origin's window, so failures
     * look the same whether or not the account exists.
     */
    public void onLoginFailure(String username, String networkOrigin) {
        if (!cfg.isEnabled()) {
            return;
        }
        final String origin = DetectorUtils.nullSafe(networkOrigin);

        events.publish(EventType.LOGIN_FAILURE, origin, SubjectType.NETWORK_ORIGIN, Severity.INFO,
                Constants.LOGIN_ATTEMPT, "failed login");

        RateLimitKey originKey = originKey(origin);
        RateLimitDecision originDecision = limiter.check(originKey);
        if (!originDecision.isAllowed()) {
            escalator.recordViolation(originKey);
            blockOrigin(origin);
        }

        Optional<String> accountId = resolve(username);
        if (accountId.isEmpty()) {
            return;
        }

        events.publish(EventType.LOGIN_FAILURE, accountId.get(), SubjectType.ACCOUNT, Severity.INFO,
                Constants.LOGIN_ACCOUNT, "failed login from " + origin);

        RateLimitKey accountKey = accountKey(accountId.get());
        RateLimitDecision accountDecision = limiter.check(accountKey);
        if (!accountDecision.isAllowed()) {
            escalator.recordViolation(accountKey);
            blocks.block(accountId.get(), BlockScope.ACCOUNT, BlockReason.REPEATED_FAILURES, cfg.getAccountLockDuration());
        }
    }

    /** Decides, before credentials are verified, whether the attempt may proceed. */
    public LoginDecision onLoginAttempt(String username, String networkOrigin) {
        if (!cfg.isEnabled()) {
            return LoginDecision.allow();
        }
        final String origin = DetectorUtils.nullSafe(networkOrigin);
        final Instant now = clock.instant();

        Optional<RateLimitDecision> originDenial = blocks.activeBlock(origin)
                .map(record -> RateLimitDecision.blocked(record, now))
                .or(() -> escalator.isPenalized(originKey(origin)));
        if (originDenial.isPresent()) {
            log.debug("Login attempt denied origin={} cause={}", origin, originDenial.get().getReason());
            return LoginDecision.deny(LoginDenial.ORIGIN_BLOCKED, originDenial.get());
        }

        Optional<String> accountId = resolve(username);
        if (accountId.isPresent()) {
            Optional<RateLimitDecision> accountDenial = blocks.activeBlock(accountId.get())
                    .map(record -> RateLimitDecision.blocked(record, now))
                    .or(() -> escalator.isPenalized(accountKey(accountId.get())));
            if (accountDenial.isPresent()) {
                log.debug("Login attempt denied account={} cause={}", accountId.get(), accountDenial.get().getReason());
                return LoginDecision.deny(LoginDenial.ACCOUNT_LOCKED, accountDenial.get());
            }
        }

        return LoginDecision.allow();
    }

    /** Clears the failure windows after a successful login. Penalties and blocks stay. */
    public void onLoginSuccess(String username, String networkOrigin) {
        if (!cfg.isEnabled()) {
            return;
        }
        limiter.reset(originKey(DetectorUtils.nullSafe(networkOrigin)));
        resolve(username).ifPresent(accountId -> limiter.reset(accountKey(accountId)));
    }

    /** Blocks the origin; the lockout tally only grows when a new block was actually placed. */
    private void blockOrigin(String origin) {
        String tallyKey = keys.lockouts(origin);
        long lockouts = store.get(tallyKey).map(BruteForceGuard::parseCount).orElse(0L) + 1;
        boolean ban = lockouts >= cfg.getMaxLockouts();
        Duration duration = ban ? cfg.getBanDuration() : cfg.getOriginBlockDuration();

        blocks.block(origin, BlockScope.NETWORK_ORIGIN, BlockReason.EXCESSIVE_FAILED_LOGINS, duration)
                .ifPresent(record -> {
                    store.incrementAndExpire(tallyKey, cfg.getLockoutTallyTtl());
                    if (ban) {
                        alerts.raise(Constants.ORIGIN_BANNED, Severity.CRITICAL, origin,
                                String.format("%d lockouts within %d hours, banned until %s",
                                        lockouts, cfg.getLockoutTallyTtl().toHours(), record.getBlockedUntil()));
                    }
                });
    }

    private Optional<String> resolve(String username) {
        String normalized = DetectorUtils.normalizeValue(username);
        if (normalized == null) {
            return Optional.empty();
        }
        return accounts.resolve(normalized);
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed lockout tally '{}'", value);
            return 0L;
        }
    }

    private static RateLimitKey originKey(String origin) {
        return RateLimitKey.origin(origin, Constants.LOGIN_ATTEMPT);
    }

    private static RateLimitKey accountKey(String accountId) {
        return RateLimitKey.account(accountId, Constants.LOGIN_ACCOUNT);
    }
}
