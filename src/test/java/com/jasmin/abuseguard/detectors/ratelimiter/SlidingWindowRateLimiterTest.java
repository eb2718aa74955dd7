package com.jasmin.abuseguard.detectors.ratelimiter;

import com.jasmin.abuseguard.models.DenialReason;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.SecurityEvent;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.support.EngineFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private final EngineFixture fx = new EngineFixture();
    private final SlidingWindowRateLimiter limiter = fx.limiter;

    private static final Duration MINUTE = Duration.ofSeconds(60);

    @Test
    void allowsExactlyLimitAttemptsWithinWindow() {
        RateLimitKey key = RateLimitKey.of("user-1", "field_create");

        for (int i = 0; i < 5; i++) {
            RateLimitDecision d = limiter.check(key, 5, MINUTE);
            assertThat(d.isAllowed()).isTrue();
            assertThat(d.getRemaining()).isEqualTo(4 - i);
        }

        RateLimitDecision sixth = limiter.check(key, 5, MINUTE);
        assertThat(sixth.isAllowed()).isFalse();
        assertThat(sixth.getReason()).isEqualTo(DenialReason.RATE_LIMITED);
        assertThat(sixth.getRetryAfterSeconds()).isEqualTo(60);
        assertThat(sixth.getMessage()).contains("60 seconds");
    }

    @Test
    void deniedKeyRecoversOnceOldestAttemptLeavesWindow() {
        RateLimitKey key = RateLimitKey.of("user-1", "profile_update");
        Duration twoSeconds = Duration.ofSeconds(2);

        assertThat(limiter.check(key, 1, twoSeconds).isAllowed()).isTrue();

        fx.clock.advanceMillis(1_000);
        RateLimitDecision denied = limiter.check(key, 1, twoSeconds);
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getRetryAfterSeconds()).isEqualTo(1);

        fx.clock.advanceMillis(1_100);
        assertThat(limiter.check(key, 1, twoSeconds).isAllowed()).isTrue();
    }

    @Test
    void repeatedDenialsDoNotGrowTheAttemptLog() {
        RateLimitKey key = RateLimitKey.of("user-1", "search_query");

        assertThat(limiter.check(key, 2, MINUTE).isAllowed()).isTrue();
        fx.clock.advanceMillis(1_000);
        assertThat(limiter.check(key, 2, MINUTE).isAllowed()).isTrue();

        for (int i = 0; i < 10; i++) {
            fx.clock.advanceMillis(1_000);
            assertThat(limiter.check(key, 2, MINUTE).isAllowed()).isFalse();
        }

        // t = 60.5s: only the attempt at t = 0 has left the window
        fx.clock.set(EngineFixture.START.plusMillis(60_500));
        assertThat(limiter.check(key, 2, MINUTE).isAllowed()).isTrue();
        fx.clock.advanceMillis(100);
        assertThat(limiter.check(key, 2, MINUTE).isAllowed()).isFalse();
    }

    @Test
    void keysAreIndependentAcrossIdentifiersAndActions() {
        RateLimitKey aX = RateLimitKey.of("idA", "message_send");
        RateLimitKey bX = RateLimitKey.of("idB", "message_send");
        RateLimitKey aY = RateLimitKey.of("idA", "like_action");

        assertThat(limiter.check(aX, 1, MINUTE).isAllowed()).isTrue();
        assertThat(limiter.check(aX, 1, MINUTE).isAllowed()).isFalse();

        assertThat(limiter.check(bX, 1, MINUTE).isAllowed()).isTrue();
        assertThat(limiter.check(aY, 1, MINUTE).isAllowed()).isTrue();
        assertThat(limiter.remaining(aY, 2, MINUTE)).isEqualTo(1);
    }

    @Test
    void colonsInIdentifierOrActionNeverMergeTwoKeys() {
        RateLimitKey first = RateLimitKey.of("x:y", "a");
        RateLimitKey second = RateLimitKey.of("y", "a:x");
        assertThat(fx.keys.attemptLog(first)).isNotEqualTo(fx.keys.attemptLog(second));

        assertThat(limiter.check(first, 1, MINUTE).isAllowed()).isTrue();
        assertThat(limiter.check(second, 1, MINUTE).isAllowed()).isTrue();

        RateLimitKey v6 = RateLimitKey.origin("2001:db8::1", "login_attempt");
        RateLimitKey v6Other = RateLimitKey.origin("2001:db8::2", "login_attempt");
        assertThat(limiter.check(v6, 1, MINUTE).isAllowed()).isTrue();
        assertThat(limiter.check(v6, 1, MINUTE).isAllowed()).isFalse();
        assertThat(limiter.check(v6Other, 1, MINUTE).isAllowed()).isTrue();
    }

    @Test
    void zeroLimitDeniesEveryAttempt() {
        RateLimitKey key = RateLimitKey.of("user-1", "photo_upload");

        RateLimitDecision d = limiter.check(key, 0, MINUTE);

        assertThat(d.isAllowed()).isFalse();
        assertThat(d.getRetryAfterSeconds()).isEqualTo(60);
        assertThat(limiter.check(key, 0, MINUTE).isAllowed()).isFalse();
    }

    @Test
    void rejectsNonPositiveWindowAndNegativeLimit() {
        RateLimitKey key = RateLimitKey.of("user-1", "field_create");

        assertThatThrownBy(() -> limiter.check(key, 5, Duration.ZERO))
                .isInstanceOf(RateLimitConfigurationException.class);
        assertThatThrownBy(() -> limiter.check(key, 5, Duration.ofSeconds(-1)))
                .isInstanceOf(RateLimitConfigurationException.class);
        assertThatThrownBy(() -> limiter.check(key, -1, MINUTE))
                .isInstanceOf(RateLimitConfigurationException.class);
    }

    @Test
    void denialPublishesRateLimitEvent() {
        RateLimitKey key = RateLimitKey.origin("203.0.113.7", "registration");
        limiter.check(key, 1, MINUTE);
        assertThat(fx.eventListener.events()).isEmpty();

        limiter.check(key, 1, MINUTE);

        List<SecurityEvent> events = fx.eventListener.eventsOfType(EventType.RATE_LIMIT_EXCEEDED);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getSubject()).isEqualTo("203.0.113.7");
        assertThat(events.get(0).getAction()).isEqualTo("registration");
        assertThat(events.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(events.get(0).getTimestamp()).isEqualTo(EngineFixture.START);
    }

    @Test
    void usesConfiguredRuleAndFallsBackToDefaultRule() {
        RateLimitKey known = RateLimitKey.of("user-1", "profile_update");
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.check(known).isAllowed()).isTrue();
        }
        assertThat(limiter.check(known).isAllowed()).isFalse();

        RateLimitKey unknown = RateLimitKey.of("user-1", "poke_action");
        assertThat(limiter.check(unknown).getRemaining()).isEqualTo(99);
    }

    @Test
    void resetForgetsAttempts() {
        RateLimitKey key = RateLimitKey.of("user-1", "message_send");
        limiter.check(key, 1, MINUTE);
        assertThat(limiter.remaining(key, 1, MINUTE)).isZero();

        limiter.reset(key);

        assertThat(limiter.remaining(key, 1, MINUTE)).isEqualTo(1);
    }
}
