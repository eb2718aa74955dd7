package com.jasmin.abuseguard.services;

import com.jasmin.abuseguard.constants.Constants;
import com.jasmin.abuseguard.detectors.ratelimiter.FailurePolicy;
import com.jasmin.abuseguard.detectors.ratelimiter.RateLimitConfigurationException;
import com.jasmin.abuseguard.models.BlockReason;
import com.jasmin.abuseguard.models.BlockScope;
import com.jasmin.abuseguard.models.BlockStatus;
import com.jasmin.abuseguard.models.DenialReason;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.LoginDecision;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.models.SecurityAlert;
import com.jasmin.abuseguard.models.SecurityEvent;
import com.jasmin.abuseguard.models.Severity;
import com.jasmin.abuseguard.models.SubjectType;
import com.jasmin.abuseguard.store.SecurityStore;
import com.jasmin.abuseguard.store.StorageUnavailableException;
import com.jasmin.abuseguard.support.EngineFixture;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AbuseGuardServiceTest {

    private static final Duration MINUTE = Duration.ofSeconds(60);

    private final EngineFixture fx = new EngineFixture();
    private final AbuseGuardService service = fx.service;

    @Test
    void exceedingLimitRecordsViolationAndPenalizes() {
        assertThat(service.checkRateLimit("user-1", "message_send", 2, MINUTE).isAllowed()).isTrue();
        assertThat(service.checkRateLimit("user-1", "message_send", 2, MINUTE).isAllowed()).isTrue();

        RateLimitDecision denied = service.checkRateLimit("user-1", "message_send", 2, MINUTE);
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getReason()).isEqualTo(DenialReason.RATE_LIMITED);
        assertThat(denied.getRetryAfterSeconds()).isEqualTo(300);

        RateLimitDecision penalized = service.checkRateLimit("user-1", "message_send", 2, MINUTE);
        assertThat(penalized.getReason()).isEqualTo(DenialReason.PENALIZED);
        assertThat(penalized.getUntil()).isEqualTo(EngineFixture.START.plus(Duration.ofMinutes(5)));

        fx.clock.advance(Duration.ofMinutes(5));
        assertThat(service.checkRateLimit("user-1", "message_send", 2, MINUTE).isAllowed()).isTrue();
    }

    @Test
    void penalizedChecksDoNotConsumeTheWindow() {
        fx.escalator.recordViolation(RateLimitKey.of("user-1", "like_action"));

        for (int i = 0; i < 10; i++) {
            assertThat(service.checkRateLimit("user-1", "like_action").getReason()).isEqualTo(DenialReason.PENALIZED);
        }

        assertThat(service.remainingAttempts("user-1", "like_action")).isEqualTo(50);
        assertThat(fx.escalator.status(RateLimitKey.of("user-1", "like_action")).getViolationCount()).isEqualTo(1);
    }

    @Test
    void blockIsCheckedBeforePenalty() {
        fx.escalator.recordViolation(RateLimitKey.of("user-1", "message_send"));
        service.block("user-1", BlockScope.IDENTIFIER, Duration.ofMinutes(10), null);

        RateLimitDecision decision = service.checkRateLimit("user-1", "message_send");

        assertThat(decision.getReason()).isEqualTo(DenialReason.BLOCKED);
        assertThat(decision.getBlockReason()).isEqualTo(BlockReason.MANUAL);
        assertThat(decision.getRetryAfterSeconds()).isEqualTo(600);
    }

    @Test
    void blockAppliesToEveryActionAndLiftsWhenItExpires() {
        service.block("user-2", BlockScope.ACCOUNT, Duration.ofMinutes(10), "chargeback");

        assertThat(service.checkRateLimit("user-2", "message_send").getReason()).isEqualTo(DenialReason.BLOCKED);
        assertThat(service.checkRateLimit("user-2", "photo_upload").getReason()).isEqualTo(DenialReason.BLOCKED);
        assertThat(service.checkRateLimit("user-3", "photo_upload").isAllowed()).isTrue();

        fx.clock.advance(Duration.ofMinutes(10));

        assertThat(service.isBlocked("user-2").isBlocked()).isFalse();
        assertThat(service.checkRateLimit("user-2", "message_send").isAllowed()).isTrue();
    }

    @Test
    void manualBlockReplacesExistingBlockAndRaisesAlert() {
        fx.blocks.block("user-4", BlockScope.ACCOUNT, BlockReason.BURST_DETECTED, Duration.ofHours(1));

        BlockStatus status = service.block("user-4", BlockScope.ACCOUNT, Duration.ofMinutes(5), "false positive");

        assertThat(status.isBlocked()).isTrue();
        assertThat(status.getReason()).isEqualTo(BlockReason.MANUAL);
        assertThat(service.isBlocked("user-4").getUntil()).isEqualTo(EngineFixture.START.plus(Duration.ofMinutes(5)));

        List<SecurityAlert> alerts = fx.alertDispatcher.alertsOfType(Constants.MANUAL_BLOCK);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getSeverity()).isEqualTo(Severity.INFO);
        assertThat(alerts.get(0).getDetails()).contains("false positive");
    }

    @Test
    void invalidOverridesAreRejected() {
        assertThatThrownBy(() -> service.checkRateLimit("user-1", "message_send", 5, Duration.ZERO))
                .isInstanceOf(RateLimitConfigurationException.class);
        assertThatThrownBy(() -> service.checkRateLimit("user-1", "message_send", -3, MINUTE))
                .isInstanceOf(RateLimitConfigurationException.class);
        assertThatThrownBy(() -> service.block("user-1", BlockScope.ACCOUNT, Duration.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failedOperationIsPublishedForTheAccount() {
        service.reportFailedOperation("acct-9", "token_verify", "expired token");

        List<SecurityEvent> events = fx.eventListener.eventsOfType(EventType.OPERATION_FAILED);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getSubject()).isEqualTo("acct-9");
        assertThat(events.get(0).getSubjectType()).isEqualTo(SubjectType.ACCOUNT);
        assertThat(events.get(0).getAction()).isEqualTo("token_verify");
    }

    @Test
    void colonBearingPairsKeepSeparateWindowsAndPenalties() {
        assertThat(service.checkRateLimit("x:y", "a", 1, MINUTE).isAllowed()).isTrue();
        assertThat(service.checkRateLimit("y", "a:x", 1, MINUTE).isAllowed()).isTrue();

        assertThat(service.checkRateLimit("x:y", "a", 1, MINUTE).getReason()).isEqualTo(DenialReason.RATE_LIMITED);

        assertThat(fx.escalator.status(RateLimitKey.of("y", "a:x")).getViolationCount()).isZero();
        assertThat(service.remainingAttempts("y", "a:x")).isEqualTo(99);
    }

    @Test
    void blankIdentifierIsTrackedAsUnknown() {
        service.checkRateLimit("  ", "search_query", 1, MINUTE);

        assertThat(service.checkRateLimit(null, "search_query", 1, MINUTE).isAllowed()).isFalse();
    }

    @Nested
    class WhenStoreIsDown {

        private final SecurityStore broken = mock(SecurityStore.class, invocation -> {
            throw new StorageUnavailableException("connection refused");
        });
        private final EngineFixture down = new EngineFixture(broken, false);

        @Test
        void failOpenActionIsAllowed() {
            RateLimitDecision decision = down.service.checkRateLimit("user-1", "field_create");

            assertThat(decision.isAllowed()).isTrue();
        }

        @Test
        void failClosedActionIsDenied() {
            RateLimitDecision decision = down.service.checkRateLimit("user-1", Constants.REGISTRATION);

            assertThat(decision.isAllowed()).isFalse();
            assertThat(decision.getReason()).isEqualTo(DenialReason.STORAGE_UNAVAILABLE);
            assertThat(decision.getRetryAfterSeconds()).isEqualTo(1);
        }

        @Test
        void loginAttemptFollowsLoginPolicy() {
            LoginDecision decision = down.service.checkLoginAttempt("alice", "203.0.113.7");

            assertThat(decision.isAllowed()).isFalse();
            assertThat(decision.getCause()).isEqualTo(DenialReason.STORAGE_UNAVAILABLE);
        }

        @Test
        void loginAttemptCanBeConfiguredFailOpen() {
            down.rateLimitProperties.getActions().get(Constants.LOGIN_ATTEMPT)
                    .setFailurePolicy(FailurePolicy.FAIL_OPEN);

            assertThat(down.service.checkLoginAttempt("alice", "203.0.113.7").isAllowed()).isTrue();
        }

        @Test
        void reportingPropagatesTheStoreFailure() {
            assertThatThrownBy(() -> down.service.reportLoginFailure("alice", "203.0.113.7"))
                    .isInstanceOf(StorageUnavailableException.class);
        }
    }
}
