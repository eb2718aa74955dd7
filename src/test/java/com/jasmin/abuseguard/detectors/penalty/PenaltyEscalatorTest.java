package com.jasmin.abuseguard.detectors.penalty;

import com.jasmin.abuseguard.models.DenialReason;
import com.jasmin.abuseguard.models.EventType;
import com.jasmin.abuseguard.models.PenaltyRecord;
import com.jasmin.abuseguard.models.RateLimitDecision;
import com.jasmin.abuseguard.models.RateLimitKey;
import com.jasmin.abuseguard.support.EngineFixture;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PenaltyEscalatorTest {

    private final EngineFixture fx = new EngineFixture();
    private final PenaltyEscalator escalator = fx.escalator;
    private final RateLimitKey key = RateLimitKey.of("user-7", "message_send");

    @Test
    void escalatesThroughSequenceAndStaysAtCap() {
        List<Duration> durations = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            durations.add(escalator.recordViolation(key));
        }

        assertThat(durations).containsExactly(
                Duration.ofMinutes(5),
                Duration.ofMinutes(15),
                Duration.ofMinutes(30),
                Duration.ofHours(1),
                Duration.ofHours(24),
                Duration.ofHours(24),
                Duration.ofHours(24)
        );
    }

    @Test
    void penaltyDeniesUntilItRunsOut() {
        escalator.recordViolation(key);

        Optional<RateLimitDecision> denial = escalator.isPenalized(key);
        assertThat(denial).isPresent();
        assertThat(denial.get().getReason()).isEqualTo(DenialReason.PENALIZED);
        assertThat(denial.get().getUntil()).isEqualTo(EngineFixture.START.plus(Duration.ofMinutes(5)));
        assertThat(denial.get().getRetryAfterSeconds()).isEqualTo(300);

        fx.clock.advance(Duration.ofMinutes(4));
        assertThat(escalator.isPenalized(key)).isPresent();

        fx.clock.advance(Duration.ofMinutes(1));
        assertThat(escalator.isPenalized(key)).isEmpty();
    }

    @Test
    void violationTallyResetsOnlyWhenItsEntryExpires() {
        escalator.recordViolation(key);
        fx.clock.advance(Duration.ofHours(1));
        assertThat(escalator.recordViolation(key)).isEqualTo(Duration.ofMinutes(15));

        fx.clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThat(escalator.recordViolation(key)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void statusReportsTallyAndActivePenalty() {
        assertThat(escalator.status(key)).isEqualTo(new PenaltyRecord(0, null));

        escalator.recordViolation(key);
        escalator.recordViolation(key);

        PenaltyRecord record = escalator.status(key);
        assertThat(record.getViolationCount()).isEqualTo(2);
        assertThat(record.getPenaltyUntil()).isEqualTo(EngineFixture.START.plus(Duration.ofMinutes(15)));
        assertThat(record.isActiveAt(fx.clock.instant())).isTrue();
    }

    @Test
    void penaltiesAreKeyedPerIdentifierAndAction() {
        escalator.recordViolation(key);

        assertThat(escalator.isPenalized(RateLimitKey.of("user-8", "message_send"))).isEmpty();
        assertThat(escalator.isPenalized(RateLimitKey.of("user-7", "like_action"))).isEmpty();
    }

    @Test
    void publishesWarningOnEveryViolation() {
        escalator.recordViolation(key);
        escalator.recordViolation(key);

        assertThat(fx.eventListener.eventsOfType(EventType.PENALTY_APPLIED)).hasSize(2);
    }

    @Test
    void customSequenceIsHonoured() {
        fx.penaltyProperties.setEscalation(List.of(Duration.ofSeconds(10), Duration.ofSeconds(20)));

        assertThat(escalator.recordViolation(key)).isEqualTo(Duration.ofSeconds(10));
        assertThat(escalator.recordViolation(key)).isEqualTo(Duration.ofSeconds(20));
        assertThat(escalator.recordViolation(key)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void decreasingSequenceFailsValidation() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        PenaltyProperties props = new PenaltyProperties();
        assertThat(validator.validate(props)).isEmpty();

        props.setEscalation(List.of(Duration.ofMinutes(15), Duration.ofMinutes(5)));
        assertThat(validator.validate(props)).isNotEmpty();

        props.setEscalation(List.of(Duration.ZERO));
        assertThat(validator.validate(props)).isNotEmpty();

        props.setEscalation(List.of());
        assertThat(validator.validate(props)).isNotEmpty();
    }
}
