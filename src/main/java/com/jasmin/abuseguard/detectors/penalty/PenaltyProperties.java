package com.jasmin.abuseguard.detectors.penalty;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.penalty")
public class PenaltyProperties {

    /** Lockout for the 1st, 2nd, ... violation; the last entry repeats once reached. */
    @NotEmpty
    private List<Duration> escalation = List.of(
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(24)
    );

    /** Lifetime of the violation tally, refreshed on every violation. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration violationTtl = Duration.ofHours(24);

    @AssertTrue(message = "escalation must contain positive, non-decreasing durations")
    public boolean isEscalationValid() {
        if (escalation == null) {
            return true;
        }
        Duration previous = Duration.ZERO;
        for (Duration d : escalation) {
            if (d == null || d.isNegative() || d.isZero() || d.compareTo(previous) < 0) {
                return false;
            }
            previous = d;
        }
        return true;
    }
}
