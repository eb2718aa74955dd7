package com.jasmin.abuseguard.detectors.bruteforcedetector;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.bruteforce")
public class BruteForceProperties {

    private boolean enabled = true;

    // failure windows come from the login_attempt / login_account rate-limit rules

    /** Block applied to an origin that exceeds its threshold. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration originBlockDuration = Duration.ofHours(1);

    /** Lock applied to an account that exceeds its threshold. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration accountLockDuration = Duration.ofMinutes(30);

    /* ------------------------- Ban escalation ------------------------- */

    /** Origin blocks within {@link #lockoutTallyTtl} after which the origin is banned. */
    @Min(1)
    private int maxLockouts = 3;

    @NotNull
    @DurationMin(seconds = 1)
    private Duration banDuration = Duration.ofHours(24);

    @NotNull
    @DurationMin(seconds = 1)
    private Duration lockoutTallyTtl = Duration.ofHours(24);
}
