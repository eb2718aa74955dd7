package com.jasmin.abuseguard.services;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "abuse-guard.stats")
public class StatsProperties {

    private boolean enabled = true;

    /** How long per-minute counters are kept. */
    @NotNull
    @DurationMin(seconds = 1)
    private Duration retention = Duration.ofDays(7);

    /** Widest range a single statistics query may span, in minutes. */
    @Min(1)
    @Max(10_080)
    private int maxRangeMinutes = 1440;
}
