package com.jasmin.abuseguard.detectors.ratelimiter;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ActionRule {
    /** Attempts allowed within the window. 0 denies every attempt. */
    @Min(0)
    private int limit = 100;

    /** Sliding window length in seconds. */
    @Positive
    private long windowSeconds = 3600;

    @NotNull
    private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;

    public static ActionRule of(int limit, long windowSeconds) {
        return new ActionRule(limit, windowSeconds, FailurePolicy.FAIL_OPEN);
    }

    public static ActionRule failClosed(int limit, long windowSeconds) {
        return new ActionRule(limit, windowSeconds, FailurePolicy.FAIL_CLOSED);
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }
}
