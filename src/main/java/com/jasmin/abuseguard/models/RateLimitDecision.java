package com.jasmin.abuseguard.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a gated check. Denials are ordinary values: the caller branches on
 * {@link #isAllowed()} and shows {@link #getMessage()} with the retry hint.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitDecision {
    private boolean allowed;
    private DenialReason reason;
    private Long retryAfterSeconds;
    private Instant until;
    private Integer remaining;
    private BlockReason blockReason;
    private String message;

    public static RateLimitDecision allowed(int remaining) {
        return RateLimitDecision.builder()
                .allowed(true)
                .remaining(Math.max(0, remaining))
                .build();
    }

    public static RateLimitDecision rateLimited(long retryAfterSeconds) {
        return RateLimitDecision.builder()
                .allowed(false)
                .reason(DenialReason.RATE_LIMITED)
                .retryAfterSeconds(retryAfterSeconds)
                .remaining(0)
                .message(String.format("Rate limit exceeded. Please try again in %d seconds.", retryAfterSeconds))
                .build();
    }

    public static RateLimitDecision penalized(Instant until, Instant now) {
        long retryAfter = secondsUntil(until, now);
        return RateLimitDecision.builder()
                .allowed(false)
                .reason(DenialReason.PENALIZED)
                .until(until)
                .retryAfterSeconds(retryAfter)
                .remaining(0)
                .message(String.format("Too many violations. Temporarily restricted for %d seconds.", retryAfter))
                .build();
    }

    public static RateLimitDecision blocked(BlockRecord record, Instant now) {
        long retryAfter = secondsUntil(record.getBlockedUntil(), now);
        return RateLimitDecision.builder()
                .allowed(false)
                .reason(DenialReason.BLOCKED)
                .until(record.getBlockedUntil())
                .retryAfterSeconds(retryAfter)
                .blockReason(record.getReason())
                .remaining(0)
                .message(String.format("Access blocked (%s). Please try again in %d seconds.",
                        record.getReason().getId(), retryAfter))
                .build();
    }

    public static RateLimitDecision storageUnavailable(long retryAfterSeconds) {
        return RateLimitDecision.builder()
                .allowed(false)
                .reason(DenialReason.STORAGE_UNAVAILABLE)
                .retryAfterSeconds(retryAfterSeconds)
                .message("Rate limiter unavailable. Please try again shortly.")
                .build();
    }

    /** Whole seconds until {@code until}, rounded up, never below 1. */
    public static long secondsUntil(Instant until, Instant now) {
        long millis = Duration.between(now, until).toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
